package com.rankcup.competition.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Set;

/**
 * Converts criteria between the tagged union and the stored {@code criteria_type} + JSON config pair.
 * The type lives in its own column, so the config document only holds the rule parameters.
 */
public final class CompetitionCriteriaJsonCodec {

    private static final String FIELD_QUEUE = "queue";
    private static final String FIELD_CHAMPION_ID = "championId";
    private static final String FIELD_MIN_GAMES = "minGames";

    private static final Set<String> ALLOWED_FIELDS = Set.of(
            FIELD_QUEUE,
            FIELD_CHAMPION_ID,
            FIELD_MIN_GAMES
    );

    private CompetitionCriteriaJsonCodec() {
    }

    public static ObjectNode toConfig(CompetitionCriteria criteria) {
        if (criteria == null) {
            throw new IllegalArgumentException("Criteria is required");
        }

        ObjectNode config = JsonNodeFactory.instance.objectNode();
        if (criteria.queue() != null) {
            config.put(FIELD_QUEUE, criteria.queue().name());
        }
        if (criteria instanceof CompetitionCriteria.MostWinsChampion champion) {
            config.put(FIELD_CHAMPION_ID, champion.championId());
        }
        if (criteria instanceof CompetitionCriteria.HighestWinRate winRate) {
            config.put(FIELD_MIN_GAMES, winRate.minGames());
        }
        return config;
    }

    public static CompetitionCriteria fromConfig(CriteriaType type, JsonNode config) {
        if (type == null) {
            throw new IllegalArgumentException("Stored criteria type is missing");
        }
        if (config == null || config.isNull() || !config.isObject()) {
            throw new IllegalArgumentException("Criteria config must be a JSON object");
        }

        rejectUnexpectedFields(config);

        return CompetitionCriteria.of(
                type,
                optionalQueue(config),
                optionalInt(config, FIELD_CHAMPION_ID),
                optionalInt(config, FIELD_MIN_GAMES)
        );
    }

    public static CompetitionCriteria fromCompetition(Competition competition) {
        try {
            return fromConfig(competition.getCriteriaType(), competition.getCriteriaConfig());
        } catch (IllegalArgumentException ex) {
            throw new IllegalStateException(
                    "Stored criteria for competition " + competition.getId() + " is invalid: " + ex.getMessage(),
                    ex
            );
        }
    }

    private static CompetitionQueueType optionalQueue(JsonNode config) {
        JsonNode queueNode = config.get(FIELD_QUEUE);
        if (queueNode == null || queueNode.isNull()) {
            return null;
        }
        if (!queueNode.isTextual()) {
            throw new IllegalArgumentException("Criteria field 'queue' must be textual");
        }
        try {
            return CompetitionQueueType.valueOf(queueNode.textValue());
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown queue type '" + queueNode.textValue() + "'", ex);
        }
    }

    private static Integer optionalInt(JsonNode config, String fieldName) {
        JsonNode valueNode = config.get(fieldName);
        if (valueNode == null || valueNode.isNull()) {
            return null;
        }
        if (!valueNode.isIntegralNumber()) {
            throw new IllegalArgumentException("Criteria field '" + fieldName + "' must be an integer");
        }
        return valueNode.intValue();
    }

    private static void rejectUnexpectedFields(JsonNode config) {
        var fieldIterator = config.fieldNames();
        while (fieldIterator.hasNext()) {
            String fieldName = fieldIterator.next();
            if (!ALLOWED_FIELDS.contains(fieldName)) {
                throw new IllegalArgumentException("Unexpected field '" + fieldName + "' in criteria config");
            }
        }
    }
}
