package com.rankcup.competition.service;

import com.rankcup.competition.config.CompetitionProperties;
import com.rankcup.competition.model.SeasonDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Season calendar backed by {@code rankcup.competition.seasons}. Entries are validated once at startup.
 */
@Service
public class ConfiguredSeasonCalendar implements SeasonCalendar {

    private static final Logger log = LoggerFactory.getLogger(ConfiguredSeasonCalendar.class);

    private final Map<String, SeasonDefinition> seasonsById;

    public ConfiguredSeasonCalendar(CompetitionProperties competitionProperties) {
        Map<String, SeasonDefinition> seasons = new LinkedHashMap<>();
        for (CompetitionProperties.Season season : competitionProperties.getSeasons()) {
            SeasonDefinition definition = toDefinition(season);
            if (seasons.putIfAbsent(definition.id(), definition) != null) {
                throw new IllegalStateException("Duplicate season id in configuration: " + definition.id());
            }
        }
        this.seasonsById = Map.copyOf(seasons);
        log.info("Loaded {} season(s) into the season calendar", seasonsById.size());
    }

    @Override
    public Optional<SeasonDefinition> findSeason(String seasonId) {
        if (seasonId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(seasonsById.get(seasonId));
    }

    @Override
    public List<SeasonDefinition> listSeasons() {
        return seasonsById.values().stream()
                .sorted(Comparator.comparing(SeasonDefinition::startDate).reversed())
                .toList();
    }

    private static SeasonDefinition toDefinition(CompetitionProperties.Season season) {
        if (season.getId() == null || season.getId().isBlank()) {
            throw new IllegalStateException("rankcup.competition.seasons[].id is required");
        }
        if (season.getStartDate() == null || season.getEndDate() == null) {
            throw new IllegalStateException("Season " + season.getId() + " requires start-date and end-date");
        }
        if (!season.getStartDate().isBefore(season.getEndDate())) {
            throw new IllegalStateException("Season " + season.getId() + " must start before it ends");
        }
        String displayName = season.getDisplayName() == null ? season.getId() : season.getDisplayName();
        return new SeasonDefinition(season.getId(), displayName, season.getStartDate(), season.getEndDate());
    }
}
