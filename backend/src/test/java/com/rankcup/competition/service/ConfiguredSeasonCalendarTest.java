package com.rankcup.competition.service;

import com.rankcup.competition.config.CompetitionProperties;
import com.rankcup.competition.model.SeasonDefinition;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfiguredSeasonCalendarTest {

    private static final OffsetDateTime ACT_1_START = OffsetDateTime.parse("2026-01-09T00:00:00-08:00");
    private static final OffsetDateTime ACT_1_END = OffsetDateTime.parse("2026-03-04T23:59:59-08:00");
    private static final OffsetDateTime ACT_2_START = OffsetDateTime.parse("2026-03-05T00:00:00-08:00");
    private static final OffsetDateTime ACT_2_END = OffsetDateTime.parse("2026-04-30T23:59:59-07:00");

    @Test
    void findsConfiguredSeasonsAndListsNewestFirst() {
        ConfiguredSeasonCalendar calendar = new ConfiguredSeasonCalendar(properties(
                season("2026_SEASON_1_ACT_1", "For Demacia (Act 1)", ACT_1_START, ACT_1_END),
                season("2026_SEASON_1_ACT_2", null, ACT_2_START, ACT_2_END)
        ));

        SeasonDefinition act1 = calendar.findSeason("2026_SEASON_1_ACT_1").orElseThrow();
        assertEquals("For Demacia (Act 1)", act1.displayName());
        assertEquals("2026_SEASON_1_ACT_2", calendar.findSeason("2026_SEASON_1_ACT_2").orElseThrow().displayName());
        assertTrue(calendar.findSeason("unknown").isEmpty());
        assertTrue(calendar.findSeason(null).isEmpty());

        List<SeasonDefinition> seasons = calendar.listSeasons();
        assertEquals(List.of("2026_SEASON_1_ACT_2", "2026_SEASON_1_ACT_1"),
                seasons.stream().map(SeasonDefinition::id).toList());
    }

    @Test
    void seasonHasEndedAtItsEndInstant() {
        ConfiguredSeasonCalendar calendar = new ConfiguredSeasonCalendar(properties(
                season("2026_SEASON_1_ACT_1", "Act 1", ACT_1_START, ACT_1_END)
        ));

        assertFalse(calendar.seasonHasEnded("2026_SEASON_1_ACT_1", ACT_1_END.minusSeconds(1)));
        assertTrue(calendar.seasonHasEnded("2026_SEASON_1_ACT_1", ACT_1_END));
        assertFalse(calendar.seasonHasEnded("unknown", ACT_1_END));
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThrows(IllegalStateException.class, () -> new ConfiguredSeasonCalendar(properties(
                season("dup", "a", ACT_1_START, ACT_1_END),
                season("dup", "b", ACT_2_START, ACT_2_END)
        )));
        assertThrows(IllegalStateException.class, () -> new ConfiguredSeasonCalendar(properties(
                season("backwards", "x", ACT_1_END, ACT_1_START)
        )));
        assertThrows(IllegalStateException.class, () -> new ConfiguredSeasonCalendar(properties(
                season(" ", "x", ACT_1_START, ACT_1_END)
        )));
    }

    private static CompetitionProperties properties(CompetitionProperties.Season... seasons) {
        CompetitionProperties properties = new CompetitionProperties();
        properties.setSeasons(List.of(seasons));
        return properties;
    }

    private static CompetitionProperties.Season season(
            String id,
            String displayName,
            OffsetDateTime start,
            OffsetDateTime end
    ) {
        CompetitionProperties.Season season = new CompetitionProperties.Season();
        season.setId(id);
        season.setDisplayName(displayName);
        season.setStartDate(start);
        season.setEndDate(end);
        return season;
    }
}
