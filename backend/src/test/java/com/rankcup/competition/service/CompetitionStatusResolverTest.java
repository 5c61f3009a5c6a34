package com.rankcup.competition.service;

import com.rankcup.competition.model.Competition;
import com.rankcup.competition.model.CompetitionDateType;
import com.rankcup.competition.model.CompetitionStatus;
import com.rankcup.competition.model.SeasonDefinition;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.OffsetDateTime;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CompetitionStatusResolverTest {

    private static final OffsetDateTime T1 = OffsetDateTime.parse("2026-11-01T00:00:00Z");
    private static final OffsetDateTime T2 = OffsetDateTime.parse("2026-11-15T00:00:00Z");

    @Mock
    private SeasonCalendar seasonCalendar;

    @InjectMocks
    private CompetitionStatusResolver competitionStatusResolver;

    @Test
    void fixedDatesFollowTheHalfOpenWindow() {
        Competition competition = fixedDates(T1, T2);

        assertEquals(CompetitionStatus.DRAFT, competitionStatusResolver.resolve(competition, T1.minusSeconds(1)));
        assertEquals(CompetitionStatus.ACTIVE, competitionStatusResolver.resolve(competition, T1));
        assertEquals(CompetitionStatus.ACTIVE, competitionStatusResolver.resolve(competition, T2.minusNanos(1)));
        assertEquals(CompetitionStatus.ENDED, competitionStatusResolver.resolve(competition, T2));
        assertEquals(CompetitionStatus.ENDED, competitionStatusResolver.resolve(competition, T2.plusDays(30)));
        verifyNoInteractions(seasonCalendar);
    }

    @Test
    void cancellationOverridesEveryWindowPosition() {
        Competition competition = fixedDates(T1, T2);
        competition.setCancelled(true);

        assertEquals(CompetitionStatus.CANCELLED, competitionStatusResolver.resolve(competition, T1.minusDays(1)));
        assertEquals(CompetitionStatus.CANCELLED, competitionStatusResolver.resolve(competition, T1.plusDays(1)));
        assertEquals(CompetitionStatus.CANCELLED, competitionStatusResolver.resolve(competition, T2.plusDays(1)));
        assertFalse(competitionStatusResolver.acceptsParticipants(competition, T1.plusDays(1)));
    }

    @Test
    void seasonWindowComesFromTheCalendar() {
        when(seasonCalendar.findSeason("2026_SEASON_2_ACT_1")).thenReturn(Optional.of(
                new SeasonDefinition("2026_SEASON_2_ACT_1", "Act 1", T1, T2)
        ));
        Competition competition = season("2026_SEASON_2_ACT_1");

        assertEquals(CompetitionStatus.DRAFT, competitionStatusResolver.resolve(competition, T1.minusHours(1)));
        assertEquals(CompetitionStatus.ACTIVE, competitionStatusResolver.resolve(competition, T1.plusHours(1)));
        assertEquals(CompetitionStatus.ENDED, competitionStatusResolver.resolve(competition, T2));
    }

    @Test
    void unknownSeasonResolvesToDraft() {
        when(seasonCalendar.findSeason("missing")).thenReturn(Optional.empty());

        Competition competition = season("missing");

        assertEquals(CompetitionStatus.DRAFT, competitionStatusResolver.resolve(competition, T1));
        assertTrue(competitionStatusResolver.acceptsParticipants(competition, T1));
    }

    private static Competition fixedDates(OffsetDateTime start, OffsetDateTime end) {
        Competition competition = new Competition();
        competition.setId(1L);
        competition.setDateType(CompetitionDateType.FIXED_DATES);
        competition.setStartDate(start);
        competition.setEndDate(end);
        return competition;
    }

    private static Competition season(String seasonId) {
        Competition competition = new Competition();
        competition.setId(2L);
        competition.setDateType(CompetitionDateType.SEASON);
        competition.setSeasonId(seasonId);
        return competition;
    }
}
