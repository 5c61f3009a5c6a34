package com.rankcup.competition.service;

import com.rankcup.competition.model.Competition;
import com.rankcup.competition.model.CompetitionDates;
import com.rankcup.competition.model.CompetitionStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;

/**
 * Derives {@link CompetitionStatus} from stored data and a point in time. Pure apart from reading the
 * season calendar, and total: every stored competition maps to exactly one status.
 */
@Service
@RequiredArgsConstructor
public class CompetitionStatusResolver {

    private final SeasonCalendar seasonCalendar;

    public CompetitionStatus resolve(Competition competition, OffsetDateTime now) {
        if (competition.isCancelled()) {
            return CompetitionStatus.CANCELLED;
        }

        CompetitionDates dates = CompetitionDates.from(competition);
        if (dates instanceof CompetitionDates.FixedDates fixed) {
            return fromWindow(fixed.startDate(), fixed.endDate(), now);
        }
        CompetitionDates.Season season = (CompetitionDates.Season) dates;
        // A season missing from the calendar cannot have started as far as we know.
        return seasonCalendar.findSeason(season.seasonId())
                .map(definition -> fromWindow(definition.startDate(), definition.endDate(), now))
                .orElse(CompetitionStatus.DRAFT);
    }

    public boolean acceptsParticipants(Competition competition, OffsetDateTime now) {
        return resolve(competition, now).acceptsParticipants();
    }

    static CompetitionStatus fromWindow(OffsetDateTime start, OffsetDateTime end, OffsetDateTime now) {
        if (!now.isBefore(end)) {
            return CompetitionStatus.ENDED;
        }
        if (now.isBefore(start)) {
            return CompetitionStatus.DRAFT;
        }
        return CompetitionStatus.ACTIVE;
    }
}
