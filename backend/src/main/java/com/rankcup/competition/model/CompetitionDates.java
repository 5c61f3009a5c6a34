package com.rankcup.competition.model;

import java.time.OffsetDateTime;

/**
 * When a competition runs: either an explicit window or a named season whose window comes from the calendar.
 * Instances are only created through {@link #of}, which enforces that exactly one variant's fields are present.
 */
public sealed interface CompetitionDates {

    CompetitionDateType type();

    static CompetitionDates of(
            CompetitionDateType type,
            OffsetDateTime startDate,
            OffsetDateTime endDate,
            String seasonId
    ) {
        if (type == null) {
            throw new IllegalArgumentException("dateType is required");
        }
        return switch (type) {
            case FIXED_DATES -> {
                if (seasonId != null) {
                    throw new IllegalArgumentException("seasonId must not be set for FIXED_DATES competitions");
                }
                yield new FixedDates(startDate, endDate);
            }
            case SEASON -> {
                if (startDate != null || endDate != null) {
                    throw new IllegalArgumentException("startDate/endDate must not be set for SEASON competitions");
                }
                yield new Season(seasonId);
            }
        };
    }

    static CompetitionDates from(Competition competition) {
        return of(
                competition.getDateType(),
                competition.getStartDate(),
                competition.getEndDate(),
                competition.getSeasonId()
        );
    }

    record FixedDates(OffsetDateTime startDate, OffsetDateTime endDate) implements CompetitionDates {
        public FixedDates {
            if (startDate == null || endDate == null) {
                throw new IllegalArgumentException("startDate and endDate are required for FIXED_DATES competitions");
            }
            if (!startDate.isBefore(endDate)) {
                throw new IllegalArgumentException("startDate must be before endDate");
            }
        }

        @Override
        public CompetitionDateType type() {
            return CompetitionDateType.FIXED_DATES;
        }
    }

    record Season(String seasonId) implements CompetitionDates {
        public Season {
            if (seasonId == null || seasonId.isBlank()) {
                throw new IllegalArgumentException("seasonId is required for SEASON competitions");
            }
        }

        @Override
        public CompetitionDateType type() {
            return CompetitionDateType.SEASON;
        }
    }
}
