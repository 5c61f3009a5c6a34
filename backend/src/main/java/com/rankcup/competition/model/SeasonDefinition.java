package com.rankcup.competition.model;

import java.time.OffsetDateTime;

public record SeasonDefinition(
        String id,
        String displayName,
        OffsetDateTime startDate,
        OffsetDateTime endDate
) {
    public boolean hasEnded(OffsetDateTime now) {
        return !now.isBefore(endDate);
    }
}
