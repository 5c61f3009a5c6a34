package com.rankcup.competition.model;

/**
 * Derived lifecycle state. Never stored; computed from dates, season calendar and the cancellation flag.
 */
public enum CompetitionStatus {
    DRAFT,
    ACTIVE,
    ENDED,
    CANCELLED;

    public boolean acceptsParticipants() {
        return switch (this) {
            case DRAFT, ACTIVE -> true;
            case ENDED, CANCELLED -> false;
        };
    }
}
