package com.rankcup.competition.model;

public enum CompetitionQueueType {
    SOLO,
    FLEX,
    RANKED_ANY,
    ARENA,
    ARAM,
    URF,
    ARURF,
    QUICKPLAY,
    SWIFTPLAY,
    BRAWL,
    DRAFT_PICK,
    CUSTOM,
    ALL;

    /**
     * Rank-based criteria only make sense for the two ranked ladders.
     */
    public boolean isRankedLadder() {
        return this == SOLO || this == FLEX;
    }
}
