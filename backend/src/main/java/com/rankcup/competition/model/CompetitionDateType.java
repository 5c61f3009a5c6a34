package com.rankcup.competition.model;

public enum CompetitionDateType {
    FIXED_DATES,
    SEASON
}
