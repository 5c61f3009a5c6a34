package com.rankcup.competition.model;

public enum CompetitionVisibility {
    OPEN,
    INVITE_ONLY,
    SERVER_WIDE
}
