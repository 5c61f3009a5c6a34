package com.rankcup.competition.model;

public enum ParticipantStatus {
    INVITED,
    JOINED,
    LEFT
}
