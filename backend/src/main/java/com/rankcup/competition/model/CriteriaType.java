package com.rankcup.competition.model;

public enum CriteriaType {
    MOST_GAMES_PLAYED,
    HIGHEST_RANK,
    MOST_RANK_CLIMB,
    MOST_WINS_PLAYER,
    MOST_WINS_CHAMPION,
    HIGHEST_WIN_RATE
}
