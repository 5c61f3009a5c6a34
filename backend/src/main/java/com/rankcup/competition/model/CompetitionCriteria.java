package com.rankcup.competition.model;

/**
 * Scoring rule of a competition. Each variant carries only the parameters its rule needs and
 * checks them on construction; {@link #of} is the single entry point from flat input.
 */
public sealed interface CompetitionCriteria {

    int DEFAULT_MIN_GAMES = 10;

    CriteriaType type();

    /**
     * Queue the rule is evaluated on; {@code null} only for a champion rule that spans all queues.
     */
    CompetitionQueueType queue();

    static CompetitionCriteria of(
            CriteriaType type,
            CompetitionQueueType queue,
            Integer championId,
            Integer minGames
    ) {
        if (type == null) {
            throw new IllegalArgumentException("criteriaType is required");
        }
        return switch (type) {
            case MOST_GAMES_PLAYED -> new MostGamesPlayed(queue);
            case HIGHEST_RANK -> new HighestRank(queue);
            case MOST_RANK_CLIMB -> new MostRankClimb(queue);
            case MOST_WINS_PLAYER -> new MostWinsPlayer(queue);
            case MOST_WINS_CHAMPION -> {
                if (championId == null) {
                    throw new IllegalArgumentException("championId is required for MOST_WINS_CHAMPION");
                }
                yield new MostWinsChampion(championId, queue);
            }
            case HIGHEST_WIN_RATE -> new HighestWinRate(minGames == null ? DEFAULT_MIN_GAMES : minGames, queue);
        };
    }

    record MostGamesPlayed(CompetitionQueueType queue) implements CompetitionCriteria {
        public MostGamesPlayed {
            requireQueue(queue, CriteriaType.MOST_GAMES_PLAYED);
        }

        @Override
        public CriteriaType type() {
            return CriteriaType.MOST_GAMES_PLAYED;
        }
    }

    record HighestRank(CompetitionQueueType queue) implements CompetitionCriteria {
        public HighestRank {
            requireRankedLadder(queue, CriteriaType.HIGHEST_RANK);
        }

        @Override
        public CriteriaType type() {
            return CriteriaType.HIGHEST_RANK;
        }
    }

    record MostRankClimb(CompetitionQueueType queue) implements CompetitionCriteria {
        public MostRankClimb {
            requireRankedLadder(queue, CriteriaType.MOST_RANK_CLIMB);
        }

        @Override
        public CriteriaType type() {
            return CriteriaType.MOST_RANK_CLIMB;
        }
    }

    record MostWinsPlayer(CompetitionQueueType queue) implements CompetitionCriteria {
        public MostWinsPlayer {
            requireQueue(queue, CriteriaType.MOST_WINS_PLAYER);
        }

        @Override
        public CriteriaType type() {
            return CriteriaType.MOST_WINS_PLAYER;
        }
    }

    record MostWinsChampion(int championId, CompetitionQueueType queue) implements CompetitionCriteria {
        public MostWinsChampion {
            if (championId <= 0) {
                throw new IllegalArgumentException("championId must be positive");
            }
        }

        @Override
        public CriteriaType type() {
            return CriteriaType.MOST_WINS_CHAMPION;
        }
    }

    record HighestWinRate(int minGames, CompetitionQueueType queue) implements CompetitionCriteria {
        public HighestWinRate {
            if (minGames <= 0) {
                throw new IllegalArgumentException("minGames must be positive");
            }
            requireQueue(queue, CriteriaType.HIGHEST_WIN_RATE);
        }

        @Override
        public CriteriaType type() {
            return CriteriaType.HIGHEST_WIN_RATE;
        }
    }

    private static void requireQueue(CompetitionQueueType queue, CriteriaType type) {
        if (queue == null) {
            throw new IllegalArgumentException("queue is required for " + type);
        }
    }

    private static void requireRankedLadder(CompetitionQueueType queue, CriteriaType type) {
        requireQueue(queue, type);
        if (!queue.isRankedLadder()) {
            throw new IllegalArgumentException(type + " only supports SOLO or FLEX queues");
        }
    }
}
