package com.rankcup.competition.service;

import com.rankcup.competition.model.SeasonDefinition;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Externally maintained competitive seasons referenced by SEASON competitions.
 */
public interface SeasonCalendar {

    Optional<SeasonDefinition> findSeason(String seasonId);

    List<SeasonDefinition> listSeasons();

    /**
     * Unknown seasons are reported as not ended; callers that need existence check {@link #findSeason} first.
     */
    default boolean seasonHasEnded(String seasonId, OffsetDateTime now) {
        return findSeason(seasonId)
                .map(season -> season.hasEnded(now))
                .orElse(false);
    }
}
