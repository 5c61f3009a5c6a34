package com.rankcup.competition.service;

import com.rankcup.competition.config.CompetitionProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Process-local record of the last competition each (server, user) created. Lost on restart.
 * <p>
 * This component never blocks a creation on its own; callers decide what to do with
 * {@link #checkRateLimit} and {@link #getTimeRemaining}.
 */
@Service
public class CompetitionCreationRateLimiter {

    private final Clock clock;
    private final Duration window;
    private final Map<CreatorKey, Instant> lastCreationByCreator = new HashMap<>();
    private final Object monitor = new Object();

    public CompetitionCreationRateLimiter(Clock clock, CompetitionProperties competitionProperties) {
        this.clock = clock;
        this.window = competitionProperties.getCreationRateLimit();
    }

    public void recordCreation(String serverId, String userId) {
        Instant now = clock.instant();
        synchronized (monitor) {
            lastCreationByCreator.put(new CreatorKey(serverId, userId), now);
        }
    }

    /**
     * @return {@code true} when the user may create another competition on the server now
     */
    public boolean checkRateLimit(String serverId, String userId) {
        return getTimeRemaining(serverId, userId).isZero();
    }

    /**
     * Time until the window opens again, {@link Duration#ZERO} when already open.
     */
    public Duration getTimeRemaining(String serverId, String userId) {
        Instant lastCreation;
        synchronized (monitor) {
            lastCreation = lastCreationByCreator.get(new CreatorKey(serverId, userId));
        }
        if (lastCreation == null) {
            return Duration.ZERO;
        }
        Duration remaining = Duration.between(clock.instant(), lastCreation.plus(window));
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public void clearRateLimit(String serverId, String userId) {
        synchronized (monitor) {
            lastCreationByCreator.remove(new CreatorKey(serverId, userId));
        }
    }

    public void clearAllRateLimits() {
        synchronized (monitor) {
            lastCreationByCreator.clear();
        }
    }

    private record CreatorKey(String serverId, String userId) {
    }
}
