package com.rankcup.competition.service;

import com.rankcup.competition.config.CompetitionProperties;
import com.rankcup.competition.model.Competition;
import com.rankcup.competition.repository.CompetitionRepository;
import com.rankcup.competition.web.CompetitionRuleException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Caps how many competitions may be running at once per owner and per server.
 * <p>
 * The check is a plain read before the insert, so two racing creations can both pass and leave the
 * cap exceeded by one. Participant capacity, by contrast, is enforced under a row lock.
 */
@Service
@RequiredArgsConstructor
public class CompetitionLimitValidator {

    private static final Logger log = LoggerFactory.getLogger(CompetitionLimitValidator.class);

    private final CompetitionRepository competitionRepository;
    private final CompetitionStatusResolver competitionStatusResolver;
    private final PrivilegedOwnerPolicy privilegedOwnerPolicy;
    private final CompetitionProperties competitionProperties;
    private final Clock clock;

    @Transactional(readOnly = true)
    public void validateOwnerLimit(String serverId, String ownerId) {
        if (privilegedOwnerPolicy.isPrivilegedOwner(ownerId)) {
            log.debug("Owner {} is privileged; skipping owner limit on server {}", ownerId, serverId);
            return;
        }

        int limit = competitionProperties.getOwnerLimit();
        OffsetDateTime now = OffsetDateTime.now(clock);
        long active = countActive(competitionRepository.findOpenByServerIdAndOwnerId(serverId, ownerId, now), now);
        if (active >= limit) {
            log.warn("Rejected competition creation: owner_limit_reached serverId={} ownerId={} active={}",
                    serverId, ownerId, active);
            throw CompetitionRuleException.ownerLimitReached(active, limit);
        }
    }

    @Transactional(readOnly = true)
    public void validateServerLimit(String serverId, String ownerId) {
        if (privilegedOwnerPolicy.isPrivilegedOwner(ownerId)) {
            log.debug("Owner {} is privileged; skipping server limit on server {}", ownerId, serverId);
            return;
        }

        int limit = competitionProperties.getServerLimit();
        OffsetDateTime now = OffsetDateTime.now(clock);
        long active = countActive(competitionRepository.findOpenByServerId(serverId, now), now);
        if (active >= limit) {
            log.warn("Rejected competition creation: server_limit_reached serverId={} ownerId={} active={}",
                    serverId, ownerId, active);
            throw CompetitionRuleException.serverLimitReached(active, limit);
        }
    }

    private long countActive(List<Competition> candidates, OffsetDateTime now) {
        return candidates.stream()
                .filter(competition -> competitionStatusResolver.acceptsParticipants(competition, now))
                .count();
    }
}
