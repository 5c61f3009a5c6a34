package com.rankcup.competition.service;

import com.rankcup.competition.model.PermissionType;
import com.rankcup.competition.model.ServerPermission;
import com.rankcup.competition.repository.ServerPermissionRepository;
import com.rankcup.competition.web.CompetitionErrorCode;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * Per-server grants plus the creation policy built on them and on the creation rate limiter.
 */
@Service
@RequiredArgsConstructor
public class CompetitionPermissionService {

    private static final Logger log = LoggerFactory.getLogger(CompetitionPermissionService.class);

    private final ServerPermissionRepository serverPermissionRepository;
    private final CompetitionCreationRateLimiter competitionCreationRateLimiter;
    private final Clock clock;

    @Transactional(readOnly = true)
    public boolean hasPermission(String serverId, String userId, PermissionType permission) {
        return serverPermissionRepository.existsByServerIdAndUserIdAndPermission(serverId, userId, permission);
    }

    /**
     * Idempotent: granting an existing permission returns the original grant unchanged.
     */
    @Transactional
    public ServerPermission grantPermission(String serverId, String userId, PermissionType permission, String grantedBy) {
        return serverPermissionRepository.findByServerIdAndUserIdAndPermission(serverId, userId, permission)
                .orElseGet(() -> {
                    ServerPermission grant = new ServerPermission();
                    grant.setServerId(serverId);
                    grant.setUserId(userId);
                    grant.setPermission(permission);
                    grant.setGrantedBy(grantedBy);
                    grant.setGrantedAt(OffsetDateTime.now(clock));
                    ServerPermission saved = serverPermissionRepository.save(grant);
                    log.info("Granted {} on server {} to {} by {}", permission, serverId, userId, grantedBy);
                    return saved;
                });
    }

    /**
     * @return {@code true} if a grant was removed
     */
    @Transactional
    public boolean revokePermission(String serverId, String userId, PermissionType permission) {
        int removed = serverPermissionRepository.deleteGrant(serverId, userId, permission);
        if (removed > 0) {
            log.info("Revoked {} on server {} from {}", permission, serverId, userId);
        }
        return removed > 0;
    }

    /**
     * Administrators may always create. Everyone else needs the CREATE_COMPETITION grant and an open
     * rate-limit window.
     */
    @Transactional(readOnly = true)
    public CreationPermission canCreateCompetition(String serverId, String userId, boolean administrator) {
        if (administrator) {
            return CreationPermission.granted();
        }
        if (!hasPermission(serverId, userId, PermissionType.CREATE_COMPETITION)) {
            return new CreationPermission(false, CompetitionErrorCode.MISSING_CREATE_PERMISSION, Duration.ZERO);
        }
        Duration remaining = competitionCreationRateLimiter.getTimeRemaining(serverId, userId);
        if (!remaining.isZero()) {
            return new CreationPermission(false, CompetitionErrorCode.CREATION_RATE_LIMITED, remaining);
        }
        return CreationPermission.granted();
    }

    public record CreationPermission(boolean allowed, CompetitionErrorCode reason, Duration retryAfter) {

        static CreationPermission granted() {
            return new CreationPermission(true, null, Duration.ZERO);
        }
    }
}
