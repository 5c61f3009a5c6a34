package com.rankcup.competition.dto;

import com.rankcup.competition.model.CompetitionDateType;
import com.rankcup.competition.model.CompetitionQueueType;
import com.rankcup.competition.model.CompetitionStatus;
import com.rankcup.competition.model.CompetitionVisibility;
import com.rankcup.competition.model.CriteriaType;
import com.rankcup.competition.model.ParticipantStatus;
import com.rankcup.competition.model.PermissionType;

import java.time.OffsetDateTime;
import java.util.List;

public final class CompetitionResponses {

    private CompetitionResponses() {
    }

    public record CompetitionDetail(
            Long id,
            String serverId,
            String ownerId,
            String channelId,
            String title,
            String description,
            CompetitionVisibility visibility,
            Integer maxParticipants,
            CompetitionDateType dateType,
            OffsetDateTime startDate,
            OffsetDateTime endDate,
            String seasonId,
            CriteriaType criteriaType,
            CompetitionQueueType queue,
            Integer championId,
            Integer minGames,
            boolean cancelled,
            CompetitionStatus status,
            OffsetDateTime createdAt
    ) {
    }

    public record CompetitionStatusResponse(
            Long competitionId,
            CompetitionStatus status
    ) {
    }

    public record Participant(
            Long competitionId,
            Long playerId,
            ParticipantStatus status,
            String invitedBy,
            OffsetDateTime invitedAt,
            OffsetDateTime joinedAt,
            OffsetDateTime leftAt
    ) {
    }

    /**
     * {@code status} is {@code null} when the player has never been added.
     */
    public record ParticipantStatusResponse(
            Long competitionId,
            Long playerId,
            ParticipantStatus status
    ) {
    }

    public record JoinEligibility(
            Long competitionId,
            Long playerId,
            boolean canJoin,
            String reason
    ) {
    }

    public record EnrollmentFailure(
            Long playerId,
            String code
    ) {
    }

    public record BulkEnrollment(
            Long competitionId,
            int requested,
            int succeeded,
            int failed,
            List<EnrollmentFailure> failures
    ) {
    }

    public record CreationPermission(
            String serverId,
            String userId,
            boolean allowed,
            String reason,
            Long retryAfterSeconds
    ) {
    }

    public record PermissionGrant(
            String serverId,
            String userId,
            PermissionType permission,
            String grantedBy,
            OffsetDateTime grantedAt
    ) {
    }

    public record Season(
            String id,
            String displayName,
            OffsetDateTime startDate,
            OffsetDateTime endDate
    ) {
    }
}
