package com.rankcup.competition.dto;

import com.rankcup.competition.model.CompetitionDateType;
import com.rankcup.competition.model.CompetitionQueueType;
import com.rankcup.competition.model.CompetitionVisibility;
import com.rankcup.competition.model.CriteriaType;
import com.rankcup.competition.model.PermissionType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.OffsetDateTime;
import java.util.List;

public final class CompetitionRequests {

    private CompetitionRequests() {
    }

    /**
     * Flat creation input. Range checks that depend on configuration (participant bounds, duration cap,
     * season calendar) happen in the service, which also builds the dates and criteria unions.
     * {@code administrator} reports whether the owner is a server administrator, who skips the
     * create-permission grant and the creation rate limit.
     */
    public record CreateCompetitionRequest(
            @NotBlank(message = "serverId is required")
            @Size(max = 64, message = "serverId must be at most 64 characters")
            String serverId,

            @NotBlank(message = "ownerId is required")
            @Size(max = 64, message = "ownerId must be at most 64 characters")
            String ownerId,

            @NotBlank(message = "channelId is required")
            @Size(max = 64, message = "channelId must be at most 64 characters")
            String channelId,

            @NotBlank(message = "title is required")
            @Size(max = 100, message = "title must be at most 100 characters")
            String title,

            @NotBlank(message = "description is required")
            @Size(max = 500, message = "description must be at most 500 characters")
            String description,

            CompetitionVisibility visibility,

            Integer maxParticipants,

            @NotNull(message = "dateType is required")
            CompetitionDateType dateType,

            OffsetDateTime startDate,

            OffsetDateTime endDate,

            String seasonId,

            @NotNull(message = "criteriaType is required")
            CriteriaType criteriaType,

            CompetitionQueueType queue,

            Integer championId,

            Integer minGames,

            boolean administrator
    ) {
    }

    public record CancelCompetitionRequest(
            @NotBlank(message = "requesterId is required")
            String requesterId,

            boolean administrator
    ) {
    }

    public record JoinCompetitionRequest(
            @NotNull(message = "playerId is required")
            Long playerId
    ) {
    }

    public record InviteParticipantRequest(
            @NotBlank(message = "requesterId is required")
            String requesterId,

            @NotNull(message = "playerId is required")
            Long playerId
    ) {
    }

    public record BulkEnrollRequest(
            @NotBlank(message = "requesterId is required")
            String requesterId,

            boolean administrator,

            @NotEmpty(message = "playerIds must not be empty")
            @Size(max = 500, message = "playerIds supports at most 500 players per request")
            List<@NotNull(message = "playerIds must not contain null") Long> playerIds
    ) {
    }

    public record GrantPermissionRequest(
            @NotBlank(message = "userId is required")
            String userId,

            @NotNull(message = "permission is required")
            PermissionType permission,

            @NotBlank(message = "grantedBy is required")
            String grantedBy
    ) {
    }
}
