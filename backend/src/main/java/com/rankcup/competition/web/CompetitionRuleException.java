package com.rankcup.competition.web;

import lombok.Getter;

import java.time.Duration;

/**
 * A business rule rejected the operation. Not retryable without re-reading state.
 */
@Getter
public class CompetitionRuleException extends RuntimeException {

    private final CompetitionErrorCode errorCode;

    /**
     * How long until a retry can succeed; zero when retrying alone will not help.
     */
    private final Duration retryAfter;

    public CompetitionRuleException(CompetitionErrorCode errorCode, String message) {
        this(errorCode, message, Duration.ZERO);
    }

    public CompetitionRuleException(CompetitionErrorCode errorCode, String message, Duration retryAfter) {
        super(message);
        this.errorCode = errorCode;
        this.retryAfter = retryAfter == null ? Duration.ZERO : retryAfter;
    }

    public static CompetitionRuleException competitionNotFound(Long competitionId) {
        return new CompetitionRuleException(
                CompetitionErrorCode.COMPETITION_NOT_FOUND,
                "Competition not found: " + competitionId
        );
    }

    public static CompetitionRuleException ownerLimitReached(long activeCount, int limit) {
        return new CompetitionRuleException(
                CompetitionErrorCode.OWNER_LIMIT_REACHED,
                "Owner already has " + activeCount + " active competition(s); limit is " + limit
        );
    }

    public static CompetitionRuleException serverLimitReached(long activeCount, int limit) {
        return new CompetitionRuleException(
                CompetitionErrorCode.SERVER_LIMIT_REACHED,
                "Server already has " + activeCount + " active competition(s); limit is " + limit
        );
    }

    public static CompetitionRuleException inactiveCompetition(Long competitionId) {
        return new CompetitionRuleException(
                CompetitionErrorCode.INACTIVE_COMPETITION,
                "Competition is cancelled or has ended: " + competitionId
        );
    }

    public static CompetitionRuleException alreadyParticipant(Long competitionId, Long playerId) {
        return new CompetitionRuleException(
                CompetitionErrorCode.ALREADY_PARTICIPANT,
                "Player " + playerId + " is already a participant in competition " + competitionId
        );
    }

    public static CompetitionRuleException cannotRejoin(Long competitionId, Long playerId) {
        return new CompetitionRuleException(
                CompetitionErrorCode.CANNOT_REJOIN,
                "Player " + playerId + " left competition " + competitionId + " and cannot rejoin"
        );
    }

    public static CompetitionRuleException maximumParticipantsReached(Long competitionId, int maxParticipants) {
        return new CompetitionRuleException(
                CompetitionErrorCode.MAXIMUM_PARTICIPANTS_REACHED,
                "Competition " + competitionId + " has reached maximum participants (" + maxParticipants + ")"
        );
    }

    public static CompetitionRuleException inviteRequired(Long competitionId) {
        return new CompetitionRuleException(
                CompetitionErrorCode.INVITE_REQUIRED,
                "Competition " + competitionId + " is invite-only"
        );
    }

    public static CompetitionRuleException notCompetitionOwner(Long competitionId) {
        return new CompetitionRuleException(
                CompetitionErrorCode.NOT_COMPETITION_OWNER,
                "Only the owner of competition " + competitionId + " may do this"
        );
    }

    public static CompetitionRuleException participantNotFound(Long competitionId, Long playerId) {
        return new CompetitionRuleException(
                CompetitionErrorCode.PARTICIPANT_NOT_FOUND,
                "Participant not found: competitionId=" + competitionId + ", playerId=" + playerId
        );
    }

    public static CompetitionRuleException alreadyLeft(Long competitionId, Long playerId) {
        return new CompetitionRuleException(
                CompetitionErrorCode.ALREADY_LEFT,
                "Player " + playerId + " has already left competition " + competitionId
        );
    }

    public static CompetitionRuleException administratorRequired(Long competitionId) {
        return new CompetitionRuleException(
                CompetitionErrorCode.ADMINISTRATOR_REQUIRED,
                "Bulk enrollment into competition " + competitionId + " requires a server administrator"
        );
    }

    public static CompetitionRuleException missingCreatePermission(String serverId, String userId) {
        return new CompetitionRuleException(
                CompetitionErrorCode.MISSING_CREATE_PERMISSION,
                "User " + userId + " may not create competitions on server " + serverId
        );
    }

    public static CompetitionRuleException creationRateLimited(String serverId, String userId, Duration retryAfter) {
        return new CompetitionRuleException(
                CompetitionErrorCode.CREATION_RATE_LIMITED,
                "User " + userId + " created a competition on server " + serverId + " recently; retry in "
                        + retryAfter.toSeconds() + "s",
                retryAfter
        );
    }
}
