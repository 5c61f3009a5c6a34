package com.rankcup.competition.mapper;

import com.rankcup.competition.dto.CompetitionResponses;
import com.rankcup.competition.model.Competition;
import com.rankcup.competition.model.CompetitionCriteria;
import com.rankcup.competition.model.CompetitionCriteriaJsonCodec;
import com.rankcup.competition.model.CompetitionParticipant;
import com.rankcup.competition.model.CompetitionStatus;
import com.rankcup.competition.model.SeasonDefinition;
import com.rankcup.competition.model.ServerPermission;
import com.rankcup.competition.service.CompetitionEnrollmentService;
import com.rankcup.competition.service.CompetitionPermissionService;
import com.rankcup.competition.service.ParticipantService;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;

@Component
public class CompetitionResponseMapper {

    public CompetitionResponses.CompetitionDetail toCompetitionDetail(Competition competition, CompetitionStatus status) {
        CompetitionCriteria criteria = CompetitionCriteriaJsonCodec.fromCompetition(competition);
        Integer championId = criteria instanceof CompetitionCriteria.MostWinsChampion champion
                ? champion.championId()
                : null;
        Integer minGames = criteria instanceof CompetitionCriteria.HighestWinRate winRate
                ? winRate.minGames()
                : null;

        return new CompetitionResponses.CompetitionDetail(
                competition.getId(),
                competition.getServerId(),
                competition.getOwnerId(),
                competition.getChannelId(),
                competition.getTitle(),
                competition.getDescription(),
                competition.getVisibility(),
                competition.getMaxParticipants(),
                competition.getDateType(),
                competition.getStartDate(),
                competition.getEndDate(),
                competition.getSeasonId(),
                criteria.type(),
                criteria.queue(),
                championId,
                minGames,
                competition.isCancelled(),
                status,
                competition.getCreatedAt()
        );
    }

    public CompetitionResponses.Participant toParticipantResponse(CompetitionParticipant participant) {
        return new CompetitionResponses.Participant(
                participant.getCompetitionId(),
                participant.getPlayerId(),
                participant.getStatus(),
                participant.getInvitedBy(),
                participant.getInvitedAt(),
                participant.getJoinedAt(),
                participant.getLeftAt()
        );
    }

    public List<CompetitionResponses.Participant> toParticipantResponses(
            Collection<CompetitionParticipant> participants
    ) {
        return participants.stream()
                .map(this::toParticipantResponse)
                .toList();
    }

    public CompetitionResponses.JoinEligibility toJoinEligibilityResponse(
            Long competitionId,
            Long playerId,
            ParticipantService.JoinEligibility eligibility
    ) {
        return new CompetitionResponses.JoinEligibility(
                competitionId,
                playerId,
                eligibility.canJoin(),
                eligibility.reason() != null ? eligibility.reason().code() : null
        );
    }

    public CompetitionResponses.BulkEnrollment toBulkEnrollmentResponse(
            CompetitionEnrollmentService.BulkEnrollmentResult result
    ) {
        List<CompetitionResponses.EnrollmentFailure> failures = result.failures().stream()
                .map(failure -> new CompetitionResponses.EnrollmentFailure(failure.playerId(), failure.code().code()))
                .toList();
        return new CompetitionResponses.BulkEnrollment(
                result.competitionId(),
                result.requested(),
                result.succeeded(),
                result.failed(),
                failures
        );
    }

    public CompetitionResponses.CreationPermission toCreationPermissionResponse(
            String serverId,
            String userId,
            CompetitionPermissionService.CreationPermission permission
    ) {
        return new CompetitionResponses.CreationPermission(
                serverId,
                userId,
                permission.allowed(),
                permission.reason() != null ? permission.reason().code() : null,
                permission.retryAfter().isZero() ? null : permission.retryAfter().toSeconds()
        );
    }

    public CompetitionResponses.PermissionGrant toPermissionGrantResponse(ServerPermission grant) {
        return new CompetitionResponses.PermissionGrant(
                grant.getServerId(),
                grant.getUserId(),
                grant.getPermission(),
                grant.getGrantedBy(),
                grant.getGrantedAt()
        );
    }

    public List<CompetitionResponses.Season> toSeasonResponses(List<SeasonDefinition> seasons) {
        return seasons.stream()
                .map(season -> new CompetitionResponses.Season(
                        season.id(),
                        season.displayName(),
                        season.startDate(),
                        season.endDate()
                ))
                .toList();
    }
}
