package com.rankcup.competition.service;

import com.rankcup.competition.model.Competition;
import com.rankcup.competition.model.CompetitionParticipant;
import com.rankcup.competition.model.ParticipantStatus;
import com.rankcup.competition.web.CompetitionErrorCode;
import com.rankcup.competition.web.CompetitionRuleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

import static com.rankcup.competition.config.BulkEnrollmentConfig.BULK_ENROLLMENT_EXECUTOR;

/**
 * Visibility and invitation gate in front of {@link ParticipantService}: self-joins, owner invitations
 * and privileged bulk enrollment.
 */
@Service
public class CompetitionEnrollmentService {

    private static final Logger log = LoggerFactory.getLogger(CompetitionEnrollmentService.class);

    private final CompetitionService competitionService;
    private final ParticipantService participantService;
    private final Executor bulkEnrollmentExecutor;

    public CompetitionEnrollmentService(
            CompetitionService competitionService,
            ParticipantService participantService,
            @Qualifier(BULK_ENROLLMENT_EXECUTOR) Executor bulkEnrollmentExecutor
    ) {
        this.competitionService = competitionService;
        this.participantService = participantService;
        this.bulkEnrollmentExecutor = bulkEnrollmentExecutor;
    }

    /**
     * A pending invitation is accepted; otherwise the player self-joins, which INVITE_ONLY competitions refuse.
     */
    public CompetitionParticipant joinCompetition(Long competitionId, Long playerId) {
        Optional<ParticipantStatus> current = participantService.getParticipantStatus(competitionId, playerId);
        if (current.isPresent() && current.get() == ParticipantStatus.INVITED) {
            return participantService.acceptInvitation(competitionId, playerId);
        }
        return participantService.addParticipant(ParticipantService.AddParticipantCommand.join(competitionId, playerId));
    }

    public CompetitionParticipant inviteParticipant(Long competitionId, String requesterId, Long playerId) {
        Competition competition = competitionService.requireCompetition(competitionId);
        if (!competition.getOwnerId().equals(requesterId)) {
            log.warn("Rejected invitation: not_competition_owner competitionId={} requesterId={} playerId={}",
                    competitionId, requesterId, playerId);
            throw CompetitionRuleException.notCompetitionOwner(competitionId);
        }
        return participantService.addParticipant(
                ParticipantService.AddParticipantCommand.invite(competitionId, playerId, requesterId)
        );
    }

    /**
     * Adds every player as JOINED, each in its own transaction, concurrently on the bulk enrollment pool.
     * Only server administrators may bulk enroll; their adds skip the invite-only gate on any visibility.
     * A failing player is recorded and does not stop the others. Duplicate ids are enrolled once.
     */
    public BulkEnrollmentResult bulkEnroll(
            Long competitionId,
            String requesterId,
            boolean administrator,
            List<Long> playerIds
    ) {
        if (!administrator) {
            log.warn("Rejected bulk enrollment: administrator_required competitionId={} requesterId={}",
                    competitionId, requesterId);
            throw CompetitionRuleException.administratorRequired(competitionId);
        }
        competitionService.requireCompetition(competitionId);
        Set<Long> uniquePlayerIds = new LinkedHashSet<>(playerIds);

        List<CompletableFuture<EnrollmentOutcome>> futures = new ArrayList<>(uniquePlayerIds.size());
        for (Long playerId : uniquePlayerIds) {
            futures.add(CompletableFuture
                    .supplyAsync(() -> participantService.addParticipant(
                            ParticipantService.AddParticipantCommand.privilegedJoin(competitionId, playerId)
                    ), bulkEnrollmentExecutor)
                    .handle((participant, failure) -> failure == null
                            ? EnrollmentOutcome.success(playerId)
                            : EnrollmentOutcome.failure(playerId, classify(competitionId, playerId, failure))));
        }

        List<EnrollmentFailure> failures = new ArrayList<>();
        int succeeded = 0;
        for (CompletableFuture<EnrollmentOutcome> future : futures) {
            EnrollmentOutcome outcome = future.join();
            if (outcome.failureCode() == null) {
                succeeded++;
            } else {
                failures.add(new EnrollmentFailure(outcome.playerId(), outcome.failureCode()));
            }
        }

        BulkEnrollmentResult result = new BulkEnrollmentResult(
                competitionId,
                uniquePlayerIds.size(),
                succeeded,
                failures.size(),
                List.copyOf(failures)
        );
        log.info("Bulk enrollment for competition {} by {}: {}/{} succeeded, {} failed",
                competitionId, requesterId, result.succeeded(), result.requested(), result.failed());
        return result;
    }

    private static CompetitionErrorCode classify(Long competitionId, Long playerId, Throwable failure) {
        Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                ? failure.getCause()
                : failure;
        if (cause instanceof CompetitionRuleException ruleException) {
            return ruleException.getErrorCode();
        }
        log.error("Bulk enrollment failed for player {} in competition {}", playerId, competitionId, cause);
        return CompetitionErrorCode.STORE_UNAVAILABLE;
    }

    public record EnrollmentFailure(Long playerId, CompetitionErrorCode code) {
    }

    public record BulkEnrollmentResult(
            Long competitionId,
            int requested,
            int succeeded,
            int failed,
            List<EnrollmentFailure> failures
    ) {
    }

    private record EnrollmentOutcome(Long playerId, CompetitionErrorCode failureCode) {

        static EnrollmentOutcome success(Long playerId) {
            return new EnrollmentOutcome(playerId, null);
        }

        static EnrollmentOutcome failure(Long playerId, CompetitionErrorCode code) {
            return new EnrollmentOutcome(playerId, code);
        }
    }
}
