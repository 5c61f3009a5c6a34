package com.rankcup.competition.service;

import com.rankcup.competition.model.Competition;
import com.rankcup.competition.model.CompetitionParticipant;
import com.rankcup.competition.model.CompetitionVisibility;
import com.rankcup.competition.model.ParticipantStatus;
import com.rankcup.competition.repository.CompetitionParticipantRepository;
import com.rankcup.competition.repository.CompetitionRepository;
import com.rankcup.competition.web.CompetitionErrorCode;
import com.rankcup.competition.web.CompetitionRuleException;
import com.rankcup.competition.web.CompetitionValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Participant state machine. States are ABSENT (no row), {@link ParticipantStatus#INVITED},
 * {@link ParticipantStatus#JOINED} and {@link ParticipantStatus#LEFT}; LEFT is terminal.
 * <p>
 * Every write that can consume a slot first locks the competition row, so the active-count read and
 * the insert are serialized per competition and {@code maxParticipants} can never be overshot.
 */
@Service
public class ParticipantService {

    private static final Logger log = LoggerFactory.getLogger(ParticipantService.class);

    private final CompetitionRepository competitionRepository;
    private final CompetitionParticipantRepository participantRepository;
    private final CompetitionStatusResolver competitionStatusResolver;
    private final Clock clock;

    public ParticipantService(
            CompetitionRepository competitionRepository,
            CompetitionParticipantRepository participantRepository,
            CompetitionStatusResolver competitionStatusResolver,
            Clock clock
    ) {
        this.competitionRepository = competitionRepository;
        this.participantRepository = participantRepository;
        this.competitionStatusResolver = competitionStatusResolver;
        this.clock = clock;
    }

    /**
     * ABSENT to JOINED or INVITED.
     *
     * @throws CompetitionRuleException for inactive_competition, already_participant, cannot_rejoin,
     *                                  invite_required or maximum_participants_reached
     */
    @Transactional
    public CompetitionParticipant addParticipant(AddParticipantCommand command) {
        ParticipantStatus status = command.status();
        if (status == null || status == ParticipantStatus.LEFT) {
            throw CompetitionValidationException.of("status", "status must be JOINED or INVITED");
        }
        if (status == ParticipantStatus.INVITED && (command.invitedBy() == null || command.invitedBy().isBlank())) {
            throw CompetitionValidationException.of("invitedBy", "invitedBy is required when status is INVITED");
        }

        Long competitionId = command.competitionId();
        Long playerId = command.playerId();
        Competition competition = competitionRepository.findByIdForUpdate(competitionId)
                .orElseThrow(() -> CompetitionRuleException.competitionNotFound(competitionId));

        OffsetDateTime now = OffsetDateTime.now(clock);
        if (!competitionStatusResolver.acceptsParticipants(competition, now)) {
            throw rejected(CompetitionRuleException.inactiveCompetition(competitionId), competitionId, playerId);
        }

        Optional<CompetitionParticipant> existing =
                participantRepository.findByCompetitionIdAndPlayerId(competitionId, playerId);
        if (existing.isPresent()) {
            throw rejected(existingRowRejection(existing.get()), competitionId, playerId);
        }

        if (status == ParticipantStatus.JOINED
                && competition.getVisibility() == CompetitionVisibility.INVITE_ONLY
                && !command.privilegedAdd()) {
            throw rejected(CompetitionRuleException.inviteRequired(competitionId), competitionId, playerId);
        }

        long activeCount = participantRepository.countByCompetitionIdAndStatusNot(competitionId, ParticipantStatus.LEFT);
        if (activeCount >= competition.getMaxParticipants()) {
            throw rejected(
                    CompetitionRuleException.maximumParticipantsReached(competitionId, competition.getMaxParticipants()),
                    competitionId,
                    playerId
            );
        }

        CompetitionParticipant participant = new CompetitionParticipant();
        participant.setCompetitionId(competitionId);
        participant.setPlayerId(playerId);
        participant.setStatus(status);
        if (status == ParticipantStatus.INVITED) {
            participant.setInvitedBy(command.invitedBy());
            participant.setInvitedAt(now);
        } else {
            participant.setJoinedAt(now);
        }

        CompetitionParticipant saved;
        try {
            saved = participantRepository.saveAndFlush(participant);
        } catch (DataIntegrityViolationException ex) {
            // The locked check above makes this unreachable for writers that go through this service.
            throw rejected(CompetitionRuleException.alreadyParticipant(competitionId, playerId), competitionId, playerId);
        }

        log.info("Player {} {} competition {} ({}/{})",
                playerId,
                status == ParticipantStatus.INVITED ? "invited to" : "joined",
                competitionId,
                activeCount + 1,
                competition.getMaxParticipants());
        return saved;
    }

    /**
     * INVITED to JOINED. The slot was reserved by the invitation, so capacity is not re-checked.
     * A second call fails with already_participant and leaves {@code joinedAt} untouched.
     */
    @Transactional
    public CompetitionParticipant acceptInvitation(Long competitionId, Long playerId) {
        CompetitionParticipant participant = participantRepository
                .findByCompetitionIdAndPlayerIdForUpdate(competitionId, playerId)
                .orElseThrow(() -> rejected(
                        CompetitionRuleException.participantNotFound(competitionId, playerId),
                        competitionId,
                        playerId
                ));

        if (participant.getStatus() != ParticipantStatus.INVITED) {
            throw rejected(existingRowRejection(participant), competitionId, playerId);
        }

        participant.setStatus(ParticipantStatus.JOINED);
        if (participant.getJoinedAt() == null) {
            participant.setJoinedAt(OffsetDateTime.now(clock));
        }
        CompetitionParticipant saved = participantRepository.save(participant);
        log.info("Player {} accepted invitation to competition {}", playerId, competitionId);
        return saved;
    }

    /**
     * JOINED or INVITED to LEFT. Terminal: the row stays and blocks any later add for the same player.
     */
    @Transactional
    public CompetitionParticipant removeParticipant(Long competitionId, Long playerId) {
        CompetitionParticipant participant = participantRepository
                .findByCompetitionIdAndPlayerIdForUpdate(competitionId, playerId)
                .orElseThrow(() -> rejected(
                        CompetitionRuleException.participantNotFound(competitionId, playerId),
                        competitionId,
                        playerId
                ));

        ParticipantStatus previous = participant.getStatus();
        CompetitionParticipant left = switch (previous) {
            case LEFT -> throw rejected(CompetitionRuleException.alreadyLeft(competitionId, playerId), competitionId, playerId);
            case JOINED, INVITED -> {
                participant.setStatus(ParticipantStatus.LEFT);
                participant.setLeftAt(OffsetDateTime.now(clock));
                yield participantRepository.save(participant);
            }
        };
        log.info("Player {} left competition {} (was {})", playerId, competitionId, previous);
        return left;
    }

    @Transactional(readOnly = true)
    public Optional<ParticipantStatus> getParticipantStatus(Long competitionId, Long playerId) {
        return participantRepository.findByCompetitionIdAndPlayerId(competitionId, playerId)
                .map(CompetitionParticipant::getStatus);
    }

    @Transactional(readOnly = true)
    public List<CompetitionParticipant> getParticipants(Long competitionId, ParticipantStatus statusFilter) {
        if (!competitionRepository.existsById(competitionId)) {
            throw CompetitionRuleException.competitionNotFound(competitionId);
        }
        if (statusFilter == null) {
            return participantRepository.findByCompetitionIdOrderByJoinedAtAscIdAsc(competitionId);
        }
        return participantRepository.findByCompetitionIdAndStatusOrderByJoinedAtAscIdAsc(competitionId, statusFilter);
    }

    /**
     * Read-only preview of a self-join. A pending invitation counts as joinable since accepting it
     * needs no free slot.
     */
    @Transactional(readOnly = true)
    public JoinEligibility canJoinCompetition(Long competitionId, Long playerId) {
        Optional<Competition> found = competitionRepository.findById(competitionId);
        if (found.isEmpty()) {
            return JoinEligibility.rejected(CompetitionErrorCode.COMPETITION_NOT_FOUND);
        }
        Competition competition = found.get();
        if (!competitionStatusResolver.acceptsParticipants(competition, OffsetDateTime.now(clock))) {
            return JoinEligibility.rejected(CompetitionErrorCode.INACTIVE_COMPETITION);
        }

        Optional<CompetitionParticipant> existing =
                participantRepository.findByCompetitionIdAndPlayerId(competitionId, playerId);
        if (existing.isPresent()) {
            return switch (existing.get().getStatus()) {
                case INVITED -> JoinEligibility.allowed();
                case JOINED -> JoinEligibility.rejected(CompetitionErrorCode.ALREADY_PARTICIPANT);
                case LEFT -> JoinEligibility.rejected(CompetitionErrorCode.CANNOT_REJOIN);
            };
        }

        if (competition.getVisibility() == CompetitionVisibility.INVITE_ONLY) {
            return JoinEligibility.rejected(CompetitionErrorCode.INVITE_REQUIRED);
        }
        long activeCount = participantRepository.countByCompetitionIdAndStatusNot(competitionId, ParticipantStatus.LEFT);
        if (activeCount >= competition.getMaxParticipants()) {
            return JoinEligibility.rejected(CompetitionErrorCode.MAXIMUM_PARTICIPANTS_REACHED);
        }
        return JoinEligibility.allowed();
    }

    private static CompetitionRuleException existingRowRejection(CompetitionParticipant participant) {
        Long competitionId = participant.getCompetitionId();
        Long playerId = participant.getPlayerId();
        return switch (participant.getStatus()) {
            case LEFT -> CompetitionRuleException.cannotRejoin(competitionId, playerId);
            case JOINED, INVITED -> CompetitionRuleException.alreadyParticipant(competitionId, playerId);
        };
    }

    private static CompetitionRuleException rejected(CompetitionRuleException ex, Long competitionId, Long playerId) {
        log.warn("Participant change rejected: {} competitionId={} playerId={}",
                ex.getErrorCode().code(), competitionId, playerId);
        return ex;
    }

    /**
     * @param privilegedAdd bulk enrollment path; lets a JOINED add through on INVITE_ONLY competitions
     */
    public record AddParticipantCommand(
            Long competitionId,
            Long playerId,
            ParticipantStatus status,
            String invitedBy,
            boolean privilegedAdd
    ) {
        public static AddParticipantCommand join(Long competitionId, Long playerId) {
            return new AddParticipantCommand(competitionId, playerId, ParticipantStatus.JOINED, null, false);
        }

        public static AddParticipantCommand invite(Long competitionId, Long playerId, String invitedBy) {
            return new AddParticipantCommand(competitionId, playerId, ParticipantStatus.INVITED, invitedBy, false);
        }

        public static AddParticipantCommand privilegedJoin(Long competitionId, Long playerId) {
            return new AddParticipantCommand(competitionId, playerId, ParticipantStatus.JOINED, null, true);
        }
    }

    public record JoinEligibility(boolean canJoin, CompetitionErrorCode reason) {

        static JoinEligibility allowed() {
            return new JoinEligibility(true, null);
        }

        static JoinEligibility rejected(CompetitionErrorCode reason) {
            return new JoinEligibility(false, reason);
        }
    }
}
