package com.rankcup.competition.controller;

import com.rankcup.competition.dto.CompetitionRequests;
import com.rankcup.competition.dto.CompetitionResponses;
import com.rankcup.competition.mapper.CompetitionResponseMapper;
import com.rankcup.competition.model.Competition;
import com.rankcup.competition.model.CompetitionParticipant;
import com.rankcup.competition.model.CompetitionStatus;
import com.rankcup.competition.model.ParticipantStatus;
import com.rankcup.competition.service.CompetitionEnrollmentService;
import com.rankcup.competition.service.CompetitionService;
import com.rankcup.competition.service.ParticipantService;
import com.rankcup.competition.web.CompetitionRuleException;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/competitions")
public class CompetitionController {

    private final CompetitionService competitionService;
    private final ParticipantService participantService;
    private final CompetitionEnrollmentService competitionEnrollmentService;
    private final CompetitionResponseMapper competitionResponseMapper;

    public CompetitionController(
            CompetitionService competitionService,
            ParticipantService participantService,
            CompetitionEnrollmentService competitionEnrollmentService,
            CompetitionResponseMapper competitionResponseMapper
    ) {
        this.competitionService = competitionService;
        this.participantService = participantService;
        this.competitionEnrollmentService = competitionEnrollmentService;
        this.competitionResponseMapper = competitionResponseMapper;
    }

    @PostMapping
    public ResponseEntity<CompetitionResponses.CompetitionDetail> createCompetition(
            @Valid @RequestBody CompetitionRequests.CreateCompetitionRequest request
    ) {
        Competition competition = competitionService.createCompetition(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(toDetail(competition));
    }

    @GetMapping("/{competitionId}")
    public ResponseEntity<CompetitionResponses.CompetitionDetail> getCompetition(@PathVariable Long competitionId) {
        Competition competition = competitionService.getCompetitionById(competitionId)
                .orElseThrow(() -> CompetitionRuleException.competitionNotFound(competitionId));
        return ResponseEntity.ok(toDetail(competition));
    }

    @GetMapping("/{competitionId}/status")
    public ResponseEntity<CompetitionResponses.CompetitionStatusResponse> getCompetitionStatus(
            @PathVariable Long competitionId
    ) {
        Competition competition = competitionService.requireCompetition(competitionId);
        CompetitionStatus status = competitionService.getCompetitionStatus(competition);
        return ResponseEntity.ok(new CompetitionResponses.CompetitionStatusResponse(competitionId, status));
    }

    @PostMapping("/{competitionId}/cancel")
    public ResponseEntity<CompetitionResponses.CompetitionDetail> cancelCompetition(
            @PathVariable Long competitionId,
            @Valid @RequestBody CompetitionRequests.CancelCompetitionRequest request
    ) {
        Competition competition = competitionService.cancelCompetition(
                competitionId,
                request.requesterId(),
                request.administrator()
        );
        return ResponseEntity.ok(toDetail(competition));
    }

    @GetMapping
    public ResponseEntity<List<CompetitionResponses.CompetitionDetail>> listCompetitions(
            @RequestParam(required = false) String serverId,
            @RequestParam(defaultValue = "false") boolean activeOnly,
            @RequestParam(required = false) String ownerId
    ) {
        List<Competition> competitions = serverId == null
                ? competitionService.getActiveCompetitions()
                : competitionService.listCompetitionsByServer(serverId, activeOnly, ownerId);
        return ResponseEntity.ok(competitions.stream().map(this::toDetail).toList());
    }

    @GetMapping("/{competitionId}/participants")
    public ResponseEntity<List<CompetitionResponses.Participant>> listParticipants(
            @PathVariable Long competitionId,
            @RequestParam(required = false) ParticipantStatus status
    ) {
        List<CompetitionParticipant> participants = participantService.getParticipants(competitionId, status);
        return ResponseEntity.ok(competitionResponseMapper.toParticipantResponses(participants));
    }

    @PostMapping("/{competitionId}/join")
    public ResponseEntity<CompetitionResponses.Participant> joinCompetition(
            @PathVariable Long competitionId,
            @Valid @RequestBody CompetitionRequests.JoinCompetitionRequest request
    ) {
        CompetitionParticipant participant =
                competitionEnrollmentService.joinCompetition(competitionId, request.playerId());
        return ResponseEntity.ok(competitionResponseMapper.toParticipantResponse(participant));
    }

    @PostMapping("/{competitionId}/invitations")
    public ResponseEntity<CompetitionResponses.Participant> inviteParticipant(
            @PathVariable Long competitionId,
            @Valid @RequestBody CompetitionRequests.InviteParticipantRequest request
    ) {
        CompetitionParticipant participant = competitionEnrollmentService.inviteParticipant(
                competitionId,
                request.requesterId(),
                request.playerId()
        );
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(competitionResponseMapper.toParticipantResponse(participant));
    }

    @PostMapping("/{competitionId}/participants/{playerId}/accept")
    public ResponseEntity<CompetitionResponses.Participant> acceptInvitation(
            @PathVariable Long competitionId,
            @PathVariable Long playerId
    ) {
        CompetitionParticipant participant = participantService.acceptInvitation(competitionId, playerId);
        return ResponseEntity.ok(competitionResponseMapper.toParticipantResponse(participant));
    }

    @PostMapping("/{competitionId}/participants/{playerId}/leave")
    public ResponseEntity<CompetitionResponses.Participant> leaveCompetition(
            @PathVariable Long competitionId,
            @PathVariable Long playerId
    ) {
        CompetitionParticipant participant = participantService.removeParticipant(competitionId, playerId);
        return ResponseEntity.ok(competitionResponseMapper.toParticipantResponse(participant));
    }

    @GetMapping("/{competitionId}/participants/{playerId}/status")
    public ResponseEntity<CompetitionResponses.ParticipantStatusResponse> getParticipantStatus(
            @PathVariable Long competitionId,
            @PathVariable Long playerId
    ) {
        ParticipantStatus status = participantService.getParticipantStatus(competitionId, playerId).orElse(null);
        return ResponseEntity.ok(new CompetitionResponses.ParticipantStatusResponse(competitionId, playerId, status));
    }

    @GetMapping("/{competitionId}/participants/{playerId}/eligibility")
    public ResponseEntity<CompetitionResponses.JoinEligibility> canJoinCompetition(
            @PathVariable Long competitionId,
            @PathVariable Long playerId
    ) {
        ParticipantService.JoinEligibility eligibility = participantService.canJoinCompetition(competitionId, playerId);
        return ResponseEntity.ok(
                competitionResponseMapper.toJoinEligibilityResponse(competitionId, playerId, eligibility)
        );
    }

    @PostMapping("/{competitionId}/bulk-enroll")
    public ResponseEntity<CompetitionResponses.BulkEnrollment> bulkEnroll(
            @PathVariable Long competitionId,
            @Valid @RequestBody CompetitionRequests.BulkEnrollRequest request
    ) {
        CompetitionEnrollmentService.BulkEnrollmentResult result = competitionEnrollmentService.bulkEnroll(
                competitionId,
                request.requesterId(),
                request.administrator(),
                request.playerIds()
        );
        return ResponseEntity.ok(competitionResponseMapper.toBulkEnrollmentResponse(result));
    }

    private CompetitionResponses.CompetitionDetail toDetail(Competition competition) {
        return competitionResponseMapper.toCompetitionDetail(
                competition,
                competitionService.getCompetitionStatus(competition)
        );
    }
}
