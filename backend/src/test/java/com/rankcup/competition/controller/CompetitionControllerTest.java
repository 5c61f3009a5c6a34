package com.rankcup.competition.controller;

import com.rankcup.competition.dto.CompetitionRequests;
import com.rankcup.competition.mapper.CompetitionResponseMapper;
import com.rankcup.competition.model.Competition;
import com.rankcup.competition.model.CompetitionCriteria;
import com.rankcup.competition.model.CompetitionCriteriaJsonCodec;
import com.rankcup.competition.model.CompetitionDateType;
import com.rankcup.competition.model.CompetitionParticipant;
import com.rankcup.competition.model.CompetitionQueueType;
import com.rankcup.competition.model.CompetitionStatus;
import com.rankcup.competition.model.CompetitionVisibility;
import com.rankcup.competition.model.ParticipantStatus;
import com.rankcup.competition.service.CompetitionEnrollmentService;
import com.rankcup.competition.service.CompetitionService;
import com.rankcup.competition.service.ParticipantService;
import com.rankcup.competition.web.CompetitionErrorCode;
import com.rankcup.competition.web.CompetitionRuleException;
import com.rankcup.competition.web.CompetitionValidationException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CompetitionController.class)
@Import(CompetitionResponseMapper.class)
class CompetitionControllerTest {

    private static final OffsetDateTime START = OffsetDateTime.parse("2026-11-01T00:00:00Z");

    private static final String MEMBER_CREATE_BODY = """
            {
              "serverId": "server-1",
              "ownerId": "member-1",
              "channelId": "channel-1",
              "title": "November grind",
              "description": "Most solo queue games",
              "dateType": "FIXED_DATES",
              "startDate": "2026-11-01T00:00:00Z",
              "endDate": "2026-11-30T00:00:00Z",
              "criteriaType": "MOST_GAMES_PLAYED",
              "queue": "SOLO"
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private CompetitionService competitionService;

    @MockitoBean
    private ParticipantService participantService;

    @MockitoBean
    private CompetitionEnrollmentService competitionEnrollmentService;

    @Test
    void createCompetitionReturnsCreatedPayload() throws Exception {
        Competition competition = sampleCompetition(31L);
        when(competitionService.createCompetition(any())).thenReturn(competition);
        when(competitionService.getCompetitionStatus(competition)).thenReturn(CompetitionStatus.DRAFT);

        mockMvc.perform(post("/api/competitions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "serverId": "server-1",
                                  "ownerId": "owner-1",
                                  "channelId": "channel-1",
                                  "title": "November grind",
                                  "description": "Most solo queue games",
                                  "dateType": "FIXED_DATES",
                                  "startDate": "2026-11-01T00:00:00Z",
                                  "endDate": "2026-11-30T00:00:00Z",
                                  "criteriaType": "MOST_GAMES_PLAYED",
                                  "queue": "SOLO"
                                }
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(31))
                .andExpect(jsonPath("$.status").value("DRAFT"))
                .andExpect(jsonPath("$.criteriaType").value("MOST_GAMES_PLAYED"))
                .andExpect(jsonPath("$.queue").value("SOLO"))
                .andExpect(jsonPath("$.maxParticipants").value(50));
    }

    @Test
    void createCompetitionBeanValidationFailureReturnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/competitions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "serverId": "server-1",
                                  "ownerId": "owner-1",
                                  "channelId": "channel-1",
                                  "title": "",
                                  "description": "Most solo queue games",
                                  "criteriaType": "MOST_GAMES_PLAYED"
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("validation_failed"))
                .andExpect(jsonPath("$.fieldErrors.title").exists())
                .andExpect(jsonPath("$.fieldErrors.dateType").exists());

        verify(competitionService, never()).createCompetition(any());
    }

    @Test
    void serviceValidationFailureReturnsFieldErrors() throws Exception {
        when(competitionService.createCompetition(any()))
                .thenThrow(CompetitionValidationException.of("maxParticipants", "maxParticipants must be between 2 and 100"));

        mockMvc.perform(post("/api/competitions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "serverId": "server-1",
                                  "ownerId": "owner-1",
                                  "channelId": "channel-1",
                                  "title": "Tiny",
                                  "description": "Too small",
                                  "maxParticipants": 1,
                                  "dateType": "FIXED_DATES",
                                  "startDate": "2026-11-01T00:00:00Z",
                                  "endDate": "2026-11-30T00:00:00Z",
                                  "criteriaType": "MOST_GAMES_PLAYED",
                                  "queue": "SOLO"
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("validation_failed"))
                .andExpect(jsonPath("$.fieldErrors.maxParticipants").value("maxParticipants must be between 2 and 100"));
    }

    @Test
    void ownerLimitReturnsConflictWithCode() throws Exception {
        when(competitionService.createCompetition(any())).thenThrow(CompetitionRuleException.ownerLimitReached(1, 1));

        mockMvc.perform(post("/api/competitions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "serverId": "server-1",
                                  "ownerId": "owner-1",
                                  "channelId": "channel-1",
                                  "title": "Second",
                                  "description": "Another one",
                                  "dateType": "SEASON",
                                  "seasonId": "2026_SEASON_2_ACT_1",
                                  "criteriaType": "HIGHEST_RANK",
                                  "queue": "FLEX"
                                }
                                """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("owner_limit_reached"));
    }

    @Test
    void rateLimitedCreatorGetsTooManyRequestsWithRetryAfter() throws Exception {
        when(competitionService.createCompetition(any())).thenThrow(
                CompetitionRuleException.creationRateLimited("server-1", "member-1", Duration.ofSeconds(1799).plusMillis(200))
        );

        mockMvc.perform(post("/api/competitions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(MEMBER_CREATE_BODY))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "1800"))
                .andExpect(jsonPath("$.code").value("creation_rate_limited"));
    }

    @Test
    void memberWithoutCreateGrantGetsForbidden() throws Exception {
        when(competitionService.createCompetition(any()))
                .thenThrow(CompetitionRuleException.missingCreatePermission("server-1", "member-1"));

        mockMvc.perform(post("/api/competitions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(MEMBER_CREATE_BODY))
                .andExpect(status().isForbidden())
                .andExpect(header().doesNotExist("Retry-After"))
                .andExpect(jsonPath("$.code").value("missing_create_permission"));
    }

    @Test
    void administratorFlagReachesTheService() throws Exception {
        Competition competition = sampleCompetition(32L);
        when(competitionService.createCompetition(argThat(CompetitionRequests.CreateCompetitionRequest::administrator)))
                .thenReturn(competition);
        when(competitionService.getCompetitionStatus(competition)).thenReturn(CompetitionStatus.DRAFT);

        mockMvc.perform(post("/api/competitions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(MEMBER_CREATE_BODY.replace("\"member-1\"", "\"admin-1\", \"administrator\": true")))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(32));
    }

    @Test
    void getMissingCompetitionReturnsNotFound() throws Exception {
        when(competitionService.getCompetitionById(404L)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/competitions/404"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("competition_not_found"));
    }

    @Test
    void statusEndpointReturnsDerivedStatus() throws Exception {
        Competition competition = sampleCompetition(5L);
        when(competitionService.requireCompetition(5L)).thenReturn(competition);
        when(competitionService.getCompetitionStatus(competition)).thenReturn(CompetitionStatus.ACTIVE);

        mockMvc.perform(get("/api/competitions/5/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.competitionId").value(5))
                .andExpect(jsonPath("$.status").value("ACTIVE"));
    }

    @Test
    void joinFullCompetitionReturnsConflict() throws Exception {
        when(competitionEnrollmentService.joinCompetition(7L, 900L))
                .thenThrow(CompetitionRuleException.maximumParticipantsReached(7L, 10));

        mockMvc.perform(post("/api/competitions/7/join")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"playerId": 900}
                                """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("maximum_participants_reached"));
    }

    @Test
    void joinInviteOnlyWithoutInvitationReturnsForbidden() throws Exception {
        when(competitionEnrollmentService.joinCompetition(7L, 901L))
                .thenThrow(CompetitionRuleException.inviteRequired(7L));

        mockMvc.perform(post("/api/competitions/7/join")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"playerId": 901}
                                """))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("invite_required"));
    }

    @Test
    void participantsCannotBeAddedWithARawStatus() throws Exception {
        mockMvc.perform(post("/api/competitions/7/participants")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"playerId": 902, "status": "INVITED", "invitedBy": "not-the-owner"}
                                """))
                .andExpect(status().isMethodNotAllowed());

        verify(participantService, never()).addParticipant(any());
    }

    @Test
    void invitationByNonOwnerReturnsForbidden() throws Exception {
        when(competitionEnrollmentService.inviteParticipant(7L, "not-the-owner", 902L))
                .thenThrow(CompetitionRuleException.notCompetitionOwner(7L));

        mockMvc.perform(post("/api/competitions/7/invitations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"requesterId": "not-the-owner", "playerId": 902}
                                """))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("not_competition_owner"));
    }

    @Test
    void acceptInvitationReturnsJoinedParticipant() throws Exception {
        CompetitionParticipant participant = new CompetitionParticipant();
        participant.setCompetitionId(7L);
        participant.setPlayerId(903L);
        participant.setStatus(ParticipantStatus.JOINED);
        participant.setInvitedBy("owner-1");
        participant.setInvitedAt(START.minusDays(1));
        participant.setJoinedAt(START);
        when(participantService.acceptInvitation(7L, 903L)).thenReturn(participant);

        mockMvc.perform(post("/api/competitions/7/participants/903/accept"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("JOINED"))
                .andExpect(jsonPath("$.invitedBy").value("owner-1"));
    }

    @Test
    void leaveTwiceReturnsAlreadyLeft() throws Exception {
        when(participantService.removeParticipant(7L, 904L)).thenThrow(CompetitionRuleException.alreadyLeft(7L, 904L));

        mockMvc.perform(post("/api/competitions/7/participants/904/leave"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("already_left"));
    }

    @Test
    void participantStatusIsNullWhenAbsent() throws Exception {
        when(participantService.getParticipantStatus(7L, 905L)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/competitions/7/participants/905/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.playerId").value(905))
                .andExpect(jsonPath("$.status").doesNotExist());
    }

    @Test
    void eligibilityExposesReasonCode() throws Exception {
        when(participantService.canJoinCompetition(7L, 906L))
                .thenReturn(new ParticipantService.JoinEligibility(false, CompetitionErrorCode.CANNOT_REJOIN));

        mockMvc.perform(get("/api/competitions/7/participants/906/eligibility"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.canJoin").value(false))
                .andExpect(jsonPath("$.reason").value("cannot_rejoin"));
    }

    @Test
    void bulkEnrollReturnsAggregatedOutcome() throws Exception {
        when(competitionEnrollmentService.bulkEnroll(eq(7L), eq("admin-1"), eq(true), any())).thenReturn(
                new CompetitionEnrollmentService.BulkEnrollmentResult(
                        7L, 3, 2, 1,
                        List.of(new CompetitionEnrollmentService.EnrollmentFailure(12L, CompetitionErrorCode.CANNOT_REJOIN))
                )
        );

        mockMvc.perform(post("/api/competitions/7/bulk-enroll")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"requesterId": "admin-1", "administrator": true, "playerIds": [10, 11, 12]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.requested").value(3))
                .andExpect(jsonPath("$.succeeded").value(2))
                .andExpect(jsonPath("$.failures[0].playerId").value(12))
                .andExpect(jsonPath("$.failures[0].code").value("cannot_rejoin"));
    }

    @Test
    void bulkEnrollRejectsEmptyPlayerList() throws Exception {
        mockMvc.perform(post("/api/competitions/7/bulk-enroll")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"requesterId": "admin-1", "administrator": true, "playerIds": []}
                                """))
                .andExpect(status().isBadRequest());

        verify(competitionEnrollmentService, never()).bulkEnroll(anyLong(), any(), anyBoolean(), any());
    }

    @Test
    void bulkEnrollByNonAdministratorReturnsForbidden() throws Exception {
        when(competitionEnrollmentService.bulkEnroll(eq(7L), eq("member-2"), eq(false), any()))
                .thenThrow(CompetitionRuleException.administratorRequired(7L));

        mockMvc.perform(post("/api/competitions/7/bulk-enroll")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"requesterId": "member-2", "playerIds": [10, 11]}
                                """))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("administrator_required"));
    }

    @Test
    void bulkEnrollWithoutRequesterIsRejected() throws Exception {
        mockMvc.perform(post("/api/competitions/7/bulk-enroll")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"playerIds": [10, 11]}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors.requesterId").exists());

        verify(competitionEnrollmentService, never()).bulkEnroll(anyLong(), any(), anyBoolean(), any());
    }

    @Test
    void storeFailureReturnsServiceUnavailable() throws Exception {
        when(participantService.getParticipants(7L, null))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        mockMvc.perform(get("/api/competitions/7/participants"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("store_unavailable"));
    }

    @Test
    void cancelByNonOwnerReturnsForbidden() throws Exception {
        when(competitionService.cancelCompetition(7L, "member-2", false))
                .thenThrow(CompetitionRuleException.notCompetitionOwner(7L));

        mockMvc.perform(post("/api/competitions/7/cancel")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"requesterId": "member-2", "administrator": false}
                                """))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("not_competition_owner"));
    }

    private static Competition sampleCompetition(Long id) {
        Competition competition = new Competition();
        competition.setId(id);
        competition.setServerId("server-1");
        competition.setOwnerId("owner-1");
        competition.setChannelId("channel-1");
        competition.setTitle("November grind");
        competition.setDescription("Most solo queue games");
        competition.setVisibility(CompetitionVisibility.OPEN);
        competition.setMaxParticipants(50);
        competition.setDateType(CompetitionDateType.FIXED_DATES);
        competition.setStartDate(START);
        competition.setEndDate(START.plusDays(29));
        CompetitionCriteria criteria = new CompetitionCriteria.MostGamesPlayed(CompetitionQueueType.SOLO);
        competition.setCriteriaType(criteria.type());
        competition.setCriteriaConfig(CompetitionCriteriaJsonCodec.toConfig(criteria));
        competition.setCreatedAt(START.minusDays(1));
        return competition;
    }
}
