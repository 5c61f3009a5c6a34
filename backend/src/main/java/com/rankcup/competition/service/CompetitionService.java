package com.rankcup.competition.service;

import com.rankcup.competition.config.CompetitionProperties;
import com.rankcup.competition.dto.CompetitionRequests;
import com.rankcup.competition.model.Competition;
import com.rankcup.competition.model.CompetitionCriteria;
import com.rankcup.competition.model.CompetitionCriteriaJsonCodec;
import com.rankcup.competition.model.CompetitionDates;
import com.rankcup.competition.model.CompetitionStatus;
import com.rankcup.competition.model.CompetitionVisibility;
import com.rankcup.competition.model.SeasonDefinition;
import com.rankcup.competition.repository.CompetitionRepository;
import com.rankcup.competition.web.CompetitionRuleException;
import com.rankcup.competition.web.CompetitionValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Competition registry: creation, lookup, listing, cancellation and status derivation.
 */
@Service
public class CompetitionService {

    private static final Logger log = LoggerFactory.getLogger(CompetitionService.class);

    private static final int MAX_TITLE_LENGTH = 100;
    private static final int MAX_DESCRIPTION_LENGTH = 500;

    private final CompetitionRepository competitionRepository;
    private final CompetitionLimitValidator competitionLimitValidator;
    private final CompetitionCreationRateLimiter competitionCreationRateLimiter;
    private final CompetitionPermissionService competitionPermissionService;
    private final CompetitionStatusResolver competitionStatusResolver;
    private final SeasonCalendar seasonCalendar;
    private final CompetitionProperties competitionProperties;
    private final Clock clock;

    public CompetitionService(
            CompetitionRepository competitionRepository,
            CompetitionLimitValidator competitionLimitValidator,
            CompetitionCreationRateLimiter competitionCreationRateLimiter,
            CompetitionPermissionService competitionPermissionService,
            CompetitionStatusResolver competitionStatusResolver,
            SeasonCalendar seasonCalendar,
            CompetitionProperties competitionProperties,
            Clock clock
    ) {
        this.competitionRepository = competitionRepository;
        this.competitionLimitValidator = competitionLimitValidator;
        this.competitionCreationRateLimiter = competitionCreationRateLimiter;
        this.competitionPermissionService = competitionPermissionService;
        this.competitionStatusResolver = competitionStatusResolver;
        this.seasonCalendar = seasonCalendar;
        this.competitionProperties = competitionProperties;
        this.clock = clock;
    }

    /**
     * Validates the input, checks the creator's permission and rate-limit window, applies the owner and
     * server caps, and persists the competition. The creator's rate-limit window starts only once the
     * insert has committed.
     */
    @Transactional
    public Competition createCompetition(CompetitionRequests.CreateCompetitionRequest request) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        Map<String, String> fieldErrors = new LinkedHashMap<>();

        String title = trimToNull(request.title());
        String description = trimToNull(request.description());
        requireText(fieldErrors, "serverId", request.serverId());
        requireText(fieldErrors, "ownerId", request.ownerId());
        requireText(fieldErrors, "channelId", request.channelId());
        checkLength(fieldErrors, "title", title, MAX_TITLE_LENGTH);
        checkLength(fieldErrors, "description", description, MAX_DESCRIPTION_LENGTH);

        int maxParticipants = request.maxParticipants() == null
                ? competitionProperties.getDefaultMaxParticipants()
                : request.maxParticipants();
        if (maxParticipants < competitionProperties.getMinParticipants()
                || maxParticipants > competitionProperties.getMaxParticipants()) {
            fieldErrors.put("maxParticipants", "maxParticipants must be between "
                    + competitionProperties.getMinParticipants() + " and "
                    + competitionProperties.getMaxParticipants());
        }

        CompetitionDates dates = buildDates(request, now, fieldErrors);
        CompetitionCriteria criteria = buildCriteria(request, fieldErrors);

        if (!fieldErrors.isEmpty()) {
            log.warn("Rejected competition creation: validation_failed serverId={} ownerId={} fields={}",
                    request.serverId(), request.ownerId(), fieldErrors.keySet());
            throw new CompetitionValidationException(fieldErrors);
        }

        requireCreationPermission(request.serverId(), request.ownerId(), request.administrator());
        competitionLimitValidator.validateOwnerLimit(request.serverId(), request.ownerId());
        competitionLimitValidator.validateServerLimit(request.serverId(), request.ownerId());

        Competition competition = new Competition();
        competition.setServerId(request.serverId());
        competition.setOwnerId(request.ownerId());
        competition.setChannelId(request.channelId());
        competition.setTitle(title);
        competition.setDescription(description);
        competition.setVisibility(request.visibility() == null ? CompetitionVisibility.OPEN : request.visibility());
        competition.setMaxParticipants(maxParticipants);
        applyDates(competition, dates);
        competition.setCriteriaType(criteria.type());
        competition.setCriteriaConfig(CompetitionCriteriaJsonCodec.toConfig(criteria));
        competition.setCancelled(false);
        competition.setCreatedAt(now);
        competition.setUpdatedAt(now);

        Competition saved = competitionRepository.save(competition);
        recordCreationAfterCommit(saved.getServerId(), saved.getOwnerId());

        log.info("Created competition {} on server {} for owner {} ({}, {})",
                saved.getId(), saved.getServerId(), saved.getOwnerId(), dates.type(), criteria.type());
        return saved;
    }

    @Transactional(readOnly = true)
    public Optional<Competition> getCompetitionById(Long competitionId) {
        return competitionRepository.findById(competitionId);
    }

    @Transactional(readOnly = true)
    public Competition requireCompetition(Long competitionId) {
        return competitionRepository.findById(competitionId)
                .orElseThrow(() -> CompetitionRuleException.competitionNotFound(competitionId));
    }

    public CompetitionStatus getCompetitionStatus(Competition competition, OffsetDateTime now) {
        return competitionStatusResolver.resolve(competition, now);
    }

    public CompetitionStatus getCompetitionStatus(Competition competition) {
        return getCompetitionStatus(competition, OffsetDateTime.now(clock));
    }

    /**
     * Newest first. {@code activeOnly} keeps competitions that are neither cancelled nor ended.
     */
    @Transactional(readOnly = true)
    public List<Competition> listCompetitionsByServer(String serverId, boolean activeOnly, String ownerId) {
        List<Competition> competitions = ownerId == null
                ? competitionRepository.findByServerIdOrderByCreatedAtDesc(serverId)
                : competitionRepository.findByServerIdAndOwnerIdOrderByCreatedAtDesc(serverId, ownerId);
        if (!activeOnly) {
            return competitions;
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        return competitions.stream()
                .filter(competition -> competitionStatusResolver.acceptsParticipants(competition, now))
                .toList();
    }

    /**
     * Competitions on every server that are neither cancelled nor ended, newest first.
     */
    @Transactional(readOnly = true)
    public List<Competition> getActiveCompetitions() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        return competitionRepository.findOpen(now).stream()
                .filter(competition -> competitionStatusResolver.acceptsParticipants(competition, now))
                .toList();
    }

    /**
     * Marks the competition cancelled. Repeating the call on a cancelled competition is a no-op.
     */
    @Transactional
    public Competition cancelCompetition(Long competitionId, String requesterId, boolean administrator) {
        Competition competition = competitionRepository.findByIdForUpdate(competitionId)
                .orElseThrow(() -> CompetitionRuleException.competitionNotFound(competitionId));

        if (!administrator && !competition.getOwnerId().equals(requesterId)) {
            log.warn("Rejected cancellation: not_competition_owner competitionId={} requesterId={}",
                    competitionId, requesterId);
            throw CompetitionRuleException.notCompetitionOwner(competitionId);
        }
        if (competition.isCancelled()) {
            return competition;
        }

        competition.setCancelled(true);
        competition.setUpdatedAt(OffsetDateTime.now(clock));
        Competition saved = competitionRepository.save(competition);
        log.info("Cancelled competition {} on server {} by {}", competitionId, saved.getServerId(), requesterId);
        return saved;
    }

    private CompetitionDates buildDates(
            CompetitionRequests.CreateCompetitionRequest request,
            OffsetDateTime now,
            Map<String, String> fieldErrors
    ) {
        CompetitionDates dates;
        try {
            dates = CompetitionDates.of(request.dateType(), request.startDate(), request.endDate(), request.seasonId());
        } catch (IllegalArgumentException ex) {
            fieldErrors.put("dates", ex.getMessage());
            return null;
        }

        if (dates instanceof CompetitionDates.FixedDates fixed) {
            Duration maxDuration = Duration.ofDays(competitionProperties.getMaxDurationDays());
            if (Duration.between(fixed.startDate(), fixed.endDate()).compareTo(maxDuration) > 0) {
                fieldErrors.put("endDate", "Competition cannot run longer than "
                        + competitionProperties.getMaxDurationDays() + " days");
            }
        } else if (dates instanceof CompetitionDates.Season season) {
            Optional<SeasonDefinition> definition = seasonCalendar.findSeason(season.seasonId());
            if (definition.isEmpty()) {
                fieldErrors.put("seasonId", "Unknown season: " + season.seasonId());
            } else if (definition.get().hasEnded(now)) {
                fieldErrors.put("seasonId", "Season has already ended: " + season.seasonId());
            }
        }
        return dates;
    }

    private static CompetitionCriteria buildCriteria(
            CompetitionRequests.CreateCompetitionRequest request,
            Map<String, String> fieldErrors
    ) {
        try {
            return CompetitionCriteria.of(
                    request.criteriaType(),
                    request.queue(),
                    request.championId(),
                    request.minGames()
            );
        } catch (IllegalArgumentException ex) {
            fieldErrors.put("criteria", ex.getMessage());
            return null;
        }
    }

    private static void applyDates(Competition competition, CompetitionDates dates) {
        competition.setDateType(dates.type());
        if (dates instanceof CompetitionDates.FixedDates fixed) {
            competition.setStartDate(fixed.startDate());
            competition.setEndDate(fixed.endDate());
        } else {
            competition.setSeasonId(((CompetitionDates.Season) dates).seasonId());
        }
    }

    private void requireCreationPermission(String serverId, String ownerId, boolean administrator) {
        CompetitionPermissionService.CreationPermission permission =
                competitionPermissionService.canCreateCompetition(serverId, ownerId, administrator);
        if (permission.allowed()) {
            return;
        }
        log.warn("Rejected competition creation: {} serverId={} ownerId={}",
                permission.reason().code(), serverId, ownerId);
        switch (permission.reason()) {
            case CREATION_RATE_LIMITED -> throw CompetitionRuleException.creationRateLimited(
                    serverId, ownerId, permission.retryAfter());
            case MISSING_CREATE_PERMISSION -> throw CompetitionRuleException.missingCreatePermission(serverId, ownerId);
            default -> throw new IllegalStateException("Unexpected creation denial: " + permission.reason());
        }
    }

    private void recordCreationAfterCommit(String serverId, String ownerId) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            competitionCreationRateLimiter.recordCreation(serverId, ownerId);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                competitionCreationRateLimiter.recordCreation(serverId, ownerId);
            }
        });
    }

    private static void requireText(Map<String, String> fieldErrors, String field, String value) {
        if (value == null || value.isBlank()) {
            fieldErrors.put(field, field + " is required");
        }
    }

    private static void checkLength(Map<String, String> fieldErrors, String field, String value, int maxLength) {
        if (value == null) {
            fieldErrors.put(field, field + " is required");
        } else if (value.length() > maxLength) {
            fieldErrors.put(field, field + " must be at most " + maxLength + " characters");
        }
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
