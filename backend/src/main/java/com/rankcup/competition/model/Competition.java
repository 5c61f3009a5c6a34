package com.rankcup.competition.model;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;

@Getter
@Setter
@Entity
@Table(name = "competitions")
public class Competition {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "server_id", nullable = false, updatable = false, length = 64)
    private String serverId;

    @Column(name = "owner_id", nullable = false, updatable = false, length = 64)
    private String ownerId;

    @Column(name = "channel_id", nullable = false, length = 64)
    private String channelId;

    @Column(name = "title", nullable = false, length = 100)
    private String title;

    @Column(name = "description", nullable = false, length = 500)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "visibility", nullable = false, length = 32)
    private CompetitionVisibility visibility = CompetitionVisibility.OPEN;

    @Column(name = "max_participants", nullable = false)
    private Integer maxParticipants = 50;

    @Enumerated(EnumType.STRING)
    @Column(name = "date_type", nullable = false, updatable = false, length = 32)
    private CompetitionDateType dateType;

    @Column(name = "start_date", updatable = false)
    private OffsetDateTime startDate;

    @Column(name = "end_date", updatable = false)
    private OffsetDateTime endDate;

    @Column(name = "season_id", updatable = false, length = 64)
    private String seasonId;

    @Enumerated(EnumType.STRING)
    @Column(name = "criteria_type", nullable = false, length = 32)
    private CriteriaType criteriaType;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "criteria_config", nullable = false, columnDefinition = "jsonb")
    private JsonNode criteriaConfig;

    @Column(name = "is_cancelled", nullable = false)
    private boolean cancelled = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}
