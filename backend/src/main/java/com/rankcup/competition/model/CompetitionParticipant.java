package com.rankcup.competition.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

/**
 * One row per (competition, player) ever contacted. Rows are mutated in place and never deleted,
 * so a LEFT row keeps blocking re-entry.
 */
@Getter
@Setter
@Entity
@Table(
        name = "competition_participants",
        uniqueConstraints = @UniqueConstraint(
                name = "uq_competition_participants_competition_player",
                columnNames = {"competition_id", "player_id"}
        )
)
public class CompetitionParticipant {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "competition_id", nullable = false, updatable = false)
    private Long competitionId;

    @Column(name = "player_id", nullable = false, updatable = false)
    private Long playerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private ParticipantStatus status;

    @Column(name = "invited_by", length = 64)
    private String invitedBy;

    @Column(name = "invited_at")
    private OffsetDateTime invitedAt;

    @Column(name = "joined_at")
    private OffsetDateTime joinedAt;

    @Column(name = "left_at")
    private OffsetDateTime leftAt;
}
