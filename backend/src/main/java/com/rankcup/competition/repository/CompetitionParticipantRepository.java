package com.rankcup.competition.repository;

import com.rankcup.competition.model.CompetitionParticipant;
import com.rankcup.competition.model.ParticipantStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface CompetitionParticipantRepository extends JpaRepository<CompetitionParticipant, Long> {
    Optional<CompetitionParticipant> findByCompetitionIdAndPlayerId(Long competitionId, Long playerId);

    long countByCompetitionIdAndStatusNot(Long competitionId, ParticipantStatus status);

    List<CompetitionParticipant> findByCompetitionIdOrderByJoinedAtAscIdAsc(Long competitionId);

    List<CompetitionParticipant> findByCompetitionIdAndStatusOrderByJoinedAtAscIdAsc(
            Long competitionId,
            ParticipantStatus status
    );

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select p from CompetitionParticipant p "
            + "where p.competitionId = :competitionId and p.playerId = :playerId")
    Optional<CompetitionParticipant> findByCompetitionIdAndPlayerIdForUpdate(
            @Param("competitionId") Long competitionId,
            @Param("playerId") Long playerId
    );
}
