package com.rankcup.competition.repository;

import com.rankcup.competition.model.Competition;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface CompetitionRepository extends JpaRepository<Competition, Long> {
    List<Competition> findByServerIdOrderByCreatedAtDesc(String serverId);

    List<Competition> findByServerIdAndOwnerIdOrderByCreatedAtDesc(String serverId, String ownerId);

    /**
     * Not cancelled and either a SEASON competition or one whose fixed end is still ahead. Season windows
     * live in the season calendar, so callers finish the filtering with the status resolver.
     */
    @Query("select c from Competition c where c.serverId = :serverId and c.cancelled = false"
            + " and (c.dateType = com.rankcup.competition.model.CompetitionDateType.SEASON or c.endDate > :now)")
    List<Competition> findOpenByServerId(@Param("serverId") String serverId, @Param("now") OffsetDateTime now);

    @Query("select c from Competition c where c.serverId = :serverId and c.ownerId = :ownerId and c.cancelled = false"
            + " and (c.dateType = com.rankcup.competition.model.CompetitionDateType.SEASON or c.endDate > :now)")
    List<Competition> findOpenByServerIdAndOwnerId(
            @Param("serverId") String serverId,
            @Param("ownerId") String ownerId,
            @Param("now") OffsetDateTime now
    );

    @Query("select c from Competition c where c.cancelled = false"
            + " and (c.dateType = com.rankcup.competition.model.CompetitionDateType.SEASON or c.endDate > :now)"
            + " order by c.createdAt desc")
    List<Competition> findOpen(@Param("now") OffsetDateTime now);

    /**
     * Row lock held until commit; every capacity-affecting write for a competition goes through it.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select c from Competition c where c.id = :competitionId")
    Optional<Competition> findByIdForUpdate(@Param("competitionId") Long competitionId);
}
