package com.rankcup.competition.repository;

import com.rankcup.competition.model.PermissionType;
import com.rankcup.competition.model.ServerPermission;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ServerPermissionRepository extends JpaRepository<ServerPermission, Long> {
    Optional<ServerPermission> findByServerIdAndUserIdAndPermission(
            String serverId,
            String userId,
            PermissionType permission
    );

    boolean existsByServerIdAndUserIdAndPermission(String serverId, String userId, PermissionType permission);

    @Modifying
    @Query("DELETE FROM ServerPermission p "
            + "WHERE p.serverId = :serverId AND p.userId = :userId AND p.permission = :permission")
    int deleteGrant(@Param("serverId") String serverId,
                    @Param("userId") String userId,
                    @Param("permission") PermissionType permission);
}
