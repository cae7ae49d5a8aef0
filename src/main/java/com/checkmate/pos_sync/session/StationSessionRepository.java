package com.checkmate.pos_sync.session;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface StationSessionRepository extends JpaRepository<StationSessionEntity, Long> {

    /**
     * Token lookup. Only open sessions in the given status are visible.
     */
    Optional<StationSessionEntity> findByTokenAndSyncStatusAndClosedAtIsNull(String token, SessionStatus syncStatus);

    List<StationSessionEntity> findByIdIn(Collection<Long> ids);

    /**
     * Abandons every active session of a user. Run before issuing a new one.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE StationSessionEntity s
        SET s.syncStatus = :abandoned, s.closedAt = :now
        WHERE s.userId = :userId AND s.syncStatus = :active
        """)
    int abandonActiveForUser(@Param("userId") long userId,
                             @Param("now") Instant now,
                             @Param("active") SessionStatus active,
                             @Param("abandoned") SessionStatus abandoned);

    /**
     * Abandons active sessions idle since before the cutoff.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE StationSessionEntity s
        SET s.syncStatus = :abandoned, s.closedAt = :now
        WHERE s.syncStatus = :active AND s.lastActivityAt < :cutoff
        """)
    int abandonIdleSince(@Param("cutoff") Instant cutoff,
                         @Param("now") Instant now,
                         @Param("active") SessionStatus active,
                         @Param("abandoned") SessionStatus abandoned);

    @Modifying
    @Query("UPDATE StationSessionEntity s SET s.lastActivityAt = :now WHERE s.id = :id")
    int touch(@Param("id") long id, @Param("now") Instant now);

    /**
     * Session counts per status for one line log, as (status, count) rows.
     */
    @Query("""
        SELECT s.syncStatus, COUNT(s) FROM StationSessionEntity s
        WHERE s.lineLogId = :lineLogId
        GROUP BY s.syncStatus
        """)
    List<Object[]> countByStatusForLineLog(@Param("lineLogId") long lineLogId);
}
