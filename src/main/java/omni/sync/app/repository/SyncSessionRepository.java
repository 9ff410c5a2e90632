package omni.sync.app.repository;

import omni.sync.app.entity.Provider;
import omni.sync.app.entity.SyncSession;
import omni.sync.app.entity.SyncSessionStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface SyncSessionRepository extends JpaRepository<SyncSession, String> {

    Optional<SyncSession> findByIdAndUserId(String id, String userId);

    Optional<SyncSession> findFirstByUserIdAndProviderOrderByStartedAtDesc(String userId, Provider provider);

    List<SyncSession> findByUserIdOrderByStartedAtDesc(String userId, Pageable limit);

    List<SyncSession> findByUserIdAndProviderOrderByStartedAtDesc(String userId, Provider provider, Pageable limit);

    List<SyncSession> findByUserIdAndStatusOrderByStartedAtDesc(String userId, SyncSessionStatus status, Pageable limit);

    List<SyncSession> findByUserIdAndProviderAndStatusOrderByStartedAtDesc(String userId, Provider provider,
                                                                         SyncSessionStatus status, Pageable limit);

    // Runs whose runner died never report back
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE SyncSession s SET s.status = omni.sync.app.entity.SyncSessionStatus.FAILED, s.error = :error, "
            + "s.completedAt = :now, s.updatedAt = :now "
            + "WHERE s.status = omni.sync.app.entity.SyncSessionStatus.RUNNING AND s.updatedAt < :cutoff")
    int failAbandoned(@Param("cutoff") Instant cutoff, @Param("error") String error, @Param("now") Instant now);
}
