package omni.sync.app.repository;

import omni.sync.app.entity.Job;
import omni.sync.app.entity.JobStatus;
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

/**
 * Every status transition is a conditional update on the expected current status,
 * so concurrent runners cannot both move the same job.
 */
@Repository
public interface JobRepository extends JpaRepository<Job, String> {

    @Query("SELECT j FROM Job j WHERE j.status = omni.sync.app.entity.JobStatus.QUEUED "
            + "AND (j.runAfter IS NULL OR j.runAfter <= :now) ORDER BY j.createdAt ASC")
    List<Job> findRunnable(@Param("now") Instant now, Pageable limit);

    Optional<Job> findByIdAndUserId(String id, String userId);

    /**
     * Atomic claim: queued -> processing for exactly one caller. Counts the attempt.
     *
     * @return 1 if this caller won the job, 0 otherwise
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Job j SET j.status = omni.sync.app.entity.JobStatus.PROCESSING, j.attempts = j.attempts + 1, "
            + "j.updatedAt = :now WHERE j.id = :id AND j.userId = :userId "
            + "AND j.status = omni.sync.app.entity.JobStatus.QUEUED")
    int claim(@Param("id") String id, @Param("userId") String userId, @Param("now") Instant now);

    /**
     * Attempt count as stored, i.e. after the caller's own claim.
     */
    @Query("SELECT j.attempts FROM Job j WHERE j.id = :id")
    Optional<Integer> findAttemptsById(@Param("id") String id);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Job j SET j.status = omni.sync.app.entity.JobStatus.DONE, j.lastError = NULL, j.updatedAt = :now "
            + "WHERE j.id = :id AND j.status = omni.sync.app.entity.JobStatus.PROCESSING")
    int markDone(@Param("id") String id, @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Job j SET j.status = omni.sync.app.entity.JobStatus.QUEUED, j.runAfter = :runAfter, "
            + "j.lastError = :error, j.updatedAt = :now "
            + "WHERE j.id = :id AND j.status = omni.sync.app.entity.JobStatus.PROCESSING")
    int markRetry(@Param("id") String id, @Param("runAfter") Instant runAfter,
                  @Param("error") String error, @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Job j SET j.status = omni.sync.app.entity.JobStatus.ERROR, j.lastError = :error, j.updatedAt = :now "
            + "WHERE j.id = :id AND j.status = omni.sync.app.entity.JobStatus.PROCESSING")
    int markError(@Param("id") String id, @Param("error") String error, @Param("now") Instant now);

    /**
     * Timed out job whose handler may still run: stays processing, so no runner can claim it
     * before the stale sweep re-queues it.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Job j SET j.lastError = :error, j.updatedAt = :now "
            + "WHERE j.id = :id AND j.status = omni.sync.app.entity.JobStatus.PROCESSING")
    int markTimedOut(@Param("id") String id, @Param("error") String error, @Param("now") Instant now);

    // Stale sweep: abandoned processing jobs
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Job j SET j.status = omni.sync.app.entity.JobStatus.ERROR, j.lastError = :error, j.updatedAt = :now "
            + "WHERE j.status = omni.sync.app.entity.JobStatus.PROCESSING AND j.updatedAt < :cutoff "
            + "AND j.attempts >= :maxAttempts")
    int failStale(@Param("cutoff") Instant cutoff, @Param("maxAttempts") int maxAttempts,
                  @Param("error") String error, @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Job j SET j.status = omni.sync.app.entity.JobStatus.QUEUED, j.runAfter = :now, "
            + "j.lastError = :error, j.updatedAt = :now "
            + "WHERE j.status = omni.sync.app.entity.JobStatus.PROCESSING AND j.updatedAt < :cutoff "
            + "AND j.attempts < :maxAttempts")
    int requeueStale(@Param("cutoff") Instant cutoff, @Param("maxAttempts") int maxAttempts,
                     @Param("error") String error, @Param("now") Instant now);

    @Transactional
    @Modifying
    @Query("DELETE FROM Job j WHERE j.status IN (omni.sync.app.entity.JobStatus.DONE, "
            + "omni.sync.app.entity.JobStatus.ERROR) AND j.updatedAt < :cutoff")
    int deleteFinishedBefore(@Param("cutoff") Instant cutoff);

    @Query("SELECT j.status AS status, COUNT(j) AS total FROM Job j GROUP BY j.status")
    List<StatusCount> countByStatus();

    @Query("SELECT j.status AS status, COUNT(j) AS total FROM Job j WHERE j.userId = :userId GROUP BY j.status")
    List<StatusCount> countByStatusForUser(@Param("userId") String userId);

    interface StatusCount {
        JobStatus getStatus();

        long getTotal();
    }
}
