package omni.sync.app.service.job;

import lombok.extern.slf4j.Slf4j;
import omni.sync.app.config.JobProperties;
import omni.sync.app.repository.JobRepository;
import omni.sync.app.service.sync.SyncSessionService;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Housekeeping of the jobs table: abandoned processing jobs and old finished jobs.
 * Sync sessions left running by a dead runner are closed with the same sweep.
 */
@Slf4j
@Service
public class JobMaintenanceService {
    private final JobRepository jobRepository;
    private final SyncSessionService syncSessionService;
    private final JobProperties properties;
    private final Clock clock;

    public JobMaintenanceService(JobRepository jobRepository,
                                 SyncSessionService syncSessionService,
                                 JobProperties properties,
                                 Clock clock) {
        this.jobRepository = jobRepository;
        this.syncSessionService = syncSessionService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Processing jobs whose runner died are re-queued, or failed when out of attempts.
     *
     * @return number of jobs touched
     */
    public int sweepStaleJobs() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(properties.getStaleAfter());
        String reason = "Abandoned in processing for more than " + properties.getStaleAfter().toMinutes() + " minutes";
        int failed = jobRepository.failStale(cutoff, properties.getMaxAttempts(), reason, now);
        int requeued = jobRepository.requeueStale(cutoff, properties.getMaxAttempts(), reason, now);
        if (failed + requeued > 0) {
            log.warn("Stale job sweep: {} re-queued, {} failed", requeued, failed);
        }
        syncSessionService.failAbandoned(properties.getStaleAfter());
        return failed + requeued;
    }

    /**
     * Deletes done and error jobs older than the retention period.
     */
    public int cleanupOldJobs() {
        Instant cutoff = clock.instant().minus(Duration.ofDays(properties.getRetentionDays()));
        int deleted = jobRepository.deleteFinishedBefore(cutoff);
        log.info("Deleted {} finished jobs older than {} days", deleted, properties.getRetentionDays());
        return deleted;
    }
}
