package omni.sync.app.service.job;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * In-process triggers. Disable with omni.jobs.scheduler-enabled=false when an external cron
 * calls the run endpoint instead.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "omni.jobs", name = "scheduler-enabled", havingValue = "true", matchIfMissing = true)
public class JobScheduler {
    private final JobRunner jobRunner;
    private final JobMaintenanceService maintenanceService;

    public JobScheduler(JobRunner jobRunner, JobMaintenanceService maintenanceService) {
        this.jobRunner = jobRunner;
        this.maintenanceService = maintenanceService;
    }

    @Scheduled(fixedDelayString = "${omni.jobs.poll-interval-ms:30000}", initialDelayString = "${omni.jobs.poll-initial-delay-ms:10000}")
    public void poll() {
        try {
            jobRunner.runOnce();
        } catch (Exception e) {
            log.error("Error in scheduled job poll: {}", e.getMessage(), e);
        }
    }

    @Scheduled(fixedDelayString = "${omni.jobs.stale-sweep-interval-ms:300000}")
    public void sweepStaleJobs() {
        try {
            maintenanceService.sweepStaleJobs();
        } catch (Exception e) {
            log.error("Error in stale job sweep: {}", e.getMessage(), e);
        }
    }

    @Scheduled(cron = "${omni.jobs.cleanup-cron:0 30 3 * * *}")
    public void cleanupOldJobs() {
        try {
            maintenanceService.cleanupOldJobs();
        } catch (Exception e) {
            log.error("Error cleaning up old jobs: {}", e.getMessage(), e);
        }
    }
}
