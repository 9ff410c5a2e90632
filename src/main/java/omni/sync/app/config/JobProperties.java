package omni.sync.app.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import omni.sync.app.common.RetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Job queue and runner settings (omni.jobs.*).
 */
@ConfigurationProperties(prefix = "omni.jobs")
@Getter
@Setter
@NoArgsConstructor
public class JobProperties {

    /** Attempts before a retryable job is moved to error. */
    private int maxAttempts = 3;

    /** Base delay of the job-level exponential backoff. */
    private Duration backoffBase = Duration.ofSeconds(1);

    /** Upper bound of the job-level backoff. */
    private Duration backoffMax = Duration.ofSeconds(30);

    /** Jitter factor applied to the backoff (0.1 = ±10%). */
    private double backoffJitter = 0.1;

    /** Maximum jobs claimed in one poll cycle. */
    private int batchSize = 10;

    /** Wall-clock budget of one poll cycle; no new job is started after it elapses. */
    private Duration cycleBudget = Duration.ofMinutes(10);

    /** Per-job execution timeout. */
    private Duration jobTimeout = Duration.ofMinutes(5);

    /** Fixed pause between two jobs of the same lane. */
    private Duration interJobDelay = Duration.ofMillis(100);

    /** Parallel lanes per poll cycle; 1 runs jobs sequentially. */
    private int concurrency = 1;

    /** Processing jobs not touched for this long are considered abandoned. Keep it above {@code jobTimeout}. */
    private Duration staleAfter = Duration.ofMinutes(15);

    /** Done and error jobs older than this are deleted. */
    private int retentionDays = 30;

    /** Shared secret expected in the X-Cron-Secret header of the run trigger. */
    private String cronSecret;

    public RetryPolicy retryPolicy() {
        return new RetryPolicy(backoffBase.toMillis(), backoffMax.toMillis(), backoffJitter, maxAttempts);
    }
}
