package omni.sync.app.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import omni.sync.app.common.RetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Provider HTTP client settings (omni.provider.*).
 */
@ConfigurationProperties(prefix = "omni.provider")
@Getter
@Setter
@NoArgsConstructor
public class ProviderProperties {

    private String applicationName = "Omni Sync";

    private Duration connectTimeout = Duration.ofSeconds(10);

    private Duration readTimeout = Duration.ofSeconds(30);

    /** Per user, as Google enforces its per-user quotas. */
    private int mailPermitsPerMinute = 200;

    private int calendarPermitsPerMinute = 480;

    /** How long a call may wait for a rate limit permit before failing. */
    private Duration limiterTimeout = Duration.ofSeconds(30);

    private CircuitBreaker circuitBreaker = new CircuitBreaker();

    private Retry retry = new Retry();

    @Getter
    @Setter
    @NoArgsConstructor
    public static class CircuitBreaker {
        /** Consecutive retryable failures that open the breaker for a (user, provider). */
        private int failureThreshold = 5;

        private Duration openDuration = Duration.ofMinutes(5);
    }

    @Getter
    @Setter
    @NoArgsConstructor
    public static class Retry {
        /** Total attempts per provider call, the first one included. */
        private int maxAttempts = 4;

        private Duration baseDelay = Duration.ofMillis(500);

        private Duration maxDelay = Duration.ofSeconds(30);

        private double jitter = 0.1;

        public RetryPolicy toPolicy() {
            return new RetryPolicy(baseDelay.toMillis(), maxDelay.toMillis(), jitter, maxAttempts);
        }
    }
}
