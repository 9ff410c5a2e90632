package omni.sync.app.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with a capped delay and ±jitter. Shared by the provider
 * clients (call-level retries) and the job runner (job-level retries).
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;

    public RetryPolicy(long baseDelayMs, long maxDelayMs, double jitterFactor, int maxAttempts) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        if (jitterFactor < 0 || jitterFactor > 1) {
            throw new IllegalArgumentException("jitterFactor must be between 0 and 1");
        }
        this.baseDelayMs = Math.max(0, baseDelayMs);
        this.maxDelayMs = Math.max(this.baseDelayMs, maxDelayMs);
        this.jitterFactor = jitterFactor;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Delay in milliseconds before retrying after the given zero-based attempt.
     * Formula: min(baseDelay * 2^attempt, maxDelay), then ±jitter, never above maxDelay.
     */
    public long delayMs(int attempt) {
        int exponent = Math.max(0, Math.min(attempt, 20));
        long exponential = Math.min(baseDelayMs * (1L << exponent), maxDelayMs);
        return Math.min(jitter(exponential), maxDelayMs);
    }

    private long jitter(long value) {
        if (jitterFactor == 0 || value == 0) {
            return value;
        }
        ThreadLocalRandom r = ThreadLocalRandom.current();
        double jitter = 1.0 + (r.nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * jitter));
    }

    /**
     * @param attemptsSoFar number of attempts already made, the failed one included
     */
    public boolean canRetry(int attemptsSoFar) {
        return attemptsSoFar < maxAttempts;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    /**
     * Default: 1s base, 30s cap, ±10% jitter, 3 attempts.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(1000L, 30_000L, 0.1, 3);
    }
}
