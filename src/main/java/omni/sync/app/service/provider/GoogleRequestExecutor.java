package omni.sync.app.service.provider;

import com.google.api.client.googleapis.json.GoogleJsonError;
import com.google.api.client.googleapis.json.GoogleJsonResponseException;
import com.google.api.client.http.HttpResponseException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import omni.sync.app.common.RetryPolicy;
import omni.sync.app.entity.Provider;
import omni.sync.app.exception.ProviderException;

import java.io.IOException;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Runs Google API calls through the (user, provider) rate limiter and circuit breaker and the
 * shared retry policy. 429, 408, 5xx, quota 403s and I/O failures (timeouts included) are
 * retried; everything else is not. Quota 403s back off three times longer.
 */
@Slf4j
public class GoogleRequestExecutor {
    static final Set<String> QUOTA_REASONS = Set.of(
            "rateLimitExceeded", "userRateLimitExceeded", "dailyLimitExceeded", "quotaExceeded");

    @FunctionalInterface
    public interface GoogleCall<T> {
        T execute() throws IOException;
    }

    private final Provider provider;
    private final ProviderCallGuards guards;
    private final RetryPolicy retryPolicy;

    public GoogleRequestExecutor(Provider provider, ProviderCallGuards guards, RetryPolicy retryPolicy) {
        this.provider = provider;
        this.guards = guards;
        this.retryPolicy = retryPolicy;
    }

    public <T> T execute(String userId, String operation, GoogleCall<T> call) {
        String name = provider.getWireName() + " " + operation;
        CircuitBreaker breaker = guards.circuitBreaker(userId, provider);
        RateLimiter limiter = guards.rateLimiter(userId, provider);
        int attempt = 0;
        while (true) {
            attempt++;
            if (!breaker.tryAcquirePermission()) {
                throw new ProviderException(name + " skipped, circuit open for user " + userId, 0, true, null);
            }
            if (!limiter.acquirePermission()) {
                breaker.releasePermission();
                if (Thread.currentThread().isInterrupted()) {
                    throw new ProviderException(name + " interrupted", 0, false, null);
                }
                throw new ProviderException(name + " rate limit wait exceeded for user " + userId, 429, true, null);
            }

            long started = System.nanoTime();
            ProviderException failure;
            try {
                T result = call.execute();
                breaker.onSuccess(System.nanoTime() - started, TimeUnit.NANOSECONDS);
                return result;
            } catch (HttpResponseException e) {
                int status = e.getStatusCode();
                boolean retryable = ProviderException.isRetryableStatus(status) || isQuotaExceeded(e);
                failure = new ProviderException(name + " failed with " + status + ": " + e.getStatusMessage(),
                        status, retryable, e);
            } catch (IOException e) {
                failure = ProviderException.transientFailure(name + " I/O failure: " + e.getMessage(), e);
            }
            breaker.onError(System.nanoTime() - started, TimeUnit.NANOSECONDS, failure);

            if (!failure.isRetryable() || !retryPolicy.canRetry(attempt)) {
                throw failure;
            }
            long delay = retryPolicy.delayMs(attempt - 1);
            if (failure.getStatusCode() == 403) {
                delay = Math.min(delay * 3, retryPolicy.getMaxDelayMs());
            }
            log.warn("{} attempt {}/{} failed ({}), retrying in {} ms",
                    name, attempt, retryPolicy.getMaxAttempts(), failure.getMessage(), delay);
            sleep(delay, name);
        }
    }

    /**
     * Google reports quota exhaustion as 403 with a reason in the error details.
     */
    static boolean isQuotaExceeded(HttpResponseException e) {
        if (e.getStatusCode() != 403 || !(e instanceof GoogleJsonResponseException)) {
            return false;
        }
        GoogleJsonError details = ((GoogleJsonResponseException) e).getDetails();
        if (details == null) {
            return false;
        }
        if (details.getErrors() != null) {
            for (GoogleJsonError.ErrorInfo info : details.getErrors()) {
                if (QUOTA_REASONS.contains(info.getReason())) {
                    return true;
                }
            }
        }
        return false;
    }

    private void sleep(long delayMs, String name) {
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(name + " interrupted during backoff", 0, false, e);
        }
    }
}
