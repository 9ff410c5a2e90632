package omni.sync.app.service.provider;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import lombok.extern.slf4j.Slf4j;
import omni.sync.app.config.ProviderProperties;
import omni.sync.app.entity.Provider;
import omni.sync.app.exception.ProviderException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Rate limiter and circuit breaker per (user, provider), so one user's quota or outage
 * never throttles another user's sync.
 */
@Slf4j
@Component
public class ProviderCallGuards {
    private final RateLimiterRegistry rateLimiters = RateLimiterRegistry.ofDefaults();
    private final CircuitBreakerRegistry circuitBreakers = CircuitBreakerRegistry.ofDefaults();
    private final Map<Provider, RateLimiterConfig> limiterConfigs = new EnumMap<>(Provider.class);
    private final CircuitBreakerConfig breakerConfig;

    public ProviderCallGuards(ProviderProperties properties) {
        Duration timeout = properties.getLimiterTimeout();
        limiterConfigs.put(Provider.MAIL, limiterConfig(properties.getMailPermitsPerMinute(), timeout));
        limiterConfigs.put(Provider.CALENDAR, limiterConfig(properties.getCalendarPermitsPerMinute(), timeout));

        int threshold = Math.max(1, properties.getCircuitBreaker().getFailureThreshold());
        this.breakerConfig = CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(threshold)
                .minimumNumberOfCalls(threshold)
                .failureRateThreshold(100.0f)
                .waitDurationInOpenState(properties.getCircuitBreaker().getOpenDuration())
                .permittedNumberOfCallsInHalfOpenState(1)
                .recordException(ProviderCallGuards::isProviderFault)
                .build();
    }

    private static RateLimiterConfig limiterConfig(int permitsPerMinute, Duration timeout) {
        return RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .limitForPeriod(Math.max(1, permitsPerMinute))
                .timeoutDuration(timeout)
                .build();
    }

    // 401, 404 and the like mean the provider answered; only outages and throttling count.
    static boolean isProviderFault(Throwable error) {
        if (error instanceof ProviderException) {
            return ((ProviderException) error).isRetryable();
        }
        return true;
    }

    public RateLimiter rateLimiter(String userId, Provider provider) {
        return rateLimiters.rateLimiter(key(userId, provider), limiterConfigs.get(provider));
    }

    public CircuitBreaker circuitBreaker(String userId, Provider provider) {
        return circuitBreakers.circuitBreaker(key(userId, provider), breakerConfig);
    }

    private static String key(String userId, Provider provider) {
        return userId + ":" + provider.getWireName();
    }
}
