package ocsphealth.config;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ResilienceConfig {

    // resilience4j rejects refresh periods shorter than this
    private static final Duration SHORTEST_REFRESH_PERIOD = Duration.ofNanos(1);

    /**
     * One certificate intelligence call per {@code min-interval}. Callers wait up to two periods for their turn.
     */
    @Bean
    public RateLimiter censysRateLimiter(AppProperties appProperties) {
        final Duration minInterval = appProperties.censys().minInterval();
        final Duration period = minInterval.compareTo(SHORTEST_REFRESH_PERIOD) < 0 ?
            SHORTEST_REFRESH_PERIOD : minInterval;
        return RateLimiter.of("censys", RateLimiterConfig.custom()
            .limitForPeriod(1)
            .limitRefreshPeriod(period)
            .timeoutDuration(period.multipliedBy(2))
            .build());
    }
}
