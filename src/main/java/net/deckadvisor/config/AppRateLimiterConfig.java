package net.deckadvisor.config;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the catalog API rate limiter
 * - Keeps request volume inside the catalog provider's published limits
 * - Callers wait up to {@code rate-limit-wait} for a permit instead of failing immediately
 */
@Configuration
public class AppRateLimiterConfig {
    private static final Logger logger = LoggerFactory.getLogger(AppRateLimiterConfig.class);

    /**
     * Rate limiter for Scryfall
     *
     * @param properties catalog settings
     * @return Configured rate limiter instance
     */
    @Bean
    public RateLimiter scryfallRateLimiter(CatalogProperties properties) {
        RateLimiter rateLimiter = createCatalogRateLimiter(properties);
        logger.info("Scryfall rate limiter initialized with limit of {} requests/second (wait up to {})",
                properties.getRequestsPerSecond(), properties.getRateLimitWait());
        return rateLimiter;
    }

    static RateLimiter createCatalogRateLimiter(CatalogProperties properties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(properties.getRequestsPerSecond())
                .timeoutDuration(properties.getRateLimitWait())
                .build();
        return RateLimiter.of("scryfallCatalogRateLimiter", config);
    }
}
