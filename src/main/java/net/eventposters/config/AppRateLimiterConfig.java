/**
 * Configuration for API rate limiters
 * - Configures the rate limiter for the image search API
 * - Prevents exceeding the provider's hourly quota during variant batches
 */
package net.eventposters.config;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class AppRateLimiterConfig {
    private static final Logger logger = LoggerFactory.getLogger(AppRateLimiterConfig.class);

    /**
     * Rate limiter for the image search API
     * - Denied permits are not queued: the caller falls back to the white canvas
     *
     * @param posterProperties poster configuration holding the per-minute limit
     * @return Configured rate limiter instance
     */
    @Bean
    public RateLimiter imageSearchRateLimiter(PosterProperties posterProperties) {
        int limitPerMinute = Math.max(1, posterProperties.getSearch().getRequestsPerMinute());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .limitForPeriod(limitPerMinute)
                .timeoutDuration(Duration.ZERO)
                .build();

        RateLimiter rateLimiter = RateLimiter.of("imageSearchRateLimiter", config);

        logger.info("Image search rate limiter initialized with limit of {} requests per minute", limitPerMinute);

        return rateLimiter;
    }
}
