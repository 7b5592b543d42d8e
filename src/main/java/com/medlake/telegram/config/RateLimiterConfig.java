package com.medlake.telegram.config;

import com.google.common.util.concurrent.RateLimiter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RateLimiterConfig {

    @Value("${app.ratelimit.history-qps:0}")
    private double historyRateLimit;
    @Value("${app.ratelimit.detection-qps:0}")
    private double detectionRateLimit;

    /**
     * Shared limiter for history pages and media downloads; the source applies flood limits per session.
     */
    @Bean("historyRateLimiter")
    @SuppressWarnings("UnstableApiUsage")
    public RateLimiter historyRateLimiter() {
        return createOptionalLimiter(historyRateLimit);
    }

    @Bean("detectionRateLimiter")
    @SuppressWarnings("UnstableApiUsage")
    public RateLimiter detectionRateLimiter() {
        return createOptionalLimiter(detectionRateLimit);
    }

    private RateLimiter createOptionalLimiter(double qps) {
        double effectiveQps = qps > 0 ? qps : Double.MAX_VALUE;
        return RateLimiter.create(effectiveQps);
    }
}
