package com.dnsfilter.api.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Rate limiting configuration using Bucket4j.
 *
 * Buckets are keyed by request surface and client IP. Defaults allow 60
 * requests per minute per key.
 */
@Configuration
public class RateLimitConfig {

    private static final Logger log = LoggerFactory.getLogger(RateLimitConfig.class);

    @Bean
    public RateLimiter rateLimiter(
            @Value("${dnsfilter.ratelimit.enabled:true}") boolean enabled,
            @Value("${dnsfilter.ratelimit.capacity:60}") long capacity,
            @Value("${dnsfilter.ratelimit.period:PT1M}") Duration period) {
        if (!enabled) {
            log.warn("Rate limiting is disabled");
            return new RateLimiter() {
                @Override
                public boolean tryAcquire(String key) {
                    return true;
                }

                @Override
                public void reset(String key) {
                    // nothing tracked
                }
            };
        }
        log.info("Rate limiting {} requests per {} per client", capacity, period);
        return new BucketRateLimiter(capacity, period);
    }
}
