package com.dnsfilter.api.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically drops idle rate-limit buckets so the key space stays bounded
 * by recently active clients.
 */
@Component
public class RateLimiterEviction {

    private static final Logger log = LoggerFactory.getLogger(RateLimiterEviction.class);

    private final RateLimiter rateLimiter;

    public RateLimiterEviction(RateLimiter rateLimiter) {
        this.rateLimiter = rateLimiter;
    }

    @Scheduled(fixedRateString = "${dnsfilter.ratelimit.eviction-interval:PT5M}")
    public void evictIdleBuckets() {
        int removed = rateLimiter.evictIdle();
        if (removed > 0) {
            log.debug("Evicted {} idle rate-limit buckets", removed);
        }
    }
}
