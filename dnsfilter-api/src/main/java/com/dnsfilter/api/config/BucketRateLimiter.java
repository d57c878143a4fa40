package com.dnsfilter.api.config;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory token buckets, one per key, all with the same bandwidth.
 *
 * A bucket left untouched for a whole period has refilled completely, so
 * dropping it is indistinguishable from keeping it.
 */
public class BucketRateLimiter implements RateLimiter {

    private final Map<String, TrackedBucket> buckets = new ConcurrentHashMap<>();
    private final long capacity;
    private final Duration period;
    private final Clock clock;

    public BucketRateLimiter(long capacity, Duration period) {
        this(capacity, period, Clock.systemUTC());
    }

    BucketRateLimiter(long capacity, Duration period, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Rate limit capacity must be positive");
        }
        if (period == null || period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("Rate limit period must be positive");
        }
        this.capacity = capacity;
        this.period = period;
        this.clock = clock;
    }

    @Override
    public boolean tryAcquire(String key) {
        TrackedBucket tracked = buckets.computeIfAbsent(key, this::createBucket);
        tracked.lastAccess = clock.instant();
        return tracked.bucket.tryConsume(1);
    }

    @Override
    public void reset(String key) {
        buckets.remove(key);
    }

    @Override
    public int evictIdle() {
        Instant cutoff = clock.instant().minus(period);
        int removed = 0;
        Iterator<Map.Entry<String, TrackedBucket>> it = buckets.entrySet().iterator();
        while (it.hasNext()) {
            if (it.next().getValue().lastAccess.isBefore(cutoff)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    int trackedKeys() {
        return buckets.size();
    }

    private TrackedBucket createBucket(String key) {
        Bandwidth limit = Bandwidth.classic(capacity, Refill.greedy(capacity, period));
        return new TrackedBucket(Bucket.builder().addLimit(limit).build(), clock.instant());
    }

    private static final class TrackedBucket {
        private final Bucket bucket;
        private volatile Instant lastAccess;

        private TrackedBucket(Bucket bucket, Instant lastAccess) {
            this.bucket = bucket;
            this.lastAccess = lastAccess;
        }
    }
}
