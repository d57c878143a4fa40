package com.dnsfilter.api.config;

/**
 * Shared request counter consulted once per request before authentication.
 * Implementations must never block the caller.
 */
public interface RateLimiter {

    /**
     * Consumes one permit for the key.
     *
     * @return false when the key has exhausted its allowance
     */
    boolean tryAcquire(String key);

    /**
     * Forgets all state for the key.
     */
    void reset(String key);

    /**
     * Drops state for keys that have been idle long enough to be fully refilled.
     *
     * @return number of keys dropped
     */
    default int evictIdle() {
        return 0;
    }
}
