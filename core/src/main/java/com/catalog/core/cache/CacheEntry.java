package com.catalog.core.cache;

import java.time.Duration;

/** Stored value plus bookkeeping. Replaced, never mutated. */
final class CacheEntry {
    final String key;
    final Object payload;
    final long storedAt;
    final Duration ttl;
    final boolean expired;

    CacheEntry(String key, Object payload, long storedAt, Duration ttl, boolean expired) {
        this.key = key;
        this.payload = payload;
        this.storedAt = storedAt;
        this.ttl = ttl;
        this.expired = expired;
    }

    boolean isLive(long now, Duration wantedTtl) {
        return !expired && now - storedAt < wantedTtl.toMillis();
    }

    CacheEntry markExpired() {
        return expired ? this : new CacheEntry(key, payload, storedAt, ttl, true);
    }
}
