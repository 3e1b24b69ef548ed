package com.catalog.core.cache;

import java.util.Optional;

/**
 * Value handed out by the {@link CacheLayer}. {@code stale} marks a previous payload
 * served because the rebuild failed; {@link #getRebuildError()} then says why.
 */
public final class CacheResult<T> {
    private final T payload;
    private final boolean stale;
    private final long storedAt;
    private final Throwable rebuildError;

    CacheResult(T payload, boolean stale, long storedAt, Throwable rebuildError) {
        this.payload = payload;
        this.stale = stale;
        this.storedAt = storedAt;
        this.rebuildError = rebuildError;
    }

    public T getPayload() { return payload; }
    public boolean isStale() { return stale; }
    public long getStoredAt() { return storedAt; }
    public Optional<Throwable> getRebuildError() { return Optional.ofNullable(rebuildError); }
}
