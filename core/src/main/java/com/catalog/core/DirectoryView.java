package com.catalog.core;

import com.catalog.common.model.AggregatedDirectory;

import java.util.Optional;

/**
 * Directory handed out by {@link Kernel#getDirectory(boolean)}. {@code stale} means the last
 * refresh failed and this is an older snapshot; {@link #getRefreshError()} says why.
 */
public final class DirectoryView {
    private final AggregatedDirectory directory;
    private final boolean stale;
    private final long storedAt;
    private final Throwable refreshError;

    public DirectoryView(AggregatedDirectory directory, boolean stale, long storedAt, Throwable refreshError) {
        this.directory = directory;
        this.stale = stale;
        this.storedAt = storedAt;
        this.refreshError = refreshError;
    }

    public AggregatedDirectory getDirectory() { return directory; }
    public boolean isStale() { return stale; }
    public long getStoredAt() { return storedAt; }

    public Optional<Throwable> getRefreshError() {
        return Optional.ofNullable(refreshError);
    }
}
