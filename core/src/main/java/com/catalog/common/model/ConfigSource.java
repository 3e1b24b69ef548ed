package com.catalog.common.model;

import java.util.Objects;

/**
 * Ein abonnierter Konfigurations-Feed (config source).
 * Immutable: the registry swaps instances on every mutation.
 */
public final class ConfigSource {
    private final String id;
    private final String url;
    private final String name;
    private final int priority;
    private final boolean enabled;
    private final boolean primary;
    private final long lastFetchedAt;
    private final HealthStatus healthStatus;

    public ConfigSource(String id, String url, String name, int priority, boolean enabled,
                        boolean primary, long lastFetchedAt, HealthStatus healthStatus) {
        this.id = Objects.requireNonNull(id, "id");
        this.url = Objects.requireNonNull(url, "url");
        this.name = name != null ? name : id;
        this.priority = priority;
        this.enabled = enabled;
        this.primary = primary;
        this.lastFetchedAt = lastFetchedAt;
        this.healthStatus = healthStatus != null ? healthStatus : HealthStatus.UNKNOWN;
    }

    /** Fresh, enabled, non-primary source that was never fetched. */
    public static ConfigSource of(String id, String url, String name, int priority) {
        return new ConfigSource(id, url, name, priority, true, false, 0L, HealthStatus.UNKNOWN);
    }

    public String getId() { return id; }
    public String getUrl() { return url; }
    public String getName() { return name; }
    public int getPriority() { return priority; }
    public boolean isEnabled() { return enabled; }
    public boolean isPrimary() { return primary; }
    public long getLastFetchedAt() { return lastFetchedAt; }
    public HealthStatus getHealthStatus() { return healthStatus; }

    public ConfigSource withEnabled(boolean value) {
        return new ConfigSource(id, url, name, priority, value, primary, lastFetchedAt, healthStatus);
    }

    public ConfigSource withPrimary(boolean value) {
        return new ConfigSource(id, url, name, priority, enabled, value, lastFetchedAt, healthStatus);
    }

    public ConfigSource withPriority(int value) {
        return new ConfigSource(id, url, name, value, enabled, primary, lastFetchedAt, healthStatus);
    }

    public ConfigSource withHealth(HealthStatus status, long fetchedAt) {
        return new ConfigSource(id, url, name, priority, enabled, primary, fetchedAt, status);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConfigSource)) return false;
        ConfigSource that = (ConfigSource) o;
        return priority == that.priority && enabled == that.enabled && primary == that.primary
                && lastFetchedAt == that.lastFetchedAt && id.equals(that.id) && url.equals(that.url)
                && name.equals(that.name) && healthStatus == that.healthStatus;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, url, name, priority, enabled, primary, lastFetchedAt, healthStatus);
    }

    @Override
    public String toString() {
        return "ConfigSource[" + id + " " + url + " prio=" + priority
                + (primary ? " primary" : "") + (enabled ? "" : " disabled") + " " + healthStatus + "]";
    }
}
