package com.catalog.core.plugin;

import com.catalog.api.ResolverPlugin;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Registry slot for one plugin id. Descriptor and state never change; a reload creates
 * a new entry. The lease counter tracks resolutions currently using the plugin.
 */
public final class PluginEntry {
    private final PluginDescriptor descriptor;
    private final LoadState state;
    private final ResolverPlugin plugin;
    private final long loadedAt;
    private final AtomicInteger leases = new AtomicInteger();
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile boolean retired;

    PluginEntry(PluginDescriptor descriptor, LoadState state, ResolverPlugin plugin, long loadedAt) {
        this.descriptor = descriptor;
        this.state = state;
        this.plugin = plugin;
        this.loadedAt = loadedAt;
    }

    public PluginDescriptor getDescriptor() { return descriptor; }
    public LoadState getState() { return state; }
    public ResolverPlugin getPlugin() { return plugin; }
    public long getLoadedAt() { return loadedAt; }
    public int getActiveLeases() { return leases.get(); }
    public boolean isRetired() { return retired; }

    public String getId() {
        return descriptor.getId();
    }

    void acquire() {
        leases.incrementAndGet();
    }

    /** @return true if this release was the last one of a retired plugin */
    boolean release() {
        return leases.decrementAndGet() == 0 && retired;
    }

    /** @return true if nobody holds a lease, i.e. the plugin may be closed right away */
    boolean retire() {
        retired = true;
        return leases.get() == 0;
    }

    /** Release and retire can both see zero leases; only the first caller closes. */
    boolean markClosed() {
        return closed.compareAndSet(false, true);
    }
}
