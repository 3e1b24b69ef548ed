package com.catalog.core.plugin;

import com.catalog.api.ResolverPlugin;
import com.catalog.common.model.SiteKind;
import com.catalog.common.util.Checksums;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Holds the resolver plugins that passed checksum validation. Loading and unloading are
 * serialized; lookups read the concurrent index without locking.
 *
 * <p>A plugin in use by a resolution is protected by a {@link Lease}: unloading removes it
 * from selection immediately but {@link ResolverPlugin#close()} only runs once the last
 * lease is released.
 */
public class ResolverRegistry implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ResolverRegistry.class);

    public static final Comparator<PluginDescriptor> SELECTION_ORDER =
            Comparator.comparingInt(PluginDescriptor::getPriority).reversed()
                    .thenComparing(PluginDescriptor::getId);

    private final ResolverFactory factory;
    private final Map<String, PluginEntry> loaded = new ConcurrentHashMap<>();
    private final Map<String, PluginEntry> rejected = new ConcurrentHashMap<>();
    // every descriptor that ever failed validation, per plugin id
    private final Map<String, Set<PluginDescriptor>> frozen = new ConcurrentHashMap<>();
    private final Object writeLock = new Object();

    public ResolverRegistry(ResolverFactory factory) {
        this.factory = factory;
    }

    // --- Loading ---

    /**
     * Validates {@code bytes} against the descriptor checksum and registers the plugin.
     * A descriptor that was rejected once stays rejected; a successful load under an
     * existing id replaces the previous plugin.
     *
     * @throws PluginChecksumException on mismatch or for a previously rejected descriptor
     * @throws PluginLoadException if the factory cannot build the plugin
     */
    public PluginDescriptor load(PluginDescriptor descriptor, byte[] bytes) {
        String id = descriptor.getId();
        synchronized (writeLock) {
            if (frozen.getOrDefault(id, Set.of()).contains(descriptor)) {
                logger.warn("⛔ Plugin {} was rejected before, refusing to load it again", id);
                throw new PluginChecksumException(id, "Plugin " + id + " was rejected earlier (checksum mismatch)");
            }

            if (!Checksums.matches(descriptor.getChecksum(), bytes)) {
                rejected.put(id, new PluginEntry(descriptor, LoadState.REJECTED, null, System.currentTimeMillis()));
                frozen.computeIfAbsent(id, k -> ConcurrentHashMap.newKeySet()).add(descriptor);
                logger.error("⛔ Checksum mismatch for plugin {} ({} bytes)", id, bytes == null ? 0 : bytes.length);
                throw new PluginChecksumException(id, "Checksum mismatch for plugin " + id);
            }

            ResolverPlugin plugin;
            try {
                plugin = factory.create(descriptor, bytes);
            } catch (PluginLoadException e) {
                throw e;
            } catch (Exception e) {
                throw new PluginLoadException("Failed to instantiate plugin " + id, e);
            }
            if (plugin == null) {
                throw new PluginLoadException("Factory returned no plugin for " + id, null);
            }

            rejected.remove(id);
            PluginEntry entry = new PluginEntry(descriptor, LoadState.LOADED, plugin, System.currentTimeMillis());
            PluginEntry replaced = loaded.put(id, entry);
            if (replaced != null) {
                logger.info("♻️ Replacing plugin {} v{}", id, replaced.getDescriptor().getVersion());
                retire(replaced);
            }
            logger.info("🔌 Loaded resolver plugin {} v{} (formats {}, priority {})",
                    id, descriptor.getVersion(), descriptor.getSupportedFormats(), descriptor.getPriority());
            return descriptor;
        }
    }

    /**
     * Removes the plugin from selection. Resolutions holding a lease finish normally.
     *
     * @return false if no plugin with that id was loaded
     */
    public boolean unload(String id) {
        PluginEntry entry;
        synchronized (writeLock) {
            entry = loaded.remove(id);
        }
        if (entry == null) {
            logger.warn("Cannot unload unknown plugin: {}", id);
            return false;
        }
        retire(entry);
        logger.info("🗑️ Plugin {} unloaded ({} active leases)", id, entry.getActiveLeases());
        return true;
    }

    private void retire(PluginEntry entry) {
        if (entry.retire()) {
            closeQuietly(entry);
        }
    }

    private void closeQuietly(PluginEntry entry) {
        if (!entry.markClosed()) return;
        try {
            entry.getPlugin().close();
        } catch (Exception e) {
            logger.warn("Error while closing plugin {}", entry.getId(), e);
        }
    }

    // --- Leases ---

    /**
     * Pins a loaded plugin for the duration of one attempt.
     *
     * @return empty if the id is not loaded (unknown, rejected or already unloaded)
     */
    public Optional<Lease> acquire(String id) {
        PluginEntry entry = loaded.get(id);
        if (entry == null) return Optional.empty();
        entry.acquire();
        if (entry.isRetired()) {
            // unload raced us
            release(entry);
            return Optional.empty();
        }
        return Optional.of(new Lease(entry));
    }

    private void release(PluginEntry entry) {
        if (entry.release()) {
            logger.debug("Last lease released, closing plugin {}", entry.getId());
            closeQuietly(entry);
        }
    }

    public final class Lease implements AutoCloseable {
        private final PluginEntry entry;
        private boolean released;

        private Lease(PluginEntry entry) {
            this.entry = entry;
        }

        public ResolverPlugin plugin() {
            return entry.getPlugin();
        }

        public PluginDescriptor descriptor() {
            return entry.getDescriptor();
        }

        @Override
        public void close() {
            if (released) return;
            released = true;
            release(entry);
        }
    }

    // --- Queries ---

    public boolean isLoaded(String id) {
        return loaded.containsKey(id);
    }

    /** Current state for {@code id}; empty if the id was never seen. */
    public Optional<LoadState> state(String id) {
        if (loaded.containsKey(id)) return Optional.of(LoadState.LOADED);
        if (rejected.containsKey(id)) return Optional.of(LoadState.REJECTED);
        return Optional.empty();
    }

    public List<PluginDescriptor> loaded() {
        return loaded.values().stream()
                .map(PluginEntry::getDescriptor)
                .sorted(SELECTION_ORDER)
                .collect(Collectors.toList());
    }

    /** Loaded plugins accepting the kind's format (or "*"), highest priority first. */
    public List<PluginDescriptor> candidatesFor(SiteKind kind) {
        String format = kind.getFormat();
        return loaded.values().stream()
                .map(PluginEntry::getDescriptor)
                .filter(d -> d.supports(format))
                .sorted(SELECTION_ORDER)
                .collect(Collectors.toList());
    }

    public int size() {
        return loaded.size();
    }

    @Override
    public void close() {
        for (String id : new ArrayList<>(loaded.keySet())) {
            unload(id);
        }
    }
}
