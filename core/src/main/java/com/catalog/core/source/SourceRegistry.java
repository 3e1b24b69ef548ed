package com.catalog.core.source;

import com.catalog.api.BlobStore;
import com.catalog.common.model.ConfigSource;
import com.catalog.common.model.HealthStatus;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Holds the subscribed config sources. Writers are serialized by one lock, readers work
 * on the last committed immutable snapshot and never block.
 */
public class SourceRegistry {
    private static final Logger logger = LoggerFactory.getLogger(SourceRegistry.class);
    public static final String STORE_KEY = "source_registry";

    /** Notified after every user-facing mutation (add/remove/enable/primary/priority). */
    @FunctionalInterface
    public interface Listener {
        void onRegistryChanged(String reason);
    }

    private final ReentrantLock writeLock = new ReentrantLock();
    private final List<Listener> listeners = new CopyOnWriteArrayList<>();
    private final BlobStore store;
    private final Gson gson;
    private volatile List<ConfigSource> snapshot = List.of();

    public SourceRegistry(BlobStore store) {
        this.store = store;
        this.gson = new GsonBuilder().setPrettyPrinting().create();
    }

    public void addListener(Listener listener) {
        listeners.add(listener);
    }

    /** Restores the persisted list; a missing or unreadable blob leaves the registry empty. */
    public void open() {
        if (store == null) return;
        try {
            Optional<String> blob = store.load(STORE_KEY);
            if (blob.isEmpty()) {
                logger.info("No persisted config sources found.");
                return;
            }
            List<ConfigSource> loaded = gson.fromJson(blob.get(), new TypeToken<List<ConfigSource>>() {}.getType());
            if (loaded != null) {
                writeLock.lock();
                try {
                    snapshot = List.copyOf(loaded);
                } finally {
                    writeLock.unlock();
                }
            }
            logger.info("📚 Restored {} config sources", snapshot.size());
        } catch (IOException | JsonParseException e) {
            logger.error("Failed to load config sources, starting empty", e);
        }
    }

    // --- Mutations ---

    public void add(ConfigSource source) {
        writeLock.lock();
        try {
            for (ConfigSource existing : snapshot) {
                if (existing.getId().equals(source.getId())) {
                    throw new DuplicateSourceException("Source id already registered: " + source.getId());
                }
                if (existing.getUrl().equals(source.getUrl())) {
                    throw new DuplicateSourceException("Source url already registered: " + source.getUrl()
                            + " (as " + existing.getId() + ")");
                }
            }
            List<ConfigSource> next = new ArrayList<>(snapshot);
            if (source.isPrimary()) {
                next.replaceAll(s -> s.isPrimary() ? s.withPrimary(false) : s);
            }
            next.add(source);
            commit(next);
        } finally {
            writeLock.unlock();
        }
        logger.info("➕ Source registered: {}", source);
        fireChanged("add " + source.getId());
    }

    public void remove(String id) {
        writeLock.lock();
        try {
            requireKnown(id);
            commit(snapshot.stream().filter(s -> !s.getId().equals(id)).collect(Collectors.toList()));
        } finally {
            writeLock.unlock();
        }
        logger.info("➖ Source removed: {}", id);
        fireChanged("remove " + id);
    }

    public void setEnabled(String id, boolean enabled) {
        update(id, s -> s.withEnabled(enabled));
        logger.info("Source {} {}", id, enabled ? "enabled" : "disabled");
        fireChanged((enabled ? "enable " : "disable ") + id);
    }

    /** Makes {@code id} the only primary source. */
    public void setPrimary(String id) {
        writeLock.lock();
        try {
            requireKnown(id);
            List<ConfigSource> next = new ArrayList<>(snapshot.size());
            for (ConfigSource s : snapshot) {
                next.add(s.withPrimary(s.getId().equals(id)));
            }
            commit(next);
        } finally {
            writeLock.unlock();
        }
        logger.info("⭐ Primary source is now {}", id);
        fireChanged("primary " + id);
    }

    public void setPriority(String id, int priority) {
        update(id, s -> s.withPriority(priority));
        fireChanged("priority " + id);
    }

    /**
     * Stores the outcome of a refresh. Does not notify listeners: refresh outcomes are a
     * product of aggregation, not a reason for another one.
     */
    public void recordFetchOutcome(String id, HealthStatus status, long fetchedAt) {
        writeLock.lock();
        try {
            if (find(id).isEmpty()) {
                logger.debug("Ignoring fetch outcome for removed source {}", id);
                return;
            }
            List<ConfigSource> next = new ArrayList<>(snapshot);
            next.replaceAll(s -> s.getId().equals(id) ? s.withHealth(status, fetchedAt) : s);
            commit(next);
        } finally {
            writeLock.unlock();
        }
    }

    // --- Reads (lock-free) ---

    public List<ConfigSource> snapshot() {
        return snapshot;
    }

    public List<ConfigSource> enabledSources() {
        return snapshot.stream().filter(ConfigSource::isEnabled).collect(Collectors.toUnmodifiableList());
    }

    public Optional<ConfigSource> find(String id) {
        return snapshot.stream().filter(s -> s.getId().equals(id)).findFirst();
    }

    public ConfigSource get(String id) {
        return find(id).orElseThrow(() -> new UnknownSourceException(id));
    }

    public Optional<ConfigSource> primary() {
        return snapshot.stream().filter(ConfigSource::isPrimary).findFirst();
    }

    public int size() {
        return snapshot.size();
    }

    // --- Internals ---

    private void update(String id, UnaryOperator<ConfigSource> change) {
        writeLock.lock();
        try {
            requireKnown(id);
            List<ConfigSource> next = new ArrayList<>(snapshot);
            next.replaceAll(s -> s.getId().equals(id) ? change.apply(s) : s);
            commit(next);
        } finally {
            writeLock.unlock();
        }
    }

    private void requireKnown(String id) {
        if (find(id).isEmpty()) throw new UnknownSourceException(id);
    }

    // caller holds writeLock
    private void commit(List<ConfigSource> next) {
        snapshot = List.copyOf(next);
        persist();
    }

    private void persist() {
        if (store == null) return;
        try {
            store.save(STORE_KEY, gson.toJson(snapshot));
        } catch (IOException e) {
            logger.error("Failed to persist config sources", e);
        }
    }

    private void fireChanged(String reason) {
        for (Listener l : listeners) {
            try {
                l.onRegistryChanged(reason);
            } catch (RuntimeException e) {
                logger.error("Registry listener failed for '{}'", reason, e);
            }
        }
    }
}
