package com.catalog.core.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * TTL cache with per-key single-flight rebuilds and stale fallback.
 * <p>
 * A rebuild that fails while an older payload exists returns that payload flagged
 * stale; without an older payload the producer's exception reaches the caller.
 * Invalidation only expires an entry, the payload stays available as fallback.
 */
public class CacheLayer {
    private static final Logger logger = LoggerFactory.getLogger(CacheLayer.class);

    /** Rebuilds a cache value, e.g. fetch+parse for fragments or aggregation for the directory. */
    @FunctionalInterface
    public interface Producer<T, E extends Exception> {
        T produce() throws E;
    }

    private final Clock clock;
    private final ConcurrentHashMap<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CompletableFuture<CacheEntry>> inFlight = new ConcurrentHashMap<>();
    // bumped by every invalidation, a rebuild that overlapped one must not be stored live
    private final ConcurrentHashMap<String, AtomicLong> generations = new ConcurrentHashMap<>();

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong staleServed = new AtomicLong();

    public CacheLayer(Clock clock) {
        this.clock = clock;
    }

    public <T, E extends Exception> CacheResult<T> get(String key, Duration ttl, Producer<T, E> producer) throws E {
        CacheEntry current = entries.get(key);
        if (current != null && current.isLive(clock.millis(), ttl)) {
            hits.incrementAndGet();
            return result(current, false, null);
        }
        misses.incrementAndGet();

        CompletableFuture<CacheEntry> mine = new CompletableFuture<>();
        CompletableFuture<CacheEntry> running = inFlight.putIfAbsent(key, mine);
        if (running != null) {
            logger.debug("Joining in-flight rebuild of {}", key);
            return await(key, running);
        }

        try {
            // jemand anderes war evtl. gerade fertig geworden
            CacheEntry again = entries.get(key);
            if (again != null && again != current && again.isLive(clock.millis(), ttl)) {
                mine.complete(again);
                return result(again, false, null);
            }

            long generation = generation(key);
            T value = producer.produce();
            boolean outdated = generation(key) != generation;
            CacheEntry fresh = new CacheEntry(key, value, clock.millis(), ttl, outdated);
            if (outdated) {
                logger.debug("Key {} was invalidated during rebuild, storing result as expired", key);
            }
            entries.put(key, fresh);
            mine.complete(fresh);
            return result(fresh, false, null);
        } catch (Exception e) {
            mine.completeExceptionally(e);
            return fallback(key, e);
        } catch (Error e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    private <T, E extends Exception> CacheResult<T> await(String key, CompletableFuture<CacheEntry> running) throws E {
        try {
            return result(running.get(), false, null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for rebuild of " + key);
        } catch (ExecutionException e) {
            return fallback(key, e.getCause());
        }
    }

    private <T, E extends Exception> CacheResult<T> fallback(String key, Throwable error) throws E {
        CacheEntry previous = entries.get(key);
        if (previous == null || error instanceof CancellationException) {
            throw CacheLayer.<E>rethrow(error);
        }
        staleServed.incrementAndGet();
        logger.warn("♻️ Rebuild of {} failed ({}), serving stale value from {}", key, error.getMessage(), previous.storedAt);
        return result(previous, true, error);
    }

    @SuppressWarnings("unchecked")
    private static <E extends Exception> E rethrow(Throwable t) throws E {
        if (t instanceof RuntimeException) throw (RuntimeException) t;
        if (t instanceof Error) throw (Error) t;
        throw (E) t;
    }

    @SuppressWarnings("unchecked")
    private static <T> CacheResult<T> result(CacheEntry entry, boolean stale, Throwable error) {
        return new CacheResult<>((T) entry.payload, stale, entry.storedAt, error);
    }

    /** Current invalidation generation of {@code key}, for use with {@link #put}. */
    public long generation(String key) {
        AtomicLong g = generations.get(key);
        return g == null ? 0L : g.get();
    }

    private void bump(String key) {
        generations.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
    }

    private void bumpMatching(Predicate<String> keyFilter) {
        entries.keySet().forEach(k -> {
            if (keyFilter.test(k)) bump(k);
        });
        inFlight.keySet().forEach(k -> {
            if (keyFilter.test(k)) bump(k);
        });
    }

    // --- Maintenance ---

    /**
     * Next {@link #get} rebuilds; the old payload stays as stale fallback. A rebuild already
     * running for the key still returns its value to its callers but is not kept as live.
     */
    public void invalidate(String key) {
        bump(key);
        entries.computeIfPresent(key, (k, e) -> e.markExpired());
    }

    public void invalidatePrefix(String prefix) {
        bumpMatching(k -> k.startsWith(prefix));
        entries.replaceAll((k, e) -> k.startsWith(prefix) ? e.markExpired() : e);
    }

    /** Drops every entry under the prefix, fallback payloads included. */
    public void removePrefix(String prefix) {
        removeIf(k -> k.startsWith(prefix));
    }

    public void removeIf(Predicate<String> keyFilter) {
        bumpMatching(keyFilter);
        entries.keySet().removeIf(keyFilter);
    }

    /**
     * Stores a value produced outside {@link #get}. If {@code key} was invalidated or removed
     * since {@code sinceGeneration} was read, the value is stored already expired.
     */
    public void put(String key, Object value, Duration ttl, long sinceGeneration) {
        boolean outdated = generation(key) != sinceGeneration;
        entries.put(key, new CacheEntry(key, value, clock.millis(), ttl, outdated));
    }

    /** Installs a restored value (e.g. from disk) as already expired. */
    public void seed(String key, Object payload, long storedAt, Duration ttl) {
        entries.putIfAbsent(key, new CacheEntry(key, payload, storedAt, ttl, true));
    }

    public <T> Optional<CacheResult<T>> peek(String key) {
        CacheEntry e = entries.get(key);
        if (e == null) return Optional.empty();
        boolean live = e.isLive(clock.millis(), e.ttl);
        return Optional.of(result(e, !live, null));
    }

    public void remove(String key) {
        bump(key);
        entries.remove(key);
    }

    public void clear() {
        generations.values().forEach(AtomicLong::incrementAndGet);
        inFlight.keySet().forEach(this::bump);
        entries.clear();
    }

    // --- Stats ---

    public long getHits() { return hits.get(); }
    public long getMisses() { return misses.get(); }
    public long getStaleServed() { return staleServed.get(); }

    public double getHitRate() {
        long total = hits.get() + misses.get();
        return total == 0 ? 0.0 : (double) hits.get() / total;
    }
}
