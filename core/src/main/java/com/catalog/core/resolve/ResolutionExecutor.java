package com.catalog.core.resolve;

import com.catalog.api.ResolveRequest;
import com.catalog.common.model.AggregatedSiteEntry;
import com.catalog.common.model.ResolveHint;
import com.catalog.common.model.ResolvedStream;
import com.catalog.core.cache.CacheLayer;
import com.catalog.core.cache.CacheResult;
import com.catalog.core.config.Configuration;
import com.catalog.core.plugin.PluginDescriptor;
import com.catalog.core.plugin.ResolverRegistry;
import com.catalog.services.stats.StatisticsManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Walks the fallback chain of resolver plugins for one entry until one of them returns a
 * stream. Attempts run strictly one after another; each plugin call runs on the plugin
 * executor so it can be bounded by a timeout.
 * <p>
 * With a {@link CacheLayer} attached, successful streams are remembered per entry and plugin.
 * Plugin settings {@code cacheExpiryMinutes} and {@code timeoutMs} override the defaults;
 * an expiry of 0 turns caching off for that plugin.
 */
public class ResolutionExecutor {
    private static final Logger logger = LoggerFactory.getLogger(ResolutionExecutor.class);

    public static final String CACHE_KEY_PREFIX = "resolve:";
    public static final String SETTING_CACHE_EXPIRY = "cacheExpiryMinutes";
    public static final String SETTING_TIMEOUT = "timeoutMs";

    private final ResolverRegistry registry;
    private final ExecutorService pluginExecutor;
    private final StatisticsManager stats;
    private final Duration attemptTimeout;
    private final CacheLayer cache;
    private final Configuration config;

    public ResolutionExecutor(ResolverRegistry registry, ExecutorService pluginExecutor,
                              StatisticsManager stats, Duration attemptTimeout) {
        this(registry, pluginExecutor, stats, attemptTimeout, null, null);
    }

    public ResolutionExecutor(ResolverRegistry registry, ExecutorService pluginExecutor,
                              StatisticsManager stats, Duration attemptTimeout,
                              CacheLayer cache, Configuration config) {
        this.registry = registry;
        this.pluginExecutor = pluginExecutor;
        this.stats = stats;
        this.attemptTimeout = attemptTimeout;
        this.cache = cache;
        this.config = config;
    }

    public static String cacheKey(String entryKey, String pluginId) {
        return CACHE_KEY_PREFIX + entryKey + ":" + pluginId;
    }

    /**
     * Resolves {@code entry}. Exhausting the chain is a normal result, not an exception.
     * If the calling thread is interrupted the running attempt completes and the result is
     * CANCELLED; the interrupt flag stays set.
     *
     * @throws NoResolverAvailableException if no loaded plugin is eligible
     */
    public ResolutionResult resolve(AggregatedSiteEntry entry, ResolveHint hint) {
        List<String> chain = buildChain(entry, hint);
        if (chain.isEmpty()) {
            throw new NoResolverAvailableException(entry.getKey());
        }
        logger.debug("Resolving {} via {}", entry.getKey(), chain);

        Optional<ResolutionResult> cached = fromCache(entry, chain);
        if (cached.isPresent()) return cached.get();

        ResolveRequest request = new ResolveRequest(entry, hint);
        List<ResolutionAttempt> attempts = new ArrayList<>();
        ResolutionState state = ResolutionState.PENDING;

        for (String pluginId : chain) {
            if (Thread.currentThread().isInterrupted()) {
                state = ResolutionState.CANCELLED;
                break;
            }
            Optional<ResolverRegistry.Lease> lease = registry.acquire(pluginId);
            if (lease.isEmpty()) {
                logger.debug("Plugin {} was unloaded before its turn, skipping", pluginId);
                continue;
            }

            state = ResolutionState.ATTEMPTING;
            String key = cacheKey(entry.getKey(), pluginId);
            long generation = cache == null ? 0L : cache.generation(key);
            AttemptRun run;
            try (ResolverRegistry.Lease l = lease.get()) {
                run = attempt(l, request);
            }
            attempts.add(run.attempt);
            logger.debug("Attempt {} for {}: {} after {} ms ({} tries)", pluginId, entry.getKey(),
                    run.attempt.outcome(), run.attempt.elapsedMs(), run.attempt.tries());

            if (run.stream != null) {
                remember(key, pluginId, run.stream, generation);
                stats.recordResolution(true);
                logger.info("▶️ Resolved {} with {}", entry.getKey(), pluginId);
                return new ResolutionResult(entry.getKey(), ResolutionState.SUCCEEDED, attempts, run.stream);
            }
        }

        if (state == ResolutionState.CANCELLED || Thread.currentThread().isInterrupted()) {
            logger.info("Resolution of {} cancelled after {} attempt(s)", entry.getKey(), attempts.size());
            return new ResolutionResult(entry.getKey(), ResolutionState.CANCELLED, attempts, null);
        }
        stats.recordResolution(false);
        logger.warn("❌ No resolver could handle {} ({} attempt(s))", entry.getKey(), attempts.size());
        return new ResolutionResult(entry.getKey(), ResolutionState.EXHAUSTED, attempts, null);
    }

    // --- Result cache ---

    private Optional<ResolutionResult> fromCache(AggregatedSiteEntry entry, List<String> chain) {
        if (cache == null) return Optional.empty();
        for (String pluginId : chain) {
            Optional<CacheResult<ResolvedStream>> hit = cache.peek(cacheKey(entry.getKey(), pluginId));
            if (hit.isEmpty() || hit.get().isStale()) continue;
            ResolvedStream stream = hit.get().getPayload();
            stats.recordResolution(true);
            logger.info("▶️ Resolved {} from cache ({})", entry.getKey(), pluginId);
            ResolutionAttempt attempt = new ResolutionAttempt(pluginId, AttemptOutcome.CACHED, 0, 0, stream.primaryUrl());
            return Optional.of(new ResolutionResult(entry.getKey(), ResolutionState.SUCCEEDED, List.of(attempt), stream));
        }
        return Optional.empty();
    }

    private void remember(String key, String pluginId, ResolvedStream stream, long generation) {
        if (cache == null) return;
        long minutes = pluginSetting(pluginId, SETTING_CACHE_EXPIRY,
                config == null ? 60 : config.resolveCacheMinutes);
        if (minutes <= 0) return;
        cache.put(key, stream, Duration.ofMinutes(minutes), generation);
    }

    /** Drops cached streams of one plugin, e.g. after it was replaced or unloaded. */
    public void forgetPlugin(String pluginId) {
        if (cache == null) return;
        String suffix = ":" + pluginId;
        cache.removeIf(k -> k.startsWith(CACHE_KEY_PREFIX) && k.endsWith(suffix));
    }

    public void clearCache() {
        if (cache == null) return;
        cache.removePrefix(CACHE_KEY_PREFIX);
        logger.info("🧹 Resolution cache cleared");
    }

    Duration timeoutFor(String pluginId) {
        long ms = pluginSetting(pluginId, SETTING_TIMEOUT, attemptTimeout.toMillis());
        return ms > 0 ? Duration.ofMillis(ms) : attemptTimeout;
    }

    private long pluginSetting(String pluginId, String key, long fallback) {
        if (config == null) return fallback;
        String raw = config.getPluginSetting(pluginId, key, null);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring invalid setting {}={} of plugin {}", key, raw, pluginId);
            return fallback;
        }
    }

    /** Explicit hint first, then the entry's own hint, then plugins matching the entry format. */
    List<String> buildChain(AggregatedSiteEntry entry, ResolveHint hint) {
        List<String> requested;
        if (hint != null && hint.hasFallbackParsers()) {
            requested = hint.getFallbackParsers();
        } else if (entry.getSite().getHint().hasFallbackParsers()) {
            requested = entry.getSite().getHint().getFallbackParsers();
        } else {
            requested = registry.candidatesFor(entry.getKind()).stream()
                    .map(PluginDescriptor::getId)
                    .collect(Collectors.toList());
        }
        Set<String> chain = new LinkedHashSet<>();
        for (String id : requested) {
            if (registry.isLoaded(id)) {
                chain.add(id);
            } else {
                logger.debug("Skipping resolver {} for {}: not loaded", id, entry.getKey());
            }
        }
        return new ArrayList<>(chain);
    }

    // --- Single attempt ---

    private static final class AttemptRun {
        final ResolutionAttempt attempt;
        final ResolvedStream stream;

        AttemptRun(ResolutionAttempt attempt, ResolvedStream stream) {
            this.attempt = attempt;
            this.stream = stream;
        }
    }

    /**
     * Calls the plugin, once more if the first call timed out. An interrupt of the calling
     * thread does not abort the running call; it is restored once the attempt is over.
     */
    private AttemptRun attempt(ResolverRegistry.Lease lease, ResolveRequest request) {
        String pluginId = lease.descriptor().getId();
        Duration timeout = timeoutFor(pluginId);
        long start = System.nanoTime();
        boolean interrupted = false;
        int tries = 0;
        AttemptOutcome outcome;
        String message;
        ResolvedStream stream = null;

        while (true) {
            tries++;
            Future<Optional<ResolvedStream>> future = pluginExecutor.submit(() -> lease.plugin().resolve(request));
            long deadline = System.nanoTime() + timeout.toNanos();
            Optional<ResolvedStream> result = null;
            Throwable failure = null;
            boolean timedOut = false;
            while (true) {
                try {
                    result = future.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
                    break;
                } catch (InterruptedException e) {
                    interrupted = true;
                } catch (TimeoutException e) {
                    future.cancel(true);
                    timedOut = true;
                    break;
                } catch (ExecutionException e) {
                    failure = e.getCause() != null ? e.getCause() : e;
                    break;
                }
            }

            if (timedOut) {
                outcome = AttemptOutcome.TIMEOUT;
                message = "timed out after " + timeout.toMillis() + " ms";
            } else if (failure != null) {
                outcome = AttemptOutcome.ERROR;
                message = failure.getClass().getSimpleName() + ": " + failure.getMessage();
                logger.warn("Resolver {} failed for {}: {}", pluginId, request.entry().getKey(), message);
            } else if (result != null && result.isPresent()) {
                outcome = AttemptOutcome.SUCCESS;
                stream = result.get();
                message = stream.primaryUrl();
            } else {
                outcome = AttemptOutcome.NO_MATCH;
                message = "no stream for " + request.entry().getKey();
            }

            // Zweiter Versuch nur bei Timeout
            if (outcome != AttemptOutcome.TIMEOUT || tries >= 2 || interrupted) break;
            logger.debug("Resolver {} timed out, retrying once", pluginId);
        }

        if (interrupted) Thread.currentThread().interrupt();
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        return new AttemptRun(new ResolutionAttempt(pluginId, outcome, elapsedMs, tries, message), stream);
    }
}
