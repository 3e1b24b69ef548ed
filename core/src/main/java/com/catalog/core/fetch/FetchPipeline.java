package com.catalog.core.fetch;

import com.catalog.api.HttpFetcher;
import com.catalog.common.model.CatalogFragment;
import com.catalog.common.model.ConfigSource;
import com.catalog.common.model.HealthStatus;
import com.catalog.core.source.SourceRegistry;
import com.catalog.services.stats.StatisticsManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Downloads one config source and parses it into a fragment, updating the source's
 * health and fetch history on the way.
 */
public class FetchPipeline {
    private static final Logger logger = LoggerFactory.getLogger(FetchPipeline.class);

    private final HttpFetcher fetcher;
    private final FragmentParser parser;
    private final SourceRegistry registry;
    private final FetchHistory history;
    private final StatisticsManager stats;
    private final Clock clock;
    private final int failureThreshold;
    private final ExecutorService ioExecutor;

    public FetchPipeline(HttpFetcher fetcher, FragmentParser parser, SourceRegistry registry,
                         FetchHistory history, StatisticsManager stats, Clock clock,
                         int failureThreshold, ExecutorService ioExecutor) {
        this.fetcher = fetcher;
        this.parser = parser;
        this.registry = registry;
        this.history = history;
        this.stats = stats;
        this.clock = clock;
        this.failureThreshold = failureThreshold;
        this.ioExecutor = ioExecutor;
    }

    public FetchHistory getHistory() {
        return history;
    }

    /**
     * @throws SourceFetchException network error, HTTP error or timeout
     * @throws SourceParseException payload is not a valid catalog
     */
    public CatalogFragment fetchAndParse(ConfigSource source, Duration timeout) throws SourceException {
        long started = System.nanoTime();
        try {
            byte[] raw = download(source, timeout);
            CatalogFragment fragment = parser.parse(source.getId(), source.getUrl(), raw, clock.millis());
            onSuccess(source, elapsedMs(started));
            logger.info("📥 Source {}: {} sites, {} parsers, {} lives",
                    source.getId(), fragment.getSites().size(), fragment.getResolvers().size(), fragment.getLives().size());
            return fragment;
        } catch (SourceException e) {
            if (!Thread.currentThread().isInterrupted()) {
                onFailure(source, elapsedMs(started), e);
            }
            throw e;
        }
    }

    private byte[] download(ConfigSource source, Duration timeout) throws SourceFetchException {
        AtomicBoolean claimed = new AtomicBoolean(false);
        CompletableFuture<Void> settled = new CompletableFuture<>();
        Future<byte[]> future = ioExecutor.submit(() -> {
            if (!claimed.compareAndSet(false, true)) return null; // schon abgebrochen
            try {
                return fetcher.fetch(source.getUrl(), timeout);
            } finally {
                settled.complete(null);
            }
        });
        try {
            byte[] raw = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (raw == null) throw new SourceFetchException(source.getId(), "No response body", false, null);
            return raw;
        } catch (TimeoutException e) {
            future.cancel(true);
            if (!claimed.compareAndSet(false, true)) {
                awaitTransport(source, settled);
            }
            throw new SourceFetchException(source.getId(),
                    "Timed out after " + timeout.toMillis() + " ms", true, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            String msg = cause instanceof IOException ? cause.getMessage() : String.valueOf(cause);
            throw new SourceFetchException(source.getId(), "Fetch failed: " + msg, false, cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new SourceFetchException(source.getId(), "Fetch interrupted", false, e);
        }
    }

    /**
     * A transport may not react to interrupts (blocking socket reads). The caller keeps its
     * worker slot until the transport has really returned.
     */
    private void awaitTransport(ConfigSource source, CompletableFuture<Void> settled) throws SourceFetchException {
        try {
            settled.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceFetchException(source.getId(), "Fetch interrupted", false, e);
        } catch (ExecutionException e) {
            // settled wird nur normal abgeschlossen
            throw new IllegalStateException(e.getCause());
        }
        logger.debug("Timed-out transport for {} has returned", source.getId());
    }

    private void onSuccess(ConfigSource source, long latencyMs) {
        long now = clock.millis();
        history.record(source.getId(), new FetchRecord(true, latencyMs, now));
        registry.recordFetchOutcome(source.getId(), HealthStatus.HEALTHY, now);
        if (stats != null) stats.recordFetch(true, latencyMs);
    }

    private void onFailure(ConfigSource source, long latencyMs, SourceException e) {
        history.record(source.getId(), new FetchRecord(false, latencyMs, clock.millis()));
        int consecutive = history.consecutiveFailures(source.getId());
        HealthStatus status = consecutive >= failureThreshold ? HealthStatus.ERROR : HealthStatus.WARNING;
        registry.recordFetchOutcome(source.getId(), status, source.getLastFetchedAt());
        if (stats != null) stats.recordFetch(false, latencyMs);
        logger.warn("⚠️ Source {} failed ({} in a row, now {}): {}",
                source.getId(), consecutive, status, e.getMessage());
    }

    private static long elapsedMs(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }
}
