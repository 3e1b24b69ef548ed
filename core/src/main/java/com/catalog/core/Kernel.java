package com.catalog.core;

import com.catalog.api.BlobStore;
import com.catalog.api.HttpFetcher;
import com.catalog.common.model.AggregatedDirectory;
import com.catalog.common.model.AggregatedSiteEntry;
import com.catalog.common.model.ConfigSource;
import com.catalog.common.model.ResolveHint;
import com.catalog.common.util.HttpUtils;
import com.catalog.core.aggregation.AggregationEngine;
import com.catalog.core.aggregation.DirectoryPage;
import com.catalog.core.aggregation.DirectoryQuery;
import com.catalog.core.cache.CacheLayer;
import com.catalog.core.cache.CacheResult;
import com.catalog.core.config.ConfigManager;
import com.catalog.core.config.Configuration;
import com.catalog.core.fetch.FetchHistory;
import com.catalog.core.fetch.FetchPipeline;
import com.catalog.core.fetch.FragmentParser;
import com.catalog.core.plugin.JarResolverFactory;
import com.catalog.core.plugin.PluginDescriptor;
import com.catalog.core.plugin.PluginLoader;
import com.catalog.core.plugin.ResolverFactory;
import com.catalog.core.plugin.ResolverRegistry;
import com.catalog.core.resolve.ResolutionExecutor;
import com.catalog.core.resolve.ResolutionResult;
import com.catalog.core.resolve.UnknownEntryException;
import com.catalog.core.scoring.SourceScorer;
import com.catalog.core.source.SourceRegistry;
import com.catalog.services.database.DatabaseBlobStore;
import com.catalog.services.database.DatabaseService;
import com.catalog.services.database.FileBlobStore;
import com.catalog.services.stats.StatisticsManager;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Facade over the catalog components. Owns the executors and wires the registry,
 * fetch pipeline, aggregation, cache and resolver plumbing together.
 */
public class Kernel implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(Kernel.class);

    public static final String SNAPSHOT_KEY = "aggregated_directory";
    private static final String DIRECTORY_KEY = AggregationEngine.DEFAULT_KEY;

    private final Configuration config;
    private final BlobStore store;
    private final Clock clock;
    private final Gson gson = new GsonBuilder().create();

    // Infrastructure
    private final StatisticsManager statisticsManager;
    private final SourceRegistry sourceRegistry;
    private final FetchPipeline fetchPipeline;
    private final CacheLayer cache;
    private final AggregationEngine aggregationEngine;
    private final ResolverRegistry resolverRegistry;
    private final ResolutionExecutor resolutionExecutor;
    private final PluginLoader pluginLoader;

    private final ExecutorService ioExecutor;
    private final ExecutorService workerExecutor;
    private final ExecutorService pluginExecutor;

    private final AtomicBoolean open = new AtomicBoolean(false);
    private ConfigManager configManager;
    private DatabaseService databaseService;

    public Kernel(Configuration config, HttpFetcher fetcher, BlobStore store,
                  ResolverFactory resolverFactory, Clock clock) {
        this.config = config;
        this.store = store;
        this.clock = clock;

        this.ioExecutor = Executors.newCachedThreadPool(daemonThreads("catalog-io"));
        this.workerExecutor = Executors.newCachedThreadPool(daemonThreads("catalog-worker"));
        this.pluginExecutor = Executors.newCachedThreadPool(daemonThreads("catalog-resolver"));

        this.statisticsManager = new StatisticsManager();
        this.sourceRegistry = new SourceRegistry(store);
        this.fetchPipeline = new FetchPipeline(fetcher, new FragmentParser(), sourceRegistry,
                new FetchHistory(config.historyWindow), statisticsManager, clock,
                config.failureThreshold, ioExecutor);
        this.cache = new CacheLayer(clock);
        SourceScorer scorer = new SourceScorer(config.historyWindow, config.decayFactor, config.stalenessThreshold());
        this.aggregationEngine = new AggregationEngine(fetchPipeline, scorer, cache, workerExecutor, clock,
                config.parallelism, config.fetchTimeout(), config.fragmentTtl());
        this.resolverRegistry = new ResolverRegistry(resolverFactory);
        this.resolutionExecutor = new ResolutionExecutor(resolverRegistry, pluginExecutor,
                statisticsManager, config.resolveTimeout(), cache, config);
        this.pluginLoader = new PluginLoader(resolverRegistry, config);

        // Jede Änderung an den Quellen macht das Verzeichnis ungültig
        sourceRegistry.addListener(reason -> {
            logger.debug("Source registry changed ({}), invalidating directory", reason);
            cache.invalidate(DIRECTORY_KEY);
        });
        aggregationEngine.addListener(directory -> statisticsManager.recordAggregation(directory.getGeneratedAt()));
        aggregationEngine.addListener(this::persistSnapshot);
    }

    /**
     * Production wiring: storage as configured, HTTP via {@link HttpUtils}, plugins from jars.
     */
    public static Kernel create(ConfigManager configManager) {
        Configuration config = configManager.getConfig();
        File toolsDir = configManager.getToolsDir().getAbsoluteFile();
        DatabaseService database = null;
        BlobStore store;
        if ("h2".equalsIgnoreCase(config.storage)) {
            database = new DatabaseService(config.databasePath);
            store = new DatabaseBlobStore(database);
        } else {
            store = new FileBlobStore(toolsDir);
        }
        Kernel kernel = new Kernel(config, new HttpUtils(), store, new JarResolverFactory(), Clock.systemUTC());
        kernel.configManager = configManager;
        kernel.databaseService = database;
        return kernel;
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    // --- Lifecycle ---

    /** Restores persisted sources and the last directory snapshot. */
    public void open() {
        if (open.getAndSet(true)) return;
        logger.info("⚛️ Kernel booting...");
        sourceRegistry.open();
        restoreSnapshot();
        logger.info("✅ Kernel active ({} sources).", sourceRegistry.size());
    }

    /** Scans {@link Configuration#pluginDir} for resolver plugins. */
    public List<PluginDescriptor> loadPlugins() {
        List<PluginDescriptor> loaded = pluginLoader.loadPlugins(new File(config.pluginDir));
        if (pluginLoader.isConfigChanged() && configManager != null) {
            configManager.save();
        }
        return loaded;
    }

    @Override
    public void close() {
        if (!open.getAndSet(false)) {
            // auch ohne open() die Threads freigeben
            logger.debug("Kernel closed without being opened");
        }
        resolverRegistry.close();
        ioExecutor.shutdownNow();
        workerExecutor.shutdownNow();
        pluginExecutor.shutdownNow();
        try {
            workerExecutor.awaitTermination(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (databaseService != null) databaseService.shutdown();
        logger.info("🛑 Kernel stopped.");
    }

    private void restoreSnapshot() {
        if (store == null) return;
        try {
            Optional<String> blob = store.load(SNAPSHOT_KEY);
            if (blob.isEmpty()) return;
            AggregatedDirectory snapshot = gson.fromJson(blob.get(), AggregatedDirectory.class);
            if (snapshot == null) return;
            cache.seed(DIRECTORY_KEY, snapshot, snapshot.getGeneratedAt(), config.directoryTtl());
            logger.info("📦 Restored directory snapshot with {} sites", snapshot.getUniqueSiteCount());
        } catch (IOException | JsonParseException e) {
            logger.warn("Could not restore directory snapshot: {}", e.getMessage());
        }
    }

    private void persistSnapshot(AggregatedDirectory directory) {
        if (store == null) return;
        try {
            store.save(SNAPSHOT_KEY, gson.toJson(directory));
        } catch (IOException e) {
            logger.error("Failed to persist directory snapshot", e);
        }
    }

    // --- Sources ---

    public void registerSource(ConfigSource source) {
        sourceRegistry.add(source);
    }

    public void removeSource(String sourceId) {
        ConfigSource source = sourceRegistry.get(sourceId);
        sourceRegistry.remove(sourceId);
        fetchPipeline.getHistory().forget(sourceId);
        cache.remove(AggregationEngine.fragmentKey(source));
    }

    public void setSourceEnabled(String sourceId, boolean enabled) {
        sourceRegistry.setEnabled(sourceId, enabled);
    }

    public void setPrimarySource(String sourceId) {
        sourceRegistry.setPrimary(sourceId);
    }

    public List<ConfigSource> getSources() {
        return sourceRegistry.snapshot();
    }

    // --- Directory ---

    /**
     * Returns the cached directory, rebuilding it when expired or when {@code forceRefresh}
     * is set (which also discards cached fragments). If the rebuild fails and an older
     * directory exists, that one is returned flagged stale.
     *
     * @throws com.catalog.core.aggregation.AggregationFailedException no fragment and no older directory
     */
    public DirectoryView getDirectory(boolean forceRefresh) {
        if (forceRefresh) {
            cache.invalidatePrefix(AggregationEngine.FRAGMENT_KEY_PREFIX);
            cache.invalidate(DIRECTORY_KEY);
        }
        CacheResult<AggregatedDirectory> result = cache.get(DIRECTORY_KEY, config.directoryTtl(),
                () -> aggregationEngine.aggregate(DIRECTORY_KEY, sourceRegistry.enabledSources()));
        if (result.isStale()) {
            logger.warn("Serving stale directory from {}", result.getStoredAt());
        }
        return new DirectoryView(result.getPayload(), result.isStale(), result.getStoredAt(),
                result.getRebuildError().orElse(null));
    }

    /** Query with the configured quality threshold; callers refine it further. */
    public DirectoryQuery newQuery() {
        return new DirectoryQuery().minQuality(config.minQuality);
    }

    public DirectoryPage query(DirectoryQuery query) {
        return query.apply(getDirectory(false).getDirectory());
    }

    // --- Resolution ---

    /**
     * Resolves the directory entry {@code entryKey} to a playable stream.
     *
     * @throws UnknownEntryException the key is not in the current directory
     * @throws com.catalog.core.resolve.NoResolverAvailableException no eligible plugin is loaded
     */
    public ResolutionResult resolve(String entryKey, ResolveHint hint) {
        AggregatedDirectory directory = currentDirectory();
        AggregatedSiteEntry entry = directory.find(entryKey)
                .orElseThrow(() -> new UnknownEntryException(entryKey));
        return resolutionExecutor.resolve(entry, hint);
    }

    /** Forgets every remembered stream; the next resolve calls the plugins again. */
    public void clearResolutionCache() {
        resolutionExecutor.clearCache();
    }

    private AggregatedDirectory currentDirectory() {
        Optional<CacheResult<AggregatedDirectory>> cached = cache.peek(DIRECTORY_KEY);
        if (cached.isPresent()) return cached.get().getPayload();
        return getDirectory(false).getDirectory();
    }

    // --- Plugins ---

    public PluginDescriptor loadPlugin(PluginDescriptor descriptor, byte[] bytes) {
        PluginDescriptor loaded = resolverRegistry.load(descriptor, bytes);
        // neue Version, alte Ergebnisse gelten nicht mehr
        resolutionExecutor.forgetPlugin(loaded.getId());
        return loaded;
    }

    public boolean unloadPlugin(String pluginId) {
        boolean unloaded = resolverRegistry.unload(pluginId);
        if (unloaded) resolutionExecutor.forgetPlugin(pluginId);
        return unloaded;
    }

    // --- Statistics ---

    public CatalogStatistics getStatistics() {
        Optional<CacheResult<AggregatedDirectory>> cached = cache.peek(DIRECTORY_KEY);
        AggregatedDirectory directory = cached.map(CacheResult::getPayload).orElse(null);
        List<ConfigSource> sources = sourceRegistry.snapshot();
        return new CatalogStatistics(
                sources.size(),
                (int) sources.stream().filter(ConfigSource::isEnabled).count(),
                directory == null ? 0 : directory.getTotalSiteCount(),
                directory == null ? 0 : directory.getUniqueSiteCount(),
                directory == null ? 0 : directory.getCategories().size(),
                resolverRegistry.size(),
                statisticsManager.getAggregations(),
                statisticsManager.getLastAggregationTime(),
                statisticsManager.getAverageFetchLatencyMs(),
                statisticsManager.getSuccessRate(),
                cache.getHitRate(),
                statisticsManager.getResolutions(),
                statisticsManager.getSuccessfulResolutions());
    }

    // --- Getters ---

    public Configuration getConfig() {
        return config;
    }

    public SourceRegistry getSourceRegistry() {
        return sourceRegistry;
    }

    public ResolverRegistry getResolverRegistry() {
        return resolverRegistry;
    }

    public StatisticsManager getStatisticsManager() {
        return statisticsManager;
    }

    public CacheLayer getCache() {
        return cache;
    }

    public FetchPipeline getFetchPipeline() {
        return fetchPipeline;
    }

    public Clock getClock() {
        return clock;
    }
}
