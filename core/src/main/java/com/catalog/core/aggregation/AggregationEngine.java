package com.catalog.core.aggregation;

import com.catalog.common.model.*;
import com.catalog.core.cache.CacheLayer;
import com.catalog.core.cache.CacheResult;
import com.catalog.core.fetch.FetchPipeline;
import com.catalog.core.fetch.SourceException;
import com.catalog.core.fetch.SourceFetchException;
import com.catalog.core.fetch.SourceParseException;
import com.catalog.core.scoring.SourceScore;
import com.catalog.core.scoring.SourceScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Fans out fetches over all enabled sources and merges the fragments into one
 * deduplicated, scored directory.
 * <p>
 * Collisions on a site key are decided by: higher source priority, then higher source
 * quality, then the more recent fetch, then the primary source, then the smaller source id.
 * The loser's origin urls are kept on the winner.
 */
public class AggregationEngine {
    private static final Logger logger = LoggerFactory.getLogger(AggregationEngine.class);

    public static final String DEFAULT_KEY = "directory";
    public static final String FRAGMENT_KEY_PREFIX = "fragment:";

    /** Precedence of sources for lives/rules/parsers/wallpapers: priority, primary, id. */
    static final Comparator<ConfigSource> SOURCE_PRECEDENCE = Comparator
            .comparingInt(ConfigSource::getPriority).reversed()
            .thenComparing(ConfigSource::isPrimary, Comparator.reverseOrder())
            .thenComparing(ConfigSource::getId);

    static final Comparator<AggregatedSiteEntry> DIRECTORY_ORDER = Comparator
            .comparingDouble(AggregatedSiteEntry::getQualityScore).reversed()
            .thenComparing(Comparator.comparingDouble(AggregatedSiteEntry::getReliabilityScore).reversed())
            .thenComparing(AggregatedSiteEntry::getKey);

    private final FetchPipeline pipeline;
    private final SourceScorer scorer;
    private final CacheLayer cache;
    private final ExecutorService workers;
    private final Clock clock;
    private final int parallelism;
    private final Duration fetchTimeout;
    private final Duration fragmentTtl;

    private final ConcurrentHashMap<String, CompletableFuture<AggregatedDirectory>> inFlight = new ConcurrentHashMap<>();
    private final List<Consumer<AggregatedDirectory>> listeners = new CopyOnWriteArrayList<>();

    public AggregationEngine(FetchPipeline pipeline, SourceScorer scorer, CacheLayer cache,
                             ExecutorService workers, Clock clock, int parallelism,
                             Duration fetchTimeout, Duration fragmentTtl) {
        if (parallelism < 1) throw new IllegalArgumentException("parallelism must be >= 1");
        this.pipeline = pipeline;
        this.scorer = scorer;
        this.cache = cache;
        this.workers = workers;
        this.clock = clock;
        this.parallelism = parallelism;
        this.fetchTimeout = fetchTimeout;
        this.fragmentTtl = fragmentTtl;
    }

    /** Called with every freshly built directory. */
    public void addListener(Consumer<AggregatedDirectory> listener) {
        listeners.add(listener);
    }

    public static String fragmentKey(ConfigSource source) {
        return FRAGMENT_KEY_PREFIX + source.getUrl();
    }

    public AggregatedDirectory aggregate(List<ConfigSource> sources) {
        return aggregate(DEFAULT_KEY, sources);
    }

    /**
     * Runs one aggregation cycle for {@code directoryKey}. A caller arriving while a cycle
     * for the same key is running waits for that cycle instead of starting another.
     *
     * @throws AggregationFailedException no enabled source delivered a fragment
     * @throws CancellationException      the calling thread was interrupted
     */
    public AggregatedDirectory aggregate(String directoryKey, List<ConfigSource> sources) {
        CompletableFuture<AggregatedDirectory> mine = new CompletableFuture<>();
        CompletableFuture<AggregatedDirectory> running = inFlight.putIfAbsent(directoryKey, mine);
        if (running != null) {
            logger.debug("Aggregation for {} already running, joining", directoryKey);
            return join(running);
        }
        try {
            AggregatedDirectory directory = runCycle(sources);
            mine.complete(directory);
            for (Consumer<AggregatedDirectory> l : listeners) {
                try {
                    l.accept(directory);
                } catch (RuntimeException e) {
                    logger.error("Directory listener failed", e);
                }
            }
            return directory;
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(directoryKey, mine);
        }
    }

    private static AggregatedDirectory join(CompletableFuture<AggregatedDirectory> running) {
        try {
            return running.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for aggregation");
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) throw (RuntimeException) e.getCause();
            throw new IllegalStateException("Aggregation failed", e.getCause());
        }
    }

    // --- Cycle ---

    private AggregatedDirectory runCycle(List<ConfigSource> sources) {
        List<ConfigSource> enabled = sources.stream()
                .filter(ConfigSource::isEnabled)
                .sorted(SOURCE_PRECEDENCE)
                .collect(Collectors.toList());
        if (enabled.isEmpty()) {
            throw new AggregationFailedException("No enabled config sources", List.of());
        }
        logger.info("🔄 Aggregating {} sources (parallelism {})", enabled.size(), parallelism);
        long started = System.currentTimeMillis();

        List<SourceOutcome> outcomes = fetchAll(enabled);

        List<SourceOutcome> succeeded = new ArrayList<>();
        List<SourceFailure> failures = new ArrayList<>();
        for (SourceOutcome o : outcomes) {
            if (o.fragment != null) succeeded.add(o);
            else failures.add(o.failure);
        }
        if (succeeded.isEmpty()) {
            logger.error("❌ All {} config sources failed", enabled.size());
            throw new AggregationFailedException("All " + enabled.size() + " enabled sources failed", failures);
        }

        AggregatedDirectory directory = merge(succeeded, failures, enabled.size());
        logger.info("✅ Aggregation done in {} ms: {} unique sites from {}/{} sources",
                System.currentTimeMillis() - started, directory.getUniqueSiteCount(),
                succeeded.size(), enabled.size());
        return directory;
    }

    private List<SourceOutcome> fetchAll(List<ConfigSource> enabled) {
        Semaphore permits = new Semaphore(parallelism);
        List<CompletableFuture<SourceOutcome>> futures = new ArrayList<>();
        try {
            for (ConfigSource source : enabled) {
                if (Thread.currentThread().isInterrupted()) throw new InterruptedException();
                permits.acquire();
                CompletableFuture<SourceOutcome> task = CompletableFuture.supplyAsync(() -> fetchOne(source), workers);
                // Permit erst freigeben, wenn der Worker wirklich fertig ist
                task.whenComplete((r, e) -> permits.release());
                futures.add(task.copy().completeOnTimeout(SourceOutcome.failed(source, SourceFailure.Kind.TIMEOUT,
                                "No result within " + fetchTimeout.toMillis() + " ms"),
                        fetchTimeout.toMillis(), TimeUnit.MILLISECONDS));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("🛑 Aggregation cancelled, {} of {} fetches were scheduled", futures.size(), enabled.size());
            throw new CancellationException("Aggregation cancelled");
        } catch (ExecutionException e) {
            // fetchOne faengt alles ab, sollte nicht passieren
            throw new IllegalStateException("Fetch worker failed", e.getCause());
        }
        return futures.stream().map(CompletableFuture::join).collect(Collectors.toList());
    }

    private SourceOutcome fetchOne(ConfigSource source) {
        try {
            CacheResult<CatalogFragment> result = cache.get(fragmentKey(source), fragmentTtl,
                    () -> pipeline.fetchAndParse(source, fetchTimeout));
            if (result.isStale()) {
                String why = result.getRebuildError().map(Throwable::getMessage).orElse("rebuild failed");
                return SourceOutcome.failed(source, kindOf(result.getRebuildError().orElse(null)), why);
            }
            return SourceOutcome.ok(source, result.getPayload());
        } catch (SourceException e) {
            return SourceOutcome.failed(source, kindOf(e), e.getMessage());
        } catch (CancellationException e) {
            return SourceOutcome.failed(source, SourceFailure.Kind.FETCH, "cancelled");
        } catch (RuntimeException e) {
            logger.error("Unexpected error fetching source {}", source.getId(), e);
            return SourceOutcome.failed(source, SourceFailure.Kind.FETCH, String.valueOf(e));
        }
    }

    private static SourceFailure.Kind kindOf(Throwable e) {
        if (e instanceof SourceParseException) return SourceFailure.Kind.PARSE;
        if (e instanceof SourceFetchException && ((SourceFetchException) e).isTimedOut()) return SourceFailure.Kind.TIMEOUT;
        return SourceFailure.Kind.FETCH;
    }

    // --- Merge ---

    private AggregatedDirectory merge(List<SourceOutcome> succeeded, List<SourceFailure> failures, int sourceCount) {
        long now = clock.millis();
        Map<String, Candidate> working = new LinkedHashMap<>();

        for (SourceOutcome outcome : succeeded) {
            SourceScore score = scoreOf(outcome, now);
            for (SiteEntry site : outcome.fragment.getSites()) {
                Candidate challenger = new Candidate(site, outcome.source, score, outcome.fragment.getFetchedAt());
                working.merge(site.getKey(), challenger, Candidate::resolve);
            }
        }

        List<AggregatedSiteEntry> sites = working.values().stream()
                .map(Candidate::toEntry)
                .sorted(DIRECTORY_ORDER)
                .collect(Collectors.toList());

        return new AggregatedDirectory(sites, buildCategories(sites), now, failures,
                dedupe(succeeded, CatalogFragment::getLives, LiveEntry::url),
                dedupe(succeeded, CatalogFragment::getRules, RuleEntry::name),
                dedupe(succeeded, CatalogFragment::getResolvers, ResolverDescriptor::name),
                dedupe(succeeded, CatalogFragment::getWallpapers, Function.identity()),
                sourceCount, succeeded.size());
    }

    private SourceScore scoreOf(SourceOutcome outcome, long now) {
        CatalogFragment fragment = outcome.fragment;
        long[] timestamps = fragment.getSites().stream()
                .mapToLong(s -> s.getUpdatedAt() > 0 ? s.getUpdatedAt() : fragment.getFetchedAt())
                .toArray();
        return scorer.score(outcome.source, pipeline.getHistory().recent(outcome.source.getId()), timestamps, now);
    }

    static List<CategoryInfo> buildCategories(List<AggregatedSiteEntry> sites) {
        Map<SiteKind, List<String>> grouped = new EnumMap<>(SiteKind.class);
        for (AggregatedSiteEntry e : sites) {
            grouped.computeIfAbsent(e.getKind(), k -> new ArrayList<>()).add(e.getKey());
        }
        return grouped.entrySet().stream()
                .map(en -> new CategoryInfo(en.getKey().getFormat(), en.getKey().getDisplayName(), en.getValue()))
                .sorted(Comparator.comparingInt(CategoryInfo::siteCount).reversed().thenComparing(CategoryInfo::id))
                .collect(Collectors.toList());
    }

    // first occurrence wins, outcomes are already in source precedence order
    private static <T> List<T> dedupe(List<SourceOutcome> outcomes,
                                      Function<CatalogFragment, List<T>> items,
                                      Function<T, String> identity) {
        Map<String, T> seen = new LinkedHashMap<>();
        for (SourceOutcome o : outcomes) {
            for (T item : items.apply(o.fragment)) seen.putIfAbsent(identity.apply(item), item);
        }
        return new ArrayList<>(seen.values());
    }

    // --- Internals ---

    private static final class SourceOutcome {
        final ConfigSource source;
        final CatalogFragment fragment;
        final SourceFailure failure;

        private SourceOutcome(ConfigSource source, CatalogFragment fragment, SourceFailure failure) {
            this.source = source;
            this.fragment = fragment;
            this.failure = failure;
        }

        static SourceOutcome ok(ConfigSource source, CatalogFragment fragment) {
            return new SourceOutcome(source, fragment, null);
        }

        static SourceOutcome failed(ConfigSource source, SourceFailure.Kind kind, String message) {
            return new SourceOutcome(source, null, new SourceFailure(source.getId(), source.getUrl(), kind, message));
        }
    }

    /** A site as offered by one source, competing for its key. */
    static final class Candidate {
        static final Comparator<Candidate> WINS_FIRST = Comparator
                .comparingInt((Candidate c) -> c.source.getPriority()).reversed()
                .thenComparing(Comparator.comparingDouble((Candidate c) -> c.score.quality()).reversed())
                .thenComparing(Comparator.comparingLong((Candidate c) -> c.fetchedAt).reversed())
                .thenComparing((Candidate c) -> c.source.isPrimary(), Comparator.reverseOrder())
                .thenComparing((Candidate c) -> c.source.getId());

        final SiteEntry site;
        final ConfigSource source;
        final SourceScore score;
        final long fetchedAt;
        final Set<String> originUrls = new LinkedHashSet<>();
        long lastSeen;

        Candidate(SiteEntry site, ConfigSource source, SourceScore score, long fetchedAt) {
            this.site = site;
            this.source = source;
            this.score = score;
            this.fetchedAt = fetchedAt;
            this.originUrls.add(source.getUrl());
            this.lastSeen = fetchedAt;
        }

        static Candidate resolve(Candidate current, Candidate challenger) {
            boolean challengerWins = WINS_FIRST.compare(challenger, current) < 0;
            Candidate winner = challengerWins ? challenger : current;
            Candidate loser = challengerWins ? current : challenger;
            winner.originUrls.addAll(loser.originUrls);
            winner.lastSeen = Math.max(winner.lastSeen, loser.lastSeen);
            return winner;
        }

        AggregatedSiteEntry toEntry() {
            return new AggregatedSiteEntry(site, source.getId(), originUrls,
                    score.quality(), score.reliability(), lastSeen);
        }
    }
}
