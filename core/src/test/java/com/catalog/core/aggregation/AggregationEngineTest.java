package com.catalog.core.aggregation;

import com.catalog.common.model.AggregatedDirectory;
import com.catalog.common.model.AggregatedSiteEntry;
import com.catalog.common.model.ConfigSource;
import com.catalog.common.model.SourceFailure;
import com.catalog.core.cache.CacheLayer;
import com.catalog.core.fetch.FetchHistory;
import com.catalog.core.fetch.FetchPipeline;
import com.catalog.core.fetch.FetchRecord;
import com.catalog.core.fetch.FragmentParser;
import com.catalog.core.scoring.SourceScorer;
import com.catalog.core.source.SourceRegistry;
import com.catalog.services.stats.StatisticsManager;
import com.catalog.test.TestBase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.catalog.test.Feeds.feed;
import static org.junit.jupiter.api.Assertions.*;

class AggregationEngineTest extends TestBase {

    private ExecutorService io;
    private ExecutorService workers;
    private SourceRegistry registry;
    private CacheLayer cache;
    private FetchHistory history;

    @BeforeEach
    void createExecutors() {
        io = Executors.newCachedThreadPool();
        workers = Executors.newCachedThreadPool();
        registry = new SourceRegistry(store);
        cache = new CacheLayer(clock);
        history = new FetchHistory(10);
    }

    @AfterEach
    void stopExecutors() {
        io.shutdownNow();
        workers.shutdownNow();
    }

    private AggregationEngine engine(int parallelism, Duration fetchTimeout) {
        FetchPipeline pipeline = new FetchPipeline(fetcher, new FragmentParser(), registry,
                history, new StatisticsManager(), clock, 3, io);
        SourceScorer scorer = new SourceScorer(10, 0.9, Duration.ofDays(7));
        return new AggregationEngine(pipeline, scorer, cache, workers, clock, parallelism,
                fetchTimeout, Duration.ofMinutes(30));
    }

    private AggregationEngine engine() {
        return engine(8, Duration.ofSeconds(2));
    }

    private ConfigSource source(String id, int priority) {
        ConfigSource s = ConfigSource.of(id, "https://" + id + ".example/feed.json", id.toUpperCase(), priority);
        registry.add(s);
        return s;
    }

    @Test
    void testKeysAreUniqueAndOriginUrlsMerged() {
        ConfigSource a = source("a", 5);
        ConfigSource b = source("b", 1);
        fetcher.respond(a.getUrl(), feed().site("shared", "From A").site("only-a", "A only").json());
        fetcher.respond(b.getUrl(), feed().site("shared", "From B").site("only-b", "B only").json());

        AggregatedDirectory dir = engine().aggregate(registry.enabledSources());

        assertEquals(3, dir.getUniqueSiteCount());
        assertEquals(4, dir.getTotalSiteCount());
        AggregatedSiteEntry shared = dir.find("shared").orElseThrow();
        assertEquals("From A", shared.getName());
        assertEquals("a", shared.getWinningSourceId());
        assertEquals(Set.of(a.getUrl(), b.getUrl()), shared.getOriginUrls());
        assertEquals(2, dir.getSuccessfulSources());
        assertTrue(dir.getFailures().isEmpty());
    }

    @Test
    void testHigherPriorityWinsRegardlessOfOrder() {
        ConfigSource low = source("a-low", 0);
        ConfigSource high = source("z-high", 9);
        fetcher.respond(low.getUrl(), feed().site("k", "Low").json());
        fetcher.respond(high.getUrl(), feed().site("k", "High").json());

        AggregatedDirectory dir = engine().aggregate(List.of(low, high));

        assertEquals("High", dir.find("k").orElseThrow().getName());
    }

    @Test
    void testEqualSourcesFallBackToPrimaryThenId() {
        ConfigSource b = source("b", 0);
        ConfigSource c = source("c", 0);
        fetcher.respond(b.getUrl(), feed().site("k", "From B").json());
        fetcher.respond(c.getUrl(), feed().site("k", "From C").json());

        assertEquals("From B", engine().aggregate(registry.enabledSources()).find("k").orElseThrow().getName());

        registry.setPrimary("c");
        cache.clear();
        assertEquals("From C", engine().aggregate(registry.enabledSources()).find("k").orElseThrow().getName());
    }

    @Test
    void testMoreReliableSourceWinsAtEqualPriority() {
        ConfigSource a = source("a", 0);
        ConfigSource b = source("b", 0);
        fetcher.respond(a.getUrl(), feed().site("k", "From A").json());
        fetcher.respond(b.getUrl(), feed().site("k", "From B").json());
        for (int i = 0; i < 4; i++) {
            history.record("a", new FetchRecord(false, 10, START - 60_000 + i));
        }

        AggregatedSiteEntry winner = engine().aggregate(registry.enabledSources()).find("k").orElseThrow();

        assertEquals("b", winner.getWinningSourceId());
        assertEquals("From B", winner.getName());
        assertEquals(Set.of(a.getUrl(), b.getUrl()), winner.getOriginUrls());
    }

    @Test
    void testMoreRecentFetchWinsAtEqualQuality() {
        ConfigSource a = source("a", 0);
        ConfigSource b = source("b", 0);
        fetcher.respond(a.getUrl(), feed().site("k", "From A").json());
        fetcher.respond(b.getUrl(), feed().site("k", "From B").json());
        AggregationEngine engine = engine();

        // a's fragment stays cached from the earlier cycle, b is fetched a minute later
        engine.aggregate(List.of(a));
        clock.advance(Duration.ofMinutes(1));
        AggregatedSiteEntry winner = engine.aggregate(registry.enabledSources()).find("k").orElseThrow();

        assertEquals(1, fetcher.calls(a.getUrl()));
        assertEquals(1, fetcher.calls(b.getUrl()));
        assertEquals("b", winner.getWinningSourceId());
        assertEquals(START + 60_000, winner.getLastSeen());
    }

    @Test
    void testPartialFailureIsRecorded() {
        ConfigSource ok = source("ok", 0);
        ConfigSource down = source("down", 0);
        ConfigSource junk = source("junk", 0);
        fetcher.respond(ok.getUrl(), feed().site("s", "S").live("TV", "https://tv.example/a.m3u").json());
        fetcher.fail(down.getUrl(), "connection refused");
        fetcher.respond(junk.getUrl(), "not json at all");

        AggregatedDirectory dir = engine().aggregate(registry.enabledSources());

        assertEquals(1, dir.getUniqueSiteCount());
        assertEquals(3, dir.getSourceCount());
        assertEquals(1, dir.getSuccessfulSources());
        assertEquals(2, dir.getFailures().size());
        SourceFailure parse = dir.getFailures().stream().filter(f -> f.sourceId().equals("junk")).findFirst().orElseThrow();
        assertEquals(SourceFailure.Kind.PARSE, parse.kind());
        assertEquals(1, dir.getLives().size());
    }

    @Test
    void testAllSourcesFailing() {
        ConfigSource a = source("a", 0);
        fetcher.fail(a.getUrl(), "offline");

        AggregationFailedException e = assertThrows(AggregationFailedException.class,
                () -> engine().aggregate(registry.enabledSources()));
        assertEquals(1, e.getFailures().size());
    }

    @Test
    void testNoEnabledSources() {
        source("a", 0);
        registry.setEnabled("a", false);
        assertThrows(AggregationFailedException.class, () -> engine().aggregate(registry.enabledSources()));
    }

    @Test
    void testSlowSourceIsReportedAsTimeout() {
        ConfigSource fast = source("fast", 0);
        ConfigSource slow = source("slow", 0);
        fetcher.respond(fast.getUrl(), feed().site("f", "F").json());
        fetcher.respondSlowly(slow.getUrl(), feed().site("s", "S").json(), 3_000);

        AggregatedDirectory dir = engine(8, Duration.ofMillis(200)).aggregate(registry.enabledSources());

        assertTrue(dir.find("f").isPresent());
        assertFalse(dir.find("s").isPresent());
        assertEquals(SourceFailure.Kind.TIMEOUT, dir.getFailures().get(0).kind());
    }

    @Test
    void testParallelismIsBounded() {
        for (int i = 0; i < 6; i++) {
            ConfigSource s = source("s" + i, 0);
            fetcher.respondSlowly(s.getUrl(), feed().site("k" + i, "K" + i).json(), 100);
        }

        AggregatedDirectory dir = engine(2, Duration.ofSeconds(5)).aggregate(registry.enabledSources());

        assertEquals(6, dir.getUniqueSiteCount());
        assertTrue(fetcher.maxConcurrent() <= 2, "max concurrent fetches: " + fetcher.maxConcurrent());
    }

    @Test
    void testTimedOutFetchKeepsItsSlotUntilTransportReturns() {
        for (int i = 0; i < 3; i++) {
            ConfigSource s = source("s" + i, 0);
            fetcher.respondIgnoringInterrupts(s.getUrl(), feed().site("k" + i, "K" + i).json(), 300);
        }

        AggregationFailedException e = assertThrows(AggregationFailedException.class,
                () -> engine(1, Duration.ofMillis(80)).aggregate(registry.enabledSources()));

        assertEquals(3, e.getFailures().size());
        assertTrue(e.getFailures().stream().allMatch(f -> f.kind() == SourceFailure.Kind.TIMEOUT));
        assertEquals(3, fetcher.totalCalls());
        assertEquals(1, fetcher.maxConcurrent(), "max concurrent fetches: " + fetcher.maxConcurrent());
    }

    @Test
    void testLiveFragmentsAreNotRefetched() {
        ConfigSource a = source("a", 0);
        fetcher.respond(a.getUrl(), feed().site("k", "K").json());
        AggregationEngine engine = engine();

        engine.aggregate(registry.enabledSources());
        engine.aggregate(registry.enabledSources());

        assertEquals(1, fetcher.calls(a.getUrl()));
    }

    @Test
    void testFailedRefreshOfCachedFragmentCountsAsFailure() {
        ConfigSource a = source("a", 0);
        ConfigSource b = source("b", 0);
        fetcher.respond(a.getUrl(), feed().site("ka", "A").json());
        fetcher.respond(b.getUrl(), feed().site("kb", "B").json());
        AggregationEngine engine = engine();
        engine.aggregate(registry.enabledSources());

        fetcher.fail(b.getUrl(), "gone");
        cache.invalidatePrefix(AggregationEngine.FRAGMENT_KEY_PREFIX);
        AggregatedDirectory dir = engine.aggregate(registry.enabledSources());

        assertFalse(dir.find("kb").isPresent());
        assertEquals("b", dir.getFailures().get(0).sourceId());
    }

    @Test
    void testConcurrentCallersShareOneCycle() throws Exception {
        ConfigSource a = source("a", 0);
        CountDownLatch gate = new CountDownLatch(1);
        fetcher.respondAfter(a.getUrl(), feed().site("k", "K").json(), gate);
        AggregationEngine engine = engine();
        ExecutorService callers = Executors.newFixedThreadPool(3);
        try {
            List<ConfigSource> sources = registry.enabledSources();
            Future<AggregatedDirectory> f1 = callers.submit(() -> engine.aggregate(sources));
            Future<AggregatedDirectory> f2 = callers.submit(() -> engine.aggregate(sources));
            Future<AggregatedDirectory> f3 = callers.submit(() -> engine.aggregate(sources));
            Thread.sleep(200);
            gate.countDown();

            AggregatedDirectory d1 = f1.get(5, TimeUnit.SECONDS);
            assertSame(d1, f2.get(5, TimeUnit.SECONDS));
            assertSame(d1, f3.get(5, TimeUnit.SECONDS));
            assertEquals(1, fetcher.calls(a.getUrl()));
        } finally {
            callers.shutdownNow();
        }
    }

    @Test
    void testCategoriesGroupedByKind() {
        ConfigSource a = source("a", 0);
        fetcher.respond(a.getUrl(), feed()
                .site("v1", "V1", 0, "https://v1")
                .site("api1", "Api1", 1, "https://api1")
                .site("api2", "Api2", 1, "https://api2")
                .json());

        AggregatedDirectory dir = engine().aggregate(registry.enabledSources());

        assertEquals("video_api", dir.getCategories().get(0).id());
        assertEquals(2, dir.getCategories().get(0).siteCount());
        assertEquals("video", dir.getCategories().get(1).id());
    }

    @Test
    void testLivesAndParsersDedupedByPrecedence() {
        ConfigSource high = source("high", 5);
        ConfigSource low = source("low", 0);
        fetcher.respond(high.getUrl(), feed().site("a", "A").parser("jx", "https://high/jx").live("TV", "https://tv").json());
        fetcher.respond(low.getUrl(), feed().site("b", "B").parser("jx", "https://low/jx").live("TV again", "https://tv").json());

        AggregatedDirectory dir = engine().aggregate(registry.enabledSources());

        assertEquals(1, dir.getResolvers().size());
        assertEquals("https://high/jx", dir.getResolvers().get(0).url());
        assertEquals(1, dir.getLives().size());
        assertEquals("TV", dir.getLives().get(0).name());
    }

    @Test
    void testWallpapersDedupedByPrecedence() {
        ConfigSource high = source("high", 5);
        ConfigSource low = source("low", 0);
        ConfigSource same = source("same", 1);
        fetcher.respond(low.getUrl(), feed().site("a", "A").wallpaper("https://img.example/low.jpg").json());
        fetcher.respond(high.getUrl(), feed().site("b", "B").wallpaper("https://img.example/high.jpg").json());
        fetcher.respond(same.getUrl(), feed().site("c", "C").wallpaper("https://img.example/high.jpg").json());

        AggregatedDirectory dir = engine().aggregate(registry.enabledSources());

        assertEquals(List.of("https://img.example/high.jpg", "https://img.example/low.jpg"), dir.getWallpapers());
    }
}
