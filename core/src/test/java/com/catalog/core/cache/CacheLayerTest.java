package com.catalog.core.cache;

import com.catalog.test.TestBase;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CacheLayerTest extends TestBase {

    private static final Duration TTL = Duration.ofMinutes(10);

    @Test
    void testHitWithinTtlAndRebuildAfterExpiry() throws Exception {
        CacheLayer cache = new CacheLayer(clock);
        AtomicInteger builds = new AtomicInteger();

        assertEquals(1, cache.get("k", TTL, builds::incrementAndGet).getPayload());
        assertEquals(1, cache.get("k", TTL, builds::incrementAndGet).getPayload());

        clock.advance(TTL.plusSeconds(1));
        assertEquals(2, cache.get("k", TTL, builds::incrementAndGet).getPayload());
        assertEquals(1, cache.getHits());
        assertEquals(2, cache.getMisses());
    }

    @Test
    void testFailedRebuildServesStale() throws Exception {
        CacheLayer cache = new CacheLayer(clock);
        cache.get("k", TTL, () -> "v1");
        clock.advance(TTL.plusSeconds(1));

        CacheResult<String> result = cache.get("k", TTL, () -> {
            throw new IOException("offline");
        });

        assertTrue(result.isStale());
        assertEquals("v1", result.getPayload());
        assertEquals("offline", result.getRebuildError().orElseThrow().getMessage());
        assertEquals(1, cache.getStaleServed());
    }

    @Test
    void testFailedBuildWithoutPreviousPropagates() {
        CacheLayer cache = new CacheLayer(clock);
        IOException e = assertThrows(IOException.class, () -> cache.get("k", TTL, () -> {
            throw new IOException("offline");
        }));
        assertEquals("offline", e.getMessage());
    }

    @Test
    void testInvalidateForcesRebuildButKeepsFallback() throws Exception {
        CacheLayer cache = new CacheLayer(clock);
        cache.get("fragment:a", TTL, () -> "a1");
        cache.get("fragment:b", TTL, () -> "b1");
        cache.get("directory", TTL, () -> "d1");

        cache.invalidatePrefix("fragment:");

        assertTrue(cache.<String>peek("fragment:a").orElseThrow().isStale());
        assertFalse(cache.<String>peek("directory").orElseThrow().isStale());
        assertEquals("a2", cache.get("fragment:a", TTL, () -> "a2").getPayload());
        CacheResult<String> fallback = cache.get("fragment:b", TTL, () -> {
            throw new IOException("down");
        });
        assertEquals("b1", fallback.getPayload());
    }

    @Test
    void testSeededValueIsExpiredFallback() throws Exception {
        CacheLayer cache = new CacheLayer(clock);
        cache.seed("directory", "restored", START - 1_000, TTL);

        CacheResult<String> result = cache.get("directory", TTL, () -> {
            throw new IllegalStateException("all sources failed");
        });

        assertTrue(result.isStale());
        assertEquals("restored", result.getPayload());
        assertEquals(START - 1_000, result.getStoredAt());
    }

    @Test
    void testConcurrentMissesShareOneRebuild() throws Exception {
        CacheLayer cache = new CacheLayer(clock);
        AtomicInteger builds = new AtomicInteger();
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<CacheResult<Integer>>> results = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                results.add(pool.submit(() -> cache.get("k", TTL, () -> {
                    builds.incrementAndGet();
                    release.await(5, TimeUnit.SECONDS);
                    return 7;
                })));
            }
            Thread.sleep(200);
            release.countDown();
            for (Future<CacheResult<Integer>> f : results) {
                assertEquals(7, f.get(5, TimeUnit.SECONDS).getPayload());
            }
            assertEquals(1, builds.get());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void testInvalidationDuringRebuildIsNotLost() throws Exception {
        CacheLayer cache = new CacheLayer(clock);
        cache.get("directory", TTL, () -> "d1");
        cache.invalidate("directory");

        CacheResult<String> built = cache.get("directory", TTL, () -> {
            // a mutation lands while the rebuild is still running
            cache.invalidate("directory");
            return "d2";
        });

        assertEquals("d2", built.getPayload());
        assertTrue(cache.<String>peek("directory").orElseThrow().isStale());
        assertEquals("d3", cache.get("directory", TTL, () -> "d3").getPayload());
        assertFalse(cache.<String>peek("directory").orElseThrow().isStale());
    }

    @Test
    void testRemovePrefixDropsFallbacks() throws Exception {
        CacheLayer cache = new CacheLayer(clock);
        cache.get("resolve:e1:p", TTL, () -> "s1");
        cache.get("resolve:e2:p", TTL, () -> "s2");
        cache.get("directory", TTL, () -> "d1");

        cache.removePrefix("resolve:");

        assertTrue(cache.peek("resolve:e1:p").isEmpty());
        assertTrue(cache.peek("resolve:e2:p").isEmpty());
        assertTrue(cache.peek("directory").isPresent());
    }
}
