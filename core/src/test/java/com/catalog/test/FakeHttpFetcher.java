package com.catalog.test;

import com.catalog.api.HttpFetcher;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scripted HTTP transport: each url gets a body, an error or a delay.
 * Unknown urls fail like a 404.
 */
public class FakeHttpFetcher implements HttpFetcher {

    private static final class Response {
        final String body;
        final String error;
        final long delayMs;
        final CountDownLatch gate;
        final boolean ignoresInterrupts;

        Response(String body, String error, long delayMs, CountDownLatch gate) {
            this(body, error, delayMs, gate, false);
        }

        Response(String body, String error, long delayMs, CountDownLatch gate, boolean ignoresInterrupts) {
            this.body = body;
            this.error = error;
            this.delayMs = delayMs;
            this.gate = gate;
            this.ignoresInterrupts = ignoresInterrupts;
        }
    }

    private final Map<String, Response> responses = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();

    public FakeHttpFetcher respond(String url, String body) {
        responses.put(url, new Response(body, null, 0, null));
        return this;
    }

    public FakeHttpFetcher respondSlowly(String url, String body, long delayMs) {
        responses.put(url, new Response(body, null, delayMs, null));
        return this;
    }

    /** Like a blocking socket read: the delay runs to the end even when the thread is interrupted. */
    public FakeHttpFetcher respondIgnoringInterrupts(String url, String body, long delayMs) {
        responses.put(url, new Response(body, null, delayMs, null, true));
        return this;
    }

    /** Blocks the fetch until {@code gate} is counted down. */
    public FakeHttpFetcher respondAfter(String url, String body, CountDownLatch gate) {
        responses.put(url, new Response(body, null, 0, gate));
        return this;
    }

    public FakeHttpFetcher fail(String url, String error) {
        responses.put(url, new Response(null, error, 0, null));
        return this;
    }

    public int calls(String url) {
        AtomicInteger c = calls.get(url);
        return c == null ? 0 : c.get();
    }

    public int totalCalls() {
        return calls.values().stream().mapToInt(AtomicInteger::get).sum();
    }

    public int maxConcurrent() {
        return maxInFlight.get();
    }

    @Override
    public byte[] fetch(String url, Duration timeout) throws IOException {
        calls.computeIfAbsent(url, k -> new AtomicInteger()).incrementAndGet();
        int now = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(now, Math::max);
        try {
            Response r = responses.get(url);
            if (r == null) throw new IOException("HTTP 404 for " + url);
            if (r.gate != null) r.gate.await();
            if (r.ignoresInterrupts) sleepUninterruptibly(r.delayMs);
            else if (r.delayMs > 0) Thread.sleep(r.delayMs);
            if (r.error != null) throw new IOException(r.error);
            return r.body.getBytes(StandardCharsets.UTF_8);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("interrupted", e);
        } finally {
            inFlight.decrementAndGet();
        }
    }

    private static void sleepUninterruptibly(long millis) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(millis);
        boolean interrupted = false;
        long left;
        while ((left = deadline - System.nanoTime()) > 0) {
            try {
                TimeUnit.NANOSECONDS.sleep(left);
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) Thread.currentThread().interrupt();
    }
}
