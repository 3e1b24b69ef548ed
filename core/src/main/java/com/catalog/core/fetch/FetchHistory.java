package com.catalog.core.fetch;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bounded per-source log of recent fetch outcomes, newest first.
 */
public class FetchHistory {
    private final int window;
    private final Map<String, Deque<FetchRecord>> records = new ConcurrentHashMap<>();

    public FetchHistory(int window) {
        if (window < 1) throw new IllegalArgumentException("window must be >= 1");
        this.window = window;
    }

    public void record(String sourceId, FetchRecord record) {
        Deque<FetchRecord> deque = records.computeIfAbsent(sourceId, k -> new ArrayDeque<>());
        synchronized (deque) {
            deque.addFirst(record);
            while (deque.size() > window) deque.removeLast();
        }
    }

    /** Newest first, at most {@code window} entries. */
    public List<FetchRecord> recent(String sourceId) {
        Deque<FetchRecord> deque = records.get(sourceId);
        if (deque == null) return List.of();
        synchronized (deque) {
            return List.copyOf(deque);
        }
    }

    public int consecutiveFailures(String sourceId) {
        Deque<FetchRecord> deque = records.get(sourceId);
        if (deque == null) return 0;
        int count = 0;
        synchronized (deque) {
            Iterator<FetchRecord> it = deque.iterator();
            while (it.hasNext() && !it.next().success()) count++;
        }
        return count;
    }

    public void forget(String sourceId) {
        records.remove(sourceId);
    }
}
