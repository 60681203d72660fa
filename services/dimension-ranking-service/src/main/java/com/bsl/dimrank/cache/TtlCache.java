package com.bsl.dimrank.cache;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Size-bounded cache with a fixed time-to-live measured from insertion. Reads never extend an
 * entry's life. Expired entries are misses and are dropped on lookup; when an insert pushes
 * the cache past capacity the oldest insertion is evicted first.
 *
 * <p>Lookups go straight to a {@link ConcurrentHashMap} and never block on unrelated keys.
 * Inserts and evictions are serialized by one lock and only ever remove the exact entry they
 * observed, so no caller can see a half-inserted or half-evicted entry.
 */
public class TtlCache<V> {
    private final ConcurrentHashMap<String, CacheEntry<V>> entries = new ConcurrentHashMap<>();
    private final ArrayDeque<InsertionRecord<V>> order = new ArrayDeque<>();
    private final Object insertLock = new Object();
    private final int maxEntries;
    private final long ttlMs;
    private final Clock clock;

    public TtlCache(int maxEntries, long ttlMs, Clock clock) {
        this.maxEntries = Math.max(1, maxEntries);
        this.ttlMs = Math.max(1L, ttlMs);
        this.clock = clock;
    }

    public Optional<CacheEntry<V>> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        CacheEntry<V> entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.millis())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    public void put(String key, V value) {
        if (key == null || value == null) {
            return;
        }
        synchronized (insertLock) {
            long now = clock.millis();
            CacheEntry<V> entry = new CacheEntry<>(value, now, now + ttlMs);
            entries.put(key, entry);
            order.addLast(new InsertionRecord<>(key, entry));
            evictExpired(now);
            evictOverflow();
            compactIfNeeded();
        }
    }

    public int size() {
        return entries.size();
    }

    public void invalidateAll() {
        synchronized (insertLock) {
            entries.clear();
            order.clear();
        }
    }

    private void evictExpired(long now) {
        InsertionRecord<V> head = order.peekFirst();
        while (head != null && head.entry().isExpired(now)) {
            order.pollFirst();
            entries.remove(head.key(), head.entry());
            head = order.peekFirst();
        }
    }

    private void evictOverflow() {
        while (entries.size() > maxEntries) {
            InsertionRecord<V> oldest = order.pollFirst();
            if (oldest == null) {
                break;
            }
            entries.remove(oldest.key(), oldest.entry());
        }
    }

    // re-inserted keys leave superseded records behind; drop them once they pile up
    private void compactIfNeeded() {
        if (order.size() <= (maxEntries * 2) + 16) {
            return;
        }
        Iterator<InsertionRecord<V>> iterator = order.iterator();
        while (iterator.hasNext()) {
            InsertionRecord<V> record = iterator.next();
            if (entries.get(record.key()) != record.entry()) {
                iterator.remove();
            }
        }
    }

    private record InsertionRecord<V>(String key, CacheEntry<V> entry) {}
}
