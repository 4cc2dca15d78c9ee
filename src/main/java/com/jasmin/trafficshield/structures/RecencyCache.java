package com.jasmin.trafficshield.structures;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded least-recently-used cache with O(1) get and put.
 * <p>
 * Both {@link #get} and {@link #put} mark the key as most recently used. Inserting a new key
 * beyond capacity evicts exactly one entry, the least recently touched one.
 */
public class RecencyCache<K, V> {

    private final int capacity;
    private final LinkedHashMap<K, V> entries;
    private long evictions;

    public RecencyCache(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new LinkedHashMap<>(16, 0.75f, true);
    }

    public synchronized Optional<V> get(K key) {
        return Optional.ofNullable(entries.get(key));
    }

    /**
     * Inserts or replaces the value for {@code key}.
     *
     * @return the evicted key, when the insert pushed the cache over capacity
     */
    public synchronized Optional<K> put(K key, V value) {
        entries.put(key, value);
        if (entries.size() <= capacity) {
            return Optional.empty();
        }
        Iterator<K> it = entries.keySet().iterator();
        K eldest = it.next();
        it.remove();
        evictions++;
        return Optional.of(eldest);
    }

    public synchronized boolean remove(K key) {
        return entries.remove(key) != null;
    }

    public synchronized boolean containsKey(K key) {
        return entries.containsKey(key);
    }

    public synchronized int size() {
        return entries.size();
    }

    public int getCapacity() {
        return capacity;
    }

    public synchronized long getEvictions() {
        return evictions;
    }

    public synchronized double utilization() {
        return (double) entries.size() / capacity;
    }

    /** Keys ordered from least to most recently used. Does not change recency. */
    public synchronized List<K> keysByRecency() {
        return new ArrayList<>(entries.keySet());
    }

    public synchronized List<Map.Entry<K, V>> snapshot() {
        List<Map.Entry<K, V>> out = new ArrayList<>(entries.size());
        for (Map.Entry<K, V> e : entries.entrySet()) {
            out.add(Map.entry(e.getKey(), e.getValue()));
        }
        return out;
    }

    public synchronized void clear() {
        entries.clear();
    }
}
