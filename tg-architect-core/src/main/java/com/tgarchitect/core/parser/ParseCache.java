package com.tgarchitect.core.parser;

import com.tgarchitect.core.model.TerragruntFile;

import java.time.Clock;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cache of parsed files keyed by path.
 *
 * <p>An entry is only returned while the file's size and modification time match the values
 * recorded at insertion and the entry is younger than the TTL. Entries are write-once; a
 * changed file replaces its entry instead of updating it. When the capacity is reached the
 * oldest entry is evicted.
 *
 * <p>Thread-safe.
 */
public class ParseCache {

    private record Entry(TerragruntFile file, long size, long modifiedMillis, long createdAt) {
    }

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final int maxSize;
    private final long ttlMillis;
    private final Clock clock;

    /**
     * @param maxSize maximum number of entries, at least 1
     * @param ttlMillis entry lifetime, 0 for no expiry
     * @param clock time source
     */
    public ParseCache(int maxSize, long ttlMillis, Clock clock) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be at least 1");
        }
        this.maxSize = maxSize;
        this.ttlMillis = ttlMillis;
        this.clock = clock;
    }

    public ParseCache(int maxSize, long ttlMillis) {
        this(maxSize, ttlMillis, Clock.systemUTC());
    }

    /**
     * Looks up a fresh entry.
     *
     * @param path file path
     * @param size current file size
     * @param modifiedMillis current modification time
     * @return the cached file if still valid
     */
    public Optional<TerragruntFile> get(String path, long size, long modifiedMillis) {
        Entry entry = entries.get(path);
        if (entry == null) {
            return Optional.empty();
        }
        boolean expired = ttlMillis > 0 && clock.millis() - entry.createdAt() > ttlMillis;
        if (expired || entry.size() != size || entry.modifiedMillis() != modifiedMillis) {
            entries.remove(path, entry);
            return Optional.empty();
        }
        return Optional.of(entry.file());
    }

    /**
     * Stores a parsed file. Writers are serialized so the capacity is never exceeded.
     */
    public synchronized void put(String path, long size, long modifiedMillis, TerragruntFile file) {
        while (!entries.containsKey(path) && entries.size() >= maxSize) {
            evictOldest();
        }
        entries.put(path, new Entry(file, size, modifiedMillis, clock.millis()));
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }

    private void evictOldest() {
        entries.entrySet().stream()
            .min(Comparator.comparingLong(e -> e.getValue().createdAt()))
            .ifPresent(oldest -> entries.remove(oldest.getKey(), oldest.getValue()));
    }
}
