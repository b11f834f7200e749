/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Rosace.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.rosace.declutter.cache;

import com.hellblazer.rosace.declutter.SelectionResult;
import com.hellblazer.rosace.declutter.exceptions.CacheStoreException;
import com.hellblazer.rosace.declutter.exceptions.NoCachedDataException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Three tier cache of selection results keyed by (period, zoom level).
 *
 * <p>Lookup order is the in-memory map, then the precomputed directory (tier 1), then the persisted key-value store
 * (tier 2). A result found in a slower tier is promoted into memory. Results computed through
 * {@link #getOrCompute(CacheKey, Supplier)} are written to memory and tier 2; the precomputed directory is never
 * written on that path.
 *
 * <p>Mutations and computations for one key are serialized by a lock owned by that key. Operations on different
 * keys never contend. A tier-2 write that fails is logged and counted; the computed result is still returned.
 *
 * <p>Per-key locks are kept for the life of the cache, {@link #invalidate(CacheKey)} included, so a thread waiting on
 * a key and one arriving later always share the same lock. The key space is periods times zoom levels, so the lock
 * map stays bounded.
 *
 * @author hal.hildebrand
 */
public class SelectionResultCache {

    private static final Logger log = LoggerFactory.getLogger(SelectionResultCache.class);

    private final ConcurrentHashMap<CacheKey, SelectionResult> memory = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<CacheKey, ReentrantLock>   locks  = new ConcurrentHashMap<>();
    private final PrecomputedResultDirectory                   precomputed;
    private final KeyValueStore                                store;
    private final SelectionResultCodec                         codec;

    // Statistics
    private final AtomicLong memoryHits      = new AtomicLong();
    private final AtomicLong precomputedHits = new AtomicLong();
    private final AtomicLong storeHits       = new AtomicLong();
    private final AtomicLong misses          = new AtomicLong();
    private final AtomicLong computations    = new AtomicLong();
    private final AtomicLong writeFailures   = new AtomicLong();
    private final AtomicLong invalidations   = new AtomicLong();

    /**
     * Cache without a precomputed directory.
     */
    public SelectionResultCache(KeyValueStore store) {
        this(null, store, new SelectionResultCodec());
    }

    /**
     * @param precomputed tier-1 directory, or null if there is none
     * @param store       tier-2 store
     * @param codec       JSON form shared by both persistent tiers
     */
    public SelectionResultCache(PrecomputedResultDirectory precomputed, KeyValueStore store,
                                SelectionResultCodec codec) {
        this.precomputed = precomputed;
        this.store = Objects.requireNonNull(store, "Key-value store cannot be null");
        this.codec = Objects.requireNonNull(codec, "Codec cannot be null");
    }

    /**
     * @return the cached selection, or empty if no tier holds one
     */
    public Optional<SelectionResult> get(CacheKey key) {
        var cached = memory.get(key);
        if (cached != null) {
            memoryHits.incrementAndGet();
            return Optional.of(cached);
        }
        var lock = lockFor(key);
        lock.lock();
        try {
            var found = lookup(key);
            if (found.isEmpty()) {
                misses.incrementAndGet();
            }
            return found;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the cached selection for the key, computing and storing it on a miss. Concurrent callers for the same
     * key compute at most once.
     */
    public SelectionResult getOrCompute(CacheKey key, Supplier<SelectionResult> computation) {
        var cached = memory.get(key);
        if (cached != null) {
            memoryHits.incrementAndGet();
            return cached;
        }
        var lock = lockFor(key);
        lock.lock();
        try {
            var found = lookup(key);
            if (found.isPresent()) {
                return found.get();
            }
            misses.incrementAndGet();
            var result = Objects.requireNonNull(computation.get(), "Computation returned null for " + key);
            computations.incrementAndGet();
            memory.put(key, result);
            persist(key, result);
            log.info("Computed selection {}: {} visible, {} hidden", key, result.visible().size(),
                     result.hidden().size());
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stores the selection in memory and tier 2.
     */
    public void put(CacheKey key, SelectionResult result) {
        Objects.requireNonNull(result, "Result cannot be null");
        var lock = lockFor(key);
        lock.lock();
        try {
            memory.put(key, result);
            persist(key, result);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops the key from memory and tier 2, and removes its precomputed file when the directory is writable.
     */
    public void invalidate(CacheKey key) {
        var lock = lockFor(key);
        lock.lock();
        try {
            memory.remove(key);
            try {
                store.remove(key.storageKey());
            } catch (CacheStoreException e) {
                log.warn("Failed to remove {} from persisted cache: {}", key, e.getMessage());
            }
            if (precomputed != null && precomputed.delete(key)) {
                log.debug("Removed precomputed selection for {}", key);
            }
            invalidations.incrementAndGet();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Clears the in-memory tier. Persistent tiers are untouched.
     */
    public void invalidateAll() {
        int count = memory.size();
        memory.clear();
        invalidations.addAndGet(count);
    }

    /**
     * @return the JSON stored in tier 2 for the key
     * @throws NoCachedDataException if the key was never stored
     */
    public String export(CacheKey key) {
        return store.get(key.storageKey())
                    .orElseThrow(() -> new NoCachedDataException("No cached selection for " + key));
    }

    /**
     * Writes the tier-2 JSON for the key into the directory under its precomputed file name, so the directory can be
     * used as a tier-1 source later.
     *
     * @return the written file
     * @throws NoCachedDataException if the key was never stored
     * @throws CacheStoreException   if the file cannot be written
     */
    public Path exportTo(CacheKey key, Path directory) {
        var file = PrecomputedResultDirectory.writeFile(directory, key, export(key));
        log.info("Exported selection {} to {}", key, file);
        return file;
    }

    /**
     * Number of selections held in memory.
     */
    public int size() {
        return memory.size();
    }

    public CacheStats getStats() {
        return new CacheStats(memoryHits.get(), precomputedHits.get(), storeHits.get(), misses.get(),
                              computations.get(), writeFailures.get(), invalidations.get(), memory.size());
    }

    public void resetStats() {
        memoryHits.set(0);
        precomputedHits.set(0);
        storeHits.set(0);
        misses.set(0);
        computations.set(0);
        writeFailures.set(0);
        invalidations.set(0);
    }

    private Optional<SelectionResult> lookup(CacheKey key) {
        var cached = memory.get(key);
        if (cached != null) {
            memoryHits.incrementAndGet();
            return Optional.of(cached);
        }
        if (precomputed != null) {
            var fromDirectory = precomputed.read(key);
            if (fromDirectory.isPresent()) {
                log.debug("Precomputed hit for {}", key);
                precomputedHits.incrementAndGet();
                memory.put(key, fromDirectory.get());
                return fromDirectory;
            }
        }
        Optional<String> json;
        try {
            json = store.get(key.storageKey());
        } catch (CacheStoreException e) {
            log.warn("Failed to read {} from persisted cache: {}", key, e.getMessage());
            return Optional.empty();
        }
        var fromStore = json.flatMap(text -> codec.decode(text, key.storageKey()));
        if (fromStore.isPresent()) {
            log.debug("Persisted hit for {}", key);
            storeHits.incrementAndGet();
            memory.put(key, fromStore.get());
        }
        return fromStore;
    }

    private void persist(CacheKey key, SelectionResult result) {
        try {
            store.put(key.storageKey(), codec.encode(result));
        } catch (CacheStoreException e) {
            writeFailures.incrementAndGet();
            log.warn("Failed to persist selection {}, keeping it in memory only: {}", key, e.getMessage());
        }
    }

    private ReentrantLock lockFor(CacheKey key) {
        return locks.computeIfAbsent(key, k -> new ReentrantLock());
    }

    /**
     * Cache statistics snapshot
     */
    public record CacheStats(long memoryHits, long precomputedHits, long storeHits, long misses, long computations,
                             long writeFailures, long invalidations, int currentSize) {

        public long hits() {
            return memoryHits + precomputedHits + storeHits;
        }

        public double hitRate() {
            long total = hits() + misses;
            return total == 0 ? 0.0 : (double) hits() / total;
        }

        @Override
        public String toString() {
            return String.format(
            "SelectionResultCache[hits=%d (memory=%d, precomputed=%d, persisted=%d), misses=%d, hitRate=%.1f%%, "
            + "computed=%d, writeFailures=%d, invalidations=%d, size=%d]", hits(), memoryHits, precomputedHits,
            storeHits, misses, hitRate() * 100, computations, writeFailures, invalidations, currentSize);
        }
    }
}
