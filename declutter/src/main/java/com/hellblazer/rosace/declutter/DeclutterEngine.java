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
package com.hellblazer.rosace.declutter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.rosace.declutter.cache.CacheKey;
import com.hellblazer.rosace.declutter.cache.InMemoryKeyValueStore;
import com.hellblazer.rosace.declutter.cache.JsonFileKeyValueStore;
import com.hellblazer.rosace.declutter.cache.KeyValueStore;
import com.hellblazer.rosace.declutter.cache.PrecomputedResultDirectory;
import com.hellblazer.rosace.declutter.cache.SelectionResultCache;
import com.hellblazer.rosace.declutter.cache.SelectionResultCodec;
import com.hellblazer.rosace.declutter.cluster.ClusteringDeclutterStrategy;
import com.hellblazer.rosace.declutter.cluster.KMeansPlusPlus;
import com.hellblazer.rosace.declutter.cluster.PartitionedIterationExecutor;
import com.hellblazer.rosace.declutter.config.DeclutterConfig;
import com.hellblazer.rosace.geometry.Glyph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Entry point for decluttering: picks the strategy named by the configuration and routes every computation through
 * the {@link SelectionResultCache}.
 *
 * <pre>
 * try (var engine = new DeclutterEngine(new DeclutterConfigLoader().load())) {
 *     var plan = engine.initialize(glyphsByPeriod);
 *     var shown = plan.visibleRecords("2024-06", 2, records, Record::sensorId);
 * }
 * </pre>
 *
 * @author hal.hildebrand
 */
public class DeclutterEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DeclutterEngine.class);

    private final DeclutterConfig              config;
    private final SelectionResultCache         cache;
    private final PartitionedIterationExecutor executor;
    private final DeclutterStrategy            strategy;

    public DeclutterEngine(DeclutterConfig config) {
        this(config, createCache(config));
    }

    public DeclutterEngine(DeclutterConfig config, SelectionResultCache cache) {
        this.config = config;
        this.cache = cache;
        if (config.getStrategy() == DeclutterConfig.Strategy.CLUSTERING) {
            executor = new PartitionedIterationExecutor(config.getPartitions(), config.getWorkerThreads());
            var seed = config.getSeed();
            var random = seed.isPresent() ? new Random(seed.getAsLong()) : new Random();
            strategy = new ClusteringDeclutterStrategy(new KMeansPlusPlus(executor, random),
                                                       config.getClusterCounts(), config.getMaxIterations());
        } else {
            executor = null;
            strategy = new GreedyDeclutterSelector(config.getOverlapScale());
        }
        log.debug("Created DeclutterEngine with strategy={}", strategy.name());
    }

    /**
     * Builds the cache tiers named by the configuration: the precomputed directory if one is set, and a JSON file
     * store or an in-memory store for the persisted tier.
     */
    public static SelectionResultCache createCache(DeclutterConfig config) {
        var codec = new SelectionResultCodec();
        var precomputed = config.getPrecomputedDirectory()
                                .map(dir -> new PrecomputedResultDirectory(dir, config.isPrecomputedWritable(), codec))
                                .orElse(null);
        KeyValueStore store = config.getStoreFile()
                                    .<KeyValueStore>map(file -> new JsonFileKeyValueStore(file, new ObjectMapper()))
                                    .orElseGet(InMemoryKeyValueStore::new);
        return new SelectionResultCache(precomputed, store, codec);
    }

    /**
     * Declutters one batch, answering from the cache when the key was computed before.
     */
    public SelectionResult declutter(CacheKey key, List<Glyph> glyphs, DeclutterContext context) {
        return cache.getOrCompute(key, () -> strategy.declutter(glyphs == null ? List.of() : glyphs, context));
    }

    /**
     * Computes the selection of every period at every zoom level of the configured zoom-level table. Levels run from
     * coarsest to finest; the glyphs visible for a period at one level are passed as already visible when the next
     * level of the same period is computed.
     *
     * @param glyphsByPeriod glyphs keyed by period, in the order periods should be processed
     */
    public DeclutterPlan initialize(Map<String, List<Glyph>> glyphsByPeriod) {
        var zoomLevels = config.getZoomLevels();
        var visibleByPeriod = new HashMap<String, Set<String>>();
        var plan = new LinkedHashMap<Integer, Map<String, SelectionResult>>();
        for (int level = 0; level < zoomLevels.levels(); level++) {
            double radius = zoomLevels.radiusMeters(level);
            var byPeriod = new LinkedHashMap<String, SelectionResult>();
            for (var entry : glyphsByPeriod.entrySet()) {
                var period = entry.getKey();
                var context = new DeclutterContext(radius, level, visibleByPeriod.get(period));
                var result = declutter(new CacheKey(period, level), entry.getValue(), context);
                visibleByPeriod.put(period, result.visible());
                byPeriod.put(period, result);
            }
            plan.put(level, byPeriod);
        }
        log.info("Initialized {} periods across {} zoom levels with {}; {}", glyphsByPeriod.size(),
                 zoomLevels.levels(), strategy.name(), cache.getStats());
        return new DeclutterPlan(plan);
    }

    public SelectionResultCache getCache() {
        return cache;
    }

    public DeclutterConfig getConfig() {
        return config;
    }

    public DeclutterStrategy getStrategy() {
        return strategy;
    }

    @Override
    public void close() {
        if (executor != null) {
            executor.close();
        }
    }
}
