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
package com.hellblazer.rosace.declutter.config;

import com.hellblazer.rosace.declutter.cluster.ClusterCountTable;
import com.hellblazer.rosace.declutter.cluster.PartitionedIterationExecutor;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Configuration of a {@link com.hellblazer.rosace.declutter.DeclutterEngine}: which strategy declutters, how the
 * clustering run is bounded and parallelized, the zoom-level tables, and where the cache tiers live.
 *
 * @author hal.hildebrand
 */
public class DeclutterConfig {

    public enum Strategy {
        GREEDY, CLUSTERING
    }

    public static final int DEFAULT_MAX_ITERATIONS = 10000;

    private Strategy          strategy             = Strategy.GREEDY;
    private double            overlapScale         = 1.0;
    private int               maxIterations        = DEFAULT_MAX_ITERATIONS;
    private int               partitions           = PartitionedIterationExecutor.DEFAULT_PARTITIONS;
    private int               workerThreads        = PartitionedIterationExecutor.DEFAULT_PARTITIONS;
    private Long              seed;
    private ClusterCountTable clusterCounts        = ClusterCountTable.defaults();
    private ZoomLevelTable    zoomLevels           = ZoomLevelTable.defaults();
    private Path              precomputedDirectory;
    private boolean           precomputedWritable;
    private Path              storeFile;

    public static DeclutterConfig defaults() {
        return new DeclutterConfig();
    }

    public Strategy getStrategy() {
        return strategy;
    }

    /**
     * Factor applied to the summed radii in the overlap test.
     */
    public double getOverlapScale() {
        return overlapScale;
    }

    /**
     * Iteration budget of one clustering run.
     */
    public int getMaxIterations() {
        return maxIterations;
    }

    /**
     * Number of contiguous slices the assignment step is split into.
     */
    public int getPartitions() {
        return partitions;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    /**
     * Seed for the clustering random source; empty for a nondeterministic one.
     */
    public OptionalLong getSeed() {
        return seed == null ? OptionalLong.empty() : OptionalLong.of(seed);
    }

    public ClusterCountTable getClusterCounts() {
        return clusterCounts;
    }

    public ZoomLevelTable getZoomLevels() {
        return zoomLevels;
    }

    /**
     * Directory of precomputed {@code <period>_<zoom>_cache.json} files, if any.
     */
    public Optional<Path> getPrecomputedDirectory() {
        return Optional.ofNullable(precomputedDirectory);
    }

    public boolean isPrecomputedWritable() {
        return precomputedWritable;
    }

    /**
     * File backing the persisted cache tier; empty keeps that tier in memory.
     */
    public Optional<Path> getStoreFile() {
        return Optional.ofNullable(storeFile);
    }

    // Fluent API for configuration

    public DeclutterConfig withStrategy(Strategy strategy) {
        this.strategy = Objects.requireNonNull(strategy, "Strategy cannot be null");
        return this;
    }

    public DeclutterConfig withOverlapScale(double scale) {
        if (!(scale > 0) || !Double.isFinite(scale)) {
            throw new IllegalArgumentException("Overlap scale must be positive");
        }
        this.overlapScale = scale;
        return this;
    }

    public DeclutterConfig withMaxIterations(int iterations) {
        if (iterations <= 0) {
            throw new IllegalArgumentException("Max iterations must be positive");
        }
        this.maxIterations = iterations;
        return this;
    }

    public DeclutterConfig withPartitions(int partitions) {
        if (partitions <= 0) {
            throw new IllegalArgumentException("Partitions must be positive");
        }
        this.partitions = partitions;
        return this;
    }

    public DeclutterConfig withWorkerThreads(int threads) {
        if (threads <= 0) {
            throw new IllegalArgumentException("Worker threads must be positive");
        }
        this.workerThreads = threads;
        return this;
    }

    public DeclutterConfig withSeed(long seed) {
        this.seed = seed;
        return this;
    }

    public DeclutterConfig withClusterCounts(ClusterCountTable table) {
        this.clusterCounts = Objects.requireNonNull(table, "Cluster count table cannot be null");
        return this;
    }

    public DeclutterConfig withZoomLevels(ZoomLevelTable table) {
        this.zoomLevels = Objects.requireNonNull(table, "Zoom level table cannot be null");
        return this;
    }

    public DeclutterConfig withPrecomputedDirectory(Path directory, boolean writable) {
        this.precomputedDirectory = directory;
        this.precomputedWritable = writable;
        return this;
    }

    public DeclutterConfig withStoreFile(Path file) {
        this.storeFile = file;
        return this;
    }

    @Override
    public String toString() {
        return "DeclutterConfig[strategy=" + strategy + ", overlapScale=" + overlapScale + ", maxIterations="
        + maxIterations + ", partitions=" + partitions + ", workerThreads=" + workerThreads + ", seed=" + seed
        + ", precomputed=" + precomputedDirectory + (precomputedWritable ? " (writable)" : "") + ", store="
        + storeFile + "]";
    }
}
