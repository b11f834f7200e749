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
package com.hellblazer.rosace.declutter.cluster;

import com.hellblazer.rosace.declutter.exceptions.WorkerFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point2d;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fan-out/fan-in execution of one k-means iteration.
 *
 * <p>The assignment step splits the points into contiguous partitions, dispatches each partition to a worker and
 * waits for every partition before concatenating the partial assignments in split order, whatever order the workers
 * finish in. The centroid recompute is dispatched as a single task and awaited as well, so an iteration is complete
 * before the caller can start the next one.
 *
 * <p>There is no per-partition timeout: a partition that never returns blocks the iteration. A partition that fails
 * fails the whole step with a {@link WorkerFailureException}.
 *
 * <pre>
 * try (var executor = new PartitionedIterationExecutor(2)) {
 *     var grouper = new KMeansPlusPlus(executor, new Random(42));
 *     var result = grouper.group(points, 8, 100);
 * }
 * </pre>
 *
 * @author hal.hildebrand
 */
public class PartitionedIterationExecutor implements AutoCloseable {

    public static final int DEFAULT_PARTITIONS = 2;

    private static final Logger        log           = LoggerFactory.getLogger(PartitionedIterationExecutor.class);
    private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

    private final ExecutorService workers;
    private final int             partitions;
    private final boolean         ownsWorkers;

    public PartitionedIterationExecutor() {
        this(DEFAULT_PARTITIONS);
    }

    /**
     * Creates an executor with its own worker pool: one thread per partition.
     *
     * @param partitions number of partitions the assignment step is split into (must be > 0)
     */
    public PartitionedIterationExecutor(int partitions) {
        this(partitions, partitions);
    }

    /**
     * Creates an executor with its own pool of {@code threads} workers.
     */
    public PartitionedIterationExecutor(int partitions, int threads) {
        this(partitions, newWorkerPool(validate(threads)), true);
    }

    /**
     * Creates an executor on a caller-owned pool. {@link #close()} leaves that pool running.
     */
    public PartitionedIterationExecutor(int partitions, ExecutorService workers) {
        this(partitions, workers, false);
    }

    private PartitionedIterationExecutor(int partitions, ExecutorService workers, boolean ownsWorkers) {
        this.partitions = validate(partitions);
        this.workers = Objects.requireNonNull(workers, "Worker pool cannot be null");
        this.ownsWorkers = ownsWorkers;
        log.debug("Created PartitionedIterationExecutor with partitions={}", partitions);
    }

    /**
     * Partition boundaries: partition {@code p} covers {@code [bounds[p], bounds[p + 1])}.
     */
    static int[] split(int size, int partitions) {
        var bounds = new int[partitions + 1];
        for (int p = 0; p <= partitions; p++) {
            bounds[p] = (int) ((long) p * size / partitions);
        }
        return bounds;
    }

    /**
     * Assign every point to its nearest centroid, one worker per partition.
     *
     * @return the assignment vector, index-aligned with {@code points}
     * @throws WorkerFailureException if any partition fails
     */
    public int[] assign(List<Point2d> points, List<Point2d> centroids) {
        var bounds = split(points.size(), partitions);
        var futures = new ArrayList<CompletableFuture<int[]>>(partitions);
        for (int p = 0; p < partitions; p++) {
            int from = bounds[p];
            int to = bounds[p + 1];
            futures.add(dispatch(() -> Centroids.assign(points, from, to, centroids), "assignment partition " + p));
        }

        awaitAll(futures, "assignment");

        var assignments = new int[points.size()];
        int offset = 0;
        for (var future : futures) {
            var partial = future.join();
            System.arraycopy(partial, 0, assignments, offset, partial.length);
            offset += partial.length;
        }
        return assignments;
    }

    /**
     * Recompute the centroids as a single, non-parallel task and wait for it.
     *
     * @throws WorkerFailureException if the recompute fails
     */
    public List<Point2d> recenter(List<Point2d> points, List<Point2d> centroids, int[] assignments) {
        var future = dispatch(() -> Centroids.recompute(points, centroids, assignments), "centroid recompute");
        awaitAll(List.of(future), "centroid recompute");
        return future.join();
    }

    public int getPartitions() {
        return partitions;
    }

    public boolean isShutdown() {
        return workers.isShutdown();
    }

    /**
     * Shuts down the worker pool if this executor created it. Waits up to 5 seconds, then forces shutdown.
     */
    @Override
    public void close() {
        if (!ownsWorkers) {
            return;
        }
        log.debug("Shutting down PartitionedIterationExecutor");
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Partition workers did not terminate gracefully, forcing shutdown");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            log.warn("Interrupted while waiting for partition worker shutdown", e);
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private <T> CompletableFuture<T> dispatch(Callable<T> task, String description) {
        try {
            return CompletableFuture.supplyAsync(() -> {
                try {
                    return task.call();
                } catch (Exception e) {
                    throw new CompletionException(description + " failed", e);
                }
            }, workers);
        } catch (RejectedExecutionException e) {
            throw new WorkerFailureException("Could not dispatch " + description, e);
        }
    }

    private static void awaitAll(List<? extends CompletableFuture<?>> futures, String step) {
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException | CancellationException e) {
            var cause = e.getCause() != null ? e.getCause() : e;
            log.error("Parallel {} failed", step, cause);
            throw new WorkerFailureException("Parallel " + step + " failed", cause);
        }
    }

    private static ExecutorService newWorkerPool(int threads) {
        int pool = POOL_SEQUENCE.incrementAndGet();
        var threadCount = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, runnable -> {
            var thread = new Thread(runnable, "declutter-" + pool + "-worker-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    private static int validate(int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("Partition and thread counts must be > 0, got: " + count);
        }
        return count;
    }
}
