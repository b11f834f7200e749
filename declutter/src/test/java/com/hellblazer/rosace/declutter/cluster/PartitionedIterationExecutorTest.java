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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point2d;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
@DisplayName("Partitioned Iteration Executor Tests")
class PartitionedIterationExecutorTest {

    @Test
    @DisplayName("Split covers the range in contiguous slices")
    void testSplit() {
        assertArrayEquals(new int[] { 0, 3, 6, 10 }, PartitionedIterationExecutor.split(10, 3));
        assertArrayEquals(new int[] { 0, 0, 1, 1, 2 }, PartitionedIterationExecutor.split(2, 4));
        assertArrayEquals(new int[] { 0, 0 }, PartitionedIterationExecutor.split(0, 1));
    }

    @Test
    @DisplayName("Parallel assignment matches a sequential pass for any partition count")
    void testAssignMatchesSequential() {
        var random = new Random(17);
        var points = new ArrayList<Point2d>();
        for (int i = 0; i < 101; i++) {
            points.add(new Point2d(random.nextDouble() * 50, random.nextDouble() * 50));
        }
        var centroids = List.of(new Point2d(10, 10), new Point2d(40, 10), new Point2d(25, 40));
        var expected = Centroids.assign(points, 0, points.size(), centroids);

        for (int partitions = 1; partitions <= 6; partitions++) {
            try (var executor = new PartitionedIterationExecutor(partitions)) {
                assertArrayEquals(expected, executor.assign(points, centroids), "partitions=" + partitions);
            }
        }
    }

    @Test
    @DisplayName("Partial results are concatenated in split order, not completion order")
    void testReassemblyOrder() {
        var points = new ArrayList<Point2d>();
        for (int i = 0; i < 12; i++) {
            points.add(new Point2d(i, 0));
        }
        var centroids = List.of(new Point2d(0, 0), new Point2d(5, 0), new Point2d(11, 0));
        var expected = Centroids.assign(points, 0, points.size(), centroids);

        var reversing = new ReversingExecutorService(4);
        try (var executor = new PartitionedIterationExecutor(4, reversing)) {
            assertArrayEquals(expected, executor.assign(points, centroids));
        }
        assertFalse(reversing.isShutdown(), "Caller owned pool must stay up");
    }

    @Test
    @DisplayName("Recenter returns the member means")
    void testRecenter() {
        var points = List.of(new Point2d(0, 0), new Point2d(2, 0), new Point2d(10, 10));
        var centroids = List.of(new Point2d(0, 0), new Point2d(10, 10), new Point2d(50, 50));

        try (var executor = new PartitionedIterationExecutor()) {
            var moved = executor.recenter(points, centroids, new int[] { 0, 0, 1 });

            assertEquals(List.of(new Point2d(1, 0), new Point2d(10, 10), new Point2d(50, 50)), moved);
        }
    }

    @Test
    @DisplayName("A failing partition fails the whole step")
    void testWorkerFailure() {
        var points = Arrays.asList(new Point2d(0, 0), null, new Point2d(1, 1), new Point2d(2, 2));
        var centroids = List.of(new Point2d(0, 0));

        try (var executor = new PartitionedIterationExecutor(2)) {
            var e = assertThrows(WorkerFailureException.class, () -> executor.assign(points, centroids));
            assertNotNull(e.getCause());
        }
    }

    @Test
    @DisplayName("Dispatch after close fails instead of hanging")
    void testClosed() {
        var executor = new PartitionedIterationExecutor(2);
        executor.close();

        assertTrue(executor.isShutdown());
        assertThrows(WorkerFailureException.class,
                     () -> executor.assign(List.of(new Point2d(0, 0)), List.of(new Point2d(0, 0))));
    }

    @Test
    @DisplayName("Closing leaves a caller owned pool running")
    void testCallerOwnedPool() throws Exception {
        var pool = Executors.newFixedThreadPool(2);
        try {
            var executor = new PartitionedIterationExecutor(3, pool);
            executor.close();
            assertFalse(pool.isShutdown());
            assertEquals(3, executor.getPartitions());
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
        }
    }

    @Test
    @DisplayName("Partition and thread counts must be positive")
    void testInvalidCounts() {
        assertThrows(IllegalArgumentException.class, () -> new PartitionedIterationExecutor(0));
        assertThrows(IllegalArgumentException.class, () -> new PartitionedIterationExecutor(2, 0));
    }

    /**
     * Holds submitted tasks until a full batch has arrived, then runs the batch last-submitted first on the calling
     * thread.
     */
    private static class ReversingExecutorService extends AbstractExecutorService {
        private final int            batch;
        private final List<Runnable> pending = new ArrayList<>();
        private volatile boolean     shutdown;

        ReversingExecutorService(int batch) {
            this.batch = batch;
        }

        @Override
        public void execute(Runnable command) {
            pending.add(command);
            if (pending.size() == batch) {
                var tasks = new ArrayList<>(pending);
                pending.clear();
                Collections.reverse(tasks);
                tasks.forEach(Runnable::run);
            }
        }

        @Override
        public void shutdown() {
            shutdown = true;
        }

        @Override
        public List<Runnable> shutdownNow() {
            shutdown = true;
            return List.of();
        }

        @Override
        public boolean isShutdown() {
            return shutdown;
        }

        @Override
        public boolean isTerminated() {
            return shutdown;
        }

        @Override
        public boolean awaitTermination(long timeout, TimeUnit unit) {
            return true;
        }
    }
}
