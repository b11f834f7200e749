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

import com.hellblazer.rosace.common.IntArrayList;
import com.hellblazer.rosace.declutter.exceptions.InvalidInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point2d;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * K-means++ spatial grouper with a parallel assignment step.
 *
 * <p>Seeding follows "k-means++: The Advantages of Careful Seeding" (Arthur and Vassilvitskii, 2007), with the
 * weighted draw approximated by a candidate list: every point index is repeated {@code ceil(weight * 100)} times,
 * where weight is the point's distance to its nearest chosen centroid over the sum of those distances, and the new
 * centroid is drawn uniformly from that list. The approximation is kept as is; runs with the same random sequence
 * produce the same groups.
 *
 * <p>Each iteration assigns points to their nearest centroid through the {@link PartitionedIterationExecutor},
 * re-seeds any centroid left without members, stops once the assignment repeats, and otherwise moves the centroids
 * to the mean of their members. Re-seeding rounds consume iterations, so a degenerate input (more groups than
 * distinct positions) runs out the budget instead of looping forever.
 *
 * <p>Centroids and assignments are owned by a single run and never shared across runs. A grouper instance draws
 * from one {@link Random}, so concurrent runs on the same instance are not reproducible.
 *
 * @author hal.hildebrand
 */
public class KMeansPlusPlus {

    public static final int DEFAULT_MAX_ITERATIONS = 100;

    private static final Logger log          = LoggerFactory.getLogger(KMeansPlusPlus.class);
    private static final int    WEIGHT_SCALE = 100;

    private final PartitionedIterationExecutor executor;
    private final Random                       random;

    public KMeansPlusPlus(PartitionedIterationExecutor executor, Random random) {
        this.executor = Objects.requireNonNull(executor, "Executor cannot be null");
        this.random = Objects.requireNonNull(random, "Random cannot be null");
    }

    public ClusteringResult group(List<Point2d> points, int k) {
        return group(points, k, DEFAULT_MAX_ITERATIONS);
    }

    /**
     * Partition the points into {@code k} groups.
     *
     * @param points        positions in raw coordinate space
     * @param k             number of groups (must be > 0)
     * @param maxIterations iteration budget (must be > 0)
     * @return assignment, final centroids and convergence diagnostics
     * @throws InvalidInputException  if {@code points} is empty
     * @throws IllegalArgumentException if {@code k} or {@code maxIterations} is not positive
     * @throws com.hellblazer.rosace.declutter.exceptions.WorkerFailureException if a parallel step fails
     */
    public ClusteringResult group(List<Point2d> points, int k, int maxIterations) {
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive: " + k);
        }
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be positive: " + maxIterations);
        }
        if (points == null || points.isEmpty()) {
            throw new InvalidInputException("Cannot cluster zero points into " + k + " groups");
        }

        var data = points.stream().map(Point2d::new).toList();
        var centroids = seed(data, k);

        int[] previous = null;
        int[] assignments = null;
        boolean converged = false;
        int iteration = 0;
        while (iteration < maxIterations) {
            iteration++;
            assignments = executor.assign(data, centroids);

            var empty = emptyClusters(assignments, k);
            if (!empty.isEmpty()) {
                for (int i = 0; i < empty.size(); i++) {
                    centroids.set(empty.getInt(i), weightedDraw(data, centroids));
                }
                log.debug("Iteration {}: re-seeded {} empty clusters", iteration, empty.size());
                continue;
            }

            if (Arrays.equals(previous, assignments)) {
                converged = true;
                break;
            }
            previous = assignments;
            centroids = new ArrayList<>(executor.recenter(data, centroids, assignments));
            log.trace("Iteration {}: centroids {}", iteration, centroids);
        }

        if (converged) {
            log.debug("k-means converged after {} iterations (k={}, n={})", iteration, k, data.size());
        } else {
            // settle on the assignment implied by the last centroids
            assignments = executor.assign(data, centroids);
            log.warn("k-means stopped at the {} iteration limit without converging (k={}, n={})", maxIterations, k,
                     data.size());
        }

        double heterogeneity = Centroids.heterogeneity(data, centroids, assignments);
        return new ClusteringResult(assignments, centroids, iteration, converged, heterogeneity);
    }

    /**
     * First centroid uniformly at random, the rest by distance-weighted draws.
     */
    List<Point2d> seed(List<Point2d> data, int k) {
        var centroids = new ArrayList<Point2d>(k);
        centroids.add(new Point2d(data.get(random.nextInt(data.size()))));
        while (centroids.size() < k) {
            centroids.add(weightedDraw(data, centroids));
        }
        return centroids;
    }

    /**
     * Draw a point with probability roughly proportional to its distance from the nearest centroid.
     */
    Point2d weightedDraw(List<Point2d> data, List<Point2d> centroids) {
        var candidates = weightedCandidates(Centroids.minDistances(data, centroids));
        int index = candidates.isEmpty()
                    ? random.nextInt(data.size())
                    : candidates.getInt(random.nextInt(candidates.size()));
        return new Point2d(data.get(index));
    }

    /**
     * Replicate each index {@code ceil(weight * 100)} times. Empty when every point sits on a centroid.
     */
    static IntArrayList weightedCandidates(double[] distances) {
        double total = 0.0;
        for (var distance : distances) {
            total += distance;
        }
        var candidates = new IntArrayList(WEIGHT_SCALE + distances.length);
        if (total <= 0.0 || !Double.isFinite(total)) {
            return candidates;
        }
        for (int i = 0; i < distances.length; i++) {
            double multiples = distances[i] / total * WEIGHT_SCALE;
            candidates.addRepeated(i, (int) Math.ceil(multiples));
        }
        return candidates;
    }

    private static IntArrayList emptyClusters(int[] assignments, int k) {
        var populated = new boolean[k];
        for (var cluster : assignments) {
            populated[cluster] = true;
        }
        var empty = new IntArrayList();
        for (int c = 0; c < k; c++) {
            if (!populated[c]) {
                empty.addInt(c);
            }
        }
        return empty;
    }
}
