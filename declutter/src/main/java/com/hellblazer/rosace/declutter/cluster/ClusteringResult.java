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

import javax.vecmath.Point2d;
import java.util.Arrays;
import java.util.List;

/**
 * Outcome of one k-means++ run.
 *
 * @param assignments   cluster index per input point
 * @param centroids     final centroid positions, indexed by cluster
 * @param iterations    iterations consumed, re-seeding rounds included
 * @param converged     false when the iteration budget ran out before the assignment stabilized
 * @param heterogeneity sum of the distances from every point to its assigned centroid
 * @author hal.hildebrand
 */
public record ClusteringResult(int[] assignments, List<Point2d> centroids, int iterations, boolean converged,
                               double heterogeneity) {

    public ClusteringResult {
        assignments = assignments.clone();
        centroids = centroids.stream().map(Point2d::new).toList();
    }

    @Override
    public int[] assignments() {
        return assignments.clone();
    }

    public int assignment(int pointIndex) {
        return assignments[pointIndex];
    }

    /**
     * @return a copy of the centroid of {@code cluster}
     */
    public Point2d centroid(int cluster) {
        return new Point2d(centroids.get(cluster));
    }

    @Override
    public List<Point2d> centroids() {
        return centroids.stream().map(Point2d::new).toList();
    }

    /**
     * Classify a new point using the learned centroids.
     *
     * @return index of the nearest final centroid
     */
    public int classify(Point2d point) {
        return Centroids.nearest(point, centroids);
    }

    public int k() {
        return centroids.size();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ClusteringResult other)) return false;

        return iterations == other.iterations && converged == other.converged
        && Double.compare(heterogeneity, other.heterogeneity) == 0 && Arrays.equals(assignments, other.assignments)
        && centroids.equals(other.centroids);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(assignments);
        result = 31 * result + centroids.hashCode();
        result = 31 * result + Integer.hashCode(iterations);
        result = 31 * result + Boolean.hashCode(converged);
        result = 31 * result + Double.hashCode(heterogeneity);
        return result;
    }

    @Override
    public String toString() {
        return "ClusteringResult[k=" + centroids.size() + ", points=" + assignments.length + ", iterations="
        + iterations + ", converged=" + converged + ", heterogeneity=" + heterogeneity + "]";
    }
}
