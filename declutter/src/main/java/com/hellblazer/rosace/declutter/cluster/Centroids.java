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
import java.util.ArrayList;
import java.util.List;

/**
 * Centroid arithmetic shared by the grouper and its workers. Distances are Euclidean in raw coordinate space.
 *
 * @author hal.hildebrand
 */
public final class Centroids {

    private Centroids() {
    }

    /**
     * @return index of the centroid closest to {@code point}; the lowest index wins ties
     */
    public static int nearest(Point2d point, List<Point2d> centroids) {
        int best = 0;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (int c = 0; c < centroids.size(); c++) {
            double distance = point.distance(centroids.get(c));
            if (distance < bestDistance) {
                bestDistance = distance;
                best = c;
            }
        }
        return best;
    }

    /**
     * Nearest-centroid assignment for the points in {@code [from, to)}.
     */
    public static int[] assign(List<Point2d> points, int from, int to, List<Point2d> centroids) {
        var assignments = new int[to - from];
        for (int i = from; i < to; i++) {
            assignments[i - from] = nearest(points.get(i), centroids);
        }
        return assignments;
    }

    /**
     * Distance from every point to its nearest centroid.
     */
    public static double[] minDistances(List<Point2d> points, List<Point2d> centroids) {
        var distances = new double[points.size()];
        for (int i = 0; i < points.size(); i++) {
            var point = points.get(i);
            double min = Double.POSITIVE_INFINITY;
            for (var centroid : centroids) {
                min = Math.min(min, point.distance(centroid));
            }
            distances[i] = min;
        }
        return distances;
    }

    /**
     * Move every centroid to the arithmetic mean of its members. A centroid without members keeps its position.
     */
    public static List<Point2d> recompute(List<Point2d> points, List<Point2d> centroids, int[] assignments) {
        int k = centroids.size();
        var sums = new Point2d[k];
        var counts = new int[k];
        for (int c = 0; c < k; c++) {
            sums[c] = new Point2d();
        }
        for (int i = 0; i < points.size(); i++) {
            int c = assignments[i];
            sums[c].add(points.get(i));
            counts[c]++;
        }

        var moved = new ArrayList<Point2d>(k);
        for (int c = 0; c < k; c++) {
            if (counts[c] == 0) {
                moved.add(new Point2d(centroids.get(c)));
            } else {
                sums[c].scale(1.0 / counts[c]);
                moved.add(sums[c]);
            }
        }
        return moved;
    }

    /**
     * Sum of the distances from every point to the centroid it is assigned to.
     */
    public static double heterogeneity(List<Point2d> points, List<Point2d> centroids, int[] assignments) {
        double total = 0.0;
        for (int i = 0; i < points.size(); i++) {
            total += points.get(i).distance(centroids.get(assignments[i]));
        }
        return total;
    }
}
