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

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Number of clusters to form at each discrete zoom level. Unlisted levels fall back to a default count.
 *
 * @author hal.hildebrand
 */
public final class ClusterCountTable {

    public static final int DEFAULT_CLUSTER_COUNT = 8;

    private static final ClusterCountTable DEFAULTS = new ClusterCountTable(
    Map.of(0, 1, 1, 2, 2, 9, 3, 18, 4, 24), DEFAULT_CLUSTER_COUNT);

    private final Map<Integer, Integer> countsByZoomLevel;
    private final int                   defaultCount;

    public ClusterCountTable(Map<Integer, Integer> countsByZoomLevel, int defaultCount) {
        if (defaultCount <= 0) {
            throw new IllegalArgumentException("Default cluster count must be positive: " + defaultCount);
        }
        var counts = new TreeMap<Integer, Integer>();
        countsByZoomLevel.forEach((level, count) -> {
            if (count == null || count <= 0) {
                throw new IllegalArgumentException("Cluster count for zoom level " + level + " must be positive");
            }
            counts.put(level, count);
        });
        this.countsByZoomLevel = counts;
        this.defaultCount = defaultCount;
    }

    /**
     * 0→1, 1→2, 2→9, 3→18, 4→24, everything else 8.
     */
    public static ClusterCountTable defaults() {
        return DEFAULTS;
    }

    public int clusterCount(int zoomLevel) {
        return countsByZoomLevel.getOrDefault(zoomLevel, defaultCount);
    }

    /**
     * Explicit per-level counts, ordered by level.
     */
    public Map<Integer, Integer> getCounts() {
        return Collections.unmodifiableMap(countsByZoomLevel);
    }

    public int getDefaultCount() {
        return defaultCount;
    }

    @Override
    public String toString() {
        return "ClusterCountTable" + countsByZoomLevel + "[default=" + defaultCount + "]";
    }
}
