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

import com.hellblazer.rosace.geometry.CircleOverlap;
import com.hellblazer.rosace.geometry.GlyphDisc;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sparse weighted overlap graph over one glyph batch. An edge exists between two glyphs when their discs overlap and
 * the lens area between them is positive; the area is stored under both endpoints so lookups from either side agree.
 *
 * <p>Construction is O(n²) and the index is rebuilt from scratch for every batch.
 *
 * @author hal.hildebrand
 */
public final class IntersectionIndex {

    private final Map<String, Map<String, Double>> adjacency;
    private final int                              edgeCount;

    private IntersectionIndex(Map<String, Map<String, Double>> adjacency, int edgeCount) {
        this.adjacency = adjacency;
        this.edgeCount = edgeCount;
    }

    /**
     * Build the index for a batch of sized glyphs.
     *
     * @param discs glyphs with their radius, ids unique
     * @param scale coefficient applied to the sum of radii by the overlap test
     */
    public static IntersectionIndex build(List<GlyphDisc> discs, double scale) {
        var adjacency = new LinkedHashMap<String, Map<String, Double>>(discs.size() * 2);
        for (var disc : discs) {
            adjacency.put(disc.id(), new LinkedHashMap<>());
        }

        int edges = 0;
        for (int i = 0; i < discs.size(); i++) {
            var a = discs.get(i);
            for (int j = i + 1; j < discs.size(); j++) {
                var b = discs.get(j);
                if (!CircleOverlap.isOverlapping(a, b, scale)) {
                    continue;
                }
                double area = CircleOverlap.intersectionArea(a, b);
                if (area > 0) {
                    adjacency.get(a.id()).put(b.id(), area);
                    adjacency.get(b.id()).put(a.id(), area);
                    edges++;
                }
            }
        }
        return new IntersectionIndex(adjacency, edges);
    }

    /**
     * @return the overlap area between the two glyphs, 0 if they do not overlap or either id is unknown
     */
    public double area(String a, String b) {
        var neighbors = adjacency.get(a);
        if (neighbors == null) {
            return 0.0;
        }
        return neighbors.getOrDefault(b, 0.0);
    }

    public boolean overlaps(String a, String b) {
        return area(a, b) > 0;
    }

    /**
     * @return unmodifiable view of the glyphs overlapping {@code id} and the corresponding areas
     */
    public Map<String, Double> neighbors(String id) {
        var neighbors = adjacency.get(id);
        return neighbors == null ? Map.of() : Collections.unmodifiableMap(neighbors);
    }

    public boolean contains(String id) {
        return adjacency.containsKey(id);
    }

    /**
     * Number of unordered overlapping pairs.
     */
    public int edgeCount() {
        return edgeCount;
    }

    /**
     * Number of glyphs indexed.
     */
    public int size() {
        return adjacency.size();
    }
}
