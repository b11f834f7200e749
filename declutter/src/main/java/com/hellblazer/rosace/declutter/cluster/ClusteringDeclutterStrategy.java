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
import com.hellblazer.rosace.declutter.DeclutterContext;
import com.hellblazer.rosace.declutter.DeclutterStrategy;
import com.hellblazer.rosace.declutter.GlyphBatch;
import com.hellblazer.rosace.declutter.SelectionResult;
import com.hellblazer.rosace.geometry.Glyph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Declutters by grouping glyph positions with k-means++ and keeping one representative per group: the member closest
 * to the group's centroid. Every other member is hidden behind the representative.
 *
 * <p>The hidden count written for a representative is the size of its group, itself included, and is written for
 * every group, singletons too. The number of groups comes from the {@link ClusterCountTable} for the context's zoom
 * level, capped at the batch size. Ids already visible at another zoom level are not used by this strategy.
 *
 * @author hal.hildebrand
 */
public class ClusteringDeclutterStrategy implements DeclutterStrategy {

    private static final Logger log = LoggerFactory.getLogger(ClusteringDeclutterStrategy.class);

    private final KMeansPlusPlus    grouper;
    private final ClusterCountTable clusterCounts;
    private final int               maxIterations;

    public ClusteringDeclutterStrategy(KMeansPlusPlus grouper, ClusterCountTable clusterCounts, int maxIterations) {
        this.grouper = Objects.requireNonNull(grouper, "Grouper cannot be null");
        this.clusterCounts = Objects.requireNonNull(clusterCounts, "Cluster count table cannot be null");
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be positive: " + maxIterations);
        }
        this.maxIterations = maxIterations;
    }

    @Override
    public SelectionResult declutter(List<Glyph> glyphs, DeclutterContext context) {
        if (glyphs == null || glyphs.isEmpty()) {
            return SelectionResult.empty();
        }
        var problem = GlyphBatch.problem(glyphs, context.radiusMeters());
        if (problem.isPresent()) {
            log.warn("Skipping clustering declutter of {} glyphs: {}", glyphs.size(), problem.get());
            return SelectionResult.empty();
        }

        int k = Math.min(clusterCounts.clusterCount(context.zoomLevel()), glyphs.size());
        var points = glyphs.stream().map(Glyph::position).toList();
        var clustering = grouper.group(points, k, maxIterations);

        var members = new LinkedHashMap<Integer, IntArrayList>();
        for (int i = 0; i < glyphs.size(); i++) {
            members.computeIfAbsent(clustering.assignment(i), c -> new IntArrayList()).addInt(i);
        }

        var representatives = new HashSet<String>();
        var groupSizes = new LinkedHashMap<String, Integer>();
        members.forEach((cluster, group) -> {
            var centroid = clustering.centroid(cluster);
            int best = group.getInt(0);
            double bestDistance = Double.POSITIVE_INFINITY;
            for (int m = 0; m < group.size(); m++) {
                int index = group.getInt(m);
                double distance = points.get(index).distance(centroid);
                if (distance < bestDistance) {
                    bestDistance = distance;
                    best = index;
                }
            }
            var representative = glyphs.get(best).id();
            representatives.add(representative);
            groupSizes.put(representative, group.size());
        });

        var visible = new LinkedHashSet<String>();
        var hidden = new LinkedHashSet<String>();
        var counts = new LinkedHashMap<String, Integer>();
        for (var glyph : glyphs) {
            if (representatives.contains(glyph.id())) {
                visible.add(glyph.id());
                counts.put(glyph.id(), groupSizes.get(glyph.id()));
            } else {
                hidden.add(glyph.id());
            }
        }

        log.debug("Clustering declutter of {} glyphs at zoom level {}: {} groups, converged={} after {} iterations",
                  glyphs.size(), context.zoomLevel(), members.size(), clustering.converged(),
                  clustering.iterations());
        return new SelectionResult(visible, hidden, counts);
    }

    @Override
    public String name() {
        return "clustering";
    }

    public int getMaxIterations() {
        return maxIterations;
    }
}
