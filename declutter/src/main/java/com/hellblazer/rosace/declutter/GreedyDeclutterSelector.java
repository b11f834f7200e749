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
import com.hellblazer.rosace.geometry.Glyph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Greedy overlap filter. Repeatedly keeps the glyph with the largest total overlap against the remaining glyphs and
 * discards everything that overlaps it, until no two remaining glyphs overlap.
 *
 * <p>The selection is deterministic: when several glyphs share the maximum total overlap, the first one in input
 * order is kept.
 *
 * <p>Hidden glyphs are attributed to the visible glyph they overlap the most (first visible glyph wins ties); the
 * resulting hidden count of a visible glyph includes the glyph itself. Visible glyphs that hide nothing get no
 * entry.
 *
 * @author hal.hildebrand
 */
public class GreedyDeclutterSelector implements DeclutterStrategy {

    private static final Logger log = LoggerFactory.getLogger(GreedyDeclutterSelector.class);

    private final double overlapScale;

    public GreedyDeclutterSelector() {
        this(CircleOverlap.DEFAULT_SCALE);
    }

    /**
     * @param overlapScale coefficient applied to the sum of radii when testing for overlap
     */
    public GreedyDeclutterSelector(double overlapScale) {
        if (!Double.isFinite(overlapScale) || overlapScale <= 0) {
            throw new IllegalArgumentException("Overlap scale must be positive: " + overlapScale);
        }
        this.overlapScale = overlapScale;
    }

    @Override
    public SelectionResult declutter(List<Glyph> glyphs, DeclutterContext context) {
        return select(glyphs, context.radiusMeters(), context.alreadyVisible());
    }

    @Override
    public String name() {
        return "greedy";
    }

    public double getOverlapScale() {
        return overlapScale;
    }

    public SelectionResult select(List<Glyph> glyphs, double radiusMeters) {
        return select(glyphs, radiusMeters, Set.of());
    }

    /**
     * Select a non-overlapping subset of the glyphs.
     *
     * @param glyphs         batch to declutter
     * @param radiusMeters   radius shared by every glyph
     * @param alreadyVisible ids shown at another zoom level; glyphs overlapping any of them start out hidden. Ids
     *                       outside the batch are ignored.
     * @return the selection, empty for an empty or malformed batch
     */
    public SelectionResult select(List<Glyph> glyphs, double radiusMeters, Set<String> alreadyVisible) {
        if (glyphs == null || glyphs.isEmpty()) {
            return SelectionResult.empty();
        }
        var problem = GlyphBatch.problem(glyphs, radiusMeters);
        if (problem.isPresent()) {
            log.warn("Skipping greedy declutter of {} glyphs: {}", glyphs.size(), problem.get());
            return SelectionResult.empty();
        }

        var ids = glyphs.stream().map(Glyph::id).toList();
        var index = IntersectionIndex.build(glyphs.stream().map(g -> g.withRadius(radiusMeters)).toList(),
                                            overlapScale);

        var working = new ArrayList<>(ids);
        if (alreadyVisible != null && !alreadyVisible.isEmpty()) {
            working.removeIf(id -> alreadyVisible.stream().anyMatch(shown -> index.overlaps(id, shown)));
        }
        int preHidden = ids.size() - working.size();

        int rounds = 0;
        while (!working.isEmpty()) {
            String kept = null;
            double maxScore = -1.0;
            for (var id : working) {
                double score = conflictScore(id, working, index);
                if (score > maxScore) {
                    maxScore = score;
                    kept = id;
                }
            }
            if (kept == null || maxScore == 0.0) {
                break;
            }
            rounds++;

            // The kept glyph stays in the working set: with its neighbors gone its score drops to zero
            var winner = kept;
            working.removeIf(id -> !id.equals(winner) && index.overlaps(winner, id));
        }

        var visible = new LinkedHashSet<>(working);
        var hidden = new LinkedHashSet<String>();
        for (var id : ids) {
            if (!visible.contains(id)) {
                hidden.add(id);
            }
        }

        var counts = hiddenCounts(visible, hidden, index);
        log.debug("Greedy declutter of {} glyphs at {}m: {} visible, {} hidden ({} pre-hidden), {} rounds",
                  ids.size(), radiusMeters, visible.size(), hidden.size(), preHidden, rounds);
        return new SelectionResult(visible, hidden, counts);
    }

    private static double conflictScore(String id, List<String> working, IntersectionIndex index) {
        var neighbors = index.neighbors(id);
        if (neighbors.isEmpty()) {
            return 0.0;
        }
        double score = 0.0;
        for (var other : working) {
            if (!other.equals(id)) {
                score += neighbors.getOrDefault(other, 0.0);
            }
        }
        return score;
    }

    private static Map<String, Integer> hiddenCounts(Set<String> visible, Set<String> hidden,
                                                     IntersectionIndex index) {
        var bestVisible = new HashMap<String, String>();
        var bestArea = new HashMap<String, Double>();
        for (var v : visible) {
            for (var h : hidden) {
                double area = index.area(v, h);
                if (area > 0 && area > bestArea.getOrDefault(h, 0.0)) {
                    bestVisible.put(h, v);
                    bestArea.put(h, area);
                }
            }
        }

        var attributed = new HashMap<String, Integer>();
        for (var v : bestVisible.values()) {
            attributed.merge(v, 1, Integer::sum);
        }

        var counts = new LinkedHashMap<String, Integer>();
        for (var v : visible) {
            var n = attributed.get(v);
            if (n != null) {
                // self inclusion
                counts.put(v, n + 1);
            }
        }
        return counts;
    }
}
