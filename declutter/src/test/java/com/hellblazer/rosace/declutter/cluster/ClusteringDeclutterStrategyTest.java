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

import com.hellblazer.rosace.declutter.DeclutterContext;
import com.hellblazer.rosace.declutter.SelectionResult;
import com.hellblazer.rosace.geometry.Glyph;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
@DisplayName("Clustering Declutter Strategy Tests")
class ClusteringDeclutterStrategyTest {

    private PartitionedIterationExecutor executor;
    private ClusterCountTable            counts;

    @BeforeEach
    void setUp() {
        executor = new PartitionedIterationExecutor(2);
        counts = new ClusterCountTable(Map.of(0, 2, 1, 3), 8);
    }

    @AfterEach
    void tearDown() {
        executor.close();
    }

    private ClusteringDeclutterStrategy strategy(long seed) {
        return new ClusteringDeclutterStrategy(new KMeansPlusPlus(executor, new Random(seed)), counts, 100);
    }

    @Test
    @DisplayName("One representative per group, counting the whole group")
    void testRepresentatives() {
        var glyphs = List.of(new Glyph("a1", 45, 3), new Glyph("b1", 46, 4), new Glyph("a2", 45, 3),
                             new Glyph("a3", 45, 3), new Glyph("b2", 46, 4));

        var result = strategy(21).declutter(glyphs, DeclutterContext.of(20.0, 0));

        assertEquals(List.of("a1", "b1"), new ArrayList<>(result.visible()));
        assertEquals(List.of("a2", "a3", "b2"), new ArrayList<>(result.hidden()));
        assertEquals(Map.of("a1", 3, "b1", 2), result.hiddenCountByVisible());
    }

    @Test
    @DisplayName("Singleton groups still get a count of one")
    void testSingletonCounts() {
        var glyphs = List.of(new Glyph("a1", 45, 3), new Glyph("a2", 45, 3), new Glyph("b", 46, 4),
                             new Glyph("c", 47, 5));

        var result = strategy(4).declutter(glyphs, DeclutterContext.of(20.0, 1));

        assertEquals(Set.of("a1", "b", "c"), result.visible());
        assertEquals(Set.of("a2"), result.hidden());
        assertEquals(Map.of("a1", 2, "b", 1, "c", 1), result.hiddenCountByVisible());
    }

    @Test
    @DisplayName("Group count is capped at the batch size")
    void testGroupCountCapped() {
        var glyphs = List.of(new Glyph("a", 45, 3), new Glyph("b", 46, 4), new Glyph("c", 47, 5));

        // zoom level 7 falls back to 8 groups
        var result = strategy(8).declutter(glyphs, DeclutterContext.of(20.0, 7));

        assertEquals(List.of("a", "b", "c"), new ArrayList<>(result.visible()));
        assertTrue(result.hidden().isEmpty());
        assertEquals(Map.of("a", 1, "b", 1, "c", 1), result.hiddenCountByVisible());
    }

    @Test
    @DisplayName("Every glyph ends up visible or hidden")
    void testPartition() {
        var random = new Random(31);
        var glyphs = new ArrayList<Glyph>();
        for (int i = 0; i < 60; i++) {
            glyphs.add(new Glyph("g" + i, 45 + random.nextDouble() * 0.01, 3 + random.nextDouble() * 0.01));
        }

        var result = strategy(2).declutter(glyphs, DeclutterContext.of(20.0, 2));

        assertEquals(glyphs.size(), result.size());
        assertTrue(result.visible().size() <= 8);
        int represented = result.hiddenCountByVisible().values().stream().mapToInt(Integer::intValue).sum();
        assertEquals(glyphs.size(), represented);
        assertEquals(result.visible(), result.hiddenCountByVisible().keySet());
    }

    @Test
    @DisplayName("Empty and malformed batches")
    void testEmptyAndMalformed() {
        var strategy = strategy(1);

        assertSame(SelectionResult.empty(),
                   strategy.declutter(List.of(), DeclutterContext.of(20.0, 0)));
        var duplicates = List.of(new Glyph("x", 45, 3), new Glyph("x", 46, 4));
        assertTrue(strategy.declutter(duplicates, DeclutterContext.of(20.0, 0)).isEmpty());
        assertTrue(strategy.declutter(List.of(new Glyph("x", 45, 3)), DeclutterContext.of(0.0, 0)).isEmpty());
        assertEquals("clustering", strategy.name());
    }

    @Test
    @DisplayName("Cluster count table defaults")
    void testDefaultTable() {
        var defaults = ClusterCountTable.defaults();

        assertEquals(1, defaults.clusterCount(0));
        assertEquals(2, defaults.clusterCount(1));
        assertEquals(9, defaults.clusterCount(2));
        assertEquals(18, defaults.clusterCount(3));
        assertEquals(24, defaults.clusterCount(4));
        assertEquals(8, defaults.clusterCount(5));
        assertThrows(IllegalArgumentException.class, () -> new ClusterCountTable(Map.of(0, 0), 8));
        assertThrows(IllegalArgumentException.class, () -> new ClusterCountTable(Map.of(), 0));
    }
}
