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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the greedy overlap filter
 *
 * @author hal.hildebrand
 */
@DisplayName("Greedy Declutter Selector Tests")
class GreedyDeclutterSelectorTest {

    private GreedyDeclutterSelector selector;

    @BeforeEach
    void setUp() {
        selector = new GreedyDeclutterSelector();
    }

    @Test
    @DisplayName("Two overlapping glyphs and a distant one")
    void testOverlappingPairAndDistantGlyph() {
        var glyphs = List.of(new Glyph("g0", 0, 0), new Glyph("g1", 0, 0.0001), new Glyph("g2", 10, 10));

        var result = selector.select(glyphs, 15.0);

        assertEquals(List.of("g0", "g2"), new ArrayList<>(result.visible()));
        assertEquals(Set.of("g1"), result.hidden());
        assertEquals(Map.of("g0", 2), result.hiddenCountByVisible());
        assertEquals(2, result.representedCount("g0"));
        assertEquals(1, result.representedCount("g2"));
    }

    @Test
    @DisplayName("Collinear, mutually overlapping glyphs collapse to one")
    void testCollinearGlyphs() {
        var glyphs = List.of(new Glyph("g0", 0, 0), new Glyph("g1", 0, 0.0001), new Glyph("g2", 0, 0.0002),
                             new Glyph("g3", 0, 0.0003));

        var result = selector.select(glyphs, 30.0);

        assertEquals(1, result.visible().size());
        assertEquals(3, result.hidden().size());
        var kept = result.visible().iterator().next();
        // The two inner glyphs overlap the rest the most
        assertTrue(Set.of("g1", "g2").contains(kept), "Kept " + kept);
        assertEquals(Map.of(kept, 4), result.hiddenCountByVisible());
    }

    @Test
    @DisplayName("Visible glyphs never overlap one another")
    void testVisiblePairwiseDisjoint() {
        var glyphs = new ArrayList<Glyph>();
        for (int i = 0; i < 6; i++) {
            for (int j = 0; j < 6; j++) {
                glyphs.add(new Glyph("g" + i + "-" + j, i * 0.00015, j * 0.00015));
            }
        }

        var result = selector.select(glyphs, 12.0);
        var visible = glyphs.stream().filter(g -> result.visible().contains(g.id())).toList();

        assertFalse(visible.isEmpty());
        for (int i = 0; i < visible.size(); i++) {
            for (int j = i + 1; j < visible.size(); j++) {
                assertFalse(CircleOverlap.isOverlapping(visible.get(i).withRadius(12.0),
                                                        visible.get(j).withRadius(12.0)));
            }
        }
        assertEquals(glyphs.size(), result.size());
    }

    @Test
    @DisplayName("Disjoint glyphs are all visible with no counts")
    void testDisjointGlyphs() {
        var glyphs = List.of(new Glyph("a", 0, 0), new Glyph("b", 1, 1), new Glyph("c", 2, 2));

        var result = selector.select(glyphs, 15.0);

        assertEquals(List.of("a", "b", "c"), new ArrayList<>(result.visible()));
        assertTrue(result.hidden().isEmpty());
        assertTrue(result.hiddenCountByVisible().isEmpty());
    }

    @Test
    @DisplayName("Empty and single glyph batches")
    void testTrivialBatches() {
        assertSame(SelectionResult.empty(), selector.select(List.of(), 15.0));

        var single = selector.select(List.of(new Glyph("only", 45, 7)), 15.0);
        assertEquals(Set.of("only"), single.visible());
        assertTrue(single.hidden().isEmpty());
        assertTrue(single.hiddenCountByVisible().isEmpty());
    }

    @Test
    @DisplayName("Glyphs overlapping an already visible glyph start out hidden")
    void testAlreadyVisible() {
        var glyphs = List.of(new Glyph("g0", 0, 0), new Glyph("g1", 0, 0.0001), new Glyph("g2", 10, 10));

        var result = selector.select(glyphs, 15.0, Set.of("g1"));

        assertEquals(List.of("g1", "g2"), new ArrayList<>(result.visible()));
        assertEquals(Set.of("g0"), result.hidden());
        assertEquals(Map.of("g1", 2), result.hiddenCountByVisible());
    }

    @Test
    @DisplayName("Already visible ids outside the batch are ignored")
    void testAlreadyVisibleOutsideBatch() {
        var glyphs = List.of(new Glyph("g0", 0, 0), new Glyph("g1", 0, 0.0001));

        var result = selector.declutter(glyphs, DeclutterContext.of(15.0, 1).withAlreadyVisible(Set.of("elsewhere")));

        assertEquals(selector.select(glyphs, 15.0), result);
    }

    @Test
    @DisplayName("Malformed batches degrade to an empty result")
    void testMalformedBatches() {
        var duplicates = List.of(new Glyph("dup", 0, 0), new Glyph("dup", 1, 1));
        assertTrue(selector.select(duplicates, 15.0).isEmpty());

        var glyphs = List.of(new Glyph("a", 0, 0));
        assertTrue(selector.select(glyphs, 0.0).isEmpty());
        assertTrue(selector.select(glyphs, -3.0).isEmpty());
        assertTrue(selector.select(glyphs, Double.NaN).isEmpty());
        assertTrue(selector.select(glyphs, Double.POSITIVE_INFINITY).isEmpty());

        var withNull = new ArrayList<Glyph>();
        withNull.add(new Glyph("a", 0, 0));
        withNull.add(null);
        assertTrue(selector.select(withNull, 15.0).isEmpty());
    }

    @Test
    @DisplayName("Decluttering the visible set again changes nothing")
    void testIdempotent() {
        var glyphs = List.of(new Glyph("g0", 0, 0), new Glyph("g1", 0, 0.0001), new Glyph("g2", 0, 0.0002),
                             new Glyph("g3", 0, 0.0009), new Glyph("g4", 5, 5));
        var first = selector.select(glyphs, 20.0);

        var survivors = glyphs.stream().filter(g -> first.visible().contains(g.id())).toList();
        var second = selector.select(survivors, 20.0);

        assertEquals(first.visible(), second.visible());
        assertTrue(second.hidden().isEmpty());
    }

    @Test
    @DisplayName("Same input gives the same selection")
    void testDeterministic() {
        var glyphs = new ArrayList<Glyph>();
        for (int i = 0; i < 25; i++) {
            glyphs.add(new Glyph("g" + i, (i % 5) * 0.0001, (i / 5) * 0.00013));
        }

        assertEquals(selector.select(glyphs, 10.0), selector.select(glyphs, 10.0));
    }

    @Test
    @DisplayName("Overlap scale must be positive")
    void testInvalidScale() {
        assertThrows(IllegalArgumentException.class, () -> new GreedyDeclutterSelector(0.0));
        assertThrows(IllegalArgumentException.class, () -> new GreedyDeclutterSelector(Double.NaN));
        assertEquals("greedy", selector.name());
        assertEquals(1.0, selector.getOverlapScale());
    }
}
