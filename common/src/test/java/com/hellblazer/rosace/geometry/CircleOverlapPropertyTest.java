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
package com.hellblazer.rosace.geometry;

import net.jqwik.api.*;
import net.jqwik.api.constraints.DoubleRange;
import net.jqwik.api.constraints.Scale;

import org.junit.jupiter.api.DisplayName;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Circle Overlap Property-Based Tests")
class CircleOverlapPropertyTest {

    @Property
    @Label("Intersection area is symmetric")
    void intersectionAreaIsSymmetric(@ForAll("discs") GlyphDisc a, @ForAll("discs") GlyphDisc b) {
        assertEquals(CircleOverlap.intersectionArea(a, b), CircleOverlap.intersectionArea(b, a));
    }

    @Property
    @Label("Intersection area is non-negative and bounded by the smaller circle")
    void intersectionAreaIsBounded(@ForAll("discs") GlyphDisc a, @ForAll("discs") GlyphDisc b) {
        double area = CircleOverlap.intersectionArea(a, b);
        double r = Math.min(a.radius(), b.radius());

        assertTrue(area >= 0.0);
        assertTrue(area <= Math.PI * r * r * (1 + 1e-9));
    }

    @Property
    @Label("Overlap predicate is symmetric")
    void overlapIsSymmetric(@ForAll("discs") GlyphDisc a, @ForAll("discs") GlyphDisc b) {
        assertEquals(CircleOverlap.isOverlapping(a, b), CircleOverlap.isOverlapping(b, a));
    }

    @Property
    @Label("Far apart circles never intersect")
    void farApartHasNoArea(@ForAll("discs") GlyphDisc a,
                           @ForAll @DoubleRange(min = 0.001, max = 1.0) @Scale(4) double extra) {
        double gap = 2 * a.radius() + extra;
        var b = new GlyphDisc("far", a.latitude(), a.longitude() + gap, a.radius());

        assertEquals(0.0, CircleOverlap.intersectionArea(a, b));
    }

    @Provide
    Arbitrary<GlyphDisc> discs() {
        var lat = Arbitraries.doubles().between(-60.0, 60.0);
        var lon = Arbitraries.doubles().between(-180.0, 180.0);
        var radius = Arbitraries.doubles().between(0.001, 50.0).ofScale(4);
        return Combinators.combine(lat, lon, radius).as((la, lo, r) -> new GlyphDisc("g", la, lo, r));
    }
}
