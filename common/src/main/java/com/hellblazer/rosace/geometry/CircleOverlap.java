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

/**
 * Distance and circle intersection computations between two glyph discs in a locally flattened (equirectangular)
 * coordinate space.
 *
 * <p>The overlap test converts the coordinate deltas into meters, while {@link #intersectionArea(GlyphDisc,
 * GlyphDisc)} feeds the raw degree-space distance into the lens formula alongside radii expressed in meters. The two
 * are deliberately not reconciled: the intersection area is only ever used to rank overlaps against each other, and
 * changing its units changes which glyph wins a tie-break.
 *
 * @author hal.hildebrand
 */
public final class CircleOverlap {

    /**
     * Meters spanned by one degree of latitude.
     */
    public static final double METERS_PER_DEGREE = 111320.0;

    /**
     * Default multiplier applied to the sum of radii by the overlap test.
     */
    public static final double DEFAULT_SCALE = 1.0;

    private CircleOverlap() {
    }

    /**
     * Flattened distance in meters between the two disc centers. Longitude is cosine-corrected at the mean latitude
     * of the pair.
     */
    public static double distanceMeters(GlyphDisc a, GlyphDisc b) {
        double latDiff = (a.latitude() - b.latitude()) * METERS_PER_DEGREE;
        double meanLatitude = Math.toRadians((a.latitude() + b.latitude()) / 2.0);
        double lonDiff = (a.longitude() - b.longitude()) * METERS_PER_DEGREE * Math.cos(meanLatitude);
        return Math.sqrt(latDiff * latDiff + lonDiff * lonDiff);
    }

    /**
     * Euclidean distance between the centers in raw degree space.
     */
    public static double degreeDistance(GlyphDisc a, GlyphDisc b) {
        double dLat = a.latitude() - b.latitude();
        double dLon = a.longitude() - b.longitude();
        return Math.sqrt(dLat * dLat + dLon * dLon);
    }

    public static boolean isOverlapping(GlyphDisc a, GlyphDisc b) {
        return isOverlapping(a, b, DEFAULT_SCALE);
    }

    /**
     * @param scale coefficient applied to the sum of both radii
     * @return true iff the flattened distance is at most the scaled sum of radii
     */
    public static boolean isOverlapping(GlyphDisc a, GlyphDisc b, double scale) {
        return distanceMeters(a, b) <= (a.radius() + b.radius()) * scale;
    }

    /**
     * Area of the lens shared by the two circles.
     *
     * @return 0 for disjoint circles, the smaller circle's area when one contains the other, otherwise the lens area
     */
    public static double intersectionArea(GlyphDisc a, GlyphDisc b) {
        double d = degreeDistance(a, b);
        // evaluate with the larger radius first so the result is bit-for-bit symmetric
        double r1 = Math.max(a.radius(), b.radius());
        double r2 = Math.min(a.radius(), b.radius());

        if (d >= r1 + r2) {
            return 0.0;
        }
        if (d <= r1 - r2) {
            return Math.PI * r2 * r2;
        }

        double part1 = r1 * r1 * Math.acos(clampUnit((d * d + r1 * r1 - r2 * r2) / (2 * d * r1)));
        double part2 = r2 * r2 * Math.acos(clampUnit((d * d + r2 * r2 - r1 * r1) / (2 * d * r2)));
        double part3 = 0.5 * Math.sqrt(
        Math.max(0.0, (-d + r1 + r2) * (d + r1 - r2) * (d - r1 + r2) * (d + r1 + r2)));

        return Math.max(0.0, part1 + part2 - part3);
    }

    // rounding near tangency can push the cosine a hair outside [-1, 1]
    private static double clampUnit(double cosine) {
        return Math.max(-1.0, Math.min(1.0, cosine));
    }
}
