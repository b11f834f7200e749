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

import javax.vecmath.Point2d;
import java.util.Objects;

/**
 * A circular marker for one sensor at one geographic point. Glyphs carry only what the decluttering engine needs;
 * renderer attributes stay with the caller.
 *
 * @param id        unique sensor identifier
 * @param latitude  WGS84 latitude in degrees
 * @param longitude WGS84 longitude in degrees
 * @author hal.hildebrand
 */
public record Glyph(String id, double latitude, double longitude) {

    public Glyph {
        Objects.requireNonNull(id, "Glyph id cannot be null");
        if (!Double.isFinite(latitude) || !Double.isFinite(longitude)) {
            throw new IllegalArgumentException(
            "Glyph " + id + " has non-finite coordinates: (" + latitude + ", " + longitude + ")");
        }
    }

    /**
     * The raw (lat, lon) coordinate pair used by the clustering strategy. No meters correction is applied.
     */
    public Point2d position() {
        return new Point2d(latitude, longitude);
    }

    /**
     * Size this glyph for a zoom level.
     *
     * @param radiusMeters glyph radius in meters
     */
    public GlyphDisc withRadius(double radiusMeters) {
        return new GlyphDisc(id, latitude, longitude, radiusMeters);
    }
}
