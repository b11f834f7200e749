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

import java.util.Objects;

/**
 * A glyph located on the map together with its radius.
 *
 * @param id        sensor identifier
 * @param latitude  degrees
 * @param longitude degrees
 * @param radius    meters, strictly positive
 * @author hal.hildebrand
 */
public record GlyphDisc(String id, double latitude, double longitude, double radius) {

    public GlyphDisc {
        Objects.requireNonNull(id, "Glyph id cannot be null");
        if (!Double.isFinite(radius) || radius <= 0) {
            throw new IllegalArgumentException("Radius must be positive and finite: " + radius);
        }
    }
}
