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

import com.hellblazer.rosace.geometry.Glyph;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;

/**
 * Sanity checks applied to a glyph batch before any strategy runs. A malformed batch degrades to an empty result
 * instead of failing the caller.
 *
 * @author hal.hildebrand
 */
public final class GlyphBatch {

    private GlyphBatch() {
    }

    /**
     * @return a description of what is wrong with the batch, or empty if it can be decluttered
     */
    public static Optional<String> problem(List<Glyph> glyphs, double radiusMeters) {
        if (!Double.isFinite(radiusMeters) || radiusMeters <= 0) {
            return Optional.of("radius must be positive and finite, got " + radiusMeters);
        }
        var seen = new HashSet<String>(glyphs.size() * 2);
        for (var glyph : glyphs) {
            if (glyph == null) {
                return Optional.of("batch contains a null glyph");
            }
            if (!seen.add(glyph.id())) {
                return Optional.of("duplicate glyph id " + glyph.id());
            }
        }
        return Optional.empty();
    }
}
