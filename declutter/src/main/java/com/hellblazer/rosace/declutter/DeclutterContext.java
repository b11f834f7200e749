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

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Per-call parameters of a declutter run. Passed explicitly into every call so the engine holds no view state
 * between calls.
 *
 * @param radiusMeters   glyph radius shared by every glyph of the batch
 * @param zoomLevel      discrete zoom level the batch is decluttered for
 * @param alreadyVisible ids chosen at another (typically coarser) zoom level; glyphs overlapping any of them start
 *                       out hidden. Empty when there is no such set.
 * @author hal.hildebrand
 */
public record DeclutterContext(double radiusMeters, int zoomLevel, Set<String> alreadyVisible) {

    public DeclutterContext {
        if (zoomLevel < 0) {
            throw new IllegalArgumentException("Zoom level cannot be negative: " + zoomLevel);
        }
        alreadyVisible = alreadyVisible == null
                         ? Set.of()
                         : Collections.unmodifiableSet(new LinkedHashSet<>(alreadyVisible));
    }

    public static DeclutterContext of(double radiusMeters, int zoomLevel) {
        return new DeclutterContext(radiusMeters, zoomLevel, Set.of());
    }

    public DeclutterContext withAlreadyVisible(Set<String> ids) {
        return new DeclutterContext(radiusMeters, zoomLevel, ids);
    }
}
