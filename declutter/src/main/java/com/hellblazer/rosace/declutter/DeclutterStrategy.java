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

import java.util.List;

/**
 * A decluttering algorithm: reduces a batch of glyphs to a subset that can be drawn, recording what each drawn glyph
 * hides.
 *
 * <p>Implementations are stateless between calls. An empty batch yields {@link SelectionResult#empty()}.
 *
 * @author hal.hildebrand
 */
public interface DeclutterStrategy {

    /**
     * @param glyphs  glyphs of one period, never mutated
     * @param context radius, zoom level and ids already shown at another zoom level
     * @return the selection; every input id is either visible or hidden
     */
    SelectionResult declutter(List<Glyph> glyphs, DeclutterContext context);

    /**
     * Short name used in log output.
     */
    String name();
}
