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

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Outcome of decluttering one batch of glyphs: which glyphs are drawn, which are suppressed, and how many glyphs each
 * drawn glyph stands for.
 *
 * <p>The hidden count includes the visible glyph itself. Whether a visible glyph with nothing behind it gets an entry
 * depends on the strategy that produced the result: the greedy selector omits such entries, the clustering strategy
 * writes one for every representative.
 *
 * <p>The legacy field names {@code filteredInSensors}, {@code filteredOutSensors} and {@code hiddenCountsMap} are
 * accepted when reading JSON so precomputed files written by earlier tooling load unchanged.
 *
 * @param visible              ids of the glyphs to draw, in input order
 * @param hidden               ids of suppressed glyphs, in input order
 * @param hiddenCountByVisible visible id to number of glyphs it represents
 * @author hal.hildebrand
 */
public record SelectionResult(
    @JsonProperty("visible") @JsonAlias("filteredInSensors")
    @JsonDeserialize(as = LinkedHashSet.class) Set<String> visible,
    @JsonProperty("hidden") @JsonAlias("filteredOutSensors")
    @JsonDeserialize(as = LinkedHashSet.class) Set<String> hidden,
    @JsonProperty("hiddenCountByVisible") @JsonAlias("hiddenCountsMap")
    Map<String, Integer> hiddenCountByVisible
) {
    private static final SelectionResult EMPTY = new SelectionResult(Set.of(), Set.of(), Map.of());

    public SelectionResult {
        visible = orderedCopy(visible);
        hidden = orderedCopy(hidden);
        hiddenCountByVisible = hiddenCountByVisible == null
                               ? Map.of()
                               : Collections.unmodifiableMap(new LinkedHashMap<>(hiddenCountByVisible));
    }

    /**
     * The result for an empty glyph batch.
     */
    public static SelectionResult empty() {
        return EMPTY;
    }

    /**
     * Number of glyphs the visible glyph stands for; 1 when nothing is hidden behind it.
     */
    public int representedCount(String visibleId) {
        return hiddenCountByVisible.getOrDefault(visibleId, 1);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return visible.isEmpty() && hidden.isEmpty();
    }

    /**
     * Total number of glyphs the result was computed over.
     */
    public int size() {
        return visible.size() + hidden.size();
    }

    private static Set<String> orderedCopy(Collection<String> ids) {
        return ids == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(ids));
    }
}
