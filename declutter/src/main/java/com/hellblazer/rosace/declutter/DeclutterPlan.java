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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Selections for every (zoom level, period) pair computed by {@link DeclutterEngine#initialize(Map)}. Immutable.
 *
 * @author hal.hildebrand
 */
public final class DeclutterPlan {

    private final Map<Integer, Map<String, SelectionResult>> byZoomLevel;

    DeclutterPlan(Map<Integer, Map<String, SelectionResult>> byZoomLevel) {
        var copy = new TreeMap<Integer, Map<String, SelectionResult>>();
        byZoomLevel.forEach(
        (level, byPeriod) -> copy.put(level, Collections.unmodifiableMap(new LinkedHashMap<>(byPeriod))));
        this.byZoomLevel = Collections.unmodifiableMap(copy);
    }

    public Optional<SelectionResult> result(String periodKey, int zoomLevel) {
        return Optional.ofNullable(byZoomLevel.getOrDefault(zoomLevel, Map.of()).get(periodKey));
    }

    /**
     * Filters caller-owned records down to those whose id is visible for the period at the zoom level, keeping their
     * order. Records of a period or level the plan does not cover are all dropped.
     *
     * @param records    records carrying whatever attributes the caller needs
     * @param idFunction extracts the glyph id of a record
     */
    public <R> List<R> visibleRecords(String periodKey, int zoomLevel, Collection<R> records,
                                      Function<? super R, String> idFunction) {
        Set<String> visible = result(periodKey, zoomLevel).map(SelectionResult::visible).orElse(Set.of());
        return records.stream().filter(record -> visible.contains(idFunction.apply(record))).toList();
    }

    /**
     * Zoom levels covered, ascending.
     */
    public Set<Integer> zoomLevels() {
        return byZoomLevel.keySet();
    }

    /**
     * Selections of one zoom level by period, in initialization order.
     */
    public Map<String, SelectionResult> resultsFor(int zoomLevel) {
        return byZoomLevel.getOrDefault(zoomLevel, Map.of());
    }

    @Override
    public String toString() {
        return "DeclutterPlan[zoomLevels=" + byZoomLevel.keySet() + "]";
    }
}
