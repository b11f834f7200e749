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
package com.hellblazer.rosace.declutter.cache;

import java.util.Objects;

/**
 * Identifies one cached selection: a time-period key and a discrete zoom level.
 *
 * @author hal.hildebrand
 */
public record CacheKey(String periodKey, int zoomLevel) {

    static final String STORAGE_PREFIX = "filterCache-";
    static final String FILE_SUFFIX    = "_cache.json";

    public CacheKey {
        Objects.requireNonNull(periodKey, "Period key cannot be null");
        if (periodKey.isBlank()) {
            throw new IllegalArgumentException("Period key cannot be blank");
        }
        if (zoomLevel < 0) {
            throw new IllegalArgumentException("Zoom level cannot be negative: " + zoomLevel);
        }
    }

    /**
     * {@code <period>_<zoomLevel>}
     */
    public String name() {
        return periodKey + "_" + zoomLevel;
    }

    /**
     * Key under which the selection is held in a {@link KeyValueStore}.
     */
    public String storageKey() {
        return STORAGE_PREFIX + name();
    }

    /**
     * Name of the precomputed file for this key.
     */
    public String fileName() {
        return name() + FILE_SUFFIX;
    }

    @Override
    public String toString() {
        return name();
    }
}
