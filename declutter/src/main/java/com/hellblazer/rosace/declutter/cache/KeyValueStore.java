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

import com.hellblazer.rosace.declutter.exceptions.CacheStoreException;

import java.util.Optional;

/**
 * Durable string to string storage backing the persisted cache tier.
 *
 * @author hal.hildebrand
 */
public interface KeyValueStore {

    /**
     * @throws CacheStoreException if the store cannot be read
     */
    Optional<String> get(String key);

    /**
     * @throws CacheStoreException if the value cannot be stored
     */
    void put(String key, String value);

    /**
     * Removes the key if present.
     *
     * @throws CacheStoreException if the store cannot be updated
     */
    void remove(String key);
}
