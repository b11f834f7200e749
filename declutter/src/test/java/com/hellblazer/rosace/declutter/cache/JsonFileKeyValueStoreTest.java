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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
@DisplayName("JSON File Key-Value Store Tests")
class JsonFileKeyValueStoreTest {

    @TempDir
    Path directory;

    @Test
    @DisplayName("Entries survive reopening the file")
    void testPersistence() {
        var file = directory.resolve("store.json");
        var store = new JsonFileKeyValueStore(file);
        assertEquals(0, store.size());

        store.put("filterCache-spring_0", "{\"visible\":[\"a\"]}");
        store.put("filterCache-spring_1", "{}");
        store.remove("filterCache-spring_1");

        assertTrue(Files.exists(file));
        var reopened = new JsonFileKeyValueStore(file);
        assertEquals(1, reopened.size());
        assertEquals(Optional.of("{\"visible\":[\"a\"]}"), reopened.get("filterCache-spring_0"));
        assertEquals(Optional.empty(), reopened.get("filterCache-spring_1"));
    }

    @Test
    @DisplayName("Missing parent directories are created on first write")
    void testCreatesParents() {
        var file = directory.resolve("nested/deeper/store.json");
        var store = new JsonFileKeyValueStore(file);

        store.put("k", "v");

        assertEquals(Optional.of("v"), new JsonFileKeyValueStore(file).get("k"));
        assertEquals(file, store.getFile());
    }

    @Test
    @DisplayName("A file that is not a flat JSON object is rejected")
    void testMalformedFile() throws Exception {
        var file = directory.resolve("broken.json");
        Files.writeString(file, "[1, 2, 3]");

        assertThrows(CacheStoreException.class, () -> new JsonFileKeyValueStore(file));
    }

    @Test
    @DisplayName("A failed write leaves the previous value in place")
    void testFailedWriteRollsBack() throws Exception {
        var blocker = directory.resolve("blocker");
        Files.writeString(blocker, "not a directory");
        var store = new JsonFileKeyValueStore(blocker.resolve("store.json"));

        assertThrows(CacheStoreException.class, () -> store.put("k", "v"));
        assertEquals(Optional.empty(), store.get("k"));
        assertEquals(0, store.size());
    }

    @Test
    @DisplayName("In-memory store")
    void testInMemoryStore() {
        var store = new InMemoryKeyValueStore();

        store.put("k", "v");
        assertEquals(Optional.of("v"), store.get("k"));
        store.remove("k");
        store.remove("never");
        assertEquals(0, store.size());
    }
}
