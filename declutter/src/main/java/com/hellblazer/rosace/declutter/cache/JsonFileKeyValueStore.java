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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.rosace.declutter.exceptions.CacheStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * {@link KeyValueStore} persisted as a single flat JSON object file. The file is read once on construction and
 * rewritten in full on every update, through a temporary sibling file that is then moved into place.
 *
 * @author hal.hildebrand
 */
public class JsonFileKeyValueStore implements KeyValueStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileKeyValueStore.class);

    private static final TypeReference<LinkedHashMap<String, String>> ENTRIES = new TypeReference<>() {
    };

    private final Path                file;
    private final ObjectMapper        mapper;
    private final Map<String, String> entries;

    public JsonFileKeyValueStore(Path file) {
        this(file, new ObjectMapper());
    }

    public JsonFileKeyValueStore(Path file, ObjectMapper mapper) {
        this.file = file;
        this.mapper = mapper;
        this.entries = load(file, mapper);
    }

    @Override
    public synchronized Optional<String> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public synchronized void put(String key, String value) {
        var previous = entries.put(key, value);
        try {
            write();
        } catch (CacheStoreException e) {
            if (previous == null) {
                entries.remove(key);
            } else {
                entries.put(key, previous);
            }
            throw e;
        }
    }

    @Override
    public synchronized void remove(String key) {
        var previous = entries.remove(key);
        if (previous == null) {
            return;
        }
        try {
            write();
        } catch (CacheStoreException e) {
            entries.put(key, previous);
            throw e;
        }
    }

    public Path getFile() {
        return file;
    }

    public synchronized int size() {
        return entries.size();
    }

    private void write() {
        try {
            var parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            var temp = file.resolveSibling(file.getFileName() + ".tmp");
            mapper.writeValue(temp.toFile(), entries);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new CacheStoreException("Failed to write key-value store " + file, e);
        }
    }

    private static Map<String, String> load(Path file, ObjectMapper mapper) {
        if (!Files.exists(file)) {
            log.debug("Key-value store {} does not exist yet, starting empty", file);
            return new LinkedHashMap<>();
        }
        try {
            Map<String, String> loaded = mapper.readValue(file.toFile(), ENTRIES);
            if (loaded == null) {
                loaded = new LinkedHashMap<>();
            }
            log.debug("Loaded {} entries from key-value store {}", loaded.size(), file);
            return loaded;
        } catch (JsonProcessingException e) {
            throw new CacheStoreException("Key-value store " + file + " is not a flat JSON object", e);
        } catch (IOException e) {
            throw new CacheStoreException("Failed to read key-value store " + file, e);
        }
    }
}
