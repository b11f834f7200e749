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

import com.hellblazer.rosace.declutter.SelectionResult;
import com.hellblazer.rosace.declutter.exceptions.CacheStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Directory of precomputed selections, one {@code <period>_<zoom>_cache.json} file per key. A missing file is a
 * silent miss. The directory is only modified when it was opened writable.
 *
 * @author hal.hildebrand
 */
public class PrecomputedResultDirectory {

    private static final Logger log = LoggerFactory.getLogger(PrecomputedResultDirectory.class);

    private final Path                 directory;
    private final boolean              writable;
    private final SelectionResultCodec codec;

    public PrecomputedResultDirectory(Path directory, boolean writable, SelectionResultCodec codec) {
        this.directory = directory;
        this.writable = writable;
        this.codec = codec;
    }

    public Optional<SelectionResult> read(CacheKey key) {
        var file = directory.resolve(key.fileName());
        if (!Files.isRegularFile(file)) {
            log.debug("No precomputed selection for {} in {}", key, directory);
            return Optional.empty();
        }
        try {
            return codec.decode(Files.readString(file, StandardCharsets.UTF_8), file.toString());
        } catch (IOException e) {
            log.warn("Cannot read precomputed selection {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Removes the file for the key when the directory is writable. Failures are logged, never thrown.
     *
     * @return true if a file was removed
     */
    public boolean delete(CacheKey key) {
        if (!writable) {
            return false;
        }
        var file = directory.resolve(key.fileName());
        try {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Cannot remove precomputed selection {}: {}", file, e.getMessage());
            return false;
        }
    }

    public Path getDirectory() {
        return directory;
    }

    public boolean isWritable() {
        return writable;
    }

    /**
     * Writes already encoded selection JSON as the precomputed file for the key in the given directory, creating the
     * directory if needed.
     *
     * @return the written file
     * @throws CacheStoreException if the file cannot be written
     */
    static Path writeFile(Path directory, CacheKey key, String json) {
        var file = directory.resolve(key.fileName());
        try {
            Files.createDirectories(directory);
            Files.writeString(file, json, StandardCharsets.UTF_8);
            return file;
        } catch (IOException e) {
            throw new CacheStoreException("Cannot write precomputed selection " + file, e);
        }
    }
}
