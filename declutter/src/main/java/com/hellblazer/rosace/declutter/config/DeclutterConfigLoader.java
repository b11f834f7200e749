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
package com.hellblazer.rosace.declutter.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.rosace.declutter.cluster.ClusterCountTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;

/**
 * Reads a {@link DeclutterConfig} from JSON. Every field is optional; absent fields keep their defaults.
 *
 * <pre>
 * {
 *   "strategy": "greedy",
 *   "overlapScale": 1.0,
 *   "maxIterations": 10000,
 *   "partitions": 2,
 *   "workerThreads": 2,
 *   "seed": 42,
 *   "clusterCounts": { "default": 8, "levels": { "0": 1, "1": 2, "2": 9, "3": 18, "4": 24 } },
 *   "zoomLevels": { "referenceZooms": [15, 15, 16, 17, 18], "thresholds": [14, 15, 16, 17],
 *                   "latitude": 0.0, "pixelWidth": 40 },
 *   "cache": { "precomputedDirectory": "precomputed", "precomputedWritable": false, "storeFile": "cache.json" }
 * }
 * </pre>
 *
 * @author hal.hildebrand
 */
public class DeclutterConfigLoader {
    public static final String CONFIG_RESOURCE = "/rosace-declutter.json";

    private static final Logger log = LoggerFactory.getLogger(DeclutterConfigLoader.class);

    private final ObjectMapper objectMapper;

    public DeclutterConfigLoader() {
        this(new ObjectMapper());
    }

    public DeclutterConfigLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Load {@value #CONFIG_RESOURCE} from the classpath, or the defaults if there is no such resource.
     *
     * @throws IllegalStateException if the resource is present but malformed
     */
    public DeclutterConfig load() {
        try (var stream = getClass().getResourceAsStream(CONFIG_RESOURCE)) {
            if (stream == null) {
                log.info("No {} on the classpath, using default declutter configuration", CONFIG_RESOURCE);
                return DeclutterConfig.defaults();
            }
            return load(stream, CONFIG_RESOURCE);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + CONFIG_RESOURCE, e);
        }
    }

    /**
     * @param stream JSON configuration; not closed
     * @param source description of the stream for messages
     * @throws IllegalStateException if the JSON is malformed or holds invalid values
     */
    public DeclutterConfig load(InputStream stream, String source) {
        JsonNode root;
        try {
            root = objectMapper.readTree(stream);
        } catch (IOException e) {
            throw new IllegalStateException("Malformed declutter configuration " + source, e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalStateException("Declutter configuration " + source + " must be a JSON object");
        }
        try {
            var config = parse(root);
            log.info("Loaded declutter configuration from {}: {}", source, config);
            return config;
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid declutter configuration " + source + ": " + e.getMessage(), e);
        }
    }

    private DeclutterConfig parse(JsonNode root) {
        var config = DeclutterConfig.defaults();
        if (root.has("strategy")) {
            config.withStrategy(
            DeclutterConfig.Strategy.valueOf(text(root, "strategy").toUpperCase(Locale.ROOT)));
        }
        if (root.has("overlapScale")) {
            config.withOverlapScale(number(root, "overlapScale"));
        }
        if (root.has("maxIterations")) {
            config.withMaxIterations(integer(root, "maxIterations"));
        }
        if (root.has("partitions")) {
            config.withPartitions(integer(root, "partitions"));
        }
        config.withWorkerThreads(root.has("workerThreads") ? integer(root, "workerThreads") : config.getPartitions());
        if (root.has("seed")) {
            var seed = root.get("seed");
            if (!seed.canConvertToLong()) {
                throw new IllegalArgumentException("seed must be an integer");
            }
            config.withSeed(seed.asLong());
        }
        if (root.has("clusterCounts")) {
            config.withClusterCounts(parseClusterCounts(root.get("clusterCounts")));
        }
        if (root.has("zoomLevels")) {
            config.withZoomLevels(parseZoomLevels(root.get("zoomLevels")));
        }
        var cache = root.get("cache");
        if (cache != null && cache.isObject()) {
            if (cache.hasNonNull("precomputedDirectory")) {
                config.withPrecomputedDirectory(Path.of(text(cache, "precomputedDirectory")),
                                                cache.path("precomputedWritable").asBoolean(false));
            }
            if (cache.hasNonNull("storeFile")) {
                config.withStoreFile(Path.of(text(cache, "storeFile")));
            }
        }
        return config;
    }

    private ClusterCountTable parseClusterCounts(JsonNode node) {
        var defaults = ClusterCountTable.defaults();
        int defaultCount = node.has("default") ? integer(node, "default") : defaults.getDefaultCount();
        var levels = node.get("levels");
        if (levels == null) {
            return new ClusterCountTable(defaults.getCounts(), defaultCount);
        }
        var counts = new HashMap<Integer, Integer>();
        var fields = levels.fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            int level;
            try {
                level = Integer.parseInt(entry.getKey());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("clusterCounts level is not an integer: " + entry.getKey());
            }
            if (!entry.getValue().canConvertToInt()) {
                throw new IllegalArgumentException("clusterCounts for level " + level + " must be an integer");
            }
            counts.put(level, entry.getValue().asInt());
        }
        return new ClusterCountTable(counts, defaultCount);
    }

    private ZoomLevelTable parseZoomLevels(JsonNode node) {
        var defaults = ZoomLevelTable.defaults();
        var referenceZooms = doubles(node, "referenceZooms", new double[] { 15, 15, 16, 17, 18 });
        var thresholds = doubles(node, "thresholds", new double[] { 14, 15, 16, 17 });
        double latitude = node.has("latitude") ? number(node, "latitude") : defaults.getLatitude();
        double pixelWidth = node.has("pixelWidth") ? number(node, "pixelWidth") : defaults.getPixelWidth();
        return new ZoomLevelTable(referenceZooms, thresholds, latitude, pixelWidth);
    }

    private static double[] doubles(JsonNode node, String field, double[] fallback) {
        var array = node.get(field);
        if (array == null) {
            return fallback;
        }
        if (!array.isArray()) {
            throw new IllegalArgumentException(field + " must be an array");
        }
        var values = new double[array.size()];
        for (int i = 0; i < values.length; i++) {
            if (!array.get(i).isNumber()) {
                throw new IllegalArgumentException(field + "[" + i + "] must be a number");
            }
            values[i] = array.get(i).asDouble();
        }
        return values;
    }

    private static String text(JsonNode node, String field) {
        var value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new IllegalArgumentException(field + " must be a string");
        }
        return value.asText();
    }

    private static double number(JsonNode node, String field) {
        var value = node.get(field);
        if (value == null || !value.isNumber()) {
            throw new IllegalArgumentException(field + " must be a number");
        }
        return value.asDouble();
    }

    private static int integer(JsonNode node, String field) {
        var value = node.get(field);
        if (value == null || !value.canConvertToInt() || !value.isIntegralNumber()) {
            throw new IllegalArgumentException(field + " must be an integer");
        }
        return value.asInt();
    }
}
