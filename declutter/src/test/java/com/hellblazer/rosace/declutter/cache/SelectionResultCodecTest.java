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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.rosace.declutter.SelectionResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
@DisplayName("Selection Result Codec Tests")
class SelectionResultCodecTest {

    private final SelectionResultCodec codec = new SelectionResultCodec();

    @Test
    @DisplayName("Encoded form uses the current field names")
    void testEncode() throws Exception {
        var result = new SelectionResult(new LinkedHashSet<>(List.of("b", "a")), Set.of("c"), Map.of("b", 2));

        var tree = new ObjectMapper().readTree(codec.encode(result));

        assertEquals("b", tree.get("visible").get(0).asText());
        assertEquals("a", tree.get("visible").get(1).asText());
        assertEquals("c", tree.get("hidden").get(0).asText());
        assertEquals(2, tree.get("hiddenCountByVisible").get("b").asInt());
        assertFalse(tree.has("empty"));
    }

    @Test
    @DisplayName("Decoding keeps order and reads legacy names")
    void testDecode() {
        var current = codec.decode("{\"visible\":[\"z\",\"y\"],\"hidden\":[\"x\"],\"hiddenCountByVisible\":{\"z\":2}}",
                                   "test").orElseThrow();
        var legacy = codec.decode(
        "{\"filteredInSensors\":[\"z\",\"y\"],\"filteredOutSensors\":[\"x\"],\"hiddenCountsMap\":{\"z\":2}," +
        "\"generatedBy\":\"notebook\"}", "test").orElseThrow();

        assertEquals(List.of("z", "y"), new ArrayList<>(current.visible()));
        assertEquals(current, legacy);
    }

    @Test
    @DisplayName("Missing fields decode as empty collections")
    void testMissingFields() {
        var result = codec.decode("{\"visible\":[\"only\"]}", "test").orElseThrow();

        assertEquals(Set.of("only"), result.visible());
        assertTrue(result.hidden().isEmpty());
        assertTrue(result.hiddenCountByVisible().isEmpty());
    }

    @Test
    @DisplayName("Malformed text decodes to nothing")
    void testMalformed() {
        assertTrue(codec.decode("{\"visible\": [", "test").isEmpty());
        assertTrue(codec.decode("null", "test").isEmpty());
        assertTrue(codec.decode("{\"visible\": 12}", "test").isEmpty());
    }
}
