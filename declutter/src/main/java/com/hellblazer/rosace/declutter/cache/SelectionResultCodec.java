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
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.rosace.declutter.SelectionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * JSON form of a {@link SelectionResult}. Decoding accepts both the current field names and the legacy
 * {@code filteredInSensors} / {@code filteredOutSensors} / {@code hiddenCountsMap} names. Unparseable text decodes to
 * empty with a warning.
 *
 * @author hal.hildebrand
 */
public class SelectionResultCodec {

    private static final Logger log = LoggerFactory.getLogger(SelectionResultCodec.class);

    private final ObjectMapper mapper;

    public SelectionResultCodec() {
        this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public SelectionResultCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String encode(SelectionResult result) {
        try {
            return mapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize selection result", e);
        }
    }

    /**
     * @param json   text to decode
     * @param source where the text came from, for the warning
     */
    public Optional<SelectionResult> decode(String json, String source) {
        try {
            var result = mapper.readValue(json, SelectionResult.class);
            if (result == null) {
                log.warn("Ignoring empty cached selection from {}", source);
                return Optional.empty();
            }
            return Optional.of(result);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring malformed cached selection from {}: {}", source, e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
