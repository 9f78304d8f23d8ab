/*
 * Copyright (c) 2023-2025 Burak Sezer
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.strata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.strata.common.StrataException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

/**
 * The JSONUtils class provides utility methods for reading and writing JSON data using the Jackson ObjectMapper.
 */
public class JSONUtils {
    public static final ObjectMapper objectMapper = new ObjectMapper();
    private static final Logger LOGGER = LoggerFactory.getLogger(JSONUtils.class);

    public static JsonNode readTree(String content) {
        try {
            return objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            LOGGER.debug("Failed to parse JSON content", e);
            throw new StrataException("JSON parsing failed: " + e.getOriginalMessage(), e);
        }
    }

    public static JsonNode readTree(InputStream content) {
        try {
            return objectMapper.readTree(content);
        } catch (IOException e) {
            LOGGER.debug("Failed to parse JSON stream", e);
            throw new StrataException("JSON parsing failed", e);
        }
    }

    public static String writeValueAsString(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            LOGGER.error("Failed to serialize Java object to JSON. ", e);
            throw new StrataException("JSON serialization failed", e);
        }
    }
}
