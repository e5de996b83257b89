/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Lamina.
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
package com.hellblazer.lamina.entity.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link RuntimeConfig} from JSON.
 * <p>
 * Recognized keys: {@code exceptionTolerant}, {@code logLateMessages}, {@code firstEntityId},
 * {@code firstNetworkId}, {@code warnOnUnknownSession}. Absent keys keep their defaults and unknown keys are
 * ignored.
 * <pre>
 * {
 *   "exceptionTolerant": false,
 *   "logLateMessages": true,
 *   "firstEntityId": 1
 * }
 * </pre>
 */
public class RuntimeConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(RuntimeConfigLoader.class);

    /**
     * Classpath resource consulted by {@link #loadDefault()}.
     */
    public static final String CONFIG_RESOURCE = "/lamina-runtime.json";

    private final ObjectMapper objectMapper;

    public RuntimeConfigLoader() {
        this(new ObjectMapper());
    }

    public RuntimeConfigLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Load {@value #CONFIG_RESOURCE} from the classpath, falling back to defaults when it is absent.
     */
    public RuntimeConfig loadDefault() {
        return loadResource(CONFIG_RESOURCE);
    }

    /**
     * Load a classpath resource, falling back to defaults when it is absent.
     *
     * @throws IllegalArgumentException if the resource is present but invalid
     */
    public RuntimeConfig loadResource(String resource) {
        try (var stream = RuntimeConfigLoader.class.getResourceAsStream(resource)) {
            if (stream == null) {
                log.debug("Runtime configuration {} not found, using defaults", resource);
                return RuntimeConfig.defaultConfig();
            }
            var config = load(stream);
            log.info("Loaded runtime configuration from {}: {}", resource, config);
            return config;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read runtime configuration " + resource, e);
        }
    }

    /**
     * @throws UncheckedIOException     if the file cannot be read
     * @throws IllegalArgumentException if the document is invalid
     */
    public RuntimeConfig load(Path path) {
        try (var stream = Files.newInputStream(path)) {
            return load(stream);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read runtime configuration " + path, e);
        }
    }

    /**
     * @throws IllegalArgumentException if the document is not a JSON object or holds values of the wrong type
     */
    public RuntimeConfig load(InputStream stream) throws IOException {
        JsonNode root = objectMapper.readTree(stream);
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Runtime configuration must be a JSON object");
        }
        var builder = RuntimeConfig.builder();
        if (root.has("exceptionTolerant")) {
            builder.withExceptionTolerant(requireBoolean(root, "exceptionTolerant"));
        }
        if (root.has("logLateMessages")) {
            builder.withLogLateMessages(requireBoolean(root, "logLateMessages"));
        }
        if (root.has("firstEntityId")) {
            builder.withFirstEntityId(requireInt(root, "firstEntityId"));
        }
        if (root.has("firstNetworkId")) {
            builder.withFirstNetworkId(requireInt(root, "firstNetworkId"));
        }
        if (root.has("warnOnUnknownSession")) {
            builder.withWarnOnUnknownSession(requireBoolean(root, "warnOnUnknownSession"));
        }
        return builder.build();
    }

    private static boolean requireBoolean(JsonNode root, String key) {
        var node = root.get(key);
        if (!node.isBoolean()) {
            throw new IllegalArgumentException("Expected boolean for " + key + " but was " + node);
        }
        return node.booleanValue();
    }

    private static int requireInt(JsonNode root, String key) {
        var node = root.get(key);
        if (!node.isInt()) {
            throw new IllegalArgumentException("Expected integer for " + key + " but was " + node);
        }
        return node.intValue();
    }
}
