/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.dataset;

import com.intuitivedesigns.nodekernel.config.ConfigurationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration record a dataset is built from.
 *
 * @param type   registry key of the backend (e.g. "KAFKA", "MEMORY")
 * @param target backend-specific location (bootstrap servers, topic name, ...)
 * @param params backend-specific parameters
 */
public record DatasetConfig(String type, String target, Map<String, Object> params) {

    public DatasetConfig {
        if (type == null || type.isBlank()) {
            throw new ConfigurationException("Dataset config is missing 'type'");
        }
        type = type.trim();
        target = (target == null) ? "" : target;
        params = (params == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public DatasetConfig(String type, String target) {
        this(type, target, Map.of());
    }

    /**
     * Builds a record from a loosely typed mapping with keys {@code type}, {@code target} and
     * {@code params}, as found in a parsed pipeline definition.
     */
    @SuppressWarnings("unchecked")
    public static DatasetConfig fromMap(Map<String, ?> raw) {
        if (raw == null) {
            throw new ConfigurationException("Dataset config must not be null");
        }
        Object type = raw.get("type");
        Object target = raw.get("target");
        Object params = raw.get("params");

        if (!(type instanceof String)) {
            throw new ConfigurationException("Dataset config 'type' must be a string, got: " + type);
        }
        if (target != null && !(target instanceof String)) {
            throw new ConfigurationException("Dataset config 'target' must be a string, got: " + target);
        }
        if (params != null && !(params instanceof Map)) {
            throw new ConfigurationException("Dataset config 'params' must be a mapping, got: " + params);
        }
        return new DatasetConfig((String) type, (String) target, (Map<String, Object>) params);
    }
}
