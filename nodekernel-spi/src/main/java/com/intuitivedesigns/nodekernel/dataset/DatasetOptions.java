/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.dataset;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable option bag passed to dataset operations.
 *
 * <p>Backends define which keys they understand; unknown keys are ignored. Typed getters fall
 * back to the supplied default when a key is absent or cannot be converted.</p>
 */
public final class DatasetOptions {

    // Keys shared by the bundled backends
    public static final String HOW = "how";
    public static final String BLOCK = "block";
    public static final String TIMEOUT_MS = "timeout_ms";

    private static final DatasetOptions EMPTY = new DatasetOptions(Map.of());

    private final Map<String, Object> values;

    private DatasetOptions(Map<String, Object> values) {
        this.values = values;
    }

    public static DatasetOptions empty() {
        return EMPTY;
    }

    public static DatasetOptions of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) return EMPTY;
        return new DatasetOptions(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    public static DatasetOptions of(String key, Object value) {
        return builder().put(key, value).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public String getString(String key, String defaultValue) {
        Object v = values.get(key);
        return (v == null) ? defaultValue : v.toString();
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        Object v = values.get(key);
        if (v instanceof Boolean b) return b;
        if (v instanceof String s) return Boolean.parseBoolean(s.trim());
        return defaultValue;
    }

    public long getLong(String key, long defaultValue) {
        Object v = values.get(key);
        if (v instanceof Number n) return n.longValue();
        if (v instanceof String s) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    /**
     * Reads a millisecond value, or a {@link Duration} stored directly under {@code key}.
     */
    public Duration getDuration(String key, Duration defaultValue) {
        Object v = values.get(key);
        if (v instanceof Duration d) return d;
        long ms = getLong(key, -1L);
        return (ms < 0) ? defaultValue : Duration.ofMillis(ms);
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getMap(String key) {
        Object v = values.get(key);
        return (v instanceof Map) ? (Map<String, Object>) v : Map.of();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public DatasetOptions with(String key, Object value) {
        return builder().putAll(values).put(key, value).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return (o instanceof DatasetOptions other) && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "DatasetOptions" + values;
    }

    public static final class Builder {
        private final Map<String, Object> values = new LinkedHashMap<>();

        private Builder() {}

        public Builder put(String key, Object value) {
            Objects.requireNonNull(key, "key");
            if (value == null) {
                values.remove(key);
            } else {
                values.put(key, value);
            }
            return this;
        }

        public Builder putAll(Map<String, ?> more) {
            if (more != null) more.forEach(this::put);
            return this;
        }

        public DatasetOptions build() {
            return DatasetOptions.of(values);
        }
    }
}
