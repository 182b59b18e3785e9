/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;

/**
 * Process-wide configuration.
 * Loads from -Dnk.config.path or ENV 'NK_CONFIG_PATH'.
 *
 * <p>Besides plain typed lookups, {@link #subset(String)} exposes prefix views which the node
 * runtime uses for default consumer/producer settings (e.g. every {@code kafka.consumer.*} key).</p>
 */
public final class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    public static final String PROP_CONFIG_PATH = "nk.config.path";
    public static final String ENV_CONFIG_PATH = "NK_CONFIG_PATH";

    // Well-known keys
    public static final String KEY_LOGGING_DATASET = "node.logging.dataset";
    public static final String KEY_CONSUMER_PREFIX = "kafka.consumer.";
    public static final String KEY_PRODUCER_PREFIX = "kafka.producer.";

    public static final String DEFAULT_LOGGING_DATASET = "logging";

    private static volatile PipelineConfig instance;

    private final Properties props;

    private PipelineConfig(Properties props) {
        this.props = props;
    }

    /**
     * Returns the process-wide configuration, loading it on first access.
     */
    public static PipelineConfig get() {
        PipelineConfig local = instance;
        if (local == null) {
            synchronized (PipelineConfig.class) {
                local = instance;
                if (local == null) {
                    local = new PipelineConfig(loadDefault());
                    instance = local;
                }
            }
        }
        return local;
    }

    public static PipelineConfig of(Properties props) {
        Objects.requireNonNull(props, "props");
        Properties copy = new Properties();
        copy.putAll(props);
        return new PipelineConfig(copy);
    }

    public static PipelineConfig of(Map<String, String> values) {
        Objects.requireNonNull(values, "values");
        Properties copy = new Properties();
        copy.putAll(values);
        return new PipelineConfig(copy);
    }

    public static PipelineConfig empty() {
        return new PipelineConfig(new Properties());
    }

    private static Properties loadDefault() {
        Properties loaded = new Properties();

        // 1. System property first, then environment
        String path = System.getProperty(PROP_CONFIG_PATH);
        if (path == null || path.isBlank()) {
            path = System.getenv(ENV_CONFIG_PATH);
        }

        if (path == null || path.isBlank()) {
            log.warn("No configuration file specified (-D{} or {}). Using built-in defaults.",
                    PROP_CONFIG_PATH, ENV_CONFIG_PATH);
            return loaded;
        }

        log.info("Loading configuration from: {}", path);
        try (InputStream is = new FileInputStream(path)) {
            loaded.load(is);
            log.info("Loaded {} properties.", loaded.size());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load config file: " + path, e);
        }
        return loaded;
    }

    public String getString(String key, String defaultValue) {
        return props.getProperty(key, defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Long.parseLong(val.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String val = props.getProperty(key);
        return val == null ? defaultValue : Boolean.parseBoolean(val.trim());
    }

    public boolean hasPath(String key) {
        return props.containsKey(key);
    }

    /**
     * All keys starting with {@code prefix}, with the prefix stripped, in key order.
     */
    public Map<String, Object> subset(String prefix) {
        Objects.requireNonNull(prefix, "prefix");
        Map<String, Object> out = new LinkedHashMap<>();
        for (String key : new TreeSet<>(props.stringPropertyNames())) {
            if (key.startsWith(prefix) && key.length() > prefix.length()) {
                out.put(key.substring(prefix.length()), props.getProperty(key));
            }
        }
        return out;
    }

    public String loggingDataset() {
        String name = getString(KEY_LOGGING_DATASET, DEFAULT_LOGGING_DATASET);
        return (name == null || name.isBlank()) ? DEFAULT_LOGGING_DATASET : name.trim();
    }

    public Map<String, Object> defaultConsumerConfig() {
        return subset(KEY_CONSUMER_PREFIX);
    }

    public Map<String, Object> defaultProducerConfig() {
        return subset(KEY_PRODUCER_PREFIX);
    }

    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        for (String name : props.stringPropertyNames()) {
            map.put(name, props.getProperty(name));
        }
        return map;
    }

    public Set<String> keys() {
        return props.stringPropertyNames();
    }
}
