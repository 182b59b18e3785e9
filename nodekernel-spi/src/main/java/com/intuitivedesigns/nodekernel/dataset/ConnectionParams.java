/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.dataset;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Role-specific connection parameters handed to {@link Dataset#initialize(DatasetOptions)} for
 * datasets that need a live connection.
 *
 * @param role              consumer for node inputs, producer for node outputs
 * @param datasetName       dataset the connection belongs to
 * @param nodeName          node owning the connection
 * @param pipelineName      pipeline the node runs in
 * @param prefix            optional topic-name prefix ({@code <prefix>.<dataset>}), may be null
 * @param hasPipelinePrefix whether the pipeline name is part of the remote name
 * @param backendConfig     consumer or producer settings for the backend client
 */
public record ConnectionParams(ConnectionRole role,
                               String datasetName,
                               String nodeName,
                               String pipelineName,
                               String prefix,
                               boolean hasPipelinePrefix,
                               Map<String, Object> backendConfig) {

    public static final String KEY_ROLE = "role";
    public static final String KEY_DATASET_NAME = "dataset_name";
    public static final String KEY_NODE_NAME = "node_name";
    public static final String KEY_PIPELINE_NAME = "pipeline_name";
    public static final String KEY_PREFIX = "prefix";
    public static final String KEY_HAS_PIPELINE_PREFIX = "has_pipeline_prefix";
    public static final String KEY_BACKEND_CONFIG = "backend_config";

    public ConnectionParams {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(datasetName, "datasetName");
        Objects.requireNonNull(nodeName, "nodeName");
        Objects.requireNonNull(pipelineName, "pipelineName");
        prefix = (prefix == null || prefix.isBlank()) ? null : prefix.trim();
        backendConfig = (backendConfig == null)
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(backendConfig));
    }

    public static ConnectionParams consumer(String datasetName, String nodeName, String pipelineName,
                                            String prefix, boolean hasPipelinePrefix,
                                            Map<String, Object> consumerConfig) {
        return new ConnectionParams(ConnectionRole.CONSUMER, datasetName, nodeName, pipelineName,
                prefix, hasPipelinePrefix, consumerConfig);
    }

    public static ConnectionParams producer(String datasetName, String nodeName, String pipelineName,
                                            String prefix, boolean hasPipelinePrefix,
                                            Map<String, Object> producerConfig) {
        return new ConnectionParams(ConnectionRole.PRODUCER, datasetName, nodeName, pipelineName,
                prefix, hasPipelinePrefix, producerConfig);
    }

    public DatasetOptions toOptions() {
        return DatasetOptions.builder()
                .put(KEY_ROLE, role.name())
                .put(KEY_DATASET_NAME, datasetName)
                .put(KEY_NODE_NAME, nodeName)
                .put(KEY_PIPELINE_NAME, pipelineName)
                .put(KEY_PREFIX, prefix)
                .put(KEY_HAS_PIPELINE_PREFIX, hasPipelinePrefix)
                .put(KEY_BACKEND_CONFIG, backendConfig)
                .build();
    }

    /**
     * Reverse of {@link #toOptions()}.
     *
     * @throws IllegalArgumentException if the role or a required name is missing
     */
    public static ConnectionParams fromOptions(DatasetOptions options) {
        Objects.requireNonNull(options, "options");
        String role = options.getString(KEY_ROLE, null);
        if (role == null) {
            throw new IllegalArgumentException("Connection options are missing '" + KEY_ROLE + "'");
        }
        return new ConnectionParams(
                ConnectionRole.valueOf(role.trim().toUpperCase(Locale.ROOT)),
                require(options, KEY_DATASET_NAME),
                require(options, KEY_NODE_NAME),
                require(options, KEY_PIPELINE_NAME),
                options.getString(KEY_PREFIX, null),
                options.getBoolean(KEY_HAS_PIPELINE_PREFIX, false),
                options.getMap(KEY_BACKEND_CONFIG)
        );
    }

    /**
     * Remote name for the dataset: {@code [<prefix>.][<pipeline>.]<dataset>}.
     */
    public String qualifiedName() {
        String name = hasPipelinePrefix ? pipelineName + "." + datasetName : datasetName;
        return (prefix != null) ? prefix + "." + name : name;
    }

    private static String require(DatasetOptions options, String key) {
        String v = options.getString(key, null);
        if (v == null || v.isBlank()) {
            throw new IllegalArgumentException("Connection options are missing '" + key + "'");
        }
        return v;
    }
}
