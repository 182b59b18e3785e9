/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.memory;

import com.intuitivedesigns.nodekernel.config.ConfigurationException;
import com.intuitivedesigns.nodekernel.config.PipelineConfig;
import com.intuitivedesigns.nodekernel.dataset.Dataset;
import com.intuitivedesigns.nodekernel.spi.DatasetPlugin;

import java.util.Map;

/**
 * In-process dataset backed by {@link MemoryTopicStore#shared()}.
 * <p>
 * ID: MEMORY. {@code target} names the topic (defaults to the dataset name).
 * Params: {@code max_messages} bounds the topic, oldest messages are dropped (0 = unbounded).
 */
public final class MemoryDatasetPlugin implements DatasetPlugin {

    public static final String ID = "MEMORY";
    static final String PARAM_MAX_MESSAGES = "max_messages";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Dataset<?> create(String name, String target, Map<String, Object> params, PipelineConfig config) {
        return new MemoryDataset(name, target, maxMessages(name, params), MemoryTopicStore.shared());
    }

    static int maxMessages(String name, Map<String, Object> params) {
        Object raw = params.get(PARAM_MAX_MESSAGES);
        if (raw == null) {
            return 0;
        }
        try {
            int value = (raw instanceof Number n) ? n.intValue() : Integer.parseInt(raw.toString().trim());
            if (value < 0) {
                throw new ConfigurationException("Dataset '" + name + "': " + PARAM_MAX_MESSAGES + " must be >= 0, got " + value);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Dataset '" + name + "': " + PARAM_MAX_MESSAGES + " is not a number: " + raw, e);
        }
    }
}
