/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.kafka;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON envelope written to every Kafka topic:
 * {@code {"timestamp", "dataset", "source_pipeline", "source_node", "message"}}.
 */
final class KafkaMessageCodec {

    static final String TIMESTAMP = "timestamp";
    static final String DATASET = "dataset";
    static final String SOURCE_PIPELINE = "source_pipeline";
    static final String SOURCE_NODE = "source_node";
    static final String MESSAGE = "message";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> ENVELOPE = new TypeReference<>() {};

    private KafkaMessageCodec() {}

    static String encode(Instant timestamp, String dataset, String pipeline, String node, Object message)
            throws JsonProcessingException {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put(TIMESTAMP, timestamp.toString());
        envelope.put(DATASET, dataset);
        envelope.put(SOURCE_PIPELINE, pipeline);
        envelope.put(SOURCE_NODE, node);
        envelope.put(MESSAGE, message);
        return MAPPER.writeValueAsString(envelope);
    }

    static Map<String, Object> decode(String json) throws JsonProcessingException {
        return MAPPER.readValue(json, ENVELOPE);
    }
}
