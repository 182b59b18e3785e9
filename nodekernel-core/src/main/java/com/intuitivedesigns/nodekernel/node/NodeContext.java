/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.node;

import com.intuitivedesigns.nodekernel.dataset.Dataset;

import java.util.Map;

/**
 * The view of its node a {@link NodeTask} works against.
 */
public interface NodeContext {

    String name();

    String pipelineName();

    /**
     * @throws IllegalArgumentException if the node has no input of that name
     */
    Dataset<Object> input(String datasetName);

    /**
     * @throws IllegalArgumentException if the node has no output of that name
     */
    Dataset<Object> output(String datasetName);

    Map<String, Dataset<Object>> inputs();

    Map<String, Dataset<Object>> outputs();

    default void log(String message) {
        log(message, LogLevel.INFO.label());
    }

    /**
     * Writes {@code {"log": message, "level": level}} to the logging output.
     *
     * @throws IllegalArgumentException if {@code level} is not one of {@link LogLevel}
     */
    void log(String message, String level);

    /**
     * Requests shutdown of the whole pipeline. One-way; a no-op when the node has no
     * {@link PoisonPill}.
     */
    void activatePoisonPill();
}
