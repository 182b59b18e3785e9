/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.runner;

import com.intuitivedesigns.nodekernel.node.NodeTask;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * One node of a pipeline: what it runs and which datasets it reads and writes.
 *
 * @param taskFactory called once per run, so each run gets fresh task state
 * @param parameters  passed to every hook; may contain environment placeholders
 */
public record NodeDefinition(String name,
                             Supplier<? extends NodeTask> taskFactory,
                             List<String> inputs,
                             List<String> outputs,
                             Map<String, Object> parameters) {

    public NodeDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(taskFactory, "taskFactory");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Node name must not be blank");
        }
        inputs = (inputs == null) ? List.of() : List.copyOf(inputs);
        outputs = (outputs == null) ? List.of() : List.copyOf(outputs);
        parameters = (parameters == null)
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public NodeDefinition(String name, Supplier<? extends NodeTask> taskFactory, List<String> inputs, List<String> outputs) {
        this(name, taskFactory, inputs, outputs, Map.of());
    }
}
