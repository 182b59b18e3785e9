/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.runner;

import com.intuitivedesigns.nodekernel.dataset.DatasetConfig;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A named set of datasets and the nodes wired to them.
 */
public record PipelineDefinition(String name,
                                 Map<String, DatasetConfig> datasets,
                                 List<NodeDefinition> nodes) {

    public PipelineDefinition {
        Objects.requireNonNull(name, "name");
        datasets = (datasets == null)
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(datasets));
        nodes = (nodes == null) ? List.of() : List.copyOf(nodes);

        Set<String> seen = new HashSet<>();
        for (NodeDefinition node : nodes) {
            if (!seen.add(node.name())) {
                throw new IllegalArgumentException("Duplicate node name '" + node.name() + "' in pipeline '" + name + "'");
            }
        }
    }
}
