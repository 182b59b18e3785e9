/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.node;

import java.util.Map;

/**
 * Snapshot taken after one test-mode loop iteration.
 *
 * @param lastConsumed per input, the value the step consumed in this iteration (inputs the step
 *                     did not read from are absent)
 * @param lastProduced per output, the most recent value written so far
 * @param node         the node under test, for inspecting task state
 */
public record TestIteration(Map<String, Object> lastConsumed,
                            Map<String, Object> lastProduced,
                            Node node) {
}
