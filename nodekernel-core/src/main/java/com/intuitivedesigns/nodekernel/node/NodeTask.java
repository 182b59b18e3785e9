/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.node;

import java.util.Map;

/**
 * User logic of a node.
 *
 * <p>The {@link Node} loop driver calls {@link #preLoop} once, then {@link #step} until it
 * returns {@link StepResult#STOP}, then {@link #postLoop} once. Exceptions thrown from any of
 * them terminate the node; there is no retry.</p>
 *
 * <pre>{@code
 * NodeTask passThrough = (ctx, params) -> {
 *     Object value = ctx.input("input").read();
 *     if (value != null) ctx.output("output").write(value);
 *     return StepResult.CONTINUE;
 * };
 * }</pre>
 */
@FunctionalInterface
public interface NodeTask {

    default void preLoop(NodeContext ctx, Map<String, Object> params) throws Exception {
        // optional
    }

    /**
     * One loop iteration. A {@code null} result is treated as {@link StepResult#CONTINUE}.
     */
    StepResult step(NodeContext ctx, Map<String, Object> params) throws Exception;

    default void postLoop(NodeContext ctx, Map<String, Object> params) throws Exception {
        // optional
    }
}
