/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.node;

/**
 * Carries a checked exception out of a context that cannot declare it, such as
 * {@link java.util.Iterator#next()}.
 */
public class NodeExecutionException extends RuntimeException {

    private final String nodeName;

    public NodeExecutionException(String nodeName, Throwable cause) {
        super("Node '" + nodeName + "' failed: " + cause.getMessage(), cause);
        this.nodeName = nodeName;
    }

    public String nodeName() {
        return nodeName;
    }
}
