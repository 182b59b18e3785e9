/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.node;

/**
 * An operation was invoked in the wrong node mode: a test-only operation outside test mode, or
 * a production operation without its required setup.
 */
public class NodeModeException extends IllegalStateException {

    public NodeModeException(String message) {
        super(message);
    }
}
