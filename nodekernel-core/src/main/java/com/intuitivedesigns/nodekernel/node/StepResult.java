/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.node;

/**
 * Outcome of one {@link NodeTask#step} call.
 */
public enum StepResult {
    /** Run another iteration. */
    CONTINUE,
    /** Leave the loop; the post-loop hook runs next. */
    STOP
}
