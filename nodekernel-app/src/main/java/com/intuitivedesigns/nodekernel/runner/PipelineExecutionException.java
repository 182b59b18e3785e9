/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.runner;

/**
 * A node of a running pipeline terminated with a failure. The cause is the node's exception.
 */
public class PipelineExecutionException extends RuntimeException {

    private final String pipelineName;
    private final String nodeName;

    public PipelineExecutionException(String pipelineName, String nodeName, Throwable cause) {
        super("Node '" + nodeName + "' of pipeline '" + pipelineName + "' failed: " + cause, cause);
        this.pipelineName = pipelineName;
        this.nodeName = nodeName;
    }

    public String pipelineName() {
        return pipelineName;
    }

    public String nodeName() {
        return nodeName;
    }
}
