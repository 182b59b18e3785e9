/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.config;

/**
 * A {@code {$NAME}} placeholder referenced a variable that is not set.
 */
public class MissingEnvironmentVariableException extends ConfigurationException {

    private final String variable;

    public MissingEnvironmentVariableException(String variable) {
        super("Failed to inject environment variable. " + variable + " was not found.");
        this.variable = variable;
    }

    public String variable() {
        return variable;
    }
}
