/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.node;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Levels accepted by {@link NodeContext#log(String, String)}.
 */
public enum LogLevel {
    INFO("info"),
    DEBUG("debug"),
    WARNING("warning"),
    ERROR("error"),
    CRITICAL("critical");

    private final String label;

    LogLevel(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Exact, case-sensitive match on the label.
     *
     * @throws IllegalArgumentException listing the valid labels
     */
    public static LogLevel parse(String level) {
        for (LogLevel l : values()) {
            if (l.label.equals(level)) {
                return l;
            }
        }
        throw new IllegalArgumentException("Invalid logging level " + level
                + ". Valid options are: " + validOptions());
    }

    public static String validOptions() {
        return Arrays.stream(values()).map(LogLevel::label).collect(Collectors.joining(", "));
    }
}
