/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.dataset;

import java.util.Objects;

/**
 * The single failure type surfaced by dataset operations.
 *
 * <p>Always carries the name of the dataset that failed. When a backend failure is translated,
 * the original exception is kept as the cause.</p>
 */
public class DatasetError extends RuntimeException {

    private final String datasetName;

    public DatasetError(String datasetName, String message) {
        super(message);
        this.datasetName = Objects.requireNonNull(datasetName, "datasetName");
    }

    public DatasetError(String datasetName, String message, Throwable cause) {
        super(message, cause);
        this.datasetName = Objects.requireNonNull(datasetName, "datasetName");
    }

    public String datasetName() {
        return datasetName;
    }
}
