/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */
package com.intuitivedesigns.nodekernel.spi;

public enum PluginKind {
    DATASET,
    ASYNC_DATASET
}
