/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.metrics;

final class NoopMetricsRuntime implements MetricsRuntime {

    static final NoopMetricsRuntime INSTANCE = new NoopMetricsRuntime();

    private NoopMetricsRuntime() {}

    @Override
    public Object registry() {
        return null;
    }
}
