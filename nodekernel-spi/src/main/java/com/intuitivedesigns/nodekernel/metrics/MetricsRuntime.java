/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.metrics;

/**
 * The vendor-agnostic contract for node metrics.
 *
 * <p>Every method has a no-op default so nodes can run without any metrics backend
 * ({@link #noop()}).</p>
 */
public interface MetricsRuntime extends AutoCloseable {

    /**
     * Returns the underlying registry (e.g., MeterRegistry) for advanced usage.
     */
    Object registry();

    /**
     * @return true if metrics are actually being recorded.
     */
    default boolean enabled() { return false; }

    /**
     * @return A string identifier for the implementation (e.g., "MICROMETER", "NOOP").
     */
    default String type() { return "NOOP"; }

    // --- Standard Instrumentation Methods (with NOOP defaults) ---

    default void counter(String name, String... tags) {}

    default void timer(String name, long durationNanos, String... tags) {}

    default void gauge(String name, double value, String... tags) {}

    @Override
    default void close() {
        // no-op by default
    }

    static MetricsRuntime noop() {
        return NoopMetricsRuntime.INSTANCE;
    }
}
