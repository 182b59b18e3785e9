/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.metrics;

import com.intuitivedesigns.nodekernel.config.PipelineConfig;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsRuntimeTest {

    @Test
    void disabledByDefault() {
        MetricsRuntime runtime = MicrometerMetricsRuntime.fromConfig(PipelineConfig.empty());
        assertFalse(runtime.enabled());
        assertEquals("NOOP", runtime.type());
        runtime.counter("ignored", "k", "v");
    }

    @Test
    void recordsCountersTimersAndGauges() {
        MetricsRuntime runtime = MicrometerMetricsRuntime.fromConfig(
                PipelineConfig.of(Map.of("metrics.enabled", "true")));
        assertTrue(runtime.enabled());
        MeterRegistry registry = (MeterRegistry) runtime.registry();

        runtime.counter("nodekernel.node.iterations", "node", "a");
        runtime.counter("nodekernel.node.iterations", "node", "a");
        runtime.timer("nodekernel.node.step", TimeUnit.MILLISECONDS.toNanos(5), "node", "a");
        runtime.gauge("nodekernel.queue.depth", 3, "node", "a");
        runtime.gauge("nodekernel.queue.depth", 7, "node", "a");

        assertEquals(2.0, registry.get("nodekernel.node.iterations").tag("node", "a").counter().count());
        assertEquals(1L, registry.get("nodekernel.node.step").timer().count());
        assertEquals(7.0, registry.get("nodekernel.queue.depth").gauge().value());
        runtime.close();
    }

    @Test
    void fromConfig_shouldApplyCommonTags() {
        MetricsRuntime runtime = MicrometerMetricsRuntime.fromConfig(PipelineConfig.of(Map.of(
                "metrics.enabled", "true",
                "metrics.tags.env", "dev")));
        MeterRegistry registry = (MeterRegistry) runtime.registry();

        runtime.counter("nodekernel.node.failures", "node", "b");

        assertEquals(1.0, registry.get("nodekernel.node.failures")
                .tag("env", "dev").tag("node", "b").counter().count());
        runtime.close();
    }
}
