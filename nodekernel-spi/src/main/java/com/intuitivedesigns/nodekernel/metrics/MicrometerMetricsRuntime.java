/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.metrics;

import com.intuitivedesigns.nodekernel.config.PipelineConfig;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer-backed {@link MetricsRuntime} used by nodes and the local runner.
 *
 * <p>Meters land in a composite registry that always holds an in-memory
 * {@link SimpleMeterRegistry}; exporters are attached with {@link #addRegistry(MeterRegistry)}.
 * Keys under {@code metrics.tags.} become common tags on every meter, e.g.
 * {@code metrics.tags.env=dev}.</p>
 */
public final class MicrometerMetricsRuntime implements MetricsRuntime {

    private static final Logger log = LoggerFactory.getLogger(MicrometerMetricsRuntime.class);

    public static final String KEY_ENABLED = "metrics.enabled";
    public static final String KEY_COMMON_TAGS = "metrics.tags.";

    private final CompositeMeterRegistry registry = new CompositeMeterRegistry();

    // gauges are pushed by callers, so each one reads from a mutable cell
    private final Map<GaugeKey, GaugeCell> gauges = new ConcurrentHashMap<>();

    public MicrometerMetricsRuntime() {
        this(Tags.empty());
    }

    public MicrometerMetricsRuntime(Iterable<Tag> commonTags) {
        registry.add(new SimpleMeterRegistry());
        registry.config().commonTags(commonTags);
    }

    public static MetricsRuntime fromConfig(PipelineConfig config) {
        if (!config.getBoolean(KEY_ENABLED, false)) {
            return MetricsRuntime.noop();
        }
        final List<Tag> common = new ArrayList<>();
        config.subset(KEY_COMMON_TAGS).forEach((k, v) -> common.add(Tag.of(k, String.valueOf(v))));
        log.info("Node metrics enabled (common tags: {})", common);
        return new MicrometerMetricsRuntime(common);
    }

    public void addRegistry(MeterRegistry exporter) {
        registry.add(exporter);
    }

    @Override
    public Object registry() {
        return registry;
    }

    @Override
    public boolean enabled() {
        return true;
    }

    @Override
    public String type() {
        return "MICROMETER";
    }

    @Override
    public void counter(String name, String... tags) {
        registry.counter(name, tags).increment();
    }

    @Override
    public void timer(String name, long durationNanos, String... tags) {
        registry.timer(name, tags).record(durationNanos, TimeUnit.NANOSECONDS);
    }

    @Override
    public void gauge(String name, double value, String... tags) {
        final Tags tagSet = Tags.of(tags);
        gauges.computeIfAbsent(new GaugeKey(name, tagSet), key -> {
            GaugeCell cell = new GaugeCell();
            Gauge.builder(name, cell, GaugeCell::value).tags(tagSet).register(registry);
            return cell;
        }).value = value;
    }

    @Override
    public void close() {
        registry.close();
        gauges.clear();
        log.debug("Node metrics registry closed");
    }

    private record GaugeKey(String name, Tags tags) {}

    private static final class GaugeCell {
        volatile double value;

        double value() {
            return value;
        }
    }
}
