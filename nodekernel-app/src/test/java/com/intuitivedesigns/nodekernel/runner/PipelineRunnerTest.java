/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.runner;

import com.intuitivedesigns.nodekernel.config.ConfigInjector;
import com.intuitivedesigns.nodekernel.config.ConfigurationException;
import com.intuitivedesigns.nodekernel.config.DatasetFactory;
import com.intuitivedesigns.nodekernel.config.MissingEnvironmentVariableException;
import com.intuitivedesigns.nodekernel.config.PipelineConfig;
import com.intuitivedesigns.nodekernel.dataset.DatasetConfig;
import com.intuitivedesigns.nodekernel.memory.MemoryTopic;
import com.intuitivedesigns.nodekernel.memory.MemoryTopicStore;
import com.intuitivedesigns.nodekernel.node.NodeContext;
import com.intuitivedesigns.nodekernel.node.NodeTask;
import com.intuitivedesigns.nodekernel.node.StepResult;
import com.intuitivedesigns.nodekernel.spi.PluginCatalog;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(value = 30, unit = TimeUnit.SECONDS)
class PipelineRunnerTest {

    private final PipelineConfig config = PipelineConfig.empty();
    private final DatasetFactory factory = new DatasetFactory(PluginCatalog.load(), config);

    // Topics live in the process-wide store, so every test uses its own names
    private final String run = UUID.randomUUID().toString().substring(0, 8);

    private Map<String, DatasetConfig> memoryDatasets(String... names) {
        Map<String, DatasetConfig> datasets = new LinkedHashMap<>();
        for (String name : names) {
            datasets.put(name, new DatasetConfig("memory", run + "." + name));
        }
        datasets.put("logging", new DatasetConfig("memory", run + ".logging"));
        return datasets;
    }

    private List<Object> topicContents(String dataset) {
        MemoryTopic topic = MemoryTopicStore.shared().find(run + "." + dataset).orElseThrow();
        List<Object> values = new ArrayList<>();
        for (long offset = topic.firstOffset(); offset < topic.endOffset(); offset++) {
            values.add(topic.get(offset).value());
        }
        return values;
    }

    private PipelineRunner runner(PipelineDefinition definition) {
        return PipelineRunner.builder(definition).datasetFactory(factory).config(config).build();
    }

    /** Emits 0..count-1 then stops. */
    private static final class Sequencer implements NodeTask {
        private int next;

        @Override
        public StepResult step(NodeContext ctx, Map<String, Object> params) {
            int count = ((Number) params.get("count")).intValue();
            if (next >= count) {
                return StepResult.STOP;
            }
            ctx.output("numbers").write(next++);
            return StepResult.CONTINUE;
        }
    }

    /** Doubles each number and stops after {@code expected} values. */
    private static final class Doubler implements NodeTask {
        private int seen;

        @Override
        public StepResult step(NodeContext ctx, Map<String, Object> params) {
            Object value = ctx.input("numbers").read();
            if (value == null) {
                return StepResult.CONTINUE;
            }
            ctx.output("doubled").write(((Integer) value) * 2);
            seen++;
            return seen >= ((Number) params.get("expected")).intValue() ? StepResult.STOP : StepResult.CONTINUE;
        }
    }

    @Test
    void sequencerFeedsDoublerAcrossThreads() throws Exception {
        PipelineDefinition definition = new PipelineDefinition("numbers_" + run,
                memoryDatasets("numbers", "doubled"),
                List.of(
                        new NodeDefinition("sequencer", Sequencer::new, List.of(), List.of("numbers"), Map.of("count", 5)),
                        new NodeDefinition("doubler", Doubler::new, List.of("numbers"), List.of("doubled"), Map.of("expected", 5))));

        runner(definition).run();

        assertEquals(List.of(0, 1, 2, 3, 4), topicContents("numbers"));
        assertEquals(List.of(0, 2, 4, 6, 8), topicContents("doubled"));
    }

    @Test
    void metricsEnabledInConfigRecordNodeIterations() throws Exception {
        PipelineConfig metricsConfig = PipelineConfig.of(Map.of(
                "metrics.enabled", "true",
                "metrics.tags.env", "test"));
        PipelineDefinition definition = new PipelineDefinition("metrics_" + run,
                memoryDatasets("numbers"),
                List.of(new NodeDefinition("sequencer", Sequencer::new, List.of(), List.of("numbers"), Map.of("count", 3))));

        PipelineRunner runner = PipelineRunner.builder(definition)
                .datasetFactory(new DatasetFactory(PluginCatalog.load(), metricsConfig))
                .config(metricsConfig)
                .build();
        assertTrue(runner.metrics().enabled());
        MeterRegistry registry = (MeterRegistry) runner.metrics().registry();

        runner.run();

        // three writes plus the STOP step
        assertEquals(4.0, registry.get("nodekernel.node.iterations")
                .tag("node", "sequencer").tag("env", "test").counter().count());
        assertEquals(4L, registry.get("nodekernel.node.step").tag("node", "sequencer").timer().count());
    }

    @Test
    void metricsStayDisabledByDefault() {
        PipelineDefinition definition = new PipelineDefinition("nometrics_" + run, memoryDatasets(), List.of());
        assertFalse(runner(definition).metrics().enabled());
    }

    @Test
    void completionIsLoggedForEveryNode() throws Exception {
        PipelineDefinition definition = new PipelineDefinition("logs_" + run,
                memoryDatasets("numbers"),
                List.of(new NodeDefinition("sequencer", Sequencer::new, List.of(), List.of("numbers"), Map.of("count", 1))));

        runner(definition).run();

        assertTrue(topicContents("logging").contains(
                Map.of("log", "Execution loop complete for node: sequencer", "level", "info")));
    }

    @Test
    void poisonPillStopsLongRunningNodes() throws Exception {
        NodeTask forever = (ctx, params) -> {
            Thread.sleep(5);
            return StepResult.CONTINUE;
        };
        NodeTask killer = new NodeTask() {
            private int steps;

            @Override
            public StepResult step(NodeContext ctx, Map<String, Object> params) {
                if (++steps == 3) {
                    ctx.activatePoisonPill();
                }
                return StepResult.CONTINUE;
            }
        };
        PipelineDefinition definition = new PipelineDefinition("pill_" + run,
                memoryDatasets(),
                List.of(
                        new NodeDefinition("forever", () -> forever, List.of(), List.of()),
                        new NodeDefinition("killer", () -> killer, List.of(), List.of())));

        PipelineRunner runner = runner(definition);
        runner.run();

        assertTrue(runner.poisonPill().isActive());
    }

    @Test
    void nodeFailureStopsThePipelineAndIsRethrown() {
        IllegalStateException boom = new IllegalStateException("bad data");
        NodeTask failing = (ctx, params) -> {
            throw boom;
        };
        NodeTask forever = (ctx, params) -> {
            Thread.sleep(5);
            return StepResult.CONTINUE;
        };
        PipelineDefinition definition = new PipelineDefinition("fail_" + run,
                memoryDatasets(),
                List.of(
                        new NodeDefinition("forever", () -> forever, List.of(), List.of()),
                        new NodeDefinition("failing", () -> failing, List.of(), List.of())));

        PipelineExecutionException ex = assertThrows(PipelineExecutionException.class, () -> runner(definition).run());

        assertEquals("failing", ex.nodeName());
        assertSame(boom, ex.getCause());
    }

    @Test
    void parametersGetEnvironmentValues() throws Exception {
        List<Object> received = new CopyOnWriteArrayList<>();
        NodeTask capture = (ctx, params) -> {
            received.add(params.get("broker"));
            return StepResult.STOP;
        };
        PipelineDefinition definition = new PipelineDefinition("env_" + run,
                memoryDatasets(),
                List.of(new NodeDefinition("capture", () -> capture, List.of(), List.of(), Map.of("broker", "{$BROKER}:9092"))));

        PipelineRunner.builder(definition)
                .datasetFactory(factory)
                .config(config)
                .injector(new ConfigInjector(Map.of("BROKER", "kafka-0")::get))
                .build()
                .run();

        assertEquals(List.of("kafka-0:9092"), received);
    }

    @Test
    void missingEnvironmentVariableFailsBeforeAnyNodeStarts() {
        List<Object> steps = new CopyOnWriteArrayList<>();
        NodeTask capture = (ctx, params) -> {
            steps.add("step");
            return StepResult.STOP;
        };
        PipelineDefinition definition = new PipelineDefinition("missing_env_" + run,
                memoryDatasets(),
                List.of(
                        new NodeDefinition("first", () -> capture, List.of(), List.of()),
                        new NodeDefinition("second", () -> capture, List.of(), List.of(), Map.of("x", "{$NOT_SET}"))));

        PipelineRunner runner = PipelineRunner.builder(definition)
                .datasetFactory(factory)
                .config(config)
                .injector(new ConfigInjector(Map.<String, String>of()::get))
                .build();

        assertThrows(MissingEnvironmentVariableException.class, runner::run);
        assertTrue(steps.isEmpty());
    }

    @Test
    void undefinedDatasetIsAConfigurationError() {
        PipelineDefinition definition = new PipelineDefinition("undefined_" + run,
                memoryDatasets(),
                List.of(new NodeDefinition("reader", Doubler::new, List.of("numbers"), List.of("doubled"))));

        assertThrows(ConfigurationException.class, () -> runner(definition).run());
    }

    @Test
    void datasetsAreCreatedBeforeStart() throws Exception {
        PipelineDefinition definition = new PipelineDefinition("create_" + run,
                memoryDatasets("unused"),
                List.of());

        runner(definition).run();

        assertTrue(MemoryTopicStore.shared().exists(run + ".unused"));
    }

    @Test
    void duplicateNodeNamesAreRejected() {
        NodeDefinition node = new NodeDefinition("same", Sequencer::new, List.of(), List.of());
        assertThrows(IllegalArgumentException.class,
                () -> new PipelineDefinition("dup", Map.of(), List.of(node, node)));
    }
}
