/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.runner;

import com.intuitivedesigns.nodekernel.config.ConfigInjector;
import com.intuitivedesigns.nodekernel.config.ConfigurationException;
import com.intuitivedesigns.nodekernel.config.DatasetFactory;
import com.intuitivedesigns.nodekernel.config.PipelineConfig;
import com.intuitivedesigns.nodekernel.dataset.ConnectionParams;
import com.intuitivedesigns.nodekernel.dataset.Dataset;
import com.intuitivedesigns.nodekernel.dataset.DatasetConfig;
import com.intuitivedesigns.nodekernel.dataset.DatasetCreateStatus;
import com.intuitivedesigns.nodekernel.dataset.DatasetOptions;
import com.intuitivedesigns.nodekernel.metrics.MetricsRuntime;
import com.intuitivedesigns.nodekernel.metrics.MicrometerMetricsRuntime;
import com.intuitivedesigns.nodekernel.node.Node;
import com.intuitivedesigns.nodekernel.node.PoisonPill;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs every node of a {@link PipelineDefinition} in this JVM, one platform thread per node.
 *
 * <p>{@link #run()} returns once all nodes have finished. When the shared {@link PoisonPill} is
 * activated, by a node or through {@link #stop()}, or when any node fails, the remaining node
 * threads are interrupted and the run winds down. The first node failure is rethrown as a
 * {@link PipelineExecutionException}.</p>
 *
 * <p>Config keys:</p>
 * <ul>
 *   <li>{@code pipeline.datasets.create} (default true): create every dataset before start</li>
 *   <li>{@code pipeline.datasets.create.timeout.ms} (default 30000)</li>
 *   <li>{@code pipeline.dataset.prefix}: remote name prefix</li>
 *   <li>{@code pipeline.dataset.pipeline.prefix} (default false): prepend the pipeline name</li>
 *   <li>{@code pipeline.shutdown.timeout.ms} (default 10000): wait for interrupted nodes</li>
 *   <li>{@code metrics.enabled}, {@code metrics.tags.*}: used when no {@link MetricsRuntime} is
 *   given to the builder; the runner then closes that runtime when {@link #run()} returns</li>
 * </ul>
 */
public final class PipelineRunner {

    private static final Logger log = LoggerFactory.getLogger(PipelineRunner.class);

    // --- Config Keys ---
    static final String CFG_CREATE_DATASETS = "pipeline.datasets.create";
    static final String CFG_CREATE_TIMEOUT_MS = "pipeline.datasets.create.timeout.ms";
    static final String CFG_PREFIX = "pipeline.dataset.prefix";
    static final String CFG_PIPELINE_PREFIX = "pipeline.dataset.pipeline.prefix";
    static final String CFG_SHUTDOWN_TIMEOUT_MS = "pipeline.shutdown.timeout.ms";

    private static final String METRIC_NODES_RUNNING = "nodekernel.pipeline.nodes.running";
    private static final long SUPERVISE_INTERVAL_MS = 100L;

    private final PipelineDefinition definition;
    private final DatasetFactory datasetFactory;
    private final PipelineConfig config;
    private final MetricsRuntime metrics;
    private final boolean ownsMetrics;
    private final ConfigInjector injector;
    private final PoisonPill poisonPill = new PoisonPill();

    private final String prefix;
    private final boolean hasPipelinePrefix;

    private PipelineRunner(Builder b) {
        this.definition = Objects.requireNonNull(b.definition, "definition");
        this.config = (b.config != null) ? b.config : PipelineConfig.get();
        this.datasetFactory = (b.datasetFactory != null) ? b.datasetFactory : DatasetFactory.defaults();
        this.ownsMetrics = (b.metrics == null);
        this.metrics = ownsMetrics ? MicrometerMetricsRuntime.fromConfig(config) : b.metrics;
        this.injector = (b.injector != null) ? b.injector : new ConfigInjector();
        this.prefix = config.getString(CFG_PREFIX, null);
        this.hasPipelinePrefix = config.getBoolean(CFG_PIPELINE_PREFIX, false);
    }

    public static Builder builder(PipelineDefinition definition) {
        return new Builder(definition);
    }

    public PoisonPill poisonPill() {
        return poisonPill;
    }

    public MetricsRuntime metrics() {
        return metrics;
    }

    /**
     * Asks every node to stop. Safe to call from any thread.
     */
    public void stop() {
        if (poisonPill.activate()) {
            log.info("Stop requested for pipeline '{}'", definition.name());
        }
    }

    /**
     * Runs the pipeline to completion.
     *
     * @throws PipelineExecutionException if a node failed
     * @throws ConfigurationException     if datasets or parameters are misconfigured
     * @throws InterruptedException       if the calling thread is interrupted while supervising
     */
    public void run() throws InterruptedException {
        try {
            runPipeline();
        } finally {
            if (ownsMetrics) {
                metrics.close();
            }
        }
    }

    private void runPipeline() throws InterruptedException {
        final String pipeline = definition.name();
        log.info("=== Starting pipeline '{}' ({} nodes, {} datasets) ===",
                pipeline, definition.nodes().size(), definition.datasets().size());

        if (config.getBoolean(CFG_CREATE_DATASETS, true)) {
            createDatasets();
        }

        final List<NodeRun> runs = prepareNodes();
        final CountDownLatch finished = new CountDownLatch(runs.size());
        final AtomicReference<PipelineExecutionException> failure = new AtomicReference<>();

        for (NodeRun run : runs) {
            run.thread = new Thread(() -> runNode(run, failure, finished), "nk-node-" + run.node.name());
            run.thread.start();
        }

        try {
            supervise(finished, failure);
        } finally {
            shutdown(runs, finished);
        }

        PipelineExecutionException error = failure.get();
        if (error != null) {
            log.error("Pipeline '{}' terminated by failure of node '{}'", pipeline, error.nodeName());
            throw error;
        }
        log.info("=== Pipeline '{}' finished ===", pipeline);
    }

    // --- Phases ---

    private void createDatasets() throws InterruptedException {
        final DatasetOptions naming = DatasetOptions.builder()
                .put(ConnectionParams.KEY_PIPELINE_NAME, definition.name())
                .put(ConnectionParams.KEY_PREFIX, prefix)
                .put(ConnectionParams.KEY_HAS_PIPELINE_PREFIX, hasPipelinePrefix)
                .build();
        final long timeoutMs = config.getLong(CFG_CREATE_TIMEOUT_MS, 30_000L);

        for (Map.Entry<String, DatasetConfig> e : definition.datasets().entrySet()) {
            try (Dataset<Object> ds = datasetFactory.fromConfig(e.getKey(), e.getValue())) {
                DatasetCreateStatus status = ds.create(naming);
                awaitCreated(status, timeoutMs);
                log.info("Dataset ready: {}", status);
            }
        }
    }

    private static void awaitCreated(DatasetCreateStatus status, long timeoutMs) throws InterruptedException {
        final long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        while (!status.done()) {
            if (System.nanoTime() >= deadline) {
                throw new ConfigurationException("Timed out after " + timeoutMs + "ms creating dataset '"
                        + status.datasetName() + "'");
            }
            Thread.sleep(10);
        }
    }

    private List<NodeRun> prepareNodes() {
        final List<NodeRun> runs = new ArrayList<>();
        try {
            for (NodeDefinition def : definition.nodes()) {
                final Map<String, Object> params = injector.injectEnvVars(def.parameters());
                final Node node = Node.builder(def.taskFactory().get())
                        .name(def.name())
                        .pipelineName(definition.name())
                        .poisonPill(poisonPill)
                        .datasetFactory(datasetFactory)
                        .config(config)
                        .metrics(metrics)
                        .build();
                runs.add(new NodeRun(node, params));
                node.setup(definition.datasets(), def.inputs(), def.outputs(), prefix, hasPipelinePrefix);
            }
        } catch (RuntimeException e) {
            runs.forEach(r -> r.node.close());
            throw e;
        }
        return runs;
    }

    private void runNode(NodeRun run, AtomicReference<PipelineExecutionException> failure, CountDownLatch finished) {
        final String nodeName = run.node.name();
        try {
            run.node.execute(run.params);
            log.info("Node '{}' completed", nodeName);
        } catch (InterruptedException e) {
            log.info("Node '{}' interrupted, shutting down", nodeName);
        } catch (Exception e) {
            log.error("Node '{}' failed", nodeName, e);
            failure.compareAndSet(null, new PipelineExecutionException(definition.name(), nodeName, e));
        } finally {
            run.node.close();
            finished.countDown();
            metrics.gauge(METRIC_NODES_RUNNING, finished.getCount(), "pipeline", definition.name());
        }
    }

    private void supervise(CountDownLatch finished, AtomicReference<PipelineExecutionException> failure)
            throws InterruptedException {
        metrics.gauge(METRIC_NODES_RUNNING, finished.getCount(), "pipeline", definition.name());
        while (!finished.await(SUPERVISE_INTERVAL_MS, TimeUnit.MILLISECONDS)) {
            if (poisonPill.isActive()) {
                log.warn("Poison pill active, stopping pipeline '{}'", definition.name());
                return;
            }
            if (failure.get() != null) {
                return;
            }
        }
    }

    private void shutdown(List<NodeRun> runs, CountDownLatch finished) throws InterruptedException {
        if (finished.getCount() == 0) {
            return;
        }
        for (NodeRun run : runs) {
            if (run.thread.isAlive()) {
                run.thread.interrupt();
            }
        }
        final long timeoutMs = config.getLong(CFG_SHUTDOWN_TIMEOUT_MS, 10_000L);
        if (!finished.await(timeoutMs, TimeUnit.MILLISECONDS)) {
            log.warn("{} node(s) of pipeline '{}' still running after {}ms",
                    finished.getCount(), definition.name(), timeoutMs);
        }
    }

    private static final class NodeRun {
        final Node node;
        final Map<String, Object> params;
        Thread thread;

        NodeRun(Node node, Map<String, Object> params) {
            this.node = node;
            this.params = params;
        }
    }

    public static final class Builder {
        private final PipelineDefinition definition;
        private DatasetFactory datasetFactory;
        private PipelineConfig config;
        private MetricsRuntime metrics;
        private ConfigInjector injector;

        private Builder(PipelineDefinition definition) {
            this.definition = definition;
        }

        public Builder datasetFactory(DatasetFactory datasetFactory) {
            this.datasetFactory = datasetFactory;
            return this;
        }

        public Builder config(PipelineConfig config) {
            this.config = config;
            return this;
        }

        public Builder metrics(MetricsRuntime metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder injector(ConfigInjector injector) {
            this.injector = injector;
            return this;
        }

        public PipelineRunner build() {
            return new PipelineRunner(this);
        }
    }
}
