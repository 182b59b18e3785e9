/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.node;

import com.intuitivedesigns.nodekernel.config.ConfigurationException;
import com.intuitivedesigns.nodekernel.config.DatasetFactory;
import com.intuitivedesigns.nodekernel.config.PipelineConfig;
import com.intuitivedesigns.nodekernel.dataset.ConnectionParams;
import com.intuitivedesigns.nodekernel.dataset.Dataset;
import com.intuitivedesigns.nodekernel.dataset.DatasetConfig;
import com.intuitivedesigns.nodekernel.metrics.MetricsRuntime;
import com.intuitivedesigns.nodekernel.testing.FakeDatasetInput;
import com.intuitivedesigns.nodekernel.testing.FakeDatasetOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Loop driver for one unit of pipeline work.
 *
 * <p>Lifecycle: {@code created -> setup -> ready -> preLoop -> running -> postLoop ->
 * terminated}. A node owns its dataset handles exclusively and talks to other nodes only
 * through them. It spawns no threads; the supervisor gives each node its own execution
 * context.</p>
 *
 * <p><b>Failure contract:</b> a failure in the pre-loop hook or in any step is written to the
 * logging output (level {@code debug}, full stack trace) and then rethrown unchanged. There is
 * no retry; isolation is the supervisor's job.</p>
 *
 * <p><b>Test mode:</b> after {@link #enableTestMode()}, production handles are dropped and never
 * touched again; {@link #setupTest} installs in-memory doubles and {@link #runTest} /
 * {@link #runTestIterations} drive the loop against them.</p>
 */
public class Node implements NodeContext {

    private static final Logger log = LoggerFactory.getLogger(Node.class);

    // Metric names
    private static final String METRIC_ITERATIONS = "nodekernel.node.iterations";
    private static final String METRIC_FAILURES = "nodekernel.node.failures";
    private static final String METRIC_STEP = "nodekernel.node.step";

    private final String name;
    private final String pipelineName;
    private final NodeTask task;
    private final PoisonPill poisonPill; // borrowed, may be null
    private final DatasetFactory datasetFactory;
    private final PipelineConfig config;
    private final MetricsRuntime metrics;
    private final String loggingDataset;
    private final String[] metricTags;

    private final Map<String, Dataset<Object>> inputs = new LinkedHashMap<>();
    private final Map<String, Dataset<Object>> outputs = new LinkedHashMap<>();

    private Map<String, Object> parameters = new LinkedHashMap<>();
    private volatile boolean testMode;
    private volatile Instant lastHeartbeat;

    private Node(Builder b) {
        this.task = Objects.requireNonNull(b.task, "task");
        this.name = (b.name != null && !b.name.isBlank()) ? b.name.trim() : task.getClass().getSimpleName();
        this.pipelineName = Objects.requireNonNull(b.pipelineName, "pipelineName");
        this.poisonPill = b.poisonPill;
        this.config = (b.config != null) ? b.config : PipelineConfig.get();
        this.datasetFactory = b.datasetFactory;
        this.metrics = (b.metrics != null) ? b.metrics : MetricsRuntime.noop();
        this.loggingDataset = config.loggingDataset();
        this.testMode = b.testMode;
        this.lastHeartbeat = Instant.now();
        this.metricTags = new String[]{"pipeline", pipelineName, "node", name};
    }

    public static Builder builder(NodeTask task) {
        return new Builder(task);
    }

    // --- Setup ---

    /**
     * Builds a handle per input and output name from the dataset registry, and initializes the
     * handles that need a connection: consumer role for inputs, producer role for outputs. The
     * logging dataset is always added to the outputs. Calling again replaces handles per name.
     *
     * @param datasets          dataset registry, name to config record
     * @param inputNames        datasets this node reads
     * @param outputNames       datasets this node writes
     * @param prefix            optional remote name prefix
     * @param hasPipelinePrefix whether remote names carry the pipeline name
     * @throws ConfigurationException if a name has no entry in {@code datasets} or an unknown type
     * @throws NodeModeException      if the node is in test mode
     */
    public void setup(Map<String, DatasetConfig> datasets,
                      List<String> inputNames,
                      List<String> outputNames,
                      String prefix,
                      boolean hasPipelinePrefix) {
        if (testMode) {
            throw new NodeModeException("Node '" + name + "' is in test mode. Use setupTest() instead of setup().");
        }
        if (datasetFactory == null) {
            throw new NodeModeException("Node '" + name + "' was built without a DatasetFactory; setup() requires one.");
        }
        Objects.requireNonNull(datasets, "datasets");

        final List<String> ins = (inputNames == null) ? List.of() : inputNames;
        final List<String> outs = new ArrayList<>((outputNames == null) ? List.of() : outputNames);
        if (!outs.contains(loggingDataset)) {
            outs.add(loggingDataset);
        }

        for (String datasetName : ins) {
            replace(inputs, datasetName, build(datasets, datasetName));
        }
        for (String datasetName : outs) {
            replace(outputs, datasetName, build(datasets, datasetName));
        }

        for (String datasetName : ins) {
            Dataset<Object> ds = inputs.get(datasetName);
            if (ds.connectionRequired()) {
                ds.initialize(ConnectionParams.consumer(datasetName, name, pipelineName, prefix,
                        hasPipelinePrefix, config.defaultConsumerConfig()).toOptions());
            }
        }
        for (String datasetName : outs) {
            Dataset<Object> ds = outputs.get(datasetName);
            if (ds.connectionRequired()) {
                ds.initialize(ConnectionParams.producer(datasetName, name, pipelineName, prefix,
                        hasPipelinePrefix, config.defaultProducerConfig()).toOptions());
            }
        }

        log.info("Node '{}' ready. pipeline='{}' inputs={} outputs={}", name, pipelineName, inputs.keySet(), outputs.keySet());
    }

    public void setup(Map<String, DatasetConfig> datasets, List<String> inputNames, List<String> outputNames) {
        setup(datasets, inputNames, outputNames, null, false);
    }

    private Dataset<Object> build(Map<String, DatasetConfig> datasets, String datasetName) {
        DatasetConfig cfg = datasets.get(datasetName);
        if (cfg == null) {
            throw new ConfigurationException("Node '" + name + "' references dataset '" + datasetName
                    + "' which is not defined. Defined datasets: " + datasets.keySet());
        }
        return datasetFactory.fromConfig(datasetName, cfg);
    }

    private void replace(Map<String, Dataset<Object>> handles, String datasetName, Dataset<Object> fresh) {
        Dataset<Object> previous = handles.put(datasetName, fresh);
        if (previous != null && previous != fresh) {
            closeQuietly(previous);
        }
    }

    // --- Execution ---

    /**
     * Runs the full lifecycle: pre-loop hook, steps until {@link StepResult#STOP}, post-loop
     * hook, then a final log line naming the node.
     *
     * @throws InterruptedException if the executing thread is interrupted between iterations
     * @throws Exception            whatever the task threw, unchanged
     */
    public void execute(Map<String, Object> params) throws Exception {
        this.parameters = (params != null) ? params : new LinkedHashMap<>();
        final Map<String, Object> p = this.parameters;

        log.info("Node '{}' starting execution loop", name);
        try {
            task.preLoop(this, p);
        } catch (Exception e) {
            logTraceback(e);
            throw e;
        }

        StepResult result = StepResult.CONTINUE;
        while (result != StepResult.STOP) {
            if (Thread.interrupted()) {
                throw new InterruptedException("Node '" + name + "' interrupted");
            }
            result = runStep(p);
        }

        task.postLoop(this, p);
        log("Execution loop complete for node: " + name);
    }

    private StepResult runStep(Map<String, Object> p) throws Exception {
        lastHeartbeat = Instant.now();
        final long start = System.nanoTime();
        try {
            StepResult r = task.step(this, p);
            metrics.counter(METRIC_ITERATIONS, metricTags);
            return (r != null) ? r : StepResult.CONTINUE;
        } catch (Exception e) {
            metrics.counter(METRIC_FAILURES, metricTags);
            logTraceback(e);
            throw e;
        } finally {
            metrics.timer(METRIC_STEP, System.nanoTime() - start, metricTags);
        }
    }

    private void logTraceback(Exception failure) {
        StringWriter trace = new StringWriter();
        failure.printStackTrace(new PrintWriter(trace));
        try {
            log(trace.toString(), LogLevel.DEBUG.label());
        } catch (RuntimeException logFailure) {
            // The step failure is what the caller must see
            failure.addSuppressed(logFailure);
        }
    }

    // --- NodeContext ---

    @Override
    public String name() {
        return name;
    }

    @Override
    public String pipelineName() {
        return pipelineName;
    }

    @Override
    public Dataset<Object> input(String datasetName) {
        Dataset<Object> ds = inputs.get(datasetName);
        if (ds == null) {
            throw new IllegalArgumentException("Node '" + name + "' has no input '" + datasetName + "'. Inputs: " + inputs.keySet());
        }
        return ds;
    }

    @Override
    public Dataset<Object> output(String datasetName) {
        Dataset<Object> ds = outputs.get(datasetName);
        if (ds == null) {
            throw new IllegalArgumentException("Node '" + name + "' has no output '" + datasetName + "'. Outputs: " + outputs.keySet());
        }
        return ds;
    }

    @Override
    public Map<String, Dataset<Object>> inputs() {
        return Collections.unmodifiableMap(inputs);
    }

    @Override
    public Map<String, Dataset<Object>> outputs() {
        return Collections.unmodifiableMap(outputs);
    }

    @Override
    public void log(String message, String level) {
        final LogLevel parsed = LogLevel.parse(level);
        final Dataset<Object> out = outputs.get(loggingDataset);
        if (out == null) {
            throw new NodeModeException("Node '" + name + "' has no '" + loggingDataset
                    + "' output. Call setup() or setupTest() first.");
        }

        mirror(parsed, message);

        Map<String, Object> record = new LinkedHashMap<>();
        record.put("log", message);
        record.put("level", parsed.label());
        out.write(record);
    }

    private void mirror(LogLevel level, String message) {
        switch (level) {
            case DEBUG:
                log.debug("[{}] {}", name, message);
                break;
            case WARNING:
                log.warn("[{}] {}", name, message);
                break;
            case ERROR:
            case CRITICAL:
                log.error("[{}] {}", name, message);
                break;
            default:
                log.info("[{}] {}", name, message);
        }
    }

    @Override
    public void activatePoisonPill() {
        if (poisonPill == null) {
            log.debug("Node '{}' has no poison pill; activation ignored", name);
            return;
        }
        if (poisonPill.activate()) {
            log.warn("Poison pill activated by node '{}' (pipeline '{}')", name, pipelineName);
        }
    }

    // --- Test mode ---

    /**
     * Switches to test mode. Production handles are dropped without being closed or used again.
     */
    public void enableTestMode() {
        testMode = true;
        inputs.clear();
        outputs.clear();
    }

    /**
     * Installs in-memory doubles: one input double per entry of {@code inputValues}, one output
     * double per name in {@code outputNames} plus the logging dataset.
     *
     * @throws NodeModeException if the node is not in test mode
     */
    public void setupTest(Map<String, ? extends List<?>> inputValues,
                          List<String> outputNames,
                          Map<String, Object> params) {
        requireTestMode();

        inputs.clear();
        if (inputValues != null) {
            inputValues.forEach((datasetName, values) ->
                    inputs.put(datasetName, new FakeDatasetInput<Object>(datasetName, name, values)));
        }

        outputs.clear();
        final List<String> outs = new ArrayList<>((outputNames == null) ? List.of() : outputNames);
        if (!outs.contains(loggingDataset)) {
            outs.add(loggingDataset);
        }
        for (String datasetName : outs) {
            outputs.put(datasetName, new FakeDatasetOutput<>(datasetName, name));
        }

        this.parameters = (params != null) ? params : new LinkedHashMap<>();
    }

    public Map<String, List<Object>> runTest() throws Exception {
        return runTest(null);
    }

    /**
     * Runs pre-loop, steps and post-loop against the test doubles.
     *
     * <p>After each iteration the loop stops when the step returned {@link StepResult#STOP}, or
     * when {@code runtime} is given and has elapsed, or when the node has inputs which are all
     * exhausted, whichever comes first. Without inputs, only {@code STOP} or the runtime ends it.</p>
     *
     * @param runtime optional wall-clock budget
     * @return per output name, every value written, in order
     * @throws NodeModeException if the node is not in test mode
     */
    public Map<String, List<Object>> runTest(Duration runtime) throws Exception {
        requireTestMode();
        TestLoop loop = new TestLoop(parameters, runtime);
        loop.start();
        while (!loop.ended) {
            loop.iterate();
        }
        loop.finish();
        return collectOutputs();
    }

    public Map<String, List<Object>> runTest(Map<String, Object> params, Duration runtime) throws Exception {
        requireTestMode();
        this.parameters = (params != null) ? params : new LinkedHashMap<>();
        return runTest(runtime);
    }

    /**
     * Lazy variant of {@link #runTest(Duration)}: each {@code next()} runs one iteration and
     * returns its snapshot. The pre-loop hook runs on the first call to {@code hasNext()}, the
     * post-loop hook once the loop has ended. Checked task failures surface as
     * {@link NodeExecutionException}.
     *
     * @throws NodeModeException if the node is not in test mode
     */
    public Iterator<TestIteration> runTestIterations(Duration runtime) {
        requireTestMode();
        return new TestIterator(new TestLoop(parameters, runtime));
    }

    public Iterator<TestIteration> runTestIterations() {
        return runTestIterations(null);
    }

    private Map<String, List<Object>> collectOutputs() {
        Map<String, List<Object>> result = new LinkedHashMap<>();
        for (Map.Entry<String, Dataset<Object>> e : outputs.entrySet()) {
            if (e.getValue() instanceof FakeDatasetOutput<Object> out) {
                result.put(e.getKey(), new ArrayList<>(out.values()));
            }
        }
        return result;
    }

    private void requireTestMode() {
        if (!testMode) {
            throw new NodeModeException("Node '" + name + "' is not in test mode. Please call enableTestMode() first.");
        }
    }

    /**
     * One test-mode run: start time, hooks and the termination rule.
     */
    private final class TestLoop {
        private final Map<String, Object> params;
        private final Duration runtime;
        private final long startNanos;
        private boolean ended;

        TestLoop(Map<String, Object> params, Duration runtime) {
            this.params = params;
            this.runtime = runtime;
            this.startNanos = System.nanoTime();
        }

        void start() throws Exception {
            task.preLoop(Node.this, params);
        }

        TestIteration iterate() throws Exception {
            Map<String, Long> countsBefore = new LinkedHashMap<>();
            for (Map.Entry<String, Dataset<Object>> e : inputs.entrySet()) {
                if (e.getValue() instanceof FakeDatasetInput<Object> in) {
                    countsBefore.put(e.getKey(), in.consumedCount());
                }
            }

            StepResult result = runStep(params);

            ended = (result == StepResult.STOP) || budgetReached();

            Map<String, Object> consumed = new LinkedHashMap<>();
            for (Map.Entry<String, Dataset<Object>> e : inputs.entrySet()) {
                if (e.getValue() instanceof FakeDatasetInput<Object> in) {
                    Long before = countsBefore.get(e.getKey());
                    if (before != null && in.consumedCount() > before) {
                        consumed.put(e.getKey(), in.lastConsumed());
                    }
                }
            }

            Map<String, Object> produced = new LinkedHashMap<>();
            for (Map.Entry<String, Dataset<Object>> e : outputs.entrySet()) {
                if (e.getValue() instanceof FakeDatasetOutput<Object> out && out.last() != null) {
                    produced.put(e.getKey(), out.last());
                }
            }

            return new TestIteration(Collections.unmodifiableMap(consumed), Collections.unmodifiableMap(produced), Node.this);
        }

        private boolean budgetReached() {
            if (runtime != null && System.nanoTime() - startNanos >= runtime.toNanos()) {
                return true;
            }
            return inputsExhausted();
        }

        private boolean inputsExhausted() {
            if (inputs.isEmpty()) {
                return false;
            }
            for (Dataset<Object> ds : inputs.values()) {
                if (!(ds instanceof FakeDatasetInput<Object> in) || !in.isEmpty()) {
                    return false;
                }
            }
            return true;
        }

        void finish() throws Exception {
            task.postLoop(Node.this, params);
        }
    }

    private final class TestIterator implements Iterator<TestIteration> {
        private final TestLoop loop;
        private boolean started;
        private boolean finished;
        private TestIteration next;

        TestIterator(TestLoop loop) {
            this.loop = loop;
        }

        @Override
        public boolean hasNext() {
            if (next != null) return true;
            if (finished) return false;
            try {
                if (!started) {
                    started = true;
                    loop.start();
                }
                if (loop.ended) {
                    finished = true;
                    loop.finish();
                    return false;
                }
                next = loop.iterate();
                return true;
            } catch (RuntimeException e) {
                finished = true;
                throw e;
            } catch (Exception e) {
                finished = true;
                throw new NodeExecutionException(name, e);
            }
        }

        @Override
        public TestIteration next() {
            if (!hasNext()) {
                throw new NoSuchElementException("Test run of node '" + name + "' has ended");
            }
            TestIteration current = next;
            next = null;
            return current;
        }
    }

    // --- State ---

    public boolean isTestMode() {
        return testMode;
    }

    public Instant lastHeartbeat() {
        return lastHeartbeat;
    }

    public Map<String, Object> parameters() {
        return parameters;
    }

    public NodeTask task() {
        return task;
    }

    public PoisonPill poisonPill() {
        return poisonPill;
    }

    /**
     * Closes every dataset handle. Remote storage is left untouched.
     */
    public void close() {
        for (Dataset<Object> ds : inputs.values()) closeQuietly(ds);
        for (Dataset<Object> ds : outputs.values()) closeQuietly(ds);
    }

    private void closeQuietly(Dataset<Object> ds) {
        try {
            ds.close();
        } catch (Exception e) {
            log.warn("Error closing dataset '{}' of node '{}'", ds.name(), name, e);
        }
    }

    @Override
    public String toString() {
        return "Node{name='" + name + "', pipeline='" + pipelineName + "', testMode=" + testMode + '}';
    }

    public static final class Builder {
        private final NodeTask task;
        private String name;
        private String pipelineName;
        private PoisonPill poisonPill;
        private DatasetFactory datasetFactory;
        private PipelineConfig config;
        private MetricsRuntime metrics;
        private boolean testMode;

        private Builder(NodeTask task) {
            this.task = task;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder pipelineName(String pipelineName) {
            this.pipelineName = pipelineName;
            return this;
        }

        public Builder poisonPill(PoisonPill poisonPill) {
            this.poisonPill = poisonPill;
            return this;
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

        public Builder testMode(boolean testMode) {
            this.testMode = testMode;
            return this;
        }

        public Node build() {
            return new Node(this);
        }
    }
}
