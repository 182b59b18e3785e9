/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.kafka;

import com.intuitivedesigns.nodekernel.config.PipelineConfig;
import com.intuitivedesigns.nodekernel.dataset.AbstractDataset;
import com.intuitivedesigns.nodekernel.dataset.ConnectionParams;
import com.intuitivedesigns.nodekernel.dataset.ConnectionRole;
import com.intuitivedesigns.nodekernel.dataset.DatasetCreateStatus;
import com.intuitivedesigns.nodekernel.dataset.DatasetOptions;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.errors.InterruptException;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * {@code KAFKA} dataset: one topic on a Kafka cluster.
 *
 * <p>{@code target} is the bootstrap server list. The topic name is derived from the connection
 * parameters ({@code [<prefix>.][<pipeline>.]<dataset>}); consumers join the group
 * {@code <pipeline>.<node>}. Each message travels as a JSON envelope carrying the timestamp, the
 * dataset and the producing pipeline and node; {@link #read} returns the {@code message} field,
 * or the whole envelope when the {@code envelope} option is true.</p>
 *
 * <p>Dataset params:</p>
 * <ul>
 *   <li>{@code num_partitions} (default 1), {@code replication_factor} (default 1)</li>
 *   <li>{@code config}: topic-level configs passed to topic creation</li>
 *   <li>{@code poll_timeout_ms}: single consumer poll bound (default 100)</li>
 *   <li>{@code sync_send}: wait for the broker acknowledgement on each write (default false)</li>
 * </ul>
 */
public final class KafkaDataset extends AbstractDataset<Object> {

    private static final Logger log = LoggerFactory.getLogger(KafkaDataset.class);

    public static final String KIND = "KAFKA";

    public static final String PARAM_NUM_PARTITIONS = "num_partitions";
    public static final String PARAM_REPLICATION_FACTOR = "replication_factor";
    public static final String PARAM_CONFIG = "config";
    public static final String PARAM_POLL_TIMEOUT_MS = "poll_timeout_ms";
    public static final String PARAM_SYNC_SEND = "sync_send";

    /** Read option: return the full envelope instead of the message. */
    public static final String OPT_ENVELOPE = "envelope";

    private static final String KEY_ADMIN_PREFIX = "kafka.admin.";

    private final String bootstrapServers;
    private final int numPartitions;
    private final short replicationFactor;
    private final Map<String, String> topicConfigs;
    private final Duration pollTimeout;
    private final boolean syncSend;
    private final PipelineConfig config;
    private final KafkaClients clients;

    private final Deque<ConsumerRecord<String, String>> buffer = new ArrayDeque<>();

    private ConnectionParams connection;
    private String topic;
    private Producer<String, String> producer;
    private Consumer<String, String> consumer;

    public KafkaDataset(String name,
                        String bootstrapServers,
                        Map<String, Object> params,
                        PipelineConfig config,
                        KafkaClients clients) {
        super(name);
        this.bootstrapServers = Objects.requireNonNull(bootstrapServers, "bootstrapServers");
        final Map<String, Object> p = (params == null) ? Map.of() : params;
        this.numPartitions = intParam(p, PARAM_NUM_PARTITIONS, 1);
        this.replicationFactor = (short) intParam(p, PARAM_REPLICATION_FACTOR, 1);
        this.topicConfigs = stringMap(p.get(PARAM_CONFIG));
        this.pollTimeout = Duration.ofMillis(intParam(p, PARAM_POLL_TIMEOUT_MS, 100));
        this.syncSend = Boolean.parseBoolean(String.valueOf(p.getOrDefault(PARAM_SYNC_SEND, "false")).trim());
        this.config = Objects.requireNonNull(config, "config");
        this.clients = Objects.requireNonNull(clients, "clients");
        this.topic = name;
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public boolean connectionRequired() {
        return true;
    }

    /**
     * Topic this handle is bound to; the bare dataset name until a connection or an explicit
     * naming option says otherwise.
     */
    public synchronized String topic() {
        return topic;
    }

    // --- Connection ---

    @Override
    protected synchronized void doInitialize(DatasetOptions options) {
        closeClients();
        final ConnectionParams params = ConnectionParams.fromOptions(options);
        this.connection = params;
        this.topic = params.qualifiedName();

        final Properties props = new Properties();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);

        if (params.role() == ConnectionRole.CONSUMER) {
            props.put(ConsumerConfig.GROUP_ID_CONFIG, params.pipelineName() + "." + params.nodeName());
            props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
            props.putAll(params.backendConfig());
            props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
            props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
            this.consumer = clients.consumer(props);
            consumer.subscribe(List.of(topic));
            log.info("Kafka consumer ready. dataset='{}' topic='{}' group='{}'",
                    name, topic, props.get(ConsumerConfig.GROUP_ID_CONFIG));
        } else {
            props.putAll(params.backendConfig());
            props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
            props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
            this.producer = clients.producer(props);
            log.info("Kafka producer ready. dataset='{}' topic='{}' sync={}", name, topic, syncSend);
        }
    }

    // --- Data ---

    @Override
    protected synchronized void doWrite(Object value, DatasetOptions options) throws Exception {
        if (producer == null) {
            throw new IllegalStateException("Dataset '" + name + "' is not connected as a producer");
        }
        final String json = KafkaMessageCodec.encode(Instant.now(), name,
                connection.pipelineName(), connection.nodeName(), value);
        final ProducerRecord<String, String> record = new ProducerRecord<>(topic, json);

        if (syncSend) {
            try {
                producer.send(record).get();
            } catch (ExecutionException e) {
                // surface the broker failure itself as the DatasetError cause
                if (e.getCause() instanceof Exception cause) {
                    throw cause;
                }
                throw e;
            }
            return;
        }
        producer.send(record, (metadata, exception) -> {
            if (exception != null) {
                log.error("Kafka write failed. dataset='{}' topic='{}': {}", name, topic, exception.getMessage());
            }
        });
    }

    @Override
    protected synchronized Object doRead(DatasetOptions options) throws Exception {
        if (consumer == null) {
            throw new IllegalStateException("Dataset '" + name + "' is not connected as a consumer");
        }
        final String how = options.getString(DatasetOptions.HOW, "next");
        final ConsumerRecord<String, String> record;
        switch (how) {
            case "next":
                record = next(options);
                break;
            case "last":
                record = last(options);
                break;
            default:
                throw new IllegalArgumentException("Unsupported read mode how=" + how + " (expected next or last)");
        }
        if (record == null) {
            return null;
        }

        final Map<String, Object> envelope = KafkaMessageCodec.decode(record.value());
        return options.getBoolean(OPT_ENVELOPE, false) ? envelope : envelope.get(KafkaMessageCodec.MESSAGE);
    }

    private ConsumerRecord<String, String> next(DatasetOptions options) {
        if (buffer.isEmpty()) {
            fill(options);
        }
        return buffer.pollFirst();
    }

    private ConsumerRecord<String, String> last(DatasetOptions options) {
        if (buffer.isEmpty()) {
            fill(options);
        }
        // Drain whatever else is already available so the newest record wins
        if (!buffer.isEmpty()) {
            int polled;
            do {
                polled = poll(Duration.ZERO);
            } while (polled > 0);
        }
        final ConsumerRecord<String, String> newest = buffer.peekLast();
        buffer.clear();
        return newest;
    }

    /**
     * Polls once, or until something arrives when the read is blocking.
     */
    private void fill(DatasetOptions options) {
        if (!options.getBoolean(DatasetOptions.BLOCK, false)) {
            poll(pollTimeout);
            return;
        }
        final Duration timeout = options.getDuration(DatasetOptions.TIMEOUT_MS, null);
        final long deadline = (timeout == null) ? Long.MAX_VALUE : System.nanoTime() + timeout.toNanos();
        while (buffer.isEmpty() && !Thread.currentThread().isInterrupted()) {
            final long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return;
            }
            poll(Duration.ofNanos(Math.min(remaining, pollTimeout.toNanos())));
        }
    }

    private int poll(Duration timeout) {
        final ConsumerRecords<String, String> records;
        try {
            records = consumer.poll(timeout);
        } catch (InterruptException e) {
            // Kafka clears the flag when it throws; the node loop relies on it
            Thread.currentThread().interrupt();
            log.debug("Poll on '{}' interrupted", topic);
            return 0;
        }
        for (ConsumerRecord<String, String> record : records) {
            buffer.addLast(record);
        }
        return records.count();
    }

    // --- Topic management ---

    @Override
    protected synchronized DatasetCreateStatus doCreate(DatasetOptions options) throws Exception {
        final String target = resolveTopic(options);
        try (TopicAdmin admin = clients.admin(adminProps())) {
            if (admin.listTopics().contains(target)) {
                log.info("Topic '{}' already exists, skipping creation", target);
                return DatasetCreateStatus.completed(name);
            }
            final NewTopic newTopic = new NewTopic(target, numPartitions, replicationFactor).configs(topicConfigs);
            final Future<Void> created = admin.createTopic(newTopic);
            log.info("Creating topic '{}' (partitions={}, replication={})", target, numPartitions, replicationFactor);
            return DatasetCreateStatus.ofTopics(name, Map.of(target, created));
        }
    }

    @Override
    protected synchronized boolean doExists(DatasetOptions options) throws Exception {
        final String target = resolveTopic(options);
        try (TopicAdmin admin = clients.admin(adminProps())) {
            return admin.listTopics().contains(target);
        }
    }

    @Override
    protected synchronized void doDelete() throws Exception {
        try (TopicAdmin admin = clients.admin(adminProps())) {
            admin.deleteTopic(topic);
            log.info("Deleted topic '{}'", topic);
        }
    }

    @Override
    protected synchronized String doDescribe(DatasetOptions options) {
        return "Kafka dataset '" + name + "' topic='" + topic + "' bootstrap='" + bootstrapServers
                + "' partitions=" + numPartitions + " replication=" + replicationFactor;
    }

    /**
     * Options may carry {@code pipeline_name}, {@code prefix} and {@code has_pipeline_prefix} to
     * name the topic before a connection exists; otherwise the bound topic is used.
     */
    private String resolveTopic(DatasetOptions options) {
        final String pipeline = options.getString(ConnectionParams.KEY_PIPELINE_NAME, null);
        final String prefix = options.getString(ConnectionParams.KEY_PREFIX, null);
        if (pipeline != null || prefix != null) {
            final boolean withPipeline = pipeline != null && options.getBoolean(ConnectionParams.KEY_HAS_PIPELINE_PREFIX, false);
            String resolved = withPipeline ? pipeline + "." + name : name;
            resolved = (prefix != null && !prefix.isBlank()) ? prefix.trim() + "." + resolved : resolved;
            this.topic = resolved;
        }
        return topic;
    }

    private Properties adminProps() {
        final Properties props = new Properties();
        props.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.putAll(config.subset(KEY_ADMIN_PREFIX));
        return props;
    }

    // --- Lifecycle ---

    @Override
    public synchronized void close() {
        closeClients();
    }

    private void closeClients() {
        if (consumer != null) {
            try {
                consumer.close(Duration.ofSeconds(5));
            } catch (Exception e) {
                log.warn("Error closing consumer of '{}'", name, e);
            }
            consumer = null;
            buffer.clear();
        }
        if (producer != null) {
            try {
                producer.flush();
                producer.close(Duration.ofSeconds(5));
            } catch (Exception e) {
                log.warn("Error closing producer of '{}'", name, e);
            }
            producer = null;
        }
    }

    // --- Helpers ---

    private int intParam(Map<String, Object> params, String key, int def) {
        final Object raw = params.get(key);
        if (raw == null) return def;
        if (raw instanceof Number n) return n.intValue();
        try {
            return Integer.parseInt(raw.toString().trim());
        } catch (NumberFormatException e) {
            log.warn("Dataset '{}': invalid {}='{}', using {}", name, key, raw, def);
            return def;
        }
    }

    private static Map<String, String> stringMap(Object raw) {
        final Map<String, String> out = new LinkedHashMap<>();
        if (raw instanceof Map<?, ?> map) {
            map.forEach((k, v) -> out.put(String.valueOf(k), String.valueOf(v)));
        }
        return out;
    }
}
