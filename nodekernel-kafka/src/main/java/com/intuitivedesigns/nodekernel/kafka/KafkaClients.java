/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.kafka;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;

import java.util.Properties;

/**
 * Creates the Kafka clients a {@link KafkaDataset} uses. Tests substitute mock clients.
 */
public interface KafkaClients {

    Producer<String, String> producer(Properties props);

    Consumer<String, String> consumer(Properties props);

    TopicAdmin admin(Properties props);

    static KafkaClients defaults() {
        return new KafkaClients() {
            @Override
            public Producer<String, String> producer(Properties props) {
                return new KafkaProducer<>(props);
            }

            @Override
            public Consumer<String, String> consumer(Properties props) {
                return new KafkaConsumer<>(props);
            }

            @Override
            public TopicAdmin admin(Properties props) {
                return new AdminTopicAdmin(props);
            }
        };
    }
}
