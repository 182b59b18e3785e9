/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.kafka;

import org.apache.kafka.clients.admin.NewTopic;

import java.util.Set;
import java.util.concurrent.Future;

/**
 * The topic-management calls {@link KafkaDataset} makes against the cluster.
 */
public interface TopicAdmin extends AutoCloseable {

    Set<String> listTopics() throws Exception;

    /**
     * Requests creation; the returned future completes when the broker has acknowledged it.
     */
    Future<Void> createTopic(NewTopic topic);

    void deleteTopic(String topic) throws Exception;

    @Override
    void close();
}
