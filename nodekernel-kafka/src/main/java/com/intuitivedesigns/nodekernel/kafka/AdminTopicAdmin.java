/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.kafka;

import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.NewTopic;

import java.time.Duration;
import java.util.List;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * {@link TopicAdmin} backed by the Kafka {@link Admin} client.
 */
final class AdminTopicAdmin implements TopicAdmin {

    private static final long REQUEST_TIMEOUT_SECONDS = 30;

    private final Admin admin;

    AdminTopicAdmin(Properties props) {
        this.admin = Admin.create(props);
    }

    @Override
    public Set<String> listTopics() throws Exception {
        return admin.listTopics().names().get(REQUEST_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    @Override
    public Future<Void> createTopic(NewTopic topic) {
        return admin.createTopics(List.of(topic)).values().get(topic.name());
    }

    @Override
    public void deleteTopic(String topic) throws Exception {
        admin.deleteTopics(List.of(topic)).all().get(REQUEST_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    @Override
    public void close() {
        // Waits for in-flight requests, so create futures are settled afterwards
        admin.close(Duration.ofSeconds(REQUEST_TIMEOUT_SECONDS));
    }
}
