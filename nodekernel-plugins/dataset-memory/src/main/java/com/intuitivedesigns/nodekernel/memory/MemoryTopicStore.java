/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-wide registry of {@link MemoryTopic}s, keyed by topic name.
 *
 * <p>Every {@code MEMORY} dataset built by the plugin shares {@link #shared()}, so nodes running
 * in the same JVM exchange messages through it. Tests can build isolated stores.</p>
 */
public final class MemoryTopicStore {

    private static final Logger log = LoggerFactory.getLogger(MemoryTopicStore.class);

    private static final MemoryTopicStore SHARED = new MemoryTopicStore();

    private final ConcurrentMap<String, MemoryTopic> topics = new ConcurrentHashMap<>();

    public static MemoryTopicStore shared() {
        return SHARED;
    }

    /**
     * @return true if the topic was created, false if it already existed
     */
    public boolean create(String name, int maxMessages) {
        boolean[] created = {false};
        topics.computeIfAbsent(name, n -> {
            created[0] = true;
            return new MemoryTopic(n, maxMessages);
        });
        if (created[0]) {
            log.debug("Created memory topic '{}' (maxMessages={})", name, maxMessages);
        }
        return created[0];
    }

    /**
     * Existing topic, or a new unbounded one.
     */
    public MemoryTopic getOrCreate(String name) {
        return topics.computeIfAbsent(name, n -> new MemoryTopic(n, 0));
    }

    public Optional<MemoryTopic> find(String name) {
        return Optional.ofNullable(topics.get(name));
    }

    public boolean exists(String name) {
        return topics.containsKey(name);
    }

    public boolean delete(String name) {
        boolean removed = topics.remove(name) != null;
        if (removed) {
            log.debug("Deleted memory topic '{}'", name);
        }
        return removed;
    }

    public Set<String> topicNames() {
        return new TreeSet<>(topics.keySet());
    }

    public void clear() {
        topics.clear();
    }
}
