/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.memory;

import com.intuitivedesigns.nodekernel.dataset.AbstractDataset;
import com.intuitivedesigns.nodekernel.dataset.DatasetCreateStatus;
import com.intuitivedesigns.nodekernel.dataset.DatasetOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * {@code MEMORY} dataset: a handle on one {@link MemoryTopic}.
 *
 * <p>Writes append to the topic. Each handle keeps its own read cursor, so two nodes reading
 * the same topic each see every message. Read options:</p>
 * <ul>
 *   <li>{@code how}: {@code next} (oldest unread, default) or {@code last} (newest, skipping
 *   anything older)</li>
 *   <li>{@code block}: wait for a message when nothing is unread</li>
 *   <li>{@code timeout_ms}: upper bound on that wait; absent means wait until interrupted</li>
 * </ul>
 * <p>A read with nothing to return gives {@code null}. An interrupted blocking read returns
 * {@code null} with the thread's interrupt flag set.</p>
 */
public final class MemoryDataset extends AbstractDataset<Object> {

    private static final Logger log = LoggerFactory.getLogger(MemoryDataset.class);

    public static final String KIND = "MEMORY";

    private final String topicName;
    private final int maxMessages;
    private final MemoryTopicStore store;

    // Guarded by this
    private MemoryTopic boundTopic;
    private long cursor;

    public MemoryDataset(String name, String topicName, int maxMessages, MemoryTopicStore store) {
        super(name);
        this.topicName = (topicName == null || topicName.isBlank()) ? name : topicName.trim();
        this.maxMessages = maxMessages;
        this.store = Objects.requireNonNull(store, "store");
    }

    @Override
    public String kind() {
        return KIND;
    }

    public String topicName() {
        return topicName;
    }

    /**
     * Offset of the next message {@code how=next} would return.
     */
    public synchronized long position() {
        return cursor;
    }

    @Override
    protected Object doRead(DatasetOptions options) {
        final String how = options.getString(DatasetOptions.HOW, "next");
        if (!"next".equals(how) && !"last".equals(how)) {
            throw new IllegalArgumentException("Unsupported read mode how=" + how + " (expected next or last)");
        }

        final MemoryTopic topic;
        final long waitFrom;
        synchronized (this) {
            topic = bind();
            if (topic.endOffset() > cursor) {
                return take(topic, how);
            }
            waitFrom = cursor;
        }

        // Wait without holding the handle, other reads on it must not queue behind this one
        if (!awaitMessage(topic, waitFrom, options)) {
            return null;
        }

        synchronized (this) {
            final MemoryTopic live = bind();
            return (live.endOffset() > cursor) ? take(live, how) : null;
        }
    }

    // Caller holds this
    private Object take(MemoryTopic topic, String how) {
        final MemoryTopic.Entry entry = "last".equals(how) ? topic.last() : topic.get(cursor);
        if (entry == null) {
            return null;
        }
        cursor = entry.offset() + 1;
        return entry.value();
    }

    private boolean awaitMessage(MemoryTopic topic, long offset, DatasetOptions options) {
        if (!options.getBoolean(DatasetOptions.BLOCK, false)) {
            return false;
        }
        Duration timeout = options.getDuration(DatasetOptions.TIMEOUT_MS, null);
        try {
            return topic.awaitOffset(offset, (timeout == null) ? -1L : timeout.toNanos());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Blocking read on '{}' interrupted", name);
            return false;
        }
    }

    /**
     * Resolves the live topic, resetting the cursor if the topic was deleted and recreated.
     */
    private MemoryTopic bind() {
        MemoryTopic live = store.getOrCreate(topicName);
        if (live != boundTopic) {
            boundTopic = live;
            cursor = live.firstOffset();
        }
        return live;
    }

    @Override
    protected void doWrite(Object value, DatasetOptions options) {
        Objects.requireNonNull(value, "value");
        store.getOrCreate(topicName).append(value);
    }

    @Override
    protected DatasetCreateStatus doCreate(DatasetOptions options) {
        if (!store.create(topicName, maxMessages)) {
            log.debug("Memory topic '{}' already exists, nothing to create", topicName);
        }
        return DatasetCreateStatus.completed(name);
    }

    @Override
    protected void doDelete() {
        store.delete(topicName);
    }

    @Override
    protected void doInitialize(DatasetOptions options) {
        // in-process, nothing to connect
    }

    @Override
    protected boolean doExists(DatasetOptions options) {
        return store.exists(topicName);
    }

    @Override
    protected String doDescribe(DatasetOptions options) {
        int size = store.find(topicName).map(MemoryTopic::size).orElse(0);
        return "Memory dataset '" + name + "' on topic '" + topicName + "' (" + size + " messages)";
    }
}
