/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.memory;

import com.intuitivedesigns.nodekernel.dataset.AbstractAsyncDataset;
import com.intuitivedesigns.nodekernel.dataset.DatasetCreateStatus;
import com.intuitivedesigns.nodekernel.dataset.DatasetOptions;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Non-blocking {@code MEMORY} dataset. Shares topics and read semantics with
 * {@link MemoryDataset}; blocking reads run on a small daemon pool so callers never wait.
 */
public final class MemoryAsyncDataset extends AbstractAsyncDataset<Object> {

    private static final AtomicInteger THREAD_IDS = new AtomicInteger();

    private static final ExecutorService BLOCKING_READS = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "nk-memory-read-" + THREAD_IDS.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    private final MemoryDataset delegate;

    public MemoryAsyncDataset(String name, String topicName, int maxMessages, MemoryTopicStore store) {
        super(name);
        this.delegate = new MemoryDataset(name, topicName, maxMessages, Objects.requireNonNull(store, "store"));
    }

    @Override
    public String kind() {
        return MemoryDataset.KIND;
    }

    public String topicName() {
        return delegate.topicName();
    }

    @Override
    protected CompletionStage<Object> doRead(DatasetOptions options) {
        if (options.getBoolean(DatasetOptions.BLOCK, false)) {
            return CompletableFuture.supplyAsync(() -> delegate.read(options), BLOCKING_READS);
        }
        return CompletableFuture.completedFuture(delegate.read(options));
    }

    @Override
    protected CompletionStage<Void> doWrite(Object value, DatasetOptions options) {
        delegate.write(value, options);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    protected CompletionStage<DatasetCreateStatus> doCreate(DatasetOptions options) {
        return CompletableFuture.completedFuture(delegate.create(options));
    }

    @Override
    protected CompletionStage<Void> doDelete() {
        delegate.delete();
        return CompletableFuture.completedFuture(null);
    }

    @Override
    protected CompletionStage<Void> doInitialize(DatasetOptions options) {
        return CompletableFuture.completedFuture(null);
    }

    @Override
    protected CompletionStage<Boolean> doExists(DatasetOptions options) {
        return CompletableFuture.completedFuture(delegate.exists(options));
    }

    @Override
    protected CompletionStage<String> doDescribe(DatasetOptions options) {
        return CompletableFuture.completedFuture(delegate.describe(options));
    }
}
