/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.dataset;

import java.util.concurrent.CompletableFuture;

/**
 * Non-blocking counterpart of {@link Dataset}.
 *
 * <p>Same operation names and semantics, but every operation returns immediately with a future.
 * Failures complete the future exceptionally with a {@link DatasetError}. Deliberately not a
 * sub- or super-type of {@link Dataset}.</p>
 *
 * @param <T> type of the values read from and written to the stream
 */
public interface AsyncDataset<T> extends AutoCloseable {

    String name();

    String kind();

    default boolean connectionRequired() {
        return false;
    }

    CompletableFuture<T> read(DatasetOptions options);

    default CompletableFuture<T> read() {
        return read(DatasetOptions.empty());
    }

    CompletableFuture<Void> write(T value, DatasetOptions options);

    default CompletableFuture<Void> write(T value) {
        return write(value, DatasetOptions.empty());
    }

    CompletableFuture<DatasetCreateStatus> create(DatasetOptions options);

    default CompletableFuture<DatasetCreateStatus> create() {
        return create(DatasetOptions.empty());
    }

    CompletableFuture<Void> delete();

    CompletableFuture<Void> initialize(DatasetOptions options);

    default CompletableFuture<Void> initialize() {
        return initialize(DatasetOptions.empty());
    }

    CompletableFuture<Boolean> exists(DatasetOptions options);

    default CompletableFuture<Boolean> exists() {
        return exists(DatasetOptions.empty());
    }

    CompletableFuture<String> describe(DatasetOptions options);

    default CompletableFuture<String> describe() {
        return describe(DatasetOptions.empty());
    }

    @Override
    default void close() {
        // no-op by default
    }
}
