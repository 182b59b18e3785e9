/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.dataset;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

/**
 * Base class for non-blocking datasets.
 *
 * <p>Hooks return a {@link CompletionStage}. Both a synchronous throw from the hook and an
 * exceptional completion of the returned stage are translated the same way as in
 * {@link AbstractDataset}: {@link DatasetError} passes through, anything else is wrapped.
 * Callers therefore only ever see a future failed with a {@code DatasetError}.</p>
 *
 * @param <T> value type
 */
public abstract class AbstractAsyncDataset<T> implements AsyncDataset<T> {

    protected final String name;

    private volatile boolean initialized;

    protected AbstractAsyncDataset(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public final String name() {
        return name;
    }

    public final boolean isInitialized() {
        return initialized;
    }

    @Override
    public final CompletableFuture<T> read(DatasetOptions options) {
        if (notReady()) return notInitialized("read");
        return call("read", () -> doRead(orEmpty(options)));
    }

    @Override
    public final CompletableFuture<Void> write(T value, DatasetOptions options) {
        if (notReady()) return notInitialized("write");
        return call("write", () -> doWrite(value, orEmpty(options)));
    }

    @Override
    public final CompletableFuture<DatasetCreateStatus> create(DatasetOptions options) {
        return call("create", () -> doCreate(orEmpty(options)))
                .thenApply(status -> (status != null) ? status : DatasetCreateStatus.completed(name));
    }

    @Override
    public final CompletableFuture<Void> delete() {
        return call("delete", this::doDelete);
    }

    @Override
    public final CompletableFuture<Void> initialize(DatasetOptions options) {
        return call("initialize", () -> doInitialize(orEmpty(options)))
                .thenRun(() -> initialized = true);
    }

    @Override
    public final CompletableFuture<Boolean> exists(DatasetOptions options) {
        return call("exists", () -> doExists(orEmpty(options)))
                .thenApply(Boolean.TRUE::equals);
    }

    @Override
    public final CompletableFuture<String> describe(DatasetOptions options) {
        return call("describe", () -> doDescribe(orEmpty(options)));
    }

    // --- Backend hooks ---

    protected abstract CompletionStage<T> doRead(DatasetOptions options) throws Exception;

    protected abstract CompletionStage<Void> doWrite(T value, DatasetOptions options) throws Exception;

    protected abstract CompletionStage<DatasetCreateStatus> doCreate(DatasetOptions options) throws Exception;

    protected abstract CompletionStage<Void> doDelete() throws Exception;

    protected abstract CompletionStage<Void> doInitialize(DatasetOptions options) throws Exception;

    protected abstract CompletionStage<Boolean> doExists(DatasetOptions options) throws Exception;

    protected CompletionStage<String> doDescribe(DatasetOptions options) throws Exception {
        return CompletableFuture.completedFuture("Dataset name: " + name + ", kind: " + kind());
    }

    // --- Helpers ---

    @FunctionalInterface
    private interface AsyncBackendCall<R> {
        CompletionStage<R> run() throws Exception;
    }

    private <R> CompletableFuture<R> call(String operation, AsyncBackendCall<R> body) {
        final CompletionStage<R> stage;
        try {
            stage = body.run();
        } catch (Exception e) {
            return CompletableFuture.failedFuture(translate(operation, e));
        }
        if (stage == null) {
            return CompletableFuture.completedFuture(null);
        }

        CompletableFuture<R> result = new CompletableFuture<>();
        stage.whenComplete((value, error) -> {
            if (error == null) {
                result.complete(value);
            } else {
                result.completeExceptionally(translate(operation, error));
            }
        });
        return result;
    }

    private DatasetError translate(String operation, Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof DatasetError de) {
            return de;
        }
        return new DatasetError(name, AbstractDataset.failureMessage(operation, name), cause);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    private boolean notReady() {
        return connectionRequired() && !initialized;
    }

    private <R> CompletableFuture<R> notInitialized(String operation) {
        return CompletableFuture.failedFuture(new DatasetError(name,
                "Cannot " + operation + " dataset " + name + " before initialize() has been called."));
    }

    private static DatasetOptions orEmpty(DatasetOptions options) {
        return (options == null) ? DatasetOptions.empty() : options;
    }
}
