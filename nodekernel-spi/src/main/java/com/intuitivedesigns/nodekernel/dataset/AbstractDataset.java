/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.dataset;

import java.util.Objects;

/**
 * Base class for blocking datasets.
 *
 * <p>Each public operation is final and delegates to a protected {@code doXxx} hook. This is the
 * single point of error translation: a {@link DatasetError} thrown by the hook propagates
 * unchanged, any other exception is wrapped into a {@link DatasetError} naming this dataset.</p>
 *
 * <pre>{@code
 * public final class MyDataset extends AbstractDataset<String> {
 *     protected String doRead(DatasetOptions options) { ... }
 *     protected void doWrite(String value, DatasetOptions options) { ... }
 *     ...
 * }
 * }</pre>
 *
 * @param <T> value type
 */
public abstract class AbstractDataset<T> implements Dataset<T> {

    protected final String name;

    private volatile boolean initialized;

    protected AbstractDataset(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public final String name() {
        return name;
    }

    public final boolean isInitialized() {
        return initialized;
    }

    // --- Public wrappers ---

    @Override
    public final T read(DatasetOptions options) {
        return call("read", () -> {
            requireInitialized("read");
            return doRead(orEmpty(options));
        });
    }

    @Override
    public final void write(T value, DatasetOptions options) {
        call("write", () -> {
            requireInitialized("write");
            doWrite(value, orEmpty(options));
            return null;
        });
    }

    @Override
    public final DatasetCreateStatus create(DatasetOptions options) {
        DatasetCreateStatus status = call("create", () -> doCreate(orEmpty(options)));
        return (status != null) ? status : DatasetCreateStatus.completed(name);
    }

    @Override
    public final void delete() {
        call("delete", () -> {
            doDelete();
            return null;
        });
    }

    @Override
    public final void initialize(DatasetOptions options) {
        call("initialize", () -> {
            doInitialize(orEmpty(options));
            return null;
        });
        initialized = true;
    }

    @Override
    public final boolean exists(DatasetOptions options) {
        return Boolean.TRUE.equals(call("exists", () -> doExists(orEmpty(options))));
    }

    @Override
    public final String describe(DatasetOptions options) {
        return call("describe", () -> doDescribe(orEmpty(options)));
    }

    // --- Backend hooks ---

    protected abstract T doRead(DatasetOptions options) throws Exception;

    protected abstract void doWrite(T value, DatasetOptions options) throws Exception;

    protected abstract DatasetCreateStatus doCreate(DatasetOptions options) throws Exception;

    protected abstract void doDelete() throws Exception;

    protected abstract void doInitialize(DatasetOptions options) throws Exception;

    protected abstract boolean doExists(DatasetOptions options) throws Exception;

    protected String doDescribe(DatasetOptions options) throws Exception {
        return "Dataset name: " + name + ", kind: " + kind();
    }

    // --- Helpers ---

    @FunctionalInterface
    private interface BackendCall<R> {
        R run() throws Exception;
    }

    private <R> R call(String operation, BackendCall<R> body) {
        try {
            return body.run();
        } catch (DatasetError e) {
            throw e;
        } catch (Exception e) {
            throw new DatasetError(name, failureMessage(operation, name), e);
        }
    }

    private void requireInitialized(String operation) {
        if (connectionRequired() && !initialized) {
            throw new DatasetError(name,
                    "Cannot " + operation + " dataset " + name + " before initialize() has been called.");
        }
    }

    static String failureMessage(String operation, String datasetName) {
        if ("exists".equals(operation)) {
            return "Failed to check if dataset " + datasetName + " exists.";
        }
        return "Failed to " + operation + " dataset " + datasetName + ".";
    }

    private static DatasetOptions orEmpty(DatasetOptions options) {
        return (options == null) ? DatasetOptions.empty() : options;
    }
}
