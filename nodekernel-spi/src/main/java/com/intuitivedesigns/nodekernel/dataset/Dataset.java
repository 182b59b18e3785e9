/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.dataset;

/**
 * A named data stream with a uniform, blocking lifecycle contract.
 *
 * <p><b>Contract:</b></p>
 * <ul>
 * <li>Every operation fails only with {@link DatasetError}, naming this dataset and wrapping the
 * backend's original exception.</li>
 * <li>Datasets reporting {@link #connectionRequired()} must be {@link #initialize(DatasetOptions)
 * initialized} before the first read or write.</li>
 * <li>A handle belongs to exactly one node; implementations need not be thread-safe.</li>
 * </ul>
 *
 * <p>The non-blocking counterpart is {@link AsyncDataset}; the two hierarchies share no
 * operations.</p>
 *
 * @param <T> type of the values read from and written to the stream
 */
public interface Dataset<T> extends AutoCloseable {

    String name();

    /**
     * Backend discriminator, equal to the registry id the dataset was built from (e.g. "KAFKA").
     */
    String kind();

    /**
     * @return true if {@link #initialize(DatasetOptions)} must be called with
     *         {@link ConnectionParams} before reading or writing.
     */
    default boolean connectionRequired() {
        return false;
    }

    /**
     * Fetches a value. Whether this blocks, and what an empty stream returns, is backend-defined;
     * the bundled backends return {@code null} when nothing is available.
     */
    T read(DatasetOptions options);

    default T read() {
        return read(DatasetOptions.empty());
    }

    void write(T value, DatasetOptions options);

    default void write(T value) {
        write(value, DatasetOptions.empty());
    }

    /**
     * Provisions backing storage. Safe to call when the storage already exists.
     */
    DatasetCreateStatus create(DatasetOptions options);

    default DatasetCreateStatus create() {
        return create(DatasetOptions.empty());
    }

    void delete();

    /**
     * Establishes live connections (producer/consumer sessions).
     */
    void initialize(DatasetOptions options);

    default void initialize() {
        initialize(DatasetOptions.empty());
    }

    boolean exists(DatasetOptions options);

    default boolean exists() {
        return exists(DatasetOptions.empty());
    }

    /**
     * Human-readable metadata dump.
     */
    String describe(DatasetOptions options);

    default String describe() {
        return describe(DatasetOptions.empty());
    }

    /**
     * Releases connections. Backing storage is left untouched.
     */
    @Override
    default void close() {
        // no-op by default for connection-less datasets
    }
}
