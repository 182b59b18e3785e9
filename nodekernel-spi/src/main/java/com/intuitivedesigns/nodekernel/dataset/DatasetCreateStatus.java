/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.dataset;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Future;

/**
 * Completion status of one or more pending provisioning operations for a dataset.
 *
 * <p>Either remote storage creation (one future per topic) or connection setup (one future per
 * producer/consumer). Callers poll {@link #done()} to learn when a batch has finished.</p>
 */
public final class DatasetCreateStatus {

    private final String datasetName;
    private final Map<String, Future<?>> topicFutures;
    private final List<Future<?>> statuses;

    public DatasetCreateStatus(String datasetName,
                               Map<String, ? extends Future<?>> topicFutures,
                               List<? extends Future<?>> statuses) {
        this.datasetName = Objects.requireNonNull(datasetName, "datasetName");
        this.topicFutures = (topicFutures == null)
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(topicFutures));
        this.statuses = (statuses == null) ? List.of() : List.copyOf(statuses);
    }

    public static DatasetCreateStatus completed(String datasetName) {
        return new DatasetCreateStatus(datasetName, null, null);
    }

    public static DatasetCreateStatus ofTopics(String datasetName, Map<String, ? extends Future<?>> topicFutures) {
        return new DatasetCreateStatus(datasetName, topicFutures, null);
    }

    public static DatasetCreateStatus ofStatuses(String datasetName, List<? extends Future<?>> statuses) {
        return new DatasetCreateStatus(datasetName, null, statuses);
    }

    /**
     * @return true when nothing is tracked, or every tracked operation has completed
     *         (successfully or not).
     */
    public boolean done() {
        for (Future<?> f : topicFutures.values()) {
            if (!f.isDone()) return false;
        }
        for (Future<?> f : statuses) {
            if (!f.isDone()) return false;
        }
        return true;
    }

    public String datasetName() {
        return datasetName;
    }

    public Map<String, Future<?>> topicFutures() {
        return topicFutures;
    }

    public List<Future<?>> statuses() {
        return statuses;
    }

    @Override
    public String toString() {
        return "DatasetCreateStatus{dataset=" + datasetName
                + ", topics=" + topicFutures.keySet()
                + ", statuses=" + statuses.size()
                + ", done=" + done() + '}';
    }
}
