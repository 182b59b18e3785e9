/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.testing;

import com.intuitivedesigns.nodekernel.dataset.AbstractDataset;
import com.intuitivedesigns.nodekernel.dataset.DatasetCreateStatus;
import com.intuitivedesigns.nodekernel.dataset.DatasetOptions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * In-memory output double that records every written value in order.
 */
public final class FakeDatasetOutput<T> extends AbstractDataset<T> {

    public static final String KIND = "FAKE_OUTPUT";

    private final String nodeName;
    private final List<T> values = new ArrayList<>();

    public FakeDatasetOutput(String name, String nodeName) {
        super(name);
        this.nodeName = nodeName;
    }

    @Override
    public String kind() {
        return KIND;
    }

    public List<T> values() {
        return Collections.unmodifiableList(values);
    }

    public T last() {
        return values.isEmpty() ? null : values.get(values.size() - 1);
    }

    @Override
    protected T doRead(DatasetOptions options) {
        throw new UnsupportedOperationException("Output double '" + name + "' is write-only");
    }

    @Override
    protected void doWrite(T value, DatasetOptions options) {
        values.add(value);
    }

    @Override
    protected DatasetCreateStatus doCreate(DatasetOptions options) {
        return DatasetCreateStatus.completed(name);
    }

    @Override
    protected void doDelete() {
        values.clear();
    }

    @Override
    protected void doInitialize(DatasetOptions options) {
        // nothing to connect
    }

    @Override
    protected boolean doExists(DatasetOptions options) {
        return true;
    }

    @Override
    protected String doDescribe(DatasetOptions options) {
        return "Fake output '" + name + "' for node '" + nodeName + "', written=" + values.size();
    }
}
