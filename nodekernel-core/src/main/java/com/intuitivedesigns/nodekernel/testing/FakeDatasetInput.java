/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.testing;

import com.intuitivedesigns.nodekernel.dataset.AbstractDataset;
import com.intuitivedesigns.nodekernel.dataset.DatasetCreateStatus;
import com.intuitivedesigns.nodekernel.dataset.DatasetOptions;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * In-memory input double fed from a fixed sequence of values.
 *
 * <p>Reading an exhausted input never fails: it returns {@code null}, so a step can keep polling
 * while the test driver decides when to stop. Supports {@code how=next} (default) and
 * {@code how=last}, which drains the queue and returns its final value.</p>
 */
public final class FakeDatasetInput<T> extends AbstractDataset<T> {

    public static final String KIND = "FAKE_INPUT";

    private final String nodeName;
    private final Deque<T> values;

    private T lastConsumed;
    private long consumedCount;

    public FakeDatasetInput(String name, String nodeName, Collection<? extends T> values) {
        super(name);
        this.nodeName = nodeName;
        Objects.requireNonNull(values, "values");
        this.values = new ArrayDeque<>(values.size());
        for (T v : values) {
            if (v == null) {
                throw new IllegalArgumentException("Input double '" + name + "' does not accept null values");
            }
            this.values.addLast(v);
        }
    }

    @Override
    public String kind() {
        return KIND;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /** Values not consumed yet, in order. */
    public List<T> remaining() {
        return new ArrayList<>(values);
    }

    public T peek() {
        return values.peekFirst();
    }

    public T lastConsumed() {
        return lastConsumed;
    }

    public long consumedCount() {
        return consumedCount;
    }

    @Override
    protected T doRead(DatasetOptions options) {
        String how = options.getString(DatasetOptions.HOW, "next");
        switch (how) {
            case "next":
                return consume(values.pollFirst());
            case "last":
                T last = values.peekLast();
                values.clear();
                return consume(last);
            default:
                throw new IllegalArgumentException("Unsupported read mode how=" + how + " (expected next or last)");
        }
    }

    private T consume(T value) {
        if (value != null) {
            lastConsumed = value;
            consumedCount++;
        }
        return value;
    }

    @Override
    protected void doWrite(T value, DatasetOptions options) {
        throw new UnsupportedOperationException("Input double '" + name + "' is read-only");
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
        return "Fake input '" + name + "' for node '" + nodeName + "', remaining=" + values.size();
    }
}
