/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.dataset;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AbstractDatasetTest {

    /**
     * Backend whose hooks throw whatever the test sets in {@code failure}.
     */
    private static final class ScriptedDataset extends AbstractDataset<String> {
        Exception failure;
        boolean needsConnection;
        final List<String> written = new ArrayList<>();

        ScriptedDataset(String name) {
            super(name);
        }

        @Override
        public String kind() {
            return "SCRIPTED";
        }

        @Override
        public boolean connectionRequired() {
            return needsConnection;
        }

        private void maybeFail() throws Exception {
            if (failure != null) throw failure;
        }

        @Override
        protected String doRead(DatasetOptions options) throws Exception {
            maybeFail();
            return written.isEmpty() ? null : written.get(0);
        }

        @Override
        protected void doWrite(String value, DatasetOptions options) throws Exception {
            maybeFail();
            written.add(value);
        }

        @Override
        protected DatasetCreateStatus doCreate(DatasetOptions options) throws Exception {
            maybeFail();
            return null;
        }

        @Override
        protected void doDelete() throws Exception {
            maybeFail();
        }

        @Override
        protected void doInitialize(DatasetOptions options) throws Exception {
            maybeFail();
        }

        @Override
        protected boolean doExists(DatasetOptions options) throws Exception {
            maybeFail();
            return true;
        }
    }

    @Test
    void wrapsBackendFailureWithDatasetNameAndCause() {
        ScriptedDataset ds = new ScriptedDataset("orders");
        IOException boom = new IOException("broker unreachable");
        ds.failure = boom;

        DatasetError error = assertThrows(DatasetError.class, ds::read);
        assertEquals("orders", error.datasetName());
        assertEquals("Failed to read dataset orders.", error.getMessage());
        assertSame(boom, error.getCause());
    }

    @Test
    void everyOperationTranslatesFailures() {
        ScriptedDataset ds = new ScriptedDataset("orders");
        ds.failure = new IllegalStateException("nope");

        assertThrows(DatasetError.class, () -> ds.write("x"));
        assertThrows(DatasetError.class, ds::create);
        assertThrows(DatasetError.class, ds::delete);
        assertThrows(DatasetError.class, ds::initialize);

        DatasetError exists = assertThrows(DatasetError.class, ds::exists);
        assertEquals("Failed to check if dataset orders exists.", exists.getMessage());
    }

    @Test
    void datasetErrorFromBackendIsNotDoubleWrapped() {
        ScriptedDataset ds = new ScriptedDataset("orders");
        DatasetError original = new DatasetError("orders", "custom backend message");
        ds.failure = original;

        DatasetError error = assertThrows(DatasetError.class, () -> ds.write("x"));
        assertSame(original, error);
        assertNull(error.getCause());
    }

    @Test
    void createWithoutStatusReportsDone() {
        ScriptedDataset ds = new ScriptedDataset("orders");
        DatasetCreateStatus status = ds.create();
        assertTrue(status.done());
        assertEquals("orders", status.datasetName());
    }

    @Test
    void connectionBackedDatasetRejectsIoBeforeInitialize() {
        ScriptedDataset ds = new ScriptedDataset("orders");
        ds.needsConnection = true;

        DatasetError error = assertThrows(DatasetError.class, () -> ds.write("a"));
        assertEquals("orders", error.datasetName());
        assertTrue(ds.written.isEmpty());

        ds.initialize();
        assertTrue(ds.isInitialized());
        ds.write("a");
        assertEquals("a", ds.read());
    }

    @Test
    void failedInitializeLeavesDatasetUninitialized() {
        ScriptedDataset ds = new ScriptedDataset("orders");
        ds.needsConnection = true;
        ds.failure = new IOException("refused");

        assertThrows(DatasetError.class, ds::initialize);
        assertFalse(ds.isInitialized());
    }

    @Test
    void defaultDescribeNamesDatasetAndKind() {
        ScriptedDataset ds = new ScriptedDataset("orders");
        assertEquals("Dataset name: orders, kind: SCRIPTED", ds.describe());
    }
}
