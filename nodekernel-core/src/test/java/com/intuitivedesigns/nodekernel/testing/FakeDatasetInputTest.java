/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.testing;

import com.intuitivedesigns.nodekernel.dataset.DatasetError;
import com.intuitivedesigns.nodekernel.dataset.DatasetOptions;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FakeDatasetInputTest {

    @Test
    void nextConsumesInOrderThenReturnsNull() {
        FakeDatasetInput<Integer> in = new FakeDatasetInput<>("numbers", "doubler", List.of(1, 2));

        assertEquals(1, in.read());
        assertEquals(2, in.read());
        assertNull(in.read());
        assertTrue(in.isEmpty());
        assertEquals(2, in.consumedCount());
        assertEquals(2, in.lastConsumed());
    }

    @Test
    void lastSkipsToTheNewestValue() {
        FakeDatasetInput<String> in = new FakeDatasetInput<>("quotes", "n", List.of("a", "b", "c"));

        assertEquals("c", in.read(DatasetOptions.of(DatasetOptions.HOW, "last")));
        assertTrue(in.isEmpty());
    }

    @Test
    void unknownReadModeIsWrappedAsDatasetError() {
        FakeDatasetInput<String> in = new FakeDatasetInput<>("quotes", "n", List.of("a"));

        DatasetError ex = assertThrows(DatasetError.class,
                () -> in.read(DatasetOptions.of(DatasetOptions.HOW, "random")));
        assertInstanceOf(IllegalArgumentException.class, ex.getCause());
        assertEquals(List.of("a"), in.remaining());
    }

    @Test
    void writingIsRejected() {
        FakeDatasetInput<String> in = new FakeDatasetInput<>("quotes", "n", List.of());
        assertThrows(DatasetError.class, () -> in.write("x"));
    }

    @Test
    void outputRecordsWritesInOrder() {
        FakeDatasetOutput<String> out = new FakeDatasetOutput<>("sink", "n");
        assertNull(out.last());
        out.write("a");
        out.write("b");
        assertEquals(List.of("a", "b"), out.values());
        assertEquals("b", out.last());
    }
}
