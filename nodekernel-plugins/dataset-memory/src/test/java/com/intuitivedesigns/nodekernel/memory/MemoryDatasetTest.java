/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.memory;

import com.intuitivedesigns.nodekernel.dataset.DatasetError;
import com.intuitivedesigns.nodekernel.dataset.DatasetOptions;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class MemoryDatasetTest {

    private static final DatasetOptions LAST = DatasetOptions.of(DatasetOptions.HOW, "last");

    private final MemoryTopicStore store = new MemoryTopicStore();

    private MemoryDataset handle(String name) {
        return new MemoryDataset(name, "prices", 0, store);
    }

    @Test
    void eachHandleReadsEveryMessage() {
        MemoryDataset writer = handle("out");
        MemoryDataset readerA = handle("in_a");
        MemoryDataset readerB = handle("in_b");

        writer.write("p1");
        writer.write("p2");

        assertEquals("p1", readerA.read());
        assertEquals("p2", readerA.read());
        assertNull(readerA.read());
        assertEquals("p1", readerB.read());
        assertEquals(2, readerA.position());
    }

    @Test
    void lastSkipsToTheNewestMessage() {
        MemoryDataset writer = handle("out");
        MemoryDataset reader = handle("in");
        writer.write(1);
        writer.write(2);
        writer.write(3);

        assertEquals(3, reader.read(LAST));
        assertNull(reader.read(LAST));
        writer.write(4);
        assertEquals(4, reader.read());
    }

    @Test
    void blockingReadTimesOut() {
        MemoryDataset reader = handle("in");
        DatasetOptions options = DatasetOptions.builder()
                .put(DatasetOptions.BLOCK, true)
                .put(DatasetOptions.TIMEOUT_MS, 30)
                .build();

        long start = System.nanoTime();
        assertNull(reader.read(options));
        assertTrue(System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(30));
    }

    @Test
    void blockingReadWakesOnWrite() throws Exception {
        MemoryDataset reader = handle("in");
        MemoryDataset writer = handle("out");
        AtomicReference<Object> received = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);

        Thread consumer = new Thread(() -> {
            received.set(reader.read(DatasetOptions.builder()
                    .put(DatasetOptions.BLOCK, true)
                    .put(DatasetOptions.TIMEOUT_MS, 5_000)
                    .build()));
            done.countDown();
        });
        consumer.start();

        writer.write("tick");
        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertEquals("tick", received.get());
    }

    @Test
    void interruptedBlockingReadReturnsNullAndKeepsFlag() throws Exception {
        MemoryDataset reader = handle("in");
        AtomicReference<Object> received = new AtomicReference<>("unset");
        AtomicReference<Boolean> interrupted = new AtomicReference<>();

        Thread consumer = new Thread(() -> {
            received.set(reader.read(DatasetOptions.of(DatasetOptions.BLOCK, true)));
            interrupted.set(Thread.currentThread().isInterrupted());
        });
        consumer.start();
        Thread.sleep(20);
        consumer.interrupt();
        consumer.join(5_000);

        assertNull(received.get());
        assertTrue(interrupted.get());
    }

    @Test
    void createIsIdempotentAndDeleteRemoves() {
        MemoryDataset ds = handle("prices");
        assertFalse(ds.exists());

        assertTrue(ds.create().done());
        ds.write("p1");
        ds.create();
        assertEquals(1, store.find("prices").orElseThrow().size());

        ds.delete();
        assertFalse(ds.exists());
    }

    @Test
    void cursorResetsWhenTopicIsRecreated() {
        MemoryDataset writer = handle("out");
        MemoryDataset reader = handle("in");
        writer.write("old");
        assertEquals("old", reader.read());

        writer.delete();
        writer.write("new");

        assertEquals("new", reader.read());
    }

    @Test
    void boundedTopicDropsOldestAndReadersSkipForward() {
        MemoryDataset writer = new MemoryDataset("out", "ticks", 2, store);
        writer.create();
        MemoryDataset reader = new MemoryDataset("in", "ticks", 2, store);
        assertNull(reader.read());

        writer.write(1);
        writer.write(2);
        writer.write(3);

        assertEquals(2, reader.read());
        assertEquals(3, reader.read());
    }

    @Test
    void unknownReadModeIsADatasetError() {
        DatasetError ex = assertThrows(DatasetError.class,
                () -> handle("in").read(DatasetOptions.of(DatasetOptions.HOW, "first")));
        assertEquals("Failed to read dataset in.", ex.getMessage());
    }

    @Test
    void targetDefaultsToDatasetName() {
        assertEquals("orders", new MemoryDataset("orders", " ", 0, store).topicName());
    }
}
