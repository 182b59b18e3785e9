/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.memory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only, offset-addressed log shared by every handle on the same topic.
 *
 * <p>Offsets start at 0 and grow with each append. When {@code maxMessages} is positive the
 * oldest entries are dropped once the bound is hit; readers positioned before the retained
 * range skip forward to the oldest retained offset.</p>
 */
public final class MemoryTopic {

    private final String name;
    private final int maxMessages;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition appended = lock.newCondition();
    private final List<Object> messages = new ArrayList<>();
    private long firstOffset;

    MemoryTopic(String name, int maxMessages) {
        this.name = name;
        this.maxMessages = maxMessages;
    }

    public String name() {
        return name;
    }

    /**
     * @return the offset assigned to {@code value}
     */
    public long append(Object value) {
        lock.lock();
        try {
            messages.add(value);
            if (maxMessages > 0 && messages.size() > maxMessages) {
                messages.remove(0);
                firstOffset++;
            }
            appended.signalAll();
            return firstOffset + messages.size() - 1;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Offset the next append will receive.
     */
    public long endOffset() {
        lock.lock();
        try {
            return firstOffset + messages.size();
        } finally {
            lock.unlock();
        }
    }

    public long firstOffset() {
        lock.lock();
        try {
            return firstOffset;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Entry at {@code offset}, or the oldest retained entry if {@code offset} was dropped.
     *
     * @return the entry, or {@code null} if nothing exists at or after {@code offset}
     */
    public Entry get(long offset) {
        lock.lock();
        try {
            return entryAt(Math.max(offset, firstOffset));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Newest entry, or {@code null} when the topic is empty.
     */
    public Entry last() {
        lock.lock();
        try {
            return messages.isEmpty() ? null : new Entry(firstOffset + messages.size() - 1, messages.get(messages.size() - 1));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits until an entry exists at or beyond {@code offset}.
     *
     * @param timeoutNanos negative to wait without limit
     * @return whether such an entry exists
     */
    public boolean awaitOffset(long offset, long timeoutNanos) throws InterruptedException {
        lock.lock();
        try {
            long remaining = timeoutNanos;
            while (firstOffset + messages.size() <= offset) {
                if (timeoutNanos < 0) {
                    appended.await();
                } else {
                    if (remaining <= 0) return false;
                    remaining = appended.awaitNanos(remaining);
                }
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return messages.size();
        } finally {
            lock.unlock();
        }
    }

    private Entry entryAt(long offset) {
        long index = offset - firstOffset;
        if (index >= messages.size()) {
            return null;
        }
        return new Entry(offset, messages.get((int) index));
    }

    @Override
    public String toString() {
        return "MemoryTopic{name='" + name + "', size=" + size() + '}';
    }

    /**
     * A stored value and its offset.
     */
    public record Entry(long offset, Object value) {
    }
}
