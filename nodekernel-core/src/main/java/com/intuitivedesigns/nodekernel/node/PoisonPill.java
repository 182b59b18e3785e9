/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.node;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Pipeline-wide shutdown flag.
 *
 * <p>One instance per pipeline run, created before any node starts and handed by reference to
 * every node. Two states, inactive and active, with no way back. Activation does not interrupt
 * running steps; the supervisor observes the flag and tears the nodes down.</p>
 */
public final class PoisonPill {

    private final AtomicBoolean active = new AtomicBoolean(false);
    private final CountDownLatch activated = new CountDownLatch(1);

    /**
     * Sets the flag. Idempotent.
     *
     * @return true if this call performed the transition
     */
    public boolean activate() {
        if (active.compareAndSet(false, true)) {
            activated.countDown();
            return true;
        }
        return false;
    }

    public boolean isActive() {
        return active.get();
    }

    /**
     * Blocks until the flag is active or the timeout elapses.
     *
     * @return whether the flag is active
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return activated.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    @Override
    public String toString() {
        return "PoisonPill{active=" + active.get() + '}';
    }
}
