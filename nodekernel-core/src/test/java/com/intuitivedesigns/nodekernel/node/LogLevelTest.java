/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.node;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LogLevelTest {

    @Test
    void parsesExactLabels() {
        assertEquals(LogLevel.INFO, LogLevel.parse("info"));
        assertEquals(LogLevel.CRITICAL, LogLevel.parse("critical"));
    }

    @Test
    void labelsAreCaseSensitive() {
        assertThrows(IllegalArgumentException.class, () -> LogLevel.parse("INFO"));
        assertThrows(IllegalArgumentException.class, () -> LogLevel.parse(null));
    }
}
