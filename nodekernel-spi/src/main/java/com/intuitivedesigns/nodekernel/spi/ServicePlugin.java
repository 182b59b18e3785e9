/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.spi;

import java.util.Locale;

/**
 * Base contract for everything discovered through {@link java.util.ServiceLoader}.
 * Ids are matched case-insensitively against the {@code type} field of dataset configs.
 */
public interface ServicePlugin {

    /**
     * Backend id as written in configs, e.g. {@code MEMORY} or {@code KAFKA}.
     */
    String id();

    PluginKind kind();

    /**
     * The id as the registry keys it: trimmed and upper-cased.
     */
    default String normalizedId() {
        return normalizeId(id());
    }

    static String normalizeId(String id) {
        return id == null ? "" : id.trim().toUpperCase(Locale.ROOT);
    }
}
