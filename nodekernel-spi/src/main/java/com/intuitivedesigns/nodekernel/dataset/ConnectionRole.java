/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.nodekernel.dataset;

/**
 * Which side of a dataset a node connects to. Inputs consume, outputs produce.
 */
public enum ConnectionRole {
    CONSUMER,
    PRODUCER
}
