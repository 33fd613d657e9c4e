/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.sources.http;

public final class GatewayClosedException extends IngestionException {

    public GatewayClosedException() {
        super("Gateway is shutting down", 503);
    }
}
