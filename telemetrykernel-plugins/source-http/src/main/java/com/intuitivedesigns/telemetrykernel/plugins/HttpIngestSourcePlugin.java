/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.plugins;

import com.intuitivedesigns.telemetrykernel.core.EventSource;
import com.intuitivedesigns.telemetrykernel.sources.http.GatewaySettings;
import com.intuitivedesigns.telemetrykernel.sources.http.HttpIngestionGateway;
import com.intuitivedesigns.telemetrykernel.spi.PluginContext;
import com.intuitivedesigns.telemetrykernel.spi.SourcePlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP ingestion gateway as a chain source. See {@link GatewaySettings} for the {@code ingest.*} keys.
 */
public final class HttpIngestSourcePlugin implements SourcePlugin {

    private static final Logger log = LoggerFactory.getLogger(HttpIngestSourcePlugin.class);

    public static final String ID = "HTTP";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public EventSource create(PluginContext context) {
        final GatewaySettings settings = GatewaySettings.from(context.config());
        log.info("Initialized HTTP source (port={}, path={}, capacity={}, maxBatch={})",
                settings.port(), settings.path(), settings.queueCapacity(), settings.maxBatchSize());
        return new HttpIngestionGateway(settings, context.metrics());
    }
}
