/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.plugins;

import com.intuitivedesigns.telemetrykernel.config.PipelineConfig;
import com.intuitivedesigns.telemetrykernel.core.FieldPath;
import com.intuitivedesigns.telemetrykernel.core.TransformUnit;
import com.intuitivedesigns.telemetrykernel.plugins.transform.UserEnricher;
import com.intuitivedesigns.telemetrykernel.spi.PluginContext;
import com.intuitivedesigns.telemetrykernel.spi.PluginIds;
import com.intuitivedesigns.telemetrykernel.spi.UnitPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Identity enrichment. Same keys as the asset enricher under {@code unit.user_enricher.}.
 */
public final class UserEnricherPlugin implements UnitPlugin {

    private static final Logger log = LoggerFactory.getLogger(UserEnricherPlugin.class);

    public static final String ID = "USER_ENRICHER";

    private static final String PREFIX = PluginIds.unitPrefix(ID);

    // Config keys
    public static final String KEY_ENDPOINT = PREFIX + "endpoint";
    public static final String KEY_ID_FIELD = PREFIX + "id.field";
    public static final String KEY_TIMEOUT_MS = PREFIX + "timeout.ms";

    // Defaults
    public static final String DEFAULT_ID_FIELD = "user_id";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    @Override
    public String id() {
        return ID;
    }

    @Override
    public TransformUnit create(PluginContext context) {
        final PipelineConfig config = context.config();

        final String endpoint = config.require(KEY_ENDPOINT);
        final FieldPath idPath = FieldPath.parse(config.getString(KEY_ID_FIELD, DEFAULT_ID_FIELD));
        final Duration timeout = config.getDurationMs(KEY_TIMEOUT_MS, DEFAULT_TIMEOUT);

        log.info("Initialized USER_ENRICHER (endpoint={}, idField={}, timeout={}ms)", endpoint, idPath, timeout.toMillis());
        return new UserEnricher("user_enricher", endpoint, idPath, timeout, context.lookupClient(), context.metrics());
    }
}
