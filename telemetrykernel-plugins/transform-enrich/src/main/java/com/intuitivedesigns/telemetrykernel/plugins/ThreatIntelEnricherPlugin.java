/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.plugins;

import com.intuitivedesigns.telemetrykernel.config.PipelineConfig;
import com.intuitivedesigns.telemetrykernel.core.TransformUnit;
import com.intuitivedesigns.telemetrykernel.plugins.transform.ObservableType;
import com.intuitivedesigns.telemetrykernel.plugins.transform.ThreatIntelEnricher;
import com.intuitivedesigns.telemetrykernel.spi.PluginContext;
import com.intuitivedesigns.telemetrykernel.spi.PluginIds;
import com.intuitivedesigns.telemetrykernel.spi.UnitPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Per-observable threat-intel enrichment.
 * <pre>
 * unit.threat_intel_enricher.endpoint=http://intel-api/ioc
 * unit.threat_intel_enricher.timeout.ms=5000
 * unit.threat_intel_enricher.eligible.type.ids=1,2,4,5,7,8,23
 * </pre>
 */
public final class ThreatIntelEnricherPlugin implements UnitPlugin {

    private static final Logger log = LoggerFactory.getLogger(ThreatIntelEnricherPlugin.class);

    public static final String ID = "THREAT_INTEL_ENRICHER";

    private static final String PREFIX = PluginIds.unitPrefix(ID);

    // Config keys
    public static final String KEY_ENDPOINT = PREFIX + "endpoint";
    public static final String KEY_TIMEOUT_MS = PREFIX + "timeout.ms";
    public static final String KEY_ELIGIBLE_TYPE_IDS = PREFIX + "eligible.type.ids";

    // Defaults
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    @Override
    public String id() {
        return ID;
    }

    @Override
    public TransformUnit create(PluginContext context) {
        final PipelineConfig config = context.config();

        final String endpoint = config.require(KEY_ENDPOINT);
        final Duration timeout = config.getDurationMs(KEY_TIMEOUT_MS, DEFAULT_TIMEOUT);
        final Set<Long> eligible = parseTypeIds(config.getList(KEY_ELIGIBLE_TYPE_IDS, null));

        log.info("Initialized {} (endpoint={}, timeout={}ms, eligibleTypeIds={})",
                ID, endpoint, timeout.toMillis(), eligible);
        return new ThreatIntelEnricher("threat_intel_enricher", endpoint, timeout, eligible,
                context.lookupClient(), context.metrics());
    }

    static Set<Long> parseTypeIds(List<String> raw) {
        if (raw == null) return ObservableType.defaultEligibleIds();

        final Set<Long> out = new LinkedHashSet<>();
        for (String s : raw) {
            try {
                out.add(Long.parseLong(s));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Config '" + KEY_ELIGIBLE_TYPE_IDS + "' has a non-numeric type id: " + s, e);
            }
        }
        return out;
    }
}
