/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.metrics;

import com.intuitivedesigns.telemetrykernel.config.PipelineConfig;
import io.micrometer.core.instrument.Tags;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable configuration container for the metrics runtime.
 */
public final class MetricsSettings {

    // ---- Config keys ----
    private static final String KEY_PROVIDER = "metrics.provider";
    private static final String KEY_TAG_PREFIX = "metrics.tag.";
    private static final String KEY_PROM_PORT = "metrics.prometheus.port";
    private static final String KEY_PROM_PATH = "metrics.prometheus.path";

    // ---- Defaults ----
    private static final String DEFAULT_PROVIDER = "NONE";
    private static final int DEFAULT_PROM_PORT = 9090;
    private static final String DEFAULT_PROM_PATH = "/metrics";

    public final String providerId;
    public final Map<String, String> commonTags;

    /** 0 binds an ephemeral port. */
    public final int prometheusPort;
    public final String prometheusPath;

    private MetricsSettings(String providerId, Map<String, String> commonTags, int prometheusPort, String prometheusPath) {
        this.providerId = providerId;
        this.commonTags = commonTags;
        this.prometheusPort = prometheusPort;
        this.prometheusPath = prometheusPath;
    }

    public static MetricsSettings from(PipelineConfig config) {
        Objects.requireNonNull(config, "config");

        final String provider = normalizeUpper(config.getString(KEY_PROVIDER, DEFAULT_PROVIDER));

        // metrics.tag.<name>=<value> becomes a common tag on every meter
        final Map<String, String> tags = new HashMap<>();
        for (Map.Entry<String, String> entry : config.subset(KEY_TAG_PREFIX).entrySet()) {
            final String tagKey = entry.getKey().trim();
            final String tagVal = (entry.getValue() == null) ? "" : entry.getValue().trim();
            if (!tagKey.isEmpty() && !tagVal.isEmpty()) {
                tags.put(tagKey, tagVal);
            }
        }

        final int promPort = clampInt(config.getInt(KEY_PROM_PORT, DEFAULT_PROM_PORT), 0, 65_535);
        String promPath = config.getString(KEY_PROM_PATH, DEFAULT_PROM_PATH);
        if (!promPath.startsWith("/")) promPath = "/" + promPath;

        return new MetricsSettings(
                (provider != null) ? provider : DEFAULT_PROVIDER,
                Collections.unmodifiableMap(tags),
                promPort,
                promPath);
    }

    /** Common tags as Micrometer {@link Tags}; blank entries were already dropped by {@link #from}. */
    public Tags micrometerTags() {
        Tags out = Tags.empty();
        for (Map.Entry<String, String> e : commonTags.entrySet()) {
            out = out.and(e.getKey(), e.getValue());
        }
        return out;
    }

    @Override
    public String toString() {
        return "MetricsSettings{" +
                "providerId='" + providerId + '\'' +
                ", commonTags=" + commonTags +
                ", prometheusPort=" + prometheusPort +
                ", prometheusPath='" + prometheusPath + '\'' +
                '}';
    }

    private static String normalizeUpper(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t.toUpperCase(Locale.ROOT);
    }

    private static int clampInt(int v, int min, int max) {
        return Math.max(min, Math.min(max, v));
    }
}
