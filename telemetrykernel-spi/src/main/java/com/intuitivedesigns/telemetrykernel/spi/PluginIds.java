/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.spi;

import java.util.Locale;

public final class PluginIds {
    private PluginIds() {}

    /**
     * Trims and upper-cases, so {@code asset_enricher} and {@code ASSET_ENRICHER} name the same plugin.
     */
    public static String normalize(String s) {
        return s == null ? "" : s.trim().toUpperCase(Locale.ROOT);
    }

    /**
     * Config prefix for a unit's own keys, e.g. {@code unit.asset_enricher.}.
     */
    public static String unitPrefix(String id) {
        return "unit." + normalize(id).toLowerCase(Locale.ROOT) + ".";
    }
}
