/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.spi;

/**
 * Typed registries for every plugin kind found on the classpath.
 */
public final class PluginCatalog {

    private final ServicePluginRegistry<SourcePlugin> sources;
    private final ServicePluginRegistry<UnitPlugin> units;
    private final ServicePluginRegistry<SinkPlugin> sinks;

    public PluginCatalog(ClassLoader cl) {
        this.sources = new ServicePluginRegistry<>(SourcePlugin.class, PluginKind.SOURCE, cl);
        this.units = new ServicePluginRegistry<>(UnitPlugin.class, PluginKind.UNIT, cl);
        this.sinks = new ServicePluginRegistry<>(SinkPlugin.class, PluginKind.SINK, cl);
    }

    public ServicePluginRegistry<SourcePlugin> sources() {
        return sources;
    }

    public ServicePluginRegistry<UnitPlugin> units() {
        return units;
    }

    public ServicePluginRegistry<SinkPlugin> sinks() {
        return sinks;
    }
}
