/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */
package com.intuitivedesigns.telemetrykernel.spi;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.TreeMap;

/**
 * Plugins of one {@link PluginKind}, keyed by normalised id.
 *
 * <p>The classpath is scanned once, when the registry is built.</p>
 *
 * @param <T> the SPI interface, e.g. {@code UnitPlugin}
 */
public final class ServicePluginRegistry<T extends PipelinePlugin<?>> {

    private final PluginKind kind;
    private final Map<String, T> byId;

    public ServicePluginRegistry(Class<T> spiType, PluginKind kind, ClassLoader cl) {
        this.kind = kind;

        final Map<String, T> found = new TreeMap<>();
        for (T plugin : ServiceLoader.load(spiType, cl)) {
            final String pluginClass = plugin.getClass().getName();
            final String id = PluginIds.normalize(plugin.id());
            if (id.isEmpty()) {
                throw new IllegalStateException("Blank plugin id from " + pluginClass);
            }
            if (plugin.kind() != kind) {
                throw new IllegalStateException(pluginClass + " is registered as " + spiType.getSimpleName()
                        + " but reports kind " + plugin.kind());
            }
            final T previous = found.putIfAbsent(id, plugin);
            if (previous != null) {
                throw new IllegalStateException("Two " + label() + " plugins claim id '" + id + "': "
                        + previous.getClass().getName() + ", " + pluginClass);
            }
        }
        this.byId = Collections.unmodifiableMap(found);
    }

    /**
     * @param configKey the key the id was read from, quoted in the error
     * @throws IllegalArgumentException when no plugin of this kind has the id
     */
    public T require(String id, String configKey) {
        final T plugin = byId.get(PluginIds.normalize(id));
        if (plugin == null) {
            throw new IllegalArgumentException("Unknown " + label() + " '" + id + "' in '" + configKey
                    + "'. Known: " + byId.keySet());
        }
        return plugin;
    }

    /** Sorted. */
    public Set<String> availableIds() {
        return byId.keySet();
    }

    private String label() {
        return kind.name().toLowerCase(Locale.ROOT);
    }
}
