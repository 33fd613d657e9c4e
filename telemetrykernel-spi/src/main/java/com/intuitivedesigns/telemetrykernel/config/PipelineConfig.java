/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * Properties-backed configuration.
 * {@link #load()} reads the file named by -Dtk.config.path or ENV 'TK_CONFIG_PATH'.
 */
public final class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    public static final String CONFIG_PATH_PROPERTY = "tk.config.path";
    public static final String CONFIG_PATH_ENV = "TK_CONFIG_PATH";

    private final Properties props;

    private PipelineConfig(Properties props) {
        this.props = props;
    }

    public static PipelineConfig fromProperties(Properties source) {
        Objects.requireNonNull(source, "source");
        Properties copy = new Properties();
        for (String name : source.stringPropertyNames()) {
            copy.setProperty(name, source.getProperty(name));
        }
        return new PipelineConfig(copy);
    }

    public static PipelineConfig fromMap(Map<String, String> source) {
        Objects.requireNonNull(source, "source");
        Properties copy = new Properties();
        copy.putAll(source);
        return new PipelineConfig(copy);
    }

    public static PipelineConfig empty() {
        return new PipelineConfig(new Properties());
    }

    public static PipelineConfig load() {
        // 1. System Property first (-Dtk.config.path)
        String path = System.getProperty(CONFIG_PATH_PROPERTY);

        // 2. Fallback to Environment Variable
        if (path == null || path.isBlank()) {
            path = System.getenv(CONFIG_PATH_ENV);
        }

        if (path == null || path.isBlank()) {
            log.warn("No configuration file specified, using defaults. Usage: -D{}=/path/to/config.properties", CONFIG_PATH_PROPERTY);
            return empty();
        }
        return load(Path.of(path));
    }

    public static PipelineConfig load(Path path) {
        log.info("Loading configuration from: {}", path);
        Properties props = new Properties();
        try (InputStream is = Files.newInputStream(path)) {
            props.load(is);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load config file: " + path, e);
        }
        log.info("Loaded {} properties.", props.size());
        return new PipelineConfig(props);
    }

    public String getString(String key, String defaultValue) {
        String val = props.getProperty(key);
        return (val == null) ? defaultValue : val.trim();
    }

    /**
     * @throws IllegalArgumentException if the key is missing or blank
     */
    public String require(String key) {
        String val = getString(key, null);
        if (val == null || val.isEmpty()) {
            throw new IllegalArgumentException("Missing required config: " + key);
        }
        return val;
    }

    public int getInt(String key, int defaultValue) {
        String val = getString(key, null);
        if (val == null || val.isEmpty()) return defaultValue;
        try {
            return Integer.parseInt(val);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Config '" + key + "' is not an integer: " + val, e);
        }
    }

    public long getLong(String key, long defaultValue) {
        String val = getString(key, null);
        if (val == null || val.isEmpty()) return defaultValue;
        try {
            return Long.parseLong(val);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Config '" + key + "' is not a number: " + val, e);
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String val = getString(key, null);
        return (val == null || val.isEmpty()) ? defaultValue : Boolean.parseBoolean(val);
    }

    /**
     * Milliseconds value as a Duration.
     */
    public Duration getDurationMs(String key, Duration defaultValue) {
        long ms = getLong(key, -1L);
        if (ms < 0) return defaultValue;
        return Duration.ofMillis(ms);
    }

    /**
     * Comma separated list; entries are trimmed and blanks skipped.
     */
    public List<String> getList(String key, List<String> defaultValue) {
        String val = getString(key, null);
        if (val == null) return defaultValue;

        List<String> out = new ArrayList<>();
        for (String part : val.split(",")) {
            String s = part.trim();
            if (!s.isEmpty()) out.add(s);
        }
        return Collections.unmodifiableList(out);
    }

    public boolean hasPath(String key) {
        return props.containsKey(key);
    }

    public Map<String, Object> asMap() {
        Map<String, Object> map = new HashMap<>();
        for (String name : props.stringPropertyNames()) {
            map.put(name, props.getProperty(name));
        }
        return map;
    }

    /**
     * Entries under {@code prefix}, with the prefix stripped.
     */
    public Map<String, String> subset(String prefix) {
        Map<String, String> map = new HashMap<>();
        for (String name : props.stringPropertyNames()) {
            if (name.startsWith(prefix)) {
                map.put(name.substring(prefix.length()), props.getProperty(name));
            }
        }
        return map;
    }

    public Set<String> keys() {
        return props.stringPropertyNames();
    }
}
