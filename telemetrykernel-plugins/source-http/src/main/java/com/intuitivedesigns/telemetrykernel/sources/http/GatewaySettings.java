/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.sources.http;

import com.intuitivedesigns.telemetrykernel.config.PipelineConfig;

import java.time.Duration;
import java.util.Objects;

/**
 * Tuning for {@link HttpIngestionGateway}.
 *
 * @param host          bind address
 * @param port          listen port, 0 for an ephemeral port
 * @param path          events path
 * @param queueCapacity bounded buffer capacity
 * @param maxBatchSize  maximum events per submission
 * @param maxBodyBytes  maximum request body size
 * @param drainTimeout  how long shutdown waits for consumers to empty the buffer
 * @param shutdownGrace how long shutdown waits for in-flight requests
 * @param httpThreads   request handler threads
 */
public record GatewaySettings(String host,
                              int port,
                              String path,
                              int queueCapacity,
                              int maxBatchSize,
                              long maxBodyBytes,
                              Duration drainTimeout,
                              Duration shutdownGrace,
                              int httpThreads) {

    // Config keys
    public static final String KEY_HOST = "ingest.http.host";
    public static final String KEY_PORT = "ingest.http.port";
    public static final String KEY_PATH = "ingest.http.path";
    public static final String KEY_QUEUE_CAPACITY = "ingest.queue.capacity";
    public static final String KEY_MAX_BATCH_SIZE = "ingest.max.batch.size";
    public static final String KEY_MAX_BODY_BYTES = "ingest.http.max.body.bytes";
    public static final String KEY_DRAIN_TIMEOUT_MS = "ingest.drain.timeout.ms";
    public static final String KEY_SHUTDOWN_GRACE_MS = "ingest.http.shutdown.grace.ms";
    public static final String KEY_HTTP_THREADS = "ingest.http.threads";

    // Defaults
    public static final String DEFAULT_HOST = "0.0.0.0";
    public static final int DEFAULT_PORT = 8080;
    public static final String DEFAULT_PATH = "/events";
    public static final int DEFAULT_QUEUE_CAPACITY = 100;
    public static final int DEFAULT_MAX_BATCH_SIZE = 100;
    public static final long DEFAULT_MAX_BODY_BYTES = 10L * 1024 * 1024;
    public static final Duration DEFAULT_DRAIN_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_SHUTDOWN_GRACE = Duration.ofSeconds(10);
    public static final int DEFAULT_HTTP_THREADS = 4;

    public GatewaySettings {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(drainTimeout, "drainTimeout");
        Objects.requireNonNull(shutdownGrace, "shutdownGrace");
        if (port < 0 || port > 65_535) throw new IllegalArgumentException("port out of range: " + port);
        if (!path.startsWith("/")) throw new IllegalArgumentException("path must start with '/': " + path);
        if (queueCapacity <= 0) throw new IllegalArgumentException("queueCapacity must be > 0");
        if (maxBatchSize <= 0) throw new IllegalArgumentException("maxBatchSize must be > 0");
        if (maxBodyBytes <= 0) throw new IllegalArgumentException("maxBodyBytes must be > 0");
        if (httpThreads <= 0) throw new IllegalArgumentException("httpThreads must be > 0");
    }

    public static GatewaySettings from(PipelineConfig config) {
        Objects.requireNonNull(config, "config");
        return new GatewaySettings(
                config.getString(KEY_HOST, DEFAULT_HOST),
                config.getInt(KEY_PORT, DEFAULT_PORT),
                config.getString(KEY_PATH, DEFAULT_PATH),
                config.getInt(KEY_QUEUE_CAPACITY, DEFAULT_QUEUE_CAPACITY),
                config.getInt(KEY_MAX_BATCH_SIZE, DEFAULT_MAX_BATCH_SIZE),
                config.getLong(KEY_MAX_BODY_BYTES, DEFAULT_MAX_BODY_BYTES),
                config.getDurationMs(KEY_DRAIN_TIMEOUT_MS, DEFAULT_DRAIN_TIMEOUT),
                config.getDurationMs(KEY_SHUTDOWN_GRACE_MS, DEFAULT_SHUTDOWN_GRACE),
                config.getInt(KEY_HTTP_THREADS, DEFAULT_HTTP_THREADS));
    }

    public static GatewaySettings defaults() {
        return from(PipelineConfig.empty());
    }

    public GatewaySettings withPort(int newPort) {
        return new GatewaySettings(host, newPort, path, queueCapacity, maxBatchSize, maxBodyBytes,
                drainTimeout, shutdownGrace, httpThreads);
    }

    public GatewaySettings withLimits(int newQueueCapacity, int newMaxBatchSize) {
        return new GatewaySettings(host, port, path, newQueueCapacity, newMaxBatchSize, maxBodyBytes,
                drainTimeout, shutdownGrace, httpThreads);
    }

    public GatewaySettings withDrainTimeout(Duration newDrainTimeout) {
        return new GatewaySettings(host, port, path, queueCapacity, maxBatchSize, maxBodyBytes,
                newDrainTimeout, shutdownGrace, httpThreads);
    }
}
