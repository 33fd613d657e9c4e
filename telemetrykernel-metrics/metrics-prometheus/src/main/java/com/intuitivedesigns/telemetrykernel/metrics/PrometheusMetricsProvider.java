/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.metrics;

import com.sun.net.httpserver.HttpServer;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Micrometer runtime backed by a Prometheus registry, scraped over a small JDK HTTP server.
 */
public final class PrometheusMetricsProvider implements MetricsProvider {

    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsProvider.class);

    public static final String ID = "PROMETHEUS";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public MetricsRuntime create(MetricsSettings s) {
        // SPI contract: return null if not applicable
        if (s == null || !matches(s.providerId)) {
            return null;
        }

        final PrometheusMeterRegistry reg = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        reg.config().commonTags(s.micrometerTags());

        final ScrapeEndpoint endpoint = ScrapeEndpoint.start(reg, s.prometheusPort, s.prometheusPath);

        final MicrometerMetricsRuntime runtime = new MicrometerMetricsRuntime();
        runtime.addRegistry(reg);
        runtime.addCloseable(endpoint);

        log.info("Prometheus metrics active (port={}, path={})", endpoint.port(), s.prometheusPath);
        return runtime;
    }

    static final class ScrapeEndpoint implements AutoCloseable {
        private final HttpServer server;
        private final ExecutorService executor;

        private ScrapeEndpoint(HttpServer server, ExecutorService executor) {
            this.server = server;
            this.executor = executor;
        }

        static ScrapeEndpoint start(PrometheusMeterRegistry registry, int port, String path) {
            Objects.requireNonNull(registry, "registry");

            final HttpServer server;
            try {
                server = HttpServer.create(new InetSocketAddress(port), 0);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to start Prometheus metrics server on port " + port, e);
            }

            final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "tk-metrics-http");
                t.setDaemon(true);
                return t;
            });
            server.setExecutor(executor);

            server.createContext(path, exchange -> {
                try {
                    final byte[] bytes = registry.scrape().getBytes(StandardCharsets.UTF_8);
                    exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4; charset=utf-8");
                    exchange.sendResponseHeaders(200, bytes.length);
                    try (OutputStream os = exchange.getResponseBody()) {
                        os.write(bytes);
                    }
                } catch (IOException | RuntimeException e) {
                    log.warn("Metrics scrape failed: {}", e.getMessage());
                    exchange.sendResponseHeaders(500, -1);
                } finally {
                    exchange.close();
                }
            });

            server.start();
            return new ScrapeEndpoint(server, executor);
        }

        int port() {
            return server.getAddress().getPort();
        }

        @Override
        public void close() {
            server.stop(0);
            executor.shutdownNow();
        }

        @Override
        public String toString() {
            return "PrometheusScrapeEndpoint[port=" + port() + "]";
        }
    }
}
