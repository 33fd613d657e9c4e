/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.lookup;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.intuitivedesigns.telemetrykernel.config.PipelineConfig;
import com.intuitivedesigns.telemetrykernel.core.JsonSupport;
import com.intuitivedesigns.telemetrykernel.metrics.MetricsRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link LookupClient} over one shared {@link HttpClient}.
 *
 * <p>Built once by the composition root and injected into every enrichment unit.
 * The underlying connection pool is shared by all units and workers.</p>
 */
public final class HttpLookupClient implements LookupClient {

    private static final Logger log = LoggerFactory.getLogger(HttpLookupClient.class);

    private static final String ACCEPT = "Accept";
    private static final String APP_JSON = "application/json";

    // Config keys
    public static final String KEY_CONNECT_TIMEOUT_MS = "lookup.http.connect.timeout.ms";
    public static final String KEY_WORKER_THREADS = "lookup.http.threads";

    private static final long DEFAULT_CONNECT_TIMEOUT_MS = 2_000L;
    private static final int DEFAULT_WORKER_THREADS = 8;

    static final int MAX_ERROR_BODY_BYTES = 1024;

    private final HttpClient httpClient;
    private final ExecutorService ownedExecutor;
    private final MetricsRuntime metrics;

    public HttpLookupClient(HttpClient httpClient, MetricsRuntime metrics) {
        this(httpClient, null, metrics);
    }

    private HttpLookupClient(HttpClient httpClient, ExecutorService ownedExecutor, MetricsRuntime metrics) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.ownedExecutor = ownedExecutor;
    }

    public static HttpLookupClient fromConfig(PipelineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");

        final long connectTimeoutMs = Math.max(100L, config.getLong(KEY_CONNECT_TIMEOUT_MS, DEFAULT_CONNECT_TIMEOUT_MS));
        final int threads = Math.max(1, config.getInt(KEY_WORKER_THREADS, DEFAULT_WORKER_THREADS));

        final ExecutorService executor = Executors.newFixedThreadPool(threads, new LookupThreadFactory());
        final HttpClient client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .version(HttpClient.Version.HTTP_1_1)
                .executor(executor)
                .build();

        log.info("Lookup client ready (connectTimeout={}ms, threads={})", connectTimeoutMs, threads);
        return new HttpLookupClient(client, executor, metrics);
    }

    @Override
    public ObjectNode fetch(String baseUrl, String key, Duration timeout) throws LookupException {
        Objects.requireNonNull(baseUrl, "baseUrl");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(timeout, "timeout");

        final long startNs = System.nanoTime();
        metrics.counter("lookup.requests");
        try {
            return doFetch(baseUrl, key, timeout);
        } catch (LookupException e) {
            metrics.counter("lookup.failures");
            throw e;
        } finally {
            metrics.timer("lookup.latency", (System.nanoTime() - startNs) / 1_000_000L);
        }
    }

    private ObjectNode doFetch(String baseUrl, String key, Duration timeout) throws LookupException {
        final URI uri = buildUri(baseUrl, key);

        final HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .header(ACCEPT, APP_JSON)
                .GET()
                .build();

        // The request timeout stops at the response headers; the future bounds the body as well
        final CompletableFuture<HttpResponse<byte[]>> pending =
                httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray());
        final HttpResponse<byte[]> response;
        try {
            response = pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw new LookupException("timed out after " + timeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            throw new LookupException("interrupted", e);
        } catch (ExecutionException e) {
            final Throwable cause = (e.getCause() != null) ? e.getCause() : e;
            if (cause instanceof HttpTimeoutException) {
                throw new LookupException("timed out after " + timeout.toMillis() + "ms", cause);
            }
            throw new LookupException("request failed: " + cause.getMessage(), cause);
        }

        final byte[] body = (response.body() != null) ? response.body() : new byte[0];
        final int status = response.statusCode();

        if (status >= 400) {
            throw new LookupException("http status " + status + ": " + preview(body), status, null);
        }

        if (log.isDebugEnabled()) {
            log.debug("Lookup {} -> {} ({} bytes)", uri, status, body.length);
        }
        return decode(body);
    }

    static ObjectNode decode(byte[] body) throws LookupException {
        if (body.length == 0) {
            throw new LookupException("empty body");
        }

        final JsonNode node;
        try {
            node = JsonSupport.parse(body);
        } catch (JsonProcessingException e) {
            throw new LookupException("invalid json: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new LookupException("invalid json: " + e.getMessage(), e);
        }

        if (node == null || !node.isObject()) {
            throw new LookupException("empty body");
        }
        return (ObjectNode) node;
    }

    /**
     * Joins base and key with exactly one slash; the key is encoded as a single path segment.
     */
    static URI buildUri(String baseUrl, String key) throws LookupException {
        String base = baseUrl.trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        final String segment = URLEncoder.encode(key, StandardCharsets.UTF_8).replace("+", "%20");
        try {
            return URI.create(base + "/" + segment);
        } catch (IllegalArgumentException e) {
            throw new LookupException("invalid lookup url '" + base + "': " + e.getMessage(), e);
        }
    }

    private static String preview(byte[] body) {
        final int n = Math.min(body.length, MAX_ERROR_BODY_BYTES);
        return new String(body, 0, n, StandardCharsets.UTF_8).trim();
    }

    @Override
    public void close() {
        if (ownedExecutor == null) return;

        ownedExecutor.shutdown();
        try {
            if (!ownedExecutor.awaitTermination(2, TimeUnit.SECONDS)) {
                ownedExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            ownedExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Lookup client closed.");
    }

    private static final class LookupThreadFactory implements ThreadFactory {
        private final AtomicInteger seq = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "tk-lookup-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
