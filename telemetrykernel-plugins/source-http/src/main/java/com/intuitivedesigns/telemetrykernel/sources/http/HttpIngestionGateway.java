/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.sources.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.intuitivedesigns.telemetrykernel.core.EventRecord;
import com.intuitivedesigns.telemetrykernel.core.EventSource;
import com.intuitivedesigns.telemetrykernel.core.JsonSupport;
import com.intuitivedesigns.telemetrykernel.core.PollResult;
import com.intuitivedesigns.telemetrykernel.metrics.MetricsRuntime;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * HTTP front end feeding a bounded buffer that chain workers poll.
 *
 * <p><b>Backpressure:</b> enqueue never blocks. When the buffer is full the submission
 * fails with {@link QueueFullException}; events accepted before that point stay enqueued.</p>
 *
 * <p><b>Threading:</b> {@link #submit(byte[])} is called from many HTTP handler threads and
 * {@link #poll(Duration)} from many workers. The {@link ArrayBlockingQueue} is the only
 * shared mutable state between them.</p>
 */
public final class HttpIngestionGateway implements EventSource {

    private static final Logger log = LoggerFactory.getLogger(HttpIngestionGateway.class);

    public static final String META_RECEIVED_AT = "http.received_at";
    public static final String HEALTH_PATH = "/health";

    private static final DateTimeFormatter RFC3339 = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    private enum State { NEW, OPEN, CLOSED }

    private final GatewaySettings settings;
    private final MetricsRuntime metrics;
    private final BlockingQueue<EventRecord> buffer;

    private volatile State state = State.NEW;

    // Submitters hold the read side across their offers; closing takes the write side,
    // so no offer can land after the state turns CLOSED
    private final ReadWriteLock intakeLock = new ReentrantReadWriteLock();
    private volatile HttpServer server;
    private volatile ExecutorService httpExecutor;

    public HttpIngestionGateway(GatewaySettings settings, MetricsRuntime metrics) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.buffer = new ArrayBlockingQueue<>(settings.queueCapacity());
    }

    // -----------------------------------------------------------------------
    // LIFECYCLE
    // -----------------------------------------------------------------------

    /**
     * Starts the HTTP listener. {@link #submit(byte[])} also works without it (in-process producers).
     */
    @Override
    public synchronized void connect() {
        if (state != State.NEW) return;

        final HttpServer s;
        try {
            s = HttpServer.create(new InetSocketAddress(settings.host(), settings.port()), 0);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to bind ingestion gateway on " + settings.host() + ":" + settings.port(), e);
        }

        final AtomicInteger seq = new AtomicInteger();
        final ExecutorService executor = Executors.newFixedThreadPool(settings.httpThreads(), r -> {
            Thread t = new Thread(r, "tk-ingest-http-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        s.setExecutor(executor);
        s.createContext(settings.path(), new IngestHttpHandler(this, settings.maxBodyBytes()));
        s.createContext(HEALTH_PATH, new IngestHttpHandler.Health());
        s.start();

        this.server = s;
        this.httpExecutor = executor;
        this.state = State.OPEN;

        log.info("HTTP ingestion gateway listening on http://{}:{}{} (capacity={}, maxBatch={})",
                settings.host(), boundPort(), settings.path(), settings.queueCapacity(), settings.maxBatchSize());
    }

    /**
     * Stops accepting submissions and the listener, then waits up to the drain timeout
     * for consumers to empty the buffer. Whatever is left after that is released.
     */
    @Override
    public void disconnect() {
        synchronized (this) {
            if (state == State.CLOSED) return;
            intakeLock.writeLock().lock();
            try {
                state = State.CLOSED;
            } finally {
                intakeLock.writeLock().unlock();
            }
        }
        log.info("Shutting down HTTP ingestion gateway");

        final HttpServer s = server;
        if (s != null) {
            s.stop((int) Math.max(0L, (settings.shutdownGrace().toMillis() + 999) / 1000));
        }
        final ExecutorService ex = httpExecutor;
        if (ex != null) {
            ex.shutdown();
        }

        final long deadline = System.nanoTime() + settings.drainTimeout().toNanos();
        while (!buffer.isEmpty() && System.nanoTime() < deadline) {
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }

        final int abandoned = buffer.size();
        buffer.clear();
        updateDepthGauge();

        if (abandoned > 0) {
            log.warn("Ingestion gateway closed with {} undrained events", abandoned);
        } else {
            log.info("Ingestion gateway closed, buffer drained.");
        }
    }

    public boolean isClosed() {
        return state == State.CLOSED;
    }

    /**
     * @return the listening port, or -1 before {@link #connect()}
     */
    public int boundPort() {
        final HttpServer s = server;
        return (s == null) ? -1 : s.getAddress().getPort();
    }

    // -----------------------------------------------------------------------
    // PRODUCER SIDE
    // -----------------------------------------------------------------------

    /**
     * Decodes and enqueues one submission.
     *
     * <p>A JSON array is split into one event per element; any other JSON value is one event.
     * Every event must be a JSON object.</p>
     *
     * @throws MalformedInputException if the payload is not an object or an array of objects
     * @throws BatchTooLargeException  if the submission holds more than the maximum batch size
     * @throws QueueFullException      if the buffer filled up; earlier events of this submission stay enqueued
     * @throws GatewayClosedException  after {@link #disconnect()}
     */
    public SubmissionResult submit(byte[] payload) throws IngestionException {
        Objects.requireNonNull(payload, "payload");

        if (state == State.CLOSED) {
            throw new GatewayClosedException();
        }

        final List<ObjectNode> events;
        try {
            events = decode(payload);
        } catch (MalformedInputException e) {
            metrics.counter("ingest.rejected.malformed");
            throw e;
        }

        if (events.size() > settings.maxBatchSize()) {
            metrics.counter("ingest.rejected.batch_too_large");
            log.warn("Batch size {} exceeds maximum {}", events.size(), settings.maxBatchSize());
            throw new BatchTooLargeException(events.size(), settings.maxBatchSize());
        }

        int accepted = 0;
        intakeLock.readLock().lock();
        try {
            if (state == State.CLOSED) {
                throw new GatewayClosedException();
            }
            for (ObjectNode body : events) {
                final EventRecord record = EventRecord.of(body);
                record.putMetadata(META_RECEIVED_AT, formatRfc3339(Instant.now()));
                if (!buffer.offer(record)) {
                    metrics.counter("ingest.rejected.queue_full");
                    log.warn("Event queue full, accepted {}/{} events", accepted, events.size());
                    throw new QueueFullException(accepted, events.size());
                }
                accepted++;
            }
        } finally {
            intakeLock.readLock().unlock();
            metrics.counter("ingest.accepted", accepted);
            updateDepthGauge();
        }

        log.debug("Accepted {} events", accepted);
        return new SubmissionResult(accepted, Instant.now());
    }

    static List<ObjectNode> decode(byte[] payload) throws MalformedInputException {
        final JsonNode root;
        try {
            root = JsonSupport.parse(payload);
        } catch (JsonProcessingException e) {
            throw new MalformedInputException(e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new MalformedInputException(e.getMessage(), e);
        }

        if (root == null || root.isMissingNode()) {
            throw new MalformedInputException("empty body");
        }

        if (!root.isArray()) {
            if (!root.isObject()) {
                throw new MalformedInputException("event is a " + root.getNodeType() + ", expected an object");
            }
            return List.of((ObjectNode) root);
        }

        final List<ObjectNode> out = new ArrayList<>(root.size());
        for (int i = 0; i < root.size(); i++) {
            final JsonNode element = root.get(i);
            if (!element.isObject()) {
                throw new MalformedInputException("batch element " + i + " is a " + element.getNodeType() + ", expected an object");
            }
            out.add((ObjectNode) element);
        }
        return out;
    }

    // -----------------------------------------------------------------------
    // CONSUMER SIDE
    // -----------------------------------------------------------------------

    @Override
    public PollResult poll(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        try {
            final EventRecord record = buffer.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
            if (record == null) {
                return PollResult.empty();
            }
            updateDepthGauge();
            return PollResult.event(record);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return PollResult.cancelled();
        }
    }

    /** Current number of buffered events. */
    public int depth() {
        return buffer.size();
    }

    public int capacity() {
        return settings.queueCapacity();
    }

    private void updateDepthGauge() {
        metrics.gauge("ingest.buffer.depth", buffer.size());
    }

    static String formatRfc3339(Instant instant) {
        return instant.truncatedTo(ChronoUnit.SECONDS).atOffset(ZoneOffset.UTC).format(RFC3339);
    }
}
