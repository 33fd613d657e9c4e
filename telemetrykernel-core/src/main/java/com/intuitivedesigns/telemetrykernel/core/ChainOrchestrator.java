/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.core;

import com.intuitivedesigns.telemetrykernel.metrics.MetricsRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

/**
 * Drives records from an {@link EventSource} through a {@link ProcessorChain} into a sink.
 *
 * <ul>
 * <li>N platform worker threads each loop: poll, process, write. EMPTY polls are retried.</li>
 * <li>Forwarded records go to the primary sink; a sink error sends the record to the dead-letter sink.</li>
 * <li>Dropped records are counted and discarded.</li>
 * <li>Failed records follow the configured {@link FailurePolicy}.</li>
 * </ul>
 */
public final class ChainOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ChainOrchestrator.class);

    public static final String META_FAILED_UNIT = "chain.failed_unit";
    public static final String META_ERROR = "chain.error";

    private static final long ERROR_LOG_INTERVAL_MS = 5_000L;

    // Core Components
    private final EventSource source;
    private final ProcessorChain chain;
    private final EventSink primarySink;
    private final EventSink dlqSink;
    private final FailurePolicy failurePolicy;
    private final MetricsRuntime metrics;

    // Tuning
    private final int parallelism;
    private final Duration pollTimeout;
    private final Duration stopTimeout;

    // Runtime State
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile ExecutorService workers;

    // Counters
    private final LongAdder processedCount = new LongAdder();
    private final LongAdder dlqCount = new LongAdder();
    private final LongAdder sinkErrorCount = new LongAdder();
    private volatile long lastSinkErrorLogAtMs = 0L;

    public ChainOrchestrator(EventSource source,
                             ProcessorChain chain,
                             EventSink primarySink,
                             EventSink dlqSink,
                             FailurePolicy failurePolicy,
                             int parallelism,
                             Duration pollTimeout,
                             Duration stopTimeout,
                             MetricsRuntime metrics) {
        this.source = Objects.requireNonNull(source, "source");
        this.chain = Objects.requireNonNull(chain, "chain");
        this.primarySink = Objects.requireNonNull(primarySink, "primarySink");
        this.dlqSink = Objects.requireNonNull(dlqSink, "dlqSink");
        this.failurePolicy = Objects.requireNonNull(failurePolicy, "failurePolicy");
        this.pollTimeout = Objects.requireNonNull(pollTimeout, "pollTimeout");
        this.stopTimeout = Objects.requireNonNull(stopTimeout, "stopTimeout");
        this.metrics = Objects.requireNonNull(metrics, "metrics");

        if (parallelism <= 0) throw new IllegalArgumentException("Parallelism must be > 0");
        this.parallelism = parallelism;
    }

    public void start() throws Exception {
        if (!running.compareAndSet(false, true)) return;

        log.info("Starting pipeline components...");
        chain.init();
        source.connect();

        final ExecutorService ex = Executors.newFixedThreadPool(parallelism, new WorkerThreadFactory());
        for (int i = 0; i < parallelism; i++) {
            ex.submit(this::runWorkerLoop);
        }
        this.workers = ex;

        log.info("Pipeline started: parallelism={} pollTimeout={}ms failurePolicy={} units={}",
                parallelism, pollTimeout.toMillis(), failurePolicy, chain.unitNames());
    }

    /**
     * Stops the source first (it drains its buffer while workers keep polling),
     * then the workers, then flushes and closes sinks and units.
     */
    public void stop() {
        if (!running.get()) return;

        log.info("Stop requested. Draining source...");

        // 1. Stop intake; workers keep consuming what is buffered
        safeDisconnectSource();

        // 2. Stop workers
        running.set(false);
        final ExecutorService ex = workers;
        if (ex != null) {
            ex.shutdown();
            try {
                if (!ex.awaitTermination(stopTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    ex.shutdownNow();
                    ex.awaitTermination(1, TimeUnit.SECONDS);
                }
            } catch (InterruptedException e) {
                ex.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        // 3. Close Resources
        safeFlush(primarySink);
        safeClose(primarySink, "primarySink");
        safeClose(dlqSink, "dlqSink");
        chain.close();

        log.info("Pipeline stopped. processed={} forwarded={} dropped={} failed={} dlq={} sinkErrors={}",
                processedCount.sum(), chain.forwardedTotal(), chain.droppedTotal(), chain.failedTotal(),
                dlqCount.sum(), sinkErrorCount.sum());
    }

    private void runWorkerLoop() {
        while (running.get()) {
            final PollResult polled = source.poll(pollTimeout);

            switch (polled.kind()) {
                case EVENT -> handle(polled.record());
                case EMPTY -> {
                    // retry signal
                }
                case CANCELLED -> {
                    log.debug("Worker {} cancelled", Thread.currentThread().getName());
                    return;
                }
            }
        }
    }

    void handle(EventRecord record) {
        processedCount.increment();
        try {
            final ChainResult result = chain.process(record);

            switch (result.status()) {
                case FORWARDED -> writeForwarded(record);
                case DROPPED -> log.debug("Record {} dropped by {}: {}", record.id(), result.unit(), result.reason());
                case FAILED -> handleFailure(result);
            }
        } catch (RuntimeException e) {
            log.error("Unexpected error handling record {}", record.id(), e);
            deadLetter(record, "orchestrator", e);
        }
    }

    private void writeForwarded(EventRecord record) {
        try {
            primarySink.write(record);
        } catch (Exception e) {
            sinkErrorCount.increment();
            metrics.counter("pipeline.sink.errors", 1.0, "sink", primarySink.id());
            final long nowMs = System.currentTimeMillis();
            if (nowMs - lastSinkErrorLogAtMs > ERROR_LOG_INTERVAL_MS) {
                lastSinkErrorLogAtMs = nowMs;
                log.error("Sink {} write failed id={}: {}", primarySink.id(), record.id(), e.getMessage());
            }
            deadLetter(record, "sink:" + primarySink.id(), e);
        }
    }

    private void handleFailure(ChainResult result) {
        final EventRecord record = result.record();
        if (failurePolicy == FailurePolicy.LOG_AND_DROP) {
            log.warn("Record {} failed in unit {} and was dropped: {}", record.id(), result.unit(), result.reason());
            metrics.counter("pipeline.failed.dropped");
            return;
        }
        deadLetter(record, result.unit(), result.error());
    }

    private void deadLetter(EventRecord record, String origin, Throwable error) {
        record.putMetadata(META_FAILED_UNIT, origin);
        record.putMetadata(META_ERROR, String.valueOf(error != null ? error.getMessage() : null));
        try {
            dlqSink.write(record);
            dlqCount.increment();
            metrics.counter("pipeline.dlq.written");
        } catch (Exception e) {
            log.error("DOUBLE FAULT: DLQ write failed id={}", record.id(), e);
        }
    }

    // --- Accessors ---

    public boolean isRunning() {
        return running.get();
    }

    public long processedTotal() {
        return processedCount.sum();
    }

    public long deadLetteredTotal() {
        return dlqCount.sum();
    }

    // --- Helpers ---

    private void safeDisconnectSource() {
        try {
            source.disconnect();
        } catch (RuntimeException e) {
            log.warn("Error disconnecting source", e);
        }
    }

    private static void safeFlush(EventSink sink) {
        try {
            sink.flush();
        } catch (Exception e) {
            log.warn("Error flushing sink {}", sink.id(), e);
        }
    }

    private static void safeClose(AutoCloseable c, String name) {
        try {
            c.close();
        } catch (Exception e) {
            log.warn("Error closing {}", name, e);
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger seq = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "tk-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
