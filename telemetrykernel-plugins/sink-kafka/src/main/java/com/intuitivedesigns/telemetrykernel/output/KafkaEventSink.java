/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.output;

import com.intuitivedesigns.telemetrykernel.config.PipelineConfig;
import com.intuitivedesigns.telemetrykernel.core.EventRecord;
import com.intuitivedesigns.telemetrykernel.core.EventSink;
import com.intuitivedesigns.telemetrykernel.metrics.MetricsRuntime;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.internals.RecordHeaders;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Publishes finished records to one Kafka topic.
 *
 * <ul>
 * <li>value: the JSON body</li>
 * <li>key: the record id, so one event always lands on the same partition</li>
 * <li>headers: the metadata sidecar, one header per entry</li>
 * </ul>
 *
 * <p>Async sends are bounded by an in-flight semaphore and report failures through the
 * callback (counted and logged). Sync mode blocks per record and throws, so the
 * orchestrator can dead-letter the record.</p>
 */
public final class KafkaEventSink implements EventSink {

    private static final Logger log = LoggerFactory.getLogger(KafkaEventSink.class);

    // Config keys
    public static final String KEY_TOPIC = "sink.kafka.topic";
    public static final String KEY_SYNC = "sink.kafka.sync";
    public static final String KEY_INFLIGHT_MAX = "sink.kafka.inflight.max";
    public static final String KEY_ERROR_LOG_INTERVAL_MS = "sink.kafka.error.log.interval.ms";

    // Defaults
    public static final String DEFAULT_TOPIC = "ocsf-events";
    private static final int DEFAULT_INFLIGHT_MAX = 10_000;
    private static final long DEFAULT_ERROR_LOG_INTERVAL_MS = 5_000L;

    private final Producer<String, byte[]> producer;
    private final String topic;
    private final boolean syncSend;

    // Backpressure
    private final Semaphore inflightSemaphore;
    private final LongAdder inflightNow = new LongAdder();

    private final LongAdder sentOk = new LongAdder();
    private final LongAdder sentFail = new LongAdder();

    // Micrometer (optional)
    private final Counter okCounter;
    private final Counter failCounter;
    private final Timer sendLatencyTimer;

    // Rate-limited error logging
    private final long errorLogIntervalMs;
    private final AtomicLong lastErrorLogMs = new AtomicLong(0);
    private final LongAdder suppressedErrorLogs = new LongAdder();

    public KafkaEventSink(Producer<String, byte[]> producer,
                          String topic,
                          boolean syncSend,
                          int maxInFlight,
                          long errorLogIntervalMs,
                          MetricsRuntime metrics) {
        this.producer = Objects.requireNonNull(producer, "producer");
        this.topic = Objects.requireNonNull(topic, "topic");
        this.syncSend = syncSend;
        this.inflightSemaphore = (maxInFlight > 0) ? new Semaphore(maxInFlight) : null;
        this.errorLogIntervalMs = Math.max(100L, errorLogIntervalMs);

        final MeterRegistry registry = (metrics != null && metrics.enabled() && metrics.registry() instanceof MeterRegistry mr)
                ? mr
                : null;

        if (registry != null) {
            this.okCounter = registry.counter("sink.kafka.sent", "topic", topic);
            this.failCounter = registry.counter("sink.kafka.failed", "topic", topic);
            this.sendLatencyTimer = registry.timer("sink.kafka.send.latency", "topic", topic);
        } else {
            this.okCounter = null;
            this.failCounter = null;
            this.sendLatencyTimer = null;
        }

        log.info("KafkaEventSink active. topic='{}' sync={} inflight_limit={}",
                topic, syncSend, inflightSemaphore != null ? maxInFlight : "unbounded");
    }

    public static KafkaEventSink fromConfig(PipelineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");

        final String topic = config.getString(KEY_TOPIC, DEFAULT_TOPIC);
        final boolean sync = config.getBoolean(KEY_SYNC, false);
        final int inflight = config.getInt(KEY_INFLIGHT_MAX, DEFAULT_INFLIGHT_MAX);
        final long errorInterval = config.getLong(KEY_ERROR_LOG_INTERVAL_MS, DEFAULT_ERROR_LOG_INTERVAL_MS);

        final Producer<String, byte[]> producer = new KafkaProducer<>(buildProducerProps(config));
        return new KafkaEventSink(producer, topic, sync, inflight, errorInterval, metrics);
    }

    static Properties buildProducerProps(PipelineConfig config) {
        final Properties props = new Properties();

        // Connectivity
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getString("kafka.bootstrap.servers", "localhost:9092"));
        props.put(ProducerConfig.CLIENT_ID_CONFIG,
                config.getString("kafka.producer.client.id", config.getString("pipeline.name", "TelemetryKernel")));
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());

        // Durability
        props.put(ProducerConfig.ACKS_CONFIG, config.getString("kafka.producer.acks", "all"));
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, config.getString("kafka.producer.idempotence", "true"));

        // Performance
        props.put(ProducerConfig.COMPRESSION_TYPE_CONFIG, config.getString("kafka.producer.compression", "lz4"));
        props.put(ProducerConfig.BATCH_SIZE_CONFIG, Integer.toString(config.getInt("kafka.producer.batch.size", 65_536)));
        props.put(ProducerConfig.LINGER_MS_CONFIG, Integer.toString(config.getInt("kafka.producer.linger.ms", 5)));

        // kafka.ssl.*, kafka.security.*, kafka.sasl.* -> strip "kafka."
        for (String key : config.keys()) {
            if (key.startsWith("kafka.ssl.") || key.startsWith("kafka.security.") || key.startsWith("kafka.sasl.")) {
                final String v = config.getString(key, null);
                if (v != null) props.put(key.substring("kafka.".length()), v);
            }
        }
        return props;
    }

    @Override
    public void write(EventRecord record) throws Exception {
        if (record == null) return;

        final ProducerRecord<String, byte[]> out =
                new ProducerRecord<>(topic, null, record.id(), record.toJsonBytes(), headersOf(record.metadata()));

        boolean permitHeld = false;
        final long startNs = System.nanoTime();
        try {
            if (inflightSemaphore != null) {
                inflightSemaphore.acquire();
                permitHeld = true;
                inflightNow.increment();
            }

            if (syncSend) {
                producer.send(out).get();
                markOk(startNs);
            } else {
                producer.send(out, (metadata, exception) -> {
                    try {
                        if (exception == null) {
                            markOk(startNs);
                        } else {
                            markFail(startNs, exception);
                        }
                    } finally {
                        release();
                    }
                });
                // the callback owns the permit now
                permitHeld = false;
            }
        } catch (Exception e) {
            markFail(startNs, e);
            throw e;
        } finally {
            if (permitHeld) release();
        }
    }

    static RecordHeaders headersOf(Map<String, String> metadata) {
        final RecordHeaders headers = new RecordHeaders();
        for (Map.Entry<String, String> e : metadata.entrySet()) {
            headers.add(e.getKey(), e.getValue().getBytes(StandardCharsets.UTF_8));
        }
        return headers;
    }

    private void release() {
        if (inflightSemaphore != null) {
            inflightNow.decrement();
            inflightSemaphore.release();
        }
    }

    @Override
    public void flush() {
        producer.flush();
    }

    @Override
    public String id() {
        return "kafka:" + topic;
    }

    private void markOk(long startNanos) {
        sentOk.increment();
        if (okCounter != null) okCounter.increment();
        if (sendLatencyTimer != null) sendLatencyTimer.record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
    }

    private void markFail(long startNanos, Throwable exception) {
        sentFail.increment();
        if (failCounter != null) failCounter.increment();
        if (sendLatencyTimer != null) sendLatencyTimer.record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
        logRateLimited("Kafka write failed topic=" + topic, exception);
    }

    private void logRateLimited(String context, Throwable ex) {
        final long now = System.currentTimeMillis();
        final long last = lastErrorLogMs.get();

        if (now - last >= errorLogIntervalMs && lastErrorLogMs.compareAndSet(last, now)) {
            final long suppressed = suppressedErrorLogs.sumThenReset();
            if (suppressed > 0) {
                log.error("{} (suppressed {} similar errors): {}", context, suppressed, ex.getMessage());
            } else {
                log.error("{}: {}", context, ex.getMessage());
            }
        } else {
            suppressedErrorLogs.increment();
        }
    }

    public long sentOkTotal() { return sentOk.sum(); }
    public long sentFailTotal() { return sentFail.sum(); }
    public long inFlightTotal() { return inflightNow.sum(); }

    @Override
    public void close() {
        log.info("Closing KafkaEventSink (topic={})...", topic);
        try {
            producer.flush();
            producer.close(Duration.ofSeconds(5));
        } catch (Exception e) {
            log.warn("KafkaEventSink close failed", e);
        }
    }
}
