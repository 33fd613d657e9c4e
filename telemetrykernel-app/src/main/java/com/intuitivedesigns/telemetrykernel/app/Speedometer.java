/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.app;

import com.intuitivedesigns.telemetrykernel.core.ChainOrchestrator;
import com.intuitivedesigns.telemetrykernel.output.KafkaEventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.function.LongSupplier;

/**
 * Periodic throughput line: events/s through the chain, dead letters in the window,
 * and Kafka ack/fail rates when the primary sink is Kafka.
 */
final class Speedometer implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(Speedometer.class);

    private final ChainOrchestrator orchestrator;
    private final KafkaEventSink kafkaSink;
    private final LongSupplier clockNs;

    private long windowStartNs;
    private long processedMark;
    private long dlqMark;
    private long ackedMark;
    private long failedMark;

    Speedometer(ChainOrchestrator orchestrator, KafkaEventSink kafkaSink, LongSupplier clockNs) {
        this.orchestrator = orchestrator;
        this.kafkaSink = kafkaSink;
        this.clockNs = clockNs;
        this.windowStartNs = clockNs.getAsLong();
    }

    @Override
    public void run() {
        try {
            final String line = sample();
            if (line != null) log.info(line);
        } catch (RuntimeException e) {
            log.warn("Speedometer error", e);
        }
    }

    /**
     * Closes the current window and formats it; {@code null} if no time has passed.
     */
    String sample() {
        final long nowNs = clockNs.getAsLong();
        final long elapsedNs = nowNs - windowStartNs;
        if (elapsedNs <= 0) return null;
        final double seconds = elapsedNs / 1_000_000_000.0;

        final long processed = orchestrator.processedTotal();
        final long dlq = orchestrator.deadLetteredTotal();

        final StringBuilder line = new StringBuilder(String.format(Locale.US,
                "WINDOW %.0fs | CHAIN: %,.1f eps | DLQ: %,d",
                seconds, (processed - processedMark) / seconds, dlq - dlqMark));

        if (kafkaSink != null) {
            final long acked = kafkaSink.sentOkTotal();
            final long failed = kafkaSink.sentFailTotal();
            line.append(String.format(Locale.US, " | ACKED: %,.1f eps | FAIL: %,.1f eps | INFLIGHT: %,d",
                    (acked - ackedMark) / seconds, (failed - failedMark) / seconds, kafkaSink.inFlightTotal()));
            ackedMark = acked;
            failedMark = failed;
        }

        processedMark = processed;
        dlqMark = dlq;
        windowStartNs = nowNs;
        return line.toString();
    }
}
