/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.core;

import com.intuitivedesigns.telemetrykernel.metrics.NoopMetricsRuntime;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ChainOrchestratorTest {

    private static final class QueueSource implements EventSource {
        final BlockingQueue<EventRecord> queue = new LinkedBlockingQueue<>();
        volatile boolean disconnected;

        @Override
        public void connect() {
        }

        @Override
        public void disconnect() {
            disconnected = true;
        }

        @Override
        public PollResult poll(Duration timeout) {
            try {
                EventRecord r = queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
                return (r == null) ? PollResult.empty() : PollResult.event(r);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return PollResult.cancelled();
            }
        }
    }

    private static final class CollectingSink implements EventSink {
        final List<EventRecord> written = new CopyOnWriteArrayList<>();
        volatile boolean failWrites;
        volatile boolean closed;

        @Override
        public void write(EventRecord record) throws Exception {
            if (failWrites) throw new Exception("broker unavailable");
            written.add(record);
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    private static final TransformUnit REJECT_TEST = new TransformUnit() {
        @Override
        public String name() {
            return "category_filter";
        }

        @Override
        public Outcome apply(EventRecord record) {
            return "test".equals(record.text("category").orElse(null)) ? Outcome.drop("excluded") : Outcome.proceed();
        }
    };

    private static final TransformUnit REQUIRE_OBJECT = new TransformUnit() {
        @Override
        public String name() {
            return "payload_tagger";
        }

        @Override
        public Outcome apply(EventRecord record) {
            record.body();
            return Outcome.proceed();
        }
    };

    private static EventRecord record(String json) {
        return EventRecord.fromBytes(json.getBytes(StandardCharsets.UTF_8));
    }

    private static ChainOrchestrator orchestrator(EventSource source, EventSink sink, EventSink dlq, FailurePolicy policy) {
        ProcessorChain chain = new ProcessorChain(List.of(REJECT_TEST, REQUIRE_OBJECT), NoopMetricsRuntime.INSTANCE);
        return new ChainOrchestrator(source, chain, sink, dlq, policy, 2,
                Duration.ofMillis(50), Duration.ofSeconds(2), NoopMetricsRuntime.INSTANCE);
    }

    @Test
    void routesForwardedDroppedAndFailedRecords() {
        CollectingSink sink = new CollectingSink();
        CollectingSink dlq = new CollectingSink();
        ChainOrchestrator orchestrator = orchestrator(new QueueSource(), sink, dlq, FailurePolicy.DEAD_LETTER);

        orchestrator.handle(record("{\"category\":\"security\"}"));
        orchestrator.handle(record("{\"category\":\"test\"}"));
        orchestrator.handle(record("\"just a string\""));

        assertEquals(1, sink.written.size());
        assertEquals(1, dlq.written.size());

        EventRecord dead = dlq.written.get(0);
        assertEquals("category_filter", dead.metadata(ChainOrchestrator.META_FAILED_UNIT).orElseThrow());
        assertTrue(dead.metadata(ChainOrchestrator.META_ERROR).orElseThrow().contains("not a JSON object"));
    }

    @Test
    void logAndDropPolicySkipsDeadLetter() {
        CollectingSink sink = new CollectingSink();
        CollectingSink dlq = new CollectingSink();
        ChainOrchestrator orchestrator = orchestrator(new QueueSource(), sink, dlq, FailurePolicy.LOG_AND_DROP);

        orchestrator.handle(record("[]"));

        assertTrue(sink.written.isEmpty());
        assertTrue(dlq.written.isEmpty());
    }

    @Test
    void sinkFailureGoesToDeadLetter() {
        CollectingSink sink = new CollectingSink();
        sink.failWrites = true;
        CollectingSink dlq = new CollectingSink();
        ChainOrchestrator orchestrator = orchestrator(new QueueSource(), sink, dlq, FailurePolicy.DEAD_LETTER);

        orchestrator.handle(record("{\"category\":\"security\"}"));

        assertEquals(1, dlq.written.size());
        assertEquals("sink:" + sink.id(), dlq.written.get(0).metadata(ChainOrchestrator.META_FAILED_UNIT).orElseThrow());
        assertEquals(1, orchestrator.deadLetteredTotal());
    }

    @Test
    void workersDrainSourceAndStopClosesEverything() throws Exception {
        QueueSource source = new QueueSource();
        CollectingSink sink = new CollectingSink();
        CollectingSink dlq = new CollectingSink();
        ChainOrchestrator orchestrator = orchestrator(source, sink, dlq, FailurePolicy.DEAD_LETTER);

        for (int i = 0; i < 20; i++) {
            source.queue.add(record("{\"category\":\"security\",\"n\":" + i + "}"));
        }

        orchestrator.start();
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (sink.written.size() < 20 && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        orchestrator.stop();

        assertEquals(20, sink.written.size());
        assertTrue(source.disconnected);
        assertTrue(sink.closed);
        assertTrue(dlq.closed);
        assertFalse(orchestrator.isRunning());
    }

    @Test
    void rejectsNonPositiveParallelism() {
        ProcessorChain chain = new ProcessorChain(List.of(), NoopMetricsRuntime.INSTANCE);
        assertThrows(IllegalArgumentException.class, () -> new ChainOrchestrator(new QueueSource(), chain,
                new CollectingSink(), new CollectingSink(), FailurePolicy.DEAD_LETTER, 0,
                Duration.ofMillis(10), Duration.ofSeconds(1), NoopMetricsRuntime.INSTANCE));
    }

    @Test
    void parsesFailurePolicy() {
        assertEquals(FailurePolicy.DEAD_LETTER, FailurePolicy.parse(null));
        assertEquals(FailurePolicy.LOG_AND_DROP, FailurePolicy.parse(" log_and_drop "));
        assertThrows(IllegalArgumentException.class, () -> FailurePolicy.parse("retry"));
    }
}
