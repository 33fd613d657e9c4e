/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.core;

import com.intuitivedesigns.telemetrykernel.metrics.MetricsRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.LongAdder;

/**
 * Fixed-order sequence of {@link TransformUnit}s.
 *
 * <p>{@link #process(EventRecord)} walks the units once. CONTINUE moves to the next unit,
 * DROP and FAIL end the walk. A unit that throws is treated as FAIL naming that unit.</p>
 *
 * <p>Safe to call from many workers at once, each with its own record.</p>
 */
public final class ProcessorChain implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProcessorChain.class);

    private final List<TransformUnit> units;
    private final MetricsRuntime metrics;

    private final LongAdder forwarded = new LongAdder();
    private final LongAdder dropped = new LongAdder();
    private final LongAdder failed = new LongAdder();

    public ProcessorChain(List<TransformUnit> units, MetricsRuntime metrics) {
        this.units = List.copyOf(Objects.requireNonNull(units, "units"));
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Initializes units in chain order. A failing unit aborts startup.
     */
    public void init() throws Exception {
        for (TransformUnit unit : units) {
            unit.init();
        }
        log.info("Processor chain ready: {}", unitNames());
    }

    public ChainResult process(EventRecord record) {
        Objects.requireNonNull(record, "record");

        for (TransformUnit unit : units) {
            final Outcome outcome = applyUnit(unit, record);

            switch (outcome.kind()) {
                case CONTINUE -> {
                    // next unit
                }
                case DROP -> {
                    dropped.increment();
                    metrics.counter("chain.dropped", 1.0, "unit", unit.name());
                    return ChainResult.dropped(record, unit.name(), outcome.reason());
                }
                case FAIL -> {
                    failed.increment();
                    metrics.counter("chain.failed", 1.0, "unit", unit.name());
                    return ChainResult.failed(record, unit.name(), outcome.error());
                }
            }
        }

        forwarded.increment();
        metrics.counter("chain.forwarded");
        return ChainResult.forwarded(record);
    }

    private Outcome applyUnit(TransformUnit unit, EventRecord record) {
        final long startNs = System.nanoTime();
        try {
            final Outcome outcome = unit.apply(record);
            if (outcome == null) {
                return Outcome.fail(new IllegalStateException("unit " + unit.name() + " returned no outcome"));
            }
            return outcome;
        } catch (RecordFormatException e) {
            return Outcome.fail(e);
        } catch (Exception e) {
            log.debug("Unit {} threw for record {}", unit.name(), record.id(), e);
            return Outcome.fail(e);
        } finally {
            metrics.timer("chain.unit.latency", (System.nanoTime() - startNs) / 1_000_000L, "unit", unit.name());
        }
    }

    public List<String> unitNames() {
        return units.stream().map(TransformUnit::name).toList();
    }

    public long forwardedTotal() {
        return forwarded.sum();
    }

    public long droppedTotal() {
        return dropped.sum();
    }

    public long failedTotal() {
        return failed.sum();
    }

    /**
     * Closes units in reverse order. Errors are logged so every unit gets closed.
     */
    @Override
    public void close() {
        for (int i = units.size() - 1; i >= 0; i--) {
            final TransformUnit unit = units.get(i);
            try {
                unit.close();
            } catch (Exception e) {
                log.warn("Error closing unit {}", unit.name(), e);
            }
        }
    }
}
