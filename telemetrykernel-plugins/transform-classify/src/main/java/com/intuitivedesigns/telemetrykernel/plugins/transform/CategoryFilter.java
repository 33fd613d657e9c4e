/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.plugins.transform;

import com.intuitivedesigns.telemetrykernel.core.EventRecord;
import com.intuitivedesigns.telemetrykernel.core.FieldLookup;
import com.intuitivedesigns.telemetrykernel.core.FieldPath;
import com.intuitivedesigns.telemetrykernel.core.Outcome;
import com.intuitivedesigns.telemetrykernel.core.TransformUnit;
import com.intuitivedesigns.telemetrykernel.metrics.MetricsRuntime;

import java.util.Collection;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.LongAdder;

/**
 * Keeps or drops a record on one string field.
 *
 * <ol>
 * <li>field absent or not a string: keep</li>
 * <li>include list set and value not in it: drop (exclude is not consulted)</li>
 * <li>exclude list set and value in it: drop</li>
 * <li>otherwise keep</li>
 * </ol>
 */
public final class CategoryFilter implements TransformUnit {

    private final String name;
    private final FieldPath field;
    private final Set<String> include;
    private final Set<String> exclude;
    private final MetricsRuntime metrics;

    private final LongAdder passed = new LongAdder();
    private final LongAdder dropped = new LongAdder();

    public CategoryFilter(String name,
                          FieldPath field,
                          Collection<String> include,
                          Collection<String> exclude,
                          MetricsRuntime metrics) {
        this.name = Objects.requireNonNull(name, "name");
        this.field = Objects.requireNonNull(field, "field");
        this.include = Set.copyOf(include);
        this.exclude = Set.copyOf(exclude);
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Outcome apply(EventRecord record) {
        final FieldLookup<String> value = field.resolve(record.body()).flatMap(FieldLookup::ofText);
        if (!value.isPresent()) {
            return keep();
        }

        final String v = value.get();
        if (!include.isEmpty() && !include.contains(v)) {
            return drop(field + " '" + v + "' not in include list");
        }
        if (!exclude.isEmpty() && exclude.contains(v)) {
            return drop(field + " '" + v + "' is excluded");
        }
        return keep();
    }

    private Outcome keep() {
        passed.increment();
        return Outcome.proceed();
    }

    private Outcome drop(String reason) {
        dropped.increment();
        metrics.counter("filter.dropped", 1.0, "unit", name);
        return Outcome.drop(reason);
    }

    public Set<String> include() {
        return include;
    }

    public Set<String> exclude() {
        return exclude;
    }

    public long passedTotal() {
        return passed.sum();
    }

    public long droppedTotal() {
        return dropped.sum();
    }
}
