/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.plugins;

import com.intuitivedesigns.telemetrykernel.config.PipelineConfig;
import com.intuitivedesigns.telemetrykernel.core.FieldPath;
import com.intuitivedesigns.telemetrykernel.core.TransformUnit;
import com.intuitivedesigns.telemetrykernel.plugins.transform.CategoryFilter;
import com.intuitivedesigns.telemetrykernel.spi.PluginContext;
import com.intuitivedesigns.telemetrykernel.spi.PluginIds;
import com.intuitivedesigns.telemetrykernel.spi.UnitPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Allow/deny filter on one string field.
 * <pre>
 * unit.category_filter.field=category
 * unit.category_filter.include=security,compliance
 * unit.category_filter.exclude=test
 * </pre>
 */
public final class CategoryFilterPlugin implements UnitPlugin {

    private static final Logger log = LoggerFactory.getLogger(CategoryFilterPlugin.class);

    public static final String ID = "CATEGORY_FILTER";

    private static final String PREFIX = PluginIds.unitPrefix(ID);

    // Config keys
    public static final String KEY_FIELD = PREFIX + "field";
    public static final String KEY_INCLUDE = PREFIX + "include";
    public static final String KEY_EXCLUDE = PREFIX + "exclude";

    // Defaults
    public static final String DEFAULT_FIELD = "category";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public TransformUnit create(PluginContext context) {
        final PipelineConfig config = context.config();

        final FieldPath field = FieldPath.parse(config.getString(KEY_FIELD, DEFAULT_FIELD));
        if (field.isEmpty()) {
            throw new IllegalArgumentException("Config '" + KEY_FIELD + "' names no field");
        }
        final List<String> include = config.getList(KEY_INCLUDE, List.of());
        final List<String> exclude = config.getList(KEY_EXCLUDE, List.of());

        log.info("Initialized {} (field={}, include={}, exclude={})", ID, field, include, exclude);
        return new CategoryFilter("category_filter", field, include, exclude, context.metrics());
    }
}
