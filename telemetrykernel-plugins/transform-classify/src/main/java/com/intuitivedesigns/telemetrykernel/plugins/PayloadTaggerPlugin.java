/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.plugins;

import com.intuitivedesigns.telemetrykernel.config.PipelineConfig;
import com.intuitivedesigns.telemetrykernel.core.TransformUnit;
import com.intuitivedesigns.telemetrykernel.plugins.transform.PayloadTagger;
import com.intuitivedesigns.telemetrykernel.spi.PluginContext;
import com.intuitivedesigns.telemetrykernel.spi.PluginIds;
import com.intuitivedesigns.telemetrykernel.spi.UnitPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

public final class PayloadTaggerPlugin implements UnitPlugin {

    private static final Logger log = LoggerFactory.getLogger(PayloadTaggerPlugin.class);

    public static final String ID = "PAYLOAD_TAGGER";

    private static final String PREFIX = PluginIds.unitPrefix(ID);

    // Config keys
    public static final String KEY_TAG_FIELDS = PREFIX + "tag.fields";
    public static final String KEY_ADD_TIMESTAMP_TAG = PREFIX + "add.timestamp.tag";
    public static final String KEY_ADD_SOURCE_TAG = PREFIX + "add.source.tag";
    public static final String KEY_SOURCE_NAME = PREFIX + "source.name";

    // Defaults
    public static final List<String> DEFAULT_TAG_FIELDS = List.of("class_uid", "severity_id", "category_uid");
    public static final boolean DEFAULT_ADD_TIMESTAMP_TAG = true;
    public static final boolean DEFAULT_ADD_SOURCE_TAG = false;
    public static final String DEFAULT_SOURCE_NAME = "http_receiver";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public TransformUnit create(PluginContext context) {
        final PipelineConfig config = context.config();

        final List<String> fields = config.getList(KEY_TAG_FIELDS, DEFAULT_TAG_FIELDS);
        final boolean addTimestamp = config.getBoolean(KEY_ADD_TIMESTAMP_TAG, DEFAULT_ADD_TIMESTAMP_TAG);
        final boolean addSource = config.getBoolean(KEY_ADD_SOURCE_TAG, DEFAULT_ADD_SOURCE_TAG);
        final String sourceName = config.getString(KEY_SOURCE_NAME, DEFAULT_SOURCE_NAME);

        log.info("Initialized {} (fields={}, timestampTag={}, sourceTag={})", ID, fields, addTimestamp, addSource);
        return new PayloadTagger("payload_tagger", fields, addTimestamp, addSource, sourceName);
    }
}
