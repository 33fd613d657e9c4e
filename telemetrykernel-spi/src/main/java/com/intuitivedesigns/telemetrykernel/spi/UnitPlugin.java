/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.spi;

import com.intuitivedesigns.telemetrykernel.core.TransformUnit;

/**
 * SPI Definition for chain units.
 * The id is what {@code chain.units} lists and also names the unit's config prefix.
 */
public interface UnitPlugin extends PipelinePlugin<TransformUnit> {

    String id(); // e.g. "ASSET_ENRICHER", "CATEGORY_FILTER", "PAYLOAD_TAGGER"

    @Override
    default PluginKind kind() {
        return PluginKind.UNIT;
    }

    @Override
    TransformUnit create(PluginContext context) throws Exception;
}
