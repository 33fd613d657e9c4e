/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.plugins.transform;

import java.util.Optional;

/**
 * Fixed code-to-label tables for the three OCSF classifiers.
 */
public final class OcsfLabels {

    /**
     * @param category broad event family
     * @param type     finer kind; {@code null} where the family has none
     */
    public record ClassLabel(String category, String type) {}

    public record SeverityLabel(String severity, String priority) {}

    private OcsfLabels() {}

    public static Optional<ClassLabel> forClass(long classUid) {
        if (classUid == 2004) return Optional.of(new ClassLabel("detection", "alert"));
        if (classUid == 5001) return Optional.of(new ClassLabel("asset", "inventory"));
        if (classUid >= 4001 && classUid <= 4003) return Optional.of(new ClassLabel("network", "activity"));
        if (classUid >= 3001 && classUid <= 3002) return Optional.of(new ClassLabel("authentication", null));
        if (classUid >= 1001 && classUid <= 1003) return Optional.of(new ClassLabel("system", "process"));
        return Optional.empty();
    }

    public static Optional<SeverityLabel> forSeverity(long severityId) {
        if (severityId < 1 || severityId > 6) return Optional.empty();
        return switch ((int) severityId) {
            case 1 -> Optional.of(new SeverityLabel("informational", "low"));
            case 2 -> Optional.of(new SeverityLabel("low", "low"));
            case 3 -> Optional.of(new SeverityLabel("medium", "medium"));
            case 4 -> Optional.of(new SeverityLabel("high", "high"));
            case 5, 6 -> Optional.of(new SeverityLabel("critical", "critical"));
            default -> Optional.empty();
        };
    }

    /** Domain label for a {@code category_uid}. */
    public static Optional<String> forCategory(long categoryUid) {
        if (categoryUid < 1 || categoryUid > 5) return Optional.empty();
        return switch ((int) categoryUid) {
            case 1 -> Optional.of("system");
            case 2 -> Optional.of("findings");
            case 3 -> Optional.of("identity");
            case 4 -> Optional.of("network");
            case 5 -> Optional.of("discovery");
            default -> Optional.empty();
        };
    }
}
