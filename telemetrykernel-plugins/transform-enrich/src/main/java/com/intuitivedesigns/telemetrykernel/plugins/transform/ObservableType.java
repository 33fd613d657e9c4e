/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.plugins.transform;

import java.util.Arrays;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Indicator kinds carried in an observable's {@code type_id}.
 * Only the kinds threat-intel feeds actually index are looked up by default.
 */
public enum ObservableType {

    HOSTNAME(1, true),
    IP_ADDRESS(2, true),
    USER_NAME(3, false),
    DOMAIN(4, true),
    EMAIL_ADDRESS(5, true),
    FILE_NAME(7, true),
    FILE_HASH(8, true),
    PROCESS_NAME(9, false),
    PORT(14, false),
    USER_AGENT(22, false),
    URL(23, true);

    private final int typeId;
    private final boolean threatIntelEligible;

    ObservableType(int typeId, boolean threatIntelEligible) {
        this.typeId = typeId;
        this.threatIntelEligible = threatIntelEligible;
    }

    public int typeId() {
        return typeId;
    }

    public boolean isThreatIntelEligible() {
        return threatIntelEligible;
    }

    public static Optional<ObservableType> fromTypeId(long typeId) {
        for (ObservableType t : values()) {
            if (t.typeId == typeId) return Optional.of(t);
        }
        return Optional.empty();
    }

    /** Default eligible ids: {1, 2, 4, 5, 7, 8, 23}. */
    public static Set<Long> defaultEligibleIds() {
        return Arrays.stream(values())
                .filter(ObservableType::isThreatIntelEligible)
                .map(t -> (long) t.typeId)
                .collect(Collectors.toUnmodifiableSet());
    }
}
