/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.sources.http;

import java.time.Instant;

/**
 * @param accepted number of events enqueued from the submission
 * @param received when the submission was accepted
 */
public record SubmissionResult(int accepted, Instant received) {
}
