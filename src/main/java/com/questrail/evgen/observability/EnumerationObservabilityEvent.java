package com.questrail.evgen.observability;

import java.time.Instant;

/**
 * Record describing the outcome of one interaction list generator call.
 */
public record EnumerationObservabilityEvent(
    Instant timestamp,
    String generator,
    String initialState,
    Outcome outcome,
    int candidates
) {
    public enum Outcome {
        CHANNELS,
        NOT_MODELED,
        NONE_VIABLE
    }
}
