package com.questrail.evgen.observability;

import java.time.Instant;

/**
 * Record describing a successful interaction selection.
 */
public record SelectionObservabilityEvent(
    Instant timestamp,
    String initialState,
    int candidates,
    String selected
) {
}
