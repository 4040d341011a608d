package com.questrail.evgen.observability;

import java.time.Instant;

/**
 * Record representing an initial state that could not be turned into an event.
 */
public record GenerationErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
