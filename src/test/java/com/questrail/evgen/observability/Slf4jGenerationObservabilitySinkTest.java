package com.questrail.evgen.observability;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;

class Slf4jGenerationObservabilitySinkTest {

    private final Slf4jGenerationObservabilitySink sink = new Slf4jGenerationObservabilitySink();

    @Test
    void acceptsEveryOutcome() {
        Instant now = Instant.parse("2024-01-01T00:00:00Z");
        for (EnumerationObservabilityEvent.Outcome outcome : EnumerationObservabilityEvent.Outcome.values()) {
            assertDoesNotThrow(() -> sink.onEnumeration(
                new EnumerationObservabilityEvent(now, "resonant-single-pion", "nu:14;tgt:1000060120", outcome, 0)));
        }
        assertDoesNotThrow(() -> sink.onSelection(
            new SelectionObservabilityEvent(now, "nu:14;tgt:1000060120", 3, "selected")));
        assertDoesNotThrow(() -> sink.onError(new GenerationErrorEvent(now, "no viable channel", null)));
    }
}
