package com.questrail.evgen.observability;

/**
 * Main interface for receiving event-generation observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface GenerationObservabilitySink {
    /**
     * Called once per generator per initial state, whatever the outcome.
     * @param event the enumeration outcome
     */
    void onEnumeration(EnumerationObservabilityEvent event);

    /**
     * Called when an interaction has been selected into an event record.
     * @param event the selection details
     */
    void onSelection(SelectionObservabilityEvent event);

    /**
     * Called when an initial state cannot produce an event.
     * @param event the error event
     */
    void onError(GenerationErrorEvent event);
}
