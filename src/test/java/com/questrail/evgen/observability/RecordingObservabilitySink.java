package com.questrail.evgen.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements GenerationObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onEnumeration(EnumerationObservabilityEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onSelection(SelectionObservabilityEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(GenerationErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<EnumerationObservabilityEvent> getEnumerations() {
        return ofType(EnumerationObservabilityEvent.class);
    }

    public synchronized List<SelectionObservabilityEvent> getSelections() {
        return ofType(SelectionObservabilityEvent.class);
    }

    public synchronized List<GenerationErrorEvent> getErrors() {
        return ofType(GenerationErrorEvent.class);
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }

    private <T> List<T> ofType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }
}
