package com.questrail.evgen.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of GenerationObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jGenerationObservabilitySink implements GenerationObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jGenerationObservabilitySink.class);

    @Override
    public void onEnumeration(EnumerationObservabilityEvent event) {
        switch (event.outcome()) {
            case CHANNELS -> log.debug("{}: {} candidate(s) for {}",
                event.generator(), event.candidates(), event.initialState());
            case NOT_MODELED -> log.debug("{}: family not modeled, skipping {}",
                event.generator(), event.initialState());
            case NONE_VIABLE -> log.debug("{}: no viable channel for {}",
                event.generator(), event.initialState());
        }
    }

    @Override
    public void onSelection(SelectionObservabilityEvent event) {
        log.info("Selected {} of {} candidate(s) for {}",
            event.selected(), event.candidates(), event.initialState());
    }

    @Override
    public void onError(GenerationErrorEvent event) {
        log.error("Event generation error: {}", event.message(), event.cause());
    }
}
