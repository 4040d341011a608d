package com.questrail.evgen.observability;

/**
 * No-op implementation of GenerationObservabilitySink.
 */
public final class NullObservabilitySink implements GenerationObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onEnumeration(EnumerationObservabilityEvent event) {}

    @Override
    public void onSelection(SelectionObservabilityEvent event) {}

    @Override
    public void onError(GenerationErrorEvent event) {}
}
