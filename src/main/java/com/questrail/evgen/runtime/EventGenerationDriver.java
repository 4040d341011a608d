package com.questrail.evgen.runtime;

import com.questrail.evgen.config.GeneratorConfig;
import com.questrail.evgen.generator.EnumerationResult;
import com.questrail.evgen.generator.InteractionList;
import com.questrail.evgen.generator.InteractionListGenerator;
import com.questrail.evgen.generator.InteractionListGeneratorRegistry;
import com.questrail.evgen.interaction.InitialState;
import com.questrail.evgen.interaction.LorentzVector;
import com.questrail.evgen.observability.EnumerationObservabilityEvent;
import com.questrail.evgen.observability.GenerationErrorEvent;
import com.questrail.evgen.observability.GenerationObservabilitySink;
import com.questrail.evgen.observability.NullObservabilitySink;
import com.questrail.evgen.observability.SelectionObservabilityEvent;
import com.questrail.evgen.selector.EventRecord;
import com.questrail.evgen.selector.InteractionSelector;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * EventGenerationDriver
 * =============================================================================
 * Composition root for one step of event generation: every configured
 * {@link InteractionListGenerator} enumerates the initial state, the viable
 * candidate lists are merged in generator order, and the
 * {@link InteractionSelector} turns the merged list into an {@link EventRecord}.
 *
 * <h2>Failure handling</h2>
 * <ul>
 *   <li>{@link EnumerationResult.NotModeled}: skipped, reported as an
 *       enumeration event only</li>
 *   <li>{@link EnumerationResult.NoneViable}: skipped and reported as an error</li>
 *   <li>No candidates overall, or selection failure: {@link Optional#empty()};
 *       the outer event loop skips this initial state and carries on</li>
 * </ul>
 *
 * The driver holds no per-event state; it is as thread-safe as its generators,
 * selector and sink.
 */
public final class EventGenerationDriver {
    private final Map<String, InteractionListGenerator> generators;
    private final InteractionSelector selector;
    private final GenerationObservabilitySink observabilitySink;
    private final Clock clock;

    private EventGenerationDriver(
            Map<String, InteractionListGenerator> generators,
            InteractionSelector selector,
            GenerationObservabilitySink observabilitySink,
            Clock clock) {
        this.generators = Collections.unmodifiableMap(new LinkedHashMap<>(generators));
        this.selector = selector;
        this.observabilitySink = observabilitySink;
        this.clock = clock;
    }

    /**
     * Runs every generator over {@code initialState} and merges the viable lists.
     *
     * @return the merged candidates, possibly empty
     */
    public InteractionList enumerate(InitialState initialState) {
        Objects.requireNonNull(initialState, "initialState");
        InteractionList merged = new InteractionList();

        for (Map.Entry<String, InteractionListGenerator> entry : generators.entrySet()) {
            String name = entry.getKey();
            EnumerationResult result = entry.getValue().createInteractionList(initialState);

            if (result instanceof EnumerationResult.Channels channels) {
                report(name, initialState, EnumerationObservabilityEvent.Outcome.CHANNELS, channels.list().size());
                merged.addAll(channels.list());
            } else if (result instanceof EnumerationResult.NotModeled) {
                report(name, initialState, EnumerationObservabilityEvent.Outcome.NOT_MODELED, 0);
            } else if (result instanceof EnumerationResult.NoneViable none) {
                report(name, initialState, EnumerationObservabilityEvent.Outcome.NONE_VIABLE, 0);
                observabilitySink.onError(new GenerationErrorEvent(
                        clock.instant(),
                        name + ": no viable channel (" + none.reason() + ") for " + none.initialState(),
                        null));
            }
        }
        return merged;
    }

    /**
     * Enumerates, then selects one interaction carrying {@code probeP4}.
     *
     * @return the seeded event record, or empty if this initial state yields no event
     */
    public Optional<EventRecord> generate(InitialState initialState, LorentzVector probeP4) {
        Objects.requireNonNull(probeP4, "probeP4");
        InteractionList candidates = enumerate(initialState);
        if (candidates.isEmpty()) {
            return Optional.empty();
        }

        Optional<EventRecord> eventRecord = selector.selectInteraction(candidates, probeP4);
        if (eventRecord.isEmpty()) {
            observabilitySink.onError(new GenerationErrorEvent(
                    clock.instant(),
                    "Selection failed for " + initialState.asString(),
                    null));
            return Optional.empty();
        }

        eventRecord.flatMap(EventRecord::summary).ifPresent(summary ->
                observabilitySink.onSelection(new SelectionObservabilityEvent(
                        clock.instant(),
                        initialState.asString(),
                        candidates.size(),
                        summary.asString())));
        return eventRecord;
    }

    private void report(String generator,
                        InitialState initialState,
                        EnumerationObservabilityEvent.Outcome outcome,
                        int candidates) {
        observabilitySink.onEnumeration(new EnumerationObservabilityEvent(
                clock.instant(), generator, initialState.asString(), outcome, candidates));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, InteractionListGenerator> generators = new LinkedHashMap<>();
        private InteractionListGeneratorRegistry registry = InteractionListGeneratorRegistry.defaults();
        private InteractionSelector selector;
        private GenerationObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private Clock clock = Clock.systemUTC();

        public Builder withRegistry(InteractionListGeneratorRegistry registry) {
            this.registry = Objects.requireNonNull(registry, "registry");
            return this;
        }

        /**
         * Adds a generator built from the registry under {@code name}.
         */
        public Builder addGenerator(String name, GeneratorConfig config) {
            return addGenerator(name, registry.create(name, config));
        }

        public Builder addGenerator(String name, InteractionListGenerator generator) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(generator, "generator");
            if (generators.putIfAbsent(name, generator) != null) {
                throw new IllegalArgumentException("Duplicate generator name: " + name);
            }
            return this;
        }

        public Builder withSelector(InteractionSelector selector) {
            this.selector = selector;
            return this;
        }

        public Builder withObservabilitySink(GenerationObservabilitySink observabilitySink) {
            this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
            return this;
        }

        public Builder withClock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public EventGenerationDriver build() {
            Objects.requireNonNull(selector, "selector");
            if (generators.isEmpty()) {
                throw new IllegalStateException("At least one generator required");
            }
            return new EventGenerationDriver(generators, selector, observabilitySink, clock);
        }
    }
}
