package com.questrail.evgen.generator;

import com.questrail.evgen.config.GeneratorConfig;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * InteractionListGeneratorRegistry
 * -----------------------------------------------------------------------------
 * Name-keyed construction point for {@link InteractionListGenerator}s.
 *
 * <p>Configuration refers to generators by name; this registry turns a name
 * plus a {@link GeneratorConfig} into an instance, so calling code never binds
 * to a concrete generator class.</p>
 */
public final class InteractionListGeneratorRegistry
{
    /** Resonant single-pion production. */
    public static final String RESONANT_SINGLE_PION = "resonant-single-pion";

    /** Diffractive scattering (not modeled). */
    public static final String DIFFRACTIVE = "diffractive";

    private final Map<String, Function<GeneratorConfig, InteractionListGenerator>> factories;

    private InteractionListGeneratorRegistry(Map<String, Function<GeneratorConfig, InteractionListGenerator>> factories) {
        this.factories = Collections.unmodifiableMap(new LinkedHashMap<>(factories));
    }

    /**
     * Creates the generator registered under {@code name}.
     *
     * @throws IllegalArgumentException if no generator is registered under that name
     */
    public InteractionListGenerator create(String name, GeneratorConfig config) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(config, "config");
        Function<GeneratorConfig, InteractionListGenerator> factory = factories.get(name);
        if (factory == null) {
            throw new IllegalArgumentException("Unknown interaction list generator: " + name);
        }
        return factory.apply(config);
    }

    public Set<String> names() {
        return factories.keySet();
    }

    public static InteractionListGeneratorRegistry defaults() {
        return builder()
                .register(RESONANT_SINGLE_PION, ResonantSinglePionListGenerator::new)
                .register(DIFFRACTIVE, config -> new DiffractiveListGenerator())
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, Function<GeneratorConfig, InteractionListGenerator>> factories = new LinkedHashMap<>();

        public Builder register(String name, Function<GeneratorConfig, InteractionListGenerator> factory) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(factory, "factory");
            if (factories.putIfAbsent(name, factory) != null) {
                throw new IllegalArgumentException("Duplicate generator name: " + name);
            }
            return this;
        }

        public InteractionListGeneratorRegistry build() {
            return new InteractionListGeneratorRegistry(factories);
        }
    }
}
