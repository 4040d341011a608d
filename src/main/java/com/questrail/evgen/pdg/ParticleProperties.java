package com.questrail.evgen.pdg;

import java.util.Objects;

/**
 * Static properties of a single particle or nucleus.
 *
 * @param code   PDG identity code
 * @param name   human-readable name, e.g. {@code "proton"} or {@code "C12"}
 * @param mass   rest mass in GeV
 * @param charge electric charge in units of +e
 */
public record ParticleProperties(
        int code,
        String name,
        double mass,
        double charge
) {
    public ParticleProperties {
        Objects.requireNonNull(name, "name");
        if (mass < 0) {
            throw new IllegalArgumentException("mass must be non-negative (was " + mass + ")");
        }
    }
}
