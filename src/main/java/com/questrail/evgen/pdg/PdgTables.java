package com.questrail.evgen.pdg;

import java.util.Objects;

/**
 * The two read-only lookup services a {@code Target} consults: particle
 * properties and isotope membership.
 * <p>
 * Constructed once at process start and handed to every component that needs
 * it, so tests can substitute fake tables.
 */
public record PdgTables(
        ParticleTable particles,
        IsotopeTable isotopes
) {
    public PdgTables {
        Objects.requireNonNull(particles, "particles");
        Objects.requireNonNull(isotopes, "isotopes");
    }

    public static PdgTables of(PdgLibrary library) {
        Objects.requireNonNull(library, "library");
        return new PdgTables(library, library);
    }

    public static PdgTables defaults() {
        return of(PdgLibrary.defaults());
    }
}
