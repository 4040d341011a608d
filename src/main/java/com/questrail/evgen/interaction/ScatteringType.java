package com.questrail.evgen.interaction;

/**
 * Scattering mechanism of an interaction.
 */
public enum ScatteringType {
    UNKNOWN,
    QUASI_ELASTIC,
    DEEP_INELASTIC,
    RESONANT,
    COHERENT,
    DIFFRACTIVE,
    INVERSE_MUON_DECAY,
    NUCLEON_ELECTRON_ELASTIC
}
