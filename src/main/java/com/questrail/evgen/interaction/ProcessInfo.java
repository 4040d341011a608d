package com.questrail.evgen.interaction;

import java.util.Objects;

/**
 * Scattering category and current type of an interaction.
 */
public record ProcessInfo(
        ScatteringType scatteringType,
        InteractionType interactionType
) {
    public ProcessInfo {
        Objects.requireNonNull(scatteringType, "scatteringType");
        Objects.requireNonNull(interactionType, "interactionType");
    }

    public static ProcessInfo unknown() {
        return new ProcessInfo(ScatteringType.UNKNOWN, InteractionType.UNKNOWN);
    }

    public boolean isResonant() {
        return scatteringType == ScatteringType.RESONANT;
    }

    public boolean isWeakCC() {
        return interactionType == InteractionType.WEAK_CC;
    }

    public boolean isWeakNC() {
        return interactionType == InteractionType.WEAK_NC;
    }

    public String asString() {
        return "<" + scatteringType + " - " + interactionType + ">";
    }
}
