package com.questrail.evgen.interaction;

import java.util.Locale;

/**
 * Immutable four-momentum {@code (px, py, pz, E)} in GeV.
 * <p>
 * Being a value, it can be shared between owners without aliasing concerns.
 */
public record LorentzVector(
        double px,
        double py,
        double pz,
        double energy
) {
    public static final LorentzVector ZERO = new LorentzVector(0, 0, 0, 0);

    /**
     * On-shell four-momentum of a particle of the given mass at rest.
     */
    public static LorentzVector atRest(double mass) {
        return new LorentzVector(0, 0, 0, mass);
    }

    public double p() {
        return Math.sqrt(px * px + py * py + pz * pz);
    }

    /**
     * Invariant mass squared, {@code E^2 - |p|^2}.
     */
    public double mass2() {
        return energy * energy - (px * px + py * py + pz * pz);
    }

    public String asString() {
        return String.format(Locale.ROOT, "(E = %.6f, px = %.6f, py = %.6f, pz = %.6f)",
                energy, px, py, pz);
    }
}
