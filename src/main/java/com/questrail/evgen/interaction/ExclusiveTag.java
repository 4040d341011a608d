package com.questrail.evgen.interaction;

/**
 * Final-state multiplicity signature of an exclusive channel.
 * <p>
 * All counts are small and non-negative.
 */
public record ExclusiveTag(
        int nProton,
        int nNeutron,
        int nPiPlus,
        int nPi0,
        int nPiMinus
) {
    public ExclusiveTag {
        if (nProton < 0 || nNeutron < 0 || nPiPlus < 0 || nPi0 < 0 || nPiMinus < 0) {
            throw new IllegalArgumentException("multiplicities must be non-negative");
        }
    }

    public static ExclusiveTag of(int nProton, int nNeutron, int nPiPlus, int nPi0, int nPiMinus) {
        return new ExclusiveTag(nProton, nNeutron, nPiPlus, nPi0, nPiMinus);
    }

    public int nNucleons() {
        return nProton + nNeutron;
    }

    public int nPions() {
        return nPiPlus + nPi0 + nPiMinus;
    }

    /**
     * Exactly one nucleon and one pion in the final state.
     */
    public boolean isSinglePion() {
        return nNucleons() == 1 && nPions() == 1;
    }

    /**
     * Compact form, e.g. {@code [p:1,n:0;pi+:1,pi0:0,pi-:0]}.
     */
    public String asString() {
        return "[p:" + nProton + ",n:" + nNeutron
                + ";pi+:" + nPiPlus + ",pi0:" + nPi0 + ",pi-:" + nPiMinus + "]";
    }
}
