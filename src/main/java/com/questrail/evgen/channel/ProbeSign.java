package com.questrail.evgen.channel;

import com.questrail.evgen.pdg.PdgUtils;

import java.util.Optional;

/**
 * Neutrino vs. antineutrino probe.
 */
public enum ProbeSign {
    NEUTRINO,
    ANTINEUTRINO;

    /**
     * Classifies a probe code; empty for anything that is not a (anti)neutrino.
     */
    public static Optional<ProbeSign> of(int probeCode) {
        if (PdgUtils.isNeutrino(probeCode)) {
            return Optional.of(NEUTRINO);
        }
        if (PdgUtils.isAntiNeutrino(probeCode)) {
            return Optional.of(ANTINEUTRINO);
        }
        return Optional.empty();
    }
}
