package com.questrail.evgen.pdg;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * PdgLibrary
 * -----------------------------------------------------------------------------
 * In-memory {@link ParticleTable} and {@link IsotopeTable} built once and read
 * thereafter.
 *
 * <p>Instances are immutable after {@link Builder#build()} and may be shared
 * freely between threads.</p>
 *
 * <p>{@link #defaults()} covers the leptons, nucleons and pions used by the
 * neutrino generators plus a handful of common target isotopes. Deployments
 * that need a wider isotope chart should build their own instance.</p>
 */
public final class PdgLibrary implements ParticleTable, IsotopeTable
{
    private final Map<Integer, ParticleProperties> particles;
    private final Set<Integer> isotopes;

    private PdgLibrary(Map<Integer, ParticleProperties> particles, Set<Integer> isotopes) {
        this.particles = Collections.unmodifiableMap(new HashMap<>(particles));
        this.isotopes = Collections.unmodifiableSet(new HashSet<>(isotopes));
    }

    @Override
    public Optional<ParticleProperties> find(int code) {
        return Optional.ofNullable(particles.get(code));
    }

    @Override
    public boolean contains(int ionCode) {
        return isotopes.contains(ionCode);
    }

    /**
     * Returns the number of registered particles, nuclei included.
     */
    public int size() {
        return particles.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Library with the standard particle set and common target isotopes.
     */
    public static PdgLibrary defaults() {
        return builder()
                .addParticle(PdgCodes.ELECTRON, "e-", 0.000510999, -1)
                .addParticle(PdgCodes.POSITRON, "e+", 0.000510999, 1)
                .addParticle(PdgCodes.MUON, "mu-", 0.105658, -1)
                .addParticle(PdgCodes.ANTI_MUON, "mu+", 0.105658, 1)
                .addParticle(PdgCodes.TAU, "tau-", 1.77686, -1)
                .addParticle(PdgCodes.ANTI_TAU, "tau+", 1.77686, 1)
                .addParticle(PdgCodes.NU_E, "nu_e", 0, 0)
                .addParticle(PdgCodes.ANTI_NU_E, "nu_e_bar", 0, 0)
                .addParticle(PdgCodes.NU_MU, "nu_mu", 0, 0)
                .addParticle(PdgCodes.ANTI_NU_MU, "nu_mu_bar", 0, 0)
                .addParticle(PdgCodes.NU_TAU, "nu_tau", 0, 0)
                .addParticle(PdgCodes.ANTI_NU_TAU, "nu_tau_bar", 0, 0)
                .addParticle(PdgCodes.PI_0, "pi0", 0.134977, 0)
                .addParticle(PdgCodes.PI_PLUS, "pi+", 0.139570, 1)
                .addParticle(PdgCodes.PI_MINUS, "pi-", 0.139570, -1)
                .addParticle(PdgCodes.PROTON, "proton", 0.938272, 1)
                .addParticle(PdgCodes.NEUTRON, "neutron", 0.939565, 0)
                // free nucleons in ion notation
                .addParticle(PdgUtils.ionPdgCode(1, 1), "H1", 0.938272, 1)
                .addParticle(PdgUtils.ionPdgCode(1, 0), "n1", 0.939565, 0)
                .addIsotope(1, 2, "H2", 1.875613)
                .addIsotope(1, 3, "H3", 2.808921)
                .addIsotope(2, 3, "He3", 2.808391)
                .addIsotope(2, 4, "He4", 3.727379)
                .addIsotope(3, 7, "Li7", 6.533833)
                .addIsotope(6, 12, "C12", 11.177929)
                .addIsotope(7, 14, "N14", 13.043781)
                .addIsotope(8, 16, "O16", 14.899169)
                .addIsotope(10, 20, "Ne20", 18.617728)
                .addIsotope(13, 27, "Al27", 25.133144)
                .addIsotope(18, 40, "Ar40", 37.215523)
                .addIsotope(20, 40, "Ca40", 37.214694)
                .addIsotope(26, 56, "Fe56", 52.089808)
                .addIsotope(82, 208, "Pb208", 193.729247)
                .build();
    }

    public static final class Builder {
        private final Map<Integer, ParticleProperties> particles = new HashMap<>();
        private final Set<Integer> isotopes = new HashSet<>();

        private Builder() {}

        public Builder addParticle(ParticleProperties properties) {
            Objects.requireNonNull(properties, "properties");
            particles.put(properties.code(), properties);
            return this;
        }

        public Builder addParticle(int code, String name, double mass, double charge) {
            return addParticle(new ParticleProperties(code, name, mass, charge));
        }

        /**
         * Registers a nucleus both as a particle and as a known isotope.
         */
        public Builder addIsotope(int z, int a, String name, double mass) {
            if (!PdgUtils.isEncodableIon(z, a)) {
                throw new IllegalArgumentException("Invalid isotope Z=" + z + ", A=" + a);
            }
            int code = PdgUtils.ionPdgCode(a, z);
            isotopes.add(code);
            return addParticle(code, name, mass, z);
        }

        public PdgLibrary build() {
            return new PdgLibrary(particles, isotopes);
        }
    }
}
