package com.questrail.evgen.pdg;

import java.util.Optional;

/**
 * ParticleTable
 * -----------------------------------------------------------------------------
 * Read-only lookup of particle properties keyed by PDG identity code.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>An unknown code answers {@link Optional#empty()}; lookups never throw</li>
 *   <li>Implementations are populated once and read thereafter, so concurrent
 *       readers need no coordination</li>
 * </ul>
 *
 * Callers treat an absent entry as "unknown identity" and degrade to a zero
 * value rather than failing.
 */
public interface ParticleTable
{
    /**
     * Looks up the properties of the given identity.
     *
     * @param code PDG identity code (particle or ion)
     * @return the properties, or empty if the code is unknown
     */
    Optional<ParticleProperties> find(int code);

    /**
     * Returns the rest mass for the given code, or {@code 0} if unknown.
     */
    default double massOf(int code) {
        return find(code).map(ParticleProperties::mass).orElse(0.0);
    }
}
