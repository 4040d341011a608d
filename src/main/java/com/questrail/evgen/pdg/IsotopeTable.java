package com.questrail.evgen.pdg;

/**
 * Membership test for known isotopes, keyed by ion identity code
 * (see {@link PdgUtils#ionPdgCode(int, int)}).
 */
@FunctionalInterface
public interface IsotopeTable
{
    boolean contains(int ionCode);

    default boolean contains(int z, int a) {
        if (!PdgUtils.isEncodableIon(z, a)) {
            return false;
        }
        return contains(PdgUtils.ionPdgCode(a, z));
    }
}
