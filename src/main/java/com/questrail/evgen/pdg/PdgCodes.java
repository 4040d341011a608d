package com.questrail.evgen.pdg;

/**
 * PdgCodes
 * -----------------------------------------------------------------------------
 * Integer identity codes for the particles this core reasons about, following
 * the PDG Monte Carlo numbering scheme.
 *
 * Nuclei are not listed here; they use the ion convention {@code 10LZZZAAAI}
 * and are built with {@link PdgUtils#ionPdgCode(int, int)}.
 */
public final class PdgCodes
{
    private PdgCodes() {}

    /** Unset / unknown identity. */
    public static final int ROOTINO = 0;

    // quarks
    public static final int DOWN = 1;
    public static final int UP = 2;
    public static final int STRANGE = 3;
    public static final int CHARM = 4;
    public static final int BOTTOM = 5;
    public static final int TOP = 6;

    // leptons
    public static final int ELECTRON = 11;
    public static final int POSITRON = -11;
    public static final int NU_E = 12;
    public static final int ANTI_NU_E = -12;
    public static final int MUON = 13;
    public static final int ANTI_MUON = -13;
    public static final int NU_MU = 14;
    public static final int ANTI_NU_MU = -14;
    public static final int TAU = 15;
    public static final int ANTI_TAU = -15;
    public static final int NU_TAU = 16;
    public static final int ANTI_NU_TAU = -16;

    // mesons
    public static final int PI_0 = 111;
    public static final int PI_PLUS = 211;
    public static final int PI_MINUS = -211;

    // nucleons
    public static final int NEUTRON = 2112;
    public static final int PROTON = 2212;

    /** Average nucleon mass in GeV, used before any struck nucleon is known. */
    public static final double NUCLEON_MASS = 0.93891897;
}
