package com.questrail.evgen.pdg;

/**
 * Classification helpers over PDG identity codes.
 * <p>
 * Ion codes follow {@code 10LZZZAAAI}: {@code 1000000000 + Z*10000 + A*10}
 * for ground-state, non-strange nuclei.
 */
public final class PdgUtils
{
    private static final int ION_BASE = 1000000000;
    private static final int ION_LIMIT = 1999999999;
    private static final int ION_FIELD_MAX = 999;

    private PdgUtils() {}

    public static int ionPdgCode(int a, int z) {
        return ION_BASE + z * 10000 + a * 10;
    }

    /**
     * Whether {@code (Z,A)} fits the ion code layout: {@code 0 <= Z <= A} and
     * {@code 1 <= A <= 999}. Outside that range {@link #ionPdgCode} overflows
     * one field into the other and can alias a real nucleus.
     */
    public static boolean isEncodableIon(int z, int a) {
        return a >= 1 && a <= ION_FIELD_MAX && z >= 0 && z <= a;
    }

    public static boolean isIon(int code) {
        return code > ION_BASE && code < ION_LIMIT;
    }

    public static int ionPdgCodeToZ(int code) {
        return (code / 10000) % 1000;
    }

    public static int ionPdgCodeToA(int code) {
        return (code / 10) % 1000;
    }

    public static boolean isProton(int code) {
        return code == PdgCodes.PROTON;
    }

    public static boolean isNeutron(int code) {
        return code == PdgCodes.NEUTRON;
    }

    public static boolean isNeutronOrProton(int code) {
        return isProton(code) || isNeutron(code);
    }

    public static boolean isNeutrino(int code) {
        return code == PdgCodes.NU_E || code == PdgCodes.NU_MU || code == PdgCodes.NU_TAU;
    }

    public static boolean isAntiNeutrino(int code) {
        return code == PdgCodes.ANTI_NU_E || code == PdgCodes.ANTI_NU_MU || code == PdgCodes.ANTI_NU_TAU;
    }

    public static boolean isQuark(int code) {
        return code >= PdgCodes.DOWN && code <= PdgCodes.TOP;
    }

    public static boolean isAntiQuark(int code) {
        return code <= -PdgCodes.DOWN && code >= -PdgCodes.TOP;
    }

    public static boolean isPion(int code) {
        return code == PdgCodes.PI_PLUS || code == PdgCodes.PI_0 || code == PdgCodes.PI_MINUS;
    }
}
