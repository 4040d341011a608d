package com.questrail.evgen.channel;

import com.questrail.evgen.pdg.PdgCodes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * SppChannel
 * -----------------------------------------------------------------------------
 * Fixed catalogue of resonant single-pion production channels.
 *
 * <p>Each constant records the probe sign and current it belongs to, the
 * nucleon that must be struck, and the final-state nucleon and pion. The
 * suffix digits spell the final-state multiplicities in the order
 * {@code p n pi+ pi0 pi-}.</p>
 *
 * <pre>
 *   nu  CC:  nu p -> l- p pi+     nu n -> l- p pi0     nu n -> l- n pi+
 *   nu  NC:  nu p -> nu p pi0     nu p -> nu n pi+     nu n -> nu n pi0     nu n -> nu p pi-
 *   nub CC:  nub n -> l+ n pi-    nub p -> l+ n pi0    nub p -> l+ p pi-
 *   nub NC:  nub p -> nub p pi0   nub p -> nub n pi+   nub n -> nub n pi0   nub n -> nub p pi-
 * </pre>
 *
 * <p>Declaration order is the enumeration order handed to callers; it must
 * not change, since downstream weighting relies on a stable channel order.</p>
 */
public enum SppChannel {
    NU_P_CC_10100(ProbeSign.NEUTRINO, CurrentType.CC, PdgCodes.PROTON, PdgCodes.PROTON, PdgCodes.PI_PLUS),
    NU_N_CC_10010(ProbeSign.NEUTRINO, CurrentType.CC, PdgCodes.NEUTRON, PdgCodes.PROTON, PdgCodes.PI_0),
    NU_N_CC_01100(ProbeSign.NEUTRINO, CurrentType.CC, PdgCodes.NEUTRON, PdgCodes.NEUTRON, PdgCodes.PI_PLUS),

    NU_P_NC_10010(ProbeSign.NEUTRINO, CurrentType.NC, PdgCodes.PROTON, PdgCodes.PROTON, PdgCodes.PI_0),
    NU_P_NC_01100(ProbeSign.NEUTRINO, CurrentType.NC, PdgCodes.PROTON, PdgCodes.NEUTRON, PdgCodes.PI_PLUS),
    NU_N_NC_01010(ProbeSign.NEUTRINO, CurrentType.NC, PdgCodes.NEUTRON, PdgCodes.NEUTRON, PdgCodes.PI_0),
    NU_N_NC_10001(ProbeSign.NEUTRINO, CurrentType.NC, PdgCodes.NEUTRON, PdgCodes.PROTON, PdgCodes.PI_MINUS),

    NUBAR_N_CC_01001(ProbeSign.ANTINEUTRINO, CurrentType.CC, PdgCodes.NEUTRON, PdgCodes.NEUTRON, PdgCodes.PI_MINUS),
    NUBAR_P_CC_01010(ProbeSign.ANTINEUTRINO, CurrentType.CC, PdgCodes.PROTON, PdgCodes.NEUTRON, PdgCodes.PI_0),
    NUBAR_P_CC_10001(ProbeSign.ANTINEUTRINO, CurrentType.CC, PdgCodes.PROTON, PdgCodes.PROTON, PdgCodes.PI_MINUS),

    NUBAR_P_NC_10010(ProbeSign.ANTINEUTRINO, CurrentType.NC, PdgCodes.PROTON, PdgCodes.PROTON, PdgCodes.PI_0),
    NUBAR_P_NC_01100(ProbeSign.ANTINEUTRINO, CurrentType.NC, PdgCodes.PROTON, PdgCodes.NEUTRON, PdgCodes.PI_PLUS),
    NUBAR_N_NC_01010(ProbeSign.ANTINEUTRINO, CurrentType.NC, PdgCodes.NEUTRON, PdgCodes.NEUTRON, PdgCodes.PI_0),
    NUBAR_N_NC_10001(ProbeSign.ANTINEUTRINO, CurrentType.NC, PdgCodes.NEUTRON, PdgCodes.PROTON, PdgCodes.PI_MINUS);

    private static final Map<ProbeSign, Map<CurrentType, List<SppChannel>>> BY_SIGN_AND_CURRENT = index();

    private final ProbeSign probeSign;
    private final CurrentType currentType;
    private final int initialStateNucleon;
    private final int finalStateNucleon;
    private final int finalStatePion;

    SppChannel(ProbeSign probeSign,
               CurrentType currentType,
               int initialStateNucleon,
               int finalStateNucleon,
               int finalStatePion) {
        this.probeSign = probeSign;
        this.currentType = currentType;
        this.initialStateNucleon = initialStateNucleon;
        this.finalStateNucleon = finalStateNucleon;
        this.finalStatePion = finalStatePion;
    }

    public ProbeSign probeSign() {
        return probeSign;
    }

    public CurrentType currentType() {
        return currentType;
    }

    public int initialStateNucleon() {
        return initialStateNucleon;
    }

    public int finalStateNucleon() {
        return finalStateNucleon;
    }

    public int finalStatePion() {
        return finalStatePion;
    }

    /**
     * Returns the channels for one probe sign and current, in catalogue order.
     *
     * @return an unmodifiable, never-empty list
     */
    public static List<SppChannel> channels(ProbeSign sign, CurrentType current) {
        Objects.requireNonNull(sign, "sign");
        Objects.requireNonNull(current, "current");
        return BY_SIGN_AND_CURRENT.get(sign).get(current);
    }

    private static Map<ProbeSign, Map<CurrentType, List<SppChannel>>> index() {
        Map<ProbeSign, Map<CurrentType, List<SppChannel>>> bySign = new EnumMap<>(ProbeSign.class);
        for (ProbeSign sign : ProbeSign.values()) {
            Map<CurrentType, List<SppChannel>> byCurrent = new EnumMap<>(CurrentType.class);
            for (CurrentType current : CurrentType.values()) {
                List<SppChannel> subset = new ArrayList<>();
                for (SppChannel channel : values()) {
                    if (channel.probeSign == sign && channel.currentType == current) {
                        subset.add(channel);
                    }
                }
                byCurrent.put(current, Collections.unmodifiableList(subset));
            }
            bySign.put(sign, Collections.unmodifiableMap(byCurrent));
        }
        return Collections.unmodifiableMap(bySign);
    }
}
