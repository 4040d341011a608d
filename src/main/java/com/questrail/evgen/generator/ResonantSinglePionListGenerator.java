package com.questrail.evgen.generator;

import com.questrail.evgen.channel.CurrentType;
import com.questrail.evgen.channel.ProbeSign;
import com.questrail.evgen.channel.SppChannel;
import com.questrail.evgen.config.GeneratorConfig;
import com.questrail.evgen.interaction.ExclusiveTag;
import com.questrail.evgen.interaction.InitialState;
import com.questrail.evgen.interaction.Interaction;
import com.questrail.evgen.interaction.ProcessInfo;
import com.questrail.evgen.interaction.ScatteringType;
import com.questrail.evgen.interaction.Target;
import com.questrail.evgen.pdg.PdgCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * ResonantSinglePionListGenerator
 * -----------------------------------------------------------------------------
 * Enumerates resonant single-pion production channels for a neutrino or
 * antineutrino probe.
 *
 * <h2>Algorithm</h2>
 * <ol>
 *   <li>Pick the {@link SppChannel} subset for the probe sign and the configured
 *       current (CC or NC)</li>
 *   <li>Admit a channel only if the target has a nucleon of the kind the channel
 *       strikes ({@code Z > 0} for protons, {@code N > 0} for neutrons)</li>
 *   <li>For each admitted channel build an {@link Interaction} tagged
 *       (resonant, CC/NC), with the struck nucleon set and an
 *       {@link ExclusiveTag} for the final-state nucleon and pion</li>
 * </ol>
 *
 * Candidates come out in catalogue order. An initial state that admits no
 * channel yields {@link EnumerationResult.NoneViable}, never an empty list.
 */
public final class ResonantSinglePionListGenerator implements InteractionListGenerator
{
    private static final Logger log = LoggerFactory.getLogger(ResonantSinglePionListGenerator.class);

    private final GeneratorConfig config;

    public ResonantSinglePionListGenerator(GeneratorConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public GeneratorConfig config() {
        return config;
    }

    @Override
    public EnumerationResult createInteractionList(InitialState initialState) {
        Objects.requireNonNull(initialState, "initialState");
        log.info("InitialState = {}", initialState.asString());

        Optional<ProbeSign> sign = ProbeSign.of(initialState.probeCode());
        if (sign.isEmpty()) {
            log.warn("Can not handle probe! No interaction list for init-state: {}",
                    initialState.asString());
            return new EnumerationResult.NoneViable(
                    EnumerationResult.Reason.UNSUPPORTED_PROBE, initialState.asString());
        }

        Target target = initialState.target();
        boolean hasP = target.z() > 0;
        boolean hasN = target.n() > 0;

        InteractionList list = new InteractionList();
        currentType().ifPresent(current -> {
            ProcessInfo process = new ProcessInfo(ScatteringType.RESONANT, current.interactionType());
            for (SppChannel channel : SppChannel.channels(sign.get(), current)) {
                int struckNucleon = channel.initialStateNucleon();
                boolean available = (struckNucleon == PdgCodes.PROTON && hasP)
                        || (struckNucleon == PdgCodes.NEUTRON && hasN);
                if (!available) {
                    continue;
                }

                Interaction interaction = new Interaction(initialState, process);
                interaction.initialState().target().setStruckNucleonCode(struckNucleon);
                interaction.setExclusiveTag(
                        exclusiveTagFor(channel.finalStateNucleon(), channel.finalStatePion()));
                list.add(interaction);
            }
        });

        if (list.isEmpty()) {
            log.error("No interaction list for init-state: {}", initialState.asString());
            return new EnumerationResult.NoneViable(
                    EnumerationResult.Reason.NO_ADMITTED_CHANNEL, initialState.asString());
        }
        return new EnumerationResult.Channels(list);
    }

    private Optional<CurrentType> currentType() {
        if (config.chargedCurrent()) {
            return Optional.of(CurrentType.CC);
        }
        if (config.neutralCurrent()) {
            return Optional.of(CurrentType.NC);
        }
        return Optional.empty();
    }

    /**
     * One-hot nucleon and pion multiplicities. An unrecognized identity is
     * logged and contributes nothing; the other half of the tag is still set.
     */
    static ExclusiveTag exclusiveTagFor(int nucleonCode, int pionCode) {
        int nProton = 0;
        int nNeutron = 0;
        int nPiPlus = 0;
        int nPi0 = 0;
        int nPiMinus = 0;

        if (nucleonCode == PdgCodes.PROTON) {
            nProton = 1;
        } else if (nucleonCode == PdgCodes.NEUTRON) {
            nNeutron = 1;
        } else {
            log.error("Final state nucleon not a proton or a neutron! (pdg={})", nucleonCode);
        }

        switch (pionCode) {
            case PdgCodes.PI_PLUS -> nPiPlus = 1;
            case PdgCodes.PI_0 -> nPi0 = 1;
            case PdgCodes.PI_MINUS -> nPiMinus = 1;
            default -> log.error("Final state pion not a pi+/pi0/pi-! (pdg={})", pionCode);
        }

        return ExclusiveTag.of(nProton, nNeutron, nPiPlus, nPi0, nPiMinus);
    }
}
