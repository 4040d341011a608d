package com.questrail.evgen.selector;

import com.questrail.evgen.config.GeneratorConfig;
import com.questrail.evgen.generator.InteractionList;
import com.questrail.evgen.generator.ResonantSinglePionListGenerator;
import com.questrail.evgen.interaction.InitialState;
import com.questrail.evgen.interaction.Interaction;
import com.questrail.evgen.interaction.LorentzVector;
import com.questrail.evgen.interaction.Target;
import com.questrail.evgen.pdg.PdgCodes;
import com.questrail.evgen.pdg.PdgTables;
import com.questrail.evgen.random.ScriptedRandomService;
import com.questrail.evgen.random.SeededRandomService;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * UniformInteractionSelectorTest
 * -----------------------------------------------------------------------------
 * Covers the shared selection protocol (validation, copy, probe injection)
 * through the uniform policy, plus the uniformity of the draw itself.
 */
class UniformInteractionSelectorTest {

    private static final LorentzVector PROBE = new LorentzVector(0, 0, 2.0, 2.0);

    private static InteractionList carbonCC() {
        InitialState state = new InitialState(PdgCodes.NU_MU, new Target(PdgTables.defaults(), 6, 12));
        return new ResonantSinglePionListGenerator(GeneratorConfig.chargedCurrentOnly())
                .createInteractionList(state)
                .interactions()
                .orElseThrow();
    }

    @Test
    void selectsScriptedIndexAndInjectsProbeMomentum() {
        InteractionList list = carbonCC();
        UniformInteractionSelector selector = new UniformInteractionSelector(new ScriptedRandomService().withInts(2));

        EventRecord eventRecord = selector.selectInteraction(list, PROBE).orElseThrow();
        Interaction summary = eventRecord.summary().orElseThrow();

        assertEquals(list.get(2).asString(), summary.asString());
        assertEquals(PROBE, summary.initialState().probeP4());
    }

    @Test
    void selectedInteractionDoesNotAliasListElement() {
        InteractionList list = carbonCC();
        UniformInteractionSelector selector = new UniformInteractionSelector(new ScriptedRandomService().withInts(0));

        Interaction summary = selector.selectInteraction(list, PROBE).orElseThrow().summary().orElseThrow();

        assertNotSame(list.get(0), summary);
        assertEquals(LorentzVector.ZERO, list.get(0).initialState().probeP4());

        summary.initialState().target().setStruckNucleonCode(PdgCodes.NEUTRON);
        assertEquals(PdgCodes.PROTON, list.get(0).initialState().target().struckNucleonCode());
    }

    @Test
    void listIsUnchangedBySelection() {
        InteractionList list = carbonCC();
        UniformInteractionSelector selector = new UniformInteractionSelector(new ScriptedRandomService().withInts(1));

        selector.selectInteraction(list, PROBE);

        assertEquals(3, list.size());
    }

    @Test
    void nullListYieldsEmptyWithoutDrawing() {
        ScriptedRandomService random = new ScriptedRandomService();
        UniformInteractionSelector selector = new UniformInteractionSelector(random);

        assertEquals(Optional.empty(), selector.selectInteraction(null, PROBE));
        assertEquals(0, random.draws());
    }

    @Test
    void emptyListYieldsEmptyWithoutDrawing() {
        ScriptedRandomService random = new ScriptedRandomService();
        UniformInteractionSelector selector = new UniformInteractionSelector(random);

        assertTrue(selector.selectInteraction(new InteractionList(), PROBE).isEmpty());
        assertEquals(0, random.draws());
    }

    @Test
    void eachCandidateIsEquallyLikely() {
        InteractionList list = carbonCC();
        UniformInteractionSelector selector = new UniformInteractionSelector(new SeededRandomService(20240101L));

        int trials = 30000;
        int[] counts = new int[list.size()];
        for (int t = 0; t < trials; t++) {
            Interaction summary = selector.selectInteraction(list, PROBE).orElseThrow().summary().orElseThrow();
            for (int i = 0; i < list.size(); i++) {
                if (list.get(i).asString().equals(summary.asString())) {
                    counts[i]++;
                }
            }
        }

        for (int count : counts) {
            assertEquals(1.0 / 3.0, (double) count / trials, 0.02);
        }
    }
}
