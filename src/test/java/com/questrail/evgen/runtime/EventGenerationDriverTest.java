package com.questrail.evgen.runtime;

import com.questrail.evgen.config.GeneratorConfig;
import com.questrail.evgen.generator.EnumerationResult;
import com.questrail.evgen.generator.InteractionList;
import com.questrail.evgen.generator.InteractionListGeneratorRegistry;
import com.questrail.evgen.generator.ResonantSinglePionListGenerator;
import com.questrail.evgen.interaction.InitialState;
import com.questrail.evgen.interaction.Interaction;
import com.questrail.evgen.interaction.InteractionType;
import com.questrail.evgen.interaction.LorentzVector;
import com.questrail.evgen.interaction.ScatteringType;
import com.questrail.evgen.interaction.Target;
import com.questrail.evgen.observability.EnumerationObservabilityEvent;
import com.questrail.evgen.observability.RecordingObservabilitySink;
import com.questrail.evgen.pdg.PdgCodes;
import com.questrail.evgen.pdg.PdgTables;
import com.questrail.evgen.random.ScriptedRandomService;
import com.questrail.evgen.selector.EventRecord;
import com.questrail.evgen.selector.UniformInteractionSelector;
import com.questrail.evgen.selector.WeightedInteractionSelector;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * EventGenerationDriverTest
 * -----------------------------------------------------------------------------
 * End-to-end: initial state through enumeration and selection to a seeded
 * event record, with the observability trail checked at each outcome.
 */
class EventGenerationDriverTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");
    private static final LorentzVector PROBE = new LorentzVector(0, 0, 3.0, 3.0);

    private final PdgTables tables = PdgTables.defaults();
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();

    private EventGenerationDriver.Builder baseBuilder(ScriptedRandomService random) {
        return EventGenerationDriver.builder()
                .withSelector(new UniformInteractionSelector(random))
                .withObservabilitySink(sink)
                .withClock(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private InitialState carbon() {
        return new InitialState(PdgCodes.NU_MU, new Target(tables, 6, 12));
    }

    @Test
    void resonantAndDiffractiveProduceOneEvent() {
        EventGenerationDriver driver = baseBuilder(new ScriptedRandomService().withInts(1))
                .addGenerator(InteractionListGeneratorRegistry.RESONANT_SINGLE_PION, GeneratorConfig.chargedCurrentOnly())
                .addGenerator(InteractionListGeneratorRegistry.DIFFRACTIVE, GeneratorConfig.chargedCurrentOnly())
                .build();

        EventRecord eventRecord = driver.generate(carbon(), PROBE).orElseThrow();
        Interaction summary = eventRecord.summary().orElseThrow();

        assertEquals(ScatteringType.RESONANT, summary.processInfo().scatteringType());
        assertEquals(PdgCodes.NEUTRON, summary.initialState().target().struckNucleonCode());
        assertEquals(PROBE, summary.initialState().probeP4());

        List<EnumerationObservabilityEvent.Outcome> outcomes = sink.getEnumerations().stream()
                .map(EnumerationObservabilityEvent::outcome)
                .collect(Collectors.toList());
        assertEquals(List.of(EnumerationObservabilityEvent.Outcome.CHANNELS,
                EnumerationObservabilityEvent.Outcome.NOT_MODELED), outcomes);
        assertEquals(3, sink.getEnumerations().get(0).candidates());
        assertEquals(1, sink.getSelections().size());
        assertEquals(3, sink.getSelections().get(0).candidates());
        assertEquals(NOW, sink.getSelections().get(0).timestamp());
        assertTrue(sink.getErrors().isEmpty());
    }

    @Test
    void enumerateMergesListsInGeneratorOrder() {
        EventGenerationDriver driver = baseBuilder(new ScriptedRandomService())
                .addGenerator("spp-cc", new ResonantSinglePionListGenerator(GeneratorConfig.chargedCurrentOnly()))
                .addGenerator("spp-nc", new ResonantSinglePionListGenerator(GeneratorConfig.neutralCurrentOnly()))
                .build();

        InteractionList merged = driver.enumerate(carbon());

        assertEquals(7, merged.size());
        assertEquals(InteractionType.WEAK_CC, merged.get(2).processInfo().interactionType());
        assertEquals(InteractionType.WEAK_NC, merged.get(3).processInfo().interactionType());
        assertEquals(List.of("spp-cc", "spp-nc"), sink.getEnumerations().stream()
                .map(EnumerationObservabilityEvent::generator)
                .collect(Collectors.toList()));
    }

    @Test
    void mergedListTakesOwnershipOfGeneratorCandidates() {
        ResonantSinglePionListGenerator spp =
                new ResonantSinglePionListGenerator(GeneratorConfig.chargedCurrentOnly());
        List<InteractionList> produced = new ArrayList<>();
        EventGenerationDriver driver = baseBuilder(new ScriptedRandomService())
                .addGenerator("spp-cc", state -> {
                    EnumerationResult result = spp.createInteractionList(state);
                    result.interactions().ifPresent(produced::add);
                    return result;
                })
                .build();

        InteractionList merged = driver.enumerate(carbon());

        assertEquals(3, merged.size());
        assertEquals(1, produced.size());
        assertTrue(produced.get(0).isEmpty());
        assertEquals(3, sink.getEnumerations().get(0).candidates());
    }

    @Test
    void emptyTargetYieldsNoEventAndOneError() {
        ScriptedRandomService random = new ScriptedRandomService();
        EventGenerationDriver driver = baseBuilder(random)
                .addGenerator(InteractionListGeneratorRegistry.RESONANT_SINGLE_PION, GeneratorConfig.chargedCurrentOnly())
                .build();

        Optional<EventRecord> eventRecord =
                driver.generate(new InitialState(PdgCodes.NU_MU, new Target(tables, 0, 0)), PROBE);

        assertTrue(eventRecord.isEmpty());
        assertEquals(1, sink.getErrors().size());
        assertEquals(EnumerationObservabilityEvent.Outcome.NONE_VIABLE, sink.getEnumerations().get(0).outcome());
        assertTrue(sink.getSelections().isEmpty());
        assertEquals(0, random.draws());
    }

    @Test
    void notModeledAloneYieldsNoEventAndNoError() {
        EventGenerationDriver driver = baseBuilder(new ScriptedRandomService())
                .addGenerator(InteractionListGeneratorRegistry.DIFFRACTIVE, GeneratorConfig.chargedCurrentOnly())
                .build();

        assertTrue(driver.generate(carbon(), PROBE).isEmpty());
        assertTrue(sink.getErrors().isEmpty());
        assertEquals(1, sink.getEnumerations().size());
    }

    @Test
    void selectionFailureIsReported() {
        EventGenerationDriver driver = EventGenerationDriver.builder()
                .withSelector(new WeightedInteractionSelector(new ScriptedRandomService(), interaction -> 0.0))
                .withObservabilitySink(sink)
                .withClock(Clock.fixed(NOW, ZoneOffset.UTC))
                .addGenerator(InteractionListGeneratorRegistry.RESONANT_SINGLE_PION, GeneratorConfig.chargedCurrentOnly())
                .build();

        assertTrue(driver.generate(carbon(), PROBE).isEmpty());
        assertEquals(1, sink.getErrors().size());
        assertTrue(sink.getSelections().isEmpty());
    }

    @Test
    void builderRequiresSelectorAndGenerator() {
        assertThrows(NullPointerException.class, () -> EventGenerationDriver.builder()
                .addGenerator(InteractionListGeneratorRegistry.DIFFRACTIVE, GeneratorConfig.chargedCurrentOnly())
                .build());
        assertThrows(IllegalStateException.class, () -> EventGenerationDriver.builder()
                .withSelector(new UniformInteractionSelector(new ScriptedRandomService()))
                .build());
    }

    @Test
    void builderRejectsDuplicateAndUnknownNames() {
        EventGenerationDriver.Builder builder = baseBuilder(new ScriptedRandomService())
                .addGenerator(InteractionListGeneratorRegistry.DIFFRACTIVE, GeneratorConfig.chargedCurrentOnly());

        assertThrows(IllegalArgumentException.class, () -> builder.addGenerator(
                InteractionListGeneratorRegistry.DIFFRACTIVE, GeneratorConfig.chargedCurrentOnly()));
        assertThrows(IllegalArgumentException.class, () -> builder.addGenerator(
                "coherent", GeneratorConfig.chargedCurrentOnly()));
    }
}
