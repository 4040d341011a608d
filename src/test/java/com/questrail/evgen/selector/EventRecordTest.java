package com.questrail.evgen.selector;

import com.questrail.evgen.interaction.InitialState;
import com.questrail.evgen.interaction.Interaction;
import com.questrail.evgen.interaction.ProcessInfo;
import com.questrail.evgen.interaction.Target;
import com.questrail.evgen.pdg.PdgCodes;
import com.questrail.evgen.pdg.PdgTables;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EventRecordTest {

    private final Interaction interaction = new Interaction(
            new InitialState(PdgCodes.NU_E, new Target(PdgTables.defaults(), 1, 1)),
            ProcessInfo.unknown());

    @Test
    void startsWithoutSummary() {
        EventRecord eventRecord = new EventRecord();
        assertTrue(eventRecord.summary().isEmpty());
        assertEquals("EventRecord[summary=none]", eventRecord.toString());
    }

    @Test
    void summaryIsAttachedOnce() {
        EventRecord eventRecord = new EventRecord();
        eventRecord.attachSummary(interaction);

        assertSame(interaction, eventRecord.summary().orElseThrow());
        assertThrows(IllegalStateException.class, () -> eventRecord.attachSummary(interaction));
    }

    @Test
    void nullSummaryIsRejected() {
        assertThrows(NullPointerException.class, () -> new EventRecord().attachSummary(null));
    }
}
