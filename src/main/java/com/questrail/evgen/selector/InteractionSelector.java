package com.questrail.evgen.selector;

import com.questrail.evgen.generator.InteractionList;
import com.questrail.evgen.interaction.LorentzVector;

import java.util.Optional;

/**
 * InteractionSelector
 * -----------------------------------------------------------------------------
 * Picks one candidate from an {@link InteractionList} and seeds an
 * {@link EventRecord} with it.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>A {@code null} or empty list yields {@link Optional#empty()}</li>
 *   <li>The chosen interaction is copied; the list keeps its elements and the
 *       record never aliases them</li>
 *   <li>The copy carries {@code probeP4} as its probe four-momentum</li>
 *   <li>The returned record belongs to the caller</li>
 * </ul>
 *
 * Variants differ only in how the index is drawn.
 */
public interface InteractionSelector
{
    /**
     * @param list    candidates from an interaction list generator, may be {@code null}
     * @param probeP4 four-momentum of the probe for this event
     * @return the seeded record, or empty if nothing could be selected
     */
    Optional<EventRecord> selectInteraction(InteractionList list, LorentzVector probeP4);
}
