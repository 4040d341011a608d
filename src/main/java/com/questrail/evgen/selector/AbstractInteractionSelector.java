package com.questrail.evgen.selector;

import com.questrail.evgen.generator.InteractionList;
import com.questrail.evgen.interaction.Interaction;
import com.questrail.evgen.interaction.LorentzVector;
import com.questrail.evgen.random.RandomService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * AbstractInteractionSelector
 * -----------------------------------------------------------------------------
 * Fixed selection protocol shared by every draw policy:
 * <ol>
 *   <li>validate the list (non-null, non-empty)</li>
 *   <li>draw an index ({@link #drawIndex})</li>
 *   <li>copy the chosen interaction and inject the probe four-momentum</li>
 *   <li>attach the copy to a new {@link EventRecord}</li>
 * </ol>
 * Subclasses supply step 2 only.
 */
public abstract class AbstractInteractionSelector implements InteractionSelector
{
    private static final Logger log = LoggerFactory.getLogger(AbstractInteractionSelector.class);

    protected final RandomService random;

    protected AbstractInteractionSelector(RandomService random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public final Optional<EventRecord> selectInteraction(InteractionList list, LorentzVector probeP4) {
        Objects.requireNonNull(probeP4, "probeP4");

        if (list == null) {
            log.error("Null InteractionList! Can't select interaction");
            return Optional.empty();
        }
        if (list.isEmpty()) {
            log.error("Empty InteractionList! Can't select interaction");
            return Optional.empty();
        }

        OptionalInt index = drawIndex(list);
        if (index.isEmpty()) {
            log.error("No interaction could be drawn from {} candidates", list.size());
            return Optional.empty();
        }

        Interaction selected = new Interaction(list.get(index.getAsInt()));
        selected.initialState().setProbeP4(probeP4);
        log.info("Interaction to generate: {}", selected.asString());

        EventRecord eventRecord = new EventRecord();
        eventRecord.attachSummary(selected);
        return Optional.of(eventRecord);
    }

    /**
     * Draws the index of the candidate to generate.
     *
     * @param list a non-empty candidate list
     * @return an index in {@code [0, list.size())}, or empty if the policy
     *         cannot choose (e.g. every candidate has zero weight)
     */
    protected abstract OptionalInt drawIndex(InteractionList list);
}
