package com.questrail.evgen.selector;

import com.questrail.evgen.interaction.Interaction;

/**
 * Relative weight of a candidate, typically its cross section at the event's
 * probe energy. Weights must be finite and non-negative.
 */
@FunctionalInterface
public interface InteractionWeigher
{
    double weight(Interaction interaction);
}
