package com.questrail.evgen.channel;

import com.questrail.evgen.interaction.InteractionType;

/**
 * Weak current exchanged in a channel.
 */
public enum CurrentType {
    CC(InteractionType.WEAK_CC),
    NC(InteractionType.WEAK_NC);

    private final InteractionType interactionType;

    CurrentType(InteractionType interactionType) {
        this.interactionType = interactionType;
    }

    public InteractionType interactionType() {
        return interactionType;
    }
}
