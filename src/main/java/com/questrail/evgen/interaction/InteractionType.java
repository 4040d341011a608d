package com.questrail.evgen.interaction;

/**
 * Current type of an interaction.
 */
public enum InteractionType {
    UNKNOWN,
    EM,
    WEAK_CC,
    WEAK_NC,
    WEAK_MIX
}
