package com.questrail.evgen.selector;

import com.questrail.evgen.interaction.Interaction;

import java.util.Objects;
import java.util.Optional;

/**
 * Container seeded with the selected interaction, handed to the downstream
 * event-generation stages.
 * <p>
 * The record owns its summary; the summary is attached exactly once.
 */
public final class EventRecord
{
    private Interaction summary;

    /**
     * @throws IllegalStateException if a summary is already attached
     */
    public void attachSummary(Interaction interaction) {
        Objects.requireNonNull(interaction, "interaction");
        if (summary != null) {
            throw new IllegalStateException("EventRecord already has a summary attached");
        }
        this.summary = interaction;
    }

    public Optional<Interaction> summary() {
        return Optional.ofNullable(summary);
    }

    @Override
    public String toString() {
        return "EventRecord[summary=" + (summary == null ? "none" : summary.asString()) + "]";
    }
}
