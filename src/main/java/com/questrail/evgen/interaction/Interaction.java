package com.questrail.evgen.interaction;

import java.util.Objects;
import java.util.Optional;

/**
 * Interaction
 * -----------------------------------------------------------------------------
 * One candidate reaction: an {@link InitialState}, its {@link ProcessInfo} and,
 * for exclusive channels, an {@link ExclusiveTag}.
 *
 * <p>The process is fixed at construction. The initial state's target is
 * refined afterwards (the generator assigns the struck nucleon) and the
 * exclusive tag is attached once the channel's final state is known.</p>
 *
 * <p>The interaction owns its initial state. The copy constructor produces a
 * fully independent interaction.</p>
 */
public final class Interaction
{
    private final InitialState initialState;
    private final ProcessInfo processInfo;
    private ExclusiveTag exclusiveTag;

    public Interaction(InitialState initialState, ProcessInfo processInfo) {
        this.initialState = new InitialState(Objects.requireNonNull(initialState, "initialState"));
        this.processInfo = Objects.requireNonNull(processInfo, "processInfo");
    }

    public Interaction(Interaction other) {
        this(Objects.requireNonNull(other, "other").initialState, other.processInfo);
        this.exclusiveTag = other.exclusiveTag;
    }

    public InitialState initialState() {
        return initialState;
    }

    public ProcessInfo processInfo() {
        return processInfo;
    }

    public Optional<ExclusiveTag> exclusiveTag() {
        return Optional.ofNullable(exclusiveTag);
    }

    /**
     * @throws IllegalStateException if a tag is already attached
     */
    public void setExclusiveTag(ExclusiveTag exclusiveTag) {
        Objects.requireNonNull(exclusiveTag, "exclusiveTag");
        if (this.exclusiveTag != null) {
            throw new IllegalStateException("Interaction already has an exclusive tag: " + asString());
        }
        this.exclusiveTag = exclusiveTag;
    }

    public String asString() {
        StringBuilder s = new StringBuilder();
        s.append(initialState.asString())
                .append(";proc:").append(processInfo.asString());
        if (exclusiveTag != null) {
            s.append(";xcls:").append(exclusiveTag.asString());
        }
        return s.toString();
    }

    @Override
    public String toString() {
        return "Interaction[" + asString() + "]";
    }
}
