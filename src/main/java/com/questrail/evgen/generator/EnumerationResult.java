package com.questrail.evgen.generator;

import java.util.Objects;
import java.util.Optional;

/**
 * EnumerationResult
 * -----------------------------------------------------------------------------
 * Outcome of {@link InteractionListGenerator#createInteractionList}.
 *
 * <p>Three outcomes are kept structurally distinct:</p>
 * <ul>
 *   <li>{@link Channels}: at least one candidate was produced</li>
 *   <li>{@link NotModeled}: the generator's family is not modeled; the empty
 *       list is valid and nothing went wrong</li>
 *   <li>{@link NoneViable}: the family is modeled but this initial state
 *       admits no channel</li>
 * </ul>
 *
 * Callers skip event production for both of the latter, but only
 * {@link NoneViable} is reported as an error.
 */
public sealed interface EnumerationResult
        permits EnumerationResult.Channels, EnumerationResult.NotModeled, EnumerationResult.NoneViable {

    /**
     * Why a modeled family produced no candidates.
     */
    enum Reason {
        /** The probe species is not handled by this generator. */
        UNSUPPORTED_PROBE,

        /** No catalogue channel survived the configuration and nucleon-availability filters. */
        NO_ADMITTED_CHANNEL
    }

    /**
     * Returns the candidate list when there is one to select from.
     */
    default Optional<InteractionList> interactions() {
        return Optional.empty();
    }

    default boolean isViable() {
        return false;
    }

    record Channels(InteractionList list) implements EnumerationResult {
        public Channels {
            Objects.requireNonNull(list, "list");
            if (list.isEmpty()) {
                throw new IllegalArgumentException("Channels requires a non-empty list");
            }
        }

        @Override
        public Optional<InteractionList> interactions() {
            return Optional.of(list);
        }

        @Override
        public boolean isViable() {
            return true;
        }
    }

    record NotModeled(InteractionList list) implements EnumerationResult {
        public NotModeled {
            Objects.requireNonNull(list, "list");
        }

        public static NotModeled empty() {
            return new NotModeled(new InteractionList());
        }
    }

    record NoneViable(Reason reason, String initialState) implements EnumerationResult {
        public NoneViable {
            Objects.requireNonNull(reason, "reason");
            Objects.requireNonNull(initialState, "initialState");
        }
    }
}
