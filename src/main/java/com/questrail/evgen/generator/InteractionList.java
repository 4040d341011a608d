package com.questrail.evgen.generator;

import com.questrail.evgen.interaction.Interaction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Ordered, appendable sequence of candidate {@link Interaction}s.
 *
 * <p>The list owns its elements: whoever holds the list holds the candidates.
 * Consumers that need an interaction beyond the list's lifetime copy it
 * ({@link Interaction#Interaction(Interaction)}) rather than keep the
 * reference.</p>
 *
 * <p>Insertion order is preserved and is the channel order a generator
 * produced.</p>
 */
public final class InteractionList implements Iterable<Interaction>
{
    private final List<Interaction> interactions = new ArrayList<>();

    public void add(Interaction interaction) {
        interactions.add(Objects.requireNonNull(interaction, "interaction"));
    }

    /**
     * Moves every element of {@code other} to the end of this list. Ownership
     * transfers with them: {@code other} is left empty.
     *
     * @throws IllegalArgumentException if {@code other} is this list
     */
    public void addAll(InteractionList other) {
        Objects.requireNonNull(other, "other");
        if (other == this) {
            throw new IllegalArgumentException("Cannot move an InteractionList into itself");
        }
        interactions.addAll(other.interactions);
        other.interactions.clear();
    }

    public Interaction get(int index) {
        return interactions.get(index);
    }

    public int size() {
        return interactions.size();
    }

    public boolean isEmpty() {
        return interactions.isEmpty();
    }

    public Stream<Interaction> stream() {
        return interactions.stream();
    }

    /**
     * Read-only view of the elements, in order.
     */
    public List<Interaction> asList() {
        return Collections.unmodifiableList(interactions);
    }

    @Override
    public Iterator<Interaction> iterator() {
        return asList().iterator();
    }

    @Override
    public String toString() {
        StringBuilder s = new StringBuilder("InteractionList[size=").append(size()).append(']');
        for (int i = 0; i < interactions.size(); i++) {
            s.append("\n  [").append(i).append("] ").append(interactions.get(i).asString());
        }
        return s.toString();
    }
}
