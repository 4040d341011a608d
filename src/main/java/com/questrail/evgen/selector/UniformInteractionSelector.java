package com.questrail.evgen.selector;

import com.questrail.evgen.generator.InteractionList;
import com.questrail.evgen.random.RandomService;

import java.util.OptionalInt;

/**
 * Selects every candidate with equal probability {@code 1/n}.
 */
public final class UniformInteractionSelector extends AbstractInteractionSelector
{
    public UniformInteractionSelector(RandomService random) {
        super(random);
    }

    @Override
    protected OptionalInt drawIndex(InteractionList list) {
        return OptionalInt.of(random.nextInt(list.size()));
    }
}
