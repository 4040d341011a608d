package com.questrail.evgen.generator;

import com.questrail.evgen.interaction.InitialState;

/**
 * InteractionListGenerator
 * -----------------------------------------------------------------------------
 * Expands an {@link InitialState} into the candidate interactions of one
 * interaction family.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>Pure: the result depends only on the initial state and the generator's
 *       configuration; repeated calls with equal inputs give equal lists in the
 *       same order</li>
 *   <li>Stateless: implementations may be called concurrently</li>
 *   <li>The input is never modified; every candidate carries its own copy of
 *       the initial state</li>
 *   <li>Never throws for a physics condition; see {@link EnumerationResult}</li>
 * </ul>
 */
public interface InteractionListGenerator
{
    /**
     * @param initialState probe and target (must not be {@code null})
     * @return the enumeration outcome, never {@code null}
     */
    EnumerationResult createInteractionList(InitialState initialState);
}
