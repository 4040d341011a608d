package com.questrail.evgen.generator;

import com.questrail.evgen.interaction.InitialState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Interaction list generator for diffractive scattering.
 * <p>
 * The family has no channel model yet, so every initial state answers
 * {@link EnumerationResult.NotModeled} with an empty, valid list. That is not
 * an error and is not logged as one.
 */
public final class DiffractiveListGenerator implements InteractionListGenerator
{
    private static final Logger log = LoggerFactory.getLogger(DiffractiveListGenerator.class);

    @Override
    public EnumerationResult createInteractionList(InitialState initialState) {
        Objects.requireNonNull(initialState, "initialState");
        log.info("InitialState = {}", initialState.asString());
        return EnumerationResult.NotModeled.empty();
    }
}
