package com.projectledger.contract;

import com.projectledger.projection.Project;

import java.util.Optional;

/**
 * Decides whether a command input produces an event against the current
 * project state. An empty result means the command is a no-op.
 *
 * @param <I> command input type
 * @param <P> payload type of the produced event
 */
@FunctionalInterface
public interface Decider<I, P extends EventPayload> {

    /**
     * @param current current state, or null if the project does not exist yet
     * @throws ValidationException if the input is invalid for the current state
     */
    Optional<P> decide(DecisionContext context, Project current, I input);
}
