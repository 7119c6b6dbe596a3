package com.projectledger.bus;

import com.projectledger.contract.EventStatus;
import com.projectledger.contract.ProjectEvent;

import java.util.List;
import java.util.UUID;

/**
 * Append-only, per-project event storage with optimistic concurrency.
 */
public interface EventStore {

    /**
     * Appends events with versions expectedVersion+1, expectedVersion+2, ...
     * All or nothing. An empty list is a no-op.
     *
     * @return the stored events carrying their assigned versions
     * @throws ConcurrencyException if the stream is no longer at expectedVersion
     */
    List<ProjectEvent> append(UUID projectId, long expectedVersion, List<ProjectEvent> events);

    EventStream load(UUID projectId);

    /**
     * @throws com.projectledger.contract.NotFoundException if no event has this id
     */
    ProjectEvent loadOne(UUID eventId);

    /**
     * Moves a pending event to approved or rejected. The transition happens once.
     *
     * @throws com.projectledger.contract.ValidationException if newStatus is not terminal
     *         or the event is no longer pending
     * @throws com.projectledger.contract.NotFoundException if no event has this id
     */
    ProjectEvent updateStatus(UUID eventId, EventStatus newStatus);
}
