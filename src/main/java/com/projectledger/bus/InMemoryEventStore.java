package com.projectledger.bus;

import com.projectledger.contract.EventStatus;
import com.projectledger.contract.NotFoundException;
import com.projectledger.contract.ProjectEvent;
import com.projectledger.contract.ValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Event store kept in memory. Appends to one project are serialised
 * through {@link ConcurrentHashMap#compute}.
 */
public class InMemoryEventStore implements EventStore {

    private final ConcurrentHashMap<UUID, List<ProjectEvent>> streams = new ConcurrentHashMap<>();
    private final Map<UUID, UUID> projectByEventId = new ConcurrentHashMap<>();

    @Override
    public List<ProjectEvent> append(UUID projectId, long expectedVersion, List<ProjectEvent> events) {
        if (events.isEmpty()) {
            return List.of();
        }
        List<ProjectEvent> stored = new ArrayList<>(events.size());
        streams.compute(projectId, (id, existing) -> {
            List<ProjectEvent> current = existing != null ? existing : List.of();
            long actual = current.isEmpty() ? 0 : current.get(current.size() - 1).version();
            if (actual != expectedVersion) {
                throw new ConcurrencyException(projectId, expectedVersion, actual);
            }
            List<ProjectEvent> next = new ArrayList<>(current);
            long version = expectedVersion;
            for (ProjectEvent event : events) {
                if (!projectId.equals(event.projectId())) {
                    throw new ValidationException("Event " + event.id() + " belongs to project " + event.projectId());
                }
                ProjectEvent versioned = event.withVersion(++version);
                next.add(versioned);
                stored.add(versioned);
            }
            return List.copyOf(next);
        });
        for (ProjectEvent event : stored) {
            projectByEventId.put(event.id(), projectId);
        }
        return List.copyOf(stored);
    }

    @Override
    public EventStream load(UUID projectId) {
        List<ProjectEvent> events = streams.get(projectId);
        if (events == null || events.isEmpty()) {
            return EventStream.EMPTY;
        }
        return new EventStream(events, events.get(events.size() - 1).version());
    }

    @Override
    public ProjectEvent loadOne(UUID eventId) {
        UUID projectId = projectByEventId.get(eventId);
        if (projectId == null) {
            throw new NotFoundException("Event not found: " + eventId);
        }
        return streams.getOrDefault(projectId, List.of()).stream()
            .filter(e -> e.id().equals(eventId))
            .findFirst()
            .orElseThrow(() -> new NotFoundException("Event not found: " + eventId));
    }

    @Override
    public ProjectEvent updateStatus(UUID eventId, EventStatus newStatus) {
        if (newStatus == null || !newStatus.isTerminal()) {
            throw new ValidationException("Event status can only move to approved or rejected, got " + newStatus);
        }
        UUID projectId = projectByEventId.get(eventId);
        if (projectId == null) {
            throw new NotFoundException("Event not found: " + eventId);
        }
        ProjectEvent[] updated = new ProjectEvent[1];
        streams.computeIfPresent(projectId, (id, events) -> {
            List<ProjectEvent> next = new ArrayList<>(events.size());
            for (ProjectEvent event : events) {
                if (event.id().equals(eventId)) {
                    if (!event.isPending()) {
                        throw new ValidationException("Event " + eventId + " is already " + event.status().getValue());
                    }
                    updated[0] = event.withStatus(newStatus);
                    next.add(updated[0]);
                } else {
                    next.add(event);
                }
            }
            return List.copyOf(next);
        });
        if (updated[0] == null) {
            throw new NotFoundException("Event not found: " + eventId);
        }
        return updated[0];
    }
}
