package com.projectledger.contract;

import com.projectledger.projection.Project;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Immutable lookup from event type tag to its {@link EventType}.
 *
 * Built once at startup through {@link Builder}; registering a type twice
 * fails immediately.
 */
public final class EventTypeRegistry {

    private final Map<String, EventType<?, ?>> types;
    private final Map<Class<?>, EventType<?, ?>> byPayload;

    private EventTypeRegistry(Map<String, EventType<?, ?>> types) {
        this.types = Collections.unmodifiableMap(new LinkedHashMap<>(types));
        Map<Class<?>, EventType<?, ?>> payloads = new LinkedHashMap<>();
        for (EventType<?, ?> eventType : types.values()) {
            payloads.put(eventType.payloadType(), eventType);
        }
        this.byPayload = Collections.unmodifiableMap(payloads);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<EventType<?, ?>> find(String type) {
        return Optional.ofNullable(types.get(type));
    }

    public EventType<?, ?> require(String type) {
        EventType<?, ?> eventType = types.get(type);
        if (eventType == null) {
            throw new ValidationException("Unknown event type: " + type);
        }
        return eventType;
    }

    public Optional<EventType<?, ?>> forPayload(EventPayload payload) {
        return Optional.ofNullable(byPayload.get(payload.getClass()));
    }

    public Collection<EventType<?, ?>> all() {
        return types.values();
    }

    /**
     * Runs the decider registered for {@code type}.
     *
     * @param current current project state, null if the project has not been started
     * @return the decided event with version 0, or empty for a no-op
     * @throws ValidationException for an unknown type, missing identity or invalid input
     * @throws NotFoundException if the project does not exist and the type cannot create it
     */
    public Optional<ProjectEvent> decide(String type, UUID projectId, UUID actor, Project current,
                                         Object input, EventStatus status) {
        EventType<?, ?> eventType = require(type);
        if (projectId == null) {
            throw new ValidationException("project_id is required");
        }
        if (actor == null) {
            throw new ValidationException("actor is required");
        }
        if (status == null) {
            throw new ValidationException("status is required");
        }
        if (current == null && !eventType.createsProject()) {
            throw new NotFoundException("Project not found: " + projectId);
        }
        if (current != null && eventType.createsProject()) {
            throw new ValidationException("Project already started: " + projectId);
        }
        return eventType.decide(new DecisionContext(projectId, actor, status), current, input);
    }

    /**
     * Applies an event through its registered applier. Returns false if the
     * event type is not registered.
     */
    public boolean apply(Project project, ProjectEvent event) {
        EventType<?, ?> eventType = types.get(event.type());
        if (eventType == null || !eventType.payloadType().isInstance(event.payload())) {
            return false;
        }
        eventType.apply(project, event);
        return true;
    }

    public static final class Builder {

        private final Map<String, EventType<?, ?>> types = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder register(EventType<?, ?> eventType) {
            if (types.containsKey(eventType.type())) {
                throw new IllegalStateException("Event type registered twice: " + eventType.type());
            }
            for (EventType<?, ?> existing : types.values()) {
                if (existing.payloadType().equals(eventType.payloadType())) {
                    throw new IllegalStateException("Payload " + eventType.payloadType().getSimpleName()
                        + " already bound to " + existing.type());
                }
            }
            types.put(eventType.type(), eventType);
            return this;
        }

        public EventTypeRegistry build() {
            return new EventTypeRegistry(types);
        }
    }
}
