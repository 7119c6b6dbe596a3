package com.projectledger.contract;

import com.projectledger.projection.Project;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Registry entry binding an event type tag to its input type, payload type,
 * decider, applier and message templates.
 */
public final class EventType<I, P extends EventPayload> {

    private final String type;
    private final String friendlyName;
    private final Class<I> inputType;
    private final Class<P> payloadType;
    private final Decider<I, P> decider;
    private final EventApplier<P> applier;
    private final Function<P, RelatedIds> relatedIds;
    private final EventMessages messages;
    private final boolean createsProject;
    private final boolean notifiesMembers;

    private EventType(Builder<I, P> builder) {
        this.type = Objects.requireNonNull(builder.type, "type");
        this.friendlyName = Objects.requireNonNull(builder.friendlyName, "friendlyName");
        this.inputType = Objects.requireNonNull(builder.inputType, "inputType");
        this.payloadType = Objects.requireNonNull(builder.payloadType, "payloadType");
        this.decider = Objects.requireNonNull(builder.decider, "decider for " + builder.type);
        this.applier = Objects.requireNonNull(builder.applier, "applier for " + builder.type);
        this.relatedIds = builder.relatedIds;
        this.messages = builder.messages;
        this.createsProject = builder.createsProject;
        this.notifiesMembers = builder.notifiesMembers || builder.messages.notification() != null;
    }

    /**
     * Event type whose command input is the payload record itself.
     */
    public static <P extends EventPayload> Builder<P, P> of(String type, Class<P> payloadType) {
        return new Builder<>(type, payloadType, payloadType);
    }

    public String type() {
        return type;
    }

    public String friendlyName() {
        return friendlyName;
    }

    public Class<I> inputType() {
        return inputType;
    }

    public Class<P> payloadType() {
        return payloadType;
    }

    public EventMessages messages() {
        return messages;
    }

    public boolean createsProject() {
        return createsProject;
    }

    /**
     * True if an approved event of this type is announced to project members.
     */
    public boolean notifiesMembers() {
        return notifiesMembers;
    }

    public RelatedIds relatedIds(EventPayload payload) {
        if (relatedIds == null || !payloadType.isInstance(payload)) {
            return RelatedIds.NONE;
        }
        return relatedIds.apply(payloadType.cast(payload));
    }

    Optional<ProjectEvent> decide(DecisionContext context, Project current, Object input) {
        if (!inputType.isInstance(input)) {
            throw new ValidationException("Input for " + type + " must be " + inputType.getSimpleName()
                + (input == null ? ", got null" : ", got " + input.getClass().getSimpleName()));
        }
        return decider.decide(context, current, inputType.cast(input))
            .map(payload -> new ProjectEvent(
                UUID.randomUUID(),
                context.projectId(),
                0,
                type,
                friendlyName,
                context.actor(),
                Instant.now(),
                context.status(),
                payload
            ));
    }

    void apply(Project project, ProjectEvent event) {
        applier.apply(project, payloadType.cast(event.payload()), event);
    }

    public static final class Builder<I, P extends EventPayload> {

        private final String type;
        private final Class<I> inputType;
        private final Class<P> payloadType;
        private String friendlyName;
        private Decider<I, P> decider;
        private EventApplier<P> applier;
        private Function<P, RelatedIds> relatedIds;
        private EventMessages messages = EventMessages.NONE;
        private boolean createsProject;
        private boolean notifiesMembers;

        private Builder(String type, Class<I> inputType, Class<P> payloadType) {
            this.type = type;
            this.inputType = inputType;
            this.payloadType = payloadType;
        }

        public Builder<I, P> friendlyName(String friendlyName) {
            this.friendlyName = friendlyName;
            return this;
        }

        public Builder<I, P> decider(Decider<I, P> decider) {
            this.decider = decider;
            return this;
        }

        public Builder<I, P> applier(EventApplier<P> applier) {
            this.applier = applier;
            return this;
        }

        public Builder<I, P> relatedIds(Function<P, RelatedIds> relatedIds) {
            this.relatedIds = relatedIds;
            return this;
        }

        public Builder<I, P> messages(EventMessages messages) {
            this.messages = Objects.requireNonNull(messages);
            return this;
        }

        /** Marks the type that may be decided against a project that does not exist yet. */
        public Builder<I, P> createsProject() {
            this.createsProject = true;
            return this;
        }

        /** Announce to members even without a notification template. */
        public Builder<I, P> notifiesMembers() {
            this.notifiesMembers = true;
            return this;
        }

        public EventType<I, P> build() {
            return new EventType<>(this);
        }
    }
}
