package com.projectledger.policy;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * A rule attached to a project or an organisation node: when an event of
 * one of {@code eventTypes} satisfies all {@code conditions}, notify the
 * recipients or ask them for approval.
 *
 * {@code inherited} is not stored; listings set it on policies that come
 * from an ancestor node.
 */
public record EventPolicy(
    UUID id,
    String name,
    String description,
    List<String> eventTypes,
    List<PolicyCondition> conditions,
    ActionType actionType,
    String messageTemplate,
    Set<UUID> recipientPersonIds,
    Set<UUID> recipientProjectRoleIds,
    Set<UUID> recipientOrgRoleIds,
    Set<String> recipientDynamic,
    UUID projectId,
    UUID orgNodeId,
    boolean enabled,
    boolean inherited
) {

    public EventPolicy {
        eventTypes = eventTypes == null ? List.of() : List.copyOf(eventTypes);
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        recipientPersonIds = copy(recipientPersonIds);
        recipientProjectRoleIds = copy(recipientProjectRoleIds);
        recipientOrgRoleIds = copy(recipientOrgRoleIds);
        recipientDynamic = copy(recipientDynamic);
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean appliesTo(String eventType) {
        return eventTypes.contains(eventType);
    }

    public boolean hasRecipients() {
        return !recipientPersonIds.isEmpty() || !recipientProjectRoleIds.isEmpty()
            || !recipientOrgRoleIds.isEmpty() || !recipientDynamic.isEmpty();
    }

    public EventPolicy withId(UUID newId) {
        return toBuilder().id(newId).build();
    }

    public EventPolicy asInherited() {
        return toBuilder().inherited(true).build();
    }

    public Builder toBuilder() {
        return new Builder()
            .id(id)
            .name(name)
            .description(description)
            .eventTypes(eventTypes)
            .conditions(conditions)
            .actionType(actionType)
            .messageTemplate(messageTemplate)
            .recipientPersonIds(recipientPersonIds)
            .recipientProjectRoleIds(recipientProjectRoleIds)
            .recipientOrgRoleIds(recipientOrgRoleIds)
            .recipientDynamic(recipientDynamic)
            .projectId(projectId)
            .orgNodeId(orgNodeId)
            .enabled(enabled)
            .inherited(inherited);
    }

    private static <T> Set<T> copy(Set<T> values) {
        return values == null ? Set.of() : Set.copyOf(new LinkedHashSet<>(values));
    }

    public static final class Builder {
        private UUID id;
        private String name;
        private String description;
        private List<String> eventTypes = List.of();
        private List<PolicyCondition> conditions = List.of();
        private ActionType actionType;
        private String messageTemplate;
        private Set<UUID> recipientPersonIds = Set.of();
        private Set<UUID> recipientProjectRoleIds = Set.of();
        private Set<UUID> recipientOrgRoleIds = Set.of();
        private Set<String> recipientDynamic = Set.of();
        private UUID projectId;
        private UUID orgNodeId;
        private boolean enabled = true;
        private boolean inherited;

        private Builder() {
        }

        public Builder id(UUID id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder eventTypes(List<String> eventTypes) {
            this.eventTypes = eventTypes;
            return this;
        }

        public Builder eventTypes(String... eventTypes) {
            this.eventTypes = List.of(eventTypes);
            return this;
        }

        public Builder conditions(List<PolicyCondition> conditions) {
            this.conditions = conditions;
            return this;
        }

        public Builder conditions(PolicyCondition... conditions) {
            this.conditions = List.of(conditions);
            return this;
        }

        public Builder actionType(ActionType actionType) {
            this.actionType = actionType;
            return this;
        }

        public Builder messageTemplate(String messageTemplate) {
            this.messageTemplate = messageTemplate;
            return this;
        }

        public Builder recipientPersonIds(Set<UUID> recipientPersonIds) {
            this.recipientPersonIds = recipientPersonIds;
            return this;
        }

        public Builder recipientProjectRoleIds(Set<UUID> recipientProjectRoleIds) {
            this.recipientProjectRoleIds = recipientProjectRoleIds;
            return this;
        }

        public Builder recipientOrgRoleIds(Set<UUID> recipientOrgRoleIds) {
            this.recipientOrgRoleIds = recipientOrgRoleIds;
            return this;
        }

        public Builder recipientDynamic(Set<String> recipientDynamic) {
            this.recipientDynamic = recipientDynamic;
            return this;
        }

        public Builder projectId(UUID projectId) {
            this.projectId = projectId;
            return this;
        }

        public Builder orgNodeId(UUID orgNodeId) {
            this.orgNodeId = orgNodeId;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder inherited(boolean inherited) {
            this.inherited = inherited;
            return this;
        }

        public EventPolicy build() {
            return new EventPolicy(id, name, description, eventTypes, conditions, actionType, messageTemplate,
                recipientPersonIds, recipientProjectRoleIds, recipientOrgRoleIds, recipientDynamic,
                projectId, orgNodeId, enabled, inherited);
        }
    }
}
