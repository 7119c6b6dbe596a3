package com.projectledger.api;

import com.projectledger.policy.ActionType;
import com.projectledger.policy.EventPolicy;
import com.projectledger.policy.PolicyCondition;

import java.util.List;
import java.util.Set;
import java.util.UUID;

public record PolicyRequest(
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
    Boolean enabled
) {

    EventPolicy toPolicy() {
        return EventPolicy.builder()
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
            .enabled(enabled == null || enabled)
            .build();
    }
}
