package com.projectledger.policy;

import com.projectledger.contract.ProjectEvent;
import com.projectledger.notification.MessageComposer;
import com.projectledger.notification.NotificationDispatcher;
import com.projectledger.notification.NotificationType;
import com.projectledger.projection.Project;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Finds the policies that apply to an event and carries out their actions.
 *
 * Applicable policies are those attached to the project plus those attached
 * to its owning organisation node or any ancestor of it. Each policy is
 * handled on its own; one failing policy does not stop the others.
 */
public class PolicyEvaluator {

    private static final Logger log = LoggerFactory.getLogger(PolicyEvaluator.class);

    private final EventPolicyRepository repository;
    private final AncestorLookup ancestorLookup;
    private final ConditionMatcher conditionMatcher;
    private final RecipientResolver recipientResolver;
    private final NotificationDispatcher dispatcher;
    private final MessageComposer messageComposer;

    public PolicyEvaluator(EventPolicyRepository repository,
                           AncestorLookup ancestorLookup,
                           ConditionMatcher conditionMatcher,
                           RecipientResolver recipientResolver,
                           NotificationDispatcher dispatcher,
                           MessageComposer messageComposer) {
        this.repository = repository;
        this.ancestorLookup = ancestorLookup;
        this.conditionMatcher = conditionMatcher;
        this.recipientResolver = recipientResolver;
        this.dispatcher = dispatcher;
        this.messageComposer = messageComposer;
    }

    /**
     * Runs every matching policy for {@code event}. Rejected events are
     * ignored and approval requests go out only while the event is pending.
     * Failures are logged, never thrown.
     *
     * @return the policies that matched
     */
    public List<EventPolicy> evaluateAndExecute(ProjectEvent event, Project project) {
        if (event.isRejected()) {
            log.debug("Skipping policies for rejected event {}", event.id());
            return List.of();
        }
        List<EventPolicy> matched;
        try {
            matched = matchingPolicies(event, project);
        } catch (DependencyException e) {
            log.warn("Cannot evaluate policies for event {} on project {}: {}",
                event.id(), event.projectId(), e.getMessage());
            return List.of();
        }
        for (EventPolicy policy : matched) {
            try {
                execute(policy, event, project);
            } catch (RuntimeException e) {
                log.warn("Policy {} ({}) failed for event {}", policy.id(), policy.name(), event.id(), e);
            }
        }
        return matched;
    }

    /**
     * True if any matching policy asks for approval.
     *
     * @throws DependencyException if policies cannot be looked up
     */
    public boolean requiresApproval(ProjectEvent event, Project project) {
        return matchingPolicies(event, project).stream()
            .anyMatch(p -> p.actionType() == ActionType.REQUEST_APPROVAL);
    }

    List<EventPolicy> matchingPolicies(ProjectEvent event, Project project) {
        List<EventPolicy> matched = new ArrayList<>();
        for (EventPolicy policy : applicablePolicies(project)) {
            if (policy.enabled()
                && policy.appliesTo(event.type())
                && conditionMatcher.matchesAll(policy.conditions(), event, project)) {
                matched.add(policy);
            }
        }
        return matched;
    }

    private List<EventPolicy> applicablePolicies(Project project) {
        try {
            List<EventPolicy> policies = new ArrayList<>(repository.findByProject(project.getId()));
            UUID orgNodeId = project.getOwningOrgNodeId();
            if (orgNodeId != null) {
                List<UUID> nodes = new ArrayList<>();
                nodes.add(orgNodeId);
                nodes.addAll(ancestorLookup.ancestorIds(orgNodeId));
                policies.addAll(repository.findByOrgNodes(nodes));
            }
            return policies;
        } catch (DependencyException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DependencyException("Policy lookup failed for project " + project.getId(), e);
        }
    }

    private void execute(EventPolicy policy, ProjectEvent event, Project project) {
        if (policy.actionType() == ActionType.REQUEST_APPROVAL && !event.isPending()) {
            log.debug("Policy {} asks for approval but event {} is already {}",
                policy.name(), event.id(), event.status().getValue());
            return;
        }
        Set<UUID> recipients = resolveRecipients(policy, project);
        if (recipients.isEmpty()) {
            log.debug("Policy {} matched event {} but has no reachable recipients", policy.name(), event.id());
            return;
        }
        NotificationType type = policy.actionType() == ActionType.REQUEST_APPROVAL
            ? NotificationType.APPROVAL_REQUEST
            : NotificationType.INFO;
        String message = message(policy, event, project);
        log.info("Policy {} ({}) sending {} to {} recipient(s) for event {}",
            policy.name(), policy.actionType().getValue(), type, recipients.size(), event.id());
        dispatcher.dispatch(type, recipients, event.id(), message);
    }

    private Set<UUID> resolveRecipients(EventPolicy policy, Project project) {
        Set<UUID> users = new LinkedHashSet<>();
        try {
            users.addAll(recipientResolver.usersForPersons(policy.recipientPersonIds()));
        } catch (RuntimeException e) {
            log.warn("Policy {}: resolving person recipients failed", policy.name(), e);
        }
        for (UUID roleId : policy.recipientProjectRoleIds()) {
            try {
                users.addAll(recipientResolver.usersWithProjectRole(roleId, project));
            } catch (RuntimeException e) {
                log.warn("Policy {}: resolving project role {} failed", policy.name(), roleId, e);
            }
        }
        for (UUID roleId : policy.recipientOrgRoleIds()) {
            try {
                users.addAll(recipientResolver.usersWithOrgRole(roleId, project.getOwningOrgNodeId()));
            } catch (RuntimeException e) {
                log.warn("Policy {}: resolving org role {} failed", policy.name(), roleId, e);
            }
        }
        for (String strategy : policy.recipientDynamic()) {
            try {
                users.addAll(recipientResolver.dynamicRecipients(strategy, project));
            } catch (RuntimeException e) {
                log.warn("Policy {}: dynamic recipients '{}' failed", policy.name(), strategy, e);
            }
        }
        return users;
    }

    private String message(EventPolicy policy, ProjectEvent event, Project project) {
        if (policy.messageTemplate() != null && !policy.messageTemplate().isBlank()) {
            return messageComposer.render(policy.messageTemplate(), event, project);
        }
        String title = project.getTitle() != null ? project.getTitle() : project.getId().toString();
        if (policy.actionType() == ActionType.REQUEST_APPROVAL) {
            return String.format("Approval requested: %s on project '%s'.", event.friendlyName(), title);
        }
        return String.format("%s on project '%s'.", event.friendlyName(), title);
    }
}
