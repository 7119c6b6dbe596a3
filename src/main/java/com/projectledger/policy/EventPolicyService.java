package com.projectledger.policy;

import com.projectledger.contract.EventTypeRegistry;
import com.projectledger.contract.NotFoundException;
import com.projectledger.contract.ValidationException;
import com.projectledger.policy.PolicyCondition.AllOf;
import com.projectledger.policy.PolicyCondition.FieldCondition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Maintains event policies and lists them with inheritance from ancestor
 * organisation nodes.
 */
public class EventPolicyService {

    private static final Logger log = LoggerFactory.getLogger(EventPolicyService.class);

    private final EventPolicyRepository repository;
    private final AncestorLookup ancestorLookup;
    private final EventTypeRegistry registry;

    public EventPolicyService(EventPolicyRepository repository, AncestorLookup ancestorLookup,
                              EventTypeRegistry registry) {
        this.repository = repository;
        this.ancestorLookup = ancestorLookup;
        this.registry = registry;
    }

    public EventPolicy create(EventPolicy policy) {
        validate(policy);
        EventPolicy stored = repository.save(policy.toBuilder().id(UUID.randomUUID()).inherited(false).build());
        log.info("Created policy {} ({}) for {}", stored.id(), stored.name(), owner(stored));
        return stored;
    }

    public EventPolicy update(UUID id, EventPolicy policy) {
        EventPolicy existing = get(id);
        validate(policy);
        EventPolicy stored = repository.save(policy.toBuilder().id(existing.id()).inherited(false).build());
        log.info("Updated policy {} ({})", stored.id(), stored.name());
        return stored;
    }

    public void delete(UUID id) {
        if (!repository.delete(id)) {
            throw new NotFoundException("Policy not found: " + id);
        }
        log.info("Deleted policy {}", id);
    }

    public EventPolicy get(UUID id) {
        return repository.findById(id).orElseThrow(() -> new NotFoundException("Policy not found: " + id));
    }

    /**
     * Policies of an organisation node; with {@code includeInherited}, followed
     * by those of its ancestors, closest first, marked inherited.
     */
    public List<EventPolicy> listForOrgNode(UUID orgNodeId, boolean includeInherited) {
        List<EventPolicy> result = new ArrayList<>(repository.findByOrgNodes(List.of(orgNodeId)));
        if (includeInherited) {
            repository.findByOrgNodes(ancestors(orgNodeId)).stream()
                .map(EventPolicy::asInherited)
                .forEach(result::add);
        }
        return result;
    }

    /**
     * Policies of a project; with {@code includeInherited}, followed by those of
     * its owning node and that node's ancestors, marked inherited.
     */
    public List<EventPolicy> listForProject(UUID projectId, UUID owningOrgNodeId, boolean includeInherited) {
        List<EventPolicy> result = new ArrayList<>(repository.findByProject(projectId));
        if (includeInherited && owningOrgNodeId != null) {
            List<UUID> nodes = new ArrayList<>();
            nodes.add(owningOrgNodeId);
            nodes.addAll(ancestors(owningOrgNodeId));
            repository.findByOrgNodes(nodes).stream()
                .map(EventPolicy::asInherited)
                .forEach(result::add);
        }
        return result;
    }

    private List<UUID> ancestors(UUID orgNodeId) {
        try {
            return ancestorLookup.ancestorIds(orgNodeId);
        } catch (RuntimeException e) {
            throw new DependencyException("Ancestor lookup failed for org node " + orgNodeId, e);
        }
    }

    private void validate(EventPolicy policy) {
        if (policy.name() == null || policy.name().isBlank()) {
            throw new ValidationException("name is required");
        }
        if ((policy.projectId() == null) == (policy.orgNodeId() == null)) {
            throw new ValidationException("A policy belongs to exactly one of project_id or org_node_id");
        }
        if (policy.eventTypes().isEmpty()) {
            throw new ValidationException("At least one event type is required");
        }
        for (String type : policy.eventTypes()) {
            registry.require(type);
        }
        if (policy.actionType() == null) {
            throw new ValidationException("action_type is required");
        }
        validateConditions(policy.conditions());
    }

    private void validateConditions(List<PolicyCondition> conditions) {
        for (PolicyCondition condition : conditions) {
            if (condition instanceof AllOf group) {
                validateConditions(group.conditions());
            } else if (condition instanceof FieldCondition leaf) {
                if (leaf.field() == null || leaf.field().isBlank()) {
                    throw new ValidationException("Condition field is required");
                }
                if (ConditionOperator.find(leaf.operator()).isEmpty()) {
                    throw new ValidationException("Unknown condition operator: " + leaf.operator());
                }
            }
        }
    }

    private static String owner(EventPolicy policy) {
        return policy.projectId() != null ? "project " + policy.projectId() : "org node " + policy.orgNodeId();
    }
}
