package com.projectledger.policy;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryEventPolicyRepository implements EventPolicyRepository {

    private final Map<UUID, EventPolicy> policies = new ConcurrentHashMap<>();

    @Override
    public EventPolicy save(EventPolicy policy) {
        EventPolicy stored = policy.id() != null ? policy : policy.withId(UUID.randomUUID());
        policies.put(stored.id(), stored);
        return stored;
    }

    @Override
    public Optional<EventPolicy> findById(UUID id) {
        return Optional.ofNullable(policies.get(id));
    }

    @Override
    public boolean delete(UUID id) {
        return policies.remove(id) != null;
    }

    @Override
    public List<EventPolicy> findByProject(UUID projectId) {
        return policies.values().stream()
            .filter(p -> projectId.equals(p.projectId()))
            .sorted(Comparator.comparing(EventPolicy::name, Comparator.nullsLast(Comparator.naturalOrder())))
            .toList();
    }

    @Override
    public List<EventPolicy> findByOrgNodes(Collection<UUID> orgNodeIds) {
        List<EventPolicy> result = new ArrayList<>();
        for (UUID nodeId : orgNodeIds) {
            policies.values().stream()
                .filter(p -> nodeId.equals(p.orgNodeId()))
                .sorted(Comparator.comparing(EventPolicy::name, Comparator.nullsLast(Comparator.naturalOrder())))
                .forEach(result::add);
        }
        return result;
    }
}
