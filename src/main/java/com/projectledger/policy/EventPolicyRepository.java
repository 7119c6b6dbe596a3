package com.projectledger.policy;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface EventPolicyRepository {

    EventPolicy save(EventPolicy policy);

    Optional<EventPolicy> findById(UUID id);

    boolean delete(UUID id);

    List<EventPolicy> findByProject(UUID projectId);

    /** Policies owned by any of the given nodes, in the order of {@code orgNodeIds}. */
    List<EventPolicy> findByOrgNodes(Collection<UUID> orgNodeIds);
}
