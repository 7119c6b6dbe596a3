package com.projectledger.notification;

import com.projectledger.policy.AncestorLookup;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Finds the organisation node whose administrators approve changes to a
 * project: the owning node itself if it has an admin-capable role with
 * members, otherwise the closest ancestor that does.
 */
public class ApprovalNodeResolver {

    private final OrganisationDirectory directory;
    private final AncestorLookup ancestorLookup;

    public ApprovalNodeResolver(OrganisationDirectory directory, AncestorLookup ancestorLookup) {
        this.directory = directory;
        this.ancestorLookup = ancestorLookup;
    }

    public Optional<UUID> resolve(UUID orgNodeId) {
        if (orgNodeId == null) {
            return Optional.empty();
        }
        List<UUID> candidates = new ArrayList<>();
        candidates.add(orgNodeId);
        candidates.addAll(ancestorLookup.ancestorIds(orgNodeId));
        for (UUID nodeId : candidates) {
            boolean hasApprovers = directory.roleScopes(nodeId).stream()
                .anyMatch(scope -> scope.adminCapable() && scope.memberCount() > 0);
            if (hasApprovers) {
                return Optional.of(nodeId);
            }
        }
        return Optional.empty();
    }
}
