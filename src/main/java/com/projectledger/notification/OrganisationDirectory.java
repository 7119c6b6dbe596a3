package com.projectledger.notification;

import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Role scopes and memberships of organisation nodes.
 */
public interface OrganisationDirectory {

    String MANAGE_DETAILS = "manage_details";

    /**
     * A role available on a node. {@code adminCapable} roles can approve
     * project changes.
     */
    record RoleScope(UUID roleId, String roleName, boolean adminCapable, int memberCount) {
    }

    record OrgMembership(UUID personId, UUID roleId, Set<String> permissions) {

        public boolean hasPermission(String permission) {
            return permissions.contains(permission);
        }
    }

    List<RoleScope> roleScopes(UUID orgNodeId);

    /** Memberships of the node, including those granted on ancestors. */
    List<OrgMembership> effectiveMemberships(UUID orgNodeId);
}
