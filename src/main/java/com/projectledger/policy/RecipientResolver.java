package com.projectledger.policy;

import com.projectledger.projection.Project;

import java.util.Collection;
import java.util.Set;
import java.util.UUID;

/**
 * Turns policy recipients into user ids. People without a user
 * account are left out.
 */
public interface RecipientResolver {

    Set<UUID> usersForPersons(Collection<UUID> personIds);

    Set<UUID> usersWithProjectRole(UUID projectRoleId, Project project);

    Set<UUID> usersWithOrgRole(UUID orgRoleId, UUID orgNodeId);

    /** Unknown strategy names resolve to nobody. */
    Set<UUID> dynamicRecipients(String strategy, Project project);
}
