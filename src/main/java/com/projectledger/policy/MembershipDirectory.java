package com.projectledger.policy;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * People, their user accounts and their organisation roles.
 */
public interface MembershipDirectory {

    /** Empty if the person has no user account. */
    Optional<UUID> userIdForPerson(UUID personId);

    List<UUID> personsWithOrgRole(UUID orgRoleId, UUID orgNodeId);
}
