package com.projectledger.policy;

import com.projectledger.projection.Project;

import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Named recipient set computed from project state, referenced by policies
 * in {@code recipient_dynamic}.
 */
@FunctionalInterface
public interface DynamicRecipientStrategy {

    String PROJECT_MEMBERS = "project_members";
    String PROJECT_OWNER = "project_owner";
    String ORG_ADMINS = "org_admins";

    Set<UUID> resolve(Project project, RecipientResolver resolver);

    /**
     * Built-in strategies. {@code org_admins} has no source of organisation
     * administrators yet and resolves to nobody.
     */
    static Map<String, DynamicRecipientStrategy> defaults() {
        return Map.of(
            PROJECT_MEMBERS, (project, resolver) -> resolver.usersForPersons(project.memberPersonIds()),
            PROJECT_OWNER, (project, resolver) -> project.getOwnerId() != null
                ? Set.of(project.getOwnerId())
                : Set.of(),
            ORG_ADMINS, (project, resolver) -> Set.of()
        );
    }
}
