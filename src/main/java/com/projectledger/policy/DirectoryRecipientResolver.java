package com.projectledger.policy;

import com.projectledger.contract.ProjectMember;
import com.projectledger.projection.Project;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

public class DirectoryRecipientResolver implements RecipientResolver {

    private static final Logger log = LoggerFactory.getLogger(DirectoryRecipientResolver.class);

    private final MembershipDirectory directory;
    private final Map<String, DynamicRecipientStrategy> strategies;

    public DirectoryRecipientResolver(MembershipDirectory directory, Map<String, DynamicRecipientStrategy> strategies) {
        this.directory = directory;
        this.strategies = Map.copyOf(strategies);
    }

    @Override
    public Set<UUID> usersForPersons(Collection<UUID> personIds) {
        Set<UUID> users = new LinkedHashSet<>();
        for (UUID personId : personIds) {
            directory.userIdForPerson(personId).ifPresentOrElse(
                users::add,
                () -> log.debug("Person {} has no user account, skipping", personId));
        }
        return users;
    }

    @Override
    public Set<UUID> usersWithProjectRole(UUID projectRoleId, Project project) {
        return usersForPersons(project.getMembers().stream()
            .filter(m -> Objects.equals(m.projectRoleId(), projectRoleId))
            .map(ProjectMember::personId)
            .distinct()
            .toList());
    }

    @Override
    public Set<UUID> usersWithOrgRole(UUID orgRoleId, UUID orgNodeId) {
        if (orgNodeId == null) {
            return Set.of();
        }
        return usersForPersons(directory.personsWithOrgRole(orgRoleId, orgNodeId));
    }

    @Override
    public Set<UUID> dynamicRecipients(String strategy, Project project) {
        DynamicRecipientStrategy resolver = strategies.get(strategy);
        if (resolver == null) {
            log.warn("Unknown dynamic recipient strategy '{}'", strategy);
            return Set.of();
        }
        return resolver.resolve(project, this);
    }
}
