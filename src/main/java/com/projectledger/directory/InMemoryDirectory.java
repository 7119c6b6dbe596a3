package com.projectledger.directory;

import com.projectledger.notification.OrganisationDirectory;
import com.projectledger.notification.RelatedEntityLookup;
import com.projectledger.policy.AncestorLookup;
import com.projectledger.policy.MembershipDirectory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Organisation tree, people and reference names held in memory. Stands in
 * for the organisation and identity services the ledger reads from.
 */
@Component
public class InMemoryDirectory implements AncestorLookup, MembershipDirectory, OrganisationDirectory,
    RelatedEntityLookup {

    private record OrgNode(UUID id, UUID parentId, String name) {}

    private record Person(UUID id, String name, UUID userId) {}

    private record OrgRole(UUID nodeId, UUID roleId, String name, boolean adminCapable, Set<String> permissions) {}

    private record Grant(UUID nodeId, UUID roleId, UUID personId) {}

    private final Map<UUID, OrgNode> nodes = new ConcurrentHashMap<>();
    private final Map<UUID, Person> persons = new ConcurrentHashMap<>();
    private final Map<UUID, UUID> personByUser = new ConcurrentHashMap<>();
    private final Map<UUID, String> products = new ConcurrentHashMap<>();
    private final Map<UUID, String> projectRoles = new ConcurrentHashMap<>();
    private final List<OrgRole> orgRoles = new CopyOnWriteArrayList<>();
    private final List<Grant> grants = new CopyOnWriteArrayList<>();

    public InMemoryDirectory addOrgNode(UUID id, UUID parentId, String name) {
        nodes.put(id, new OrgNode(id, parentId, name));
        return this;
    }

    /**
     * @param userId user account of the person, or null if they have none
     */
    public InMemoryDirectory addPerson(UUID personId, String name, UUID userId) {
        persons.put(personId, new Person(personId, name, userId));
        if (userId != null) {
            personByUser.put(userId, personId);
        }
        return this;
    }

    public InMemoryDirectory addProduct(UUID productId, String name) {
        products.put(productId, name);
        return this;
    }

    public InMemoryDirectory addProjectRole(UUID projectRoleId, String name) {
        projectRoles.put(projectRoleId, name);
        return this;
    }

    public InMemoryDirectory addOrgRole(UUID nodeId, UUID roleId, String name, boolean adminCapable,
                                        Set<String> permissions) {
        orgRoles.add(new OrgRole(nodeId, roleId, name, adminCapable, Set.copyOf(permissions)));
        return this;
    }

    public InMemoryDirectory grantOrgRole(UUID nodeId, UUID roleId, UUID personId) {
        grants.add(new Grant(nodeId, roleId, personId));
        return this;
    }

    public void clear() {
        nodes.clear();
        persons.clear();
        personByUser.clear();
        products.clear();
        projectRoles.clear();
        orgRoles.clear();
        grants.clear();
    }

    @Override
    public List<UUID> ancestorIds(UUID orgNodeId) {
        List<UUID> ancestors = new ArrayList<>();
        Set<UUID> seen = new HashSet<>();
        seen.add(orgNodeId);
        OrgNode node = nodes.get(orgNodeId);
        while (node != null && node.parentId() != null && seen.add(node.parentId())) {
            ancestors.add(node.parentId());
            node = nodes.get(node.parentId());
        }
        return ancestors;
    }

    @Override
    public Optional<UUID> userIdForPerson(UUID personId) {
        return Optional.ofNullable(persons.get(personId)).map(Person::userId);
    }

    @Override
    public List<UUID> personsWithOrgRole(UUID orgRoleId, UUID orgNodeId) {
        Set<UUID> scope = scopeOf(orgNodeId);
        Set<UUID> result = new LinkedHashSet<>();
        for (Grant grant : grants) {
            if (grant.roleId().equals(orgRoleId) && scope.contains(grant.nodeId())) {
                result.add(grant.personId());
            }
        }
        return List.copyOf(result);
    }

    @Override
    public List<RoleScope> roleScopes(UUID orgNodeId) {
        List<RoleScope> scopes = new ArrayList<>();
        for (OrgRole role : orgRoles) {
            if (!role.nodeId().equals(orgNodeId)) {
                continue;
            }
            int members = (int) grants.stream()
                .filter(g -> g.nodeId().equals(orgNodeId) && g.roleId().equals(role.roleId()))
                .count();
            scopes.add(new RoleScope(role.roleId(), role.name(), role.adminCapable(), members));
        }
        return scopes;
    }

    @Override
    public List<OrgMembership> effectiveMemberships(UUID orgNodeId) {
        Set<UUID> scope = scopeOf(orgNodeId);
        List<OrgMembership> memberships = new ArrayList<>();
        for (Grant grant : grants) {
            if (!scope.contains(grant.nodeId())) {
                continue;
            }
            Set<String> permissions = orgRoles.stream()
                .filter(r -> r.roleId().equals(grant.roleId()) && r.nodeId().equals(grant.nodeId()))
                .findFirst()
                .map(OrgRole::permissions)
                .orElse(Set.of());
            memberships.add(new OrgMembership(grant.personId(), grant.roleId(), permissions));
        }
        return memberships;
    }

    @Override
    public Optional<String> personName(UUID personId) {
        return Optional.ofNullable(persons.get(personId)).map(Person::name);
    }

    @Override
    public Optional<String> userName(UUID userId) {
        return Optional.ofNullable(personByUser.get(userId)).flatMap(this::personName);
    }

    @Override
    public Optional<String> productName(UUID productId) {
        return Optional.ofNullable(products.get(productId));
    }

    @Override
    public Optional<String> projectRoleName(UUID projectRoleId) {
        return Optional.ofNullable(projectRoles.get(projectRoleId));
    }

    @Override
    public Optional<String> orgNodeName(UUID orgNodeId) {
        return Optional.ofNullable(nodes.get(orgNodeId)).map(OrgNode::name);
    }

    private Set<UUID> scopeOf(UUID orgNodeId) {
        Set<UUID> scope = new LinkedHashSet<>();
        scope.add(orgNodeId);
        scope.addAll(ancestorIds(orgNodeId));
        return scope;
    }
}
