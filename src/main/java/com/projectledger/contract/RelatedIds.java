package com.projectledger.contract;

import java.util.UUID;

/**
 * Ids of entities an event refers to, used to hydrate message templates.
 * Any component may be null.
 */
public record RelatedIds(UUID personId, UUID productId, UUID projectRoleId, UUID orgNodeId) {

    public static final RelatedIds NONE = new RelatedIds(null, null, null, null);

    public static RelatedIds person(UUID personId, UUID projectRoleId) {
        return new RelatedIds(personId, null, projectRoleId, null);
    }

    public static RelatedIds product(UUID productId) {
        return new RelatedIds(null, productId, null, null);
    }

    public static RelatedIds orgNode(UUID orgNodeId) {
        return new RelatedIds(null, null, null, orgNodeId);
    }
}
