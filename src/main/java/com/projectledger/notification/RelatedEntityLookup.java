package com.projectledger.notification;

import java.util.Optional;
import java.util.UUID;

/**
 * Display names for entities referenced by events. Every lookup may come
 * back empty; messages then fall back to generic wording.
 */
public interface RelatedEntityLookup {

    default Optional<String> personName(UUID personId) {
        return Optional.empty();
    }

    default Optional<String> userName(UUID userId) {
        return Optional.empty();
    }

    default Optional<String> productName(UUID productId) {
        return Optional.empty();
    }

    default Optional<String> projectRoleName(UUID projectRoleId) {
        return Optional.empty();
    }

    default Optional<String> orgNodeName(UUID orgNodeId) {
        return Optional.empty();
    }
}
