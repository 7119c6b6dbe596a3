package com.projectledger.policy;

import java.util.List;
import java.util.UUID;

/**
 * Organisation tree access. Ancestors are returned closest first and
 * exclude the node itself.
 */
@FunctionalInterface
public interface AncestorLookup {

    List<UUID> ancestorIds(UUID orgNodeId);
}
