package com.projectledger.contract;

import java.util.UUID;

/**
 * A person holding a project role. The pair is unique within a project.
 */
public record ProjectMember(UUID personId, UUID projectRoleId) {
}
