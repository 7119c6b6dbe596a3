package com.projectledger.contract;

import java.util.UUID;

public record DecisionContext(UUID projectId, UUID actor, EventStatus status) {
}
