package com.projectledger.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.projectledger.contract.EventStatus;

import java.util.UUID;

/**
 * Body of {@code POST /v1/projects/{projectId}/events}. {@code status} is
 * optional.
 */
public record CommandRequest(String type, UUID actor, JsonNode input, EventStatus status) {
}
