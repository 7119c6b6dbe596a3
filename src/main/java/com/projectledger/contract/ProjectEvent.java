package com.projectledger.contract;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A single recorded change to a project aggregate.
 *
 * Version is 0 until the event is appended; the store assigns the
 * position in the project's stream.
 */
public record ProjectEvent(
    UUID id,
    UUID projectId,
    long version,
    String type,
    String friendlyName,
    UUID createdBy,
    Instant occurredAt,
    EventStatus status,
    EventPayload payload
) {

    public ProjectEvent {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(projectId, "projectId");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(payload, "payload");
    }

    public ProjectEvent withVersion(long newVersion) {
        return new ProjectEvent(id, projectId, newVersion, type, friendlyName, createdBy, occurredAt, status, payload);
    }

    public ProjectEvent withStatus(EventStatus newStatus) {
        return new ProjectEvent(id, projectId, version, type, friendlyName, createdBy, occurredAt, newStatus, payload);
    }

    @JsonIgnore
    public boolean isPending() {
        return status == EventStatus.PENDING;
    }

    @JsonIgnore
    public boolean isApproved() {
        return status == EventStatus.APPROVED;
    }

    @JsonIgnore
    public boolean isRejected() {
        return status == EventStatus.REJECTED;
    }
}
