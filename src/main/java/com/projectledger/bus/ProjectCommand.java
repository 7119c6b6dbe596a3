package com.projectledger.bus;

import com.projectledger.contract.EventStatus;

import java.util.UUID;

/**
 * A request to record a change against a project.
 *
 * @param input  typed input record, or a map/JSON tree bound to the type's input
 * @param status explicit initial status; null lets approval policies decide
 */
public record ProjectCommand(String type, UUID projectId, UUID actor, Object input, EventStatus status) {

    public ProjectCommand(String type, UUID projectId, UUID actor, Object input) {
        this(type, projectId, actor, input, null);
    }
}
