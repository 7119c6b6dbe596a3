package com.projectledger.notification;

import com.fasterxml.jackson.annotation.JsonValue;

public enum NotificationType {
    INFO("info"),
    APPROVAL_REQUEST("approval_request"),
    STATUS_UPDATE("status_update");

    private final String value;

    NotificationType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
