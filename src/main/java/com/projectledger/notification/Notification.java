package com.projectledger.notification;

import java.time.Instant;
import java.util.UUID;

public record Notification(
    UUID id,
    UUID userId,
    UUID eventId,
    NotificationType type,
    String message,
    Instant createdAt
) {
}
