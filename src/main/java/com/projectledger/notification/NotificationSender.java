package com.projectledger.notification;

import java.util.UUID;

/**
 * Delivery channel for user notifications.
 */
public interface NotificationSender {

    void sendNotification(UUID userId, UUID eventId, String message);

    void sendApprovalRequest(UUID userId, UUID eventId, String message);

    void sendStatusUpdate(UUID userId, UUID eventId, String message);
}
