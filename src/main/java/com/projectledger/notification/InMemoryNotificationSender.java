package com.projectledger.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps sent notifications in memory so they can be listed per user.
 */
public class InMemoryNotificationSender implements NotificationSender {

    private static final Logger log = LoggerFactory.getLogger(InMemoryNotificationSender.class);

    private final CopyOnWriteArrayList<Notification> notifications = new CopyOnWriteArrayList<>();

    @Override
    public void sendNotification(UUID userId, UUID eventId, String message) {
        record(userId, eventId, NotificationType.INFO, message);
    }

    @Override
    public void sendApprovalRequest(UUID userId, UUID eventId, String message) {
        record(userId, eventId, NotificationType.APPROVAL_REQUEST, message);
    }

    @Override
    public void sendStatusUpdate(UUID userId, UUID eventId, String message) {
        record(userId, eventId, NotificationType.STATUS_UPDATE, message);
    }

    public List<Notification> all() {
        return List.copyOf(notifications);
    }

    public List<Notification> forUser(UUID userId) {
        return notifications.stream().filter(n -> n.userId().equals(userId)).toList();
    }

    public List<Notification> forEvent(UUID eventId) {
        return notifications.stream().filter(n -> n.eventId().equals(eventId)).toList();
    }

    public void clear() {
        notifications.clear();
    }

    private void record(UUID userId, UUID eventId, NotificationType type, String message) {
        notifications.add(new Notification(UUID.randomUUID(), userId, eventId, type, message, Instant.now()));
        log.debug("Notification {} to user={} for event={}: {}", type.getValue(), userId, eventId, message);
    }
}
