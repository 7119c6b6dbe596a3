package com.projectledger.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Fans a message out to a set of users. Sends run concurrently on the
 * supplied executor; failed sends are collected and reported together
 * once every send has finished.
 */
public class NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final NotificationSender sender;
    private final Executor executor;

    public NotificationDispatcher(NotificationSender sender, Executor executor) {
        this.sender = sender;
        this.executor = executor;
    }

    public record DispatchResult(int delivered, List<Throwable> failures) {

        public boolean hasFailures() {
            return !failures.isEmpty();
        }
    }

    public DispatchResult dispatch(NotificationType type, Collection<UUID> userIds, UUID eventId, String message) {
        List<CompletableFuture<Void>> sends = new ArrayList<>(userIds.size());
        for (UUID userId : userIds) {
            sends.add(CompletableFuture.runAsync(() -> send(type, userId, eventId, message), executor));
        }

        int delivered = 0;
        List<Throwable> failures = new ArrayList<>();
        for (CompletableFuture<Void> send : sends) {
            try {
                send.join();
                delivered++;
            } catch (CompletionException e) {
                failures.add(e.getCause() != null ? e.getCause() : e);
            }
        }

        if (!failures.isEmpty()) {
            RuntimeException summary = new RuntimeException(
                failures.size() + " of " + sends.size() + " " + type.getValue() + " notification(s) failed");
            failures.forEach(summary::addSuppressed);
            log.warn("Dispatch for event {} incomplete", eventId, summary);
        }
        return new DispatchResult(delivered, List.copyOf(failures));
    }

    private void send(NotificationType type, UUID userId, UUID eventId, String message) {
        switch (type) {
            case INFO -> sender.sendNotification(userId, eventId, message);
            case APPROVAL_REQUEST -> sender.sendApprovalRequest(userId, eventId, message);
            case STATUS_UPDATE -> sender.sendStatusUpdate(userId, eventId, message);
        }
    }
}
