package com.projectledger.notification;

import com.projectledger.contract.ProjectEvent;
import com.projectledger.policy.RecipientResolver;
import com.projectledger.projection.Project;

import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Tells project members about approved changes.
 */
public class ProjectEventNotificationHandler implements ProjectEventHandler {

    private final MessageComposer messageComposer;
    private final RecipientResolver recipientResolver;
    private final NotificationDispatcher dispatcher;

    public ProjectEventNotificationHandler(MessageComposer messageComposer,
                                           RecipientResolver recipientResolver,
                                           NotificationDispatcher dispatcher) {
        this.messageComposer = messageComposer;
        this.recipientResolver = recipientResolver;
        this.dispatcher = dispatcher;
    }

    @Override
    public boolean canHandle(ProjectEvent event) {
        return event.isApproved();
    }

    @Override
    public void handle(ProjectEvent event, Project project) {
        Optional<String> message = messageComposer.memberNotification(event, project);
        if (message.isEmpty()) {
            return;
        }
        Set<UUID> members = recipientResolver.usersForPersons(project.memberPersonIds());
        if (!members.isEmpty()) {
            dispatcher.dispatch(NotificationType.INFO, members, event.id(), message.get());
        }
    }
}
