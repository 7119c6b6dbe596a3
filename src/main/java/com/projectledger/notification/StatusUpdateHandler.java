package com.projectledger.notification;

import com.projectledger.contract.ProjectEvent;
import com.projectledger.projection.Project;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Tells the author of an event that it was approved or rejected.
 */
public class StatusUpdateHandler implements ProjectEventHandler {

    private static final Logger log = LoggerFactory.getLogger(StatusUpdateHandler.class);

    private final MessageComposer messageComposer;
    private final NotificationDispatcher dispatcher;

    public StatusUpdateHandler(MessageComposer messageComposer, NotificationDispatcher dispatcher) {
        this.messageComposer = messageComposer;
        this.dispatcher = dispatcher;
    }

    @Override
    public boolean canHandle(ProjectEvent event) {
        return event.status().isTerminal();
    }

    @Override
    public void handle(ProjectEvent event, Project project) {
        if (event.createdBy() == null) {
            log.debug("Event {} has no author to notify", event.id());
            return;
        }
        dispatcher.dispatch(NotificationType.STATUS_UPDATE, List.of(event.createdBy()), event.id(),
            messageComposer.statusUpdate(event, project));
    }
}
