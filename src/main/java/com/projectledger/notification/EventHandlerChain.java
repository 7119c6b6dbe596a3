package com.projectledger.notification;

import com.projectledger.contract.ProjectEvent;
import com.projectledger.projection.Project;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs every interested handler for an event, in registration order.
 * Handler failures are logged and do not affect the other handlers.
 */
public class EventHandlerChain {

    private static final Logger log = LoggerFactory.getLogger(EventHandlerChain.class);

    private final List<ProjectEventHandler> handlers;

    public EventHandlerChain(List<ProjectEventHandler> handlers) {
        this.handlers = List.copyOf(handlers);
    }

    public void dispatch(ProjectEvent event, Project project) {
        for (ProjectEventHandler handler : handlers) {
            if (!handler.canHandle(event)) {
                continue;
            }
            try {
                handler.handle(event, project);
            } catch (RuntimeException e) {
                log.warn("Handler {} failed for event {} ({})",
                    handler.getClass().getSimpleName(), event.id(), event.type(), e);
            }
        }
    }
}
