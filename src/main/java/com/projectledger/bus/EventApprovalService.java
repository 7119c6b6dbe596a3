package com.projectledger.bus;

import com.projectledger.contract.EventStatus;
import com.projectledger.contract.ProjectEvent;
import com.projectledger.notification.EventHandlerChain;
import com.projectledger.projection.Project;
import com.projectledger.projection.ProjectProjection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Decides pending events. After the status change the project is rebuilt
 * and the handler chain runs for the decided event.
 */
@Service
public class EventApprovalService {

    private static final Logger log = LoggerFactory.getLogger(EventApprovalService.class);

    private final EventStore eventStore;
    private final ProjectProjection projection;
    private final EventHandlerChain handlerChain;

    public EventApprovalService(EventStore eventStore, ProjectProjection projection, EventHandlerChain handlerChain) {
        this.eventStore = eventStore;
        this.projection = projection;
        this.handlerChain = handlerChain;
    }

    public ProjectEvent approve(UUID eventId) {
        return decide(eventId, EventStatus.APPROVED);
    }

    public ProjectEvent reject(UUID eventId) {
        return decide(eventId, EventStatus.REJECTED);
    }

    public ProjectEvent getEvent(UUID eventId) {
        return eventStore.loadOne(eventId);
    }

    private ProjectEvent decide(UUID eventId, EventStatus status) {
        ProjectEvent updated = eventStore.updateStatus(eventId, status);
        log.info("Event {} ({}) on project={} is now {}",
            eventId, updated.type(), updated.projectId(), status.getValue());
        Project state = projection.reduce(updated.projectId(), eventStore.load(updated.projectId()).events());
        handlerChain.dispatch(updated, state);
        return updated;
    }
}
