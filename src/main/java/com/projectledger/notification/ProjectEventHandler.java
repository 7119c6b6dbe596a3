package com.projectledger.notification;

import com.projectledger.contract.ProjectEvent;
import com.projectledger.projection.Project;

/**
 * Reaction to a recorded or decided event. Runs after the event is stored;
 * a failing handler never undoes the event.
 */
public interface ProjectEventHandler {

    boolean canHandle(ProjectEvent event);

    /**
     * @param project state after the event was applied
     */
    void handle(ProjectEvent event, Project project);
}
