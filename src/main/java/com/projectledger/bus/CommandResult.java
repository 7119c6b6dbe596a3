package com.projectledger.bus;

import com.projectledger.contract.ProjectEvent;
import com.projectledger.projection.Project;

/**
 * Outcome of a command. {@code event} is null when the command was a no-op.
 */
public record CommandResult(Project project, ProjectEvent event) {

    public boolean isNoOp() {
        return event == null;
    }
}
