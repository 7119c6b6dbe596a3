package com.projectledger.contract;

import com.projectledger.projection.Project;

@FunctionalInterface
public interface EventApplier<P extends EventPayload> {

    void apply(Project project, P payload, ProjectEvent event);
}
