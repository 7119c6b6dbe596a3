package com.projectledger.projection;

import com.projectledger.contract.EventTypeRegistry;
import com.projectledger.contract.ProjectEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Rebuilds project state from its event stream.
 *
 * Every event advances the version. Only approved events change fields;
 * pending and rejected events are history only. Events whose type is no
 * longer registered are logged and skipped.
 */
@Service
public class ProjectProjection {

    private static final Logger log = LoggerFactory.getLogger(ProjectProjection.class);

    private final EventTypeRegistry registry;

    public ProjectProjection(EventTypeRegistry registry) {
        this.registry = registry;
    }

    public Project reduce(UUID projectId, List<ProjectEvent> events) {
        Project project = new Project(projectId);
        for (ProjectEvent event : events) {
            apply(project, event);
        }
        return project;
    }

    public void apply(Project project, ProjectEvent event) {
        project.setVersion(Math.max(project.getVersion(), event.version()));
        if (!event.isApproved()) {
            return;
        }
        if (!registry.apply(project, event)) {
            log.warn("Skipping unrecognised event type={} id={} project={}",
                event.type(), event.id(), event.projectId());
        }
    }

    /**
     * State as it would be if {@code event} were approved, without touching
     * {@code current}. Used to evaluate approval policies before append.
     */
    public Project preview(Project current, ProjectEvent event) {
        Project candidate = current != null ? current.copy() : new Project(event.projectId());
        registry.apply(candidate, event);
        return candidate;
    }
}
