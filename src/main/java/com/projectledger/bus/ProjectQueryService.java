package com.projectledger.bus;

import com.projectledger.contract.ProjectEvent;
import com.projectledger.projection.Project;
import com.projectledger.projection.ProjectProjection;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
public class ProjectQueryService {

    private final EventStore eventStore;
    private final ProjectProjection projection;

    public ProjectQueryService(EventStore eventStore, ProjectProjection projection) {
        this.eventStore = eventStore;
        this.projection = projection;
    }

    /** Current state, empty if the project has never been started. */
    public Optional<Project> getProject(UUID projectId) {
        EventStream stream = eventStore.load(projectId);
        if (stream.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(projection.reduce(projectId, stream.events()));
    }

    public List<ProjectEvent> getHistory(UUID projectId) {
        return eventStore.load(projectId).events();
    }
}
