package com.projectledger.api;

import com.projectledger.bus.CommandResult;
import com.projectledger.bus.ProjectCommand;
import com.projectledger.bus.ProjectCommandService;
import com.projectledger.bus.ProjectQueryService;
import com.projectledger.contract.ProjectEvent;
import com.projectledger.contract.ValidationException;
import com.projectledger.policy.EventPolicy;
import com.projectledger.policy.EventPolicyService;
import com.projectledger.projection.Project;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * POST /v1/projects/{projectId}/events   record a change
 * GET  /v1/projects/{projectId}          current state
 * GET  /v1/projects/{projectId}/events   full history
 * GET  /v1/projects/{projectId}/policies applicable policies
 */
@RestController
@RequestMapping("/v1/projects")
public class ProjectController {

    private final ProjectCommandService commandService;
    private final ProjectQueryService queryService;
    private final EventPolicyService policyService;

    public ProjectController(ProjectCommandService commandService,
                             ProjectQueryService queryService,
                             EventPolicyService policyService) {
        this.commandService = commandService;
        this.queryService = queryService;
        this.policyService = policyService;
    }

    @PostMapping("/{projectId}/events")
    public Map<String, Object> execute(@PathVariable UUID projectId, @RequestBody CommandRequest request) {
        if (request.type() == null || request.type().isBlank()) {
            throw new ValidationException("type is required");
        }
        CommandResult result = commandService.execute(
            new ProjectCommand(request.type(), projectId, request.actor(), request.input(), request.status()));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", result.isNoOp() ? "no_op" : "recorded");
        body.put("project_version", result.project() != null ? result.project().getVersion() : 0);
        if (!result.isNoOp()) {
            body.put("event", result.event());
        }
        return body;
    }

    @GetMapping("/{projectId}")
    public ResponseEntity<Project> getProject(@PathVariable UUID projectId) {
        return queryService.getProject(projectId)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{projectId}/events")
    public List<ProjectEvent> getHistory(@PathVariable UUID projectId) {
        return queryService.getHistory(projectId);
    }

    @GetMapping("/{projectId}/policies")
    public List<EventPolicy> getPolicies(@PathVariable UUID projectId,
                                         @RequestParam(name = "include_inherited", defaultValue = "true")
                                         boolean includeInherited) {
        UUID owningOrgNodeId = queryService.getProject(projectId)
            .map(Project::getOwningOrgNodeId)
            .orElse(null);
        return policyService.listForProject(projectId, owningOrgNodeId, includeInherited);
    }
}
