package com.projectledger.api;

import com.projectledger.policy.EventPolicy;
import com.projectledger.policy.EventPolicyService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/v1")
public class PolicyController {

    private final EventPolicyService policyService;

    public PolicyController(EventPolicyService policyService) {
        this.policyService = policyService;
    }

    @PostMapping("/policies")
    @ResponseStatus(HttpStatus.CREATED)
    public EventPolicy create(@RequestBody PolicyRequest request) {
        return policyService.create(request.toPolicy());
    }

    @GetMapping("/policies/{policyId}")
    public EventPolicy get(@PathVariable UUID policyId) {
        return policyService.get(policyId);
    }

    @PutMapping("/policies/{policyId}")
    public EventPolicy update(@PathVariable UUID policyId, @RequestBody PolicyRequest request) {
        return policyService.update(policyId, request.toPolicy());
    }

    @DeleteMapping("/policies/{policyId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable UUID policyId) {
        policyService.delete(policyId);
    }

    @GetMapping("/org-nodes/{orgNodeId}/policies")
    public List<EventPolicy> listForOrgNode(@PathVariable UUID orgNodeId,
                                            @RequestParam(name = "include_inherited", defaultValue = "true")
                                            boolean includeInherited) {
        return policyService.listForOrgNode(orgNodeId, includeInherited);
    }
}
