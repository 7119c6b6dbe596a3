package com.projectledger.api;

import com.projectledger.bus.EventApprovalService;
import com.projectledger.contract.EventType;
import com.projectledger.contract.EventTypeRegistry;
import com.projectledger.contract.ProjectEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/v1")
public class EventController {

    private final EventApprovalService approvalService;
    private final EventTypeRegistry registry;

    public EventController(EventApprovalService approvalService, EventTypeRegistry registry) {
        this.approvalService = approvalService;
        this.registry = registry;
    }

    @GetMapping("/events/{eventId}")
    public ProjectEvent getEvent(@PathVariable UUID eventId) {
        return approvalService.getEvent(eventId);
    }

    @PostMapping("/events/{eventId}/approve")
    public ProjectEvent approve(@PathVariable UUID eventId) {
        return approvalService.approve(eventId);
    }

    @PostMapping("/events/{eventId}/reject")
    public ProjectEvent reject(@PathVariable UUID eventId) {
        return approvalService.reject(eventId);
    }

    @GetMapping("/event-types")
    public List<Map<String, Object>> eventTypes() {
        return registry.all().stream().map(EventController::describe).toList();
    }

    private static Map<String, Object> describe(EventType<?, ?> type) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("type", type.type());
        body.put("friendly_name", type.friendlyName());
        body.put("creates_project", type.createsProject());
        body.put("notifies_members", type.notifiesMembers());
        return body;
    }
}
