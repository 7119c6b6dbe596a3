package com.projectledger.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.projectledger.directory.InMemoryDirectory;
import com.projectledger.notification.InMemoryNotificationSender;
import com.projectledger.notification.NotificationType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class ProjectControllerTest {

    @Autowired MockMvc mvc;
    @Autowired ObjectMapper objectMapper;
    @Autowired InMemoryDirectory directory;
    @Autowired InMemoryNotificationSender sender;

    private UUID projectId;
    private UUID actor;

    @BeforeEach
    void setUp() {
        projectId = UUID.randomUUID();
        actor = UUID.randomUUID();
    }

    private String command(String type, String inputJson) {
        return "{\"type\":\"" + type + "\",\"actor\":\"" + actor + "\",\"input\":" + inputJson + "}";
    }

    private JsonNode postEvent(String body, int expectedStatus) throws Exception {
        MvcResult result = mvc.perform(post("/v1/projects/{id}/events", projectId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().is(expectedStatus))
            .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    private void startProject() throws Exception {
        postEvent(command("project.started",
            "{\"title\":\"Apollo\",\"slug\":\"apollo\",\"start_date\":\"2024-01-01\"}"), 200);
    }

    @Test
    @DisplayName("start, rename, repeat rename: the repeat records nothing")
    void renameTwice_secondIsNoOp() throws Exception {
        JsonNode started = postEvent(command("project.started",
            "{\"title\":\"Apollo\",\"slug\":\"apollo\",\"start_date\":\"2024-01-01\"}"), 200);
        assertEquals("recorded", started.get("status").asText());
        assertEquals(1, started.get("project_version").asLong());
        assertEquals("Project Proposal", started.get("event").get("friendly_name").asText());

        JsonNode renamed = postEvent(command("project.title_changed", "{\"title\":\"Artemis\"}"), 200);
        assertEquals("recorded", renamed.get("status").asText());
        assertEquals(2, renamed.get("event").get("version").asLong());
        assertEquals("approved", renamed.get("event").get("status").asText());

        JsonNode repeated = postEvent(command("project.title_changed", "{\"title\":\"Artemis\"}"), 200);
        assertEquals("no_op", repeated.get("status").asText());
        assertEquals(2, repeated.get("project_version").asLong());

        mvc.perform(get("/v1/projects/{id}", projectId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.title").value("Artemis"))
            .andExpect(jsonPath("$.version").value(2))
            .andExpect(jsonPath("$.owner_id").value(actor.toString()))
            .andExpect(jsonPath("$.start_date").value("2024-01-01"));

        mvc.perform(get("/v1/projects/{id}/events", projectId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(2))
            .andExpect(jsonPath("$[0].type").value("project.started"))
            .andExpect(jsonPath("$[1].payload.title").value("Artemis"));
    }

    @Test
    void unknownProject_is404() throws Exception {
        mvc.perform(get("/v1/projects/{id}", projectId))
            .andExpect(status().isNotFound());

        JsonNode error = postEvent(command("project.title_changed", "{\"title\":\"Artemis\"}"), 404);
        assertEquals("NOT_FOUND", error.get("error_code").asText());
    }

    @Test
    void unknownEventType_is400() throws Exception {
        JsonNode error = postEvent(command("project.teleported", "{}"), 400);
        assertEquals("VALIDATION_FAILED", error.get("error_code").asText());
    }

    @Test
    void startingTwice_is400() throws Exception {
        startProject();
        JsonNode error = postEvent(command("project.started", "{\"title\":\"Again\",\"slug\":\"again\"}"), 400);
        assertEquals("VALIDATION_FAILED", error.get("error_code").asText());
    }

    @Test
    void approvalPolicy_holdsChangeUntilApproved() throws Exception {
        startProject();
        UUID reviewerPerson = UUID.randomUUID();
        UUID reviewerUser = UUID.randomUUID();
        directory.addPerson(reviewerPerson, "Rae", reviewerUser);

        MvcResult created = mvc.perform(post("/v1/policies")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"Renames need approval\",\"project_id\":\"" + projectId + "\","
                    + "\"event_types\":[\"project.title_changed\"],\"action_type\":\"request_approval\","
                    + "\"recipient_person_ids\":[\"" + reviewerPerson + "\"]}"))
            .andExpect(status().is2xxSuccessful())
            .andExpect(jsonPath("$.id").exists())
            .andReturn();
        String policyId = objectMapper.readTree(created.getResponse().getContentAsString()).get("id").asText();

        JsonNode pending = postEvent(command("project.title_changed", "{\"title\":\"Artemis\"}"), 200);
        assertEquals("pending", pending.get("event").get("status").asText());
        String eventId = pending.get("event").get("id").asText();
        assertEquals(NotificationType.APPROVAL_REQUEST, sender.forUser(reviewerUser).get(0).type());

        mvc.perform(get("/v1/projects/{id}", projectId))
            .andExpect(jsonPath("$.title").value("Apollo"));

        mvc.perform(post("/v1/events/{id}/approve", eventId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("approved"));
        mvc.perform(post("/v1/events/{id}/reject", eventId))
            .andExpect(status().isBadRequest());

        mvc.perform(get("/v1/projects/{id}", projectId))
            .andExpect(jsonPath("$.title").value("Artemis"));
        assertEquals(NotificationType.STATUS_UPDATE,
            sender.forEvent(UUID.fromString(eventId)).stream()
                .filter(n -> n.userId().equals(actor))
                .findFirst().orElseThrow().type());

        mvc.perform(get("/v1/projects/{id}/policies", projectId))
            .andExpect(jsonPath("$.length()").value(1))
            .andExpect(jsonPath("$[0].name").value("Renames need approval"));

        mvc.perform(delete("/v1/policies/{id}", policyId))
            .andExpect(status().is2xxSuccessful());
        mvc.perform(get("/v1/policies/{id}", policyId))
            .andExpect(status().isNotFound());
    }

    @Test
    void eventTypes_areListed() throws Exception {
        mvc.perform(get("/v1/event-types"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(13))
            .andExpect(jsonPath("$[0].type").value("project.started"))
            .andExpect(jsonPath("$[0].creates_project").value(true));
    }
}
