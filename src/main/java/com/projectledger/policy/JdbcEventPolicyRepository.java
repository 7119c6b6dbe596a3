package com.projectledger.policy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Policies in the {@code event_policy} table. List-valued columns hold JSON.
 */
public class JdbcEventPolicyRepository implements EventPolicyRepository {

    private static final String COLUMNS = "id, name, description, event_types, conditions, action_type, "
        + "message_template, recipient_person_ids, recipient_project_role_ids, recipient_org_role_ids, "
        + "recipient_dynamic, project_id, org_node_id, enabled";

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final TypeReference<List<PolicyCondition>> CONDITIONS = new TypeReference<>() {};
    private static final TypeReference<Set<UUID>> UUID_SET = new TypeReference<>() {};
    private static final TypeReference<Set<String>> STRING_SET = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<EventPolicy> rowMapper = this::mapRow;

    public JdbcEventPolicyRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public EventPolicy save(EventPolicy policy) {
        EventPolicy stored = policy.id() != null ? policy : policy.withId(UUID.randomUUID());
        int updated = jdbcTemplate.update(
            "UPDATE event_policy SET name = ?, description = ?, event_types = ?, conditions = ?, action_type = ?, "
                + "message_template = ?, recipient_person_ids = ?, recipient_project_role_ids = ?, "
                + "recipient_org_role_ids = ?, recipient_dynamic = ?, project_id = ?, org_node_id = ?, enabled = ? "
                + "WHERE id = ?",
            stored.name(),
            stored.description(),
            json(stored.eventTypes()),
            json(stored.conditions()),
            stored.actionType().getValue(),
            stored.messageTemplate(),
            json(stored.recipientPersonIds()),
            json(stored.recipientProjectRoleIds()),
            json(stored.recipientOrgRoleIds()),
            json(stored.recipientDynamic()),
            stored.projectId(),
            stored.orgNodeId(),
            stored.enabled(),
            stored.id());
        if (updated == 0) {
            jdbcTemplate.update(
                "INSERT INTO event_policy (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                stored.id(),
                stored.name(),
                stored.description(),
                json(stored.eventTypes()),
                json(stored.conditions()),
                stored.actionType().getValue(),
                stored.messageTemplate(),
                json(stored.recipientPersonIds()),
                json(stored.recipientProjectRoleIds()),
                json(stored.recipientOrgRoleIds()),
                json(stored.recipientDynamic()),
                stored.projectId(),
                stored.orgNodeId(),
                stored.enabled());
        }
        return stored;
    }

    @Override
    public Optional<EventPolicy> findById(UUID id) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM event_policy WHERE id = ?", rowMapper, id)
            .stream().findFirst();
    }

    @Override
    public boolean delete(UUID id) {
        return jdbcTemplate.update("DELETE FROM event_policy WHERE id = ?", id) > 0;
    }

    @Override
    public List<EventPolicy> findByProject(UUID projectId) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM event_policy WHERE project_id = ? ORDER BY name", rowMapper, projectId);
    }

    @Override
    public List<EventPolicy> findByOrgNodes(Collection<UUID> orgNodeIds) {
        List<EventPolicy> result = new ArrayList<>();
        for (UUID nodeId : orgNodeIds) {
            result.addAll(jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM event_policy WHERE org_node_id = ? ORDER BY name", rowMapper, nodeId));
        }
        return result;
    }

    private EventPolicy mapRow(ResultSet rs, int rowNum) throws SQLException {
        return EventPolicy.builder()
            .id(rs.getObject("id", UUID.class))
            .name(rs.getString("name"))
            .description(rs.getString("description"))
            .eventTypes(read(rs.getString("event_types"), STRING_LIST))
            .conditions(read(rs.getString("conditions"), CONDITIONS))
            .actionType(ActionType.fromValue(rs.getString("action_type")))
            .messageTemplate(rs.getString("message_template"))
            .recipientPersonIds(read(rs.getString("recipient_person_ids"), UUID_SET))
            .recipientProjectRoleIds(read(rs.getString("recipient_project_role_ids"), UUID_SET))
            .recipientOrgRoleIds(read(rs.getString("recipient_org_role_ids"), UUID_SET))
            .recipientDynamic(read(rs.getString("recipient_dynamic"), STRING_SET))
            .projectId(rs.getObject("project_id", UUID.class))
            .orgNodeId(rs.getObject("org_node_id", UUID.class))
            .enabled(rs.getBoolean("enabled"))
            .build();
    }

    private String json(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise policy column", e);
        }
    }

    private <T> T read(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt policy column: " + json, e);
        }
    }
}
