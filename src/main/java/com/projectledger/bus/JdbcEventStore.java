package com.projectledger.bus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.projectledger.contract.EventPayload;
import com.projectledger.contract.EventPayload.UnrecognizedPayload;
import com.projectledger.contract.EventStatus;
import com.projectledger.contract.EventType;
import com.projectledger.contract.EventTypeRegistry;
import com.projectledger.contract.NotFoundException;
import com.projectledger.contract.ProjectEvent;
import com.projectledger.contract.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Relational event store. The unique (project_id, version) constraint is the
 * final arbiter of concurrent appends; a violation surfaces as
 * {@link ConcurrencyException}.
 */
public class JdbcEventStore implements EventStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcEventStore.class);

    private static final String COLUMNS =
        "id, project_id, version, type, friendly_name, status, created_by, occurred_at, payload";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final EventTypeRegistry registry;
    private final ObjectMapper objectMapper;
    private final RowMapper<ProjectEvent> rowMapper = this::mapRow;

    public JdbcEventStore(JdbcTemplate jdbcTemplate,
                          TransactionTemplate transactionTemplate,
                          EventTypeRegistry registry,
                          ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.registry = registry;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<ProjectEvent> append(UUID projectId, long expectedVersion, List<ProjectEvent> events) {
        if (events.isEmpty()) {
            return List.of();
        }
        long actual = currentVersion(projectId);
        if (actual != expectedVersion) {
            throw new ConcurrencyException(projectId, expectedVersion, actual);
        }

        List<ProjectEvent> stored = new ArrayList<>(events.size());
        long version = expectedVersion;
        for (ProjectEvent event : events) {
            if (!projectId.equals(event.projectId())) {
                throw new ValidationException("Event " + event.id() + " belongs to project " + event.projectId());
            }
            stored.add(event.withVersion(++version));
        }

        try {
            transactionTemplate.executeWithoutResult(status -> {
                for (ProjectEvent event : stored) {
                    jdbcTemplate.update(
                        "INSERT INTO project_event (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
                        event.id(),
                        event.projectId(),
                        event.version(),
                        event.type(),
                        event.friendlyName(),
                        event.status().getValue(),
                        event.createdBy(),
                        event.occurredAt().atOffset(ZoneOffset.UTC),
                        writePayload(event.payload())
                    );
                }
            });
        } catch (DuplicateKeyException | ConcurrencyFailureException e) {
            throw new ConcurrencyException(projectId, expectedVersion, e);
        } catch (DataAccessException e) {
            if (currentVersion(projectId) != expectedVersion) {
                throw new ConcurrencyException(projectId, expectedVersion, e);
            }
            throw e;
        }
        log.debug("Appended {} event(s) to project={} at version={}", stored.size(), projectId, version);
        return List.copyOf(stored);
    }

    @Override
    public EventStream load(UUID projectId) {
        List<ProjectEvent> events = jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM project_event WHERE project_id = ? ORDER BY version",
            rowMapper, projectId);
        if (events.isEmpty()) {
            return EventStream.EMPTY;
        }
        return new EventStream(events, events.get(events.size() - 1).version());
    }

    @Override
    public ProjectEvent loadOne(UUID eventId) {
        return findOne(eventId).orElseThrow(() -> new NotFoundException("Event not found: " + eventId));
    }

    @Override
    public ProjectEvent updateStatus(UUID eventId, EventStatus newStatus) {
        if (newStatus == null || !newStatus.isTerminal()) {
            throw new ValidationException("Event status can only move to approved or rejected, got " + newStatus);
        }
        int updated = jdbcTemplate.update(
            "UPDATE project_event SET status = ? WHERE id = ? AND status = ?",
            newStatus.getValue(), eventId, EventStatus.PENDING.getValue());
        ProjectEvent event = loadOne(eventId);
        if (updated == 0) {
            throw new ValidationException("Event " + eventId + " is already " + event.status().getValue());
        }
        return event;
    }

    private Optional<ProjectEvent> findOne(UUID eventId) {
        List<ProjectEvent> rows = jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM project_event WHERE id = ?", rowMapper, eventId);
        return rows.stream().findFirst();
    }

    private long currentVersion(UUID projectId) {
        Long max = jdbcTemplate.queryForObject(
            "SELECT MAX(version) FROM project_event WHERE project_id = ?", Long.class, projectId);
        return max != null ? max : 0;
    }

    private ProjectEvent mapRow(ResultSet rs, int rowNum) throws SQLException {
        String type = rs.getString("type");
        return new ProjectEvent(
            rs.getObject("id", UUID.class),
            rs.getObject("project_id", UUID.class),
            rs.getLong("version"),
            type,
            rs.getString("friendly_name"),
            rs.getObject("created_by", UUID.class),
            rs.getObject("occurred_at", OffsetDateTime.class).toInstant(),
            EventStatus.fromValue(rs.getString("status")),
            readPayload(type, rs.getString("payload"))
        );
    }

    private String writePayload(EventPayload payload) {
        Object body = payload instanceof UnrecognizedPayload unknown ? unknown.fields() : payload;
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise payload " + payload.getClass().getSimpleName(), e);
        }
    }

    private EventPayload readPayload(String type, String json) {
        try {
            Optional<EventType<?, ?>> eventType = registry.find(type);
            if (eventType.isEmpty()) {
                log.warn("Loaded event with unregistered type={}, keeping it opaque", type);
                return new UnrecognizedPayload(type, objectMapper.readValue(json, MAP_TYPE));
            }
            return objectMapper.readValue(json, eventType.get().payloadType());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt payload for event type " + type, e);
        }
    }
}
