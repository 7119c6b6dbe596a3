package com.projectledger.policy;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.projectledger.contract.EventPayload.UnrecognizedPayload;
import com.projectledger.contract.FieldNames;
import com.projectledger.contract.ProjectEvent;
import com.projectledger.policy.PolicyCondition.AllOf;
import com.projectledger.policy.PolicyCondition.FieldCondition;
import com.projectledger.projection.Project;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Evaluates policy condition trees against an event and the project it
 * belongs to.
 *
 * Field paths are {@code event.<field>}, {@code project.<field>} or
 * {@code custom_field.<definition id>}. A path that does not resolve makes
 * its condition false whatever the operator.
 */
public class ConditionMatcher {

    private static final Logger log = LoggerFactory.getLogger(ConditionMatcher.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public ConditionMatcher(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public boolean matchesAll(List<PolicyCondition> conditions, ProjectEvent event, Project project) {
        if (conditions.isEmpty()) {
            return true;
        }
        FieldSource source = new FieldSource(event, project);
        for (PolicyCondition condition : conditions) {
            if (!matches(condition, source)) {
                return false;
            }
        }
        return true;
    }

    private boolean matches(PolicyCondition condition, FieldSource source) {
        if (condition instanceof AllOf group) {
            for (PolicyCondition child : group.conditions()) {
                if (!matches(child, source)) {
                    return false;
                }
            }
            return true;
        }
        FieldCondition leaf = (FieldCondition) condition;
        Optional<ConditionOperator> operator = ConditionOperator.find(leaf.operator());
        if (operator.isEmpty()) {
            log.warn("Unknown condition operator '{}' on field {}, condition never matches",
                leaf.operator(), leaf.field());
            return false;
        }
        Optional<Map.Entry<String, Object>> resolved = source.resolve(leaf.field());
        if (resolved.isEmpty()) {
            log.debug("Condition field {} does not resolve", leaf.field());
            return false;
        }
        return test(operator.get(), resolved.get().getValue(), leaf.value());
    }

    static boolean test(ConditionOperator operator, Object actual, Object expected) {
        return switch (operator) {
            case EQUALS -> valuesEqual(actual, expected);
            case NOT_EQUALS -> !valuesEqual(actual, expected);
            case CONTAINS -> contains(actual, expected);
            case STARTS_WITH -> actual != null && expected != null
                && String.valueOf(actual).startsWith(String.valueOf(expected));
            case GREATER_THAN -> compare(actual, expected).map(c -> c > 0).orElse(false);
            case LESS_THAN -> compare(actual, expected).map(c -> c < 0).orElse(false);
            case BETWEEN -> between(actual, expected);
            case IN -> expected instanceof Collection<?> options
                && options.stream().anyMatch(o -> valuesEqual(actual, o));
            case NOT_IN -> expected instanceof Collection<?> options
                && options.stream().noneMatch(o -> valuesEqual(actual, o));
            case EXISTS -> actual != null;
            case NOT_EXISTS -> actual == null;
        };
    }

    private static boolean valuesEqual(Object actual, Object expected) {
        if (actual == null || expected == null) {
            return actual == expected;
        }
        Optional<Integer> numeric = compareNumbers(actual, expected);
        if (numeric.isPresent()) {
            return numeric.get() == 0;
        }
        return String.valueOf(actual).equals(String.valueOf(expected));
    }

    private static boolean contains(Object actual, Object expected) {
        if (actual == null || expected == null) {
            return false;
        }
        if (actual instanceof Collection<?> values) {
            return values.stream().anyMatch(v -> valuesEqual(v, expected));
        }
        return String.valueOf(actual).toLowerCase(Locale.ROOT)
            .contains(String.valueOf(expected).toLowerCase(Locale.ROOT));
    }

    private static boolean between(Object actual, Object expected) {
        if (!(expected instanceof List<?> bounds) || bounds.size() != 2) {
            log.warn("'between' needs a two-element value, got {}", expected);
            return false;
        }
        return compare(actual, bounds.get(0)).map(c -> c >= 0).orElse(false)
            && compare(actual, bounds.get(1)).map(c -> c <= 0).orElse(false);
    }

    /** Orders numbers, dates, instants, then plain text. Empty if either side is null. */
    private static Optional<Integer> compare(Object actual, Object expected) {
        if (actual == null || expected == null) {
            return Optional.empty();
        }
        Optional<Integer> numeric = compareNumbers(actual, expected);
        if (numeric.isPresent()) {
            return numeric;
        }
        LocalDate leftDate = asDate(actual);
        LocalDate rightDate = asDate(expected);
        if (leftDate != null && rightDate != null) {
            return Optional.of(leftDate.compareTo(rightDate));
        }
        Instant leftInstant = asInstant(actual);
        Instant rightInstant = asInstant(expected);
        if (leftInstant != null && rightInstant != null) {
            return Optional.of(leftInstant.compareTo(rightInstant));
        }
        return Optional.of(String.valueOf(actual).compareTo(String.valueOf(expected)));
    }

    private static Optional<Integer> compareNumbers(Object actual, Object expected) {
        BigDecimal left = asNumber(actual);
        BigDecimal right = asNumber(expected);
        if (left == null || right == null) {
            return Optional.empty();
        }
        return Optional.of(left.compareTo(right));
    }

    private static BigDecimal asNumber(Object value) {
        if (value instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return new BigDecimal(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static LocalDate asDate(Object value) {
        if (value instanceof LocalDate date) {
            return date;
        }
        if (!(value instanceof String text)) {
            return null;
        }
        try {
            return LocalDate.parse(text);
        } catch (DateTimeParseException notADate) {
            return null;
        }
    }

    private static Instant asInstant(Object value) {
        if (value instanceof Instant instant) {
            return instant;
        }
        if (!(value instanceof String text)) {
            return null;
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException notAnInstant) {
            return null;
        }
    }

    /**
     * Lazily flattened views of the event and project.
     */
    private final class FieldSource {

        private final ProjectEvent event;
        private final Project project;
        private Map<String, Object> eventFields;
        private Map<String, Object> projectFields;

        FieldSource(ProjectEvent event, Project project) {
            this.event = event;
            this.project = project;
        }

        Optional<Map.Entry<String, Object>> resolve(String path) {
            if (path == null) {
                return Optional.empty();
            }
            int dot = path.indexOf('.');
            if (dot <= 0 || dot == path.length() - 1) {
                return Optional.empty();
            }
            String scope = FieldNames.normalize(path.substring(0, dot));
            String rest = path.substring(dot + 1);
            Map<String, Object> root = switch (scope) {
                case "event" -> eventFields();
                case "project" -> projectFields();
                case "customfield" -> project != null ? project.getCustomFields() : null;
                default -> null;
            };
            if (root == null) {
                return Optional.empty();
            }
            return descend(root, rest);
        }

        @SuppressWarnings("unchecked")
        private Optional<Map.Entry<String, Object>> descend(Map<String, Object> fields, String path) {
            if (fields.containsKey(path)) {
                return FieldNames.find(fields, path);
            }
            int dot = path.indexOf('.');
            if (dot < 0) {
                return FieldNames.find(fields, path);
            }
            Optional<Map.Entry<String, Object>> head = FieldNames.find(fields, path.substring(0, dot));
            if (head.isEmpty() || !(head.get().getValue() instanceof Map<?, ?> nested)) {
                return Optional.empty();
            }
            return descend((Map<String, Object>) nested, path.substring(dot + 1));
        }

        private Map<String, Object> eventFields() {
            if (eventFields == null) {
                Map<String, Object> fields = new LinkedHashMap<>();
                fields.put("type", event.type());
                fields.put("friendly_name", event.friendlyName());
                fields.put("status", event.status().getValue());
                fields.put("created_by", event.createdBy() != null ? event.createdBy().toString() : null);
                if (event.payload() instanceof UnrecognizedPayload unknown) {
                    fields.putAll(unknown.fields());
                } else {
                    fields.putAll(objectMapper.convertValue(event.payload(), MAP_TYPE));
                }
                eventFields = fields;
            }
            return eventFields;
        }

        private Map<String, Object> projectFields() {
            if (projectFields == null) {
                projectFields = project != null
                    ? objectMapper.convertValue(project, MAP_TYPE)
                    : Map.of();
            }
            return projectFields;
        }
    }
}
