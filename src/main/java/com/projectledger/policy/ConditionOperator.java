package com.projectledger.policy;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum ConditionOperator {
    EQUALS("equals"),
    NOT_EQUALS("not_equals"),
    CONTAINS("contains"),
    STARTS_WITH("starts_with"),
    GREATER_THAN("greater_than"),
    LESS_THAN("less_than"),
    BETWEEN("between"),
    IN("in"),
    NOT_IN("not_in"),
    EXISTS("exists"),
    NOT_EXISTS("not_exists");

    private final String value;

    ConditionOperator(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<ConditionOperator> find(String value) {
        for (ConditionOperator operator : values()) {
            if (operator.value.equalsIgnoreCase(value)) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }
}
