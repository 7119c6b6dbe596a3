package com.projectledger.policy;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Condition tree of a policy. Leaves test one field; groups require all of
 * their children to hold.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.DEDUCTION)
@JsonSubTypes({
    @JsonSubTypes.Type(PolicyCondition.FieldCondition.class),
    @JsonSubTypes.Type(PolicyCondition.AllOf.class)
})
public sealed interface PolicyCondition {

    /**
     * @param field    path such as {@code event.title}, {@code project.owning_org_node_id}
     *                 or {@code custom_field.budget}
     * @param operator one of {@link ConditionOperator}; kept as text so stored
     *                 policies with retired operators still load
     */
    record FieldCondition(String field, String operator, Object value) implements PolicyCondition {}

    record AllOf(List<PolicyCondition> conditions) implements PolicyCondition {

        public AllOf {
            conditions = conditions == null ? List.of() : List.copyOf(conditions);
        }
    }
}
