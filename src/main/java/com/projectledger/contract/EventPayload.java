package com.projectledger.contract;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Typed payloads of the project event taxonomy. Each record is also the
 * command input for its event type.
 */
public sealed interface EventPayload {

    record ProjectStarted(
        String title,
        String slug,
        String description,
        LocalDate startDate,
        LocalDate endDate,
        List<ProjectMember> members,
        UUID owningOrgNodeId
    ) implements EventPayload {

        public ProjectStarted {
            members = members == null ? List.of() : List.copyOf(members);
        }
    }

    record TitleChanged(String title) implements EventPayload {}

    record DescriptionChanged(String description) implements EventPayload {}

    record StartDateChanged(LocalDate startDate) implements EventPayload {}

    record EndDateChanged(LocalDate endDate) implements EventPayload {}

    record OwningOrgNodeChanged(UUID owningOrgNodeId) implements EventPayload {}

    record ProjectRoleAssigned(UUID personId, UUID projectRoleId) implements EventPayload {}

    record ProjectRoleUnassigned(UUID personId, UUID projectRoleId) implements EventPayload {}

    record ProductAdded(UUID productId) implements EventPayload {}

    record ProductRemoved(UUID productId) implements EventPayload {}

    record AffiliatedOrganisationAdded(UUID affiliatedOrganisationId) implements EventPayload {}

    record AffiliatedOrganisationRemoved(UUID affiliatedOrganisationId) implements EventPayload {}

    record CustomFieldValueSet(String definitionId, Object value) implements EventPayload {}

    /**
     * Stored event whose type is no longer registered. Carried through
     * replay untouched so that version numbering stays intact.
     */
    record UnrecognizedPayload(String type, Map<String, Object> fields) implements EventPayload {

        public UnrecognizedPayload {
            fields = fields == null ? Map.of() : fields;
        }
    }
}
