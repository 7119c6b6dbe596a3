package com.projectledger.contract;

import com.projectledger.contract.EventPayload.AffiliatedOrganisationAdded;
import com.projectledger.contract.EventPayload.CustomFieldValueSet;
import com.projectledger.contract.EventPayload.EndDateChanged;
import com.projectledger.contract.EventPayload.OwningOrgNodeChanged;
import com.projectledger.contract.EventPayload.ProductAdded;
import com.projectledger.contract.EventPayload.ProductRemoved;
import com.projectledger.contract.EventPayload.ProjectRoleAssigned;
import com.projectledger.contract.EventPayload.ProjectRoleUnassigned;
import com.projectledger.contract.EventPayload.ProjectStarted;
import com.projectledger.contract.EventPayload.StartDateChanged;
import com.projectledger.contract.EventPayload.TitleChanged;
import com.projectledger.projection.Project;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class EventTypeRegistryTest {

    private EventTypeRegistry registry;
    private UUID projectId;
    private UUID actor;
    private Project project;

    @BeforeEach
    void setUp() {
        registry = ProjectEventTypes.registry();
        projectId = UUID.randomUUID();
        actor = UUID.randomUUID();
        project = new Project(projectId);
        project.setTitle("Apollo");
        project.setSlug("apollo");
        project.setVersion(1);
    }

    private Optional<ProjectEvent> decide(String type, Project current, Object input) {
        return registry.decide(type, projectId, actor, current, input, EventStatus.APPROVED);
    }

    @Nested
    @DisplayName("Registry construction")
    class Construction {

        @Test
        void registeringSameTypeTwice_failsImmediately() {
            EventType<TitleChanged, TitleChanged> type = EventType.of("x.title", TitleChanged.class)
                .friendlyName("Title")
                .decider((ctx, current, input) -> Optional.of(input))
                .applier((p, payload, event) -> p.setTitle(payload.title()))
                .build();
            EventTypeRegistry.Builder builder = EventTypeRegistry.builder().register(type);
            assertThrows(IllegalStateException.class, () -> builder.register(type));
        }

        @Test
        void everyTypeHasAFriendlyName() {
            assertEquals(13, registry.all().size());
            registry.all().forEach(t -> assertFalse(t.friendlyName().isBlank(), t.type()));
        }

        @Test
        void unknownType_isValidationError() {
            assertThrows(ValidationException.class,
                () -> decide("project.renamed_everything", project, new TitleChanged("x")));
        }
    }

    @Nested
    @DisplayName("Project start")
    class Start {

        @Test
        void start_onMissingProject_producesEventWithStatusAndActor() {
            ProjectStarted input = new ProjectStarted("Apollo", "apollo", "Moon", LocalDate.of(2024, 1, 1),
                LocalDate.of(2024, 12, 31), List.of(), null);

            ProjectEvent event = decide(ProjectEventTypes.PROJECT_STARTED, null, input).orElseThrow();

            assertEquals(ProjectEventTypes.PROJECT_STARTED, event.type());
            assertEquals("Project Proposal", event.friendlyName());
            assertEquals(actor, event.createdBy());
            assertEquals(projectId, event.projectId());
            assertEquals(EventStatus.APPROVED, event.status());
            assertEquals(0, event.version());
            assertSame(input, event.payload());
        }

        @Test
        void start_withoutTitle_isRejected() {
            ProjectStarted input = new ProjectStarted(" ", "apollo", null, null, null, List.of(), null);
            ValidationException ex = assertThrows(ValidationException.class,
                () -> decide(ProjectEventTypes.PROJECT_STARTED, null, input));
            assertTrue(ex.getMessage().contains("title"));
        }

        @Test
        void start_withoutSlug_isRejected() {
            ProjectStarted input = new ProjectStarted("Apollo", null, null, null, null, List.of(), null);
            assertThrows(ValidationException.class, () -> decide(ProjectEventTypes.PROJECT_STARTED, null, input));
        }

        @Test
        void start_endBeforeStart_isRejected() {
            ProjectStarted input = new ProjectStarted("Apollo", "apollo", null,
                LocalDate.of(2024, 6, 1), LocalDate.of(2024, 5, 31), List.of(), null);
            assertThrows(ValidationException.class, () -> decide(ProjectEventTypes.PROJECT_STARTED, null, input));
        }

        @Test
        void start_onExistingProject_isRejected() {
            ProjectStarted input = new ProjectStarted("Apollo", "apollo", null, null, null, List.of(), null);
            assertThrows(ValidationException.class,
                () -> decide(ProjectEventTypes.PROJECT_STARTED, project, input));
        }

        @Test
        void nonStartEvent_onMissingProject_isNotFound() {
            assertThrows(NotFoundException.class,
                () -> decide(ProjectEventTypes.TITLE_CHANGED, null, new TitleChanged("Apollo 2")));
        }

        @Test
        void missingActor_isRejected() {
            assertThrows(ValidationException.class, () -> registry.decide(ProjectEventTypes.TITLE_CHANGED,
                projectId, null, project, new TitleChanged("x"), EventStatus.APPROVED));
        }

        @Test
        void wrongInputType_isRejected() {
            assertThrows(ValidationException.class,
                () -> decide(ProjectEventTypes.TITLE_CHANGED, project, new ProductAdded(UUID.randomUUID())));
        }
    }

    @Nested
    @DisplayName("Scalar field changes")
    class FieldChanges {

        @Test
        void sameTitle_isNoOp() {
            assertTrue(decide(ProjectEventTypes.TITLE_CHANGED, project, new TitleChanged("Apollo")).isEmpty());
        }

        @Test
        void differentTitle_producesEvent() {
            ProjectEvent event = decide(ProjectEventTypes.TITLE_CHANGED, project, new TitleChanged("Artemis"))
                .orElseThrow();
            assertEquals(new TitleChanged("Artemis"), event.payload());
        }

        @Test
        void emptyTitle_isRejected() {
            assertThrows(ValidationException.class,
                () -> decide(ProjectEventTypes.TITLE_CHANGED, project, new TitleChanged("")));
        }

        @Test
        void sameEndDate_isNoOp() {
            project.setEndDate(LocalDate.of(2025, 3, 1));
            assertTrue(decide(ProjectEventTypes.END_DATE_CHANGED, project,
                new EndDateChanged(LocalDate.of(2025, 3, 1))).isEmpty());
        }

        @Test
        void nullStartDate_isRejected() {
            project.setStartDate(LocalDate.of(2024, 1, 1));
            ValidationException ex = assertThrows(ValidationException.class,
                () -> decide(ProjectEventTypes.START_DATE_CHANGED, project, new StartDateChanged(null)));
            assertTrue(ex.getMessage().contains("start_date"));
        }

        @Test
        void nullEndDate_isRejected_evenWhenNoEndDateIsSet() {
            ValidationException ex = assertThrows(ValidationException.class,
                () -> decide(ProjectEventTypes.END_DATE_CHANGED, project, new EndDateChanged(null)));
            assertTrue(ex.getMessage().contains("end_date"));
        }

        @Test
        void owningOrgNode_isRequired() {
            assertThrows(ValidationException.class,
                () -> decide(ProjectEventTypes.OWNING_ORG_NODE_CHANGED, project, new OwningOrgNodeChanged(null)));
        }

        @Test
        void customField_sameValueIsNoOp_andDefinitionIsRequired() {
            project.putCustomField("budget", 1000);
            assertTrue(decide(ProjectEventTypes.CUSTOM_FIELD_VALUE_SET, project,
                new CustomFieldValueSet("budget", 1000)).isEmpty());
            assertTrue(decide(ProjectEventTypes.CUSTOM_FIELD_VALUE_SET, project,
                new CustomFieldValueSet("budget", 2000)).isPresent());
            assertThrows(ValidationException.class, () -> decide(ProjectEventTypes.CUSTOM_FIELD_VALUE_SET,
                project, new CustomFieldValueSet(null, 1)));
        }
    }

    @Nested
    @DisplayName("Relationships")
    class Relationships {

        @Test
        void assigningExistingRole_isNoOp() {
            UUID person = UUID.randomUUID();
            UUID role = UUID.randomUUID();
            project.addMember(new ProjectMember(person, role));

            assertTrue(decide(ProjectEventTypes.PROJECT_ROLE_ASSIGNED, project,
                new ProjectRoleAssigned(person, role)).isEmpty());
            assertTrue(decide(ProjectEventTypes.PROJECT_ROLE_ASSIGNED, project,
                new ProjectRoleAssigned(person, UUID.randomUUID())).isPresent());
        }

        @Test
        void unassigningMissingRole_isNoOp() {
            assertTrue(decide(ProjectEventTypes.PROJECT_ROLE_UNASSIGNED, project,
                new ProjectRoleUnassigned(UUID.randomUUID(), UUID.randomUUID())).isEmpty());
        }

        @Test
        void roleAssignment_requiresBothIds() {
            assertThrows(ValidationException.class, () -> decide(ProjectEventTypes.PROJECT_ROLE_ASSIGNED,
                project, new ProjectRoleAssigned(UUID.randomUUID(), null)));
        }

        @Test
        void addingExistingProduct_isRejected() {
            UUID product = UUID.randomUUID();
            project.addProduct(product);
            assertThrows(ValidationException.class,
                () -> decide(ProjectEventTypes.PRODUCT_ADDED, project, new ProductAdded(product)));
        }

        @Test
        void removingMissingProduct_isRejected() {
            assertThrows(ValidationException.class,
                () -> decide(ProjectEventTypes.PRODUCT_REMOVED, project, new ProductRemoved(UUID.randomUUID())));
        }

        @Test
        void addingNewAffiliatedOrganisation_producesEvent() {
            UUID organisation = UUID.randomUUID();
            ProjectEvent event = decide(ProjectEventTypes.AFFILIATED_ORGANISATION_ADDED, project,
                new AffiliatedOrganisationAdded(organisation)).orElseThrow();
            assertEquals("Affiliated Organisation Addition", event.friendlyName());
        }
    }
}
