package com.projectledger.projection;

import com.projectledger.contract.EventPayload;
import com.projectledger.contract.EventPayload.AffiliatedOrganisationAdded;
import com.projectledger.contract.EventPayload.AffiliatedOrganisationRemoved;
import com.projectledger.contract.EventPayload.ProductAdded;
import com.projectledger.contract.EventPayload.ProductRemoved;
import com.projectledger.contract.EventPayload.ProjectRoleAssigned;
import com.projectledger.contract.EventPayload.ProjectStarted;
import com.projectledger.contract.EventPayload.TitleChanged;
import com.projectledger.contract.EventPayload.UnrecognizedPayload;
import com.projectledger.contract.EventStatus;
import com.projectledger.contract.ProjectEvent;
import com.projectledger.contract.ProjectEventTypes;
import com.projectledger.contract.ProjectMember;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ProjectProjectionTest {

    private ProjectProjection projection;
    private UUID projectId;
    private UUID author;

    @BeforeEach
    void setUp() {
        projection = new ProjectProjection(ProjectEventTypes.registry());
        projectId = UUID.randomUUID();
        author = UUID.randomUUID();
    }

    private ProjectEvent event(long version, String type, EventStatus status, EventPayload payload) {
        return new ProjectEvent(UUID.randomUUID(), projectId, version, type, type, author,
            Instant.now(), status, payload);
    }

    private ProjectEvent started(long version) {
        return event(version, ProjectEventTypes.PROJECT_STARTED, EventStatus.APPROVED,
            new ProjectStarted("Apollo", "apollo", null, null, null, List.of(), null));
    }

    @Test
    void startEvent_setsFieldsAndOwner() {
        Project project = projection.reduce(projectId, List.of(started(1)));

        assertEquals("Apollo", project.getTitle());
        assertEquals("apollo", project.getSlug());
        assertEquals(author, project.getOwnerId());
        assertEquals(1, project.getVersion());
    }

    @Test
    void pendingAndRejectedEvents_advanceVersionOnly() {
        Project project = projection.reduce(projectId, List.of(
            started(1),
            event(2, ProjectEventTypes.TITLE_CHANGED, EventStatus.PENDING, new TitleChanged("Pending")),
            event(3, ProjectEventTypes.TITLE_CHANGED, EventStatus.REJECTED, new TitleChanged("Rejected"))
        ));

        assertEquals("Apollo", project.getTitle());
        assertEquals(3, project.getVersion());
    }

    @Test
    void unrecognisedEvent_isSkippedButCounted() {
        Project project = projection.reduce(projectId, List.of(
            started(1),
            event(2, "project.budget_frozen", EventStatus.APPROVED,
                new UnrecognizedPayload("project.budget_frozen", Map.of("amount", 10))),
            event(3, ProjectEventTypes.TITLE_CHANGED, EventStatus.APPROVED, new TitleChanged("Artemis"))
        ));

        assertEquals("Artemis", project.getTitle());
        assertEquals(3, project.getVersion());
    }

    @Test
    void roleAssignment_isIdempotentOnReplay() {
        UUID person = UUID.randomUUID();
        UUID role = UUID.randomUUID();
        Project project = projection.reduce(projectId, List.of(
            started(1),
            event(2, ProjectEventTypes.PROJECT_ROLE_ASSIGNED, EventStatus.APPROVED, new ProjectRoleAssigned(person, role)),
            event(3, ProjectEventTypes.PROJECT_ROLE_ASSIGNED, EventStatus.APPROVED, new ProjectRoleAssigned(person, role))
        ));

        assertEquals(List.of(new ProjectMember(person, role)), project.getMembers());
    }

    @Test
    void productAddedTwice_isHeldOnceAndRemovedByOneRemoval() {
        UUID product = UUID.randomUUID();
        List<ProjectEvent> history = List.of(
            started(1),
            event(2, ProjectEventTypes.PRODUCT_ADDED, EventStatus.APPROVED, new ProductAdded(product)),
            event(3, ProjectEventTypes.PRODUCT_ADDED, EventStatus.APPROVED, new ProductAdded(product)));

        assertEquals(List.of(product), projection.reduce(projectId, history).getProductIds());

        List<ProjectEvent> withRemoval = new ArrayList<>(history);
        withRemoval.add(event(4, ProjectEventTypes.PRODUCT_REMOVED, EventStatus.APPROVED, new ProductRemoved(product)));
        assertTrue(projection.reduce(projectId, withRemoval).getProductIds().isEmpty());
    }

    @Test
    void affiliatedOrganisationAddedTwice_isHeldOnceAndRemovedByOneRemoval() {
        UUID organisation = UUID.randomUUID();
        Project project = projection.reduce(projectId, List.of(
            started(1),
            event(2, ProjectEventTypes.AFFILIATED_ORGANISATION_ADDED, EventStatus.APPROVED,
                new AffiliatedOrganisationAdded(organisation)),
            event(3, ProjectEventTypes.AFFILIATED_ORGANISATION_ADDED, EventStatus.APPROVED,
                new AffiliatedOrganisationAdded(organisation))));
        assertEquals(List.of(organisation), project.getAffiliatedOrganisationIds());

        projection.apply(project, event(4, ProjectEventTypes.AFFILIATED_ORGANISATION_REMOVED, EventStatus.APPROVED,
            new AffiliatedOrganisationRemoved(organisation)));
        assertTrue(project.getAffiliatedOrganisationIds().isEmpty());
    }

    @Test
    void twoPendingAdds_bothApprovedLater_leaveNoDuplicates() {
        UUID product = UUID.randomUUID();
        ProjectEvent first = event(2, ProjectEventTypes.PRODUCT_ADDED, EventStatus.PENDING, new ProductAdded(product));
        ProjectEvent second = event(3, ProjectEventTypes.PRODUCT_ADDED, EventStatus.PENDING, new ProductAdded(product));

        Project whilePending = projection.reduce(projectId, List.of(started(1), first, second));
        assertTrue(whilePending.getProductIds().isEmpty());

        Project approved = projection.reduce(projectId, List.of(started(1),
            first.withStatus(EventStatus.APPROVED), second.withStatus(EventStatus.APPROVED)));
        assertEquals(List.of(product), approved.getProductIds());
        assertEquals(3, approved.getVersion());
    }

    @Test
    void collections_areReadOnlyViews() {
        Project project = projection.reduce(projectId, List.of(started(1)));

        assertThrows(UnsupportedOperationException.class, () -> project.getProductIds().add(UUID.randomUUID()));
        assertThrows(UnsupportedOperationException.class,
            () -> project.getMembers().add(new ProjectMember(UUID.randomUUID(), UUID.randomUUID())));
        assertThrows(UnsupportedOperationException.class, () -> project.getCustomFields().put("budget", 1));
    }

    @Test
    void incrementalApply_matchesFullReplay() {
        List<ProjectEvent> history = new ArrayList<>();
        history.add(started(1));
        history.add(event(2, ProjectEventTypes.TITLE_CHANGED, EventStatus.APPROVED, new TitleChanged("Artemis")));
        history.add(event(3, ProjectEventTypes.PROJECT_ROLE_ASSIGNED, EventStatus.APPROVED,
            new ProjectRoleAssigned(UUID.randomUUID(), UUID.randomUUID())));

        Project incremental = projection.reduce(projectId, history.subList(0, 2));
        projection.apply(incremental, history.get(2));

        assertEquals(projection.reduce(projectId, history), incremental);
    }

    @Test
    void preview_leavesCurrentStateUntouched() {
        Project current = projection.reduce(projectId, List.of(started(1)));
        ProjectEvent rename = event(0, ProjectEventTypes.TITLE_CHANGED, EventStatus.PENDING, new TitleChanged("Artemis"));

        Project preview = projection.preview(current, rename);

        assertEquals("Artemis", preview.getTitle());
        assertEquals("Apollo", current.getTitle());
    }
}
