package com.projectledger.policy;

import com.projectledger.contract.NotFoundException;
import com.projectledger.contract.ProjectEventTypes;
import com.projectledger.contract.ValidationException;
import com.projectledger.directory.InMemoryDirectory;
import com.projectledger.policy.PolicyCondition.AllOf;
import com.projectledger.policy.PolicyCondition.FieldCondition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Policy management against each {@link EventPolicyRepository}.
 */
abstract class EventPolicyServiceTest {

    private EventPolicyService service;
    private UUID rootNode;
    private UUID childNode;

    protected abstract EventPolicyRepository repository();

    @BeforeEach
    void setUp() {
        rootNode = UUID.randomUUID();
        childNode = UUID.randomUUID();
        InMemoryDirectory directory = new InMemoryDirectory()
            .addOrgNode(rootNode, null, "Root")
            .addOrgNode(childNode, rootNode, "Child");
        service = new EventPolicyService(repository(), directory,
            ProjectEventTypes.registry());
    }

    private EventPolicy.Builder valid() {
        return EventPolicy.builder()
            .name("Notify on rename")
            .eventTypes(ProjectEventTypes.TITLE_CHANGED)
            .actionType(ActionType.NOTIFY);
    }

    @Test
    void create_assignsId() {
        EventPolicy created = service.create(valid().orgNodeId(rootNode).build());
        assertNotNull(created.id());
        assertEquals(created, service.get(created.id()));
    }

    @Test
    void policyMustBelongToExactlyOneOwner() {
        assertThrows(ValidationException.class, () -> service.create(valid().build()));
        assertThrows(ValidationException.class,
            () -> service.create(valid().orgNodeId(rootNode).projectId(UUID.randomUUID()).build()));
    }

    @Test
    void eventTypesAndActionAreRequired() {
        assertThrows(ValidationException.class,
            () -> service.create(valid().eventTypes(List.of()).orgNodeId(rootNode).build()));
        assertThrows(ValidationException.class,
            () -> service.create(valid().eventTypes("project.unheard_of").orgNodeId(rootNode).build()));
        assertThrows(ValidationException.class,
            () -> service.create(valid().actionType(null).orgNodeId(rootNode).build()));
    }

    @Test
    void unknownOperator_isRejectedOnCreate() {
        assertThrows(ValidationException.class, () -> service.create(valid().orgNodeId(rootNode)
            .conditions(new FieldCondition("event.title", "resembles", "x")).build()));
    }

    @Test
    void listForOrgNode_marksAncestorPoliciesAsInherited() {
        EventPolicy own = service.create(valid().name("own").orgNodeId(childNode).build());
        EventPolicy inherited = service.create(valid().name("inherited").orgNodeId(rootNode).build());

        List<EventPolicy> withInherited = service.listForOrgNode(childNode, true);
        assertEquals(2, withInherited.size());
        assertEquals(own.id(), withInherited.get(0).id());
        assertFalse(withInherited.get(0).inherited());
        assertEquals(inherited.id(), withInherited.get(1).id());
        assertTrue(withInherited.get(1).inherited());

        assertEquals(List.of(own), service.listForOrgNode(childNode, false));
    }

    @Test
    void listForProject_includesOwningNodeChain() {
        UUID projectId = UUID.randomUUID();
        service.create(valid().name("project").projectId(projectId).build());
        service.create(valid().name("child").orgNodeId(childNode).build());
        service.create(valid().name("root").orgNodeId(rootNode).build());

        assertEquals(List.of("project", "child", "root"),
            service.listForProject(projectId, childNode, true).stream().map(EventPolicy::name).toList());
        assertEquals(1, service.listForProject(projectId, childNode, false).size());
    }

    @Test
    void updateAndDelete() {
        EventPolicy created = service.create(valid().orgNodeId(rootNode).build());

        EventPolicy updated = service.update(created.id(), valid().name("Renamed").orgNodeId(rootNode).build());
        assertEquals("Renamed", service.get(created.id()).name());
        assertEquals(created.id(), updated.id());

        service.delete(created.id());
        assertThrows(NotFoundException.class, () -> service.get(created.id()));
        assertThrows(NotFoundException.class, () -> service.delete(created.id()));
    }

    @Test
    void conditionsAndRecipients_surviveStorage() {
        UUID person = UUID.randomUUID();
        EventPolicy created = service.create(valid().orgNodeId(rootNode)
            .actionType(ActionType.REQUEST_APPROVAL)
            .messageTemplate("{{project.title}} renamed")
            .conditions(
                new FieldCondition("event.title", "contains", "apollo"),
                new AllOf(List.of(
                    new FieldCondition("custom_field.budget", "between", List.of(1000, 5000)),
                    new FieldCondition("project.end_date", "not_exists", null))))
            .recipientPersonIds(Set.of(person))
            .recipientDynamic(Set.of(DynamicRecipientStrategy.PROJECT_OWNER))
            .enabled(false)
            .build());

        EventPolicy loaded = service.get(created.id());

        assertEquals(created, loaded);
        AllOf group = assertInstanceOf(AllOf.class, loaded.conditions().get(1));
        assertEquals(List.of(1000, 5000), ((FieldCondition) group.conditions().get(0)).value());
        assertFalse(loaded.enabled());
    }
}
