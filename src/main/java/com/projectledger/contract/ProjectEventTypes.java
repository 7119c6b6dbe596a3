package com.projectledger.contract;

import com.projectledger.contract.Deciders.OnConflict;
import com.projectledger.contract.EventPayload.AffiliatedOrganisationAdded;
import com.projectledger.contract.EventPayload.AffiliatedOrganisationRemoved;
import com.projectledger.contract.EventPayload.CustomFieldValueSet;
import com.projectledger.contract.EventPayload.DescriptionChanged;
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

import java.util.Objects;
import java.util.Optional;

import static com.projectledger.contract.Deciders.addTo;
import static com.projectledger.contract.Deciders.fieldChange;
import static com.projectledger.contract.Deciders.removeFrom;
import static com.projectledger.contract.Deciders.required;

/**
 * The project event taxonomy.
 */
public final class ProjectEventTypes {

    public static final String PROJECT_STARTED = "project.started";
    public static final String TITLE_CHANGED = "project.title_changed";
    public static final String DESCRIPTION_CHANGED = "project.description_changed";
    public static final String START_DATE_CHANGED = "project.start_date_changed";
    public static final String END_DATE_CHANGED = "project.end_date_changed";
    public static final String OWNING_ORG_NODE_CHANGED = "project.owning_org_node_changed";
    public static final String PROJECT_ROLE_ASSIGNED = "project.project_role_assigned";
    public static final String PROJECT_ROLE_UNASSIGNED = "project.project_role_unassigned";
    public static final String PRODUCT_ADDED = "project.product_added";
    public static final String PRODUCT_REMOVED = "project.product_removed";
    public static final String AFFILIATED_ORGANISATION_ADDED = "project.affiliated_organisation_added";
    public static final String AFFILIATED_ORGANISATION_REMOVED = "project.affiliated_organisation_removed";
    public static final String CUSTOM_FIELD_VALUE_SET = "project.custom_field_value_set";

    private ProjectEventTypes() {
    }

    public static EventTypeRegistry registry() {
        return EventTypeRegistry.builder()
            .register(EventType.of(PROJECT_STARTED, ProjectStarted.class)
                .friendlyName("Project Proposal")
                .createsProject()
                .decider(ProjectEventTypes::decideStart)
                .applier(ProjectEventTypes::applyStart)
                .relatedIds(p -> RelatedIds.orgNode(p.owningOrgNodeId()))
                .messages(new EventMessages(
                    "Project '{{event.title}}' has been started.",
                    "{{creator.name}} has proposed a new project '{{event.title}}'.",
                    "Your project proposal '{{event.title}}' has been approved.",
                    "Your project proposal '{{event.title}}' has been rejected."))
                .build())
            .register(EventType.of(TITLE_CHANGED, TitleChanged.class)
                .friendlyName("Title Change")
                .decider(fieldChange(Project::getTitle, TitleChanged::title,
                    required("title", TitleChanged::title)))
                .applier((project, p, event) -> project.setTitle(p.title()))
                .messages(new EventMessages(
                    "Project title changed to '{{event.title}}'.",
                    "{{creator.name}} wants to rename '{{project.title}}' to '{{event.title}}'.",
                    null, null))
                .build())
            .register(EventType.of(DESCRIPTION_CHANGED, DescriptionChanged.class)
                .friendlyName("Description Change")
                .decider(fieldChange(Project::getDescription, DescriptionChanged::description))
                .applier((project, p, event) -> project.setDescription(p.description()))
                .messages(new EventMessages(
                    "The description of '{{project.title}}' has been updated.", null, null, null))
                .build())
            .register(EventType.of(START_DATE_CHANGED, StartDateChanged.class)
                .friendlyName("Start Date Change")
                .decider(fieldChange(Project::getStartDate, StartDateChanged::startDate,
                    required("start_date", StartDateChanged::startDate)))
                .applier((project, p, event) -> project.setStartDate(p.startDate()))
                .messages(new EventMessages(
                    "Start date of '{{project.title}}' changed to {{event.start_date}}.", null, null, null))
                .build())
            .register(EventType.of(END_DATE_CHANGED, EndDateChanged.class)
                .friendlyName("End Date Change")
                .decider(fieldChange(Project::getEndDate, EndDateChanged::endDate,
                    required("end_date", EndDateChanged::endDate)))
                .applier((project, p, event) -> project.setEndDate(p.endDate()))
                .messages(new EventMessages(
                    "End date of '{{project.title}}' changed to {{event.end_date}}.", null, null, null))
                .build())
            .register(EventType.of(OWNING_ORG_NODE_CHANGED, OwningOrgNodeChanged.class)
                .friendlyName("Owning Organisation Change")
                .decider(fieldChange(Project::getOwningOrgNodeId, OwningOrgNodeChanged::owningOrgNodeId,
                    required("owning_org_node_id", OwningOrgNodeChanged::owningOrgNodeId)))
                .applier((project, p, event) -> project.setOwningOrgNodeId(p.owningOrgNodeId()))
                .relatedIds(p -> RelatedIds.orgNode(p.owningOrgNodeId()))
                .messages(new EventMessages(
                    "Project owning organisation node changed to '{{org_node.name}}'.", null, null, null))
                .build())
            .register(EventType.of(PROJECT_ROLE_ASSIGNED, ProjectRoleAssigned.class)
                .friendlyName("Project Role Assignment")
                .decider(addTo("project role assignment", Project::getMembers,
                    p -> new ProjectMember(p.personId(), p.projectRoleId()), OnConflict.IGNORE,
                    required("person_id", ProjectRoleAssigned::personId),
                    required("project_role_id", ProjectRoleAssigned::projectRoleId)))
                .applier((project, p, event) ->
                    project.addMember(new ProjectMember(p.personId(), p.projectRoleId())))
                .relatedIds(p -> RelatedIds.person(p.personId(), p.projectRoleId()))
                .messages(new EventMessages(
                    "{{person.name}} has been assigned the role '{{project_role.name}}'.", null, null, null))
                .build())
            .register(EventType.of(PROJECT_ROLE_UNASSIGNED, ProjectRoleUnassigned.class)
                .friendlyName("Project Role Removal")
                .decider(removeFrom("project role assignment", Project::getMembers,
                    p -> new ProjectMember(p.personId(), p.projectRoleId()), OnConflict.IGNORE,
                    required("person_id", ProjectRoleUnassigned::personId),
                    required("project_role_id", ProjectRoleUnassigned::projectRoleId)))
                .applier((project, p, event) ->
                    project.removeMember(new ProjectMember(p.personId(), p.projectRoleId())))
                .relatedIds(p -> RelatedIds.person(p.personId(), p.projectRoleId()))
                .messages(new EventMessages(
                    "{{person.name}} no longer holds the role '{{project_role.name}}'.", null, null, null))
                .build())
            .register(EventType.of(PRODUCT_ADDED, ProductAdded.class)
                .friendlyName("Product Addition")
                .decider(addTo("product", Project::getProductIds, ProductAdded::productId, OnConflict.REJECT,
                    required("product_id", ProductAdded::productId)))
                .applier((project, p, event) -> project.addProduct(p.productId()))
                .relatedIds(p -> RelatedIds.product(p.productId()))
                .messages(new EventMessages(
                    "Product '{{product.name}}' has been added to '{{project.title}}'.", null, null, null))
                .build())
            .register(EventType.of(PRODUCT_REMOVED, ProductRemoved.class)
                .friendlyName("Product Removal")
                .decider(removeFrom("product", Project::getProductIds, ProductRemoved::productId, OnConflict.REJECT,
                    required("product_id", ProductRemoved::productId)))
                .applier((project, p, event) -> project.removeProduct(p.productId()))
                .relatedIds(p -> RelatedIds.product(p.productId()))
                .messages(new EventMessages(
                    "Product '{{product.name}}' has been removed from '{{project.title}}'.", null, null, null))
                .build())
            .register(EventType.of(AFFILIATED_ORGANISATION_ADDED, AffiliatedOrganisationAdded.class)
                .friendlyName("Affiliated Organisation Addition")
                .decider(addTo("affiliated organisation", Project::getAffiliatedOrganisationIds,
                    AffiliatedOrganisationAdded::affiliatedOrganisationId, OnConflict.REJECT,
                    required("affiliated_organisation_id", AffiliatedOrganisationAdded::affiliatedOrganisationId)))
                .applier((project, p, event) ->
                    project.addAffiliatedOrganisation(p.affiliatedOrganisationId()))
                .messages(new EventMessages(
                    "An affiliated organisation has been added to '{{project.title}}'.", null, null, null))
                .build())
            .register(EventType.of(AFFILIATED_ORGANISATION_REMOVED, AffiliatedOrganisationRemoved.class)
                .friendlyName("Affiliated Organisation Removal")
                .decider(removeFrom("affiliated organisation", Project::getAffiliatedOrganisationIds,
                    AffiliatedOrganisationRemoved::affiliatedOrganisationId, OnConflict.REJECT,
                    required("affiliated_organisation_id", AffiliatedOrganisationRemoved::affiliatedOrganisationId)))
                .applier((project, p, event) ->
                    project.removeAffiliatedOrganisation(p.affiliatedOrganisationId()))
                .messages(new EventMessages(
                    "An affiliated organisation has been removed from '{{project.title}}'.", null, null, null))
                .build())
            .register(EventType.of(CUSTOM_FIELD_VALUE_SET, CustomFieldValueSet.class)
                .friendlyName("Set Custom Field Value")
                .decider((context, current, input) -> {
                    Deciders.checkRequired(input, required("definition_id", CustomFieldValueSet::definitionId));
                    if (current.getCustomFields().containsKey(input.definitionId())
                        && Objects.equals(current.getCustomFields().get(input.definitionId()), input.value())) {
                        return Optional.empty();
                    }
                    return Optional.of(input);
                })
                .applier((project, p, event) -> project.putCustomField(p.definitionId(), p.value()))
                .build())
            .build();
    }

    private static Optional<ProjectStarted> decideStart(DecisionContext context, Project current,
                                                        ProjectStarted input) {
        Deciders.checkRequired(input,
            required("title", ProjectStarted::title),
            required("slug", ProjectStarted::slug));
        if (input.startDate() != null && input.endDate() != null && input.endDate().isBefore(input.startDate())) {
            throw new ValidationException("end_date must not be before start_date");
        }
        return Optional.of(input);
    }

    private static void applyStart(Project project, ProjectStarted payload, ProjectEvent event) {
        project.setOwnerId(event.createdBy());
        project.setTitle(payload.title());
        project.setSlug(payload.slug());
        project.setDescription(payload.description());
        project.setStartDate(payload.startDate());
        project.setEndDate(payload.endDate());
        project.setOwningOrgNodeId(payload.owningOrgNodeId());
        payload.members().forEach(project::addMember);
    }
}
