package com.projectledger.projection;

import com.projectledger.contract.ProjectMember;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Current state of a project, rebuilt by replaying its event stream.
 *
 * Mutated only by event appliers during replay. Collections are handed out
 * as read-only views; member, product and affiliated organisation lists
 * hold each element at most once.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Project {

    private final UUID id;
    private long version;
    private UUID ownerId;
    private String title;
    private String slug;
    private String description;
    private LocalDate startDate;
    private LocalDate endDate;
    private UUID owningOrgNodeId;
    private final List<ProjectMember> members = new ArrayList<>();
    private final List<UUID> productIds = new ArrayList<>();
    private final List<UUID> affiliatedOrganisationIds = new ArrayList<>();
    private final Map<String, Object> customFields = new LinkedHashMap<>();

    public Project(UUID id) {
        this.id = Objects.requireNonNull(id, "id");
    }

    public Project copy() {
        Project copy = new Project(id);
        copy.version = version;
        copy.ownerId = ownerId;
        copy.title = title;
        copy.slug = slug;
        copy.description = description;
        copy.startDate = startDate;
        copy.endDate = endDate;
        copy.owningOrgNodeId = owningOrgNodeId;
        copy.members.addAll(members);
        copy.productIds.addAll(productIds);
        copy.affiliatedOrganisationIds.addAll(affiliatedOrganisationIds);
        copy.customFields.putAll(customFields);
        return copy;
    }

    public UUID getId() {
        return id;
    }

    public long getVersion() {
        return version;
    }

    public void setVersion(long version) {
        this.version = version;
    }

    public UUID getOwnerId() {
        return ownerId;
    }

    public void setOwnerId(UUID ownerId) {
        this.ownerId = ownerId;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getSlug() {
        return slug;
    }

    public void setSlug(String slug) {
        this.slug = slug;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public LocalDate getStartDate() {
        return startDate;
    }

    public void setStartDate(LocalDate startDate) {
        this.startDate = startDate;
    }

    public LocalDate getEndDate() {
        return endDate;
    }

    public void setEndDate(LocalDate endDate) {
        this.endDate = endDate;
    }

    public UUID getOwningOrgNodeId() {
        return owningOrgNodeId;
    }

    public void setOwningOrgNodeId(UUID owningOrgNodeId) {
        this.owningOrgNodeId = owningOrgNodeId;
    }

    public List<ProjectMember> getMembers() {
        return Collections.unmodifiableList(members);
    }

    public void addMember(ProjectMember member) {
        addOnce(members, member);
    }

    public void removeMember(ProjectMember member) {
        members.remove(member);
    }

    public List<UUID> getProductIds() {
        return Collections.unmodifiableList(productIds);
    }

    public void addProduct(UUID productId) {
        addOnce(productIds, productId);
    }

    public void removeProduct(UUID productId) {
        productIds.remove(productId);
    }

    public List<UUID> getAffiliatedOrganisationIds() {
        return Collections.unmodifiableList(affiliatedOrganisationIds);
    }

    public void addAffiliatedOrganisation(UUID affiliatedOrganisationId) {
        addOnce(affiliatedOrganisationIds, affiliatedOrganisationId);
    }

    public void removeAffiliatedOrganisation(UUID affiliatedOrganisationId) {
        affiliatedOrganisationIds.remove(affiliatedOrganisationId);
    }

    public Map<String, Object> getCustomFields() {
        return Collections.unmodifiableMap(customFields);
    }

    public void putCustomField(String definitionId, Object value) {
        customFields.put(definitionId, value);
    }

    private static <T> void addOnce(List<T> list, T element) {
        if (!list.contains(element)) {
            list.add(element);
        }
    }

    /** Distinct person ids across all role assignments, in assignment order. */
    public List<UUID> memberPersonIds() {
        return members.stream().map(ProjectMember::personId).distinct().toList();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Project other)) {
            return false;
        }
        return version == other.version
            && id.equals(other.id)
            && Objects.equals(ownerId, other.ownerId)
            && Objects.equals(title, other.title)
            && Objects.equals(slug, other.slug)
            && Objects.equals(description, other.description)
            && Objects.equals(startDate, other.startDate)
            && Objects.equals(endDate, other.endDate)
            && Objects.equals(owningOrgNodeId, other.owningOrgNodeId)
            && members.equals(other.members)
            && productIds.equals(other.productIds)
            && affiliatedOrganisationIds.equals(other.affiliatedOrganisationIds)
            && customFields.equals(other.customFields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, version, title, slug, owningOrgNodeId, members, productIds);
    }

    @Override
    public String toString() {
        return "Project{id=" + id + ", version=" + version + ", title='" + title + "'}";
    }
}
