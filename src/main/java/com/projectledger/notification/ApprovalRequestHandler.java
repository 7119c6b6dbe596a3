package com.projectledger.notification;

import com.projectledger.contract.ProjectEvent;
import com.projectledger.notification.OrganisationDirectory.OrgMembership;
import com.projectledger.policy.RecipientResolver;
import com.projectledger.projection.Project;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Asks the administrators of the approving organisation node to decide a
 * pending event.
 */
public class ApprovalRequestHandler implements ProjectEventHandler {

    private static final Logger log = LoggerFactory.getLogger(ApprovalRequestHandler.class);

    private final ApprovalNodeResolver approvalNodeResolver;
    private final OrganisationDirectory organisationDirectory;
    private final RecipientResolver recipientResolver;
    private final MessageComposer messageComposer;
    private final NotificationDispatcher dispatcher;

    public ApprovalRequestHandler(ApprovalNodeResolver approvalNodeResolver,
                                  OrganisationDirectory organisationDirectory,
                                  RecipientResolver recipientResolver,
                                  MessageComposer messageComposer,
                                  NotificationDispatcher dispatcher) {
        this.approvalNodeResolver = approvalNodeResolver;
        this.organisationDirectory = organisationDirectory;
        this.recipientResolver = recipientResolver;
        this.messageComposer = messageComposer;
        this.dispatcher = dispatcher;
    }

    @Override
    public boolean canHandle(ProjectEvent event) {
        return event.isPending();
    }

    @Override
    public void handle(ProjectEvent event, Project project) {
        Optional<UUID> approvalNode = approvalNodeResolver.resolve(project.getOwningOrgNodeId());
        if (approvalNode.isEmpty()) {
            log.warn("No approval node for pending event {} on project {}", event.id(), project.getId());
            return;
        }
        List<UUID> approvers = organisationDirectory.effectiveMemberships(approvalNode.get()).stream()
            .filter(m -> m.hasPermission(OrganisationDirectory.MANAGE_DETAILS))
            .map(OrgMembership::personId)
            .distinct()
            .toList();
        Set<UUID> users = recipientResolver.usersForPersons(approvers);
        if (users.isEmpty()) {
            log.warn("Approval node {} has no reachable approvers for event {}", approvalNode.get(), event.id());
            return;
        }
        dispatcher.dispatch(NotificationType.APPROVAL_REQUEST, users, event.id(),
            messageComposer.approvalRequest(event, project));
    }
}
