package com.projectledger.notification;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.projectledger.ProjectLedgerProperties;
import com.projectledger.contract.EventTypeRegistry;
import com.projectledger.policy.AncestorLookup;
import com.projectledger.policy.PolicyEvaluator;
import com.projectledger.policy.RecipientResolver;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class NotificationConfiguration {

    @Bean
    public InMemoryNotificationSender notificationSender() {
        return new InMemoryNotificationSender();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService notificationExecutor(ProjectLedgerProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getNotifications().getDispatchThreads()));
    }

    @Bean
    public NotificationDispatcher notificationDispatcher(NotificationSender sender, ExecutorService notificationExecutor) {
        return new NotificationDispatcher(sender, notificationExecutor);
    }

    @Bean
    public MessageComposer messageComposer(ObjectMapper objectMapper, EventTypeRegistry registry,
                                           RelatedEntityLookup relatedEntityLookup) {
        return new MessageComposer(objectMapper, registry, relatedEntityLookup);
    }

    @Bean
    public ApprovalNodeResolver approvalNodeResolver(OrganisationDirectory organisationDirectory,
                                                     AncestorLookup ancestorLookup) {
        return new ApprovalNodeResolver(organisationDirectory, ancestorLookup);
    }

    /**
     * Post-append handlers: policies first, then approval requests, member
     * announcements and the author's status update.
     */
    @Bean
    public EventHandlerChain eventHandlerChain(PolicyEvaluator policyEvaluator,
                                               ApprovalNodeResolver approvalNodeResolver,
                                               OrganisationDirectory organisationDirectory,
                                               RecipientResolver recipientResolver,
                                               MessageComposer messageComposer,
                                               NotificationDispatcher dispatcher) {
        return new EventHandlerChain(List.of(
            new PolicyExecutionHandler(policyEvaluator),
            new ApprovalRequestHandler(approvalNodeResolver, organisationDirectory, recipientResolver,
                messageComposer, dispatcher),
            new ProjectEventNotificationHandler(messageComposer, recipientResolver, dispatcher),
            new StatusUpdateHandler(messageComposer, dispatcher)
        ));
    }
}
