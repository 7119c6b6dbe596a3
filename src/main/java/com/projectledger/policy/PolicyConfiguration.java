package com.projectledger.policy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.projectledger.contract.EventTypeRegistry;
import com.projectledger.notification.MessageComposer;
import com.projectledger.notification.NotificationDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

@Configuration
public class PolicyConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PolicyConfiguration.class);

    @Bean
    @ConditionalOnProperty(name = "projectledger.event-store.type", havingValue = "jdbc", matchIfMissing = true)
    public EventPolicyRepository jdbcEventPolicyRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        log.info("Using JDBC policy repository");
        return new JdbcEventPolicyRepository(jdbcTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "projectledger.event-store.type", havingValue = "memory")
    public EventPolicyRepository inMemoryEventPolicyRepository() {
        log.info("Using in-memory policy repository");
        return new InMemoryEventPolicyRepository();
    }

    @Bean
    public RecipientResolver recipientResolver(MembershipDirectory membershipDirectory) {
        return new DirectoryRecipientResolver(membershipDirectory, DynamicRecipientStrategy.defaults());
    }

    @Bean
    public PolicyEvaluator policyEvaluator(EventPolicyRepository repository,
                                           AncestorLookup ancestorLookup,
                                           ObjectMapper objectMapper,
                                           RecipientResolver recipientResolver,
                                           NotificationDispatcher dispatcher,
                                           MessageComposer messageComposer) {
        return new PolicyEvaluator(repository, ancestorLookup, new ConditionMatcher(objectMapper),
            recipientResolver, dispatcher, messageComposer);
    }

    @Bean
    public EventPolicyService eventPolicyService(EventPolicyRepository repository,
                                                 AncestorLookup ancestorLookup,
                                                 EventTypeRegistry registry) {
        return new EventPolicyService(repository, ancestorLookup, registry);
    }
}
