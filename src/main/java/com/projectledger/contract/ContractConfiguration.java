package com.projectledger.contract;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ContractConfiguration {

    @Bean
    public EventTypeRegistry eventTypeRegistry() {
        return ProjectEventTypes.registry();
    }
}
