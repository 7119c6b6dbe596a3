package com.projectledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ProjectLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProjectLedgerApplication.class, args);
    }
}
