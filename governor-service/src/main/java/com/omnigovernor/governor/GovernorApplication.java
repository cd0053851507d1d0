package com.omnigovernor.governor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class GovernorApplication {

    public static void main(String[] args) {
        SpringApplication.run(GovernorApplication.class, args);
    }
}
