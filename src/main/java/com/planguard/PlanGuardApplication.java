package com.planguard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PlanGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(PlanGuardApplication.class, args);
    }
}
