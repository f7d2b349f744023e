package com.riskguardian.coordinator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RiskCoordinatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(RiskCoordinatorApplication.class, args);
    }
}
