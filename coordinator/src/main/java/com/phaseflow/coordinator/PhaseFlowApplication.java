package com.phaseflow.coordinator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PhaseFlowApplication {

    public static void main(String[] args) {
        SpringApplication.run(PhaseFlowApplication.class, args);
    }
}
