package com.metaperception.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PerceptionOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(PerceptionOrchestratorApplication.class, args);
    }
}
