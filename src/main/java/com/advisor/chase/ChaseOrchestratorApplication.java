package com.advisor.chase;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ChaseOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChaseOrchestratorApplication.class, args);
    }
}
