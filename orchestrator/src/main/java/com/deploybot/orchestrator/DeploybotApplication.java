package com.deploybot.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DeploybotApplication {

    public static void main(String[] args) {
        SpringApplication.run(DeploybotApplication.class, args);
    }
}
