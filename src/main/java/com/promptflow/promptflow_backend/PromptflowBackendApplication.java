package com.promptflow.promptflow_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PromptflowBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(PromptflowBackendApplication.class, args);
    }
}
