package com.learnflow.learnflow_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LearnflowBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(LearnflowBackendApplication.class, args);
    }
}
