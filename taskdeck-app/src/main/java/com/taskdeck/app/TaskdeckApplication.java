package com.taskdeck.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * taskdeck application entry point.
 */
@SpringBootApplication
@EnableScheduling
public class TaskdeckApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaskdeckApplication.class, args);
    }
}
