package com.example.tasktree;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TaskTreeApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaskTreeApplication.class, args);
    }
}
