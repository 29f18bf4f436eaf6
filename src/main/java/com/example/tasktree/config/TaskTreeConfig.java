package com.example.tasktree.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TaskTreeConfig {

    private static final Logger logger = LoggerFactory.getLogger(TaskTreeConfig.class);

    @Bean
    public ApplicationRunner announceApi(TaskTreeProperties properties) {
        return args -> logger.info("{} {} started: {}",
                properties.getApi().getTitle(),
                properties.getApi().getVersion(),
                properties.getApi().getDescription());
    }
}
