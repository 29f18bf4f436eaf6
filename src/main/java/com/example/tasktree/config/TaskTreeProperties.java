package com.example.tasktree.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "tasktree")
public class TaskTreeProperties {

    private Api api = new Api();

    @Data
    public static class Api {
        private String title = "Tasks API";
        private String description = "Hierarchical task management with recursive operations";
        private String version = "1.0.0";
    }
}
