package com.example.tasktree.dto;

import com.example.tasktree.entity.Task;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Detached view of a task with its children (and, for single lookups, its
 * ancestors) resolved into nodes. Never attached to the persistence context.
 */
@Data
public class TaskNode {
    private Long id;
    private String title;
    private String description;
    private boolean status;
    private LocalDateTime updated;
    private TaskNode parent;
    private List<TaskNode> childs = new ArrayList<>();

    public static TaskNode of(Task task) {
        TaskNode node = new TaskNode();
        node.setId(task.getId());
        node.setTitle(task.getTitle());
        node.setDescription(task.getDescription());
        node.setStatus(task.isStatus());
        node.setUpdated(task.getUpdated());
        return node;
    }

    // true if a task with the given id sits anywhere below this node
    public boolean hasDescendant(Long taskId) {
        for (TaskNode child : childs) {
            if (child.getId().equals(taskId) || child.hasDescendant(taskId)) {
                return true;
            }
        }
        return false;
    }
}
