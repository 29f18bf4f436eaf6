package com.example.tasktree.controller;

import com.example.tasktree.dto.ChangeParentRequest;
import com.example.tasktree.dto.TaskCreateRequest;
import com.example.tasktree.dto.TaskNode;
import com.example.tasktree.service.TaskService;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/tasks")
@CrossOrigin(origins = "*")
public class TaskController {

    @Autowired private TaskService taskService;

    // 1. Root tasks with their subtrees
    @GetMapping
    public List<TaskNode> getTasks() {
        return taskService.getRootTasks();
    }

    // 2. One task with children and ancestors
    @GetMapping("/{id}")
    public TaskNode getTask(@PathVariable Long id) {
        return taskService.getTask(id);
    }

    // 3. Create a task, optionally under ?parent=
    @PostMapping
    public TaskNode createTask(@Valid @RequestBody TaskCreateRequest request,
                               @RequestParam(required = false) Long parent) {
        return taskService.createTask(request, parent);
    }

    // 4. Delete a task together with its children
    @DeleteMapping
    public TaskNode deleteTask(@RequestParam Long id) {
        return taskService.deleteTask(id);
    }

    // 5. Toggle done/not done
    @PostMapping("/{id}/toggle")
    public TaskNode toggleTask(@PathVariable Long id,
                               @RequestParam(name = "with_childs", defaultValue = "false") boolean withChilds) {
        return taskService.toggleTask(id, withChilds);
    }

    // 6. Move under another parent; missing or null parent_id makes it a root
    @PostMapping("/{id}/change-parent")
    public TaskNode changeParent(@PathVariable Long id,
                                 @RequestBody(required = false) ChangeParentRequest request) {
        Long parentId = request == null ? null : request.getParentId();
        return taskService.changeParent(id, parentId);
    }
}
