package com.example.tasktree.service;

import com.example.tasktree.dto.TaskCreateRequest;
import com.example.tasktree.dto.TaskNode;
import com.example.tasktree.entity.Task;
import com.example.tasktree.exception.InvalidTaskRequestException;
import com.example.tasktree.exception.TaskNotFoundException;
import com.example.tasktree.exception.TaskStorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

@Service
@Transactional
public class TaskService {

    private static final Logger logger = LoggerFactory.getLogger(TaskService.class);

    private final TaskTreeStore store;

    public TaskService(TaskTreeStore store) {
        this.store = store;
    }

    @Transactional(readOnly = true)
    public List<TaskNode> getRootTasks() {
        return store.getRootTasks();
    }

    @Transactional(readOnly = true)
    public TaskNode getTask(Long id) {
        return store.getTask(id).orElseThrow(() -> new TaskNotFoundException(id));
    }

    // 1. Create a task, optionally under an existing parent
    public TaskNode createTask(TaskCreateRequest request, Long parentId) {
        Task parent = null;
        if (parentId != null) {
            parent = store.findTask(parentId).orElseThrow(() -> new TaskNotFoundException(parentId));
        }

        Task task = new Task();
        task.setTitle(request.getTitle());
        task.setDescription(request.getDescription());
        task.setStatus(request.isStatus());
        Task created = store.insertTask(task);

        if (parent != null) {
            List<Long> childs = new ArrayList<>(parent.getChilds());
            childs.add(created.getId());
            store.updateChilds(parentId, childs);
        }
        logger.info("Created task {} under parent {}", created.getId(), parentId);

        return store.getTask(created.getId())
                .orElseThrow(() -> new TaskStorageException("Created task " + created.getId() + " could not be read back"));
    }

    // 2. Delete a task with its subtree, returning what it looked like before
    public TaskNode deleteTask(Long id) {
        TaskNode snapshot = getTask(id);
        store.deleteTaskRecursive(id);
        logger.info("Deleted task {} with its subtree", id);
        return snapshot;
    }

    // 3. Toggle status; the store cascades done onto descendants
    public TaskNode toggleTask(Long id, boolean withChilds) {
        getTask(id);
        logger.debug("Toggling task {} (with_childs={})", id, withChilds);
        store.toggleTask(id);
        return getTask(id);
    }

    // 4. Move a task (and its subtree) under a new parent, or to the root level when null
    public TaskNode changeParent(Long id, Long newParentId) {
        Task task = store.findTask(id).orElseThrow(() -> new TaskNotFoundException(id));

        if (newParentId != null) {
            if (newParentId.equals(id)) {
                throw new InvalidTaskRequestException("Task " + id + " cannot be its own parent");
            }
            store.findTask(newParentId).orElseThrow(() -> new TaskNotFoundException(newParentId));
            if (getTask(id).hasDescendant(newParentId)) {
                throw new InvalidTaskRequestException(
                        "Task " + newParentId + " is a descendant of task " + id + " and cannot become its parent");
            }
        }

        Long oldParentId = task.getParent();
        if (Objects.equals(oldParentId, newParentId)) {
            return getTask(id);
        }

        if (oldParentId != null) {
            store.findTask(oldParentId).ifPresent(oldParent -> {
                List<Long> childs = new ArrayList<>(oldParent.getChilds());
                childs.remove(id);
                store.updateChilds(oldParentId, childs);
            });
        }
        if (newParentId != null) {
            Task newParent = store.findTask(newParentId).orElseThrow(() -> new TaskNotFoundException(newParentId));
            List<Long> childs = new ArrayList<>(newParent.getChilds());
            childs.add(id);
            store.updateChilds(newParentId, childs);
        }

        Task moved = store.findTask(id).orElseThrow(() -> new TaskNotFoundException(id));
        moved.setParent(newParentId);
        store.updateTask(moved)
                .orElseThrow(() -> new TaskStorageException("Update of task " + id + " returned no row"));
        logger.info("Task {} moved from parent {} to {}", id, oldParentId, newParentId);

        return getTask(id);
    }
}
