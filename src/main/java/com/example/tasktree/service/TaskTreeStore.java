package com.example.tasktree.service;

import com.example.tasktree.dto.TaskNode;
import com.example.tasktree.entity.Task;
import com.example.tasktree.exception.CycleDetectedException;
import com.example.tasktree.exception.TaskNotFoundException;
import com.example.tasktree.exception.TaskStorageException;
import com.example.tasktree.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.*;

/**
 * Owns the persisted task rows and keeps the parent/childs links consistent.
 *
 * <p>Every traversal carries a visited set, so rows that already form a cycle
 * are expanded once and then treated as absent instead of recursing forever.
 * Values handed out are copies or {@link TaskNode} views, never managed rows.
 */
@Service
public class TaskTreeStore {

    private static final Logger logger = LoggerFactory.getLogger(TaskTreeStore.class);

    private final TaskRepository taskRepository;

    public TaskTreeStore(TaskRepository taskRepository) {
        this.taskRepository = taskRepository;
    }

    // 1. Insert a new row, then link it to its parent and children (rolled back on a cycle)
    @Transactional
    public Task insertTask(Task task) {
        List<Long> requestedChilds = childIdsOf(task);
        Long parentId = task.getParent();
        if (parentId != null && !taskRepository.existsById(parentId)) {
            throw new TaskNotFoundException(parentId);
        }

        Task row = new Task();
        row.setTitle(task.getTitle());
        row.setDescription(task.getDescription());
        row.setStatus(task.isStatus());
        row.setParent(task.getParent());
        row.setChilds(new ArrayList<>());
        row.setUpdated(LocalDateTime.now());

        Task saved = taskRepository.saveAndFlush(row);
        if (saved == null || saved.getId() == null) {
            throw new TaskStorageException("Insert returned no row for task '" + task.getTitle() + "'");
        }
        logger.info("Inserted task {} '{}'", saved.getId(), saved.getTitle());

        // the parent must list the new task too
        if (parentId != null) {
            Task parent = taskRepository.findById(parentId).orElseThrow(() -> new TaskNotFoundException(parentId));
            List<Long> siblings = childIdsOf(parent);
            siblings.add(saved.getId());
            updateChilds(parentId, siblings);
        }
        if (!requestedChilds.isEmpty()) {
            updateChilds(saved.getId(), requestedChilds);
        }
        return snapshot(saved);
    }

    // 2. Tasks that no other task lists as a child, children expanded
    @Transactional(readOnly = true)
    public List<TaskNode> getRootTasks() {
        List<Task> all = taskRepository.findAllByOrderByIdAsc();

        Set<Long> listedAsChild = new HashSet<>();
        for (Task task : all) {
            for (Long childId : childIdsOf(task)) {
                if (!childId.equals(task.getId())) {
                    listedAsChild.add(childId);
                }
            }
        }

        List<TaskNode> roots = new ArrayList<>();
        for (Task task : all) {
            if (!listedAsChild.contains(task.getId())) {
                roots.add(expandChilds(task, new HashSet<>()));
            }
        }
        return roots;
    }

    // 3. One task with its subtree and ancestor chain
    @Transactional(readOnly = true)
    public Optional<TaskNode> getTask(Long id) {
        return taskRepository.findById(id).map(task -> {
            Set<Long> visited = new HashSet<>();
            TaskNode node = expandChilds(task, visited);
            node.setParent(expandAncestors(task.getParent(), visited));
            return node;
        });
    }

    // flat copy of a single row, links left as ids
    @Transactional(readOnly = true)
    public Optional<Task> findTask(Long id) {
        return taskRepository.findById(id).map(this::snapshot);
    }

    // 4. Delete the task and everything below it, children first
    @Transactional
    public void deleteTaskRecursive(Long id) {
        Optional<Task> found = taskRepository.findById(id);
        if (found.isEmpty()) {
            logger.debug("Delete of task {} skipped, no such task", id);
            return;
        }
        Long parentId = found.get().getParent();

        deleteRecursive(id, new HashSet<>());

        // drop the dangling id from the surviving parent
        if (parentId != null) {
            taskRepository.findById(parentId).ifPresent(parent -> {
                List<Long> remaining = childIdsOf(parent);
                if (remaining.remove(id)) {
                    parent.setChilds(remaining);
                    parent.setUpdated(LocalDateTime.now());
                    taskRepository.save(parent);
                }
            });
        }
    }

    private void deleteRecursive(Long id, Set<Long> visited) {
        if (!visited.add(id)) {
            logger.warn("Task {} reached twice while deleting, stored links contain a cycle", id);
            return;
        }
        Optional<Task> found = taskRepository.findById(id);
        if (found.isEmpty()) {
            return;
        }
        Task task = found.get();
        for (Long childId : childIdsOf(task)) {
            deleteRecursive(childId, visited);
        }
        taskRepository.delete(task);
        logger.info("Deleted task {}", id);
    }

    // 5. Flip status; switching to done pushes done onto every descendant
    @Transactional
    public void toggleTask(Long id) {
        Optional<Task> found = taskRepository.findById(id);
        if (found.isEmpty()) {
            logger.debug("Toggle of task {} skipped, no such task", id);
            return;
        }
        Task task = found.get();
        boolean done = !task.isStatus();
        task.setStatus(done);
        task.setUpdated(LocalDateTime.now());
        taskRepository.save(task);
        logger.info("Task {} status set to {}", id, done);

        if (done) {
            Set<Long> visited = new HashSet<>();
            visited.add(id);
            markDescendantsDone(task, visited);
        }
    }

    private void markDescendantsDone(Task task, Set<Long> visited) {
        for (Long childId : childIdsOf(task)) {
            if (!visited.add(childId)) {
                continue;
            }
            // re-read each child so its own child list is current
            taskRepository.findById(childId).ifPresent(child -> {
                child.setStatus(true);
                child.setUpdated(LocalDateTime.now());
                taskRepository.save(child);
                markDescendantsDone(child, visited);
            });
        }
    }

    // 6. Replace the child list of a task and repair the parent pointers
    @Transactional
    public void updateChilds(Long id, List<Long> newChildIds) {
        Task task = taskRepository.findById(id).orElseThrow(() -> new TaskNotFoundException(id));
        List<Long> requested = new ArrayList<>(new LinkedHashSet<>(newChildIds));

        if (requested.contains(id)) {
            throw new CycleDetectedException("Task " + id + " cannot be its own child");
        }
        List<Long> previous = childIdsOf(task);
        Map<Long, Task> children = new LinkedHashMap<>();
        for (Long childId : requested) {
            Optional<Task> child = taskRepository.findById(childId);
            if (child.isEmpty()) {
                // rows already gone are pruned, only newly named ids must exist
                if (previous.contains(childId)) {
                    logger.warn("Task {} lists missing child {}, dropping it", id, childId);
                    continue;
                }
                throw new TaskNotFoundException(childId);
            }
            if (isAncestor(childId, id)) {
                throw new CycleDetectedException("Task " + childId + " is an ancestor of task " + id);
            }
            children.put(childId, child.get());
        }

        List<Long> kept = new ArrayList<>(children.keySet());
        LocalDateTime now = LocalDateTime.now();

        task.setChilds(kept);
        task.setUpdated(now);
        taskRepository.save(task);

        for (Task child : children.values()) {
            if (previous.contains(child.getId())) {
                continue;
            }
            detachFromFormerParent(child, id);
            child.setParent(id);
            child.setUpdated(now);
            taskRepository.save(child);
        }

        for (Long formerId : previous) {
            if (children.containsKey(formerId)) {
                continue;
            }
            taskRepository.findById(formerId).ifPresent(former -> {
                if (id.equals(former.getParent())) {
                    former.setParent(null);
                    former.setUpdated(now);
                    taskRepository.save(former);
                }
            });
        }
        logger.info("Task {} children set to {}", id, kept);
    }

    // a task keeps a single parent, so the old parent must stop listing it
    private void detachFromFormerParent(Task child, Long newParentId) {
        Long formerParentId = child.getParent();
        if (formerParentId == null || formerParentId.equals(newParentId)) {
            return;
        }
        taskRepository.findById(formerParentId).ifPresent(formerParent -> {
            List<Long> siblings = childIdsOf(formerParent);
            if (siblings.remove(child.getId())) {
                formerParent.setChilds(siblings);
                formerParent.setUpdated(LocalDateTime.now());
                taskRepository.save(formerParent);
                logger.info("Task {} moved away from former parent {}", child.getId(), formerParentId);
            }
        });
    }

    // 7. Low-level full-row write, no cycle checks
    @Transactional
    public Optional<Task> updateTask(Task task) {
        if (task.getId() == null) {
            return Optional.empty();
        }
        return taskRepository.findById(task.getId()).map(row -> {
            row.setTitle(task.getTitle());
            row.setDescription(task.getDescription());
            row.setStatus(task.isStatus());
            row.setParent(task.getParent());
            row.setChilds(childIdsOf(task));
            row.setUpdated(LocalDateTime.now());
            return snapshot(taskRepository.save(row));
        });
    }

    /**
     * Walks the parent chain of {@code targetId} looking for {@code candidateId}.
     * A chain that revisits an id already contains a cycle and is reported as
     * an ancestor match, since nothing safe can be said about it.
     */
    boolean isAncestor(Long candidateId, Long targetId) {
        Set<Long> seen = new HashSet<>();
        seen.add(targetId);
        Long current = taskRepository.findById(targetId).map(Task::getParent).orElse(null);
        while (current != null) {
            if (current.equals(candidateId)) {
                return true;
            }
            if (!seen.add(current)) {
                logger.warn("Parent chain of task {} loops at {}", targetId, current);
                return true;
            }
            current = taskRepository.findById(current).map(Task::getParent).orElse(null);
        }
        return false;
    }

    private TaskNode expandChilds(Task task, Set<Long> visited) {
        visited.add(task.getId());
        TaskNode node = TaskNode.of(task);
        for (Long childId : childIdsOf(task)) {
            if (visited.contains(childId)) {
                logger.warn("Task {} already expanded, link from task {} not followed", childId, task.getId());
                continue;
            }
            taskRepository.findById(childId)
                    .ifPresent(child -> node.getChilds().add(expandChilds(child, visited)));
        }
        return node;
    }

    private TaskNode expandAncestors(Long parentId, Set<Long> visited) {
        if (parentId == null) {
            return null;
        }
        if (!visited.add(parentId)) {
            logger.warn("Task {} already expanded, parent link not followed", parentId);
            return null;
        }
        return taskRepository.findById(parentId).map(parent -> {
            TaskNode node = TaskNode.of(parent);
            node.setParent(expandAncestors(parent.getParent(), visited));
            return node;
        }).orElse(null);
    }

    private Task snapshot(Task row) {
        Task copy = new Task();
        copy.setId(row.getId());
        copy.setTitle(row.getTitle());
        copy.setDescription(row.getDescription());
        copy.setStatus(row.isStatus());
        copy.setUpdated(row.getUpdated());
        copy.setParent(row.getParent());
        copy.setChilds(childIdsOf(row));
        return copy;
    }

    private static List<Long> childIdsOf(Task task) {
        return task.getChilds() == null ? new ArrayList<>() : new ArrayList<>(task.getChilds());
    }
}
