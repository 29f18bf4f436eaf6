package com.example.tasktree.service;

import com.example.tasktree.dto.TaskCreateRequest;
import com.example.tasktree.dto.TaskNode;
import com.example.tasktree.entity.Task;
import com.example.tasktree.exception.InvalidTaskRequestException;
import com.example.tasktree.exception.TaskNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class TaskServiceTest {

    private TaskTreeStore store;
    private TaskService service;

    @BeforeEach
    void setUp() {
        store = mock(TaskTreeStore.class);
        service = new TaskService(store);
    }

    private Task row(Long id, Long parent, Long... childs) {
        Task task = new Task();
        task.setId(id);
        task.setTitle("task " + id);
        task.setParent(parent);
        task.setChilds(new ArrayList<>(List.of(childs)));
        return task;
    }

    private TaskNode node(Long id, TaskNode... childs) {
        TaskNode node = new TaskNode();
        node.setId(id);
        node.setTitle("task " + id);
        node.getChilds().addAll(List.of(childs));
        return node;
    }

    // ── create ──────────────────────────────────────────────────────

    @Test
    @DisplayName("create without parent inserts and returns the hydrated task")
    void createRootTask() {
        when(store.insertTask(any(Task.class))).thenReturn(row(1L, null));
        when(store.getTask(1L)).thenReturn(Optional.of(node(1L)));

        TaskNode created = service.createTask(new TaskCreateRequest("root", null, false), null);

        assertEquals(1L, created.getId());
        verify(store, never()).updateChilds(anyLong(), anyList());
    }

    @Test
    @DisplayName("create with parent appends the new id to the parent's child list")
    void createUnderParent() {
        when(store.findTask(10L)).thenReturn(Optional.of(row(10L, null, 3L)));
        when(store.insertTask(any(Task.class))).thenReturn(row(11L, null));
        when(store.getTask(11L)).thenReturn(Optional.of(node(11L)));

        service.createTask(new TaskCreateRequest("child", "desc", true), 10L);

        ArgumentCaptor<Task> inserted = ArgumentCaptor.forClass(Task.class);
        verify(store).insertTask(inserted.capture());
        assertEquals("child", inserted.getValue().getTitle());
        assertEquals("desc", inserted.getValue().getDescription());
        assertTrue(inserted.getValue().isStatus());
        verify(store).updateChilds(10L, List.of(3L, 11L));
    }

    @Test
    @DisplayName("create with unknown parent fails before inserting")
    void createWithMissingParent() {
        when(store.findTask(99L)).thenReturn(Optional.empty());

        assertThrows(TaskNotFoundException.class,
                () -> service.createTask(new TaskCreateRequest("orphan", null, false), 99L));
        verify(store, never()).insertTask(any());
    }

    // ── delete / toggle ─────────────────────────────────────────────

    @Test
    @DisplayName("delete returns the snapshot taken before deletion")
    void deleteReturnsSnapshot() {
        TaskNode snapshot = node(5L, node(6L));
        when(store.getTask(5L)).thenReturn(Optional.of(snapshot));

        TaskNode deleted = service.deleteTask(5L);

        assertSame(snapshot, deleted);
        verify(store).deleteTaskRecursive(5L);
    }

    @Test
    @DisplayName("delete of unknown task is NotFound")
    void deleteMissing() {
        when(store.getTask(5L)).thenReturn(Optional.empty());

        assertThrows(TaskNotFoundException.class, () -> service.deleteTask(5L));
        verify(store, never()).deleteTaskRecursive(anyLong());
    }

    @Test
    @DisplayName("toggle delegates to the store and re-reads the task")
    void toggleDelegates() {
        TaskNode after = node(7L);
        after.setStatus(true);
        when(store.getTask(7L)).thenReturn(Optional.of(node(7L)), Optional.of(after));

        TaskNode result = service.toggleTask(7L, true);

        assertTrue(result.isStatus());
        verify(store).toggleTask(7L);
    }

    @Test
    @DisplayName("toggle of unknown task is NotFound")
    void toggleMissing() {
        when(store.getTask(7L)).thenReturn(Optional.empty());

        assertThrows(TaskNotFoundException.class, () -> service.toggleTask(7L, false));
        verify(store, never()).toggleTask(anyLong());
    }

    // ── change-parent ───────────────────────────────────────────────

    @Test
    @DisplayName("change-parent to itself is a bad request")
    void changeParentToSelf() {
        when(store.findTask(1L)).thenReturn(Optional.of(row(1L, null)));

        assertThrows(InvalidTaskRequestException.class, () -> service.changeParent(1L, 1L));
        verify(store, never()).updateChilds(anyLong(), anyList());
    }

    @Test
    @DisplayName("change-parent to a descendant is a bad request")
    void changeParentToDescendant() {
        when(store.findTask(1L)).thenReturn(Optional.of(row(1L, null, 2L)));
        when(store.findTask(3L)).thenReturn(Optional.of(row(3L, 2L)));
        when(store.getTask(1L)).thenReturn(Optional.of(node(1L, node(2L, node(3L)))));

        assertThrows(InvalidTaskRequestException.class, () -> service.changeParent(1L, 3L));
        verify(store, never()).updateChilds(anyLong(), anyList());
        verify(store, never()).updateTask(any());
    }

    @Test
    @DisplayName("change-parent of unknown task or to unknown parent is NotFound")
    void changeParentMissing() {
        when(store.findTask(1L)).thenReturn(Optional.empty());
        assertThrows(TaskNotFoundException.class, () -> service.changeParent(1L, 2L));

        when(store.findTask(1L)).thenReturn(Optional.of(row(1L, null)));
        when(store.findTask(2L)).thenReturn(Optional.empty());
        assertThrows(TaskNotFoundException.class, () -> service.changeParent(1L, 2L));
    }

    @Test
    @DisplayName("change-parent unlinks from the old parent, links to the new one and persists the parent field")
    void changeParentMoves() {
        Task moving = row(4L, 1L);
        when(store.findTask(4L)).thenReturn(Optional.of(moving), Optional.of(row(4L, 2L)));
        when(store.findTask(1L)).thenReturn(Optional.of(row(1L, null, 4L, 5L)));
        when(store.findTask(2L)).thenReturn(Optional.of(row(2L, null, 6L)));
        when(store.getTask(4L)).thenReturn(Optional.of(node(4L)));
        when(store.updateTask(any(Task.class))).thenAnswer(inv -> Optional.of(inv.getArgument(0)));

        service.changeParent(4L, 2L);

        verify(store).updateChilds(1L, List.of(5L));
        verify(store).updateChilds(2L, List.of(6L, 4L));
        ArgumentCaptor<Task> written = ArgumentCaptor.forClass(Task.class);
        verify(store).updateTask(written.capture());
        assertEquals(2L, written.getValue().getParent());
    }

    @Test
    @DisplayName("change-parent with null parent detaches the task")
    void changeParentToRoot() {
        when(store.findTask(4L)).thenReturn(Optional.of(row(4L, 1L)), Optional.of(row(4L, null)));
        when(store.findTask(1L)).thenReturn(Optional.of(row(1L, null, 4L)));
        when(store.getTask(4L)).thenReturn(Optional.of(node(4L)));
        when(store.updateTask(any(Task.class))).thenAnswer(inv -> Optional.of(inv.getArgument(0)));

        service.changeParent(4L, null);

        verify(store).updateChilds(1L, List.of());
        ArgumentCaptor<Task> written = ArgumentCaptor.forClass(Task.class);
        verify(store).updateTask(written.capture());
        assertNull(written.getValue().getParent());
    }

    @Test
    @DisplayName("change-parent to the current parent changes nothing")
    void changeParentUnchanged() {
        when(store.findTask(4L)).thenReturn(Optional.of(row(4L, 1L)));
        when(store.findTask(1L)).thenReturn(Optional.of(row(1L, null, 4L)));
        when(store.getTask(4L)).thenReturn(Optional.of(node(4L)));

        service.changeParent(4L, 1L);

        verify(store, never()).updateChilds(anyLong(), anyList());
        verify(store, never()).updateTask(any());
    }
}
