package com.example.tasktree.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Raised when a child-list rewrite would make a task its own ancestor.
 * Nothing from the rejected rewrite is written.
 */
@ResponseStatus(value = HttpStatus.CONFLICT)
public class CycleDetectedException extends RuntimeException {

    public CycleDetectedException(String message) {
        super(message);
    }
}
