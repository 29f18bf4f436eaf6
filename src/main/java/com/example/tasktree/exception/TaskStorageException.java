package com.example.tasktree.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// an insert or update that should have produced a row did not
@ResponseStatus(value = HttpStatus.INTERNAL_SERVER_ERROR)
public class TaskStorageException extends RuntimeException {

    public TaskStorageException(String message) {
        super(message);
    }
}
