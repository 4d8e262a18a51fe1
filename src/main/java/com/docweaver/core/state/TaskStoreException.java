package com.docweaver.core.state;

/**
 * The backing store could not read or write a task.
 */
public class TaskStoreException extends RuntimeException {

    public TaskStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
