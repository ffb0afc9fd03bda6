package com.sailfish.taskproc.exception;

/**
 * Base class of the errors raised synchronously by task processor adapters.
 */
public class TaskProcessorException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public TaskProcessorException(String message) {
        super(message);
    }

    public TaskProcessorException(String message, Throwable cause) {
        super(message, cause);
    }
}
