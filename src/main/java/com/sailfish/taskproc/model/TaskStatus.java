package com.sailfish.taskproc.model;

/**
 * Observable status of a submitted task. Rendered as the constant name at the boundary.
 */
public enum TaskStatus {
    /**
     * Task has been submitted (or is unknown to the result store) and waits for a consumer.
     */
    PENDING,
    /**
     * A consumer picked the task up and its handler is running.
     */
    STARTED,
    /**
     * Handler failed; the task is waiting for its next attempt.
     */
    RETRY,
    /**
     * Handler completed; the result holds its return value.
     */
    SUCCESS,
    /**
     * Handler failed and the retry limit is reached, or no handler is registered for the task.
     */
    FAILURE,
    /**
     * Task was cancelled before reaching another terminal status.
     */
    REVOKED;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILURE || this == REVOKED;
    }
}
