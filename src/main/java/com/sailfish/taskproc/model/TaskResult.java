package com.sailfish.taskproc.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Snapshot of the observable state of one task. Fetched from the result store on every query,
 * never cached by the adapter.
 */
public final class TaskResult {

    private final String id;
    private final TaskStatus status;
    private final Instant createdAt;
    private final Object result;

    public TaskResult(String id, TaskStatus status, Instant createdAt, Object result) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
        this.status = Objects.requireNonNull(status, "status cannot be null");
        this.createdAt = createdAt;
        this.result = result;
    }

    public String getId() {
        return id;
    }

    public TaskStatus getStatus() {
        return status;
    }

    /**
     * @return submission time as stamped by the submitting side, or null when the task is unknown.
     */
    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * @return the handler's return value on SUCCESS, the error description on FAILURE, null otherwise.
     */
    public Object getResult() {
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TaskResult that = (TaskResult) o;
        return id.equals(that.id) && status == that.status
               && Objects.equals(createdAt, that.createdAt) && Objects.equals(result, that.result);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, status, createdAt, result);
    }

    @Override
    public String toString() {
        return "TaskResult{" +
               "id='" + id + '\'' +
               ", status=" + status +
               ", createdAt=" + createdAt +
               ", result=" + result +
               '}';
    }
}
