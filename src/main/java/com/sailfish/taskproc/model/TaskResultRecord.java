package com.sailfish.taskproc.model;

import jakarta.persistence.*;
import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Persistent state of one task in the result store.
 */
@Entity
@Table(name = "task_results", indexes = {
    @Index(name = "idx_task_results_status", columnList = "status")
})
public class TaskResultRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    @Id
    @Column(length = 64)
    private String taskId;

    @Column(nullable = false, length = 200)
    private String taskName;

    @Column(nullable = false, length = 200)
    private String queueName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TaskStatus status;

    @Lob
    @Column(name = "result_payload")
    private byte[] result; // Serialized handler return value, or error description on FAILURE

    @Column(nullable = false)
    private int retries = 0;

    @Column(length = 2000)
    private String lastError;

    @Column(length = 200)
    private String workerIdentity; // Last consumer that picked the task up

    @Column(nullable = false, updatable = false)
    private Instant createdAt; // Stamped by the submitting side

    @Column(nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        updatedAt = Instant.now();
        if (createdAt == null) {
            createdAt = updatedAt;
        }
        if (status == null) {
            status = TaskStatus.PENDING;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public String getTaskId() {
        return taskId;
    }

    public void setTaskId(String taskId) {
        this.taskId = taskId;
    }

    public String getTaskName() {
        return taskName;
    }

    public void setTaskName(String taskName) {
        this.taskName = taskName;
    }

    public String getQueueName() {
        return queueName;
    }

    public void setQueueName(String queueName) {
        this.queueName = queueName;
    }

    public TaskStatus getStatus() {
        return status;
    }

    public void setStatus(TaskStatus status) {
        this.status = status;
    }

    public byte[] getResult() {
        return result;
    }

    public void setResult(byte[] result) {
        this.result = result;
    }

    public int getRetries() {
        return retries;
    }

    public void setRetries(int retries) {
        this.retries = retries;
    }

    public String getLastError() {
        return lastError;
    }

    public void setLastError(String lastError) {
        this.lastError = lastError;
    }

    public String getWorkerIdentity() {
        return workerIdentity;
    }

    public void setWorkerIdentity(String workerIdentity) {
        this.workerIdentity = workerIdentity;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TaskResultRecord that = (TaskResultRecord) o;
        return Objects.equals(taskId, that.taskId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(taskId);
    }

    @Override
    public String toString() {
        return "TaskResultRecord{" +
               "taskId='" + taskId + '\'' +
               ", taskName='" + taskName + '\'' +
               ", status=" + status +
               ", retries=" + retries +
               ", workerIdentity='" + workerIdentity + '\'' +
               ", createdAt=" + createdAt +
               ", updatedAt=" + updatedAt +
               '}';
    }
}
