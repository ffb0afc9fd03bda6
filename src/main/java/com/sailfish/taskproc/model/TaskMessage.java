package com.sailfish.taskproc.model;

import jakarta.persistence.*;
import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * One delivery of a task on the broker. The row exists until the consumer acknowledges it,
 * which happens only after the outcome of the attempt is stored.
 */
@Entity
@Table(name = "task_messages", indexes = {
    @Index(name = "idx_task_messages_ready", columnList = "queueName, claimedBy, visibleAt"),
    @Index(name = "idx_task_messages_task", columnList = "taskId")
})
public class TaskMessage implements Serializable {

    private static final long serialVersionUID = 1L;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String taskId;

    @Column(nullable = false, length = 200)
    private String taskName;

    @Column(nullable = false, length = 200)
    private String queueName;

    @Lob
    @Column(nullable = false)
    private byte[] payload; // Serialized TaskArguments

    @Lob
    @Column(name = "message_options")
    private byte[] options; // Serialized per-call options, kept verbatim

    @Column(nullable = false)
    private int retries = 0;

    @Column(nullable = false)
    private Instant visibleAt; // Not delivered before this instant (countdown, eta, retry backoff)

    @Column(length = 200)
    private String claimedBy; // Worker identity holding the delivery, null while queued

    private Instant claimedAt;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        if (visibleAt == null) {
            visibleAt = createdAt;
        }
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
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

    public byte[] getPayload() {
        return payload;
    }

    public void setPayload(byte[] payload) {
        this.payload = payload;
    }

    public byte[] getOptions() {
        return options;
    }

    public void setOptions(byte[] options) {
        this.options = options;
    }

    public int getRetries() {
        return retries;
    }

    public void setRetries(int retries) {
        this.retries = retries;
    }

    public Instant getVisibleAt() {
        return visibleAt;
    }

    public void setVisibleAt(Instant visibleAt) {
        this.visibleAt = visibleAt;
    }

    public String getClaimedBy() {
        return claimedBy;
    }

    public void setClaimedBy(String claimedBy) {
        this.claimedBy = claimedBy;
    }

    public Instant getClaimedAt() {
        return claimedAt;
    }

    public void setClaimedAt(Instant claimedAt) {
        this.claimedAt = claimedAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TaskMessage that = (TaskMessage) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "TaskMessage{" +
               "id=" + id +
               ", taskId='" + taskId + '\'' +
               ", taskName='" + taskName + '\'' +
               ", queueName='" + queueName + '\'' +
               ", retries=" + retries +
               ", visibleAt=" + visibleAt +
               ", claimedBy='" + claimedBy + '\'' +
               '}';
    }
}
