package com.sailfish.taskproc.model;

import jakarta.persistence.*;
import java.io.Serializable;
import java.time.Instant;

/**
 * Liveness and counters published periodically by each running consumer.
 */
@Entity
@Table(name = "task_worker_heartbeats")
public class WorkerHeartbeat implements Serializable {

    private static final long serialVersionUID = 1L;

    @Id
    @Column(length = 200)
    private String workerIdentity;

    @Column(nullable = false, length = 200)
    private String queueName;

    private int concurrency;
    private int active;
    private long processed;
    private long succeeded;
    private long failed;
    private long retried;

    @Column(nullable = false)
    private Instant startedAt;

    @Column(nullable = false)
    private Instant lastSeen;

    public String getWorkerIdentity() {
        return workerIdentity;
    }

    public void setWorkerIdentity(String workerIdentity) {
        this.workerIdentity = workerIdentity;
    }

    public String getQueueName() {
        return queueName;
    }

    public void setQueueName(String queueName) {
        this.queueName = queueName;
    }

    public int getConcurrency() {
        return concurrency;
    }

    public void setConcurrency(int concurrency) {
        this.concurrency = concurrency;
    }

    public int getActive() {
        return active;
    }

    public void setActive(int active) {
        this.active = active;
    }

    public long getProcessed() {
        return processed;
    }

    public void setProcessed(long processed) {
        this.processed = processed;
    }

    public long getSucceeded() {
        return succeeded;
    }

    public void setSucceeded(long succeeded) {
        this.succeeded = succeeded;
    }

    public long getFailed() {
        return failed;
    }

    public void setFailed(long failed) {
        this.failed = failed;
    }

    public long getRetried() {
        return retried;
    }

    public void setRetried(long retried) {
        this.retried = retried;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getLastSeen() {
        return lastSeen;
    }

    public void setLastSeen(Instant lastSeen) {
        this.lastSeen = lastSeen;
    }

    @Override
    public String toString() {
        return "WorkerHeartbeat{" +
               "workerIdentity='" + workerIdentity + '\'' +
               ", queueName='" + queueName + '\'' +
               ", active=" + active +
               ", processed=" + processed +
               ", lastSeen=" + lastSeen +
               '}';
    }
}
