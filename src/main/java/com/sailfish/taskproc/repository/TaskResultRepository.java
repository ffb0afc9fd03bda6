package com.sailfish.taskproc.repository;

import com.sailfish.taskproc.model.TaskResultRecord;
import com.sailfish.taskproc.model.TaskStatus;

import java.util.Optional;

/**
 * Result store access. Every status transition is a guarded update so that a terminal
 * status is never overwritten by a late or duplicate delivery.
 */
public interface TaskResultRepository {

    /**
     * Persists the record of a newly submitted task.
     *
     * @param record The record to save, with taskId and createdAt already set.
     * @return The saved record.
     */
    TaskResultRecord save(TaskResultRecord record);

    /**
     * Finds a task record by its ID.
     *
     * @param taskId The ID of the task.
     * @return An Optional containing the record if found, empty otherwise.
     */
    Optional<TaskResultRecord> findById(String taskId);

    /**
     * Removes the record of a task whose delivery was never published.
     *
     * @return true if a record was removed.
     */
    boolean delete(String taskId);

    /**
     * Moves a PENDING, RETRY or (redelivered) STARTED task to STARTED.
     *
     * @return true if the task may run, false if it is unknown or already terminal.
     */
    boolean markStarted(String taskId, String workerIdentity);

    /**
     * Moves a STARTED task to RETRY after a failed attempt.
     */
    boolean markRetry(String taskId, int retries, String lastError);

    /**
     * Stores a terminal outcome unless the task already has one.
     *
     * @param status    SUCCESS or FAILURE.
     * @param result    Serialized result, may be null.
     * @param lastError Error details for FAILURE, null otherwise.
     * @return true if the outcome was stored, false if the task was already terminal (e.g. REVOKED).
     */
    boolean complete(String taskId, TaskStatus status, byte[] result, String lastError);

    /**
     * Marks a non-terminal task REVOKED.
     *
     * @return true if the revocation was recorded.
     */
    boolean revoke(String taskId);
}
