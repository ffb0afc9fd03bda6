package com.sailfish.taskproc.repository;

import com.sailfish.taskproc.model.TaskResultRecord;
import com.sailfish.taskproc.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jakarta.persistence.EntityManagerFactory;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * JPA implementation of the TaskResultRepository, bound to the result-store persistence unit.
 */
public class JpaTaskResultRepository extends JpaRepositorySupport implements TaskResultRepository {

    private static final Logger log = LoggerFactory.getLogger(JpaTaskResultRepository.class);

    private static final int MAX_ERROR_LENGTH = 2000;
    private static final List<TaskStatus> TERMINAL = Arrays.asList(TaskStatus.SUCCESS, TaskStatus.FAILURE, TaskStatus.REVOKED);
    private static final List<TaskStatus> RUNNABLE = Arrays.asList(TaskStatus.PENDING, TaskStatus.RETRY, TaskStatus.STARTED);

    public JpaTaskResultRepository(EntityManagerFactory entityManagerFactory) {
        super(entityManagerFactory);
    }

    @Override
    public TaskResultRecord save(TaskResultRecord record) {
        return inTransaction(entityManager -> {
            entityManager.persist(record);
            log.debug("Persisted TaskResultRecord for task ID: {}", record.getTaskId());
            return record;
        });
    }

    @Override
    public Optional<TaskResultRecord> findById(String taskId) {
        return read(entityManager -> Optional.ofNullable(entityManager.find(TaskResultRecord.class, taskId)));
    }

    @Override
    public boolean delete(String taskId) {
        int deletedCount = inTransaction(entityManager -> entityManager.createQuery(
                        "DELETE FROM TaskResultRecord r WHERE r.taskId = :id")
                .setParameter("id", taskId)
                .executeUpdate());
        return deletedCount > 0;
    }

    @Override
    public boolean markStarted(String taskId, String workerIdentity) {
        int updatedCount = inTransaction(entityManager -> entityManager.createQuery(
                        "UPDATE TaskResultRecord r SET r.status = :status, r.workerIdentity = :worker, r.updatedAt = :updatedAt " +
                        "WHERE r.taskId = :id AND r.status IN :runnable")
                .setParameter("status", TaskStatus.STARTED)
                .setParameter("worker", workerIdentity)
                .setParameter("updatedAt", Instant.now())
                .setParameter("id", taskId)
                .setParameter("runnable", RUNNABLE)
                .executeUpdate());
        return logOutcome(updatedCount, taskId, TaskStatus.STARTED);
    }

    @Override
    public boolean markRetry(String taskId, int retries, String lastError) {
        int updatedCount = inTransaction(entityManager -> entityManager.createQuery(
                        "UPDATE TaskResultRecord r SET r.status = :status, r.retries = :retries, " +
                        "r.lastError = :lastError, r.updatedAt = :updatedAt " +
                        "WHERE r.taskId = :id AND r.status = :started")
                .setParameter("status", TaskStatus.RETRY)
                .setParameter("retries", retries)
                .setParameter("lastError", truncateError(lastError))
                .setParameter("updatedAt", Instant.now())
                .setParameter("id", taskId)
                .setParameter("started", TaskStatus.STARTED)
                .executeUpdate());
        return logOutcome(updatedCount, taskId, TaskStatus.RETRY);
    }

    @Override
    public boolean complete(String taskId, TaskStatus status, byte[] result, String lastError) {
        if (status != TaskStatus.SUCCESS && status != TaskStatus.FAILURE) {
            throw new IllegalArgumentException("status must be SUCCESS or FAILURE but was " + status);
        }
        int updatedCount = inTransaction(entityManager -> entityManager.createQuery(
                        "UPDATE TaskResultRecord r SET r.status = :status, r.result = :result, " +
                        "r.lastError = :lastError, r.updatedAt = :updatedAt " +
                        "WHERE r.taskId = :id AND r.status NOT IN :terminal")
                .setParameter("status", status)
                .setParameter("result", result)
                .setParameter("lastError", truncateError(lastError))
                .setParameter("updatedAt", Instant.now())
                .setParameter("id", taskId)
                .setParameter("terminal", TERMINAL)
                .executeUpdate());
        return logOutcome(updatedCount, taskId, status);
    }

    @Override
    public boolean revoke(String taskId) {
        int updatedCount = inTransaction(entityManager -> entityManager.createQuery(
                        "UPDATE TaskResultRecord r SET r.status = :status, r.updatedAt = :updatedAt " +
                        "WHERE r.taskId = :id AND r.status NOT IN :terminal")
                .setParameter("status", TaskStatus.REVOKED)
                .setParameter("updatedAt", Instant.now())
                .setParameter("id", taskId)
                .setParameter("terminal", TERMINAL)
                .executeUpdate());
        return logOutcome(updatedCount, taskId, TaskStatus.REVOKED);
    }

    private boolean logOutcome(int updatedCount, String taskId, TaskStatus status) {
        if (updatedCount > 0) {
            log.debug("Updated status for task ID {} to {}.", taskId, status);
            return true;
        }
        // Either the ID doesn't exist or the task is already in a state the transition doesn't accept
        Optional<TaskResultRecord> record = findById(taskId);
        if (record.isPresent()) {
            log.debug("Did not update task ID {} to {} (current status {}).", taskId, status, record.get().getStatus());
        } else {
            log.warn("Attempted to update status for non-existent task ID {}", taskId);
        }
        return false;
    }

    private String truncateError(String error) {
        if (error == null) return null;
        if (error.length() > MAX_ERROR_LENGTH) {
            return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
        }
        return error;
    }
}
