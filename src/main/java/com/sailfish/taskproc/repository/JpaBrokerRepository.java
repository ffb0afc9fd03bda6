package com.sailfish.taskproc.repository;

import com.sailfish.taskproc.model.ControlMessage;
import com.sailfish.taskproc.model.TaskMessage;
import com.sailfish.taskproc.model.WorkerHeartbeat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jakarta.persistence.EntityManagerFactory;
import jakarta.persistence.TypedQuery;
import java.time.Instant;
import java.util.List;

/**
 * JPA implementation of the BrokerRepository, bound to the broker persistence unit.
 * Claims rely on guarded UPDATEs, so several consumers may poll the same tables.
 */
public class JpaBrokerRepository extends JpaRepositorySupport implements BrokerRepository {

    private static final Logger log = LoggerFactory.getLogger(JpaBrokerRepository.class);

    public JpaBrokerRepository(EntityManagerFactory entityManagerFactory) {
        super(entityManagerFactory);
    }

    @Override
    public TaskMessage publish(TaskMessage message) {
        return inTransaction(entityManager -> {
            entityManager.persist(message);
            log.debug("Published message {} for task ID {} on queue '{}'", message.getId(), message.getTaskId(), message.getQueueName());
            return message;
        });
    }

    @Override
    public List<TaskMessage> findReady(String queueName, Instant now, int limit) {
        String jpql = "SELECT m FROM TaskMessage m " +
                      "WHERE m.queueName = :queue AND m.claimedBy IS NULL AND m.visibleAt <= :now " +
                      "ORDER BY m.visibleAt ASC, m.id ASC";
        return read(entityManager -> {
            TypedQuery<TaskMessage> query = entityManager.createQuery(jpql, TaskMessage.class);
            query.setParameter("queue", queueName);
            query.setParameter("now", now);
            query.setMaxResults(limit);
            return query.getResultList();
        });
    }

    @Override
    public boolean claim(Long messageId, String workerIdentity, Instant now) {
        int updatedCount = inTransaction(entityManager -> entityManager.createQuery(
                        "UPDATE TaskMessage m SET m.claimedBy = :worker, m.claimedAt = :now " +
                        "WHERE m.id = :id AND m.claimedBy IS NULL")
                .setParameter("worker", workerIdentity)
                .setParameter("now", now)
                .setParameter("id", messageId)
                .executeUpdate());
        if (updatedCount == 0) {
            log.debug("Message {} was claimed by another worker or acknowledged already", messageId);
        }
        return updatedCount > 0;
    }

    @Override
    public boolean ack(Long messageId, String workerIdentity) {
        int deletedCount = inTransaction(entityManager -> entityManager.createQuery(
                        "DELETE FROM TaskMessage m WHERE m.id = :id AND m.claimedBy = :worker")
                .setParameter("id", messageId)
                .setParameter("worker", workerIdentity)
                .executeUpdate());
        if (deletedCount == 0) {
            log.warn("Could not acknowledge message {}: no longer claimed by {}", messageId, workerIdentity);
        }
        return deletedCount > 0;
    }

    @Override
    public boolean reschedule(Long messageId, String workerIdentity, int retries, Instant visibleAt) {
        int updatedCount = inTransaction(entityManager -> entityManager.createQuery(
                        "UPDATE TaskMessage m SET m.claimedBy = NULL, m.claimedAt = NULL, " +
                        "m.retries = :retries, m.visibleAt = :visibleAt " +
                        "WHERE m.id = :id AND m.claimedBy = :worker")
                .setParameter("retries", retries)
                .setParameter("visibleAt", visibleAt)
                .setParameter("id", messageId)
                .setParameter("worker", workerIdentity)
                .executeUpdate());
        if (updatedCount == 0) {
            log.warn("Could not reschedule message {}: no longer claimed by {}", messageId, workerIdentity);
        }
        return updatedCount > 0;
    }

    @Override
    public int deleteUnclaimed(String taskId) {
        return inTransaction(entityManager -> entityManager.createQuery(
                        "DELETE FROM TaskMessage m WHERE m.taskId = :taskId AND m.claimedBy IS NULL")
                .setParameter("taskId", taskId)
                .executeUpdate());
    }

    @Override
    public int releaseClaims(String workerIdentity) {
        int released = inTransaction(entityManager -> entityManager.createQuery(
                        "UPDATE TaskMessage m SET m.claimedBy = NULL, m.claimedAt = NULL WHERE m.claimedBy = :worker")
                .setParameter("worker", workerIdentity)
                .executeUpdate());
        if (released > 0) {
            log.info("Returned {} unfinished message(s) of worker {} to the queue", released, workerIdentity);
        }
        return released;
    }

    @Override
    public int requeueOrphaned(Instant heartbeatCutoff) {
        int released = inTransaction(entityManager -> entityManager.createQuery(
                        "UPDATE TaskMessage m SET m.claimedBy = NULL, m.claimedAt = NULL " +
                        "WHERE m.claimedBy IS NOT NULL AND m.claimedBy NOT IN " +
                        "(SELECT h.workerIdentity FROM WorkerHeartbeat h WHERE h.lastSeen >= :cutoff)")
                .setParameter("cutoff", heartbeatCutoff)
                .executeUpdate());
        if (released > 0) {
            log.warn("Requeued {} message(s) held by lost workers", released);
        }
        return released;
    }

    @Override
    public ControlMessage publishControl(ControlMessage message) {
        return inTransaction(entityManager -> {
            entityManager.persist(message);
            log.debug("Published control message {}", message);
            return message;
        });
    }

    @Override
    public long latestControlId() {
        Long latest = read(entityManager -> entityManager
                .createQuery("SELECT MAX(c.id) FROM ControlMessage c", Long.class)
                .getSingleResult());
        return latest == null ? 0L : latest;
    }

    @Override
    public List<ControlMessage> findControlMessages(long afterId, String workerIdentity) {
        return read(entityManager -> entityManager.createQuery(
                        "SELECT c FROM ControlMessage c " +
                        "WHERE c.id > :afterId AND (c.destination IS NULL OR c.destination = :worker) " +
                        "ORDER BY c.id ASC", ControlMessage.class)
                .setParameter("afterId", afterId)
                .setParameter("worker", workerIdentity)
                .getResultList());
    }

    @Override
    public void saveHeartbeat(WorkerHeartbeat heartbeat) {
        runInTransaction(entityManager -> entityManager.merge(heartbeat));
    }

    @Override
    public void removeHeartbeat(String workerIdentity) {
        runInTransaction(entityManager -> {
            WorkerHeartbeat heartbeat = entityManager.find(WorkerHeartbeat.class, workerIdentity);
            if (heartbeat != null) {
                entityManager.remove(heartbeat);
            }
        });
    }

    @Override
    public List<WorkerHeartbeat> findHeartbeats(Instant cutoff) {
        return read(entityManager -> entityManager.createQuery(
                        "SELECT h FROM WorkerHeartbeat h WHERE h.lastSeen >= :cutoff ORDER BY h.workerIdentity",
                        WorkerHeartbeat.class)
                .setParameter("cutoff", cutoff)
                .getResultList());
    }
}
