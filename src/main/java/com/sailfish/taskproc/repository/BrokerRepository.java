package com.sailfish.taskproc.repository;

import com.sailfish.taskproc.model.ControlMessage;
import com.sailfish.taskproc.model.TaskMessage;
import com.sailfish.taskproc.model.WorkerHeartbeat;

import java.time.Instant;
import java.util.List;

/**
 * Broker access: task deliveries, control commands and worker heartbeats.
 * Deliveries are claimed by a worker identity and removed only when acknowledged.
 */
public interface BrokerRepository {

    /**
     * Publishes a new delivery.
     */
    TaskMessage publish(TaskMessage message);

    /**
     * Finds unclaimed deliveries of a queue that are due, oldest first.
     *
     * @param queueName The queue to read.
     * @param now       Deliveries with a later visibleAt are skipped.
     * @param limit     The maximum number of messages to fetch in one go.
     */
    List<TaskMessage> findReady(String queueName, Instant now, int limit);

    /**
     * Claims a delivery for a worker. At most one worker wins a given delivery.
     *
     * @return true if this worker now owns the delivery.
     */
    boolean claim(Long messageId, String workerIdentity, Instant now);

    /**
     * Acknowledges (removes) a delivery still owned by the worker.
     */
    boolean ack(Long messageId, String workerIdentity);

    /**
     * Returns an owned delivery to the queue for another attempt.
     *
     * @param retries   The retry count carried by the delivery from now on.
     * @param visibleAt When the delivery becomes due again.
     */
    boolean reschedule(Long messageId, String workerIdentity, int retries, Instant visibleAt);

    /**
     * Removes the deliveries of a task that no worker has claimed yet.
     *
     * @return the number of deliveries removed.
     */
    int deleteUnclaimed(String taskId);

    /**
     * Returns every delivery claimed by the worker to the queue.
     *
     * @return the number of deliveries released.
     */
    int releaseClaims(String workerIdentity);

    /**
     * Returns to the queue the deliveries held by workers whose heartbeat is older than the cutoff.
     *
     * @return the number of deliveries released.
     */
    int requeueOrphaned(Instant heartbeatCutoff);

    /**
     * Publishes a control command; a null destination broadcasts it.
     */
    ControlMessage publishControl(ControlMessage message);

    /**
     * @return the id of the newest control message, 0 if there is none.
     */
    long latestControlId();

    /**
     * Finds control messages newer than {@code afterId} addressed to the worker or broadcast.
     */
    List<ControlMessage> findControlMessages(long afterId, String workerIdentity);

    /**
     * Inserts or refreshes a worker heartbeat.
     */
    void saveHeartbeat(WorkerHeartbeat heartbeat);

    void removeHeartbeat(String workerIdentity);

    /**
     * @return heartbeats seen at or after the cutoff.
     */
    List<WorkerHeartbeat> findHeartbeats(Instant cutoff);
}
