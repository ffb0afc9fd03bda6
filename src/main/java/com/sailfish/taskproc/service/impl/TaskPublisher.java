package com.sailfish.taskproc.service.impl;

import com.sailfish.taskproc.model.TaskArguments;
import com.sailfish.taskproc.model.TaskMessage;
import com.sailfish.taskproc.model.TaskResultRecord;
import com.sailfish.taskproc.model.TaskStatus;
import com.sailfish.taskproc.repository.BrokerRepository;
import com.sailfish.taskproc.repository.TaskResultRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Records a new task as PENDING in the result store, then publishes its delivery on the broker.
 */
public class TaskPublisher {

    private static final Logger log = LoggerFactory.getLogger(TaskPublisher.class);

    private final BrokerRepository broker;
    private final TaskResultRepository results;
    private final PayloadSerializer serializer;

    public TaskPublisher(BrokerRepository broker, TaskResultRepository results, PayloadSerializer serializer) {
        this.broker = Objects.requireNonNull(broker, "broker cannot be null");
        this.results = Objects.requireNonNull(results, "results cannot be null");
        this.serializer = Objects.requireNonNull(serializer, "serializer cannot be null");
    }

    /**
     * @param createdAt submission time, as seen by the submitter.
     * @param visibleAt earliest delivery time.
     * @throws IllegalArgumentException if arguments or options are not serializable.
     */
    public TaskMessage publish(String taskId,
                               String taskName,
                               String queueName,
                               TaskArguments arguments,
                               Map<String, ?> options,
                               Instant createdAt,
                               Instant visibleAt) {
        // Serialize first so that a bad payload leaves nothing behind
        byte[] payload = serializer.serialize(arguments);
        byte[] serializedOptions = options == null || options.isEmpty()
                ? null
                : serializer.serialize(new LinkedHashMap<>(options));

        TaskResultRecord record = new TaskResultRecord();
        record.setTaskId(taskId);
        record.setTaskName(taskName);
        record.setQueueName(queueName);
        record.setStatus(TaskStatus.PENDING);
        record.setCreatedAt(createdAt);
        results.save(record);

        TaskMessage message = new TaskMessage();
        message.setTaskId(taskId);
        message.setTaskName(taskName);
        message.setQueueName(queueName);
        message.setPayload(payload);
        message.setOptions(serializedOptions);
        message.setVisibleAt(visibleAt);
        TaskMessage published;
        try {
            published = broker.publish(message);
        } catch (RuntimeException e) {
            // No delivery exists, so nothing would ever move the record out of PENDING
            discardRecord(taskId, e);
            throw e;
        }
        log.info("Task '{}' submitted with ID {} on queue '{}'", taskName, taskId, queueName);
        return published;
    }

    private void discardRecord(String taskId, RuntimeException publishFailure) {
        try {
            results.delete(taskId);
        } catch (RuntimeException e) {
            publishFailure.addSuppressed(e);
            log.warn("Could not remove result record of unpublished task ID {}: {}", taskId, e.getMessage());
        }
    }
}
