package com.sailfish.taskproc.service.impl;

import com.sailfish.taskproc.model.TaskArguments;
import com.sailfish.taskproc.model.TaskMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Re-publishes tasks that cannot complete normally to their configured dead-letter queue.
 * The copy is a new task; {@code original_task_id} in its options links it to the failed one.
 */
public class DeadLetterRouter {

    private static final Logger log = LoggerFactory.getLogger(DeadLetterRouter.class);

    public static final String ORIGINAL_TASK_ID = "original_task_id";
    public static final String ORIGINAL_QUEUE = "original_queue";
    public static final String FAILURE = "failure";

    private final TaskPublisher publisher;
    private final PayloadSerializer serializer;
    private final String failedTaskQueueName;
    private final String unprocessableTaskQueueName;

    /**
     * @param failedTaskQueueName        queue for tasks that exhausted their retries, or null.
     * @param unprocessableTaskQueueName queue for tasks without a registered handler, or null.
     */
    public DeadLetterRouter(TaskPublisher publisher,
                            PayloadSerializer serializer,
                            String failedTaskQueueName,
                            String unprocessableTaskQueueName) {
        this.publisher = Objects.requireNonNull(publisher, "publisher cannot be null");
        this.serializer = Objects.requireNonNull(serializer, "serializer cannot be null");
        this.failedTaskQueueName = failedTaskQueueName;
        this.unprocessableTaskQueueName = unprocessableTaskQueueName;
    }

    /**
     * @return the id of the dead-letter copy, or null when no failed-task queue is configured.
     */
    public String routeFailed(TaskMessage message, String failure) {
        return route(failedTaskQueueName, message, failure);
    }

    /**
     * @return the id of the dead-letter copy, or null when no unprocessable-task queue is configured.
     */
    public String routeUnprocessable(TaskMessage message, String failure) {
        return route(unprocessableTaskQueueName, message, failure);
    }

    private String route(String queueName, TaskMessage message, String failure) {
        if (queueName == null) {
            return null;
        }
        Map<String, Object> options = new LinkedHashMap<>();
        options.put(ORIGINAL_TASK_ID, message.getTaskId());
        options.put(ORIGINAL_QUEUE, message.getQueueName());
        options.put(FAILURE, failure);

        String deadLetterId = UUID.randomUUID().toString();
        Instant now = Instant.now();
        publisher.publish(deadLetterId, message.getTaskName(), queueName,
                (TaskArguments) serializer.deserialize(message.getPayload()), options, now, now);
        log.warn("Task ID {} routed to dead-letter queue '{}' as task ID {}", message.getTaskId(), queueName, deadLetterId);
        return deadLetterId;
    }
}
