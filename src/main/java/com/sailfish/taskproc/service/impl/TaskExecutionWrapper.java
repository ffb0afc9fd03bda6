package com.sailfish.taskproc.service.impl;

import com.sailfish.taskproc.TaskHandler;
import com.sailfish.taskproc.factory.TaskHandlerRegistry;
import com.sailfish.taskproc.model.TaskArguments;
import com.sailfish.taskproc.model.TaskMessage;
import com.sailfish.taskproc.model.TaskStatus;
import com.sailfish.taskproc.repository.BrokerRepository;
import com.sailfish.taskproc.repository.TaskResultRepository;
import com.sailfish.taskproc.retry.RetryStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Executes one claimed delivery on a consumer pool thread and records its outcome.
 *
 * <p>The delivery is acknowledged only after the outcome is stored, so a worker dying mid-task
 * leaves the message claimed and it is redelivered once the worker is considered lost.
 */
public class TaskExecutionWrapper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(TaskExecutionWrapper.class);

    private static final int MAX_ERROR_LENGTH = 2000;

    private final TaskMessage message;
    private final String workerIdentity;
    private final BrokerRepository broker;
    private final TaskResultRepository results;
    private final TaskHandlerRegistry handlers;
    private final RetryStrategy retryStrategy;
    private final PayloadSerializer serializer;
    private final DeadLetterRouter deadLetters;
    private final ConsumerStats stats;

    TaskExecutionWrapper(TaskMessage message,
                         String workerIdentity,
                         BrokerRepository broker,
                         TaskResultRepository results,
                         TaskHandlerRegistry handlers,
                         RetryStrategy retryStrategy,
                         PayloadSerializer serializer,
                         DeadLetterRouter deadLetters,
                         ConsumerStats stats) {
        this.message = Objects.requireNonNull(message, "message cannot be null");
        this.workerIdentity = Objects.requireNonNull(workerIdentity, "workerIdentity cannot be null");
        this.broker = Objects.requireNonNull(broker, "broker cannot be null");
        this.results = Objects.requireNonNull(results, "results cannot be null");
        this.handlers = Objects.requireNonNull(handlers, "handlers cannot be null");
        this.retryStrategy = Objects.requireNonNull(retryStrategy, "retryStrategy cannot be null");
        this.serializer = Objects.requireNonNull(serializer, "serializer cannot be null");
        this.deadLetters = Objects.requireNonNull(deadLetters, "deadLetters cannot be null");
        this.stats = Objects.requireNonNull(stats, "stats cannot be null");
    }

    @Override
    public void run() {
        String taskId = message.getTaskId();
        log.debug("Starting execution for task ID {} (message {}, retries {})", taskId, message.getId(), message.getRetries());
        try {
            execute(taskId);
        } catch (RuntimeException e) {
            // The outcome could not be stored or acknowledged; the claim stays and the message is redelivered
            log.error("Could not record outcome of task ID {}: {}", taskId, e.getMessage(), e);
        } finally {
            stats.active.decrementAndGet();
        }
    }

    private void execute(String taskId) {
        // 1. Move to STARTED; revoked or already completed tasks are acknowledged without running
        if (!results.markStarted(taskId, workerIdentity)) {
            log.info("Task ID {} is revoked, unknown or already completed. Acknowledging without execution.", taskId);
            broker.ack(message.getId(), workerIdentity);
            return;
        }

        // 2. Resolve the handler; an unregistered name is not retried
        Optional<TaskHandler> handler = handlers.getHandler(message.getTaskName());
        if (!handler.isPresent()) {
            String failure = "NotRegistered: " + message.getTaskName();
            log.error("Task ID {} names no registered handler '{}'. Marking as FAILURE.", taskId, message.getTaskName());
            if (results.complete(taskId, TaskStatus.FAILURE, serializer.serialize(failure), failure)) {
                deadLetters.routeUnprocessable(message, failure);
                stats.failed.incrementAndGet();
            } else {
                log.info("Task ID {} was revoked; not routing it as unprocessable.", taskId);
            }
            broker.ack(message.getId(), workerIdentity);
            stats.processed.incrementAndGet();
            return;
        }

        // 3. Run the handler
        Object value;
        try {
            TaskArguments arguments = (TaskArguments) serializer.deserialize(message.getPayload());
            value = handler.get().execute(arguments.getArgs(), arguments.getKwargs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Task ID {} interrupted; returning it to the queue.", taskId);
            broker.reschedule(message.getId(), workerIdentity, message.getRetries(), Instant.now());
            return;
        } catch (Exception e) {
            handleFailure(taskId, e);
            return;
        }

        // 4. Store the result, then acknowledge
        byte[] result;
        try {
            result = serializer.serialize(value);
        } catch (IllegalArgumentException e) {
            handleFailure(taskId, e);
            return;
        }
        if (results.complete(taskId, TaskStatus.SUCCESS, result, null)) {
            log.info("Task ID {} executed successfully.", taskId);
            stats.succeeded.incrementAndGet();
        } else {
            log.info("Task ID {} finished but was revoked while running; keeping REVOKED.", taskId);
        }
        broker.ack(message.getId(), workerIdentity);
        stats.processed.incrementAndGet();
    }

    private void handleFailure(String taskId, Exception e) {
        String errorDetails = getStackTraceAsString(e);
        Optional<Duration> nextDelay = retryStrategy.calculateNextRetryDelay(message.getRetries());

        if (nextDelay.isPresent()) {
            int nextRetryCount = message.getRetries() + 1;
            if (!results.markRetry(taskId, nextRetryCount, errorDetails)) {
                log.info("Task ID {} failed after being revoked; not retrying.", taskId);
                broker.ack(message.getId(), workerIdentity);
                stats.processed.incrementAndGet();
                return;
            }
            log.warn("Task ID {} failed: {}. Scheduling retry {} in {}.", taskId, e.toString(), nextRetryCount, nextDelay.get());
            broker.reschedule(message.getId(), workerIdentity, nextRetryCount, Instant.now().plus(nextDelay.get()));
            stats.retried.incrementAndGet();
            return;
        }

        log.error("Task ID {} failed and retry limit reached. Marking as FAILURE.", taskId, e);
        String failure = e.getClass().getName() + ": " + e.getMessage();
        if (results.complete(taskId, TaskStatus.FAILURE, serializer.serialize(failure), errorDetails)) {
            deadLetters.routeFailed(message, failure);
            stats.failed.incrementAndGet();
        }
        broker.ack(message.getId(), workerIdentity);
        stats.processed.incrementAndGet();
    }

    private String getStackTraceAsString(Throwable throwable) {
        StringWriter sw = new StringWriter();
        throwable.printStackTrace(new PrintWriter(sw));
        String stackTrace = sw.toString();
        if (stackTrace.length() > MAX_ERROR_LENGTH) {
            return stackTrace.substring(0, MAX_ERROR_LENGTH - 3) + "...";
        }
        return stackTrace;
    }
}
