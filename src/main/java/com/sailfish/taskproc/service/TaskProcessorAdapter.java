package com.sailfish.taskproc.service;

import com.sailfish.taskproc.TaskHandler;
import com.sailfish.taskproc.config.TaskProcessorConfig;
import com.sailfish.taskproc.model.ConsumerState;
import com.sailfish.taskproc.model.TaskResult;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Operations every task processing backend provides: handler registration, submission,
 * status queries, cancellation, consumer lifecycle and health.
 *
 * <p>Delivery is at-least-once. The consumer handle is the only mutable state an adapter owns;
 * callers must not invoke {@link #startConsumer(Map)} and {@link #stopConsumer(Duration)}
 * concurrently on the same instance without their own synchronization.
 */
public interface TaskProcessorAdapter {

    Duration DEFAULT_STOP_TIMEOUT = Duration.ofSeconds(10);

    /**
     * Binds the adapter to its broker and result store. Called once per instance;
     * connection failures are raised here, not deferred to the first use.
     *
     * @throws IllegalStateException if the adapter is already initialized.
     * @throws com.sailfish.taskproc.exception.TaskProcessorException if the backend is unreachable.
     */
    void initialize(TaskProcessorConfig config);

    /**
     * Registers a handler under its own {@link TaskHandler#name()}.
     *
     * @return the task name used for the registration.
     */
    String registerTaskHandle(TaskHandler handler);

    /**
     * Registers a handler under an explicit task name, with the adapter's retry policy.
     * Must happen before {@link #startConsumer(Map)}.
     *
     * @return the task name used for the registration.
     * @throws IllegalStateException if the consumer is running.
     */
    String registerTaskHandle(TaskHandler handler, String name);

    /**
     * Submits a task without waiting for it to run.
     *
     * @param taskName The registered task name.
     * @param args     Positional arguments, each Serializable. May be null.
     * @param kwargs   Keyword arguments, each value Serializable. May be null.
     * @param options  Per-call options passed to the backend, e.g. {@code countdown}. May be null.
     * @return the submitted task with id, status and createdAt populated.
     */
    TaskResult enqueueTaskSync(String taskName, List<?> args, Map<String, ?> kwargs, Map<String, ?> options);

    default TaskResult enqueueTaskSync(String taskName, List<?> args) {
        return enqueueTaskSync(taskName, args, Collections.emptyMap(), Collections.emptyMap());
    }

    /**
     * Non-blocking form of {@link #enqueueTaskSync}. A backend without non-blocking I/O
     * returns a future failed with {@link com.sailfish.taskproc.exception.UnsupportedTaskOperationException}.
     */
    CompletableFuture<TaskResult> enqueueTaskAsync(String taskName, List<?> args, Map<String, ?> kwargs, Map<String, ?> options);

    /**
     * Reads the current state of a task from the result store.
     */
    TaskResult getTaskStatusSync(String taskId);

    /**
     * Non-blocking form of {@link #getTaskStatusSync}; unsupported backends fail the same way
     * as {@link #enqueueTaskAsync}.
     */
    CompletableFuture<TaskResult> getTaskStatusAsync(String taskId);

    /**
     * Requests revocation of a task. Advisory: a task that a consumer already picked up keeps
     * running, so a true return value does not mean the handler did not execute.
     *
     * @return whether the backend accepted the request.
     */
    boolean cancelTask(String taskId);

    /**
     * @return backend-defined operational counters, keyed by worker identity.
     */
    Map<String, Object> getMetrics();

    /**
     * Starts the background consumer. No-op while a consumer is already running.
     *
     * @param options backend-specific consumer options, may be empty.
     */
    void startConsumer(Map<String, ?> options);

    default void startConsumer() {
        startConsumer(Collections.emptyMap());
    }

    /**
     * Sends a stop signal addressed to this adapter's consumer only and waits at most
     * {@code timeout} for it to exit. The handle is released even when the wait times out;
     * that case is logged, never thrown.
     */
    void stopConsumer(Duration timeout);

    default void stopConsumer() {
        stopConsumer(DEFAULT_STOP_TIMEOUT);
    }

    /**
     * Broadcasts a shutdown to every consumer of the broker and tears the adapter down.
     * Local tasks already running get the backend's drain time to store their outcome first.
     */
    void shutdown();

    /**
     * @return one {@code {workerIdentity: status}} entry per reachable worker; empty if none.
     */
    List<Map<String, Map<String, String>>> healthCheck();

    ConsumerState getConsumerState();

    /**
     * @return the identity of the running consumer, empty when stopped.
     */
    Optional<String> getWorkerIdentity();

    String getBackendType();
}
