package com.sailfish.taskproc.config;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable description of where tasks are routed and how failures are retried.
 * Created once and kept for the lifetime of the adapter built from it.
 */
public final class TaskProcessorConfig {

    public static final int DEFAULT_MAX_RETRIES = 3;

    private final String queueName;
    private final int maxRetries;
    private final BackendConfig backendConfig;
    private final String failedTaskQueueName;
    private final String unprocessableTaskQueueName;

    public TaskProcessorConfig(String queueName, BackendConfig backendConfig) {
        this(queueName, DEFAULT_MAX_RETRIES, backendConfig);
    }

    public TaskProcessorConfig(String queueName, int maxRetries, BackendConfig backendConfig) {
        this(queueName, maxRetries, backendConfig, null, null);
    }

    /**
     * @param queueName                  default routing queue, non-blank.
     * @param maxRetries                 retries after a handler failure before the task is FAILURE.
     * @param backendConfig              the populated backend variant.
     * @param failedTaskQueueName        optional queue receiving tasks that exhausted their retries.
     * @param unprocessableTaskQueueName optional queue receiving tasks no handler is registered for.
     */
    public TaskProcessorConfig(String queueName,
                               int maxRetries,
                               BackendConfig backendConfig,
                               String failedTaskQueueName,
                               String unprocessableTaskQueueName) {
        if (queueName == null || queueName.trim().isEmpty()) {
            throw new IllegalArgumentException("queueName cannot be blank");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be non-negative");
        }
        this.queueName = queueName;
        this.maxRetries = maxRetries;
        this.backendConfig = Objects.requireNonNull(backendConfig, "backendConfig cannot be null");
        this.failedTaskQueueName = blankToNull(failedTaskQueueName);
        this.unprocessableTaskQueueName = blankToNull(unprocessableTaskQueueName);
    }

    private static String blankToNull(String value) {
        return value == null || value.trim().isEmpty() ? null : value;
    }

    public String getQueueName() {
        return queueName;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public BackendConfig getBackendConfig() {
        return backendConfig;
    }

    public Optional<String> getFailedTaskQueueName() {
        return Optional.ofNullable(failedTaskQueueName);
    }

    public Optional<String> getUnprocessableTaskQueueName() {
        return Optional.ofNullable(unprocessableTaskQueueName);
    }

    @Override
    public String toString() {
        return "TaskProcessorConfig{" +
               "queueName='" + queueName + '\'' +
               ", maxRetries=" + maxRetries +
               ", backendType=" + backendConfig.getBackendType() +
               ", failedTaskQueueName=" + failedTaskQueueName +
               ", unprocessableTaskQueueName=" + unprocessableTaskQueueName +
               '}';
    }
}
