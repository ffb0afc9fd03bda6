package com.sailfish.taskproc.config;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Backend variant where both the broker and the result store are relational databases
 * reached through Jakarta Persistence.
 *
 * <p>{@code brokerUrl} and {@code backendUrl} are JDBC URLs; they may point at the same database.
 * {@code transportOptions} are handed verbatim to the persistence provider of the broker
 * connection (e.g. {@code hibernate.connection.pool_size}).
 */
public final class JpaBackendConfig implements BackendConfig {

    public static final String BACKEND_TYPE = "jpa";

    public static final int DEFAULT_WORKER_CONCURRENCY = 10;
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(100);
    public static final Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofSeconds(1);
    public static final Duration DEFAULT_WORKER_LOST_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_RETRY_BACKOFF_UNIT = Duration.ofSeconds(1);
    public static final Duration DEFAULT_DRAIN_TIMEOUT = Duration.ofSeconds(5);

    private final String brokerUrl;
    private final String backendUrl;
    private final int workerConcurrency;
    private final Map<String, Object> transportOptions;
    private final Duration pollInterval;
    private final Duration heartbeatInterval;
    private final Duration workerLostTimeout;
    private final Duration retryBackoffUnit;
    private final Duration drainTimeout;

    private JpaBackendConfig(Builder builder) {
        if (builder.brokerUrl == null || builder.brokerUrl.trim().isEmpty()) {
            throw new IllegalArgumentException("brokerUrl cannot be blank");
        }
        if (builder.backendUrl == null || builder.backendUrl.trim().isEmpty()) {
            throw new IllegalArgumentException("backendUrl cannot be blank");
        }
        if (builder.workerConcurrency <= 0) {
            throw new IllegalArgumentException("workerConcurrency must be positive");
        }
        this.brokerUrl = builder.brokerUrl;
        this.backendUrl = builder.backendUrl;
        this.workerConcurrency = builder.workerConcurrency;
        this.transportOptions = builder.transportOptions == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.transportOptions));
        this.pollInterval = requirePositive(builder.pollInterval, "pollInterval");
        this.heartbeatInterval = requirePositive(builder.heartbeatInterval, "heartbeatInterval");
        this.workerLostTimeout = requirePositive(builder.workerLostTimeout, "workerLostTimeout");
        this.retryBackoffUnit = requirePositive(builder.retryBackoffUnit, "retryBackoffUnit");
        this.drainTimeout = Objects.requireNonNull(builder.drainTimeout, "drainTimeout cannot be null");
        if (workerLostTimeout.compareTo(heartbeatInterval) <= 0) {
            throw new IllegalArgumentException("workerLostTimeout must be longer than heartbeatInterval");
        }
    }

    private static Duration requirePositive(Duration value, String name) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String getBackendType() {
        return BACKEND_TYPE;
    }

    public String getBrokerUrl() {
        return brokerUrl;
    }

    public String getBackendUrl() {
        return backendUrl;
    }

    public int getWorkerConcurrency() {
        return workerConcurrency;
    }

    public Map<String, Object> getTransportOptions() {
        return transportOptions;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public Duration getHeartbeatInterval() {
        return heartbeatInterval;
    }

    public Duration getWorkerLostTimeout() {
        return workerLostTimeout;
    }

    public Duration getRetryBackoffUnit() {
        return retryBackoffUnit;
    }

    public Duration getDrainTimeout() {
        return drainTimeout;
    }

    @Override
    public String toString() {
        // URLs may embed credentials
        return "JpaBackendConfig{" +
               "workerConcurrency=" + workerConcurrency +
               ", transportOptions=" + transportOptions.keySet() +
               ", pollInterval=" + pollInterval +
               ", heartbeatInterval=" + heartbeatInterval +
               ", workerLostTimeout=" + workerLostTimeout +
               ", retryBackoffUnit=" + retryBackoffUnit +
               '}';
    }

    public static final class Builder {
        private String brokerUrl;
        private String backendUrl;
        private int workerConcurrency = DEFAULT_WORKER_CONCURRENCY;
        private Map<String, ?> transportOptions;
        private Duration pollInterval = DEFAULT_POLL_INTERVAL;
        private Duration heartbeatInterval = DEFAULT_HEARTBEAT_INTERVAL;
        private Duration workerLostTimeout = DEFAULT_WORKER_LOST_TIMEOUT;
        private Duration retryBackoffUnit = DEFAULT_RETRY_BACKOFF_UNIT;
        private Duration drainTimeout = DEFAULT_DRAIN_TIMEOUT;

        private Builder() {
        }

        public Builder brokerUrl(String brokerUrl) {
            this.brokerUrl = brokerUrl;
            return this;
        }

        public Builder backendUrl(String backendUrl) {
            this.backendUrl = backendUrl;
            return this;
        }

        public Builder workerConcurrency(int workerConcurrency) {
            this.workerConcurrency = workerConcurrency;
            return this;
        }

        public Builder transportOptions(Map<String, ?> transportOptions) {
            this.transportOptions = transportOptions;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder heartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
            return this;
        }

        public Builder workerLostTimeout(Duration workerLostTimeout) {
            this.workerLostTimeout = workerLostTimeout;
            return this;
        }

        public Builder retryBackoffUnit(Duration retryBackoffUnit) {
            this.retryBackoffUnit = retryBackoffUnit;
            return this;
        }

        public Builder drainTimeout(Duration drainTimeout) {
            this.drainTimeout = drainTimeout;
            return this;
        }

        public JpaBackendConfig build() {
            return new JpaBackendConfig(this);
        }
    }
}
