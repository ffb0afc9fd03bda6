package com.sailfish.taskproc.service.impl;

import com.sailfish.taskproc.TaskHandler;
import com.sailfish.taskproc.config.JpaBackendConfig;
import com.sailfish.taskproc.config.TaskProcessorConfig;
import com.sailfish.taskproc.exception.ConfigMismatchException;
import com.sailfish.taskproc.exception.TaskProcessorException;
import com.sailfish.taskproc.exception.UnsupportedTaskOperationException;
import com.sailfish.taskproc.factory.MapTaskHandlerRegistry;
import com.sailfish.taskproc.model.ConsumerState;
import com.sailfish.taskproc.model.TaskArguments;
import com.sailfish.taskproc.model.TaskResult;
import com.sailfish.taskproc.model.TaskResultRecord;
import com.sailfish.taskproc.model.TaskStatus;
import com.sailfish.taskproc.model.WorkerHeartbeat;
import com.sailfish.taskproc.repository.BrokerRepository;
import com.sailfish.taskproc.repository.JpaBrokerRepository;
import com.sailfish.taskproc.repository.JpaTaskResultRepository;
import com.sailfish.taskproc.repository.TaskResultRepository;
import com.sailfish.taskproc.retry.ExponentialBackoffRetryStrategy;
import com.sailfish.taskproc.retry.RetryStrategy;
import com.sailfish.taskproc.service.TaskProcessorAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jakarta.annotation.PreDestroy;
import jakarta.persistence.EntityManagerFactory;
import jakarta.persistence.Persistence;
import jakarta.persistence.PersistenceException;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Task processor backed by relational databases through Jakarta Persistence: one database acts as
 * the broker (deliveries, control messages, heartbeats), another (possibly the same) as the result store.
 *
 * <p>Policies: deliveries are acknowledged after the outcome is stored; deliveries of lost workers are
 * requeued; handler failures are retried with deterministic exponential backoff capped at 60 units;
 * results are always persisted. Submission and status queries block on JDBC, so the asynchronous
 * variants are unsupported.
 */
public class JpaTaskProcessorAdapter implements TaskProcessorAdapter {

    private static final Logger log = LoggerFactory.getLogger(JpaTaskProcessorAdapter.class);

    public static final String BROKER_PERSISTENCE_UNIT = "taskproc-broker";
    public static final String BACKEND_PERSISTENCE_UNIT = "taskproc-backend";
    static final String JDBC_URL = "jakarta.persistence.jdbc.url";

    public static final String OPTION_COUNTDOWN = "countdown";
    public static final String OPTION_ETA = "eta";
    public static final String OPTION_TASK_ID = "task_id";
    public static final String OPTION_QUEUE = "queue";
    public static final String CONSUMER_OPTION_CONCURRENCY = "concurrency";

    private static final String CONNECTION_CHECK_ID = "__taskproc_connection_check__";

    private final MapTaskHandlerRegistry handlerRegistry = new MapTaskHandlerRegistry();
    private final PayloadSerializer serializer = new PayloadSerializer();

    private TaskProcessorConfig config;
    private JpaBackendConfig backendConfig;
    private RetryStrategy retryStrategy;
    private EntityManagerFactory brokerEntityManagerFactory;
    private EntityManagerFactory backendEntityManagerFactory;
    private BrokerRepository broker;
    private TaskResultRepository results;
    private TaskPublisher publisher;
    private ConsumerSupervisor supervisor;
    private volatile boolean initialized;
    private volatile boolean shutDown;

    /**
     * @throws ConfigMismatchException if the configuration does not carry a {@link JpaBackendConfig}.
     */
    public JpaTaskProcessorAdapter(TaskProcessorConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        this.backendConfig = requireJpaBackend(config);
        this.config = config;
    }

    private static JpaBackendConfig requireJpaBackend(TaskProcessorConfig config) {
        if (!(config.getBackendConfig() instanceof JpaBackendConfig)) {
            throw new ConfigMismatchException(JpaBackendConfig.class, config.getBackendConfig().getClass());
        }
        return (JpaBackendConfig) config.getBackendConfig();
    }

    @Override
    public void initialize(TaskProcessorConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        if (initialized || shutDown) {
            throw new IllegalStateException("Adapter is already initialized");
        }
        JpaBackendConfig jpaConfig = requireJpaBackend(config);

        Map<String, Object> brokerProperties = new HashMap<>(jpaConfig.getTransportOptions());
        brokerProperties.put(JDBC_URL, jpaConfig.getBrokerUrl());
        Map<String, Object> backendProperties = new HashMap<>();
        backendProperties.put(JDBC_URL, jpaConfig.getBackendUrl());

        EntityManagerFactory brokerFactory = null;
        EntityManagerFactory backendFactory = null;
        try {
            brokerFactory = Persistence.createEntityManagerFactory(BROKER_PERSISTENCE_UNIT, brokerProperties);
            backendFactory = Persistence.createEntityManagerFactory(BACKEND_PERSISTENCE_UNIT, backendProperties);
            JpaBrokerRepository brokerRepository = new JpaBrokerRepository(brokerFactory);
            JpaTaskResultRepository resultRepository = new JpaTaskResultRepository(backendFactory);
            // Fail now rather than on first use
            brokerRepository.latestControlId();
            resultRepository.findById(CONNECTION_CHECK_ID);

            this.config = config;
            this.backendConfig = jpaConfig;
            this.brokerEntityManagerFactory = brokerFactory;
            this.backendEntityManagerFactory = backendFactory;
            this.broker = brokerRepository;
            this.results = resultRepository;
        } catch (PersistenceException | IllegalStateException e) {
            closeQuietly(brokerFactory);
            closeQuietly(backendFactory);
            log.error("Failed to connect task processor for queue '{}': {}", config.getQueueName(), e.getMessage(), e);
            throw new TaskProcessorException("Failed to connect to broker or result store: " + e.getMessage(), e);
        }

        this.retryStrategy = ExponentialBackoffRetryStrategy.deterministic(config.getMaxRetries(), jpaConfig.getRetryBackoffUnit());
        this.publisher = new TaskPublisher(broker, results, serializer);
        this.supervisor = new ConsumerSupervisor(config.getQueueName(), broker, this::createConsumer);
        this.initialized = true;
        log.info("Task processor initialized for queue '{}' (max retries {}, worker concurrency {}).",
                config.getQueueName(), config.getMaxRetries(), jpaConfig.getWorkerConcurrency());
    }

    @Override
    public String registerTaskHandle(TaskHandler handler) {
        checkNotConsuming();
        return handlerRegistry.register(handler);
    }

    @Override
    public String registerTaskHandle(TaskHandler handler, String name) {
        checkNotConsuming();
        if (name == null) {
            return handlerRegistry.register(handler);
        }
        return handlerRegistry.register(name, handler);
    }

    @Override
    public TaskResult enqueueTaskSync(String taskName, List<?> args, Map<String, ?> kwargs, Map<String, ?> options) {
        checkOperational();
        if (taskName == null || taskName.trim().isEmpty()) {
            throw new IllegalArgumentException("taskName cannot be blank");
        }
        Map<String, Object> callOptions = options == null ? new LinkedHashMap<>() : new LinkedHashMap<>(options);
        String taskId = callOptions.containsKey(OPTION_TASK_ID)
                ? String.valueOf(callOptions.get(OPTION_TASK_ID))
                : UUID.randomUUID().toString();
        String queueName = callOptions.containsKey(OPTION_QUEUE)
                ? String.valueOf(callOptions.get(OPTION_QUEUE))
                : config.getQueueName();
        Instant createdAt = Instant.now();
        Instant visibleAt = resolveVisibleAt(callOptions, createdAt);

        log.debug("Submitting task '{}' to queue '{}'", taskName, queueName);
        try {
            publisher.publish(taskId, taskName, queueName, new TaskArguments(args, kwargs), callOptions, createdAt, visibleAt);
        } catch (PersistenceException e) {
            log.error("Failed to submit task '{}': {}", taskName, e.getMessage(), e);
            throw new TaskProcessorException("Failed to submit task '" + taskName + "': " + e.getMessage(), e);
        }
        return new TaskResult(taskId, TaskStatus.PENDING, createdAt, null);
    }

    private static Instant resolveVisibleAt(Map<String, Object> options, Instant now) {
        Object eta = options.get(OPTION_ETA);
        if (eta instanceof Instant) {
            return (Instant) eta;
        }
        if (eta instanceof String) {
            try {
                return Instant.parse((String) eta);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("eta must be an ISO-8601 instant but was '" + eta + "'", e);
            }
        }
        if (eta != null) {
            throw new IllegalArgumentException("eta must be an Instant or ISO-8601 string but was " + eta.getClass().getName());
        }

        Object countdown = options.get(OPTION_COUNTDOWN);
        if (countdown instanceof Number) {
            long millis = Math.round(((Number) countdown).doubleValue() * 1000);
            return now.plusMillis(Math.max(0, millis));
        }
        if (countdown != null) {
            throw new IllegalArgumentException("countdown must be a number of seconds but was " + countdown.getClass().getName());
        }
        return now;
    }

    @Override
    public CompletableFuture<TaskResult> enqueueTaskAsync(String taskName, List<?> args, Map<String, ?> kwargs, Map<String, ?> options) {
        return CompletableFuture.failedFuture(new UnsupportedTaskOperationException(getBackendType(), "asynchronous task submission"));
    }

    @Override
    public TaskResult getTaskStatusSync(String taskId) {
        checkOperational();
        Objects.requireNonNull(taskId, "taskId cannot be null");
        Optional<TaskResultRecord> record = results.findById(taskId);
        if (!record.isPresent()) {
            // Unknown to the result store: not yet recorded or never submitted
            return new TaskResult(taskId, TaskStatus.PENDING, null, null);
        }
        TaskResultRecord found = record.get();
        Object result = found.getStatus() == TaskStatus.SUCCESS || found.getStatus() == TaskStatus.FAILURE
                ? serializer.deserialize(found.getResult())
                : null;
        return new TaskResult(found.getTaskId(), found.getStatus(), found.getCreatedAt(), result);
    }

    @Override
    public CompletableFuture<TaskResult> getTaskStatusAsync(String taskId) {
        return CompletableFuture.failedFuture(new UnsupportedTaskOperationException(getBackendType(), "asynchronous task status retrieval"));
    }

    @Override
    public boolean cancelTask(String taskId) {
        checkOperational();
        Objects.requireNonNull(taskId, "taskId cannot be null");
        if (!results.revoke(taskId)) {
            log.info("Cancel request for task ID {} not accepted (unknown or already finished).", taskId);
            return false;
        }
        int removed = broker.deleteUnclaimed(taskId);
        if (removed > 0) {
            log.info("Task ID {} revoked before delivery.", taskId);
        } else {
            log.info("Task ID {} revoked; a consumer may already be running it.", taskId);
        }
        return true;
    }

    @Override
    public Map<String, Object> getMetrics() {
        checkOperational();
        Map<String, Object> metrics = new LinkedHashMap<>();
        for (WorkerHeartbeat heartbeat : liveWorkers()) {
            Map<String, Object> stats = new LinkedHashMap<>();
            stats.put("queue", heartbeat.getQueueName());
            stats.put("concurrency", heartbeat.getConcurrency());
            stats.put("active", heartbeat.getActive());
            stats.put("processed", heartbeat.getProcessed());
            stats.put("succeeded", heartbeat.getSucceeded());
            stats.put("failed", heartbeat.getFailed());
            stats.put("retried", heartbeat.getRetried());
            stats.put("started_at", heartbeat.getStartedAt());
            stats.put("last_heartbeat", heartbeat.getLastSeen());
            metrics.put(heartbeat.getWorkerIdentity(), Collections.unmodifiableMap(stats));
        }
        return metrics;
    }

    @Override
    public void startConsumer(Map<String, ?> options) {
        checkOperational();
        supervisor.start(options == null ? Collections.emptyMap() : options);
    }

    private ConsumerLoop createConsumer(String workerIdentity, long lastControlId, Map<String, ?> options) {
        int concurrency = backendConfig.getWorkerConcurrency();
        for (Map.Entry<String, ?> option : options.entrySet()) {
            if (CONSUMER_OPTION_CONCURRENCY.equals(option.getKey()) && option.getValue() instanceof Number) {
                concurrency = ((Number) option.getValue()).intValue();
            } else {
                log.warn("Ignoring unsupported consumer option '{}'", option.getKey());
            }
        }
        DeadLetterRouter deadLetters = new DeadLetterRouter(publisher, serializer,
                config.getFailedTaskQueueName().orElse(null),
                config.getUnprocessableTaskQueueName().orElse(null));
        TaskConsumer.Settings settings = new TaskConsumer.Settings(backendConfig.getPollInterval(),
                backendConfig.getHeartbeatInterval(), backendConfig.getWorkerLostTimeout(), backendConfig.getDrainTimeout());
        return new TaskConsumer(workerIdentity, config.getQueueName(), concurrency, lastControlId,
                broker, results, handlerRegistry, retryStrategy, serializer, deadLetters, settings);
    }

    @Override
    public void stopConsumer(Duration timeout) {
        checkOperational();
        supervisor.stop(timeout);
    }

    @Override
    @PreDestroy
    public void shutdown() {
        if (shutDown) {
            return;
        }
        shutDown = true;
        if (!initialized) {
            return;
        }
        log.info("Shutting down task processor for queue '{}'...", config.getQueueName());
        awaitConsumerExit(supervisor.shutdown());
        closeQuietly(brokerEntityManagerFactory);
        closeQuietly(backendEntityManagerFactory);
        log.info("Task processor for queue '{}' shut down.", config.getQueueName());
    }

    /**
     * Keeps the persistence units open until draining consumers have stored their outcomes.
     */
    private void awaitConsumerExit(List<Thread> threads) {
        long deadline = System.nanoTime()
                + backendConfig.getDrainTimeout().plus(backendConfig.getHeartbeatInterval()).toNanos();
        for (Thread thread : threads) {
            long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMillis > 0) {
                try {
                    thread.join(remainingMillis);
                } catch (InterruptedException e) {
                    log.warn("Interrupted while waiting for consumer thread {} to exit.", thread.getName());
                    Thread.currentThread().interrupt();
                    return;
                }
            }
            if (thread.isAlive()) {
                log.warn("Consumer thread {} still running at shutdown; its in-flight outcomes may be lost.", thread.getName());
            }
        }
    }

    @Override
    public List<Map<String, Map<String, String>>> healthCheck() {
        checkOperational();
        List<Map<String, Map<String, String>>> replies = new ArrayList<>();
        for (WorkerHeartbeat heartbeat : liveWorkers()) {
            replies.add(Collections.singletonMap(heartbeat.getWorkerIdentity(), Collections.singletonMap("ok", "pong")));
        }
        return replies;
    }

    private List<WorkerHeartbeat> liveWorkers() {
        return broker.findHeartbeats(Instant.now().minus(backendConfig.getWorkerLostTimeout()));
    }

    @Override
    public ConsumerState getConsumerState() {
        return supervisor == null ? ConsumerState.STOPPED : supervisor.getState();
    }

    @Override
    public Optional<String> getWorkerIdentity() {
        return supervisor == null ? Optional.empty() : supervisor.getWorkerIdentity();
    }

    @Override
    public String getBackendType() {
        return JpaBackendConfig.BACKEND_TYPE;
    }

    private void checkOperational() {
        if (shutDown) {
            throw new IllegalStateException("Task processor has been shut down");
        }
        if (!initialized) {
            throw new IllegalStateException("Task processor is not initialized");
        }
    }

    private void checkNotConsuming() {
        if (getConsumerState() != ConsumerState.STOPPED) {
            throw new IllegalStateException("Task handlers must be registered before the consumer starts");
        }
    }

    private static void closeQuietly(EntityManagerFactory factory) {
        if (factory == null || !factory.isOpen()) {
            return;
        }
        try {
            factory.close();
        } catch (RuntimeException e) {
            log.warn("Error closing persistence unit: {}", e.getMessage(), e);
        }
    }
}
