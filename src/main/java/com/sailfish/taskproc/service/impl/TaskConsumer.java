package com.sailfish.taskproc.service.impl;

import com.sailfish.taskproc.factory.TaskHandlerRegistry;
import com.sailfish.taskproc.model.ControlMessage;
import com.sailfish.taskproc.model.TaskMessage;
import com.sailfish.taskproc.model.WorkerHeartbeat;
import com.sailfish.taskproc.repository.BrokerRepository;
import com.sailfish.taskproc.repository.TaskResultRepository;
import com.sailfish.taskproc.retry.RetryStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The background execution loop of one worker identity.
 *
 * <p>Each cycle honours control messages addressed to this worker (or broadcast), publishes the
 * heartbeat, returns deliveries of lost workers to the queue, and claims as many due deliveries
 * as there are free execution slots. Claimed deliveries run on a fixed pool of
 * {@code concurrency} threads.
 */
public class TaskConsumer implements ConsumerLoop {

    private static final Logger log = LoggerFactory.getLogger(TaskConsumer.class);

    private final String workerIdentity;
    private final String queueName;
    private final int concurrency;
    private final BrokerRepository broker;
    private final TaskResultRepository results;
    private final TaskHandlerRegistry handlers;
    private final RetryStrategy retryStrategy;
    private final PayloadSerializer serializer;
    private final DeadLetterRouter deadLetters;
    private final Settings settings;

    private final ConsumerStats stats = new ConsumerStats();
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private volatile boolean stopRequested;
    private long lastControlId;
    private Instant startedAt;
    private Instant lastHeartbeat;

    /**
     * Timing of the loop.
     */
    public static final class Settings {
        final Duration pollInterval;
        final Duration heartbeatInterval;
        final Duration workerLostTimeout;
        final Duration drainTimeout;

        public Settings(Duration pollInterval, Duration heartbeatInterval, Duration workerLostTimeout, Duration drainTimeout) {
            this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval cannot be null");
            this.heartbeatInterval = Objects.requireNonNull(heartbeatInterval, "heartbeatInterval cannot be null");
            this.workerLostTimeout = Objects.requireNonNull(workerLostTimeout, "workerLostTimeout cannot be null");
            this.drainTimeout = Objects.requireNonNull(drainTimeout, "drainTimeout cannot be null");
        }
    }

    /**
     * @param lastControlId control messages up to this id predate the consumer and are ignored.
     */
    public TaskConsumer(String workerIdentity,
                        String queueName,
                        int concurrency,
                        long lastControlId,
                        BrokerRepository broker,
                        TaskResultRepository results,
                        TaskHandlerRegistry handlers,
                        RetryStrategy retryStrategy,
                        PayloadSerializer serializer,
                        DeadLetterRouter deadLetters,
                        Settings settings) {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be positive");
        }
        this.workerIdentity = Objects.requireNonNull(workerIdentity, "workerIdentity cannot be null");
        this.queueName = Objects.requireNonNull(queueName, "queueName cannot be null");
        this.concurrency = concurrency;
        this.lastControlId = lastControlId;
        this.broker = Objects.requireNonNull(broker, "broker cannot be null");
        this.results = Objects.requireNonNull(results, "results cannot be null");
        this.handlers = Objects.requireNonNull(handlers, "handlers cannot be null");
        this.retryStrategy = Objects.requireNonNull(retryStrategy, "retryStrategy cannot be null");
        this.serializer = Objects.requireNonNull(serializer, "serializer cannot be null");
        this.deadLetters = Objects.requireNonNull(deadLetters, "deadLetters cannot be null");
        this.settings = Objects.requireNonNull(settings, "settings cannot be null");
    }

    @Override
    public void requestStop() {
        stopRequested = true;
        stopSignal.countDown();
    }

    @Override
    public void run() {
        log.info("Consumer {} started on queue '{}' with concurrency {}", workerIdentity, queueName, concurrency);
        startedAt = Instant.now();
        ExecutorService pool = Executors.newFixedThreadPool(concurrency, new WorkerThreadFactory(workerIdentity));
        try {
            while (!stopRequested) {
                runCycle(pool);
                if (!stopRequested) {
                    awaitNextCycle();
                }
            }
        } finally {
            shutdownPool(pool);
            retire();
            log.info("Consumer {} stopped. Processed {} task(s).", workerIdentity, stats.processed.get());
        }
    }

    private void runCycle(ExecutorService pool) {
        try {
            pollControlMessages();
            if (stopRequested) {
                return;
            }
            Instant now = Instant.now();
            if (lastHeartbeat == null || !now.isBefore(lastHeartbeat.plus(settings.heartbeatInterval))) {
                publishHeartbeat(now);
                broker.requeueOrphaned(now.minus(settings.workerLostTimeout));
            }
            dispatchReady(pool, now);
        } catch (RuntimeException e) {
            // Keep the loop alive across broker hiccups
            log.error("Error during consumer cycle of {}: {}", workerIdentity, e.getMessage(), e);
        }
    }

    private void pollControlMessages() {
        List<ControlMessage> messages = broker.findControlMessages(lastControlId, workerIdentity);
        for (ControlMessage message : messages) {
            lastControlId = message.getId();
            if (ControlMessage.SHUTDOWN.equals(message.getCommand())) {
                log.info("Consumer {} received {} shutdown signal", workerIdentity, message.isBroadcast() ? "broadcast" : "targeted");
                requestStop();
            } else {
                log.warn("Consumer {} ignoring unknown control command '{}'", workerIdentity, message.getCommand());
            }
        }
    }

    private void publishHeartbeat(Instant now) {
        WorkerHeartbeat heartbeat = new WorkerHeartbeat();
        heartbeat.setWorkerIdentity(workerIdentity);
        heartbeat.setQueueName(queueName);
        heartbeat.setConcurrency(concurrency);
        heartbeat.setActive(stats.active.get());
        heartbeat.setProcessed(stats.processed.get());
        heartbeat.setSucceeded(stats.succeeded.get());
        heartbeat.setFailed(stats.failed.get());
        heartbeat.setRetried(stats.retried.get());
        heartbeat.setStartedAt(startedAt);
        heartbeat.setLastSeen(now);
        broker.saveHeartbeat(heartbeat);
        lastHeartbeat = now;
    }

    private void dispatchReady(ExecutorService pool, Instant now) {
        int freeSlots = concurrency - stats.active.get();
        if (freeSlots <= 0) {
            return;
        }
        List<TaskMessage> ready = broker.findReady(queueName, now, freeSlots);
        for (TaskMessage message : ready) {
            if (!broker.claim(message.getId(), workerIdentity, now)) {
                continue;
            }
            message.setClaimedBy(workerIdentity);
            stats.active.incrementAndGet();
            try {
                pool.execute(new TaskExecutionWrapper(message, workerIdentity, broker, results, handlers,
                        retryStrategy, serializer, deadLetters, stats));
                log.debug("Dispatched task ID {} (message {})", message.getTaskId(), message.getId());
            } catch (RejectedExecutionException e) {
                stats.active.decrementAndGet();
                log.error("Execution pool of {} rejected task ID {}; returning it to the queue.", workerIdentity, message.getTaskId(), e);
                broker.reschedule(message.getId(), workerIdentity, message.getRetries(), now);
            }
        }
    }

    private void awaitNextCycle() {
        try {
            stopSignal.await(settings.pollInterval.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            log.warn("Consumer {} interrupted; stopping.", workerIdentity);
            Thread.currentThread().interrupt();
            requestStop();
        }
    }

    /**
     * Waits for in-flight tasks, then interrupts whatever is left. The heartbeat is kept up while
     * draining so that other consumers do not requeue deliveries that are still running here.
     */
    private void shutdownPool(ExecutorService pool) {
        pool.shutdown();
        long deadline = System.nanoTime() + settings.drainTimeout.toNanos();
        try {
            while (!pool.isTerminated()) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    List<Runnable> dropped = pool.shutdownNow();
                    log.warn("Consumer {} did not finish in-flight tasks in {}. Interrupting; {} queued task(s) dropped.",
                            workerIdentity, settings.drainTimeout, dropped.size());
                    return;
                }
                long slice = Math.min(remaining, settings.heartbeatInterval.toNanos());
                if (!pool.awaitTermination(slice, TimeUnit.NANOSECONDS)) {
                    heartbeatWhileDraining();
                }
            }
        } catch (InterruptedException e) {
            log.warn("Consumer {} interrupted while draining. Forcing shutdown now.", workerIdentity);
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void heartbeatWhileDraining() {
        try {
            publishHeartbeat(Instant.now());
        } catch (RuntimeException e) {
            log.warn("Consumer {} could not publish heartbeat while draining: {}", workerIdentity, e.getMessage());
        }
    }

    /** Returns unfinished deliveries to the queue and withdraws the heartbeat. */
    private void retire() {
        try {
            broker.releaseClaims(workerIdentity);
            broker.removeHeartbeat(workerIdentity);
        } catch (RuntimeException e) {
            log.warn("Consumer {} could not retire cleanly ({}); its messages are requeued once it is considered lost.",
                    workerIdentity, e.getMessage());
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        private WorkerThreadFactory(String workerIdentity) {
            this.prefix = "taskproc-" + workerIdentity + "-exec-";
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
