package com.sailfish.taskproc.service.impl;

import com.sailfish.taskproc.model.ConsumerState;
import com.sailfish.taskproc.model.ControlMessage;
import com.sailfish.taskproc.repository.BrokerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

/**
 * Owns the single consumer thread of an adapter and its worker identity.
 *
 * <p>{@code start} is a no-op while the thread is alive. {@code stop} addresses the stop signal to
 * this worker identity only and never waits longer than its timeout; the handle is released whether
 * or not the thread exited. {@code shutdown} broadcasts to every worker and does not wait; it returns
 * the consumer threads still finishing their in-flight tasks.
 *
 * <p>Single writer: callers serialize start/stop/shutdown themselves.
 */
public class ConsumerSupervisor {

    private static final Logger log = LoggerFactory.getLogger(ConsumerSupervisor.class);

    /**
     * Creates the loop run by a new consumer thread.
     */
    @FunctionalInterface
    public interface LoopFactory {
        /**
         * @param workerIdentity freshly derived identity of the consumer.
         * @param lastControlId  newest control message at start; older ones must be ignored.
         * @param options        consumer options as given to {@code start}.
         */
        ConsumerLoop create(String workerIdentity, long lastControlId, Map<String, ?> options);
    }

    private final String queueName;
    private final BrokerRepository broker;
    private final LoopFactory loopFactory;
    private final String hostName;
    private final List<Thread> exiting = new CopyOnWriteArrayList<>();

    private volatile Thread workerThread;
    private volatile ConsumerLoop loop;
    private volatile String workerIdentity;
    private volatile boolean stopping;

    public ConsumerSupervisor(String queueName, BrokerRepository broker, LoopFactory loopFactory) {
        this.queueName = Objects.requireNonNull(queueName, "queueName cannot be null");
        this.broker = Objects.requireNonNull(broker, "broker cannot be null");
        this.loopFactory = Objects.requireNonNull(loopFactory, "loopFactory cannot be null");
        this.hostName = resolveHostName();
    }

    /**
     * Starts a consumer thread under a new worker identity, unless one is already running.
     */
    public void start(Map<String, ?> options) {
        Thread current = workerThread;
        if (current != null && current.isAlive()) {
            log.info("Consumer thread is already running as {}.", workerIdentity);
            return;
        }

        String identity = deriveWorkerIdentity();
        // Read before the thread exists so a stop sent right after start is never missed
        long lastControlId = broker.latestControlId();
        ConsumerLoop newLoop = loopFactory.create(identity, lastControlId, options);

        Thread thread = new Thread(newLoop, "taskproc-consumer-" + identity);
        thread.setDaemon(true);
        this.loop = newLoop;
        this.workerIdentity = identity;
        this.workerThread = thread;
        this.stopping = false;
        thread.start();

        log.info("Consumer thread started with worker identity: {}", identity);
    }

    /**
     * Sends a stop signal to this consumer and waits at most {@code timeout} for its thread to exit.
     * Never throws for a slow consumer: the handle is released and a warning logged.
     */
    public void stop(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout cannot be null");
        long deadline = System.nanoTime() + timeout.toNanos();
        Thread thread = workerThread;
        if (thread == null || !thread.isAlive()) {
            log.info("Consumer thread is not running.");
            release();
            return;
        }

        String identity = workerIdentity;
        stopping = true;
        log.info("Sending shutdown signal to consumer {}...", identity);
        try {
            broker.publishControl(new ControlMessage(ControlMessage.SHUTDOWN, identity));
        } catch (RuntimeException e) {
            log.warn("Could not publish shutdown signal for {} ({}). Stopping it locally.", identity, e.getMessage());
            loop.requestStop();
        }

        long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
        if (remainingMillis > 0) {
            try {
                thread.join(remainingMillis);
            } catch (InterruptedException e) {
                log.warn("Interrupted while waiting for consumer {} to stop.", identity);
                Thread.currentThread().interrupt();
            }
        }

        if (thread.isAlive()) {
            log.warn("Consumer thread {} did not terminate after {}.", identity, timeout);
            exiting.add(thread);
        } else {
            log.info("Consumer thread {} has stopped.", identity);
        }
        release();
    }

    /**
     * Broadcasts a shutdown to every consumer on the broker and releases the local handle without waiting.
     *
     * @return the local consumer threads that are still alive, including ones a timed-out stop released.
     */
    public List<Thread> shutdown() {
        log.info("Broadcasting shutdown to all consumers...");
        try {
            broker.publishControl(new ControlMessage(ControlMessage.SHUTDOWN, null));
        } catch (RuntimeException e) {
            log.warn("Could not broadcast shutdown ({}). Only the local consumer is stopped.", e.getMessage());
        }
        ConsumerLoop current = loop;
        if (current != null) {
            current.requestStop();
        }
        Thread thread = workerThread;
        if (thread != null) {
            exiting.add(thread);
        }
        release();

        List<Thread> alive = new ArrayList<>();
        for (Thread candidate : exiting) {
            if (candidate.isAlive()) {
                alive.add(candidate);
            }
        }
        exiting.clear();
        return alive;
    }

    public ConsumerState getState() {
        Thread thread = workerThread;
        if (thread == null || !thread.isAlive()) {
            return ConsumerState.STOPPED;
        }
        return stopping ? ConsumerState.STOPPING : ConsumerState.RUNNING;
    }

    /**
     * @return the identity of the live consumer, empty when none is running.
     */
    public Optional<String> getWorkerIdentity() {
        return getState() == ConsumerState.STOPPED ? Optional.empty() : Optional.ofNullable(workerIdentity);
    }

    private void release() {
        workerThread = null;
        loop = null;
        workerIdentity = null;
        stopping = false;
    }

    private String deriveWorkerIdentity() {
        return queueName + "@" + hostName + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private static String resolveHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.debug("Could not resolve local host name, using 'localhost': {}", e.getMessage());
            return "localhost";
        }
    }
}
