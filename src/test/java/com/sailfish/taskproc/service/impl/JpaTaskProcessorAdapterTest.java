package com.sailfish.taskproc.service.impl;

import com.sailfish.taskproc.TaskHandler;
import com.sailfish.taskproc.TestBackends;
import com.sailfish.taskproc.config.TaskProcessorConfig;
import com.sailfish.taskproc.exception.UnsupportedTaskOperationException;
import com.sailfish.taskproc.factory.TaskProcessorAdapterFactory;
import com.sailfish.taskproc.model.ConsumerState;
import com.sailfish.taskproc.model.TaskMessage;
import com.sailfish.taskproc.model.TaskResult;
import com.sailfish.taskproc.model.TaskResultRecord;
import com.sailfish.taskproc.model.TaskStatus;
import com.sailfish.taskproc.repository.JpaBrokerRepository;
import com.sailfish.taskproc.repository.JpaTaskResultRepository;
import com.sailfish.taskproc.service.TaskProcessorAdapter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import jakarta.persistence.EntityManagerFactory;
import jakarta.persistence.Persistence;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * Runs the adapter end to end against an in-memory H2 database used as both broker and result store.
 */
class JpaTaskProcessorAdapterTest {

    private static final Duration WAIT = Duration.ofSeconds(15);

    private final List<TaskProcessorAdapter> adapters = new ArrayList<>();
    private final List<CountDownLatch> gates = new ArrayList<>();
    private String url;

    @BeforeEach
    void setUp() {
        url = TestBackends.h2Url("adapter");
    }

    @AfterEach
    void tearDown() {
        gates.forEach(CountDownLatch::countDown);
        adapters.forEach(TaskProcessorAdapter::shutdown);
    }

    private TaskProcessorAdapter adapter(String queue, int maxRetries) {
        return adapter(new TaskProcessorConfig(queue, maxRetries, TestBackends.h2(url).build()));
    }

    private TaskProcessorAdapter adapter(TaskProcessorConfig config) {
        TaskProcessorAdapter adapter = TaskProcessorAdapterFactory.create(config);
        adapters.add(adapter);
        return adapter;
    }

    private CountDownLatch gate() {
        CountDownLatch gate = new CountDownLatch(1);
        gates.add(gate);
        return gate;
    }

    private static TaskStatus statusOf(TaskProcessorAdapter adapter, String taskId) {
        return adapter.getTaskStatusSync(taskId).getStatus();
    }

    private static void awaitStatus(TaskProcessorAdapter adapter, String taskId, TaskStatus expected) {
        await().atMost(WAIT).until(() -> statusOf(adapter, taskId) == expected);
    }

    private static long processed(TaskProcessorAdapter adapter) {
        return adapter.getMetrics().values().stream()
                .mapToLong(stats -> ((Number) ((Map<?, ?>) stats).get("processed")).longValue())
                .sum();
    }

    @Test
    @DisplayName("Should run a submitted task through PENDING, STARTED and SUCCESS")
    void should_run_task_to_success() {
        // given
        TaskProcessorAdapter adapter = adapter("math", 3);
        CountDownLatch gate = gate();
        adapter.registerTaskHandle((args, kwargs) -> {
            gate.await(10, TimeUnit.SECONDS);
            return (Integer) args.get(0) + (Integer) args.get(1);
        }, "add");

        // when
        TaskResult submitted = adapter.enqueueTaskSync("add", Arrays.asList(2, 3));

        // then
        assertThat(submitted.getStatus()).isEqualTo(TaskStatus.PENDING);
        assertThat(submitted.getCreatedAt()).isNotNull();
        assertThat(statusOf(adapter, submitted.getId())).isEqualTo(TaskStatus.PENDING);

        adapter.startConsumer();
        awaitStatus(adapter, submitted.getId(), TaskStatus.STARTED);
        gate.countDown();
        awaitStatus(adapter, submitted.getId(), TaskStatus.SUCCESS);

        TaskResult finished = adapter.getTaskStatusSync(submitted.getId());
        assertThat(finished.getResult()).isEqualTo(5);
        assertThat(finished.getCreatedAt())
                .isBetween(submitted.getCreatedAt().minusMillis(1), submitted.getCreatedAt().plusMillis(1));
    }

    @Test
    @DisplayName("Should pass keyword arguments and honour a caller-chosen task id")
    void should_pass_kwargs_and_task_id() {
        // given
        TaskProcessorAdapter adapter = adapter("math", 0);
        adapter.registerTaskHandle((args, kwargs) -> kwargs.get("greeting") + " " + args.get(0), "greet");
        Map<String, Object> kwargs = new HashMap<>();
        kwargs.put("greeting", "hello");

        // when
        TaskResult submitted = adapter.enqueueTaskSync("greet", Collections.singletonList("world"), kwargs,
                Collections.singletonMap(JpaTaskProcessorAdapter.OPTION_TASK_ID, "greet-1"));
        adapter.startConsumer();

        // then
        assertThat(submitted.getId()).isEqualTo("greet-1");
        awaitStatus(adapter, "greet-1", TaskStatus.SUCCESS);
        assertThat(adapter.getTaskStatusSync("greet-1").getResult()).isEqualTo("hello world");
    }

    @Test
    @DisplayName("Should retry a failing task up to the limit and then mark it FAILURE")
    void should_fail_after_retries() {
        // given
        TaskProcessorAdapter adapter = adapter("math", 2);
        AtomicInteger invocations = new AtomicInteger();
        adapter.registerTaskHandle((args, kwargs) -> {
            invocations.incrementAndGet();
            throw new IllegalStateException("boom");
        }, "flaky");

        // when
        TaskResult submitted = adapter.enqueueTaskSync("flaky", Collections.emptyList());
        adapter.startConsumer();

        // then
        awaitStatus(adapter, submitted.getId(), TaskStatus.FAILURE);
        assertThat(invocations.get()).isEqualTo(3);
        assertThat((String) adapter.getTaskStatusSync(submitted.getId()).getResult())
                .contains("IllegalStateException")
                .contains("boom");
    }

    @Test
    @DisplayName("Should succeed when a retry eventually passes")
    void should_succeed_after_retry() {
        // given
        TaskProcessorAdapter adapter = adapter("math", 3);
        AtomicInteger invocations = new AtomicInteger();
        adapter.registerTaskHandle((args, kwargs) -> {
            if (invocations.incrementAndGet() < 3) {
                throw new IllegalStateException("not yet");
            }
            return "done";
        }, "eventually");

        // when
        TaskResult submitted = adapter.enqueueTaskSync("eventually", Collections.emptyList());
        adapter.startConsumer();

        // then
        awaitStatus(adapter, submitted.getId(), TaskStatus.SUCCESS);
        assertThat(invocations.get()).isEqualTo(3);
        assertThat(adapter.getTaskStatusSync(submitted.getId()).getResult()).isEqualTo("done");
    }

    @Test
    @DisplayName("Should report PENDING without a creation time for an unknown task id")
    void should_report_unknown_task_as_pending() {
        // given
        TaskProcessorAdapter adapter = adapter("math", 3);

        // when
        TaskResult result = adapter.getTaskStatusSync("does-not-exist");

        // then
        assertThat(result.getId()).isEqualTo("does-not-exist");
        assertThat(result.getStatus()).isEqualTo(TaskStatus.PENDING);
        assertThat(result.getCreatedAt()).isNull();
        assertThat(result.getResult()).isNull();
    }

    @Test
    @DisplayName("Should fail asynchronous operations as unsupported")
    void should_fail_async_operations() {
        // given
        TaskProcessorAdapter adapter = adapter("math", 3);

        // when
        CompletableFuture<TaskResult> enqueue = adapter.enqueueTaskAsync("add", Arrays.asList(1, 2), null, null);
        CompletableFuture<TaskResult> status = adapter.getTaskStatusAsync("any");

        // then
        assertThat(enqueue).isCompletedExceptionally();
        assertThat(status).isCompletedExceptionally();
        assertThatThrownBy(enqueue::join).hasCauseInstanceOf(UnsupportedTaskOperationException.class);
        assertThatThrownBy(status::join).hasCauseInstanceOf(UnsupportedTaskOperationException.class);
    }

    @Test
    @DisplayName("Should reject arguments that cannot be serialized")
    void should_reject_non_serializable_arguments() {
        // given
        TaskProcessorAdapter adapter = adapter("math", 3);

        // when / then
        assertThatThrownBy(() -> adapter.enqueueTaskSync("add", Collections.singletonList(new Object())))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should stop the consumer within the timeout after finishing the running task")
    void should_stop_within_timeout() {
        // given
        TaskProcessorAdapter adapter = adapter("math", 3);
        adapter.registerTaskHandle((args, kwargs) -> {
            Thread.sleep(1_000);
            return "slept";
        }, "sleepy");
        TaskResult submitted = adapter.enqueueTaskSync("sleepy", Collections.emptyList());
        adapter.startConsumer();
        awaitStatus(adapter, submitted.getId(), TaskStatus.STARTED);

        // when
        long begin = System.nanoTime();
        adapter.stopConsumer(Duration.ofSeconds(5));
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - begin);

        // then
        assertThat(elapsedMillis).isLessThan(5_000L);
        assertThat(adapter.getConsumerState()).isEqualTo(ConsumerState.STOPPED);
        assertThat(adapter.getWorkerIdentity()).isEmpty();
        assertThat(statusOf(adapter, submitted.getId())).isEqualTo(TaskStatus.SUCCESS);
        assertThat(adapter.healthCheck()).isEmpty();
    }

    @Test
    @DisplayName("Should not wait longer than the timeout for a consumer stuck in a task")
    void should_not_block_past_timeout() {
        // given
        TaskProcessorAdapter adapter = adapter("math", 3);
        CountDownLatch gate = gate();
        adapter.registerTaskHandle((args, kwargs) -> gate.await(30, TimeUnit.SECONDS), "stuck");
        TaskResult submitted = adapter.enqueueTaskSync("stuck", Collections.emptyList());
        adapter.startConsumer();
        awaitStatus(adapter, submitted.getId(), TaskStatus.STARTED);

        // when
        long begin = System.nanoTime();
        adapter.stopConsumer(Duration.ofMillis(300));
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - begin);

        // then
        assertThat(elapsedMillis).isLessThan(3_000L);
        assertThat(adapter.getConsumerState()).isEqualTo(ConsumerState.STOPPED);
    }

    @Test
    @DisplayName("Should store the outcome of a task still running when the adapter shuts down")
    void should_store_outcome_of_running_task_on_shutdown() {
        // given
        TaskProcessorAdapter adapter = adapter("math", 3);
        adapter.registerTaskHandle((args, kwargs) -> {
            Thread.sleep(500);
            return "finished";
        }, "finishing");
        TaskResult submitted = adapter.enqueueTaskSync("finishing", Collections.emptyList());
        adapter.startConsumer();
        awaitStatus(adapter, submitted.getId(), TaskStatus.STARTED);

        // when
        adapter.shutdown();

        // then
        assertThat(adapter.getConsumerState()).isEqualTo(ConsumerState.STOPPED);
        EntityManagerFactory backendFactory = Persistence.createEntityManagerFactory(
                JpaTaskProcessorAdapter.BACKEND_PERSISTENCE_UNIT,
                Collections.singletonMap(JpaTaskProcessorAdapter.JDBC_URL, url));
        try {
            TaskResultRecord record = new JpaTaskResultRepository(backendFactory).findById(submitted.getId()).orElseThrow();
            assertThat(record.getStatus()).isEqualTo(TaskStatus.SUCCESS);
        } finally {
            backendFactory.close();
        }
    }

    @Test
    @DisplayName("Should not hand a task still draining on a stopping consumer to another consumer")
    void should_not_redeliver_task_of_draining_consumer() {
        // given
        TaskProcessorAdapter draining = adapter("math", 3);
        TaskProcessorAdapter takeover = adapter("math", 3);
        AtomicInteger runs = new AtomicInteger();
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxConcurrent = new AtomicInteger();
        TaskHandler slow = (args, kwargs) -> {
            runs.incrementAndGet();
            maxConcurrent.accumulateAndGet(running.incrementAndGet(), Math::max);
            try {
                // longer than the worker-lost timeout of the test backend
                Thread.sleep(3_000);
                return "done";
            } finally {
                running.decrementAndGet();
            }
        };
        draining.registerTaskHandle(slow, "slow");
        takeover.registerTaskHandle(slow, "slow");
        TaskResult submitted = draining.enqueueTaskSync("slow", Collections.emptyList());
        draining.startConsumer();
        awaitStatus(draining, submitted.getId(), TaskStatus.STARTED);

        // when
        draining.stopConsumer(Duration.ofMillis(100));
        takeover.startConsumer();

        // then
        awaitStatus(takeover, submitted.getId(), TaskStatus.SUCCESS);
        assertThat(runs.get()).isEqualTo(1);
        assertThat(maxConcurrent.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should stop only its own consumer, while shutdown reaches every consumer")
    void should_scope_stop_and_broadcast_shutdown() {
        // given
        TaskProcessorAdapter first = adapter("math", 3);
        TaskProcessorAdapter second = adapter("math", 3);
        first.startConsumer();
        second.startConsumer();
        String secondIdentity = second.getWorkerIdentity().orElseThrow();
        await().atMost(WAIT).until(() -> first.healthCheck().size() == 2);

        // when
        first.stopConsumer(Duration.ofSeconds(5));

        // then
        assertThat(first.getConsumerState()).isEqualTo(ConsumerState.STOPPED);
        assertThat(second.getConsumerState()).isEqualTo(ConsumerState.RUNNING);
        await().atMost(WAIT).until(() -> second.healthCheck().size() == 1);
        assertThat(second.healthCheck().get(0)).containsOnlyKeys(secondIdentity);

        // when
        first.shutdown();

        // then
        await().atMost(WAIT).until(() -> second.getConsumerState() == ConsumerState.STOPPED);
        assertThatThrownBy(() -> first.getTaskStatusSync("any")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should remove a queued task when it is cancelled before delivery")
    void should_cancel_queued_task() {
        // given
        TaskProcessorAdapter adapter = adapter("math", 3);
        AtomicInteger cancelledRuns = new AtomicInteger();
        adapter.registerTaskHandle((args, kwargs) -> cancelledRuns.incrementAndGet(), "add");
        adapter.registerTaskHandle((args, kwargs) -> "ok", "marker");
        TaskResult cancelled = adapter.enqueueTaskSync("add", Arrays.asList(1, 1));

        // when
        boolean accepted = adapter.cancelTask(cancelled.getId());
        TaskResult marker = adapter.enqueueTaskSync("marker", Collections.emptyList());
        adapter.startConsumer();

        // then
        assertThat(accepted).isTrue();
        awaitStatus(adapter, marker.getId(), TaskStatus.SUCCESS);
        assertThat(statusOf(adapter, cancelled.getId())).isEqualTo(TaskStatus.REVOKED);
        assertThat(cancelledRuns.get()).isZero();
    }

    @Test
    @DisplayName("Should keep REVOKED when a running task is cancelled and then finishes")
    void should_keep_revoked_for_running_task() {
        // given
        TaskProcessorAdapter adapter = adapter("math", 3);
        CountDownLatch gate = gate();
        adapter.registerTaskHandle((args, kwargs) -> {
            gate.await(10, TimeUnit.SECONDS);
            return "finished";
        }, "long");
        TaskResult submitted = adapter.enqueueTaskSync("long", Collections.emptyList());
        adapter.startConsumer();
        awaitStatus(adapter, submitted.getId(), TaskStatus.STARTED);

        // when
        boolean accepted = adapter.cancelTask(submitted.getId());
        gate.countDown();

        // then
        assertThat(accepted).isTrue();
        await().atMost(WAIT).until(() -> processed(adapter) == 1);
        assertThat(statusOf(adapter, submitted.getId())).isEqualTo(TaskStatus.REVOKED);
    }

    @Test
    @DisplayName("Should refuse to cancel finished or unknown tasks")
    void should_refuse_cancel_of_finished_task() {
        // given
        TaskProcessorAdapter adapter = adapter("math", 3);
        adapter.registerTaskHandle((args, kwargs) -> "ok", "quick");
        TaskResult submitted = adapter.enqueueTaskSync("quick", Collections.emptyList());
        adapter.startConsumer();
        awaitStatus(adapter, submitted.getId(), TaskStatus.SUCCESS);

        // when / then
        assertThat(adapter.cancelTask(submitted.getId())).isFalse();
        assertThat(adapter.cancelTask("does-not-exist")).isFalse();
        assertThat(statusOf(adapter, submitted.getId())).isEqualTo(TaskStatus.SUCCESS);
    }

    @Test
    @DisplayName("Should hold back a task submitted with a countdown")
    void should_delay_task_with_countdown() {
        // given
        TaskProcessorAdapter adapter = adapter("math", 3);
        adapter.registerTaskHandle((args, kwargs) -> "ok", "quick");
        TaskResult delayed = adapter.enqueueTaskSync("quick", Collections.emptyList(), null,
                Collections.singletonMap(JpaTaskProcessorAdapter.OPTION_COUNTDOWN, 60));
        TaskResult immediate = adapter.enqueueTaskSync("quick", Collections.emptyList());

        // when
        adapter.startConsumer();

        // then
        awaitStatus(adapter, immediate.getId(), TaskStatus.SUCCESS);
        assertThat(statusOf(adapter, delayed.getId())).isEqualTo(TaskStatus.PENDING);
    }

    @Test
    @DisplayName("Should route a task to another queue when asked")
    void should_route_to_queue_option() {
        // given
        TaskProcessorAdapter mathAdapter = adapter("math", 3);
        TaskProcessorAdapter reportsAdapter = adapter("reports", 3);
        List<String> ranOn = new CopyOnWriteArrayList<>();
        mathAdapter.registerTaskHandle((args, kwargs) -> ranOn.add("math"), "job");
        reportsAdapter.registerTaskHandle((args, kwargs) -> ranOn.add("reports"), "job");

        // when
        TaskResult submitted = mathAdapter.enqueueTaskSync("job", Collections.emptyList(), null,
                Collections.singletonMap(JpaTaskProcessorAdapter.OPTION_QUEUE, "reports"));
        mathAdapter.startConsumer();
        reportsAdapter.startConsumer();

        // then
        awaitStatus(mathAdapter, submitted.getId(), TaskStatus.SUCCESS);
        assertThat(ranOn).containsExactly("reports");
    }

    @Test
    @DisplayName("Should fail a task without a registered handler and route it to the unprocessable queue")
    void should_fail_unregistered_task() {
        // given
        TaskProcessorAdapter adapter = adapter(new TaskProcessorConfig("math", 3, TestBackends.h2(url).build(),
                null, "math.unprocessable"));
        TaskProcessorAdapter deadLetters = adapter("math.unprocessable", 0);
        List<Object> received = new CopyOnWriteArrayList<>();
        deadLetters.registerTaskHandle((args, kwargs) -> received.add(args.get(0)), "missing");

        // when
        TaskResult submitted = adapter.enqueueTaskSync("missing", Collections.singletonList(42));
        adapter.startConsumer();
        deadLetters.startConsumer();

        // then
        awaitStatus(adapter, submitted.getId(), TaskStatus.FAILURE);
        assertThat(adapter.getTaskStatusSync(submitted.getId()).getResult()).isEqualTo("NotRegistered: missing");
        await().atMost(WAIT).until(() -> received.size() == 1);
        assertThat(received).containsExactly(42);
    }

    @Test
    @DisplayName("Should route a task that exhausted its retries to the failed-task queue")
    void should_route_failed_task() {
        // given
        TaskProcessorAdapter adapter = adapter(new TaskProcessorConfig("math", 0, TestBackends.h2(url).build(),
                "math.failed", null));
        TaskProcessorAdapter deadLetters = adapter("math.failed", 0);
        adapter.registerTaskHandle((args, kwargs) -> {
            throw new IllegalArgumentException("bad input " + args.get(0));
        }, "divide");
        List<Object> received = new CopyOnWriteArrayList<>();
        deadLetters.registerTaskHandle((args, kwargs) -> received.add(args.get(0)), "divide");

        // when
        TaskResult submitted = adapter.enqueueTaskSync("divide", Collections.singletonList(7));
        adapter.startConsumer();
        deadLetters.startConsumer();

        // then
        awaitStatus(adapter, submitted.getId(), TaskStatus.FAILURE);
        await().atMost(WAIT).until(() -> received.size() == 1);
        assertThat(received).containsExactly(7);
    }

    @Test
    @DisplayName("Should redeliver a task held by a worker that stopped sending heartbeats")
    void should_redeliver_task_of_lost_worker() {
        // given
        TaskProcessorAdapter adapter = adapter("math", 3);
        adapter.registerTaskHandle((args, kwargs) -> "recovered", "orphan");
        TaskResult submitted = adapter.enqueueTaskSync("orphan", Collections.emptyList());

        EntityManagerFactory brokerFactory = Persistence.createEntityManagerFactory(
                JpaTaskProcessorAdapter.BROKER_PERSISTENCE_UNIT,
                Collections.singletonMap(JpaTaskProcessorAdapter.JDBC_URL, url));
        try {
            JpaBrokerRepository broker = new JpaBrokerRepository(brokerFactory);
            TaskMessage message = broker.findReady("math", Instant.now(), 10).get(0);
            assertThat(broker.claim(message.getId(), "math@crashed-host-deadbeef", Instant.now())).isTrue();

            // when
            adapter.startConsumer();

            // then
            awaitStatus(adapter, submitted.getId(), TaskStatus.SUCCESS);
            assertThat(adapter.getTaskStatusSync(submitted.getId()).getResult()).isEqualTo("recovered");
        } finally {
            brokerFactory.close();
        }
    }

    @Test
    @DisplayName("Should report metrics and health for a running consumer")
    void should_report_metrics_and_health() {
        // given
        TaskProcessorAdapter adapter = adapter("math", 3);
        adapter.registerTaskHandle((args, kwargs) -> "ok", "quick");
        TaskResult submitted = adapter.enqueueTaskSync("quick", Collections.emptyList());

        // when
        adapter.startConsumer(Collections.singletonMap(JpaTaskProcessorAdapter.CONSUMER_OPTION_CONCURRENCY, 2));
        String identity = adapter.getWorkerIdentity().orElseThrow();
        awaitStatus(adapter, submitted.getId(), TaskStatus.SUCCESS);
        await().atMost(WAIT).until(() -> processed(adapter) == 1);

        // then
        assertThat(identity).startsWith("math@");
        assertThat(adapter.healthCheck()).containsExactly(
                Collections.singletonMap(identity, Collections.singletonMap("ok", "pong")));
        @SuppressWarnings("unchecked")
        Map<String, Object> stats = (Map<String, Object>) adapter.getMetrics().get(identity);
        assertThat(stats).containsEntry("queue", "math")
                .containsEntry("concurrency", 2)
                .containsEntry("succeeded", 1L)
                .containsEntry("failed", 0L)
                .containsKeys("active", "retried", "started_at", "last_heartbeat");
    }

    @Test
    @DisplayName("Should only accept handler registrations while the consumer is stopped")
    void should_reject_registration_while_running() {
        // given
        TaskProcessorAdapter adapter = adapter("math", 3);
        adapter.startConsumer();

        // when / then
        assertThatThrownBy(() -> adapter.registerTaskHandle((args, kwargs) -> null, "late"))
                .isInstanceOf(IllegalStateException.class);

        adapter.stopConsumer(Duration.ofSeconds(5));
        assertThat(adapter.registerTaskHandle((args, kwargs) -> null, "late")).isEqualTo("late");
    }

    @Test
    @DisplayName("Should ignore a second start while the consumer runs")
    void should_ignore_second_start() {
        // given
        TaskProcessorAdapter adapter = adapter("math", 3);
        adapter.startConsumer();
        String identity = adapter.getWorkerIdentity().orElseThrow();

        // when
        adapter.startConsumer();

        // then
        assertThat(adapter.getWorkerIdentity()).contains(identity);
        await().atMost(WAIT).until(() -> adapter.healthCheck().size() == 1);
    }

    @Test
    @DisplayName("Should refuse a second initialization and any use after shutdown")
    void should_guard_lifecycle() {
        // given
        TaskProcessorConfig config = new TaskProcessorConfig("math", 3, TestBackends.h2(url).build());
        TaskProcessorAdapter adapter = adapter(config);

        // when / then
        assertThatThrownBy(() -> adapter.initialize(config)).isInstanceOf(IllegalStateException.class);

        adapter.shutdown();
        adapter.shutdown();
        assertThatThrownBy(() -> adapter.enqueueTaskSync("add", Collections.emptyList()))
                .isInstanceOf(IllegalStateException.class);
        assertThat(adapter.getConsumerState()).isEqualTo(ConsumerState.STOPPED);
    }
}
