package com.ryuqq.agentmesh.testkit.contract;

import com.ryuqq.agentmesh.core.exception.InvalidTransitionException;
import com.ryuqq.agentmesh.core.exception.TaskTimeoutException;
import com.ryuqq.agentmesh.core.exception.UnknownTaskException;
import com.ryuqq.agentmesh.core.model.AgentId;
import com.ryuqq.agentmesh.core.model.Payload;
import com.ryuqq.agentmesh.core.model.TaskId;
import com.ryuqq.agentmesh.core.model.TaskRecord;
import com.ryuqq.agentmesh.core.outcome.TaskError;
import com.ryuqq.agentmesh.core.outcome.TaskOutput;
import com.ryuqq.agentmesh.core.spi.TaskRegistry;
import com.ryuqq.agentmesh.core.statemachine.TaskStatus;
import com.ryuqq.agentmesh.testkit.fake.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract tests every {@link TaskRegistry} adapter must pass.
 *
 * <p>Covers the status state machine, broadcast wake-up of waiters, timeout semantics
 * and retention-based eviction.</p>
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public abstract class AbstractTaskRegistryContractTest {

    protected static final Duration RETENTION = Duration.ofMinutes(5);
    protected static final AgentId OWNER = AgentId.of("owner-agent");

    protected MutableClock clock;
    protected TaskRegistry registry;

    /**
     * Creates a registry that reads time from the given clock.
     *
     * @param retention how long terminal records are kept
     * @param clock time source
     * @return a new, empty registry
     */
    protected abstract TaskRegistry createRegistry(Duration retention, Clock clock);

    /**
     * Releases whatever the registry holds after each test. Adapters with shared or
     * external state override this; the default does nothing.
     *
     * @param registry the registry created for the finished test
     */
    protected void clearRegistry(TaskRegistry registry) {
    }

    @BeforeEach
    void setUpRegistry() {
        clock = new MutableClock(1_000_000L);
        registry = createRegistry(RETENTION, clock);
    }

    @AfterEach
    void tearDownRegistry() {
        if (registry != null) {
            clearRegistry(registry);
        }
    }

    protected TaskId createRunning() {
        TaskId taskId = registry.create(OWNER, Payload.of("query", "q"));
        registry.markRunning(taskId);
        return taskId;
    }

    protected static TaskOutput output(String content) {
        return new TaskOutput(Payload.of("content", content), 0.5);
    }

    // ========== 상태 전이 ==========

    @Test
    void create_NewRecordIsPending() {
        // When
        TaskId taskId = registry.create(OWNER, Payload.of("query", "q"));

        // Then
        TaskRecord record = registry.find(taskId);
        assertEquals(TaskStatus.PENDING, record.getStatus());
        assertEquals(OWNER, record.getOwner());
        assertEquals(clock.millis(), record.getSubmittedAt());
        assertEquals(1, registry.size());
    }

    @Test
    void complete_RunningTask_StoresResult() {
        // Given
        TaskId taskId = createRunning();

        // When
        registry.complete(taskId, output("done"));

        // Then
        TaskRecord record = registry.find(taskId);
        assertEquals(TaskStatus.COMPLETED, record.getStatus());
        assertEquals(output("done"), record.getResult().orElseThrow());
        assertTrue(record.getCompletedAt().isPresent());
    }

    @Test
    void complete_AlreadyTerminal_ThrowsInvalidTransition() {
        // Given
        TaskId taskId = createRunning();
        registry.fail(taskId, TaskError.of("QUOTA_EXCEEDED", "quota"));

        // When & Then
        assertThrows(InvalidTransitionException.class, () -> registry.complete(taskId, output("late")));
        assertThrows(InvalidTransitionException.class, () -> registry.timeOut(taskId, TaskError.of("X", "x")));
        assertEquals(TaskStatus.FAILED, registry.find(taskId).getStatus());
    }

    @Test
    void complete_PendingTask_ThrowsInvalidTransition() {
        TaskId taskId = registry.create(OWNER, Payload.empty());

        assertThrows(InvalidTransitionException.class, () -> registry.complete(taskId, output("x")));
    }

    @Test
    void fail_PendingTask_IsAllowed() {
        TaskId taskId = registry.create(OWNER, Payload.empty());

        registry.fail(taskId, TaskError.of(TaskError.AGENT_STOPPED, "stopped"));

        assertEquals(TaskStatus.FAILED, registry.find(taskId).getStatus());
    }

    @Test
    void timeOut_RunningTask_IsTerminalAndDistinctFromFailed() {
        TaskId taskId = createRunning();

        registry.timeOut(taskId, TaskError.of(TaskError.DEADLINE_EXCEEDED, "deadline"));

        TaskRecord record = registry.find(taskId);
        assertEquals(TaskStatus.TIMED_OUT, record.getStatus());
        assertEquals(TaskError.DEADLINE_EXCEEDED, record.getError().orElseThrow().code());
    }

    @Test
    void find_UnknownId_ThrowsUnknownTask() {
        TaskId unknown = TaskId.generate();

        UnknownTaskException exception = assertThrows(UnknownTaskException.class, () -> registry.find(unknown));
        assertEquals(unknown, exception.getTaskId());
        assertThrows(UnknownTaskException.class, () -> registry.markRunning(unknown));
        assertThrows(UnknownTaskException.class, () -> registry.awaitResult(unknown, Duration.ofMillis(10)));
    }

    @Test
    void findByOwner_ReturnsOnlyOwnedRecordsInSubmissionOrder() {
        // Given
        TaskId first = registry.create(OWNER, Payload.empty());
        registry.create(AgentId.of("other"), Payload.empty());
        TaskId second = registry.create(OWNER, Payload.empty());

        // When
        List<TaskRecord> owned = registry.findByOwner(OWNER);

        // Then
        assertEquals(List.of(first, second), owned.stream().map(TaskRecord::getTaskId).toList());
    }

    // ========== 대기 ==========

    @Test
    void awaitResult_CompletedLater_ReturnsTerminalRecord() throws Exception {
        // Given
        TaskId taskId = createRunning();
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<TaskRecord> waiter = executor.submit(() -> registry.awaitResult(taskId, Duration.ofSeconds(5)));
            Thread.sleep(50);

            // When
            registry.complete(taskId, output("done"));

            // Then
            assertEquals(TaskStatus.COMPLETED, waiter.get(5, TimeUnit.SECONDS).getStatus());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void awaitResult_ManyWaiters_AllReleasedOnCompletion() throws Exception {
        // Given
        TaskId taskId = createRunning();
        int waiters = 8;
        ExecutorService executor = Executors.newFixedThreadPool(waiters);
        try {
            List<Future<TaskRecord>> futures = new ArrayList<>();
            for (int i = 0; i < waiters; i++) {
                futures.add(executor.submit(() -> registry.awaitResult(taskId, Duration.ofSeconds(5))));
            }
            Thread.sleep(50);

            // When
            registry.complete(taskId, output("done"));

            // Then
            for (Future<TaskRecord> future : futures) {
                assertEquals(TaskStatus.COMPLETED, future.get(5, TimeUnit.SECONDS).getStatus());
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void awaitResult_Timeout_LeavesRecordUntouched_AndLaterCallSeesOutcome() {
        // Given
        TaskId taskId = createRunning();
        Duration timeout = Duration.ofMillis(150);

        // When
        long start = System.nanoTime();
        TaskTimeoutException exception = assertThrows(TaskTimeoutException.class,
            () -> registry.awaitResult(taskId, timeout));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        // Then
        assertEquals(taskId, exception.getTaskId());
        assertTrue(elapsedMs >= timeout.toMillis(), "returned early after " + elapsedMs + "ms");
        assertTrue(elapsedMs < timeout.toMillis() + 1000, "returned late after " + elapsedMs + "ms");
        assertEquals(TaskStatus.RUNNING, registry.find(taskId).getStatus());

        registry.complete(taskId, output("eventually"));
        assertEquals(TaskStatus.COMPLETED, registry.awaitResult(taskId, Duration.ofMillis(10)).getStatus());
    }

    @Test
    void awaitResult_CalledTwiceOnTerminal_ReturnsSameRecord() {
        TaskId taskId = createRunning();
        registry.complete(taskId, output("done"));

        TaskRecord first = registry.awaitResult(taskId, Duration.ofMillis(10));
        TaskRecord second = registry.awaitResult(taskId, Duration.ofMillis(10));

        assertEquals(first, second);
    }

    @Test
    void awaitAsync_CompletesWhenTaskTerminates() throws Exception {
        // Given
        TaskId taskId = createRunning();
        CompletableFuture<TaskRecord> future = registry.awaitAsync(taskId, Duration.ofSeconds(5));
        assertFalse(future.isDone());

        // When
        registry.fail(taskId, TaskError.of("SERVICE_UNAVAILABLE", "down"));

        // Then
        assertEquals(TaskStatus.FAILED, future.get(5, TimeUnit.SECONDS).getStatus());
    }

    @Test
    void awaitAsync_Timeout_CompletesExceptionally() {
        TaskId taskId = createRunning();

        CompletableFuture<TaskRecord> future = registry.awaitAsync(taskId, Duration.ofMillis(50));

        ExecutionException exception = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertInstanceOf(TaskTimeoutException.class, exception.getCause());
    }

    // ========== 보존 기간 ==========

    @Test
    void evictExpired_AfterRetention_RemovesTerminalRecords() {
        // Given
        TaskId finished = createRunning();
        registry.complete(finished, output("done"));
        TaskId stillRunning = createRunning();

        // When
        clock.advance(RETENTION.plusMillis(1));
        int evicted = registry.evictExpired();

        // Then
        assertEquals(1, evicted);
        assertThrows(UnknownTaskException.class, () -> registry.find(finished));
        assertThrows(UnknownTaskException.class, () -> registry.awaitResult(finished, Duration.ofMillis(10)));
        assertEquals(TaskStatus.RUNNING, registry.find(stillRunning).getStatus());
    }

    @Test
    void find_AfterRetentionWithoutSweep_EvictsLazily() {
        TaskId finished = createRunning();
        registry.complete(finished, output("done"));

        clock.advance(RETENTION.plusMillis(1));

        assertThrows(UnknownTaskException.class, () -> registry.find(finished));
        assertEquals(0, registry.size());
    }

    @Test
    void evictExpired_WithinRetention_KeepsRecords() {
        TaskId finished = createRunning();
        registry.complete(finished, output("done"));

        clock.advance(RETENTION.minusMillis(1));

        assertEquals(0, registry.evictExpired());
        assertEquals(TaskStatus.COMPLETED, registry.find(finished).getStatus());
    }
}
