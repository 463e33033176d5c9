package com.ryuqq.agentmesh.adapter.inmemory.task;

import com.ryuqq.agentmesh.core.exception.TaskTimeoutException;
import com.ryuqq.agentmesh.core.exception.UnknownTaskException;
import com.ryuqq.agentmesh.core.model.AgentId;
import com.ryuqq.agentmesh.core.model.Payload;
import com.ryuqq.agentmesh.core.model.TaskId;
import com.ryuqq.agentmesh.core.model.TaskRecord;
import com.ryuqq.agentmesh.core.outcome.Completed;
import com.ryuqq.agentmesh.core.outcome.Failed;
import com.ryuqq.agentmesh.core.outcome.TaskError;
import com.ryuqq.agentmesh.core.outcome.TaskOutcome;
import com.ryuqq.agentmesh.core.outcome.TaskOutput;
import com.ryuqq.agentmesh.core.outcome.TimedOut;
import com.ryuqq.agentmesh.core.spi.TaskRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link TaskRegistry} SPI.
 *
 * <p>Each task is held in a {@link TaskEntry} pairing the current immutable {@link TaskRecord}
 * with a {@link CompletableFuture} that completes exactly once, when the task reaches a terminal
 * status. Waiters block on that future, so every waiter is released together and a waiter's
 * timeout never touches the record.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>tasks:</strong> ConcurrentHashMap&lt;TaskId, TaskEntry&gt; - O(1) lookup</li>
 *   <li><strong>sequence:</strong> AtomicLong - submission order for {@link #findByOwner(AgentId)}</li>
 * </ul>
 *
 * <p><strong>Retention:</strong> a terminal record is evicted once more than {@code retention} has
 * passed since its completion, either by {@link #evictExpired()} or lazily on lookup.
 * Non-terminal records are never evicted.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Records are lost on process restart</li>
 *   <li>No cross-process visibility</li>
 * </ul>
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public class InMemoryTaskRegistry implements TaskRegistry {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTaskRegistry.class);

    public static final Duration DEFAULT_RETENTION = Duration.ofHours(1);

    private final ConcurrentHashMap<TaskId, TaskEntry> tasks = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final long retentionMs;
    private final Clock clock;

    public InMemoryTaskRegistry() {
        this(DEFAULT_RETENTION, Clock.systemUTC());
    }

    /**
     * @param retention how long terminal records are kept (positive)
     * @param clock time source for timestamps and retention
     * @throws IllegalArgumentException if retention is not positive or clock is null
     */
    public InMemoryTaskRegistry(Duration retention, Clock clock) {
        if (retention == null || retention.isZero() || retention.isNegative()) {
            throw new IllegalArgumentException("retention must be positive (current: " + retention + ")");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.retentionMs = retention.toMillis();
        this.clock = clock;
    }

    @Override
    public TaskId create(AgentId owner, Payload input) {
        TaskId taskId = TaskId.generate();
        TaskRecord record = TaskRecord.pending(taskId, owner, input, clock.millis());
        tasks.put(taskId, new TaskEntry(record, sequence.incrementAndGet()));
        log.debug("Task {} created for {}", taskId.getValue(), owner.getValue());
        return taskId;
    }

    @Override
    public TaskRecord markRunning(TaskId taskId) {
        return entryFor(taskId).update(record -> record.toRunning(clock.millis()));
    }

    @Override
    public TaskRecord complete(TaskId taskId, TaskOutput output) {
        if (output == null) {
            throw new IllegalArgumentException("output cannot be null");
        }
        return terminate(taskId, new Completed(output));
    }

    @Override
    public TaskRecord fail(TaskId taskId, TaskError error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        return terminate(taskId, new Failed(error));
    }

    @Override
    public TaskRecord timeOut(TaskId taskId, TaskError error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        return terminate(taskId, new TimedOut(error));
    }

    private TaskRecord terminate(TaskId taskId, TaskOutcome outcome) {
        TaskRecord updated = entryFor(taskId).update(record -> record.toTerminal(outcome, clock.millis()));
        log.debug("Task {} reached {}", taskId.getValue(), updated.getStatus());
        return updated;
    }

    @Override
    public TaskRecord find(TaskId taskId) {
        return entryFor(taskId).record;
    }

    @Override
    public List<TaskRecord> findByOwner(AgentId owner) {
        if (owner == null) {
            throw new IllegalArgumentException("owner cannot be null");
        }
        long now = clock.millis();
        return tasks.values().stream()
            .filter(entry -> !isExpired(entry.record, now))
            .filter(entry -> entry.record.getOwner().equals(owner))
            .sorted(Comparator.comparingLong(entry -> entry.sequence))
            .map(entry -> entry.record)
            .collect(Collectors.toList());
    }

    /**
     * {@inheritDoc}
     *
     * <p>If the calling thread is interrupted while waiting, the interrupt flag is restored and
     * the wait ends with {@link TaskTimeoutException}.</p>
     */
    @Override
    public TaskRecord awaitResult(TaskId taskId, Duration timeout) {
        requireTimeout(timeout);
        TaskEntry entry = entryFor(taskId);
        try {
            return entry.terminal.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new TaskTimeoutException(taskId, timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TaskTimeoutException(taskId, timeout);
        } catch (ExecutionException e) {
            // terminal futures are only ever completed normally
            throw new IllegalStateException("Terminal future failed for task " + taskId.getValue(), e.getCause());
        }
    }

    @Override
    public CompletableFuture<TaskRecord> awaitAsync(TaskId taskId, Duration timeout) {
        requireTimeout(timeout);
        CompletableFuture<TaskRecord> result = new CompletableFuture<>();
        TaskEntry entry;
        try {
            entry = entryFor(taskId);
        } catch (UnknownTaskException e) {
            result.completeExceptionally(e);
            return result;
        }

        entry.terminal.thenApply(record -> record)
            .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
            .whenComplete((record, error) -> {
                if (error == null) {
                    result.complete(record);
                } else {
                    result.completeExceptionally(new TaskTimeoutException(taskId, timeout));
                }
            });
        return result;
    }

    @Override
    public int evictExpired() {
        long now = clock.millis();
        int evicted = 0;
        for (Map.Entry<TaskId, TaskEntry> entry : tasks.entrySet()) {
            if (isExpired(entry.getValue().record, now) && tasks.remove(entry.getKey(), entry.getValue())) {
                evicted++;
            }
        }
        if (evicted > 0) {
            log.debug("Evicted {} expired task records", evicted);
        }
        return evicted;
    }

    @Override
    public int size() {
        long now = clock.millis();
        int count = 0;
        for (TaskEntry entry : tasks.values()) {
            if (!isExpired(entry.record, now)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Removes every record. Contract tests call it after each case.
     */
    public void clear() {
        tasks.clear();
    }

    private TaskEntry entryFor(TaskId taskId) {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        TaskEntry entry = tasks.get(taskId);
        if (entry == null) {
            throw new UnknownTaskException(taskId);
        }
        if (isExpired(entry.record, clock.millis())) {
            tasks.remove(taskId, entry);
            throw new UnknownTaskException(taskId);
        }
        return entry;
    }

    private boolean isExpired(TaskRecord record, long now) {
        if (!record.isTerminal()) {
            return false;
        }
        return now - record.getCompletedAt().orElse(now) > retentionMs;
    }

    private static void requireTimeout(Duration timeout) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be non-negative (current: " + timeout + ")");
        }
    }

    /**
     * Current record of one task plus its one-shot terminal signal.
     */
    private static final class TaskEntry {

        private final long sequence;
        private final CompletableFuture<TaskRecord> terminal = new CompletableFuture<>();
        private volatile TaskRecord record;

        TaskEntry(TaskRecord record, long sequence) {
            this.record = record;
            this.sequence = sequence;
        }

        synchronized TaskRecord update(UnaryOperator<TaskRecord> transition) {
            TaskRecord updated = transition.apply(record);
            record = updated;
            if (updated.isTerminal()) {
                terminal.complete(updated);
            }
            return updated;
        }
    }
}
