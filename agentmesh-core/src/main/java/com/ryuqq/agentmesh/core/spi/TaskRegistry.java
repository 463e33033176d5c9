package com.ryuqq.agentmesh.core.spi;

import com.ryuqq.agentmesh.core.model.AgentId;
import com.ryuqq.agentmesh.core.model.Payload;
import com.ryuqq.agentmesh.core.model.TaskId;
import com.ryuqq.agentmesh.core.model.TaskRecord;
import com.ryuqq.agentmesh.core.outcome.TaskError;
import com.ryuqq.agentmesh.core.outcome.TaskOutput;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Task bookkeeping SPI.
 *
 * <p>Tracks submitted work per agent and lets any number of callers wait for a task's
 * terminal status with a timeout.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: transitions and lookups may race freely</li>
 *   <li>Guarded transitions: every status change goes through
 *       {@link com.ryuqq.agentmesh.core.statemachine.TaskTransition}; leaving a terminal status raises
 *       {@link com.ryuqq.agentmesh.core.exception.InvalidTransitionException}</li>
 *   <li>Broadcast wake-up: every waiter on a task is released when it terminates</li>
 *   <li>Retention: terminal records disappear after a bounded window; afterwards the id is unknown</li>
 * </ul>
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public interface TaskRegistry {

    /**
     * Allocates a new record in {@code pending} status.
     *
     * @param owner owning agent
     * @param input opaque task input
     * @return the new task id
     * @throws IllegalArgumentException if owner or input is null
     */
    TaskId create(AgentId owner, Payload input);

    /**
     * Moves a pending task to {@code running}.
     *
     * @param taskId task id
     * @return the updated record
     * @throws com.ryuqq.agentmesh.core.exception.UnknownTaskException if the id is unknown or evicted
     * @throws com.ryuqq.agentmesh.core.exception.InvalidTransitionException if the task is not pending
     */
    TaskRecord markRunning(TaskId taskId);

    /**
     * Moves a running task to {@code completed}.
     *
     * @param taskId task id
     * @param output task output
     * @return the updated record
     * @throws com.ryuqq.agentmesh.core.exception.UnknownTaskException if the id is unknown or evicted
     * @throws com.ryuqq.agentmesh.core.exception.InvalidTransitionException if the task is not running
     */
    TaskRecord complete(TaskId taskId, TaskOutput output);

    /**
     * Moves a pending or running task to {@code failed}.
     *
     * @param taskId task id
     * @param error captured error
     * @return the updated record
     * @throws com.ryuqq.agentmesh.core.exception.UnknownTaskException if the id is unknown or evicted
     * @throws com.ryuqq.agentmesh.core.exception.InvalidTransitionException if the task is already terminal
     */
    TaskRecord fail(TaskId taskId, TaskError error);

    /**
     * Moves a running task to {@code timed_out}.
     *
     * @param taskId task id
     * @param error deadline information
     * @return the updated record
     * @throws com.ryuqq.agentmesh.core.exception.UnknownTaskException if the id is unknown or evicted
     * @throws com.ryuqq.agentmesh.core.exception.InvalidTransitionException if the task is not running
     */
    TaskRecord timeOut(TaskId taskId, TaskError error);

    /**
     * Looks up the current snapshot of a task.
     *
     * @param taskId task id
     * @return current record
     * @throws com.ryuqq.agentmesh.core.exception.UnknownTaskException if the id is unknown or evicted
     */
    TaskRecord find(TaskId taskId);

    /**
     * Lists the records owned by an agent, oldest submission first.
     *
     * @param owner owning agent
     * @return records (possibly empty)
     */
    List<TaskRecord> findByOwner(AgentId owner);

    /**
     * Blocks until the task is terminal or the timeout elapses.
     *
     * <p>A timeout leaves the record untouched; a later call observes the eventual outcome.</p>
     *
     * @param taskId task id
     * @param timeout maximum wait
     * @return the terminal record
     * @throws com.ryuqq.agentmesh.core.exception.UnknownTaskException if the id is unknown or evicted
     * @throws com.ryuqq.agentmesh.core.exception.TaskTimeoutException if the timeout elapses first
     */
    TaskRecord awaitResult(TaskId taskId, Duration timeout);

    /**
     * Non-blocking form of {@link #awaitResult(TaskId, Duration)}.
     *
     * <p>The future completes with the terminal record, or exceptionally with
     * {@link com.ryuqq.agentmesh.core.exception.TaskTimeoutException} or
     * {@link com.ryuqq.agentmesh.core.exception.UnknownTaskException}.</p>
     *
     * @param taskId task id
     * @param timeout maximum wait
     * @return future of the terminal record
     */
    CompletableFuture<TaskRecord> awaitAsync(TaskId taskId, Duration timeout);

    /**
     * Removes terminal records whose retention window has passed.
     *
     * @return number of evicted records
     */
    int evictExpired();

    /**
     * @return number of records currently retained
     */
    int size();
}
