package com.ryuqq.agentmesh.application.runtime;

import com.ryuqq.agentmesh.core.exception.NotStartedException;
import com.ryuqq.agentmesh.core.exception.TaskFailedException;
import com.ryuqq.agentmesh.core.exception.TaskTimedOutException;
import com.ryuqq.agentmesh.core.exception.TaskTimeoutException;
import com.ryuqq.agentmesh.core.exception.UnknownTaskException;
import com.ryuqq.agentmesh.core.model.AgentId;
import com.ryuqq.agentmesh.core.model.Payload;
import com.ryuqq.agentmesh.core.model.TaskId;
import com.ryuqq.agentmesh.core.outcome.TaskOutput;
import com.ryuqq.agentmesh.core.statemachine.RuntimeState;

import java.time.Duration;

/**
 * An agent that accepts tasks and processes them in the background.
 *
 * <p>The runtime owns a task queue and a pool of workers. Callers submit work with
 * {@link #submitTask(Payload)} and later collect it with {@link #getTaskResult(TaskId, Duration)};
 * neither call ever blocks on the external capability that performs the work.</p>
 *
 * <p><strong>Lifecycle:</strong></p>
 * <pre>
 * STOPPED --start()--&gt; STARTING --&gt; RUNNING --stop()--&gt; STOPPING --&gt; STOPPED
 * </pre>
 * <p>A stopped runtime may be started again.</p>
 *
 * <p><strong>Task Flow:</strong></p>
 * <pre>
 * submitTask(input)
 *   1. registry.create(owner, input)            pending
 *   2. worker picks the task, markRunning       running
 *   3. processor runs within the task deadline
 *      - success    → complete(scored output)   completed
 *      - error      → fail(error)               failed
 *      - deadline   → timeOut(error)            timed_out
 * </pre>
 *
 * <p><strong>Shutdown:</strong> {@link #stop()} refuses new tasks, lets queued tasks drain for a bounded
 * time, and fails whatever never started so that no waiter is left hanging.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * AgentRuntime agent = factory.create(AgentType.RESEARCH, AgentId.of("researcher-1"));
 * agent.start();
 * TaskId taskId = agent.submitTask(Payload.of("query", "state of solid-state batteries"));
 * TaskOutput output = agent.getTaskResult(taskId, Duration.ofSeconds(30));
 * agent.stop();
 * </pre>
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public interface AgentRuntime {

    AgentId agentId();

    RuntimeState state();

    /**
     * Starts the workers and, when messaging is configured, registers the agent's inbox.
     *
     * @throws IllegalStateException if the runtime is not stopped
     */
    void start();

    /**
     * Stops accepting work and shuts the workers down.
     *
     * <p>Idempotent: stopping a stopped runtime does nothing.</p>
     */
    void stop();

    /**
     * Queues a task.
     *
     * @param input task input
     * @return the id of the created task (status pending)
     * @throws NotStartedException if the runtime is not running
     */
    TaskId submitTask(Payload input);

    /**
     * Waits for a task to finish.
     *
     * @param taskId task to wait for
     * @param timeout maximum time to wait
     * @return the output of a completed task
     * @throws TaskTimeoutException if the task is still unfinished after {@code timeout}
     * @throws TaskFailedException if the task failed
     * @throws TaskTimedOutException if the task exceeded its processing deadline
     * @throws UnknownTaskException if the id is unknown or already evicted
     */
    TaskOutput getTaskResult(TaskId taskId, Duration timeout);

    RuntimeMetrics metrics();
}
