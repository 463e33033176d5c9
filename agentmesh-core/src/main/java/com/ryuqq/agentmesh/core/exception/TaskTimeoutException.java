package com.ryuqq.agentmesh.core.exception;

import com.ryuqq.agentmesh.core.model.TaskId;

import java.time.Duration;

/**
 * The caller stopped waiting before the task reached a terminal status.
 *
 * <p>The task itself is unaffected and may still complete later.</p>
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public class TaskTimeoutException extends AgentMeshException {

    public static final String CODE = "TASK_TIMEOUT";

    private final TaskId taskId;

    public TaskTimeoutException(TaskId taskId, Duration timeout) {
        super(CODE, "Task " + taskId.getValue() + " did not finish within " + timeout.toMillis() + "ms");
        this.taskId = taskId;
    }

    public TaskId getTaskId() {
        return taskId;
    }
}
