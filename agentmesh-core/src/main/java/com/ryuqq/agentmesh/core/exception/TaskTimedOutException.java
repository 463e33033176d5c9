package com.ryuqq.agentmesh.core.exception;

import com.ryuqq.agentmesh.core.model.TaskId;
import com.ryuqq.agentmesh.core.outcome.TaskError;

/**
 * The task ended in the timed_out status: its processing deadline expired while running.
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public class TaskTimedOutException extends AgentMeshException {

    public static final String CODE = "TASK_TIMED_OUT";

    private final TaskId taskId;
    private final TaskError error;

    public TaskTimedOutException(TaskId taskId, TaskError error) {
        super(CODE, "Task " + taskId.getValue() + " timed out: " + error.message());
        this.taskId = taskId;
        this.error = error;
    }

    public TaskId getTaskId() {
        return taskId;
    }

    public TaskError getError() {
        return error;
    }
}
