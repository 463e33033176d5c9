package com.ryuqq.agentmesh.core.exception;

import com.ryuqq.agentmesh.core.model.TaskId;
import com.ryuqq.agentmesh.core.outcome.TaskError;

/**
 * The task ended in the failed status. The captured error is preserved verbatim.
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public class TaskFailedException extends AgentMeshException {

    public static final String CODE = "TASK_FAILED";

    private final TaskId taskId;
    private final TaskError error;

    public TaskFailedException(TaskId taskId, TaskError error) {
        super(CODE, "Task " + taskId.getValue() + " failed: " + error.code() + " - " + error.message());
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
