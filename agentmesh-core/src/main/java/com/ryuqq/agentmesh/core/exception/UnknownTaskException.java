package com.ryuqq.agentmesh.core.exception;

import com.ryuqq.agentmesh.core.model.TaskId;

/**
 * The task id was never issued or its record has been evicted.
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public class UnknownTaskException extends AgentMeshException {

    public static final String CODE = "UNKNOWN_TASK";

    private final TaskId taskId;

    public UnknownTaskException(TaskId taskId) {
        super(CODE, "Unknown task: " + taskId.getValue());
        this.taskId = taskId;
    }

    public TaskId getTaskId() {
        return taskId;
    }
}
