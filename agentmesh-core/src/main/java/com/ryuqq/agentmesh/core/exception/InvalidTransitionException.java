package com.ryuqq.agentmesh.core.exception;

import com.ryuqq.agentmesh.core.statemachine.TaskStatus;

/**
 * A task status change that the state machine does not allow, typically out of a terminal status.
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public class InvalidTransitionException extends AgentMeshException {

    public static final String CODE = "INVALID_TRANSITION";

    private final TaskStatus from;
    private final TaskStatus to;

    public InvalidTransitionException(TaskStatus from, TaskStatus to) {
        super(CODE, String.format("Invalid task transition: %s → %s%s",
            from, to, from.isTerminal() ? " (terminal status)" : ""));
        this.from = from;
        this.to = to;
    }

    public TaskStatus getFrom() {
        return from;
    }

    public TaskStatus getTo() {
        return to;
    }
}
