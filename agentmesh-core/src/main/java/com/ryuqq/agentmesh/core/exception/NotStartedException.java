package com.ryuqq.agentmesh.core.exception;

import com.ryuqq.agentmesh.core.statemachine.RuntimeState;

/**
 * Work was submitted to a runtime that is not in the running state.
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public class NotStartedException extends AgentMeshException {

    public static final String CODE = "NOT_STARTED";

    private final RuntimeState state;

    public NotStartedException(RuntimeState state) {
        super(CODE, "Agent runtime is not running (state: " + state + ")");
        this.state = state;
    }

    public RuntimeState getState() {
        return state;
    }
}
