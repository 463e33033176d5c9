package com.ryuqq.agentmesh.core.outcome;

/**
 * 성공 결과.
 *
 * @param output Task 산출물
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public record Completed(TaskOutput output) implements TaskOutcome {

    public Completed {
        if (output == null) {
            throw new IllegalArgumentException("output cannot be null");
        }
    }
}
