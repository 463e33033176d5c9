package com.ryuqq.agentmesh.core.outcome;

/**
 * 영구 실패 결과.
 *
 * <p>외부 capability 가 오류를 반환했거나, 처리 중 예외가 발생했거나,
 * 실행 전에 런타임이 정지된 경우입니다.</p>
 *
 * @param error 포착된 오류
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public record Failed(TaskError error) implements TaskOutcome {

    public Failed {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
    }
}
