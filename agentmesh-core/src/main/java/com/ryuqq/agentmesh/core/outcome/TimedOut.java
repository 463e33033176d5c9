package com.ryuqq.agentmesh.core.outcome;

/**
 * 처리 마감 시간 초과 결과.
 *
 * <p>{@link Failed} 와 달리 capability 가 오류를 돌려준 것이 아니라
 * 제한 시간 안에 응답하지 않았음을 뜻합니다.</p>
 *
 * @param error 마감 초과 정보
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public record TimedOut(TaskError error) implements TaskOutcome {

    public TimedOut {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
    }
}
