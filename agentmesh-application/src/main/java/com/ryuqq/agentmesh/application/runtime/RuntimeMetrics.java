package com.ryuqq.agentmesh.application.runtime;

import com.ryuqq.agentmesh.core.statemachine.RuntimeState;

/**
 * Agent 처리 통계 스냅샷.
 *
 * @author AgentMesh Team
 * @since 1.0.0
 * @param state 스냅샷 시점의 런타임 상태
 * @param tasksCompleted 완료된 Task 수
 * @param tasksFailed 실패한 Task 수
 * @param tasksTimedOut 처리 기한을 넘긴 Task 수
 * @param totalProcessingTimeMs 처리에 사용된 누적 시간 (밀리초)
 * @param lastActivityAt 마지막 Task 종료 시각 (epoch millis, 없으면 0)
 */
public record RuntimeMetrics(
    RuntimeState state,
    long tasksCompleted,
    long tasksFailed,
    long tasksTimedOut,
    long totalProcessingTimeMs,
    long lastActivityAt
) {

    public RuntimeMetrics {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
    }

    /**
     * 종료 상태에 도달한 Task 총 수.
     */
    public long tasksProcessed() {
        return tasksCompleted + tasksFailed + tasksTimedOut;
    }

    /**
     * Task 하나당 평균 처리 시간 (밀리초, 처리 이력이 없으면 0).
     */
    public double averageProcessingTimeMs() {
        long processed = tasksProcessed();
        return processed == 0 ? 0.0 : (double) totalProcessingTimeMs / processed;
    }
}
