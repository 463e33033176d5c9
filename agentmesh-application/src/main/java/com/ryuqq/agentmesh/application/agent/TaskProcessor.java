package com.ryuqq.agentmesh.application.agent;

import com.ryuqq.agentmesh.core.exception.CapabilityException;

/**
 * Agent 종류별 Task 처리 로직.
 *
 * <p>구현체는 상태를 갖지 않아야 하며 여러 워커 스레드에서 동시에 호출될 수 있습니다.
 * 던진 예외는 런타임이 {@code TaskError}로 기록합니다.</p>
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TaskProcessor {

    /**
     * Task 처리.
     *
     * @param context 입력과 외부 기능
     * @return 채점 전 결과
     * @throws CapabilityException 외부 기능 호출이 실패한 경우
     * @throws IllegalArgumentException 입력이 유효하지 않은 경우
     */
    Draft process(TaskContext context);
}
