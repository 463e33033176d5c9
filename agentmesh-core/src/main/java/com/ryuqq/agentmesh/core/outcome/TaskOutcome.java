package com.ryuqq.agentmesh.core.outcome;

/**
 * 종료된 Task의 결과.
 *
 * <ul>
 *   <li>{@link Completed}: 성공, {@link TaskOutput} 보유</li>
 *   <li>{@link Failed}: 처리 오류, {@link TaskError} 보유</li>
 *   <li>{@link TimedOut}: 처리 마감 초과, {@link TaskError} 보유</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 결과 종류가 컴파일 타임에 닫혀 있습니다.</p>
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public sealed interface TaskOutcome permits Completed, Failed, TimedOut {

    default boolean isCompleted() {
        return this instanceof Completed;
    }

    default boolean isFailed() {
        return this instanceof Failed;
    }

    default boolean isTimedOut() {
        return this instanceof TimedOut;
    }
}
