package com.ryuqq.agentmesh.core.statemachine;

/**
 * Task의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * PENDING
 *    │
 *    ├─► RUNNING (워커가 집어감)
 *    │      ├─► COMPLETED (성공)
 *    │      ├─► FAILED (처리 오류)
 *    │      └─► TIMED_OUT (마감 시간 초과)
 *    │
 *    └─► FAILED (실행 전 런타임 정지)
 * </pre>
 *
 * <p>COMPLETED, FAILED, TIMED_OUT 은 종료 상태이며 이후 어떤 전이도 허용되지 않습니다.</p>
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public enum TaskStatus {

    /**
     * 대기 중 (큐에 적재됨).
     */
    PENDING("pending"),

    /**
     * 워커가 처리 중.
     */
    RUNNING("running"),

    /**
     * 성공적으로 완료.
     */
    COMPLETED("completed"),

    /**
     * 실패 (영구).
     */
    FAILED("failed"),

    /**
     * 처리 마감 시간 초과.
     */
    TIMED_OUT("timed_out");

    private final String wireValue;

    TaskStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    /**
     * 응답 payload 등에 사용되는 소문자 표기.
     *
     * @return 소문자 상태값
     */
    public String wireValue() {
        return wireValue;
    }

    /**
     * 종료 상태인지 확인.
     *
     * @return COMPLETED, FAILED, TIMED_OUT 인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == TIMED_OUT;
    }
}
