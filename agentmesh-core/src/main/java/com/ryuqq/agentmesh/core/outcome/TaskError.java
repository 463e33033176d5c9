package com.ryuqq.agentmesh.core.outcome;

import com.ryuqq.agentmesh.core.exception.AgentMeshException;
import com.ryuqq.agentmesh.core.model.Payload;

/**
 * Task 처리 중 포착된 오류.
 *
 * <p>원인 예외의 코드와 메시지를 그대로 보존하여 {@code getTaskResult} 호출자에게
 * 가공 없이 전달합니다.</p>
 *
 * @param code 오류 코드 (예: QUOTA_EXCEEDED, PROCESSING_ERROR, AGENT_STOPPED)
 * @param message 오류 메시지
 * @param exceptionType 원인 예외의 클래스명 (선택, null 가능)
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public record TaskError(
    String code,
    String message,
    String exceptionType
) {

    public static final String PROCESSING_ERROR = "PROCESSING_ERROR";
    public static final String AGENT_STOPPED = "AGENT_STOPPED";
    public static final String DEADLINE_EXCEEDED = "DEADLINE_EXCEEDED";

    public TaskError {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("code cannot be null or blank");
        }
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        // exceptionType은 null 허용
    }

    public static TaskError of(String code, String message) {
        return new TaskError(code, message, null);
    }

    /**
     * 예외로부터 TaskError 생성.
     *
     * <p>{@link AgentMeshException} 이면 그 오류 코드를 유지하고,
     * 그 외에는 {@link #PROCESSING_ERROR} 로 분류합니다.</p>
     *
     * @param cause 원인 예외
     * @return TaskError
     * @throws IllegalArgumentException cause가 null인 경우
     */
    public static TaskError from(Throwable cause) {
        if (cause == null) {
            throw new IllegalArgumentException("cause cannot be null");
        }
        String code = cause instanceof AgentMeshException agentMesh
            ? agentMesh.getErrorCode()
            : PROCESSING_ERROR;
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new TaskError(code, message, cause.getClass().getName());
    }

    /**
     * 응답 envelope 에 실을 payload 표현.
     *
     * @return code, message 를 담은 Payload
     */
    public Payload toPayload() {
        return Payload.of("code", code, "message", message);
    }
}
