package com.ryuqq.agentmesh.core.outcome;

import com.ryuqq.agentmesh.core.model.Payload;

/**
 * 성공한 Task의 산출물.
 *
 * @param result 구조화된 결과 (content, sources 등)
 * @param confidence 결과 품질 점수 (0.0 ~ 1.0)
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public record TaskOutput(Payload result, double confidence) {

    public TaskOutput {
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0 (current: " + confidence + ")");
        }
    }

    /**
     * 점수 없는 산출물 생성.
     *
     * @param result 결과
     * @return confidence 0.0 인 TaskOutput
     */
    public static TaskOutput of(Payload result) {
        return new TaskOutput(result, 0.0);
    }

    /**
     * 결과 payload 에 confidence 를 포함한 응답용 표현.
     *
     * @return result + confidence
     */
    public Payload toPayload() {
        return result.with("confidence", confidence);
    }
}
