package com.ryuqq.agentmesh.application.agent;

import com.ryuqq.agentmesh.core.model.Payload;

import java.util.List;

/**
 * TaskProcessor가 만든 채점 전 결과.
 *
 * <p>런타임이 {@link ConfidenceScorer}로 신뢰도를 매긴 뒤 TaskOutput으로 확정합니다.</p>
 *
 * @author AgentMesh Team
 * @since 1.0.0
 * @param text 생성된 본문
 * @param sources 본문에서 찾은 출처 목록
 * @param extra 처리기별 부가 항목
 */
public record Draft(String text, List<String> sources, Payload extra) {

    public Draft {
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        sources = sources == null ? List.of() : List.copyOf(sources);
        extra = extra == null ? Payload.empty() : extra;
    }

    public static Draft of(String text) {
        return new Draft(text, List.of(), Payload.empty());
    }

    /**
     * 부가 항목에 본문(text)과 출처(sources)를 더한 Payload.
     */
    public Payload toPayload() {
        return extra.with("text", text).with("sources", sources);
    }
}
