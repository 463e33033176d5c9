package com.ryuqq.agentmesh.application.agent;

/**
 * 처리 결과의 신뢰도를 [0, 1] 범위로 매기는 순수 함수.
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ConfidenceScorer {

    /**
     * @param text 생성된 본문 (null은 빈 문자열로 취급)
     * @param sourceCount 본문이 인용한 출처 수
     * @return 0.0 이상 1.0 이하의 신뢰도
     */
    double score(String text, int sourceCount);

    default double score(Draft draft) {
        return score(draft.text(), draft.sources().size());
    }
}
