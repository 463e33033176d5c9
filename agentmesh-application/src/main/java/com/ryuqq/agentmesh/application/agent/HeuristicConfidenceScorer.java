package com.ryuqq.agentmesh.application.agent;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 본문 길이, 출처 수, 불확실 표현 수로 신뢰도를 계산하는 기본 채점기.
 *
 * <p><strong>계산식:</strong></p>
 * <pre>
 * 빈 본문 → 0.0
 * score = 0.5
 *       + 0.2  * min(len(trim(text)) / 2000, 1)
 *       + 0.05 * min(sourceCount, 5)
 *       - 0.05 * min(hedgeCount, 5)
 * → [0, 1]로 제한 후 소수 둘째 자리 반올림 (HALF_UP)
 * </pre>
 *
 * <p>hedgeCount는 might, may, possibly, perhaps, unclear, uncertain, probably,
 * "not sure", "it is possible" 의 단어 단위 출현 횟수입니다 (대소문자 무시).</p>
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public final class HeuristicConfidenceScorer implements ConfidenceScorer {

    static final double BASE_SCORE = 0.5;
    static final int FULL_LENGTH = 2000;
    static final int MAX_COUNTED = 5;

    private static final Pattern HEDGES = Pattern.compile(
        "\\b(might|may|possibly|perhaps|unclear|uncertain|probably|not\\s+sure|it\\s+is\\s+possible)\\b",
        Pattern.CASE_INSENSITIVE
    );

    @Override
    public double score(String text, int sourceCount) {
        if (sourceCount < 0) {
            throw new IllegalArgumentException("sourceCount must be non-negative (current: " + sourceCount + ")");
        }
        if (text == null || text.isBlank()) {
            return 0.0;
        }
        String trimmed = text.trim();
        double lengthFactor = Math.min((double) trimmed.length() / FULL_LENGTH, 1.0);
        double score = BASE_SCORE
            + 0.2 * lengthFactor
            + 0.05 * Math.min(sourceCount, MAX_COUNTED)
            - 0.05 * Math.min(countHedges(trimmed), MAX_COUNTED);
        double clamped = Math.max(0.0, Math.min(1.0, score));
        return BigDecimal.valueOf(clamped).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    static int countHedges(String text) {
        Matcher matcher = HEDGES.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
