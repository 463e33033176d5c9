package com.ryuqq.agentmesh.core.protection;

import java.util.concurrent.ThreadLocalRandom;

/**
 * 지수 백오프 + Jitter 지연 계산기.
 *
 * <p>전송 계층이 일시적으로 끊겼을 때 구독 재시도 간격을 정하는 데 사용됩니다.
 * 전송 계층 자체는 재시도하지 않으며, 재시도 정책은 호출자가 이 계산기로 결정합니다.</p>
 *
 * <pre>
 * delay = min(baseDelay * 2^(attempt-1) + jitter, maxDelay)
 * jitter = random(0, exponential * jitterFactor)
 * </pre>
 *
 * <p><strong>예시 (baseDelay=50ms, maxDelay=2000ms, jitterFactor=0.1):</strong></p>
 * <ul>
 *   <li>attempt=1: 50~55ms</li>
 *   <li>attempt=2: 100~110ms</li>
 *   <li>attempt=7: 2000ms (상한)</li>
 * </ul>
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public final class BackoffCalculator {

    private static final int MAX_SHIFT = 30;

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;

    /**
     * 기본값: baseDelay=50ms, maxDelay=2000ms, jitterFactor=0.1
     */
    public BackoffCalculator() {
        this(50, 2000, 0.1);
    }

    /**
     * @param baseDelayMs 첫 재시도 지연 (밀리초, 양수)
     * @param maxDelayMs 최대 지연 (밀리초, baseDelayMs 이상)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be positive (current: " + baseDelayMs + ")");
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")");
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
    }

    /**
     * 재시도 전 대기 시간 계산.
     *
     * @param attempt 실패한 시도 횟수 (1부터 시작)
     * @return 대기 시간 (밀리초)
     * @throws IllegalArgumentException attempt가 양수가 아닌 경우
     */
    public long calculate(int attempt) {
        if (attempt <= 0) {
            throw new IllegalArgumentException("attempt must be positive (current: " + attempt + ")");
        }
        int shift = Math.min(attempt - 1, MAX_SHIFT);
        long exponential = baseDelayMs > (maxDelayMs >> shift)
            ? maxDelayMs
            : Math.min(baseDelayMs << shift, maxDelayMs);
        long jitter = jitterFactor == 0.0
            ? 0L
            : (long) (exponential * jitterFactor * ThreadLocalRandom.current().nextDouble());
        return Math.min(exponential + jitter, maxDelayMs);
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }
}
