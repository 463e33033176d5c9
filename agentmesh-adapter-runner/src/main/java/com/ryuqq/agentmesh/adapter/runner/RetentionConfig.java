package com.ryuqq.agentmesh.adapter.runner;

/**
 * RetentionReaper 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>scanIntervalMs: 만료 Task 정리 주기 (기본 60000ms = 1분)</li>
 *   <li>initialDelayMs: 첫 정리까지의 지연 (기본 60000ms)</li>
 * </ul>
 *
 * <p>보관 기간 자체는 TaskRegistry가 결정합니다. 이 설정은 정리 주기만 제어합니다.</p>
 *
 * @author AgentMesh Team
 * @since 1.0.0
 * @param scanIntervalMs 정리 주기 (밀리초, 양수여야 함)
 * @param initialDelayMs 첫 정리 지연 (밀리초, 0 이상)
 */
public record RetentionConfig(
    long scanIntervalMs,
    long initialDelayMs
) {

    public RetentionConfig() {
        this(60000, 60000);
    }

    public RetentionConfig {
        if (scanIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "scanIntervalMs must be positive (current: " + scanIntervalMs + ")"
            );
        }
        if (initialDelayMs < 0) {
            throw new IllegalArgumentException(
                "initialDelayMs must not be negative (current: " + initialDelayMs + ")"
            );
        }
    }

    /**
     * scanIntervalMs만 변경한 새 인스턴스 생성.
     */
    public RetentionConfig withScanIntervalMs(long scanIntervalMs) {
        return new RetentionConfig(scanIntervalMs, initialDelayMs);
    }

    /**
     * initialDelayMs만 변경한 새 인스턴스 생성.
     */
    public RetentionConfig withInitialDelayMs(long initialDelayMs) {
        return new RetentionConfig(scanIntervalMs, initialDelayMs);
    }
}
