package com.ryuqq.agentmesh.application.messaging;

import com.ryuqq.agentmesh.core.protection.BackoffCalculator;

import java.time.Duration;

/**
 * CommunicationHandler 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>defaultRequestTimeoutMs: timeout 없이 호출된 요청의 응답 대기 시간 (기본 30000ms)</li>
 *   <li>subscribeMaxAttempts: 구독 실패 시 최대 시도 횟수 (기본 5)</li>
 *   <li>subscribeBackoffBaseMs / subscribeBackoffMaxMs: 구독 재시도 간격 (기본 50ms / 2000ms)</li>
 *   <li>historyLimit: 보관할 최대 전송 이력 수 (기본 1000)</li>
 *   <li>historyRetain: 한도 초과 시 남길 이력 수 (기본 500)</li>
 * </ul>
 *
 * @author AgentMesh Team
 * @since 1.0.0
 * @param defaultRequestTimeoutMs 기본 요청 타임아웃 (밀리초, 양수)
 * @param subscribeMaxAttempts 구독 최대 시도 횟수 (1 이상)
 * @param subscribeBackoffBaseMs 재시도 기본 지연 (밀리초, 양수)
 * @param subscribeBackoffMaxMs 재시도 최대 지연 (밀리초, base 이상)
 * @param historyLimit 이력 상한 (1 이상)
 * @param historyRetain 트리밍 후 남길 이력 수 (0 이상, historyLimit 이하)
 */
public record MessagingConfig(
    long defaultRequestTimeoutMs,
    int subscribeMaxAttempts,
    long subscribeBackoffBaseMs,
    long subscribeBackoffMaxMs,
    int historyLimit,
    int historyRetain
) {

    /**
     * 기본 설정 생성자.
     */
    public MessagingConfig() {
        this(30000, 5, 50, 2000, 1000, 500);
    }

    public MessagingConfig {
        if (defaultRequestTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "defaultRequestTimeoutMs must be positive (current: " + defaultRequestTimeoutMs + ")"
            );
        }
        if (subscribeMaxAttempts <= 0) {
            throw new IllegalArgumentException(
                "subscribeMaxAttempts must be positive (current: " + subscribeMaxAttempts + ")"
            );
        }
        if (subscribeBackoffBaseMs <= 0) {
            throw new IllegalArgumentException(
                "subscribeBackoffBaseMs must be positive (current: " + subscribeBackoffBaseMs + ")"
            );
        }
        if (subscribeBackoffMaxMs < subscribeBackoffBaseMs) {
            throw new IllegalArgumentException(
                "subscribeBackoffMaxMs must be >= subscribeBackoffBaseMs (current: " + subscribeBackoffMaxMs + ")"
            );
        }
        if (historyLimit <= 0) {
            throw new IllegalArgumentException(
                "historyLimit must be positive (current: " + historyLimit + ")"
            );
        }
        if (historyRetain < 0 || historyRetain > historyLimit) {
            throw new IllegalArgumentException(
                "historyRetain must be between 0 and historyLimit (current: " + historyRetain + ")"
            );
        }
    }

    public Duration defaultRequestTimeout() {
        return Duration.ofMillis(defaultRequestTimeoutMs);
    }

    /**
     * 구독 재시도용 BackoffCalculator 생성 (jitter 10%).
     */
    public BackoffCalculator subscribeBackoff() {
        return new BackoffCalculator(subscribeBackoffBaseMs, subscribeBackoffMaxMs, 0.1);
    }

    public MessagingConfig withDefaultRequestTimeoutMs(long defaultRequestTimeoutMs) {
        return new MessagingConfig(defaultRequestTimeoutMs, subscribeMaxAttempts, subscribeBackoffBaseMs,
            subscribeBackoffMaxMs, historyLimit, historyRetain);
    }

    public MessagingConfig withSubscribeMaxAttempts(int subscribeMaxAttempts) {
        return new MessagingConfig(defaultRequestTimeoutMs, subscribeMaxAttempts, subscribeBackoffBaseMs,
            subscribeBackoffMaxMs, historyLimit, historyRetain);
    }

    public MessagingConfig withSubscribeBackoff(long subscribeBackoffBaseMs, long subscribeBackoffMaxMs) {
        return new MessagingConfig(defaultRequestTimeoutMs, subscribeMaxAttempts, subscribeBackoffBaseMs,
            subscribeBackoffMaxMs, historyLimit, historyRetain);
    }

    /**
     * 이력 상한과 트리밍 후 보관 수를 함께 변경한 새 인스턴스 생성.
     */
    public MessagingConfig withHistory(int historyLimit, int historyRetain) {
        return new MessagingConfig(defaultRequestTimeoutMs, subscribeMaxAttempts, subscribeBackoffBaseMs,
            subscribeBackoffMaxMs, historyLimit, historyRetain);
    }
}
