package com.ryuqq.agentmesh.adapter.runner;

import com.ryuqq.agentmesh.core.spi.CompletionOptions;

/**
 * AgentWorkerRunner 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>concurrency: 동시 처리 워커 수 (기본 1, 제출 순서대로 하나씩 처리)</li>
 *   <li>taskDeadlineMs: Task 하나의 최대 처리 시간 (기본 60000ms = 60초)</li>
 *   <li>shutdownTimeoutMs: stop() 시 큐가 비워지기를 기다리는 시간 (기본 30000ms)</li>
 *   <li>completionOptions: 처리기에 전달할 생성 옵션 (기본 temperature 0.7, maxTokens 2048)</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>처리량: concurrency 증가 (1 → 4), 외부 기능의 호출 한도 안에서</li>
 *   <li>응답성: taskDeadlineMs 감소, 느린 호출은 timed_out으로 정리</li>
 * </ul>
 *
 * @author AgentMesh Team
 * @since 1.0.0
 * @param concurrency 워커 스레드 수 (1 이상)
 * @param taskDeadlineMs Task 처리 기한 (밀리초, 양수)
 * @param shutdownTimeoutMs 종료 대기 시간 (밀리초, 0 이상)
 * @param completionOptions 생성 옵션 (null 불가)
 */
public record RuntimeConfig(
    int concurrency,
    long taskDeadlineMs,
    long shutdownTimeoutMs,
    CompletionOptions completionOptions
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: concurrency=1, taskDeadlineMs=60000ms, shutdownTimeoutMs=30000ms,
     * completionOptions=기본 CompletionOptions</p>
     */
    public RuntimeConfig() {
        this(1, 60000, 30000, new CompletionOptions());
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RuntimeConfig {
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
        }
        if (taskDeadlineMs <= 0) {
            throw new IllegalArgumentException(
                "taskDeadlineMs must be positive (current: " + taskDeadlineMs + ")"
            );
        }
        if (shutdownTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must not be negative (current: " + shutdownTimeoutMs + ")"
            );
        }
        if (completionOptions == null) {
            throw new IllegalArgumentException("completionOptions cannot be null");
        }
    }

    public RuntimeConfig withConcurrency(int concurrency) {
        return new RuntimeConfig(concurrency, taskDeadlineMs, shutdownTimeoutMs, completionOptions);
    }

    public RuntimeConfig withTaskDeadlineMs(long taskDeadlineMs) {
        return new RuntimeConfig(concurrency, taskDeadlineMs, shutdownTimeoutMs, completionOptions);
    }

    public RuntimeConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new RuntimeConfig(concurrency, taskDeadlineMs, shutdownTimeoutMs, completionOptions);
    }

    public RuntimeConfig withCompletionOptions(CompletionOptions completionOptions) {
        return new RuntimeConfig(concurrency, taskDeadlineMs, shutdownTimeoutMs, completionOptions);
    }
}
