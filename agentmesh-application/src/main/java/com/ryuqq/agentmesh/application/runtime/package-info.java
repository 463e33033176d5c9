/**
 * Agent 런타임 계약.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.agentmesh.application.runtime.AgentRuntime} - Task 제출, 결과 조회, 생명주기</li>
 *   <li>{@link com.ryuqq.agentmesh.application.runtime.RuntimeMetrics} - 처리 통계 스냅샷</li>
 * </ul>
 *
 * <p><strong>구현체:</strong></p>
 * <p>구현체는 adapter-runner 모듈의 {@code AgentWorkerRunner}에서 제공됩니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.agentmesh.application.runtime;
