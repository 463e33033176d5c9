/**
 * Runner Adapter Layer - AgentRuntime 구현체.
 *
 * <p>이 패키지는 AgentRuntime 인터페이스의 구체적인 구현체와 운영 보조 컴포넌트를 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.agentmesh.adapter.runner.AgentWorkerRunner} - 워커 풀 기반 Task 처리 러너</li>
 *   <li>{@link com.ryuqq.agentmesh.adapter.runner.AgentFactory} - 유형별 Agent 생성</li>
 *   <li>{@link com.ryuqq.agentmesh.adapter.runner.RetentionReaper} - 만료 Task 주기적 정리</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (AgentWorkerRunner, AgentFactory, RetentionReaper)
 *   ↓ implements
 * application (AgentRuntime, TaskProcessor, CommunicationHandler)
 *   ↓ depends on
 * core (Envelope, TaskRecord, TaskOutcome, RuntimeState)
 *   ↓ depends on
 * core/spi (TaskRegistry, Transport, CompletionCapability, MemoryCapability)
 * </pre>
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
package com.ryuqq.agentmesh.adapter.runner;
