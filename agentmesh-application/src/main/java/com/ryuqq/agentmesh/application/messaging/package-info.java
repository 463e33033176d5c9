/**
 * Agent 간 메시지 라우팅.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.agentmesh.application.messaging.CommunicationHandler} - 등록, 전송, 요청/응답 상관관계, 브로드캐스트</li>
 *   <li>{@link com.ryuqq.agentmesh.application.messaging.MessagingConfig} - 타임아웃, 구독 재시도, 이력 한도 설정</li>
 *   <li>{@link com.ryuqq.agentmesh.application.messaging.HandlerStatus} - 상태 스냅샷</li>
 * </ul>
 *
 * <p>Transport 구현은 adapter 모듈이 제공합니다 (예: {@code InMemoryTransport}).</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.agentmesh.application.messaging;
