package com.ryuqq.agentmesh.application.messaging;

import com.ryuqq.agentmesh.core.model.AgentId;

import java.util.Set;

/**
 * CommunicationHandler 상태 스냅샷.
 *
 * @author AgentMesh Team
 * @since 1.0.0
 * @param registeredAgents 현재 등록된 Agent 집합
 * @param outstandingRequests 응답을 기다리는 요청 수
 * @param historySize 보관 중인 전송 이력 수
 * @param transportConnected Transport 연결 여부
 */
public record HandlerStatus(
    Set<AgentId> registeredAgents,
    int outstandingRequests,
    int historySize,
    boolean transportConnected
) {

    public HandlerStatus {
        registeredAgents = registeredAgents == null ? Set.of() : Set.copyOf(registeredAgents);
    }
}
