package com.ryuqq.agentmesh.core.contract;

import com.ryuqq.agentmesh.core.model.AgentId;
import com.ryuqq.agentmesh.core.model.MessageId;
import com.ryuqq.agentmesh.core.model.MessageKind;
import com.ryuqq.agentmesh.core.model.Payload;

/**
 * Agent 간에 교환되는 불변 메시지 봉투 (Envelope).
 *
 * <p>Envelope은 발신자, 수신자, 종류, Payload에 고유 ID와 생성 시각을 더한
 * 값 객체입니다. 생성 후에는 어떤 필드도 변경되지 않습니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>id:</strong> 전역 고유 식별자 (생성 시 할당, 재사용 불가)</li>
 *   <li><strong>from / to:</strong> 발신/수신 Agent ({@code to} 는 {@link AgentId#BROADCAST} 가능)</li>
 *   <li><strong>kind:</strong> request, response, broadcast, notification</li>
 *   <li><strong>payload:</strong> 전송 계층이 해석하지 않는 구조화 데이터</li>
 *   <li><strong>correlationId:</strong> 응답 대상 요청의 id (최상위 요청/브로드캐스트는 null)</li>
 *   <li><strong>createdAt:</strong> 생성 시각 (epoch milliseconds)</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Envelope request = Envelope.request(agentA, agentB, Payload.of("topic", "x"));
 * Envelope reply = Envelope.response(request, agentB, Payload.of("ack", true));
 * // reply.correlationId() == request.id()
 * </pre>
 *
 * <p>정적 팩토리는 알려진 {@link MessageKind} 만 허용합니다. canonical 생성자는
 * 와이어에서 복원할 때 사용되며 알 수 없는 kind도 그대로 보존합니다.</p>
 *
 * @param id 고유 식별자
 * @param from 발신 Agent
 * @param to 수신 Agent
 * @param kind 메시지 종류
 * @param payload 데이터
 * @param correlationId 응답 대상 요청 id (null 허용)
 * @param createdAt 생성 시각 (epoch millis)
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public record Envelope(
    MessageId id,
    AgentId from,
    AgentId to,
    MessageKind kind,
    Payload payload,
    MessageId correlationId,
    long createdAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 createdAt이 음수이거나,
     *         response에 correlationId가 없는 경우
     */
    public Envelope {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (from == null) {
            throw new IllegalArgumentException("from cannot be null");
        }
        if (from.isBroadcast()) {
            throw new IllegalArgumentException("from cannot be the broadcast address");
        }
        if (to == null) {
            throw new IllegalArgumentException("to cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        if (createdAt < 0) {
            throw new IllegalArgumentException("createdAt must be non-negative (current: " + createdAt + ")");
        }
        if (kind.isResponse() && correlationId == null) {
            throw new IllegalArgumentException("response envelope requires a correlationId");
        }
    }

    /**
     * 알려진 kind로 새 Envelope 생성 (id와 생성 시각 자동 할당).
     *
     * @param from 발신 Agent
     * @param to 수신 Agent
     * @param kind 메시지 종류 (알려진 값만 허용)
     * @param payload 데이터
     * @param correlationId 응답 대상 요청 id (null 허용)
     * @return 생성된 Envelope
     * @throws IllegalArgumentException kind가 알려진 값이 아니거나 필드 검증에 실패한 경우
     */
    public static Envelope create(AgentId from, AgentId to, MessageKind kind, Payload payload, MessageId correlationId) {
        if (kind == null || !kind.isKnown()) {
            throw new IllegalArgumentException("kind must be one of request, response, broadcast, notification (current: " + kind + ")");
        }
        return new Envelope(MessageId.generate(), from, to, kind, payload, correlationId, System.currentTimeMillis());
    }

    /**
     * 요청 Envelope 생성.
     */
    public static Envelope request(AgentId from, AgentId to, Payload payload) {
        return create(from, to, MessageKind.REQUEST, payload, null);
    }

    /**
     * 요청에 대한 응답 Envelope 생성.
     *
     * <p>수신자는 요청의 발신자, correlationId는 요청의 id로 설정됩니다.</p>
     *
     * @param request 원본 요청
     * @param from 응답하는 Agent
     * @param payload 응답 데이터
     * @return 응답 Envelope
     */
    public static Envelope response(Envelope request, AgentId from, Payload payload) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        return create(from, request.from(), MessageKind.RESPONSE, payload, request.id());
    }

    /**
     * 브로드캐스트 Envelope 생성 (수신자: {@link AgentId#BROADCAST}).
     */
    public static Envelope broadcast(AgentId from, Payload payload) {
        return create(from, AgentId.BROADCAST, MessageKind.BROADCAST, payload, null);
    }

    /**
     * 알림 Envelope 생성 (응답을 기대하지 않음).
     */
    public static Envelope notification(AgentId from, AgentId to, Payload payload) {
        return create(from, to, MessageKind.NOTIFICATION, payload, null);
    }

    /**
     * correlationId 보유 여부.
     *
     * @return correlationId가 있으면 true
     */
    public boolean hasCorrelationId() {
        return correlationId != null;
    }
}
