package com.ryuqq.agentmesh.core.contract;

import com.ryuqq.agentmesh.core.model.AgentId;

/**
 * 채널 이름 규칙.
 *
 * <p>Agent의 inbox 채널은 AgentId에서 결정적으로 파생되므로
 * 브로커 측 팬아웃 로직 없이 주소 지정이 가능합니다.</p>
 *
 * <ul>
 *   <li>inbox: {@code inbox:{agentId}}</li>
 *   <li>broadcast: {@code broadcast}</li>
 * </ul>
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public final class Channels {

    /**
     * 모든 등록 Agent가 암묵적으로 구독하는 예약 채널.
     */
    public static final String BROADCAST = "broadcast";

    private static final String INBOX_PREFIX = "inbox:";

    private Channels() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Agent의 inbox 채널 이름.
     *
     * @param agentId Agent ID (브로드캐스트 주소 불가)
     * @return 채널 이름
     * @throws IllegalArgumentException agentId가 null이거나 브로드캐스트 주소인 경우
     */
    public static String inbox(AgentId agentId) {
        if (agentId == null) {
            throw new IllegalArgumentException("agentId cannot be null");
        }
        if (agentId.isBroadcast()) {
            throw new IllegalArgumentException("broadcast address has no inbox, use Channels.BROADCAST");
        }
        return INBOX_PREFIX + agentId.getValue();
    }

    /**
     * Envelope의 수신자에 해당하는 채널.
     *
     * @param envelope Envelope
     * @return 브로드캐스트면 {@link #BROADCAST}, 아니면 수신자 inbox
     */
    public static String destinationOf(Envelope envelope) {
        return envelope.to().isBroadcast() ? BROADCAST : inbox(envelope.to());
    }
}
