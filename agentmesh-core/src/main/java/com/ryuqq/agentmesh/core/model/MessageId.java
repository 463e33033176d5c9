package com.ryuqq.agentmesh.core.model;

import java.util.UUID;

/**
 * Envelope의 전역 고유 식별자.
 *
 * <p>생성 시점에 무작위 UUID로 할당되며 재사용되지 않습니다.
 * 응답 Envelope은 이 값을 correlationId로 참조합니다.</p>
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public final class MessageId {

    private final String value;

    private MessageId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("MessageId cannot be null or blank");
        }
        this.value = value;
    }

    /**
     * 새 MessageId 발급 (UUID 기반).
     *
     * @return 새 MessageId
     */
    public static MessageId generate() {
        return new MessageId(UUID.randomUUID().toString());
    }

    /**
     * 기존 값으로 MessageId 복원 (역직렬화 용도).
     *
     * @param value MessageId 값
     * @return MessageId 인스턴스
     * @throws IllegalArgumentException null 또는 빈 문자열인 경우
     */
    public static MessageId of(String value) {
        return new MessageId(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MessageId that = (MessageId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "MessageId{" + value + '}';
    }
}
