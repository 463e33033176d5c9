package com.ryuqq.agentmesh.core.model;

import java.util.Locale;
import java.util.Map;

/**
 * Envelope의 종류 (라우팅 판별자).
 *
 * <p>알려진 종류는 {@link #REQUEST}, {@link #RESPONSE}, {@link #BROADCAST},
 * {@link #NOTIFICATION} 네 가지입니다. 와이어에서 알 수 없는 값이 들어오면
 * 값을 그대로 보존한 "unknown" 종류로 복원되어 핸들러에 전달되지만,
 * 요청/응답 상관관계 처리에서는 절대 request/response로 취급되지 않습니다.</p>
 *
 * <p><strong>와이어 표현:</strong> 소문자 문자열 ({@code "request"} 등)</p>
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public final class MessageKind {

    public static final MessageKind REQUEST = new MessageKind("request", true);
    public static final MessageKind RESPONSE = new MessageKind("response", true);
    public static final MessageKind BROADCAST = new MessageKind("broadcast", true);
    public static final MessageKind NOTIFICATION = new MessageKind("notification", true);

    private static final Map<String, MessageKind> KNOWN = Map.of(
        REQUEST.value, REQUEST,
        RESPONSE.value, RESPONSE,
        BROADCAST.value, BROADCAST,
        NOTIFICATION.value, NOTIFICATION
    );

    private final String value;
    private final boolean known;

    private MessageKind(String value, boolean known) {
        this.value = value;
        this.known = known;
    }

    /**
     * 와이어 값으로부터 MessageKind 복원.
     *
     * <p>알려진 값은 대소문자를 구분하지 않고 상수로 매핑되며,
     * 그 외 값은 원문 그대로 unknown 종류로 반환됩니다.</p>
     *
     * @param value 와이어 값
     * @return MessageKind
     * @throws IllegalArgumentException null 또는 빈 문자열인 경우
     */
    public static MessageKind of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("MessageKind cannot be null or blank");
        }
        MessageKind kind = KNOWN.get(value.toLowerCase(Locale.ROOT));
        return kind != null ? kind : new MessageKind(value, false);
    }

    public String getValue() {
        return value;
    }

    /**
     * 알려진 종류인지 확인.
     *
     * @return request/response/broadcast/notification 중 하나이면 true
     */
    public boolean isKnown() {
        return known;
    }

    public boolean isRequest() {
        return this == REQUEST;
    }

    public boolean isResponse() {
        return this == RESPONSE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MessageKind that = (MessageKind) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
