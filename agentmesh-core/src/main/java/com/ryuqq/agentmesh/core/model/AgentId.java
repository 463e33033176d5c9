package com.ryuqq.agentmesh.core.model;

/**
 * Agent의 식별자.
 *
 * <p>AgentId는 메시지 주소 지정과 Task 소유자 구분에 사용되며,
 * 전송 계층의 inbox 채널 이름도 이 값에서 결정적으로 파생됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_), 점(.)만 허용</li>
 *   <li>예약값 {@code *}는 {@link #BROADCAST} 로만 사용</li>
 * </ul>
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public final class AgentId {

    private static final String BROADCAST_VALUE = "*";

    /**
     * 브로드캐스트 수신자를 나타내는 예약 AgentId.
     */
    public static final AgentId BROADCAST = new AgentId(BROADCAST_VALUE, true);

    private final String value;

    private AgentId(String value, boolean reserved) {
        if (!reserved) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException("AgentId cannot be null or blank");
            }
            if (value.length() > 255) {
                throw new IllegalArgumentException("AgentId length cannot exceed 255 characters");
            }
            if (!value.matches("^[a-zA-Z0-9.\\-_]+$")) {
                throw new IllegalArgumentException("AgentId contains invalid characters. Only alphanumeric, dot, hyphen, and underscore are allowed");
            }
        }
        this.value = value;
    }

    /**
     * AgentId 생성.
     *
     * <p>{@code "*"} 를 전달하면 {@link #BROADCAST} 를 반환합니다.</p>
     *
     * @param value AgentId 값
     * @return AgentId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static AgentId of(String value) {
        if (BROADCAST_VALUE.equals(value)) {
            return BROADCAST;
        }
        return new AgentId(value, false);
    }

    /**
     * AgentId 값 조회.
     *
     * @return AgentId 값
     */
    public String getValue() {
        return value;
    }

    /**
     * 브로드캐스트 예약값인지 확인.
     *
     * @return 브로드캐스트 주소이면 true
     */
    public boolean isBroadcast() {
        return BROADCAST_VALUE.equals(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AgentId agentId = (AgentId) o;
        return value.equals(agentId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "AgentId{" + value + '}';
    }
}
