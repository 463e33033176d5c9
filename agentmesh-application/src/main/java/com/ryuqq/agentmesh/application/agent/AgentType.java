package com.ryuqq.agentmesh.application.agent;

import java.util.Locale;

/**
 * 생성 가능한 Agent 종류.
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public enum AgentType {

    RESEARCH("research"),
    SYNTHESIS("synthesis");

    private final String value;

    AgentType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * 문자열로부터 AgentType 조회 (대소문자 무시).
     *
     * @param value 종류 이름
     * @return 대응하는 AgentType
     * @throws IllegalArgumentException 알 수 없는 종류인 경우
     */
    public static AgentType of(String value) {
        if (value == null) {
            throw new IllegalArgumentException("agent type cannot be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (AgentType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown agent type: " + value);
    }
}
