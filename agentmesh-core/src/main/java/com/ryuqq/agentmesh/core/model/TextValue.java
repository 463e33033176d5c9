package com.ryuqq.agentmesh.core.model;

/**
 * 문자열 Payload 값.
 *
 * @param value 문자열 (null 불가)
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public record TextValue(String value) implements PayloadValue {

    public TextValue {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null (use NullValue)");
        }
    }

    @Override
    public Object unwrap() {
        return value;
    }
}
