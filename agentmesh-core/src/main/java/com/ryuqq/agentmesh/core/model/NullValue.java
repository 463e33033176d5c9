package com.ryuqq.agentmesh.core.model;

/**
 * 명시적 null Payload 값.
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public record NullValue() implements PayloadValue {

    public static final NullValue INSTANCE = new NullValue();

    @Override
    public Object unwrap() {
        return null;
    }
}
