package com.ryuqq.agentmesh.core.model;

/**
 * 불리언 Payload 값.
 *
 * @param value 불리언 값
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public record BooleanValue(boolean value) implements PayloadValue {

    public static final BooleanValue TRUE = new BooleanValue(true);
    public static final BooleanValue FALSE = new BooleanValue(false);

    public static BooleanValue of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public Object unwrap() {
        return value;
    }
}
