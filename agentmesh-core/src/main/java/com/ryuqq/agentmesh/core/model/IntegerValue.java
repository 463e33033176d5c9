package com.ryuqq.agentmesh.core.model;

/**
 * 정수 Payload 값.
 *
 * @param value 정수 값
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public record IntegerValue(long value) implements PayloadValue {

    @Override
    public Object unwrap() {
        return value;
    }
}
