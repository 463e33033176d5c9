package com.ryuqq.agentmesh.core.model;

/**
 * 실수 Payload 값.
 *
 * @param value 실수 값 (NaN, 무한대 불가)
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public record DecimalValue(double value) implements PayloadValue {

    public DecimalValue {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("value must be finite (current: " + value + ")");
        }
    }

    @Override
    public Object unwrap() {
        return value;
    }
}
