package com.ryuqq.agentmesh.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 중첩 매핑 Payload 값.
 *
 * <p>키 순서를 보존하며, 생성 후 수정할 수 없습니다.</p>
 *
 * @param entries 문자열 키 → 값 매핑 (null 불가)
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public record MapValue(Map<String, PayloadValue> entries) implements PayloadValue {

    public MapValue {
        if (entries == null) {
            throw new IllegalArgumentException("entries cannot be null");
        }
        Map<String, PayloadValue> copy = new LinkedHashMap<>();
        for (Map.Entry<String, PayloadValue> entry : entries.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                throw new IllegalArgumentException("entries cannot contain null keys or values");
            }
            copy.put(entry.getKey(), entry.getValue());
        }
        entries = Collections.unmodifiableMap(copy);
    }

    @Override
    public Object unwrap() {
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<String, PayloadValue> entry : entries.entrySet()) {
            result.put(entry.getKey(), entry.getValue().unwrap());
        }
        return Collections.unmodifiableMap(result);
    }
}
