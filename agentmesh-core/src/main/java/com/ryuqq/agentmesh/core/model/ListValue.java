package com.ryuqq.agentmesh.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 목록 Payload 값.
 *
 * <p>생성 시 방어적 복사 후 수정 불가 목록으로 보관합니다.</p>
 *
 * @param items 값 목록 (null 불가, 원소 null 불가)
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public record ListValue(List<PayloadValue> items) implements PayloadValue {

    public ListValue {
        if (items == null) {
            throw new IllegalArgumentException("items cannot be null");
        }
        items = List.copyOf(items);
    }

    @Override
    public Object unwrap() {
        List<Object> result = new ArrayList<>(items.size());
        for (PayloadValue item : items) {
            result.add(item.unwrap());
        }
        return Collections.unmodifiableList(result);
    }
}
