package com.ryuqq.agentmesh.core.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Payload에 담길 수 있는 값의 닫힌 집합.
 *
 * <p>Sealed interface로 정의되어 직렬화 코덱과 테스트가 다룰 변형을 컴파일 타임에 고정합니다.</p>
 * <ul>
 *   <li>{@link TextValue}: 문자열</li>
 *   <li>{@link IntegerValue}: 정수 (long)</li>
 *   <li>{@link DecimalValue}: 실수 (double)</li>
 *   <li>{@link BooleanValue}: 불리언</li>
 *   <li>{@link NullValue}: 명시적 null</li>
 *   <li>{@link ListValue}: 값 목록</li>
 *   <li>{@link MapValue}: 문자열 키 → 값 매핑</li>
 * </ul>
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public sealed interface PayloadValue
    permits TextValue, IntegerValue, DecimalValue, BooleanValue, NullValue, ListValue, MapValue {

    /**
     * 일반 Java 객체를 PayloadValue로 변환.
     *
     * <p>지원 타입: null, PayloadValue, CharSequence, Byte/Short/Integer/Long/BigInteger,
     * Float/Double/BigDecimal, Boolean, Collection, Map(문자열 키), Payload</p>
     *
     * @param value 변환할 값 (null 허용)
     * @return 대응하는 PayloadValue
     * @throws IllegalArgumentException 지원하지 않는 타입인 경우
     */
    static PayloadValue of(Object value) {
        if (value == null) {
            return NullValue.INSTANCE;
        }
        if (value instanceof PayloadValue payloadValue) {
            return payloadValue;
        }
        if (value instanceof CharSequence text) {
            return new TextValue(text.toString());
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short
            || value instanceof Byte || value instanceof BigInteger) {
            return new IntegerValue(((Number) value).longValue());
        }
        if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            return new DecimalValue(((Number) value).doubleValue());
        }
        if (value instanceof Boolean bool) {
            return BooleanValue.of(bool);
        }
        if (value instanceof Payload payload) {
            return new MapValue(payload.asMap());
        }
        if (value instanceof Collection<?> collection) {
            List<PayloadValue> items = new ArrayList<>(collection.size());
            for (Object item : collection) {
                items.add(of(item));
            }
            return new ListValue(items);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, PayloadValue> entries = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String key)) {
                    throw new IllegalArgumentException("Map keys must be strings (current: " + entry.getKey() + ")");
                }
                entries.put(key, of(entry.getValue()));
            }
            return new MapValue(entries);
        }
        throw new IllegalArgumentException("Unsupported payload value type: " + value.getClass().getName());
    }

    /**
     * 일반 Java 객체로 변환 (String, Long, Double, Boolean, null, List, Map).
     *
     * @return 변환된 Java 객체
     */
    Object unwrap();
}
