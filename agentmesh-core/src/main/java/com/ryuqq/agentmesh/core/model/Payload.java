package com.ryuqq.agentmesh.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Envelope과 Task가 운반하는 구조화된 데이터.
 *
 * <p>Payload는 문자열 키에서 {@link PayloadValue} 로의 불변 매핑입니다.
 * 전송 계층은 내용을 해석하지 않으며, 직렬화 형식은 코덱이 결정합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Payload payload = Payload.of("topic", "x");
 * Payload ack = Payload.of(Map.of("ack", true));
 * Payload extended = payload.with("depth", "deep");
 * </pre>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가 ({@link #with} 는 새 인스턴스 반환)</p>
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public final class Payload {

    private static final Payload EMPTY = new Payload(Map.of());

    private final Map<String, PayloadValue> values;

    private Payload(Map<String, PayloadValue> values) {
        this.values = values;
    }

    /**
     * 빈 Payload.
     *
     * @return 빈 Payload 인스턴스
     */
    public static Payload empty() {
        return EMPTY;
    }

    /**
     * 일반 Java 매핑으로부터 Payload 생성.
     *
     * @param map 문자열 키 매핑 (null 이면 빈 Payload)
     * @return Payload 인스턴스
     * @throws IllegalArgumentException 지원하지 않는 값 타입이 포함된 경우
     */
    public static Payload of(Map<String, ?> map) {
        if (map == null || map.isEmpty()) {
            return EMPTY;
        }
        Map<String, PayloadValue> converted = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : map.entrySet()) {
            if (entry.getKey() == null) {
                throw new IllegalArgumentException("Payload keys cannot be null");
            }
            converted.put(entry.getKey(), PayloadValue.of(entry.getValue()));
        }
        return new Payload(Collections.unmodifiableMap(converted));
    }

    /**
     * 단일 항목 Payload 생성.
     *
     * @param key 키
     * @param value 값
     * @return Payload 인스턴스
     */
    public static Payload of(String key, Object value) {
        return EMPTY.with(key, value);
    }

    /**
     * 두 항목 Payload 생성.
     */
    public static Payload of(String key1, Object value1, String key2, Object value2) {
        return EMPTY.with(key1, value1).with(key2, value2);
    }

    /**
     * 항목을 추가(또는 교체)한 새 Payload 반환.
     *
     * @param key 키 (null 불가)
     * @param value 값 (null 허용, NullValue로 저장)
     * @return 새 Payload 인스턴스
     */
    public Payload with(String key, Object value) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        Map<String, PayloadValue> copy = new LinkedHashMap<>(values);
        copy.put(key, PayloadValue.of(value));
        return new Payload(Collections.unmodifiableMap(copy));
    }

    public Optional<PayloadValue> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    /**
     * 문자열 항목 조회.
     *
     * @param key 키
     * @return 값이 TextValue인 경우 문자열, 그 외 빈 Optional
     */
    public Optional<String> getString(String key) {
        PayloadValue value = values.get(key);
        if (value instanceof TextValue text) {
            return Optional.of(text.value());
        }
        return Optional.empty();
    }

    public Optional<Boolean> getBoolean(String key) {
        PayloadValue value = values.get(key);
        if (value instanceof BooleanValue bool) {
            return Optional.of(bool.value());
        }
        return Optional.empty();
    }

    public Optional<Long> getLong(String key) {
        PayloadValue value = values.get(key);
        if (value instanceof IntegerValue integer) {
            return Optional.of(integer.value());
        }
        return Optional.empty();
    }

    /**
     * 숫자 항목 조회 (정수도 실수로 변환).
     *
     * @param key 키
     * @return 값이 IntegerValue 또는 DecimalValue 인 경우 double 값
     */
    public Optional<Double> getDouble(String key) {
        PayloadValue value = values.get(key);
        if (value instanceof DecimalValue decimal) {
            return Optional.of(decimal.value());
        }
        if (value instanceof IntegerValue integer) {
            return Optional.of((double) integer.value());
        }
        return Optional.empty();
    }

    /**
     * 중첩 매핑 항목을 Payload 로 조회.
     *
     * @param key 키
     * @return 값이 MapValue 인 경우 해당 Payload
     */
    public Optional<Payload> getPayload(String key) {
        PayloadValue value = values.get(key);
        if (value instanceof MapValue map) {
            return Optional.of(new Payload(map.entries()));
        }
        return Optional.empty();
    }

    /**
     * 목록 항목 조회.
     *
     * @param key 키
     * @return 값이 ListValue인 경우 원소 목록, 그 외 빈 목록
     */
    public List<PayloadValue> getList(String key) {
        PayloadValue value = values.get(key);
        if (value instanceof ListValue list) {
            return list.items();
        }
        return List.of();
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    /**
     * 내부 매핑 조회 (수정 불가 뷰).
     *
     * @return 키 → PayloadValue 매핑
     */
    public Map<String, PayloadValue> asMap() {
        return values;
    }

    /**
     * 일반 Java 매핑으로 변환.
     *
     * @return 키 → Java 객체 매핑
     */
    public Map<String, Object> toJavaMap() {
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<String, PayloadValue> entry : values.entrySet()) {
            result.put(entry.getKey(), entry.getValue().unwrap());
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Payload payload = (Payload) o;
        return values.equals(payload.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Payload{" + values.keySet() + '}';
    }
}
