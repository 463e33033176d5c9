package com.ryuqq.agentmesh.core.model;

import java.util.UUID;

/**
 * 제출된 작업(Task)의 고유 식별자.
 *
 * <p>제출마다 새로 발급되며, Task Registry 내에서 레코드를 찾는 키로 사용됩니다.</p>
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public final class TaskId {

    private final String value;

    private TaskId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("TaskId cannot be null or blank");
        }
        this.value = value;
    }

    /**
     * 새 TaskId 발급 (UUID 기반).
     *
     * @return 새 TaskId
     */
    public static TaskId generate() {
        return new TaskId(UUID.randomUUID().toString());
    }

    /**
     * 기존 값으로 TaskId 생성.
     *
     * @param value TaskId 값
     * @return TaskId 인스턴스
     * @throws IllegalArgumentException null 또는 빈 문자열인 경우
     */
    public static TaskId of(String value) {
        return new TaskId(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TaskId taskId = (TaskId) o;
        return value.equals(taskId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "TaskId{" + value + '}';
    }
}
