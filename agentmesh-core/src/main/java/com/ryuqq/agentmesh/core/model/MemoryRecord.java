package com.ryuqq.agentmesh.core.model;

import java.util.List;

/**
 * 외부 메모리 검색 결과 한 건.
 *
 * @param memoryId 메모리 식별자
 * @param content 저장된 내용
 * @param kind 메모리 종류 (예: research, synthesis, episodic)
 * @param tags 분류 태그
 * @param importance 중요도 (0.0 ~ 1.0)
 * @param createdAt 저장 시각 (epoch millis)
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public record MemoryRecord(
    String memoryId,
    String content,
    String kind,
    List<String> tags,
    double importance,
    long createdAt
) {

    public MemoryRecord {
        if (memoryId == null || memoryId.isBlank()) {
            throw new IllegalArgumentException("memoryId cannot be null or blank");
        }
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("kind cannot be null or blank");
        }
        if (importance < 0.0 || importance > 1.0) {
            throw new IllegalArgumentException("importance must be between 0.0 and 1.0 (current: " + importance + ")");
        }
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
