package com.ryuqq.agentmesh.application.agent;

import com.ryuqq.agentmesh.core.model.AgentId;
import com.ryuqq.agentmesh.core.model.Payload;
import com.ryuqq.agentmesh.core.model.TaskId;
import com.ryuqq.agentmesh.core.spi.CompletionCapability;
import com.ryuqq.agentmesh.core.spi.CompletionOptions;
import com.ryuqq.agentmesh.core.spi.MemoryCapability;

/**
 * Task 하나를 처리하는 데 필요한 입력과 외부 기능 묶음.
 *
 * @author AgentMesh Team
 * @since 1.0.0
 * @param taskId 처리 중인 Task
 * @param agentId Task를 소유한 Agent
 * @param input Task 입력
 * @param completion 텍스트 생성 기능
 * @param memory 장기 기억 기능
 * @param options 생성 옵션 기본값
 * @param scorer 기억 중요도 계산에 쓰는 채점기
 */
public record TaskContext(
    TaskId taskId,
    AgentId agentId,
    Payload input,
    CompletionCapability completion,
    MemoryCapability memory,
    CompletionOptions options,
    ConfidenceScorer scorer
) {

    public TaskContext {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        if (agentId == null) {
            throw new IllegalArgumentException("agentId cannot be null");
        }
        if (input == null) {
            throw new IllegalArgumentException("input cannot be null");
        }
        if (completion == null) {
            throw new IllegalArgumentException("completion cannot be null");
        }
        if (memory == null) {
            throw new IllegalArgumentException("memory cannot be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        if (scorer == null) {
            throw new IllegalArgumentException("scorer cannot be null");
        }
    }
}
