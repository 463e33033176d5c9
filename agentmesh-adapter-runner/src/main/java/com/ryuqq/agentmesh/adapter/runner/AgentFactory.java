package com.ryuqq.agentmesh.adapter.runner;

import com.ryuqq.agentmesh.application.agent.AgentType;
import com.ryuqq.agentmesh.application.agent.HeuristicConfidenceScorer;
import com.ryuqq.agentmesh.application.agent.ResearchCollaborator;
import com.ryuqq.agentmesh.application.agent.ResearchProcessor;
import com.ryuqq.agentmesh.application.agent.SynthesisProcessor;
import com.ryuqq.agentmesh.application.agent.TaskProcessor;
import com.ryuqq.agentmesh.application.messaging.CommunicationHandler;
import com.ryuqq.agentmesh.core.model.AgentId;
import com.ryuqq.agentmesh.core.spi.CompletionCapability;
import com.ryuqq.agentmesh.core.spi.MemoryCapability;
import com.ryuqq.agentmesh.core.spi.TaskRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * Agent 유형별 AgentWorkerRunner 생성기.
 *
 * <p>모든 Agent가 같은 TaskRegistry, 생성/기억 기능, 메시징 핸들러를 공유하며
 * 유형에 따라 처리기만 달라집니다. 메시징이 있으면 synthesis Agent는
 * {@link ResearchCollaborator}로 research Agent에게 질의할 수 있습니다.</p>
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public final class AgentFactory {

    private static final Logger log = LoggerFactory.getLogger(AgentFactory.class);

    private final TaskRegistry registry;
    private final CompletionCapability completion;
    private final MemoryCapability memory;
    private final CommunicationHandler messaging;
    private final RuntimeConfig config;

    /**
     * 생성자 (메시징 없음, 기본 설정).
     */
    public AgentFactory(TaskRegistry registry, CompletionCapability completion, MemoryCapability memory) {
        this(registry, completion, memory, null, new RuntimeConfig());
    }

    /**
     * 생성자.
     *
     * @param registry 공유 Task 저장소
     * @param completion 공유 텍스트 생성 기능
     * @param memory 공유 기억 기능
     * @param messaging 메시징 핸들러 (null 허용)
     * @param config 생성되는 Agent의 설정
     * @throws IllegalArgumentException messaging 외의 의존성이 null인 경우
     */
    public AgentFactory(TaskRegistry registry, CompletionCapability completion, MemoryCapability memory,
                        CommunicationHandler messaging, RuntimeConfig config) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (completion == null) {
            throw new IllegalArgumentException("completion cannot be null");
        }
        if (memory == null) {
            throw new IllegalArgumentException("memory cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.registry = registry;
        this.completion = completion;
        this.memory = memory;
        this.messaging = messaging;
        this.config = config;
    }

    /**
     * 유형 이름으로 Agent 생성.
     *
     * @param type 유형 이름 (대소문자 무시)
     * @param agentId Agent ID
     * @return 시작되지 않은 Agent
     * @throws IllegalArgumentException 지원하지 않는 유형인 경우
     */
    public AgentWorkerRunner create(String type, AgentId agentId) {
        return create(AgentType.of(type), agentId);
    }

    /**
     * Agent 생성.
     *
     * @param type Agent 유형
     * @param agentId Agent ID
     * @return 시작되지 않은 Agent
     */
    public AgentWorkerRunner create(AgentType type, AgentId agentId) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        TaskProcessor processor = switch (type) {
            case RESEARCH -> new ResearchProcessor();
            case SYNTHESIS -> new SynthesisProcessor(researchCollaborator());
        };
        log.debug("Creating {} agent {}", type.getValue(), agentId == null ? null : agentId.getValue());
        return new AgentWorkerRunner(agentId, processor, registry, completion, memory,
            new HeuristicConfidenceScorer(), config, messaging);
    }

    private ResearchCollaborator researchCollaborator() {
        if (messaging == null) {
            return null;
        }
        // research 응답을 기다리는 시간은 synthesis Task 기한의 절반
        return new ResearchCollaborator(messaging, Duration.ofMillis(Math.max(1L, config.taskDeadlineMs() / 2)));
    }

    public AgentWorkerRunner createResearchAgent(AgentId agentId) {
        return create(AgentType.RESEARCH, agentId);
    }

    public AgentWorkerRunner createSynthesisAgent(AgentId agentId) {
        return create(AgentType.SYNTHESIS, agentId);
    }

    public Set<AgentType> supportedTypes() {
        return EnumSet.allOf(AgentType.class);
    }
}
