/**
 * Agent 종류별 Task 처리기와 신뢰도 채점.
 *
 * <ul>
 *   <li>{@link com.ryuqq.agentmesh.application.agent.ResearchProcessor} - 조사</li>
 *   <li>{@link com.ryuqq.agentmesh.application.agent.SynthesisProcessor} - 종합</li>
 *   <li>{@link com.ryuqq.agentmesh.application.agent.ResearchCollaborator} - 종합 중 research Agent에게 질의</li>
 *   <li>{@link com.ryuqq.agentmesh.application.agent.HeuristicConfidenceScorer} - 기본 채점기</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.agentmesh.application.agent;
