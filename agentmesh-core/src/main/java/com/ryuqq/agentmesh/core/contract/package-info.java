/**
 * Message contract between agents: the {@link com.ryuqq.agentmesh.core.contract.Envelope} and the
 * channel naming scheme in {@link com.ryuqq.agentmesh.core.contract.Channels}.
 *
 * @since 1.0.0
 * @author AgentMesh Team
 */
package com.ryuqq.agentmesh.core.contract;
