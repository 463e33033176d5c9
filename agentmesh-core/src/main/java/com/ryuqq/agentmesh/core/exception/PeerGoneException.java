package com.ryuqq.agentmesh.core.exception;

import com.ryuqq.agentmesh.core.model.AgentId;

/**
 * The other side of a correlated exchange was deregistered. Terminal for that exchange.
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public class PeerGoneException extends AgentMeshException {

    public static final String CODE = "PEER_GONE";

    private final AgentId agentId;

    public PeerGoneException(AgentId agentId) {
        super(CODE, "Agent " + (agentId == null ? "?" : agentId.getValue()) + " is no longer registered");
        this.agentId = agentId;
    }

    public AgentId getAgentId() {
        return agentId;
    }
}
