package com.ryuqq.agentmesh.core.spi;

import com.ryuqq.agentmesh.core.contract.Envelope;

/**
 * Callback that receives envelopes delivered on a subscribed channel.
 *
 * <p>Invocations for a single subscription are serialized in publication order.
 * Implementations should return quickly; long work belongs on another thread.</p>
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface InboundHandler {

    /**
     * Handles one delivered envelope.
     *
     * @param envelope the delivered envelope, never null
     */
    void handle(Envelope envelope);
}
