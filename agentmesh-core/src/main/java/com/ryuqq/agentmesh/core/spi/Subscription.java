package com.ryuqq.agentmesh.core.spi;

/**
 * Handle to an active channel subscription.
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public interface Subscription extends AutoCloseable {

    /**
     * @return the subscribed channel name
     */
    String channel();

    /**
     * Whether the subscription still receives envelopes.
     *
     * <p>Becomes false after {@link #close()} or when the transport connection drops.</p>
     *
     * @return true while active
     */
    boolean isActive();

    /**
     * Stops delivery to this subscription. Idempotent.
     */
    @Override
    void close();
}
