package com.ryuqq.agentmesh.core.spi;

/**
 * Observer of transport connectivity changes.
 *
 * <p>Both callbacks default to no-ops so listeners can react to only one event.</p>
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public interface ConnectionListener {

    /**
     * The connection dropped. All subscriptions are already invalid when this is called.
     */
    default void onDisconnected() {
    }

    /**
     * The connection is back. Previously active subscriptions must be re-established by their owners.
     */
    default void onReconnected() {
    }
}
