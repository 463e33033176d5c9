/**
 * In-process publish/subscribe transport.
 *
 * <p>{@link com.ryuqq.agentmesh.adapter.inmemory.transport.InMemoryTransport} simulates one broker
 * connection, including drops and reconnects, for tests and single-process deployments.</p>
 *
 * @since 1.0.0
 * @author AgentMesh Team
 */
package com.ryuqq.agentmesh.adapter.inmemory.transport;
