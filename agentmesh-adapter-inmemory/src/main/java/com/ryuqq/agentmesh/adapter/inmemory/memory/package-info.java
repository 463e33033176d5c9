/**
 * Bounded in-memory implementation of the memory capability.
 *
 * @since 1.0.0
 * @author AgentMesh Team
 */
package com.ryuqq.agentmesh.adapter.inmemory.memory;
