/**
 * In-memory task registry with retention-based eviction.
 *
 * @since 1.0.0
 * @author AgentMesh Team
 */
package com.ryuqq.agentmesh.adapter.inmemory.task;
