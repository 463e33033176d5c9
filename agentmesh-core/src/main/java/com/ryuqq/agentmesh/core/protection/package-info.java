/**
 * Retry support shared by components that call the transport.
 *
 * @since 1.0.0
 * @author AgentMesh Team
 */
package com.ryuqq.agentmesh.core.protection;
