/**
 * JSON wire format for envelopes (Jackson).
 *
 * @since 1.0.0
 * @author AgentMesh Team
 */
package com.ryuqq.agentmesh.core.codec;
