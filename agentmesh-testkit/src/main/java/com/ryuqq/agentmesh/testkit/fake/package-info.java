/**
 * Test doubles for external capabilities and time.
 *
 * @since 1.0.0
 * @author AgentMesh Team
 */
package com.ryuqq.agentmesh.testkit.fake;
