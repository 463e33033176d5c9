/**
 * Reusable SPI contract tests.
 *
 * <p>Adapter modules extend these abstract classes from their own test sources so every
 * implementation is checked against the same behavior.</p>
 *
 * @since 1.0.0
 * @author AgentMesh Team
 */
package com.ryuqq.agentmesh.testkit.contract;
