/**
 * Service Provider Interface (SPI) package.
 *
 * <p>Interfaces implemented by infrastructure adapters and external integrations.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.agentmesh.core.spi.Transport} - publish/subscribe envelope broker</li>
 *   <li>{@link com.ryuqq.agentmesh.core.spi.TaskRegistry} - task bookkeeping with blocking retrieval</li>
 *   <li>{@link com.ryuqq.agentmesh.core.spi.CompletionCapability} - external text completion</li>
 *   <li>{@link com.ryuqq.agentmesh.core.spi.MemoryCapability} - external memory for context enrichment</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter modules (e.g., agentmesh-adapter-inmemory) provide concrete implementations.
 * A networked broker would implement {@code Transport} in its own adapter module.</p>
 *
 * @since 1.0.0
 * @author AgentMesh Team
 */
package com.ryuqq.agentmesh.core.spi;
