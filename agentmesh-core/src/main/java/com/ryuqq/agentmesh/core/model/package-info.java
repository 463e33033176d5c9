/**
 * Core value types.
 *
 * <h2>Identifiers</h2>
 * <ul>
 *   <li>{@link com.ryuqq.agentmesh.core.model.AgentId} - agent identifier (reserved {@code *} for broadcast)</li>
 *   <li>{@link com.ryuqq.agentmesh.core.model.MessageId} - envelope identifier</li>
 *   <li>{@link com.ryuqq.agentmesh.core.model.TaskId} - task identifier</li>
 * </ul>
 *
 * <h2>Data</h2>
 * <ul>
 *   <li>{@link com.ryuqq.agentmesh.core.model.Payload} - immutable string-keyed map of
 *       {@link com.ryuqq.agentmesh.core.model.PayloadValue} variants</li>
 *   <li>{@link com.ryuqq.agentmesh.core.model.MessageKind} - envelope kind, open to unknown wire values</li>
 *   <li>{@link com.ryuqq.agentmesh.core.model.TaskRecord} - task snapshot</li>
 *   <li>{@link com.ryuqq.agentmesh.core.model.MemoryRecord} - memory search hit</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> all types are immutable</li>
 *   <li><strong>Validation:</strong> constructors reject invalid values with IllegalArgumentException</li>
 * </ul>
 *
 * @since 1.0.0
 * @author AgentMesh Team
 */
package com.ryuqq.agentmesh.core.model;
