/**
 * Error taxonomy.
 *
 * <h2>Exceptions</h2>
 * <ul>
 *   <li>{@link com.ryuqq.agentmesh.core.exception.TransportUnavailableException} - transient, retry with backoff</li>
 *   <li>{@link com.ryuqq.agentmesh.core.exception.PeerGoneException} - peer deregistered, terminal for the exchange</li>
 *   <li>{@link com.ryuqq.agentmesh.core.exception.RequestTimeoutException} - no correlated response in time</li>
 *   <li>{@link com.ryuqq.agentmesh.core.exception.UnknownTaskException},
 *       {@link com.ryuqq.agentmesh.core.exception.InvalidTransitionException},
 *       {@link com.ryuqq.agentmesh.core.exception.NotStartedException} - usage errors, not retryable</li>
 *   <li>{@link com.ryuqq.agentmesh.core.exception.TaskTimeoutException},
 *       {@link com.ryuqq.agentmesh.core.exception.TaskTimedOutException} - caller-visible timeouts</li>
 *   <li>{@link com.ryuqq.agentmesh.core.exception.TaskFailedException} - task failed, cause preserved</li>
 *   <li>{@link com.ryuqq.agentmesh.core.exception.CapabilityException} - external capability error</li>
 * </ul>
 *
 * <p>All exceptions are unchecked and extend
 * {@link com.ryuqq.agentmesh.core.exception.AgentMeshException}. Argument validation failures use
 * {@link java.lang.IllegalArgumentException}.</p>
 *
 * @since 1.0.0
 * @author AgentMesh Team
 */
package com.ryuqq.agentmesh.core.exception;
