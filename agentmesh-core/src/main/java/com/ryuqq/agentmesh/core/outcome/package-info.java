/**
 * Terminal task results.
 *
 * <p>{@link com.ryuqq.agentmesh.core.outcome.TaskOutcome} is a sealed interface with three
 * implementations: {@link com.ryuqq.agentmesh.core.outcome.Completed},
 * {@link com.ryuqq.agentmesh.core.outcome.Failed} and
 * {@link com.ryuqq.agentmesh.core.outcome.TimedOut}. A task record carries an outcome only once
 * it reaches a terminal status.</p>
 *
 * @since 1.0.0
 * @author AgentMesh Team
 */
package com.ryuqq.agentmesh.core.outcome;
