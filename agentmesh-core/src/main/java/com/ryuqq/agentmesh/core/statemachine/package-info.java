/**
 * Task and runtime state machines.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.agentmesh.core.statemachine.TaskStatus} - task lifecycle states</li>
 *   <li>{@link com.ryuqq.agentmesh.core.statemachine.TaskTransition} - transition validation</li>
 *   <li>{@link com.ryuqq.agentmesh.core.statemachine.RuntimeState} - agent runtime lifecycle</li>
 * </ul>
 *
 * <h2>Task Transition Rules</h2>
 * <pre>
 * PENDING → RUNNING
 * PENDING → FAILED (abandoned before it ran)
 * RUNNING → COMPLETED | FAILED | TIMED_OUT
 *
 * Forbidden:
 * - any transition out of a terminal status
 * - backward transitions (e.g., RUNNING → PENDING)
 * </pre>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * TaskStatus status = TaskStatus.PENDING;
 * status = TaskTransition.transition(status, TaskStatus.RUNNING);
 * status = TaskTransition.transition(status, TaskStatus.COMPLETED);
 *
 * // throws InvalidTransitionException
 * TaskTransition.validate(status, TaskStatus.RUNNING);
 * </pre>
 *
 * @since 1.0.0
 * @author AgentMesh Team
 */
package com.ryuqq.agentmesh.core.statemachine;
