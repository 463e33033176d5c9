package com.ryuqq.agentmesh.core.statemachine;

import com.ryuqq.agentmesh.core.exception.InvalidTransitionException;

/**
 * Task 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>PENDING → RUNNING</li>
 *   <li>PENDING → FAILED (실행되지 못하고 폐기된 Task)</li>
 *   <li>RUNNING → COMPLETED | FAILED | TIMED_OUT</li>
 * </ul>
 *
 * <p>종료 상태에서의 전이, 역방향 전이는 모두 {@link InvalidTransitionException} 으로 거부됩니다.</p>
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public final class TaskTransition {

    private TaskTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws InvalidTransitionException 허용되지 않은 전이인 경우
     */
    public static void validate(TaskStatus from, TaskStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (!isAllowed(from, to)) {
            throw new InvalidTransitionException(from, to);
        }
    }

    /**
     * 검증 후 다음 상태를 반환.
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return next
     * @throws InvalidTransitionException 허용되지 않은 전이인 경우
     */
    public static TaskStatus transition(TaskStatus current, TaskStatus next) {
        validate(current, next);
        return next;
    }

    /**
     * 예외 없이 전이 허용 여부만 확인.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @return 허용되면 true
     */
    public static boolean isAllowed(TaskStatus from, TaskStatus to) {
        if (from == null || to == null || from.isTerminal()) {
            return false;
        }
        if (from == TaskStatus.PENDING) {
            return to == TaskStatus.RUNNING || to == TaskStatus.FAILED;
        }
        // RUNNING
        return to.isTerminal();
    }
}
