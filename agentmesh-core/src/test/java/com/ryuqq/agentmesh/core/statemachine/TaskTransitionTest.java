package com.ryuqq.agentmesh.core.statemachine;

import com.ryuqq.agentmesh.core.exception.InvalidTransitionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static com.ryuqq.agentmesh.core.statemachine.TaskStatus.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * TaskTransition 테스트.
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
class TaskTransitionTest {

    // ========== 정상 전이 ==========

    @Test
    void transition_NormalFlowToCompleted_Succeeds() {
        TaskStatus status = PENDING;

        status = TaskTransition.transition(status, RUNNING);
        status = TaskTransition.transition(status, COMPLETED);

        assertEquals(COMPLETED, status);
        assertTrue(status.isTerminal());
    }

    @Test
    void validate_RunningToTimedOut_Succeeds() {
        assertDoesNotThrow(() -> TaskTransition.validate(RUNNING, TIMED_OUT));
    }

    @Test
    void validate_PendingToFailed_Succeeds() {
        assertDoesNotThrow(() -> TaskTransition.validate(PENDING, FAILED));
    }

    // ========== 불법 전이 ==========

    @ParameterizedTest
    @EnumSource(value = TaskStatus.class, names = {"COMPLETED", "FAILED", "TIMED_OUT"})
    void validate_FromTerminal_ThrowsInvalidTransition(TaskStatus terminal) {
        for (TaskStatus target : TaskStatus.values()) {
            InvalidTransitionException exception = assertThrows(
                InvalidTransitionException.class,
                () -> TaskTransition.validate(terminal, target)
            );
            assertEquals(terminal, exception.getFrom());
            assertTrue(exception.getMessage().contains("terminal"));
        }
    }

    @Test
    void validate_PendingToCompleted_ThrowsInvalidTransition() {
        assertThrows(InvalidTransitionException.class, () -> TaskTransition.validate(PENDING, COMPLETED));
        assertThrows(InvalidTransitionException.class, () -> TaskTransition.validate(PENDING, TIMED_OUT));
    }

    @Test
    void validate_RunningToPending_ThrowsInvalidTransition() {
        assertThrows(InvalidTransitionException.class, () -> TaskTransition.validate(RUNNING, PENDING));
        assertThrows(InvalidTransitionException.class, () -> TaskTransition.validate(RUNNING, RUNNING));
    }

    @Test
    void validate_Null_ThrowsIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> TaskTransition.validate(null, RUNNING));
    }

    @Test
    void wireValue_IsLowerCase() {
        assertEquals("timed_out", TIMED_OUT.wireValue());
        assertEquals("pending", PENDING.wireValue());
    }
}
