package com.ryuqq.agentmesh.core.model;

import com.ryuqq.agentmesh.core.exception.InvalidTransitionException;
import com.ryuqq.agentmesh.core.outcome.Completed;
import com.ryuqq.agentmesh.core.outcome.Failed;
import com.ryuqq.agentmesh.core.outcome.TaskError;
import com.ryuqq.agentmesh.core.outcome.TaskOutput;
import com.ryuqq.agentmesh.core.outcome.TimedOut;
import com.ryuqq.agentmesh.core.statemachine.TaskStatus;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TaskRecord 테스트.
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
class TaskRecordTest {

    private final TaskRecord pending = TaskRecord.pending(TaskId.generate(), AgentId.of("agent-1"), Payload.of("query", "q"), 100L);

    @Test
    void pending_HasNoOutcomeOrTimestamps() {
        assertEquals(TaskStatus.PENDING, pending.getStatus());
        assertTrue(pending.getOutcome().isEmpty());
        assertTrue(pending.getStartedAt().isEmpty());
        assertTrue(pending.getCompletedAt().isEmpty());
    }

    @Test
    void toTerminal_Completed_ExposesResultOnly() {
        // Given
        TaskOutput output = new TaskOutput(Payload.of("content", "done"), 0.8);

        // When
        TaskRecord completed = pending.toRunning(110L).toTerminal(new Completed(output), 150L);

        // Then
        assertEquals(TaskStatus.COMPLETED, completed.getStatus());
        assertEquals(output, completed.getResult().orElseThrow());
        assertTrue(completed.getError().isEmpty());
        assertEquals(110L, completed.getStartedAt().getAsLong());
        assertEquals(150L, completed.getCompletedAt().getAsLong());
        assertEquals(TaskStatus.PENDING, pending.getStatus());
    }

    @Test
    void toTerminal_TimedOut_ExposesErrorOnly() {
        TaskError error = TaskError.of(TaskError.DEADLINE_EXCEEDED, "too slow");

        TaskRecord timedOut = pending.toRunning(110L).toTerminal(new TimedOut(error), 200L);

        assertEquals(TaskStatus.TIMED_OUT, timedOut.getStatus());
        assertEquals(error, timedOut.getError().orElseThrow());
        assertTrue(timedOut.getResult().isEmpty());
    }

    @Test
    void toTerminal_FailedFromPending_IsAllowed() {
        TaskRecord failed = pending.toTerminal(new Failed(TaskError.of(TaskError.AGENT_STOPPED, "stopped")), 120L);

        assertEquals(TaskStatus.FAILED, failed.getStatus());
        assertTrue(failed.getStartedAt().isEmpty());
    }

    @Test
    void toTerminal_Twice_ThrowsInvalidTransition() {
        TaskRecord completed = pending.toRunning(110L)
            .toTerminal(new Completed(TaskOutput.of(Payload.empty())), 120L);

        assertThrows(InvalidTransitionException.class,
            () -> completed.toTerminal(new Failed(TaskError.of("X", "late")), 130L));
    }

    @Test
    void toTerminal_CompletedFromPending_ThrowsInvalidTransition() {
        assertThrows(InvalidTransitionException.class,
            () -> pending.toTerminal(new Completed(TaskOutput.of(Payload.empty())), 120L));
    }
}
