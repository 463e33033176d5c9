package com.ryuqq.agentmesh.core.model;

import com.ryuqq.agentmesh.core.outcome.Completed;
import com.ryuqq.agentmesh.core.outcome.Failed;
import com.ryuqq.agentmesh.core.outcome.TaskError;
import com.ryuqq.agentmesh.core.outcome.TaskOutcome;
import com.ryuqq.agentmesh.core.outcome.TaskOutput;
import com.ryuqq.agentmesh.core.outcome.TimedOut;
import com.ryuqq.agentmesh.core.statemachine.TaskStatus;
import com.ryuqq.agentmesh.core.statemachine.TaskTransition;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * 제출된 작업 한 건의 스냅샷.
 *
 * <p>레코드는 불변이며, 상태 변경은 {@link #toRunning(long)}, {@link #toTerminal(TaskOutcome, long)} 이
 * 검증을 거친 새 인스턴스를 반환하는 방식으로 이루어집니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태는 최대 한 번만 부여됨</li>
 *   <li>outcome 은 종료 상태에서만 존재</li>
 *   <li>result 는 COMPLETED, error 는 FAILED/TIMED_OUT 에서만 존재</li>
 * </ul>
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public final class TaskRecord {

    private static final long ABSENT = -1L;

    private final TaskId taskId;
    private final AgentId owner;
    private final Payload input;
    private final TaskStatus status;
    private final TaskOutcome outcome;
    private final long submittedAt;
    private final long startedAt;
    private final long completedAt;

    private TaskRecord(TaskId taskId, AgentId owner, Payload input, TaskStatus status,
                       TaskOutcome outcome, long submittedAt, long startedAt, long completedAt) {
        this.taskId = taskId;
        this.owner = owner;
        this.input = input;
        this.status = status;
        this.outcome = outcome;
        this.submittedAt = submittedAt;
        this.startedAt = startedAt;
        this.completedAt = completedAt;
    }

    /**
     * PENDING 상태의 새 레코드 생성.
     *
     * @param taskId Task ID
     * @param owner 소유 Agent
     * @param input 입력 payload
     * @param submittedAt 제출 시각 (epoch millis)
     * @return 새 레코드
     * @throws IllegalArgumentException 필수 값이 null인 경우
     */
    public static TaskRecord pending(TaskId taskId, AgentId owner, Payload input, long submittedAt) {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        if (owner == null) {
            throw new IllegalArgumentException("owner cannot be null");
        }
        if (input == null) {
            throw new IllegalArgumentException("input cannot be null");
        }
        return new TaskRecord(taskId, owner, input, TaskStatus.PENDING, null, submittedAt, ABSENT, ABSENT);
    }

    /**
     * RUNNING 으로 전이한 새 레코드 반환.
     *
     * @param now 전이 시각
     * @return RUNNING 레코드
     * @throws com.ryuqq.agentmesh.core.exception.InvalidTransitionException 현재 상태가 PENDING 이 아닌 경우
     */
    public TaskRecord toRunning(long now) {
        TaskTransition.validate(status, TaskStatus.RUNNING);
        return new TaskRecord(taskId, owner, input, TaskStatus.RUNNING, null, submittedAt, now, ABSENT);
    }

    /**
     * 종료 상태로 전이한 새 레코드 반환.
     *
     * @param outcome 결과 (종류에 따라 COMPLETED/FAILED/TIMED_OUT 결정)
     * @param now 종료 시각
     * @return 종료 레코드
     * @throws com.ryuqq.agentmesh.core.exception.InvalidTransitionException 허용되지 않은 전이인 경우
     */
    public TaskRecord toTerminal(TaskOutcome outcome, long now) {
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
        TaskStatus next = statusOf(outcome);
        TaskTransition.validate(status, next);
        return new TaskRecord(taskId, owner, input, next, outcome, submittedAt, startedAt, now);
    }

    private static TaskStatus statusOf(TaskOutcome outcome) {
        if (outcome instanceof Completed) {
            return TaskStatus.COMPLETED;
        }
        if (outcome instanceof TimedOut) {
            return TaskStatus.TIMED_OUT;
        }
        return TaskStatus.FAILED;
    }

    public TaskId getTaskId() {
        return taskId;
    }

    public AgentId getOwner() {
        return owner;
    }

    public Payload getInput() {
        return input;
    }

    public TaskStatus getStatus() {
        return status;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public Optional<TaskOutcome> getOutcome() {
        return Optional.ofNullable(outcome);
    }

    /**
     * 성공 산출물 조회.
     *
     * @return COMPLETED 인 경우 산출물
     */
    public Optional<TaskOutput> getResult() {
        if (outcome instanceof Completed completed) {
            return Optional.of(completed.output());
        }
        return Optional.empty();
    }

    /**
     * 실패 정보 조회.
     *
     * @return FAILED 또는 TIMED_OUT 인 경우 오류
     */
    public Optional<TaskError> getError() {
        if (outcome instanceof Failed failed) {
            return Optional.of(failed.error());
        }
        if (outcome instanceof TimedOut timedOut) {
            return Optional.of(timedOut.error());
        }
        return Optional.empty();
    }

    public long getSubmittedAt() {
        return submittedAt;
    }

    public OptionalLong getStartedAt() {
        return startedAt == ABSENT ? OptionalLong.empty() : OptionalLong.of(startedAt);
    }

    public OptionalLong getCompletedAt() {
        return completedAt == ABSENT ? OptionalLong.empty() : OptionalLong.of(completedAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TaskRecord that = (TaskRecord) o;
        return submittedAt == that.submittedAt
            && startedAt == that.startedAt
            && completedAt == that.completedAt
            && taskId.equals(that.taskId)
            && owner.equals(that.owner)
            && input.equals(that.input)
            && status == that.status
            && Objects.equals(outcome, that.outcome);
    }

    @Override
    public int hashCode() {
        return Objects.hash(taskId, status, completedAt);
    }

    @Override
    public String toString() {
        return "TaskRecord{" +
            "taskId=" + taskId.getValue() +
            ", owner=" + owner.getValue() +
            ", status=" + status +
            '}';
    }
}
