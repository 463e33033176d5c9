package com.ryuqq.agentmesh.adapter.runner;

import com.ryuqq.agentmesh.application.agent.ConfidenceScorer;
import com.ryuqq.agentmesh.application.agent.Draft;
import com.ryuqq.agentmesh.application.agent.HeuristicConfidenceScorer;
import com.ryuqq.agentmesh.application.agent.TaskContext;
import com.ryuqq.agentmesh.application.agent.TaskProcessor;
import com.ryuqq.agentmesh.application.messaging.CommunicationHandler;
import com.ryuqq.agentmesh.application.runtime.AgentRuntime;
import com.ryuqq.agentmesh.application.runtime.RuntimeMetrics;
import com.ryuqq.agentmesh.core.contract.Envelope;
import com.ryuqq.agentmesh.core.exception.AgentMeshException;
import com.ryuqq.agentmesh.core.exception.NotStartedException;
import com.ryuqq.agentmesh.core.exception.TaskFailedException;
import com.ryuqq.agentmesh.core.exception.TaskTimedOutException;
import com.ryuqq.agentmesh.core.model.AgentId;
import com.ryuqq.agentmesh.core.model.Payload;
import com.ryuqq.agentmesh.core.model.TaskId;
import com.ryuqq.agentmesh.core.model.TaskRecord;
import com.ryuqq.agentmesh.core.outcome.Completed;
import com.ryuqq.agentmesh.core.outcome.Failed;
import com.ryuqq.agentmesh.core.outcome.TaskError;
import com.ryuqq.agentmesh.core.outcome.TaskOutcome;
import com.ryuqq.agentmesh.core.outcome.TaskOutput;
import com.ryuqq.agentmesh.core.outcome.TimedOut;
import com.ryuqq.agentmesh.core.spi.CompletionCapability;
import com.ryuqq.agentmesh.core.spi.InboundHandler;
import com.ryuqq.agentmesh.core.spi.MemoryCapability;
import com.ryuqq.agentmesh.core.spi.TaskRegistry;
import com.ryuqq.agentmesh.core.statemachine.RuntimeState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Supplier;

/**
 * Worker pool 기반 AgentRuntime 구현체.
 *
 * <p>제출된 Task를 큐에 넣고 워커 스레드가 하나씩 꺼내 {@link TaskProcessor}로 처리합니다.
 * 처리기는 별도의 capability executor에서 실행되어 Task 기한을 넘기면 워커가 먼저 빠져나옵니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>Task 생성 및 큐잉 (호출자는 외부 기능 호출을 기다리지 않음)</li>
 *   <li>Task 처리 결과를 TaskRegistry에 반영 (completed, failed, timed_out)</li>
 *   <li>수신 request Envelope을 Task로 변환하고 결과를 response로 회신</li>
 *   <li>종료 시 시작되지 않은 Task를 AGENT_STOPPED로 실패 처리</li>
 * </ul>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * submitTask(input)
 *   ↓
 * registry.create → workers.execute(TaskJob)
 *   ↓
 * TaskJob.run():
 *   1. registry.markRunning(taskId)
 *   2. capabilityExecutor.submit(processor.process(context))
 *   3. future.get(taskDeadlineMs):
 *      - Draft        → scorer.score → registry.complete
 *      - 예외          → registry.fail(TaskError.from(cause))
 *      - 기한 초과      → future.cancel + registry.timeOut(DEADLINE_EXCEEDED)
 *   4. request에서 온 Task라면 response 회신
 * </pre>
 *
 * <p><strong>동시성 제어:</strong></p>
 * <ul>
 *   <li>워커 수 = {@link RuntimeConfig#concurrency()}; 1이면 제출 순서대로 직렬 처리</li>
 *   <li>상태 전이는 AtomicReference&lt;RuntimeState&gt; CAS로 보호</li>
 *   <li>Task별 예외는 해당 Task에만 기록되고 워커는 계속 동작</li>
 * </ul>
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public final class AgentWorkerRunner implements AgentRuntime {

    private static final Logger log = LoggerFactory.getLogger(AgentWorkerRunner.class);

    private final AgentId agentId;
    private final TaskProcessor processor;
    private final TaskRegistry registry;
    private final CompletionCapability completion;
    private final MemoryCapability memory;
    private final ConfidenceScorer scorer;
    private final RuntimeConfig config;
    private final CommunicationHandler messaging;

    private final AtomicReference<RuntimeState> state = new AtomicReference<>(RuntimeState.STOPPED);
    private volatile ThreadPoolExecutor workers;
    private volatile ExecutorService capabilityExecutor;
    private volatile InboundHandler messageListener;

    private final LongAdder tasksCompleted = new LongAdder();
    private final LongAdder tasksFailed = new LongAdder();
    private final LongAdder tasksTimedOut = new LongAdder();
    private final LongAdder totalProcessingTimeMs = new LongAdder();
    private volatile long lastActivityAt;

    /**
     * 생성자 (기본 채점기, 메시징 없음).
     *
     * @param agentId Agent ID
     * @param processor Task 처리기
     * @param registry Task 저장소
     * @param completion 텍스트 생성 기능
     * @param memory 기억 기능
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public AgentWorkerRunner(AgentId agentId, TaskProcessor processor, TaskRegistry registry,
                             CompletionCapability completion, MemoryCapability memory, RuntimeConfig config) {
        this(agentId, processor, registry, completion, memory, new HeuristicConfidenceScorer(), config, null);
    }

    /**
     * 생성자 (커스텀 채점기, 선택적 메시징).
     *
     * @param scorer 결과 신뢰도 채점기
     * @param messaging 메시징 핸들러 (null이면 inbox를 등록하지 않음)
     * @throws IllegalArgumentException messaging 외의 의존성이 null인 경우
     */
    public AgentWorkerRunner(AgentId agentId, TaskProcessor processor, TaskRegistry registry,
                             CompletionCapability completion, MemoryCapability memory, ConfidenceScorer scorer,
                             RuntimeConfig config, CommunicationHandler messaging) {
        if (agentId == null) {
            throw new IllegalArgumentException("agentId cannot be null");
        }
        if (processor == null) {
            throw new IllegalArgumentException("processor cannot be null");
        }
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (completion == null) {
            throw new IllegalArgumentException("completion cannot be null");
        }
        if (memory == null) {
            throw new IllegalArgumentException("memory cannot be null");
        }
        if (scorer == null) {
            throw new IllegalArgumentException("scorer cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.agentId = agentId;
        this.processor = processor;
        this.registry = registry;
        this.completion = completion;
        this.memory = memory;
        this.scorer = scorer;
        this.config = config;
        this.messaging = messaging;
    }

    @Override
    public AgentId agentId() {
        return agentId;
    }

    @Override
    public RuntimeState state() {
        return state.get();
    }

    /**
     * request 이외의 수신 Envelope을 받을 리스너 지정.
     *
     * @param listener 리스너 (null이면 해당 Envelope은 로그만 남김)
     */
    public void setMessageListener(InboundHandler listener) {
        this.messageListener = listener;
    }

    @Override
    public void start() {
        if (!state.compareAndSet(RuntimeState.STOPPED, RuntimeState.STARTING)) {
            throw new IllegalStateException("Agent " + agentId.getValue() + " cannot start from state " + state.get());
        }
        String prefix = "agentmesh-" + agentId.getValue();
        workers = new ThreadPoolExecutor(
            config.concurrency(), config.concurrency(), 0L, TimeUnit.MILLISECONDS,
            new LinkedBlockingQueue<>(), daemonThreads(prefix + "-worker"));
        capabilityExecutor = Executors.newCachedThreadPool(daemonThreads(prefix + "-capability"));
        state.set(RuntimeState.RUNNING);

        // inbox opens only once requests can be queued
        if (messaging != null) {
            try {
                messaging.register(agentId, this::onEnvelope);
            } catch (RuntimeException e) {
                state.set(RuntimeState.STOPPED);
                abandon(workers.shutdownNow());
                capabilityExecutor.shutdownNow();
                throw e;
            }
        }
        log.info("Agent {} started (concurrency {}, deadline {}ms)",
            agentId.getValue(), config.concurrency(), config.taskDeadlineMs());
    }

    @Override
    public void stop() {
        if (!state.compareAndSet(RuntimeState.RUNNING, RuntimeState.STOPPING)) {
            return;
        }
        log.info("Agent {} stopping", agentId.getValue());

        if (messaging != null) {
            try {
                messaging.deregister(agentId);
            } catch (RuntimeException e) {
                log.warn("Deregistering agent {} failed: {}", agentId.getValue(), e.getMessage());
            }
        }

        ThreadPoolExecutor currentWorkers = workers;
        currentWorkers.shutdown();
        try {
            if (!currentWorkers.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
                abandon(currentWorkers.shutdownNow());
                if (!currentWorkers.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
                    log.warn("Agent {} workers did not terminate in time", agentId.getValue());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abandon(currentWorkers.shutdownNow());
        } finally {
            capabilityExecutor.shutdownNow();
            state.set(RuntimeState.STOPPED);
        }
        log.info("Agent {} stopped", agentId.getValue());
    }

    @Override
    public TaskId submitTask(Payload input) {
        return enqueue(input == null ? Payload.empty() : input, null);
    }

    @Override
    public TaskOutput getTaskResult(TaskId taskId, Duration timeout) {
        TaskRecord record = registry.awaitResult(taskId, timeout);
        TaskOutcome outcome = record.getOutcome()
            .orElseThrow(() -> new IllegalStateException("terminal task without outcome: " + taskId.getValue()));
        if (outcome instanceof Completed completed) {
            return completed.output();
        }
        if (outcome instanceof Failed failed) {
            throw new TaskFailedException(taskId, failed.error());
        }
        TimedOut timedOut = (TimedOut) outcome;
        throw new TaskTimedOutException(taskId, timedOut.error());
    }

    @Override
    public RuntimeMetrics metrics() {
        return new RuntimeMetrics(
            state.get(),
            tasksCompleted.sum(),
            tasksFailed.sum(),
            tasksTimedOut.sum(),
            totalProcessingTimeMs.sum(),
            lastActivityAt
        );
    }

    private TaskId enqueue(Payload input, Envelope request) {
        RuntimeState current = state.get();
        if (!current.acceptsWork()) {
            throw new NotStartedException(current);
        }
        TaskId taskId = registry.create(agentId, input);
        try {
            workers.execute(new TaskJob(taskId, input, request));
        } catch (RejectedExecutionException e) {
            registry.fail(taskId, stoppedError());
            throw new NotStartedException(state.get());
        }
        log.debug("Task {} queued on agent {}", taskId.getValue(), agentId.getValue());
        return taskId;
    }

    private void onEnvelope(Envelope envelope) {
        if (envelope.kind().isRequest()) {
            try {
                enqueue(envelope.payload(), envelope);
            } catch (NotStartedException e) {
                respond(envelope, Payload.of("status", "failed")
                    .with("error", TaskError.of(e.getErrorCode(), e.getMessage()).toPayload()));
            }
            return;
        }
        InboundHandler listener = messageListener;
        if (listener != null) {
            listener.handle(envelope);
        } else {
            log.debug("Agent {} ignored {} envelope {}",
                agentId.getValue(), envelope.kind().getValue(), envelope.id().getValue());
        }
    }

    private void abandon(List<Runnable> neverStarted) {
        for (Runnable runnable : neverStarted) {
            if (runnable instanceof TaskJob job) {
                TaskRecord record = finish(job.taskId, () -> registry.fail(job.taskId, stoppedError()));
                if (record != null) {
                    tasksFailed.increment();
                    job.replyIfRequested(record);
                }
            }
        }
        if (!neverStarted.isEmpty()) {
            log.warn("Agent {} failed {} queued tasks on stop", agentId.getValue(), neverStarted.size());
        }
    }

    private TaskRecord finish(TaskId taskId, Supplier<TaskRecord> transition) {
        try {
            return transition.get();
        } catch (AgentMeshException e) {
            log.warn("Could not record outcome of task {}: {}", taskId.getValue(), e.getMessage());
            return null;
        }
    }

    private void respond(Envelope request, Payload payload) {
        if (messaging == null) {
            return;
        }
        try {
            messaging.respond(request, agentId, payload);
        } catch (RuntimeException e) {
            log.warn("Replying to {} failed: {}", request.from().getValue(), e.getMessage());
        }
    }

    private TaskError stoppedError() {
        return TaskError.of(TaskError.AGENT_STOPPED, "Agent " + agentId.getValue() + " stopped before the task finished");
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * 큐에 들어간 Task 하나.
     */
    private final class TaskJob implements Runnable {

        private final TaskId taskId;
        private final Payload input;
        private final Envelope request;

        private TaskJob(TaskId taskId, Payload input, Envelope request) {
            this.taskId = taskId;
            this.input = input;
            this.request = request;
        }

        @Override
        public void run() {
            long startedNanos = System.nanoTime();
            try {
                registry.markRunning(taskId);
            } catch (AgentMeshException e) {
                log.warn("Task {} could not start: {}", taskId.getValue(), e.getMessage());
                return;
            }

            TaskRecord record = process();

            totalProcessingTimeMs.add(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos));
            lastActivityAt = System.currentTimeMillis();
            if (record != null) {
                replyIfRequested(record);
            }
        }

        private TaskRecord process() {
            TaskContext context = new TaskContext(
                taskId, agentId, input, completion, memory, config.completionOptions(), scorer);
            Future<Draft> future = null;
            try {
                future = capabilityExecutor.submit(() -> processor.process(context));
                Draft draft = future.get(config.taskDeadlineMs(), TimeUnit.MILLISECONDS);
                TaskOutput output = new TaskOutput(draft.toPayload(), scorer.score(draft));
                tasksCompleted.increment();
                log.debug("Task {} completed (confidence {})", taskId.getValue(), output.confidence());
                return finish(taskId, () -> registry.complete(taskId, output));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                TaskError error = TaskError.from(cause);
                log.warn("Task {} failed: {} - {}", taskId.getValue(), error.code(), error.message());
                tasksFailed.increment();
                return finish(taskId, () -> registry.fail(taskId, error));
            } catch (TimeoutException e) {
                future.cancel(true);
                TaskError error = TaskError.of(TaskError.DEADLINE_EXCEEDED,
                    "Task exceeded its deadline of " + config.taskDeadlineMs() + "ms");
                log.warn("Task {} timed out after {}ms", taskId.getValue(), config.taskDeadlineMs());
                tasksTimedOut.increment();
                return finish(taskId, () -> registry.timeOut(taskId, error));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                if (future != null) {
                    future.cancel(true);
                }
                tasksFailed.increment();
                return finish(taskId, () -> registry.fail(taskId, stoppedError()));
            } catch (RuntimeException e) {
                TaskError error = TaskError.from(e);
                log.error("Task {} failed unexpectedly", taskId.getValue(), e);
                tasksFailed.increment();
                return finish(taskId, () -> registry.fail(taskId, error));
            }
        }

        private void replyIfRequested(TaskRecord record) {
            if (request == null) {
                return;
            }
            Payload payload = Payload.of("status", record.getStatus().wireValue(), "task_id", taskId.getValue());
            if (record.getResult().isPresent()) {
                payload = payload.with("result", record.getResult().get().toPayload());
            }
            if (record.getError().isPresent()) {
                payload = payload.with("error", record.getError().get().toPayload());
            }
            respond(request, payload);
        }
    }
}
