package com.ryuqq.agentmesh.adapter.runner;

import com.ryuqq.agentmesh.adapter.inmemory.memory.InMemoryMemoryStore;
import com.ryuqq.agentmesh.adapter.inmemory.task.InMemoryTaskRegistry;
import com.ryuqq.agentmesh.adapter.inmemory.transport.InMemoryTransport;
import com.ryuqq.agentmesh.application.agent.Draft;
import com.ryuqq.agentmesh.application.agent.HeuristicConfidenceScorer;
import com.ryuqq.agentmesh.application.agent.ResearchProcessor;
import com.ryuqq.agentmesh.application.agent.TaskProcessor;
import com.ryuqq.agentmesh.application.messaging.CommunicationHandler;
import com.ryuqq.agentmesh.application.runtime.RuntimeMetrics;
import com.ryuqq.agentmesh.core.contract.Envelope;
import com.ryuqq.agentmesh.core.exception.NotStartedException;
import com.ryuqq.agentmesh.core.exception.TaskFailedException;
import com.ryuqq.agentmesh.core.exception.TaskTimedOutException;
import com.ryuqq.agentmesh.core.exception.TransportUnavailableException;
import com.ryuqq.agentmesh.core.model.AgentId;
import com.ryuqq.agentmesh.core.model.Payload;
import com.ryuqq.agentmesh.core.model.TaskId;
import com.ryuqq.agentmesh.core.model.TaskRecord;
import com.ryuqq.agentmesh.core.outcome.TaskError;
import com.ryuqq.agentmesh.core.outcome.TaskOutput;
import com.ryuqq.agentmesh.core.spi.CapabilityError;
import com.ryuqq.agentmesh.core.spi.InboundHandler;
import com.ryuqq.agentmesh.core.statemachine.RuntimeState;
import com.ryuqq.agentmesh.core.statemachine.TaskStatus;
import com.ryuqq.agentmesh.testkit.fake.ScriptedCompletionCapability;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

/**
 * AgentWorkerRunner 테스트.
 *
 * <p>실제 InMemoryTaskRegistry와 스크립트 기반 생성 기능으로 검증합니다:</p>
 * <ul>
 *   <li>동시 제출된 Task가 모두 종료 상태에 도달</li>
 *   <li>생성 기능 오류 → failed, 기한 초과 → timed_out</li>
 *   <li>stop() 시 대기 중인 Task → AGENT_STOPPED</li>
 *   <li>수신 request → 상관관계가 유지된 response</li>
 * </ul>
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
class AgentWorkerRunnerTest {

    private static final AgentId AGENT = AgentId.of("research-1");
    private static final AgentId CLIENT = AgentId.of("client");
    private static final Duration WAIT = Duration.ofSeconds(5);

    private InMemoryTaskRegistry registry;
    private InMemoryMemoryStore memory;
    private ScriptedCompletionCapability completion;
    private AgentWorkerRunner runner;

    @BeforeEach
    void setUp() {
        registry = new InMemoryTaskRegistry();
        memory = new InMemoryMemoryStore();
        completion = new ScriptedCompletionCapability("Findings. See https://example.org/report.");
    }

    @AfterEach
    void tearDown() {
        if (runner != null) {
            runner.stop();
        }
    }

    @Test
    void 동시에_제출된_100개_Task가_모두_종료된다() throws Exception {
        // given
        runner = new AgentWorkerRunner(AGENT, context -> Draft.of("done " + context.taskId().getValue()),
            registry, completion, memory, new RuntimeConfig().withConcurrency(4));
        runner.start();
        ExecutorService submitters = Executors.newFixedThreadPool(8);

        // when
        List<Future<TaskId>> futures = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            futures.add(submitters.submit(() -> runner.submitTask(Payload.of("query", "q"))));
        }
        List<TaskId> ids = new ArrayList<>();
        for (Future<TaskId> future : futures) {
            ids.add(future.get(5, TimeUnit.SECONDS));
        }
        submitters.shutdown();
        for (TaskId id : ids) {
            runner.getTaskResult(id, WAIT);
        }

        // then
        List<TaskRecord> records = registry.findByOwner(AGENT);
        assertThat(records).hasSize(100);
        assertThat(records).allSatisfy(record -> assertThat(record.getStatus()).isEqualTo(TaskStatus.COMPLETED));
        assertThat(ids).doesNotHaveDuplicates();
    }

    @Test
    void 생성_기능이_QUOTA_EXCEEDED이면_Task는_failed() {
        // given
        completion.thenFail(CapabilityError.QUOTA_EXCEEDED);
        runner = new AgentWorkerRunner(AGENT, new ResearchProcessor(), registry, completion, memory,
            new RuntimeConfig());
        runner.start();

        // when
        TaskId taskId = runner.submitTask(Payload.of("query", "quantum batteries"));

        // then
        assertThatThrownBy(() -> runner.getTaskResult(taskId, WAIT))
            .isInstanceOf(TaskFailedException.class)
            .satisfies(e -> assertThat(((TaskFailedException) e).getError().code()).isEqualTo("QUOTA_EXCEEDED"));
        assertThat(registry.find(taskId).getStatus()).isEqualTo(TaskStatus.FAILED);
    }

    @Test
    void 처리기가_입력을_거부하면_PROCESSING_ERROR로_failed() {
        // given
        runner = new AgentWorkerRunner(AGENT, new ResearchProcessor(), registry, completion, memory,
            new RuntimeConfig());
        runner.start();

        // when
        TaskId taskId = runner.submitTask(Payload.empty());

        // then
        assertThatThrownBy(() -> runner.getTaskResult(taskId, WAIT))
            .isInstanceOf(TaskFailedException.class)
            .satisfies(e -> assertThat(((TaskFailedException) e).getError().code())
                .isEqualTo(TaskError.PROCESSING_ERROR));
        assertThat(completion.callCount()).isZero();
    }

    @Test
    void 기한을_넘긴_Task는_timed_out() {
        // given
        completion.thenAnswerAfter(Duration.ofSeconds(5), "too late");
        runner = new AgentWorkerRunner(AGENT, new ResearchProcessor(), registry, completion, memory,
            new RuntimeConfig().withTaskDeadlineMs(200));
        runner.start();

        // when
        TaskId taskId = runner.submitTask(Payload.of("query", "slow topic"));

        // then
        assertThatThrownBy(() -> runner.getTaskResult(taskId, WAIT))
            .isInstanceOf(TaskTimedOutException.class)
            .satisfies(e -> assertThat(((TaskTimedOutException) e).getError().code())
                .isEqualTo(TaskError.DEADLINE_EXCEEDED));
        assertThat(registry.find(taskId).getStatus()).isEqualTo(TaskStatus.TIMED_OUT);
        assertThat(runner.metrics().tasksTimedOut()).isEqualTo(1);
    }

    @Test
    void 시작_전_제출은_NotStartedException() {
        // given
        runner = new AgentWorkerRunner(AGENT, new ResearchProcessor(), registry, completion, memory,
            new RuntimeConfig());

        // when & then
        assertThatThrownBy(() -> runner.submitTask(Payload.of("query", "q")))
            .isInstanceOf(NotStartedException.class);
        assertThat(registry.size()).isZero();
    }

    @Test
    void stop은_대기중인_Task를_AGENT_STOPPED로_실패시킨다() throws Exception {
        // given
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        TaskProcessor blocking = context -> {
            started.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("interrupted");
            }
            return Draft.of("never");
        };
        runner = new AgentWorkerRunner(AGENT, blocking, registry, completion, memory,
            new RuntimeConfig().withShutdownTimeoutMs(100).withTaskDeadlineMs(10_000));
        runner.start();
        TaskId running = runner.submitTask(Payload.of("query", "first"));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        TaskId queued1 = runner.submitTask(Payload.of("query", "second"));
        TaskId queued2 = runner.submitTask(Payload.of("query", "third"));

        // when
        runner.stop();

        // then
        assertThat(runner.state()).isEqualTo(RuntimeState.STOPPED);
        for (TaskId id : List.of(running, queued1, queued2)) {
            TaskRecord record = registry.awaitResult(id, WAIT);
            assertThat(record.getStatus()).isEqualTo(TaskStatus.FAILED);
            assertThat(record.getError()).hasValueSatisfying(
                error -> assertThat(error.code()).isEqualTo(TaskError.AGENT_STOPPED));
        }
        assertThatThrownBy(() -> runner.submitTask(Payload.of("query", "late")))
            .isInstanceOf(NotStartedException.class);
        release.countDown();
    }

    @Test
    void 정지_후_다시_시작할_수_있다() {
        // given
        runner = new AgentWorkerRunner(AGENT, new ResearchProcessor(), registry, completion, memory,
            new RuntimeConfig());
        runner.start();
        runner.stop();

        // when
        runner.start();
        TaskId taskId = runner.submitTask(Payload.of("query", "again"));

        // then
        assertThat(runner.getTaskResult(taskId, WAIT).result().getString("text")).isPresent();
        assertThat(runner.state()).isEqualTo(RuntimeState.RUNNING);
    }

    @Test
    void 실행중에_start를_다시_호출하면_예외() {
        runner = new AgentWorkerRunner(AGENT, new ResearchProcessor(), registry, completion, memory,
            new RuntimeConfig());
        runner.start();

        assertThatThrownBy(() -> runner.start()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void getTaskResult는_여러번_호출해도_같은_결과() {
        // given
        runner = new AgentWorkerRunner(AGENT, new ResearchProcessor(), registry, completion, memory,
            new RuntimeConfig());
        runner.start();
        TaskId taskId = runner.submitTask(Payload.of("query", "idempotent reads"));

        // when
        TaskOutput first = runner.getTaskResult(taskId, WAIT);
        TaskOutput second = runner.getTaskResult(taskId, WAIT);

        // then
        assertThat(second).isEqualTo(first);
        assertThat(first.result().getList("sources")).hasSize(1);
        assertThat(first.confidence())
            .isEqualTo(new HeuristicConfidenceScorer().score("Findings. See https://example.org/report.", 1));
    }

    @Test
    void metrics는_처리_결과를_집계한다() {
        // given
        completion.thenAnswer("first").thenFail(CapabilityError.INVALID_REQUEST).thenAnswer("third");
        runner = new AgentWorkerRunner(AGENT, new ResearchProcessor(), registry, completion, memory,
            new RuntimeConfig());
        runner.start();

        // when
        List<TaskId> ids = List.of(
            runner.submitTask(Payload.of("query", "a")),
            runner.submitTask(Payload.of("query", "b")),
            runner.submitTask(Payload.of("query", "c")));
        for (TaskId id : ids) {
            registry.awaitResult(id, WAIT);
        }

        // then
        RuntimeMetrics metrics = runner.metrics();
        assertThat(metrics.state()).isEqualTo(RuntimeState.RUNNING);
        assertThat(metrics.tasksCompleted()).isEqualTo(2);
        assertThat(metrics.tasksFailed()).isEqualTo(1);
        assertThat(metrics.tasksTimedOut()).isZero();
        assertThat(metrics.tasksProcessed()).isEqualTo(3);
    }

    @Test
    void 수신_request는_상관관계가_유지된_response로_회신된다() {
        // given
        InMemoryTransport transport = new InMemoryTransport();
        CommunicationHandler messaging = new CommunicationHandler(transport);
        runner = new AgentWorkerRunner(AGENT, new ResearchProcessor(), registry, completion, memory,
            new HeuristicConfidenceScorer(), new RuntimeConfig(), messaging);
        runner.start();
        messaging.register(CLIENT, envelope -> { });
        Envelope request = Envelope.request(CLIENT, AGENT, Payload.of("query", "mesh networking"));

        try {
            // when
            Envelope response = messaging.sendAndWait(AGENT, request, WAIT);

            // then
            assertThat(response.correlationId()).isEqualTo(request.id());
            assertThat(response.from()).isEqualTo(AGENT);
            assertThat(response.payload().getString("status")).contains("completed");
            assertThat(response.payload().getString("task_id")).isPresent();
            assertThat(response.payload().getPayload("result"))
                .hasValueSatisfying(result -> assertThat(result.getString("text")).isPresent());
        } finally {
            runner.stop();
            runner = null;
            messaging.shutdown();
            transport.close();
        }
    }

    @Test
    void 실패한_request는_error를_담아_회신된다() {
        // given
        completion.thenFail(CapabilityError.QUOTA_EXCEEDED);
        InMemoryTransport transport = new InMemoryTransport();
        CommunicationHandler messaging = new CommunicationHandler(transport);
        runner = new AgentWorkerRunner(AGENT, new ResearchProcessor(), registry, completion, memory,
            new HeuristicConfidenceScorer(), new RuntimeConfig(), messaging);
        runner.start();
        messaging.register(CLIENT, envelope -> { });

        try {
            // when
            Envelope response = messaging.sendAndWait(AGENT,
                Envelope.request(CLIENT, AGENT, Payload.of("query", "q")), WAIT);

            // then
            assertThat(response.payload().getString("status")).contains("failed");
            assertThat(response.payload().getPayload("error"))
                .hasValueSatisfying(error -> assertThat(error.getString("code")).contains("QUOTA_EXCEEDED"));
        } finally {
            runner.stop();
            runner = null;
            messaging.shutdown();
            transport.close();
        }
    }

    @Test
    void request가_아닌_Envelope은_리스너로_전달된다() throws Exception {
        // given
        InMemoryTransport transport = new InMemoryTransport();
        CommunicationHandler messaging = new CommunicationHandler(transport);
        runner = new AgentWorkerRunner(AGENT, new ResearchProcessor(), registry, completion, memory,
            new HeuristicConfidenceScorer(), new RuntimeConfig(), messaging);
        List<Envelope> received = new CopyOnWriteArrayList<>();
        runner.setMessageListener(received::add);
        runner.start();
        messaging.register(CLIENT, envelope -> { });

        try {
            // when
            messaging.send(AGENT, Envelope.notification(CLIENT, AGENT, Payload.of("note", "hello")));
            messaging.broadcast(Envelope.broadcast(CLIENT, Payload.of("note", "everyone")));

            // then
            awaitCondition(() -> received.size() == 2);
            assertThat(registry.size()).isZero();
        } finally {
            runner.stop();
            runner = null;
            messaging.shutdown();
            transport.close();
        }
    }

    @Test
    void stop하면_메시징_등록이_해제된다() {
        // given
        InMemoryTransport transport = new InMemoryTransport();
        CommunicationHandler messaging = new CommunicationHandler(transport);
        runner = new AgentWorkerRunner(AGENT, new ResearchProcessor(), registry, completion, memory,
            new HeuristicConfidenceScorer(), new RuntimeConfig(), messaging);
        runner.start();
        assertThat(messaging.isRegistered(AGENT)).isTrue();

        // when
        runner.stop();

        // then
        assertThat(messaging.isRegistered(AGENT)).isFalse();
        messaging.shutdown();
        transport.close();
    }

    @Test
    void synthesis_Agent는_research_Agent에게_질의한_결과를_종합한다() {
        // given
        InMemoryTransport transport = new InMemoryTransport();
        CommunicationHandler messaging = new CommunicationHandler(transport);
        AgentFactory factory = new AgentFactory(registry, completion, memory, messaging,
            new RuntimeConfig().withConcurrency(2));
        AgentId synthesizerId = AgentId.of("synthesis-1");
        runner = factory.createResearchAgent(AGENT);
        AgentWorkerRunner synthesizer = factory.createSynthesisAgent(synthesizerId);
        runner.start();
        synthesizer.start();

        try {
            // when
            TaskId taskId = synthesizer.submitTask(Payload.of("topic", "energy storage")
                .with("research_queries", List.of("quantum batteries", "solid-state cells"))
                .with("research_agent", AGENT.getValue()));
            TaskOutput output = synthesizer.getTaskResult(taskId, WAIT);

            // then
            assertThat(output.result().getLong("research_results_used")).contains(2L);
            assertThat(output.result().getLong("sources_analyzed")).contains(2L);
            assertThat(output.result().getList("sources")).hasSize(2);
            assertThat(registry.findByOwner(AGENT))
                .hasSize(2)
                .allSatisfy(record -> assertThat(record.getStatus()).isEqualTo(TaskStatus.COMPLETED));
            assertThat(completion.prompts())
                .anySatisfy(prompt -> assertThat(prompt).contains("Source 2 (research):\nFindings."));
        } finally {
            synthesizer.stop();
            runner.stop();
            runner = null;
            messaging.shutdown();
            transport.close();
        }
    }

    @Test
    void inbox_등록_시점에는_이미_RUNNING이라_즉시_도착한_request도_처리된다() {
        // given
        CommunicationHandler messaging = mock(CommunicationHandler.class);
        Envelope request = Envelope.request(CLIENT, AGENT, Payload.of("query", "early bird"));
        AtomicReference<RuntimeState> stateAtRegister = new AtomicReference<>();
        runner = new AgentWorkerRunner(AGENT, new ResearchProcessor(), registry, completion, memory,
            new HeuristicConfidenceScorer(), new RuntimeConfig(), messaging);
        doAnswer(invocation -> {
            stateAtRegister.set(runner.state());
            InboundHandler inbox = invocation.getArgument(1);
            inbox.handle(request);
            return null;
        }).when(messaging).register(eq(AGENT), any(InboundHandler.class));

        // when
        runner.start();

        // then
        assertThat(stateAtRegister.get()).isEqualTo(RuntimeState.RUNNING);
        verify(messaging, timeout(5000)).respond(eq(request), eq(AGENT),
            argThat(payload -> payload.getString("status").filter("completed"::equals).isPresent()));
        assertThat(registry.findByOwner(AGENT)).hasSize(1);
    }

    @Test
    void inbox_등록에_실패하면_STOPPED로_되돌리고_다시_시작할_수_있다() {
        // given
        CommunicationHandler messaging = mock(CommunicationHandler.class);
        doThrow(new TransportUnavailableException("broker down"))
            .doNothing()
            .when(messaging).register(eq(AGENT), any(InboundHandler.class));
        runner = new AgentWorkerRunner(AGENT, new ResearchProcessor(), registry, completion, memory,
            new HeuristicConfidenceScorer(), new RuntimeConfig(), messaging);

        // when & then
        assertThatThrownBy(() -> runner.start()).isInstanceOf(TransportUnavailableException.class);
        assertThat(runner.state()).isEqualTo(RuntimeState.STOPPED);
        assertThatThrownBy(() -> runner.submitTask(Payload.of("query", "q")))
            .isInstanceOf(NotStartedException.class);

        runner.start();
        assertThat(runner.state()).isEqualTo(RuntimeState.RUNNING);
        TaskId taskId = runner.submitTask(Payload.of("query", "after retry"));
        assertThat(runner.getTaskResult(taskId, WAIT).result().getString("text")).isPresent();
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                throw new AssertionError("condition not met within 5s");
            }
            Thread.sleep(10);
        }
    }
}
