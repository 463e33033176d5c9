package com.ryuqq.agentmesh.adapter.inmemory.task;

import com.ryuqq.agentmesh.core.exception.InvalidTransitionException;
import com.ryuqq.agentmesh.core.exception.UnknownTaskException;
import com.ryuqq.agentmesh.core.model.AgentId;
import com.ryuqq.agentmesh.core.model.Payload;
import com.ryuqq.agentmesh.core.model.TaskId;
import com.ryuqq.agentmesh.core.outcome.TaskError;
import com.ryuqq.agentmesh.core.outcome.TaskOutput;
import com.ryuqq.agentmesh.core.statemachine.TaskStatus;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryTaskRegistry 동시성 테스트.
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
class InMemoryTaskRegistryTest {

    private final InMemoryTaskRegistry registry = new InMemoryTaskRegistry();
    private final AgentId owner = AgentId.of("agent-1");

    @Test
    void 동시에_종료를_시도하면_정확히_하나만_성공한다() throws InterruptedException {
        // given
        TaskId taskId = registry.create(owner, Payload.empty());
        registry.markRunning(taskId);
        int contenders = 16;
        ExecutorService executor = Executors.newFixedThreadPool(contenders);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(contenders);
        AtomicInteger winners = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();

        // when
        for (int i = 0; i < contenders; i++) {
            int index = i;
            executor.submit(() -> {
                try {
                    start.await();
                    if (index % 2 == 0) {
                        registry.complete(taskId, TaskOutput.of(Payload.of("winner", index)));
                    } else {
                        registry.fail(taskId, TaskError.of("X", "loser " + index));
                    }
                    winners.incrementAndGet();
                } catch (InvalidTransitionException e) {
                    rejected.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();

        // then
        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        executor.shutdownNow();
        assertThat(winners.get()).isEqualTo(1);
        assertThat(rejected.get()).isEqualTo(contenders - 1);
        assertThat(registry.find(taskId).getStatus().isTerminal()).isTrue();
    }

    @Test
    void 백개의_태스크를_동시에_생성해도_식별자가_모두_다르다() throws InterruptedException {
        // given
        ExecutorService executor = Executors.newFixedThreadPool(8);
        List<TaskId> ids = java.util.Collections.synchronizedList(new ArrayList<>());
        CountDownLatch done = new CountDownLatch(100);

        // when
        for (int i = 0; i < 100; i++) {
            executor.submit(() -> {
                ids.add(registry.create(owner, Payload.empty()));
                done.countDown();
            });
        }

        // then
        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        executor.shutdownNow();
        assertThat(ids).doesNotHaveDuplicates().hasSize(100);
        assertThat(registry.findByOwner(owner)).hasSize(100);
        assertThat(registry.findByOwner(owner)).allMatch(record -> record.getStatus() == TaskStatus.PENDING);
    }

    @Test
    void 보존기간이_0이하이면_생성에_실패한다() {
        assertThatThrownBy(() -> new InMemoryTaskRegistry(Duration.ZERO, Clock.systemUTC()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("retention");
    }

    @Test
    void clear는_모든_레코드를_제거한다() {
        // given
        TaskId pending = registry.create(owner, Payload.empty());
        TaskId finished = registry.create(owner, Payload.empty());
        registry.markRunning(finished);
        registry.complete(finished, TaskOutput.of(Payload.of("text", "done")));

        // when
        registry.clear();

        // then
        assertThat(registry.size()).isZero();
        assertThat(registry.findByOwner(owner)).isEmpty();
        assertThatThrownBy(() -> registry.find(pending)).isInstanceOf(UnknownTaskException.class);
    }
}
