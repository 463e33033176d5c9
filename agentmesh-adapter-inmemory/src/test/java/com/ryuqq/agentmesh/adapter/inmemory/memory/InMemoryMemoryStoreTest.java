package com.ryuqq.agentmesh.adapter.inmemory.memory;

import com.ryuqq.agentmesh.core.model.MemoryRecord;
import com.ryuqq.agentmesh.testkit.fake.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryMemoryStore 테스트.
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
class InMemoryMemoryStoreTest {

    private final MutableClock clock = new MutableClock(1_000L);
    private final InMemoryMemoryStore store = new InMemoryMemoryStore(3, clock);

    @Test
    void search_OrdersByImportanceThenRecency() {
        // given
        store.remember("quantum computing basics", "research", List.of("research"), 0.5);
        clock.advance(Duration.ofMillis(10));
        store.remember("Quantum error correction", "research", List.of("research"), 0.9);
        clock.advance(Duration.ofMillis(10));
        String newest = store.remember("quantum networking", "research", List.of(), 0.5);

        // when
        List<MemoryRecord> results = store.search("QUANTUM", 5);

        // then
        assertThat(results).extracting(MemoryRecord::content)
            .containsExactly("Quantum error correction", "quantum networking", "quantum computing basics");
        assertThat(results.get(1).memoryId()).isEqualTo(newest);
        assertThat(results.get(1).createdAt()).isEqualTo(1_020L);
    }

    @Test
    void search_MatchesTagsAndAnyTerm_RespectsLimit() {
        store.remember("alpha", "synthesis", List.of("findings"), 0.4);
        store.remember("beta", "synthesis", List.of(), 0.4);
        store.remember("gamma", "synthesis", List.of(), 0.4);

        assertThat(store.search("findings", 5)).extracting(MemoryRecord::content).containsExactly("alpha");
        assertThat(store.search("beta gamma", 1)).hasSize(1);
        assertThat(store.search("", 10)).hasSize(3);
        assertThat(store.search("delta", 10)).isEmpty();
    }

    @Test
    void remember_AtCapacity_EvictsLeastImportantOldestFirst() {
        // given
        store.remember("low old", "k", List.of(), 0.1);
        store.remember("low new", "k", List.of(), 0.1);
        store.remember("high", "k", List.of(), 0.9);

        // when
        store.remember("extra", "k", List.of(), 0.5);

        // then
        assertThat(store.size()).isEqualTo(3);
        assertThat(store.search("", 10)).extracting(MemoryRecord::content)
            .containsExactly("high", "extra", "low new");
    }

    @Test
    void remember_InvalidImportance_ThrowsException() {
        assertThatThrownBy(() -> store.remember("x", "k", List.of(), 1.5))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.remember(" ", "k", List.of(), 0.5))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
