package com.ryuqq.agentmesh.adapter.runner;

import com.ryuqq.agentmesh.core.spi.CompletionOptions;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuntimeConfigTest {

    @Test
    void 기본값() {
        RuntimeConfig config = new RuntimeConfig();

        assertThat(config.concurrency()).isEqualTo(1);
        assertThat(config.taskDeadlineMs()).isEqualTo(60000);
        assertThat(config.shutdownTimeoutMs()).isEqualTo(30000);
        assertThat(config.completionOptions()).isEqualTo(new CompletionOptions());
    }

    @Test
    void with_메서드는_해당_값만_바꾼다() {
        RuntimeConfig config = new RuntimeConfig()
            .withConcurrency(4)
            .withTaskDeadlineMs(5000)
            .withShutdownTimeoutMs(0)
            .withCompletionOptions(new CompletionOptions().withTemperature(0.2));

        assertThat(config.concurrency()).isEqualTo(4);
        assertThat(config.taskDeadlineMs()).isEqualTo(5000);
        assertThat(config.shutdownTimeoutMs()).isZero();
        assertThat(config.completionOptions().temperature()).isEqualTo(0.2);
    }

    @Test
    void 잘못된_값은_거부된다() {
        assertThatThrownBy(() -> new RuntimeConfig().withConcurrency(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("concurrency");
        assertThatThrownBy(() -> new RuntimeConfig().withTaskDeadlineMs(0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RuntimeConfig().withShutdownTimeoutMs(-1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RuntimeConfig().withCompletionOptions(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
