package com.ryuqq.agentmesh.application.agent;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AgentTypeTest {

    @Test
    void of_KnownNames_IgnoreCase() {
        assertThat(AgentType.of("Research")).isEqualTo(AgentType.RESEARCH);
        assertThat(AgentType.of(" synthesis ")).isEqualTo(AgentType.SYNTHESIS);
    }

    @Test
    void of_UnknownName_IsRejected() {
        assertThatThrownBy(() -> AgentType.of("planner"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("planner");
    }
}
