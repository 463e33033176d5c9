package com.ryuqq.agentmesh.core.statemachine;

/**
 * Agent 런타임의 생명주기 상태.
 *
 * <pre>
 * STOPPED → STARTING → RUNNING → STOPPING → STOPPED
 * </pre>
 *
 * <p>STOPPED 로 돌아온 런타임은 다시 시작할 수 있습니다.
 * Task 제출은 RUNNING 상태에서만 허용됩니다.</p>
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public enum RuntimeState {

    STOPPED,

    STARTING,

    RUNNING,

    STOPPING;

    /**
     * 새 작업을 받을 수 있는지 확인.
     *
     * @return RUNNING 인 경우 true
     */
    public boolean acceptsWork() {
        return this == RUNNING;
    }
}
