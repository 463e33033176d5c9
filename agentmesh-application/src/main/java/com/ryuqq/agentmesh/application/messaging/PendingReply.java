package com.ryuqq.agentmesh.application.messaging;

import com.ryuqq.agentmesh.core.contract.Envelope;
import com.ryuqq.agentmesh.core.model.AgentId;
import com.ryuqq.agentmesh.core.model.MessageId;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * 요청 하나에 대한 일회성 응답 슬롯.
 *
 * <p>응답, 타임아웃, 발행 실패, 상대 Agent 이탈 중 먼저 일어난 것 하나만 반영됩니다.
 * 이후의 resolve/fail 호출은 아무 효과가 없습니다.</p>
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
final class PendingReply {

    private final MessageId requestId;
    private final AgentId requester;
    private final AgentId peer;
    private final CompletableFuture<Envelope> future = new CompletableFuture<>();
    private volatile ScheduledFuture<?> timer;

    PendingReply(MessageId requestId, AgentId requester, AgentId peer) {
        this.requestId = requestId;
        this.requester = requester;
        this.peer = peer;
    }

    MessageId requestId() {
        return requestId;
    }

    AgentId requester() {
        return requester;
    }

    AgentId peer() {
        return peer;
    }

    CompletableFuture<Envelope> future() {
        return future;
    }

    void attachTimer(ScheduledFuture<?> timer) {
        this.timer = timer;
        if (future.isDone()) {
            timer.cancel(false);
        }
    }

    boolean involves(AgentId agentId) {
        return requester.equals(agentId) || peer.equals(agentId);
    }

    boolean resolve(Envelope response) {
        return future.complete(response);
    }

    boolean fail(Throwable cause) {
        return future.completeExceptionally(cause);
    }

    void cancelTimer() {
        ScheduledFuture<?> current = timer;
        if (current != null) {
            current.cancel(false);
        }
    }
}
