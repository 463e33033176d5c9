package com.ryuqq.agentmesh.core.exception;

import com.ryuqq.agentmesh.core.model.MessageId;

import java.time.Duration;

/**
 * No correlated response arrived before the request timeout elapsed.
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public class RequestTimeoutException extends AgentMeshException {

    public static final String CODE = "REQUEST_TIMEOUT";

    private final MessageId requestId;

    public RequestTimeoutException(MessageId requestId, Duration timeout) {
        super(CODE, "No response to request " + requestId.getValue() + " within " + timeout.toMillis() + "ms");
        this.requestId = requestId;
    }

    public MessageId getRequestId() {
        return requestId;
    }
}
