package com.ryuqq.agentmesh.core.exception;

/**
 * The transport connection is down. Transient: callers may retry with backoff.
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public class TransportUnavailableException extends AgentMeshException {

    public static final String CODE = "TRANSPORT_UNAVAILABLE";

    public TransportUnavailableException(String message) {
        super(CODE, message);
    }

    public TransportUnavailableException(String message, Throwable cause) {
        super(CODE, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
