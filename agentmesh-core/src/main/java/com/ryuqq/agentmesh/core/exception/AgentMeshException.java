package com.ryuqq.agentmesh.core.exception;

/**
 * Base class of every error raised by AgentMesh components.
 *
 * <p>All errors are unchecked. Each carries a stable error code that survives
 * serialization into task error payloads and response envelopes.</p>
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public class AgentMeshException extends RuntimeException {

    private final String errorCode;

    public AgentMeshException(String errorCode, String message) {
        this(errorCode, message, null);
    }

    public AgentMeshException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Whether the caller may retry the failed operation.
     *
     * @return false unless a subclass marks the error as transient
     */
    public boolean isRetryable() {
        return false;
    }
}
