package com.ryuqq.agentmesh.core.spi;

/**
 * Error categories reported by external capabilities.
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public enum CapabilityError {

    /**
     * The provider rejected the call because a usage quota is exhausted.
     */
    QUOTA_EXCEEDED(false),

    /**
     * The provider could not be reached or answered with a server error.
     */
    SERVICE_UNAVAILABLE(true),

    /**
     * The request itself was rejected (bad prompt, bad options).
     */
    INVALID_REQUEST(false);

    private final boolean retryable;

    CapabilityError(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
