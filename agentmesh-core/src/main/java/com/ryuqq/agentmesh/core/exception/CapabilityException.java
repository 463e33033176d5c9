package com.ryuqq.agentmesh.core.exception;

import com.ryuqq.agentmesh.core.spi.CapabilityError;

/**
 * An external capability (completion or memory) reported an error.
 *
 * <p>The error code is the {@link CapabilityError} name, so a task failed by a quota
 * error records {@code QUOTA_EXCEEDED}.</p>
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public class CapabilityException extends AgentMeshException {

    private final CapabilityError error;

    public CapabilityException(CapabilityError error, String message) {
        this(error, message, null);
    }

    public CapabilityException(CapabilityError error, String message, Throwable cause) {
        super(requireError(error).name(), message, cause);
        this.error = error;
    }

    public CapabilityError getError() {
        return error;
    }

    @Override
    public boolean isRetryable() {
        return error.isRetryable();
    }

    private static CapabilityError requireError(CapabilityError error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        return error;
    }
}
