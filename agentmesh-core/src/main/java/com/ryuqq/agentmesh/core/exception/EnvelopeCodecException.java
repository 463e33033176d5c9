package com.ryuqq.agentmesh.core.exception;

/**
 * Envelope text could not be encoded or decoded.
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public class EnvelopeCodecException extends AgentMeshException {

    public static final String CODE = "ENVELOPE_CODEC";

    public EnvelopeCodecException(String message) {
        super(CODE, message);
    }

    public EnvelopeCodecException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
