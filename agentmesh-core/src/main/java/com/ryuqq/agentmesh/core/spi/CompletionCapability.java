package com.ryuqq.agentmesh.core.spi;

/**
 * External text-completion capability (a language model behind some API).
 *
 * <p>Calls may take arbitrarily long; the agent runtime bounds them with a per-task deadline
 * and interrupts the calling thread when the deadline passes.</p>
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CompletionCapability {

    /**
     * Produces a completion for the prompt.
     *
     * @param prompt prompt text
     * @param options tuning options
     * @return generated text
     * @throws com.ryuqq.agentmesh.core.exception.CapabilityException when the provider reports an error
     */
    String complete(String prompt, CompletionOptions options);
}
