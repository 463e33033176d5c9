package com.ryuqq.agentmesh.core.spi;

/**
 * Tuning options passed to a {@link CompletionCapability}.
 *
 * @param temperature sampling temperature (0.0 ~ 2.0)
 * @param maxTokens upper bound on generated tokens (positive)
 * @param systemInstruction optional system instruction, null when absent
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public record CompletionOptions(
    double temperature,
    int maxTokens,
    String systemInstruction
) {

    public static final double DEFAULT_TEMPERATURE = 0.7;
    public static final int DEFAULT_MAX_TOKENS = 2048;

    public CompletionOptions {
        if (Double.isNaN(temperature) || temperature < 0.0 || temperature > 2.0) {
            throw new IllegalArgumentException("temperature must be between 0.0 and 2.0 (current: " + temperature + ")");
        }
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive (current: " + maxTokens + ")");
        }
    }

    /**
     * Defaults: temperature 0.7, 2048 max tokens, no system instruction.
     */
    public CompletionOptions() {
        this(DEFAULT_TEMPERATURE, DEFAULT_MAX_TOKENS, null);
    }

    public CompletionOptions withTemperature(double temperature) {
        return new CompletionOptions(temperature, maxTokens, systemInstruction);
    }

    public CompletionOptions withMaxTokens(int maxTokens) {
        return new CompletionOptions(temperature, maxTokens, systemInstruction);
    }

    public CompletionOptions withSystemInstruction(String systemInstruction) {
        return new CompletionOptions(temperature, maxTokens, systemInstruction);
    }
}
