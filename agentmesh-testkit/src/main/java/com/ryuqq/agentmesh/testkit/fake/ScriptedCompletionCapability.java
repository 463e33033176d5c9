package com.ryuqq.agentmesh.testkit.fake;

import com.ryuqq.agentmesh.core.exception.CapabilityException;
import com.ryuqq.agentmesh.core.spi.CapabilityError;
import com.ryuqq.agentmesh.core.spi.CompletionCapability;
import com.ryuqq.agentmesh.core.spi.CompletionOptions;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Completion capability that replays scripted answers in order.
 *
 * <p>Each call consumes the next scripted step; once the script is exhausted every call
 * returns the default answer. Steps can answer, fail with a {@link CapabilityError}, or
 * sleep before answering to simulate a slow provider.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * ScriptedCompletionCapability completion = new ScriptedCompletionCapability("default answer")
 *     .thenAnswer("first answer")
 *     .thenFail(CapabilityError.QUOTA_EXCEEDED)
 *     .thenAnswerAfter(Duration.ofSeconds(5), "slow answer");
 * </pre>
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public final class ScriptedCompletionCapability implements CompletionCapability {

    private final Queue<Step> script = new ConcurrentLinkedQueue<>();
    private final List<String> prompts = new CopyOnWriteArrayList<>();
    private final List<CompletionOptions> options = new CopyOnWriteArrayList<>();
    private final String defaultAnswer;

    public ScriptedCompletionCapability(String defaultAnswer) {
        if (defaultAnswer == null) {
            throw new IllegalArgumentException("defaultAnswer cannot be null");
        }
        this.defaultAnswer = defaultAnswer;
    }

    public ScriptedCompletionCapability thenAnswer(String answer) {
        script.add(new Step(answer, null, Duration.ZERO));
        return this;
    }

    public ScriptedCompletionCapability thenFail(CapabilityError error) {
        script.add(new Step(null, error, Duration.ZERO));
        return this;
    }

    public ScriptedCompletionCapability thenAnswerAfter(Duration delay, String answer) {
        script.add(new Step(answer, null, delay));
        return this;
    }

    @Override
    public String complete(String prompt, CompletionOptions completionOptions) {
        prompts.add(prompt);
        options.add(completionOptions);

        Step step = script.poll();
        if (step == null) {
            return defaultAnswer;
        }
        if (!step.delay().isZero()) {
            try {
                Thread.sleep(step.delay().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CapabilityException(CapabilityError.SERVICE_UNAVAILABLE, "completion interrupted", e);
            }
        }
        if (step.error() != null) {
            throw new CapabilityException(step.error(), "scripted " + step.error().name());
        }
        return step.answer();
    }

    /**
     * @return prompts received so far, in call order
     */
    public List<String> prompts() {
        return new ArrayList<>(prompts);
    }

    public List<CompletionOptions> receivedOptions() {
        return new ArrayList<>(options);
    }

    public int callCount() {
        return prompts.size();
    }

    private record Step(String answer, CapabilityError error, Duration delay) {
    }
}
