package com.ryuqq.agentmesh.application.agent;

import com.ryuqq.agentmesh.core.model.AgentId;
import com.ryuqq.agentmesh.core.model.MapValue;
import com.ryuqq.agentmesh.core.model.MemoryRecord;
import com.ryuqq.agentmesh.core.model.Payload;
import com.ryuqq.agentmesh.core.model.PayloadValue;
import com.ryuqq.agentmesh.core.model.TextValue;
import com.ryuqq.agentmesh.core.spi.CompletionOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 여러 출처와 기억을 하나의 분석 결과로 종합하는 처리기.
 *
 * <p><strong>입력:</strong></p>
 * <ul>
 *   <li>topic: 종합 주제 (sources가 없으면 필수)</li>
 *   <li>sources: 문자열 또는 {type, content} 매핑 목록</li>
 *   <li>type: analysis, summary, comparison, evaluation, integration, synthesis (기본 analysis)</li>
 *   <li>style: comprehensive, concise, academic, practical, creative (기본 comprehensive)</li>
 *   <li>research_queries: research Agent에게 요청할 질의 목록 (선택)</li>
 *   <li>research_agent: 질의를 받을 research Agent ID (research_queries가 있으면 필수)</li>
 * </ul>
 *
 * <p>research_queries가 있으면 {@link ResearchCollaborator}를 통해 각 질의를 request로 보내고,
 * 완료된 응답의 result를 sources 뒤에 덧붙여 종합합니다. 협업기가 없는 처리기는 질의를 무시합니다.</p>
 *
 * <p>결과는 기억에 저장됩니다 (kind=synthesis, 중요도 = 신뢰도 + 0.3).</p>
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public final class SynthesisProcessor implements TaskProcessor {

    private static final Logger log = LoggerFactory.getLogger(SynthesisProcessor.class);

    public static final String MEMORY_KIND = "synthesis";
    static final int MEMORY_SEARCH_LIMIT = 10;
    static final String SYSTEM_INSTRUCTION =
        "You are an expert analyst specializing in information synthesis. Provide comprehensive, well-structured analysis.";

    private static final String DEFAULT_TYPE = "analysis";
    private static final String DEFAULT_STYLE = "comprehensive";

    private static final Map<String, String> TYPE_INSTRUCTIONS = Map.of(
        "analysis", "Analyze the information thoroughly, identifying patterns, relationships, and key insights.",
        "summary", "Provide a concise summary highlighting the most important points and conclusions.",
        "comparison", "Compare and contrast different viewpoints, approaches, or findings in the sources.",
        "evaluation", "Evaluate the quality, credibility, and implications of the information provided.",
        "integration", "Integrate information from all sources into a cohesive understanding.",
        "synthesis", "Synthesize all information into new insights and comprehensive understanding."
    );

    private static final Map<String, String> STYLE_INSTRUCTIONS = Map.of(
        "comprehensive", "Provide detailed, thorough analysis covering all aspects.",
        "concise", "Focus on key points and essential information only.",
        "academic", "Use formal, academic tone with detailed reasoning.",
        "practical", "Focus on practical implications and actionable insights.",
        "creative", "Explore creative connections and novel perspectives."
    );

    private final ResearchCollaborator collaborator;

    public SynthesisProcessor() {
        this(null);
    }

    /**
     * @param collaborator research 협업기 (null이면 research_queries를 무시)
     */
    public SynthesisProcessor(ResearchCollaborator collaborator) {
        this.collaborator = collaborator;
    }

    @Override
    public Draft process(TaskContext context) {
        Payload input = context.input();
        String topic = input.getString("topic").map(String::trim).orElse("");
        List<PayloadValue> sources = new ArrayList<>(input.getList("sources"));
        List<String> researchQueries = researchQueries(input);
        if (topic.isEmpty() && sources.isEmpty() && researchQueries.isEmpty()) {
            throw new IllegalArgumentException("synthesis task requires a 'topic', 'sources' or 'research_queries'");
        }
        String type = normalize(input.getString("type").orElse(DEFAULT_TYPE));
        String style = normalize(input.getString("style").orElse(DEFAULT_STYLE));

        int researchCollected = 0;
        if (!researchQueries.isEmpty()) {
            List<PayloadValue> research = collectResearch(context, input, researchQueries);
            researchCollected = research.size();
            sources.addAll(research);
        }

        List<MemoryRecord> memoryContext = topic.isEmpty() ? List.of() : searchMemory(context, topic);

        CompletionOptions options = context.options().withSystemInstruction(SYSTEM_INSTRUCTION);
        String text = context.completion().complete(buildPrompt(topic, sources, memoryContext, type, style), options);
        if (text == null) {
            text = "";
        }

        double confidence = context.scorer().score(text, sources.size());
        remember(context, topic, text, confidence);

        Payload extra = Payload.empty()
            .with("topic", topic)
            .with("synthesis_type", type)
            .with("style", style)
            .with("sources_analyzed", sources.size())
            .with("memory_context_used", memoryContext.size())
            .with("research_results_used", researchCollected);
        return new Draft(text, sourceLabels(sources), extra);
    }

    static String buildPrompt(String topic, List<PayloadValue> sources, List<MemoryRecord> memoryContext,
                              String type, String style) {
        StringBuilder sourcesText = new StringBuilder();
        int index = 1;
        for (PayloadValue source : sources) {
            if (source instanceof MapValue map) {
                Payload entry = Payload.of(map.entries());
                String sourceType = entry.getString("type").orElse("unknown");
                String content = entry.getString("content")
                    .or(() -> entry.getString("text"))
                    .orElse(String.valueOf(map.unwrap()));
                sourcesText.append("\nSource ").append(index).append(" (").append(sourceType).append("):\n")
                    .append(content).append('\n');
            } else {
                sourcesText.append("\nSource ").append(index).append(":\n")
                    .append(asText(source)).append('\n');
            }
            index++;
        }

        StringBuilder contextText = new StringBuilder();
        index = 1;
        for (MemoryRecord memory : memoryContext) {
            contextText.append("\nContext ").append(index).append(": ").append(memory.content()).append('\n');
            index++;
        }

        return "Topic: " + topic + "\n"
            + "\n"
            + "Synthesis Type: " + type + "\n"
            + "Style: " + style + "\n"
            + "\n"
            + "Instructions:\n"
            + "- " + TYPE_INSTRUCTIONS.getOrDefault(type, TYPE_INSTRUCTIONS.get(DEFAULT_TYPE)) + "\n"
            + "- " + STYLE_INSTRUCTIONS.getOrDefault(style, STYLE_INSTRUCTIONS.get(DEFAULT_STYLE)) + "\n"
            + "\n"
            + "Sources to Synthesize:\n"
            + sourcesText + "\n"
            + "\n"
            + "Additional Context from Memory:\n"
            + contextText + "\n"
            + "\n"
            + "Task:\n"
            + "Please synthesize all the provided information about \"" + topic + "\". Structure your response with:\n"
            + "1. Executive Summary\n"
            + "2. Key Findings\n"
            + "3. Analysis and Insights\n"
            + "4. Conclusions\n"
            + "5. Recommendations (if applicable)\n"
            + "6. Confidence Assessment\n"
            + "\n"
            + "Ensure your synthesis is coherent, well-reasoned, and adds value beyond just summarizing the sources.";
    }

    private static List<String> sourceLabels(List<PayloadValue> sources) {
        return sources.stream()
            .map(SynthesisProcessor::sourceLabel)
            .toList();
    }

    private static String sourceLabel(PayloadValue source) {
        if (source instanceof MapValue map) {
            Payload entry = Payload.of(map.entries());
            return entry.getString("source")
                .or(() -> entry.getString("type"))
                .orElse("unknown");
        }
        return "inline";
    }

    private static String asText(PayloadValue value) {
        if (value instanceof TextValue text) {
            return text.value();
        }
        return String.valueOf(value.unwrap());
    }

    private static List<String> researchQueries(Payload input) {
        return input.getList("research_queries").stream()
            .map(SynthesisProcessor::asText)
            .map(String::trim)
            .filter(query -> !query.isEmpty())
            .toList();
    }

    private List<PayloadValue> collectResearch(TaskContext context, Payload input, List<String> queries) {
        String researcher = input.getString("research_agent").map(String::trim).orElse("");
        if (researcher.isEmpty()) {
            throw new IllegalArgumentException("'research_queries' requires a 'research_agent'");
        }
        if (collaborator == null) {
            log.warn("Task {} asked for research from {} but agent {} has no messaging; queries ignored",
                context.taskId().getValue(), researcher, context.agentId().getValue());
            return List.of();
        }
        return collaborator.collect(context.agentId(), AgentId.of(researcher), queries);
    }

    private List<MemoryRecord> searchMemory(TaskContext context, String topic) {
        try {
            return context.memory().search(topic, MEMORY_SEARCH_LIMIT);
        } catch (RuntimeException e) {
            log.warn("Memory search failed for task {}: {}", context.taskId().getValue(), e.getMessage());
            return List.of();
        }
    }

    private void remember(TaskContext context, String topic, String text, double confidence) {
        double importance = Math.min(confidence + 0.3, 1.0);
        try {
            context.memory().remember(
                "Synthesis: " + topic + "\n\n" + text,
                MEMORY_KIND,
                List.of("synthesis", "analysis", "insights"),
                importance
            );
        } catch (RuntimeException e) {
            log.warn("Storing synthesis memory failed for task {}: {}", context.taskId().getValue(), e.getMessage());
        }
    }

    private static String normalize(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
