package com.ryuqq.agentmesh.application.agent;

import com.ryuqq.agentmesh.core.model.MemoryRecord;
import com.ryuqq.agentmesh.core.model.Payload;
import com.ryuqq.agentmesh.core.spi.CompletionOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 질의(query)에 대한 조사 결과를 생성하는 처리기.
 *
 * <p><strong>입력:</strong></p>
 * <ul>
 *   <li>query: 조사 질의 (필수)</li>
 *   <li>type: general, technical, factual, comparative, trend (기본 general)</li>
 *   <li>depth: light, medium, deep (기본 medium)</li>
 * </ul>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <ol>
 *   <li>기억에서 관련 조사 기록 검색 (최대 5건)</li>
 *   <li>조사 프롬프트 구성 후 CompletionCapability 호출</li>
 *   <li>본문에서 URL 출처 추출</li>
 *   <li>결과를 기억에 저장 (kind=research, 중요도 = 신뢰도 + 0.2)</li>
 * </ol>
 *
 * <p>기억 검색/저장 실패는 Task를 실패시키지 않고 로그만 남깁니다.</p>
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public final class ResearchProcessor implements TaskProcessor {

    private static final Logger log = LoggerFactory.getLogger(ResearchProcessor.class);

    public static final String MEMORY_KIND = "research";
    static final int MEMORY_SEARCH_LIMIT = 5;
    static final String SYSTEM_INSTRUCTION =
        "You are a thorough research assistant. Provide accurate, well-sourced information.";

    private static final String DEFAULT_TYPE = "general";
    private static final String DEFAULT_DEPTH = "medium";

    private static final Map<String, String> DEPTH_INSTRUCTIONS = Map.of(
        "light", "Provide a brief overview with key points.",
        "medium", "Provide detailed information with multiple perspectives and examples.",
        "deep", "Provide comprehensive analysis with detailed explanations, comparisons, and implications."
    );

    private static final Map<String, String> TYPE_INSTRUCTIONS = Map.of(
        "general", "Research this topic broadly, covering main aspects and current understanding.",
        "technical", "Focus on technical details, specifications, and implementation aspects.",
        "factual", "Verify facts and provide accurate, current information with sources when possible.",
        "comparative", "Compare different options, approaches, or solutions related to this topic.",
        "trend", "Research current trends, developments, and future predictions for this topic."
    );

    private static final Pattern URL = Pattern.compile("https?://[^\\s<>\"')\\]]+");

    @Override
    public Draft process(TaskContext context) {
        Payload input = context.input();
        String query = input.getString("query")
            .map(String::trim)
            .filter(value -> !value.isEmpty())
            .orElseThrow(() -> new IllegalArgumentException("research task requires a non-blank 'query'"));
        String type = normalize(input.getString("type").orElse(DEFAULT_TYPE));
        String depth = normalize(input.getString("depth").orElse(DEFAULT_DEPTH));

        List<MemoryRecord> related = searchMemory(context, query);

        CompletionOptions options = context.options().withSystemInstruction(SYSTEM_INSTRUCTION);
        String text = context.completion().complete(buildPrompt(query, type, depth), options);
        if (text == null) {
            text = "";
        }
        List<String> sources = extractSources(text);

        double confidence = context.scorer().score(text, sources.size());
        remember(context, query, text, confidence);

        Payload extra = Payload.empty()
            .with("query", query)
            .with("type", type)
            .with("depth", depth)
            .with("memory_matches", related.size());
        log.debug("Research finished for task {} ({} sources, {} memory matches)",
            context.taskId().getValue(), sources.size(), related.size());
        return new Draft(text, sources, extra);
    }

    static String buildPrompt(String query, String type, String depth) {
        String typeInstruction = TYPE_INSTRUCTIONS.getOrDefault(type, TYPE_INSTRUCTIONS.get(DEFAULT_TYPE));
        String depthInstruction = DEPTH_INSTRUCTIONS.getOrDefault(depth, DEPTH_INSTRUCTIONS.get(DEFAULT_DEPTH));
        return "Research Query: " + query + "\n"
            + "\n"
            + "Research Type: " + type + "\n"
            + "Research Depth: " + depth + "\n"
            + "\n"
            + "Instructions:\n"
            + "- " + typeInstruction + "\n"
            + "- " + depthInstruction + "\n"
            + "- Structure your response with clear sections\n"
            + "- Include key findings, insights, and relevant details\n"
            + "- If making claims, indicate confidence level\n"
            + "- Suggest related topics for further research\n"
            + "\n"
            + "Please provide a comprehensive research response.";
    }

    /**
     * 본문에 등장한 URL을 순서대로, 중복 없이 추출 (끝의 구두점 제외).
     */
    static List<String> extractSources(String text) {
        Set<String> urls = new LinkedHashSet<>();
        Matcher matcher = URL.matcher(text);
        while (matcher.find()) {
            String url = matcher.group().replaceAll("[.,;:!?]+$", "");
            urls.add(url);
        }
        return new ArrayList<>(urls);
    }

    private List<MemoryRecord> searchMemory(TaskContext context, String query) {
        try {
            return context.memory().search(query, MEMORY_SEARCH_LIMIT);
        } catch (RuntimeException e) {
            log.warn("Memory search failed for task {}: {}", context.taskId().getValue(), e.getMessage());
            return List.of();
        }
    }

    private void remember(TaskContext context, String query, String text, double confidence) {
        double importance = Math.min(confidence + 0.2, 1.0);
        try {
            context.memory().remember(
                "Research: " + query + "\n\n" + text,
                MEMORY_KIND,
                List.of("research", "findings"),
                importance
            );
        } catch (RuntimeException e) {
            log.warn("Storing research memory failed for task {}: {}", context.taskId().getValue(), e.getMessage());
        }
    }

    private static String normalize(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
