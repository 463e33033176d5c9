package com.ryuqq.agentmesh.application.agent;

import com.ryuqq.agentmesh.application.messaging.CommunicationHandler;
import com.ryuqq.agentmesh.core.contract.Envelope;
import com.ryuqq.agentmesh.core.model.AgentId;
import com.ryuqq.agentmesh.core.model.MapValue;
import com.ryuqq.agentmesh.core.model.Payload;
import com.ryuqq.agentmesh.core.model.PayloadValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Asks a research agent for findings over the messaging layer and turns the completed
 * replies into synthesis sources.
 *
 * <p>All queries are sent up front and share one {@code timeout} budget. A query whose
 * reply fails, times out, or reports a non-completed status contributes nothing; the
 * remaining queries still count.</p>
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public final class ResearchCollaborator {

    private static final Logger log = LoggerFactory.getLogger(ResearchCollaborator.class);

    public static final String SOURCE_TYPE = "research";

    private final CommunicationHandler messaging;
    private final Duration timeout;

    /**
     * @param messaging handler both agents are registered with
     * @param timeout total time to wait for every reply (positive)
     */
    public ResearchCollaborator(CommunicationHandler messaging, Duration timeout) {
        if (messaging == null) {
            throw new IllegalArgumentException("messaging cannot be null");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.messaging = messaging;
        this.timeout = timeout;
    }

    /**
     * Requests research for each query and collects the completed results.
     *
     * @param requester the synthesizing agent; must be registered to receive replies
     * @param researcher the research agent to ask
     * @param queries research queries, blank entries skipped
     * @return one source map per completed reply: {@code source}, {@code type}, {@code query},
     *         {@code content} and, when present, {@code confidence}
     */
    public List<PayloadValue> collect(AgentId requester, AgentId researcher, List<String> queries) {
        Map<String, CompletableFuture<Envelope>> inFlight = new LinkedHashMap<>();
        for (String query : queries) {
            if (query == null || query.isBlank() || inFlight.containsKey(query)) {
                continue;
            }
            Envelope request = Envelope.request(requester, researcher, Payload.of("query", query));
            try {
                inFlight.put(query, messaging.request(researcher, request, timeout));
            } catch (RuntimeException e) {
                log.warn("Research request '{}' to {} could not be sent: {}",
                    query, researcher.getValue(), e.getMessage());
            }
        }

        List<PayloadValue> sources = new ArrayList<>();
        long deadline = System.nanoTime() + timeout.toNanos();
        for (Map.Entry<String, CompletableFuture<Envelope>> entry : inFlight.entrySet()) {
            String query = entry.getKey();
            CompletableFuture<Envelope> future = entry.getValue();
            try {
                long remaining = Math.max(0L, deadline - System.nanoTime());
                Envelope response = future.get(remaining, TimeUnit.NANOSECONDS);
                toSource(researcher, query, response.payload()).ifPresent(sources::add);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("Research '{}' from {} failed: {}", query, researcher.getValue(), cause.getMessage());
            } catch (TimeoutException e) {
                future.cancel(false);
                log.warn("Research '{}' from {} did not answer within {}ms",
                    query, researcher.getValue(), timeout.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                inFlight.values().forEach(pending -> pending.cancel(false));
                break;
            }
        }
        log.debug("Collected {} of {} research results from {}",
            sources.size(), inFlight.size(), researcher.getValue());
        return sources;
    }

    private static Optional<PayloadValue> toSource(AgentId researcher, String query, Payload reply) {
        String status = reply.getString("status").orElse("");
        if (!"completed".equals(status)) {
            String code = reply.getPayload("error").flatMap(error -> error.getString("code")).orElse(status);
            log.warn("Research '{}' from {} ended as {}", query, researcher.getValue(), code);
            return Optional.empty();
        }
        Payload result = reply.getPayload("result").orElse(Payload.empty());
        Payload source = Payload.of("source", SOURCE_TYPE + ":" + researcher.getValue())
            .with("type", SOURCE_TYPE)
            .with("query", query)
            .with("content", result.getString("text").orElse(""));
        if (result.getDouble("confidence").isPresent()) {
            source = source.with("confidence", result.getDouble("confidence").get());
        }
        return Optional.of(new MapValue(source.asMap()));
    }
}
