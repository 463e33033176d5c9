package com.ryuqq.agentmesh.core.spi;

import com.ryuqq.agentmesh.core.model.MemoryRecord;

import java.util.List;

/**
 * External memory capability used for context enrichment.
 *
 * <p>Never required for task bookkeeping: callers treat failures as non-fatal.</p>
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public interface MemoryCapability {

    /**
     * Stores a piece of content.
     *
     * @param content text to store
     * @param kind memory kind (e.g. research, synthesis)
     * @param tags classification tags
     * @param importance importance between 0.0 and 1.0
     * @return id of the stored memory
     * @throws IllegalArgumentException if content or kind is blank or importance is out of range
     */
    String remember(String content, String kind, List<String> tags, double importance);

    /**
     * Finds memories relevant to a query.
     *
     * @param query search text
     * @param limit maximum number of results (positive)
     * @return matches ordered by importance, then recency
     */
    List<MemoryRecord> search(String query, int limit);
}
