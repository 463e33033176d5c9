package com.ryuqq.agentmesh.adapter.inmemory.memory;

import com.ryuqq.agentmesh.core.model.MemoryRecord;
import com.ryuqq.agentmesh.core.spi.MemoryCapability;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of {@link MemoryCapability}.
 *
 * <p><strong>Search:</strong> the query is split on whitespace; a memory matches when its content
 * or one of its tags contains any query term, ignoring case. A blank query matches everything.
 * Matches are ordered by importance (highest first), then recency (newest first).</p>
 *
 * <p><strong>Capacity:</strong> once {@code maxEntries} is reached, the least important memory is
 * evicted, the oldest one among equals.</p>
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public class InMemoryMemoryStore implements MemoryCapability {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMemoryStore.class);

    public static final int DEFAULT_MAX_ENTRIES = 10_000;

    private static final Comparator<Entry> RELEVANCE = Comparator
        .comparingDouble((Entry entry) -> entry.record.importance()).reversed()
        .thenComparing(Comparator.comparingLong((Entry entry) -> entry.sequence).reversed());

    private final List<Entry> entries = new ArrayList<>();
    private final AtomicLong sequence = new AtomicLong();
    private final int maxEntries;
    private final Clock clock;

    public InMemoryMemoryStore() {
        this(DEFAULT_MAX_ENTRIES, Clock.systemUTC());
    }

    /**
     * @param maxEntries capacity (positive)
     * @param clock time source for {@link MemoryRecord#createdAt()}
     */
    public InMemoryMemoryStore(int maxEntries, Clock clock) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive (current: " + maxEntries + ")");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.maxEntries = maxEntries;
        this.clock = clock;
    }

    @Override
    public String remember(String content, String kind, List<String> tags, double importance) {
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("content cannot be null or blank");
        }
        MemoryRecord record = new MemoryRecord(
            UUID.randomUUID().toString(), content, kind, tags, importance, clock.millis());

        synchronized (entries) {
            if (entries.size() >= maxEntries) {
                evictLeastRelevant();
            }
            entries.add(new Entry(record, sequence.incrementAndGet()));
        }
        log.debug("Remembered {} memory {} (importance {})", kind, record.memoryId(), importance);
        return record.memoryId();
    }

    @Override
    public List<MemoryRecord> search(String query, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive (current: " + limit + ")");
        }
        List<String> terms = terms(query);

        List<Entry> matches = new ArrayList<>();
        synchronized (entries) {
            for (Entry entry : entries) {
                if (matches(entry.record, terms)) {
                    matches.add(entry);
                }
            }
        }
        matches.sort(RELEVANCE);

        List<MemoryRecord> result = new ArrayList<>(Math.min(limit, matches.size()));
        for (int i = 0; i < matches.size() && i < limit; i++) {
            result.add(matches.get(i).record);
        }
        return result;
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    private void evictLeastRelevant() {
        Entry victim = entries.get(0);
        for (Entry entry : entries) {
            if (entry.record.importance() < victim.record.importance()
                || (entry.record.importance() == victim.record.importance() && entry.sequence < victim.sequence)) {
                victim = entry;
            }
        }
        entries.remove(victim);
        log.debug("Memory store full, evicted {}", victim.record.memoryId());
    }

    private static List<String> terms(String query) {
        List<String> terms = new ArrayList<>();
        if (query == null) {
            return terms;
        }
        for (String term : query.toLowerCase(Locale.ROOT).split("\\s+")) {
            if (!term.isBlank()) {
                terms.add(term);
            }
        }
        return terms;
    }

    private static boolean matches(MemoryRecord record, List<String> terms) {
        if (terms.isEmpty()) {
            return true;
        }
        String content = record.content().toLowerCase(Locale.ROOT);
        for (String term : terms) {
            if (content.contains(term)) {
                return true;
            }
            for (String tag : record.tags()) {
                if (tag.toLowerCase(Locale.ROOT).contains(term)) {
                    return true;
                }
            }
        }
        return false;
    }

    private record Entry(MemoryRecord record, long sequence) {
    }
}
