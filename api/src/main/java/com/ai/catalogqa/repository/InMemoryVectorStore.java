package com.ai.catalogqa.repository;

import com.ai.catalogqa.dto.ChunkRecord;
import com.ai.catalogqa.dto.RetrievalHit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fallback vector store that performs lexical retrieval over records kept in memory.
 * <p>
 * A candidate is scored as {@code |overlap| / sqrt(|document tokens|)} where tokens are the
 * distinct lower-cased alphanumeric runs of the text. Ties keep insertion order.
 * Each upsert batch becomes visible to queries atomically.
 */
public class InMemoryVectorStore implements VectorStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryVectorStore.class);
    private static final Pattern TOKEN = Pattern.compile("[A-Za-z0-9]+");

    private final CopyOnWriteArrayList<StoredDocument> documents = new CopyOnWriteArrayList<>();

    private record StoredDocument(Map<String, Object> payload, Set<String> tokens) {
    }

    private record Scored(int index, double score) {
    }

    @Override
    public int upsert(List<ChunkRecord> records) {
        List<StoredDocument> batch = new ArrayList<>();
        for (ChunkRecord record : records) {
            if (record.text().isEmpty()) {
                continue;
            }
            batch.add(new StoredDocument(Collections.unmodifiableMap(new LinkedHashMap<>(record.toPayload())),
                    tokenize(record.text())));
        }
        documents.addAll(batch);
        log.info("[InMemoryVectorStore] Stored {} of {} records ({} total)", batch.size(), records.size(),
                documents.size());
        return batch.size();
    }

    @Override
    public List<RetrievalHit> query(String text, int topK) {
        if (text == null || text.isEmpty() || topK <= 0) {
            return List.of();
        }
        Set<String> queryTokens = tokenize(text);
        if (queryTokens.isEmpty()) {
            return List.of();
        }

        // iteration over a CopyOnWriteArrayList is a stable snapshot
        Object[] snapshot = documents.toArray();
        List<Scored> scored = new ArrayList<>();
        for (int i = 0; i < snapshot.length; i++) {
            StoredDocument doc = (StoredDocument) snapshot[i];
            if (doc.tokens().isEmpty()) {
                continue;
            }
            int overlap = 0;
            for (String token : queryTokens) {
                if (doc.tokens().contains(token)) {
                    overlap++;
                }
            }
            if (overlap == 0) {
                continue;
            }
            scored.add(new Scored(i, overlap / Math.sqrt(doc.tokens().size())));
        }

        // List.sort is stable, so equal scores stay in insertion order
        scored.sort(Comparator.comparingDouble(Scored::score).reversed());

        List<RetrievalHit> hits = new ArrayList<>();
        for (Scored s : scored.subList(0, Math.min(topK, scored.size()))) {
            StoredDocument doc = (StoredDocument) snapshot[s.index()];
            hits.add(new RetrievalHit("inmemory-" + s.index(), s.score(), doc.payload()));
        }
        log.debug("[InMemoryVectorStore] Query matched {} of {} documents, returning {}",
                scored.size(), snapshot.length, hits.size());
        return hits;
    }

    @Override
    public String backendName() {
        return "inmemory";
    }

    public int size() {
        return documents.size();
    }

    static Set<String> tokenize(String text) {
        Set<String> tokens = new HashSet<>();
        Matcher matcher = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }
}
