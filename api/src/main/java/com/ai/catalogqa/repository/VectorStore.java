package com.ai.catalogqa.repository;

import com.ai.catalogqa.dto.ChunkRecord;
import com.ai.catalogqa.dto.RetrievalHit;

import java.util.List;

/**
 * Minimal vector store abstraction shared by the remote ANN store and the
 * in-process lexical fallback.
 */
public interface VectorStore {

    /**
     * Store chunk records.
     *
     * @return the number of records actually stored
     */
    int upsert(List<ChunkRecord> records);

    /**
     * Find the records most relevant to the text, best first.
     *
     * @param text the query text; an empty query yields no hits
     * @param topK the maximum amount of hits to return
     */
    List<RetrievalHit> query(String text, int topK);

    /**
     * Short backend label reported on context items and spans.
     */
    String backendName();
}
