package com.ai.catalogqa.service;

import com.ai.catalogqa.config.VectorStoreProvider;
import com.ai.catalogqa.dto.ChunkRecord;
import com.ai.catalogqa.exception.VectorStoreUnavailableException;
import com.ai.catalogqa.repository.VectorStore;
import com.ai.catalogqa.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Service for chunking knowledge base documents and storing them in the vector store.
 */
@Service
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final VectorStoreProvider vectorStoreProvider;
    private final ChunkingService chunkingService;
    private final TracingService tracingService;

    public IngestionService(VectorStoreProvider vectorStoreProvider, ChunkingService chunkingService,
            TracingService tracingService) {
        this.vectorStoreProvider = vectorStoreProvider;
        this.chunkingService = chunkingService;
        this.tracingService = tracingService;
    }

    /**
     * Chunk and upsert records.
     *
     * @return number of chunk records actually stored
     * @throws VectorStoreUnavailableException if no vector store can accept writes
     */
    public int ingest(List<Map<String, Object>> records) {
        VectorStore store = vectorStoreProvider.current()
                .orElseThrow(() -> new VectorStoreUnavailableException(
                        "Vector store is unavailable; cannot ingest documents"));

        log.info("[IngestionService] Ingesting {} records (chunkSize={}, overlap={}, backend={})",
                records.size(), chunkingService.getChunkSize(), chunkingService.getChunkOverlap(),
                store.backendName());

        return tracingService.inTraceRun("rag_ingest", Map.of("records", records.size()), root -> {
            List<ChunkRecord> chunks = tracingService.inSpan("chunk_documents", Map.of("count", records.size()),
                    span -> {
                        List<ChunkRecord> result = chunkingService.transform(records);
                        span.setAttribute("chunks", result.size());
                        return result;
                    });

            int stored = tracingService.inSpan("vector_upsert",
                    Map.of("chunks", chunks.size(), "backend", store.backendName()),
                    span -> store.upsert(chunks));

            log.info("[IngestionService] Stored {}/{} chunks from {} records", stored, chunks.size(), records.size());
            return stored;
        });
    }

    public boolean isReady() {
        return vectorStoreProvider.isReady();
    }
}
