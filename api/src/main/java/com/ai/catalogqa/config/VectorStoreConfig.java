package com.ai.catalogqa.config;

import com.ai.catalogqa.exception.VectorStoreUnavailableException;
import com.ai.catalogqa.repository.InMemoryVectorStore;
import com.ai.catalogqa.repository.WeaviateVectorStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Selects the vector store once at start-up: Weaviate when it is enabled and reachable,
 * otherwise the in-memory lexical store (unless the fallback is disabled).
 * A remote failure here is a configuration-time decision and is not retried per request.
 */
@Configuration
public class VectorStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(VectorStoreConfig.class);

    @Bean
    VectorStoreProvider vectorStoreProvider(
            @Qualifier("weaviateWebClient") WebClient weaviateWebClient,
            ObjectMapper objectMapper,
            @Value("${vectorstore.weaviate.enabled:true}") boolean weaviateEnabled,
            @Value("${vectorstore.collection-name:KnowledgeDocument}") String collectionName,
            @Value("${vectorstore.embeddings-model:text-embedding-3-small}") String embeddingsModel,
            @Value("${vectorstore.timeout-seconds:30}") long timeoutSeconds,
            @Value("${vectorstore.fallback-enabled:true}") boolean fallbackEnabled
    ) {
        return select(weaviateEnabled, fallbackEnabled, () -> new WeaviateVectorStore(
                weaviateWebClient, objectMapper, collectionName, embeddingsModel, Duration.ofSeconds(timeoutSeconds)));
    }

    static VectorStoreProvider select(boolean weaviateEnabled, boolean fallbackEnabled,
            Supplier<WeaviateVectorStore> remote) {
        if (weaviateEnabled) {
            try {
                return new VectorStoreProvider(remote.get());
            } catch (VectorStoreUnavailableException e) {
                log.warn("[VectorStoreConfig] Weaviate unavailable ({}), falling back", e.getMessage());
            }
        }
        if (fallbackEnabled) {
            log.warn("[VectorStoreConfig] Using in-memory lexical vector store; documents are not persisted");
            return new VectorStoreProvider(new InMemoryVectorStore());
        }
        log.error("[VectorStoreConfig] No vector store available; ingestion will fail and retrieval returns no documents");
        return VectorStoreProvider.none();
    }
}
