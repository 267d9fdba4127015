package com.ai.catalogqa.config;

import com.ai.catalogqa.repository.VectorStore;

import java.util.Optional;

/**
 * Holds the vector store selected at start-up, if any backend could be constructed.
 */
public class VectorStoreProvider {

    private final VectorStore vectorStore;

    public VectorStoreProvider(VectorStore vectorStore) {
        this.vectorStore = vectorStore;
    }

    public static VectorStoreProvider none() {
        return new VectorStoreProvider(null);
    }

    public Optional<VectorStore> current() {
        return Optional.ofNullable(vectorStore);
    }

    public boolean isReady() {
        return vectorStore != null;
    }
}
