package com.ai.catalogqa.service;

/**
 * Language-model collaborator used for answer synthesis.
 */
public interface LlmClient {

    /**
     * True when a model and credentials are configured. When false, {@link #complete(String)}
     * must not be called.
     */
    boolean isConfigured();

    /**
     * @throws com.ai.catalogqa.exception.SynthesisUnavailableException when the call fails
     */
    String complete(String prompt);

    String modelName();
}
