package com.ai.catalogqa.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClients for the outbound collaborators: the Weaviate ANN service and the
 * OpenAI-compatible chat completion API.
 */
@Configuration
public class WebClientConfig {

    @Bean
    WebClient weaviateWebClient(
            @Value("${vectorstore.weaviate.url:http://weaviate:8080}") String baseUrl,
            @Value("${vectorstore.weaviate.api-key:}") String apiKey,
            @Value("${llm.api-key:}") String openAiApiKey
    ) {
        WebClient.Builder builder = WebClient.builder().baseUrl(baseUrl);
        if (!apiKey.isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
        }
        if (!openAiApiKey.isBlank()) {
            // consumed by the text2vec-openai vectorizer module
            builder.defaultHeader("X-OpenAI-Api-Key", openAiApiKey);
        }
        return builder.build();
    }

    @Bean
    WebClient llmWebClient(
            @Value("${llm.base-url:https://api.openai.com}") String baseUrl,
            @Value("${llm.api-key:}") String apiKey
    ) {
        WebClient.Builder builder = WebClient.builder()
                .baseUrl(baseUrl)
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(4 * 1024 * 1024));
        if (!apiKey.isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
        }
        return builder.build();
    }
}
