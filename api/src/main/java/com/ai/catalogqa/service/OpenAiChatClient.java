package com.ai.catalogqa.service;

import com.ai.catalogqa.exception.SynthesisUnavailableException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.List;

/**
 * Client for an OpenAI-compatible chat completion API.
 * Configured only when both an API key and a model name are present.
 */
@Service
public class OpenAiChatClient implements LlmClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiChatClient.class);

    private final WebClient webClient;
    private final String apiKey;
    private final String model;
    private final double temperature;
    private final Duration timeout;

    public OpenAiChatClient(
            @Qualifier("llmWebClient") WebClient llmWebClient,
            @Value("${llm.api-key:}") String apiKey,
            @Value("${llm.model:gpt-4o-mini}") String model,
            @Value("${llm.temperature:0.2}") double temperature,
            @Value("${llm.timeout-seconds:60}") long timeoutSeconds) {
        this.webClient = llmWebClient;
        this.apiKey = apiKey;
        this.model = model;
        this.temperature = temperature;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
    }

    @Override
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank() && model != null && !model.isBlank();
    }

    @Override
    public String modelName() {
        return model;
    }

    @Override
    public String complete(String prompt) {
        if (!isConfigured()) {
            throw new SynthesisUnavailableException("No language model is configured");
        }
        log.info("[OpenAiChatClient] Generating with model: {} (prompt {} chars)", model, prompt.length());

        ChatCompletionRequest request = new ChatCompletionRequest(
                model, List.of(new Message("user", prompt)), temperature);

        try {
            ChatCompletionResponse response = webClient.post()
                    .uri("/v1/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(request)
                    .retrieve()
                    .bodyToMono(ChatCompletionResponse.class)
                    .timeout(timeout)
                    .block();

            if (response == null || response.choices() == null || response.choices().isEmpty()
                    || response.choices().get(0).message() == null) {
                log.warn("[OpenAiChatClient] Empty completion response");
                return "";
            }
            String content = response.choices().get(0).message().content();
            return content == null ? "" : content;

        } catch (WebClientRequestException e) {
            log.error("[OpenAiChatClient] Failed to connect to language model API: {}", e.getMessage());
            throw new SynthesisUnavailableException("Language model API is not reachable", e);
        } catch (WebClientResponseException e) {
            log.error("[OpenAiChatClient] Language model API error: status={}, body={}",
                    e.getStatusCode(), e.getResponseBodyAsString());
            throw new SynthesisUnavailableException("Language model API returned " + e.getStatusCode(), e);
        } catch (Exception e) {
            log.error("[OpenAiChatClient] Unexpected error during completion: {}", e.getMessage());
            throw new SynthesisUnavailableException("Completion failed: " + e.getMessage(), e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Message(String role, String content) {
    }

    record ChatCompletionRequest(String model, List<Message> messages, double temperature) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Choice(Message message) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ChatCompletionResponse(List<Choice> choices) {
    }
}
