package com.ai.catalogqa.service;

import com.ai.catalogqa.config.VectorStoreProvider;
import com.ai.catalogqa.dto.ContextItem;
import com.ai.catalogqa.dto.ContextType;
import com.ai.catalogqa.dto.ProductFilters;
import com.ai.catalogqa.dto.RagAnswer;
import com.ai.catalogqa.dto.RetrievalHit;
import com.ai.catalogqa.exception.SynthesisUnavailableException;
import com.ai.catalogqa.repository.VectorStore;
import com.ai.catalogqa.tracing.TraceHandle;
import com.ai.catalogqa.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Retrieve-then-generate pipeline: START -> RETRIEVE -> GENERATE -> DONE.
 * <p>
 * Retrieval fuses vector store documents (rank order) with up to three catalog products.
 * Generation calls the language model once, or substitutes a deterministic answer when
 * there is no context, no configured model, or the model call fails.
 */
@Service
public class RagOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RagOrchestrator.class);

    static final String NO_CONTEXT_ANSWER = "No supporting information found for this question.";
    static final String FALLBACK_PREAMBLE =
            "A language model is not available, so here are the most relevant passages I found:";
    private static final int FALLBACK_SNIPPETS = 2;

    private static final String PROMPT_TEMPLATE = """
            You are an assistant for a sustainable fashion brand. Use the provided context to answer the question.
            If the context does not contain the answer, say so.

            Context:
            %s

            Question: %s
            """;

    enum Stage { START, RETRIEVE, GENERATE, DONE }

    private final VectorStoreProvider vectorStoreProvider;
    private final CatalogContextAdapter catalogContextAdapter;
    private final LlmClient llmClient;
    private final TracingService tracingService;

    public RagOrchestrator(VectorStoreProvider vectorStoreProvider, CatalogContextAdapter catalogContextAdapter,
            LlmClient llmClient, TracingService tracingService) {
        this.vectorStoreProvider = vectorStoreProvider;
        this.catalogContextAdapter = catalogContextAdapter;
        this.llmClient = llmClient;
        this.tracingService = tracingService;
    }

    /**
     * Execute both stages inside a root span.
     */
    public RagAnswer run(String question, int topK, ProductFilters filters) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("question", question);
        attributes.put("top_k", topK);

        return tracingService.inTraceRun("rag_query", attributes, root -> {
            TraceHandle handle = root.handle();
            log.info("[RagOrchestrator] {} -> {} question='{}' topK={}", Stage.START, Stage.RETRIEVE,
                    truncate(question, 50), topK);

            List<ContextItem> context = retrieve(question, topK, filters);
            log.info("[RagOrchestrator] {} -> {} with {} context items", Stage.RETRIEVE, Stage.GENERATE,
                    context.size());

            String answer = generate(question, context);
            root.setAttribute("rag.context_items", context.size());
            root.setAttribute("rag.answer_length", answer.length());
            log.info("[RagOrchestrator] {} -> {} answer={} chars", Stage.GENERATE, Stage.DONE, answer.length());

            return new RagAnswer(answer, context, handle.traceId(), handle.traceUrl());
        });
    }

    /**
     * Documents first in retrieval rank order, then at most three catalog products.
     */
    public List<ContextItem> retrieve(String question, int topK, ProductFilters filters) {
        String query = question == null ? "" : question;
        List<ContextItem> context = new ArrayList<>();

        Optional<VectorStore> store = vectorStoreProvider.current();
        if (store.isPresent()) {
            VectorStore vectorStore = store.get();
            List<RetrievalHit> hits = tracingService.inSpan("vector_retrieve",
                    Map.of("query", query, "top_k", topK, "backend", vectorStore.backendName()),
                    span -> {
                        List<RetrievalHit> result = vectorStore.query(query, topK);
                        span.setAttribute("hits", result.size());
                        return result;
                    });
            for (RetrievalHit hit : hits) {
                context.add(toDocumentItem(hit, vectorStore.backendName()));
            }
        } else {
            log.debug("[RagOrchestrator] No vector store available, skipping document retrieval");
        }

        ProductFilters effectiveFilters = filters == null ? ProductFilters.none() : filters;
        List<ContextItem> products = tracingService.inSpan("catalog_lookup",
                Map.of("filtered", effectiveFilters.hasAny()),
                span -> {
                    List<ContextItem> result = catalogContextAdapter.findProductContext(query, effectiveFilters);
                    span.setAttribute("matches", result.size());
                    return result;
                });
        context.addAll(products);

        return List.copyOf(context);
    }

    /**
     * Synthesize an answer from the context items. Only item text is read.
     */
    public String generate(String question, List<ContextItem> context) {
        String renderedContext = renderContext(context);
        if (renderedContext.isEmpty()) {
            log.info("[RagOrchestrator] No usable context, returning sentinel answer");
            return NO_CONTEXT_ANSWER;
        }
        if (!llmClient.isConfigured()) {
            log.info("[RagOrchestrator] Language model not configured, returning extractive fallback");
            return extractiveFallback(context);
        }

        String q = question == null ? "" : question;
        String prompt = PROMPT_TEMPLATE.formatted(renderedContext, q);
        try {
            return tracingService.inSpan("llm_generate",
                    Map.of("model", String.valueOf(llmClient.modelName()), "question_length", q.length()),
                    span -> {
                        String answer = Optional.ofNullable(llmClient.complete(prompt)).orElse("");
                        span.setAttribute("answer_length", answer.length());
                        return answer;
                    });
        } catch (SynthesisUnavailableException e) {
            log.warn("[RagOrchestrator] Language model call failed, returning extractive fallback: {}",
                    e.getMessage());
            return extractiveFallback(context);
        }
    }

    static String renderContext(List<ContextItem> context) {
        List<String> blocks = new ArrayList<>();
        for (ContextItem item : context) {
            if (!item.hasText()) {
                continue;
            }
            String label = item.title() != null && !item.title().isBlank() ? item.title() : item.type().wireName();
            blocks.add(label + ":\n" + item.text());
        }
        return String.join("\n\n", blocks);
    }

    static String extractiveFallback(List<ContextItem> context) {
        List<String> parts = new ArrayList<>();
        parts.add(FALLBACK_PREAMBLE);
        context.stream()
                .filter(ContextItem::hasText)
                .limit(FALLBACK_SNIPPETS)
                .forEach(item -> parts.add(item.text()));
        return String.join("\n\n", parts);
    }

    static ContextItem toDocumentItem(RetrievalHit hit, String backend) {
        Map<String, Object> payload = hit.payload();
        Map<String, Object> metadata = new LinkedHashMap<>(payload);
        metadata.remove("text");
        return new ContextItem(ContextType.DOCUMENT, hit.id(), titleOf(payload), hit.text(), hit.score(), backend,
                metadata);
    }

    private static String titleOf(Map<String, Object> payload) {
        for (String key : List.of("title", "doc_id")) {
            Object value = payload.get(key);
            if (value != null && !String.valueOf(value).isBlank()) {
                return String.valueOf(value);
            }
        }
        return null;
    }

    private String truncate(String text, int maxLength) {
        if (text == null) {
            return "null";
        }
        return text.length() > maxLength ? text.substring(0, maxLength) + "..." : text;
    }
}
