package com.ai.catalogqa.repository;

import com.ai.catalogqa.dto.ChunkRecord;
import com.ai.catalogqa.dto.RetrievalHit;
import com.ai.catalogqa.exception.VectorStoreUnavailableException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Vector store backed by a Weaviate instance reached over its REST and GraphQL APIs.
 * Vectorization happens server side through the {@code text2vec-openai} module.
 * <p>
 * The connection is verified at construction; the collection is created lazily
 * (create-if-absent) before the first write.
 */
public class WeaviateVectorStore implements VectorStore {

    private static final Logger log = LoggerFactory.getLogger(WeaviateVectorStore.class);
    private static final int BATCH_SIZE = 100;
    private static final Pattern PROPERTY_NAME = Pattern.compile("[_A-Za-z][_0-9A-Za-z]*");
    private static final Set<String> SCALAR_TYPES = Set.of(
            "text", "text[]", "string", "string[]", "int", "int[]", "number", "number[]",
            "boolean", "boolean[]", "date", "date[]", "uuid", "uuid[]");

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String collectionName;
    private final String embeddingsModel;
    private final Duration timeout;

    private volatile boolean collectionReady;
    private volatile List<String> propertyNames;

    public WeaviateVectorStore(WebClient weaviateWebClient, ObjectMapper objectMapper, String collectionName,
            String embeddingsModel, Duration timeout) {
        this.webClient = weaviateWebClient;
        this.objectMapper = objectMapper;
        this.collectionName = collectionName;
        this.embeddingsModel = embeddingsModel;
        this.timeout = timeout;
        verifyConnection();
    }

    private void verifyConnection() {
        JsonNode meta = call("connect", () -> webClient.get()
                .uri("/v1/meta")
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(timeout)
                .block());
        log.info("[WeaviateVectorStore] Connected to Weaviate {} (collection={})",
                meta == null ? "unknown" : meta.path("version").asText("unknown"), collectionName);
    }

    /**
     * Create the collection if it does not exist yet. Safe to call repeatedly.
     */
    public void ensureCollection() {
        if (collectionReady) {
            return;
        }
        synchronized (this) {
            if (collectionReady) {
                return;
            }
            JsonNode schema = fetchSchema();
            if (schema == null) {
                Map<String, Object> classDefinition = Map.of(
                        "class", collectionName,
                        "vectorizer", "text2vec-openai",
                        "moduleConfig", Map.of("text2vec-openai", Map.of("model", embeddingsModel)));
                call("create collection", () -> webClient.post()
                        .uri("/v1/schema")
                        .contentType(MediaType.APPLICATION_JSON)
                        .bodyValue(classDefinition)
                        .retrieve()
                        .bodyToMono(JsonNode.class)
                        .timeout(timeout)
                        .block());
                log.info("[WeaviateVectorStore] Created collection {} (vectorizer=text2vec-openai, model={})",
                        collectionName, embeddingsModel);
            }
            collectionReady = true;
        }
    }

    @Override
    public int upsert(List<ChunkRecord> records) {
        if (records.isEmpty()) {
            return 0;
        }
        ensureCollection();

        int stored = 0;
        for (int start = 0; start < records.size(); start += BATCH_SIZE) {
            List<ChunkRecord> batch = records.subList(start, Math.min(start + BATCH_SIZE, records.size()));
            List<Map<String, Object>> objects = new ArrayList<>();
            for (ChunkRecord record : batch) {
                objects.add(Map.of("class", collectionName, "properties", toProperties(record)));
            }

            JsonNode response = call("batch insert", () -> webClient.post()
                    .uri("/v1/batch/objects")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("objects", objects))
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(timeout)
                    .block());

            if (response != null && response.isArray()) {
                for (JsonNode item : response) {
                    JsonNode errors = item.path("result").path("errors");
                    if (errors.isMissingNode() || errors.isNull()) {
                        stored++;
                    } else {
                        log.warn("[WeaviateVectorStore] Object rejected: {}", errors);
                    }
                }
            }
        }
        // auto-schema may have added properties
        propertyNames = null;

        log.info("[WeaviateVectorStore] Upserted {}/{} records into {}", stored, records.size(), collectionName);
        return stored;
    }

    @Override
    public List<RetrievalHit> query(String text, int topK) {
        if (text == null || text.isEmpty() || topK <= 0) {
            return List.of();
        }
        List<String> fields = resolvePropertyNames();
        if (fields == null) {
            log.warn("[WeaviateVectorStore] Collection {} does not exist yet, nothing to query", collectionName);
            return List.of();
        }

        String graphQl = String.format(
                "{ Get { %s(nearText: {concepts: [%s]}, limit: %d) { %s _additional { id distance } } } }",
                collectionName, toGraphQlString(text), topK, String.join(" ", fields));

        JsonNode response = call("nearText query", () -> webClient.post()
                .uri("/v1/graphql")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("query", graphQl))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(timeout)
                .block());

        if (response == null) {
            return List.of();
        }
        JsonNode errors = response.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            log.error("[WeaviateVectorStore] GraphQL errors: {}", errors);
            throw new VectorStoreUnavailableException("Weaviate query failed: " + errors.get(0).path("message").asText());
        }

        List<RetrievalHit> hits = new ArrayList<>();
        for (JsonNode item : response.path("data").path("Get").path(collectionName)) {
            Map<String, Object> payload = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = item.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> field = it.next();
                if (!"_additional".equals(field.getKey()) && !field.getValue().isNull()) {
                    payload.put(field.getKey(), objectMapper.convertValue(field.getValue(), Object.class));
                }
            }
            JsonNode additional = item.path("_additional");
            Double distance = additional.path("distance").isNumber() ? additional.path("distance").asDouble() : null;
            hits.add(new RetrievalHit(additional.path("id").asText(null), distance, payload));
        }

        log.info("[WeaviateVectorStore] nearText returned {} hits (limit={})", hits.size(), topK);
        return hits;
    }

    @Override
    public String backendName() {
        return "weaviate";
    }

    private List<String> resolvePropertyNames() {
        List<String> cached = propertyNames;
        if (cached != null) {
            return cached;
        }
        JsonNode schema = fetchSchema();
        if (schema == null) {
            return null;
        }
        List<String> names = new ArrayList<>();
        for (JsonNode property : schema.path("properties")) {
            String dataType = property.path("dataType").path(0).asText("");
            if (SCALAR_TYPES.contains(dataType)) {
                names.add(property.path("name").asText());
            }
        }
        if (!names.contains("text")) {
            names.add(0, "text");
        }
        propertyNames = List.copyOf(names);
        return propertyNames;
    }

    /**
     * @return the class schema, or null when the collection does not exist
     */
    private JsonNode fetchSchema() {
        try {
            return call("fetch schema", () -> webClient.get()
                    .uri("/v1/schema/{className}", collectionName)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(timeout)
                    .block());
        } catch (VectorStoreUnavailableException e) {
            if (e.getCause() instanceof WebClientResponseException.NotFound) {
                return null;
            }
            throw e;
        }
    }

    private Map<String, Object> toProperties(ChunkRecord record) {
        Map<String, Object> properties = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : record.toPayload().entrySet()) {
            if (entry.getValue() == null) {
                continue;
            }
            if (!PROPERTY_NAME.matcher(entry.getKey()).matches()) {
                log.debug("[WeaviateVectorStore] Dropping property with invalid name '{}'", entry.getKey());
                continue;
            }
            properties.put(entry.getKey(), entry.getValue());
        }
        return properties;
    }

    private String toGraphQlString(String value) {
        try {
            // a JSON string literal is also a valid GraphQL string literal
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Query text cannot be encoded", e);
        }
    }

    private <T> T call(String operation, Supplier<T> request) {
        try {
            return request.get();
        } catch (WebClientRequestException e) {
            log.error("[WeaviateVectorStore] Failed to connect to Weaviate during {}: {}", operation, e.getMessage());
            throw new VectorStoreUnavailableException("Weaviate is not running or not accessible at the configured URL", e);
        } catch (WebClientResponseException e) {
            if (!(e instanceof WebClientResponseException.NotFound)) {
                log.error("[WeaviateVectorStore] Weaviate returned error during {}: status={}, body={}",
                        operation, e.getStatusCode(), e.getResponseBodyAsString());
            }
            throw new VectorStoreUnavailableException("Weaviate returned an error during " + operation + ": "
                    + e.getStatusCode(), e);
        } catch (VectorStoreUnavailableException e) {
            throw e;
        } catch (Exception e) {
            log.error("[WeaviateVectorStore] Unexpected error during {}: {}", operation, e.getMessage());
            throw new VectorStoreUnavailableException("Weaviate " + operation + " failed: " + e.getMessage(), e);
        }
    }
}
