package com.ai.catalogqa.repository;

import com.ai.catalogqa.dto.ChunkRecord;
import com.ai.catalogqa.dto.RetrievalHit;
import com.ai.catalogqa.exception.VectorStoreUnavailableException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

public class WeaviateVectorStoreTest {

    private static final String SCHEMA = """
            {"class":"KnowledgeDocument","properties":[
              {"name":"text","dataType":["text"]},
              {"name":"title","dataType":["text"]},
              {"name":"section_index","dataType":["int"]},
              {"name":"nested","dataType":["object"]}]}
            """;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void testConstructor_UnreachableServiceSignalsUnavailable() {
        StubWeaviate stub = new StubWeaviate(request -> Mono.error(new ConnectException("Connection refused")));

        assertThrows(VectorStoreUnavailableException.class, () -> newStore(stub));
    }

    @Test
    void testQuery_EmptyTextMakesNoNetworkCall() {
        StubWeaviate stub = new StubWeaviate(this::defaultRoutes);
        WeaviateVectorStore store = newStore(stub);
        int callsAfterConnect = stub.requests.size();

        assertTrue(store.query("", 5).isEmpty());
        assertEquals(callsAfterConnect, stub.requests.size());
        assertEquals("/v1/meta", stub.requests.get(0));
    }

    @Test
    void testUpsert_CreatesMissingCollectionThenBatches() {
        StubWeaviate stub = new StubWeaviate(request -> {
            String path = request.url().getPath();
            if (path.equals("/v1/schema/KnowledgeDocument")) {
                return Mono.just(ClientResponse.create(HttpStatus.NOT_FOUND).build());
            }
            if (path.equals("/v1/batch/objects")) {
                return json("""
                        [{"id":"1","result":{}},
                         {"id":"2","result":{"errors":{"error":[{"message":"bad"}]}}}]
                        """);
            }
            return defaultRoutes(request);
        });
        WeaviateVectorStore store = newStore(stub);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("title", "Care guide");
        metadata.put("bad key", "dropped");
        int stored = store.upsert(List.of(
                new ChunkRecord("Wash cold", "care", 0, metadata),
                new ChunkRecord("Line dry", "care", 1, metadata)));

        assertEquals(1, stored);
        assertEquals(List.of("GET /v1/meta", "GET /v1/schema/KnowledgeDocument", "POST /v1/schema",
                "POST /v1/batch/objects"), stub.calls);
    }

    @Test
    void testUpsert_ExistingCollectionIsNotRecreated() {
        StubWeaviate stub = new StubWeaviate(this::defaultRoutes);
        WeaviateVectorStore store = newStore(stub);

        store.upsert(List.of(new ChunkRecord("Wash cold", "care", 0, Map.of())));
        store.upsert(List.of(new ChunkRecord("Line dry", "care", 1, Map.of())));

        assertFalse(stub.calls.contains("POST /v1/schema"));
        assertEquals(1, stub.calls.stream().filter(c -> c.equals("GET /v1/schema/KnowledgeDocument")).count());
    }

    @Test
    void testQuery_ParsesHitsWithDistanceAsScore() {
        StubWeaviate stub = new StubWeaviate(this::defaultRoutes);
        WeaviateVectorStore store = newStore(stub);

        List<RetrievalHit> hits = store.query("how do I wash linen?", 2);

        assertEquals(2, hits.size());
        assertEquals("uuid-1", hits.get(0).id());
        assertEquals(0.12, hits.get(0).score(), 1e-9);
        assertEquals("Wash linen cold", hits.get(0).text());
        assertEquals("Care guide", hits.get(0).payload().get("title"));
        assertFalse(hits.get(0).payload().containsKey("_additional"));
        assertNull(hits.get(1).score());
        assertTrue(stub.calls.contains("POST /v1/graphql"));
    }

    @Test
    void testQuery_MissingCollectionReturnsEmpty() {
        StubWeaviate stub = new StubWeaviate(request -> {
            if (request.url().getPath().equals("/v1/schema/KnowledgeDocument")) {
                return Mono.just(ClientResponse.create(HttpStatus.NOT_FOUND).build());
            }
            return defaultRoutes(request);
        });
        WeaviateVectorStore store = newStore(stub);

        assertTrue(store.query("linen", 5).isEmpty());
        assertFalse(stub.calls.contains("POST /v1/graphql"));
    }

    @Test
    void testQuery_GraphQlErrorsSignalUnavailable() {
        StubWeaviate stub = new StubWeaviate(request -> {
            if (request.url().getPath().equals("/v1/graphql")) {
                return json("{\"errors\":[{\"message\":\"vectorizer failed\"}]}");
            }
            return defaultRoutes(request);
        });
        WeaviateVectorStore store = newStore(stub);

        VectorStoreUnavailableException e = assertThrows(VectorStoreUnavailableException.class,
                () -> store.query("linen", 5));
        assertTrue(e.getMessage().contains("vectorizer failed"));
    }

    @Test
    void testQuery_ServerErrorSignalsUnavailable() {
        StubWeaviate stub = new StubWeaviate(request -> {
            if (request.url().getPath().equals("/v1/graphql")) {
                return Mono.just(ClientResponse.create(HttpStatus.INTERNAL_SERVER_ERROR).build());
            }
            return defaultRoutes(request);
        });
        WeaviateVectorStore store = newStore(stub);

        assertThrows(VectorStoreUnavailableException.class, () -> store.query("linen", 5));
    }

    private Mono<ClientResponse> defaultRoutes(ClientRequest request) {
        String path = request.url().getPath();
        if (path.equals("/v1/meta")) {
            return json("{\"version\":\"1.24.1\"}");
        }
        if (path.equals("/v1/schema/KnowledgeDocument")) {
            return json(SCHEMA);
        }
        if (path.equals("/v1/schema")) {
            return json("{\"class\":\"KnowledgeDocument\"}");
        }
        if (path.equals("/v1/batch/objects")) {
            return json("[{\"id\":\"1\",\"result\":{}}]");
        }
        if (path.equals("/v1/graphql")) {
            return json("""
                    {"data":{"Get":{"KnowledgeDocument":[
                      {"text":"Wash linen cold","title":"Care guide","section_index":0,
                       "_additional":{"id":"uuid-1","distance":0.12}},
                      {"text":"Linen softens with use","title":null,"_additional":{"id":"uuid-2"}}]}}}
                    """);
        }
        return Mono.just(ClientResponse.create(HttpStatus.NOT_FOUND).build());
    }

    private WeaviateVectorStore newStore(StubWeaviate stub) {
        WebClient webClient = WebClient.builder()
                .baseUrl("http://weaviate:8080")
                .exchangeFunction(stub)
                .build();
        return new WeaviateVectorStore(webClient, objectMapper, "KnowledgeDocument", "text-embedding-3-small",
                Duration.ofSeconds(5));
    }

    private static Mono<ClientResponse> json(String body) {
        return Mono.just(ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build());
    }

    private static final class StubWeaviate implements ExchangeFunction {

        final List<String> requests = new ArrayList<>();
        final List<String> calls = new ArrayList<>();
        private final Function<ClientRequest, Mono<ClientResponse>> routes;

        StubWeaviate(Function<ClientRequest, Mono<ClientResponse>> routes) {
            this.routes = routes;
        }

        @Override
        public Mono<ClientResponse> exchange(ClientRequest request) {
            requests.add(request.url().getPath());
            calls.add(request.method().name() + " " + request.url().getPath());
            return routes.apply(request);
        }
    }
}
