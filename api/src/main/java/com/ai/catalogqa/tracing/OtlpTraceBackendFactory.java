package com.ai.catalogqa.tracing;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.exporter.otlp.http.trace.OtlpHttpSpanExporter;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;

/**
 * Registers an OpenTelemetry tracer provider exporting over OTLP/HTTP to a
 * Phoenix-compatible collector at {@code {endpoint}/v1/traces}.
 */
@Component
public class OtlpTraceBackendFactory implements TraceBackendFactory {

    private static final Logger log = LoggerFactory.getLogger(OtlpTraceBackendFactory.class);
    private static final String INSTRUMENTATION_SCOPE = "com.ai.catalogqa";
    private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
    private static final AttributeKey<String> PROJECT_NAME = AttributeKey.stringKey("openinference.project.name");

    private final String projectName;
    private final Duration reachabilityTimeout;

    public OtlpTraceBackendFactory(
            @Value("${tracing.project-name:${app.name:catalog-qa}}") String projectName,
            @Value("${tracing.reachability-timeout-millis:2000}") long reachabilityTimeoutMillis) {
        this.projectName = projectName;
        this.reachabilityTimeout = Duration.ofMillis(reachabilityTimeoutMillis);
    }

    @Override
    public TraceBackend connect(String endpoint) {
        checkReachable(endpoint);

        String collector = TraceEndpoints.collectorEndpoint(endpoint);
        OtlpHttpSpanExporter exporter = OtlpHttpSpanExporter.builder()
                .setEndpoint(collector)
                .setTimeout(Duration.ofSeconds(10))
                .build();

        Resource resource = Resource.getDefault().merge(Resource.create(
                Attributes.of(SERVICE_NAME, projectName, PROJECT_NAME, projectName)));

        SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                .setResource(resource)
                .addSpanProcessor(BatchSpanProcessor.builder(exporter).build())
                .build();

        log.info("[OtlpTraceBackendFactory] Registered tracer provider for project '{}' -> {}", projectName, collector);
        return new TraceBackend(tracerProvider.get(INSTRUMENTATION_SCOPE), tracerProvider::close);
    }

    /**
     * Any HTTP answer counts as reachable; connection failures and timeouts propagate.
     */
    private void checkReachable(String endpoint) {
        try {
            WebClient.create(endpoint)
                    .get()
                    .retrieve()
                    .toBodilessEntity()
                    .timeout(reachabilityTimeout)
                    .block();
        } catch (WebClientResponseException e) {
            log.debug("[OtlpTraceBackendFactory] Tracing endpoint answered {}", e.getStatusCode());
        }
    }
}
