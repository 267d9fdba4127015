package com.ai.catalogqa.tracing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.ContextKey;
import io.opentelemetry.context.Scope;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.function.Function;

/**
 * Process-wide trace-context layer.
 * <p>
 * The tracing backend is connected lazily, at most once per process; a failed attempt is
 * cached and never retried. Without a backend every span is a no-op, but root spans still
 * generate a trace id and bind it to the current {@link Context} so nested spans and log
 * lines (MDC {@code traceId}) can be correlated. Tracing failures are logged and never
 * reach the caller; errors thrown by traced work are recorded and rethrown unchanged.
 */
@Service
public class TracingService {

    private static final Logger log = LoggerFactory.getLogger(TracingService.class);

    static final ContextKey<String> TRACE_ID_KEY = ContextKey.named("catalogqa.trace-id");
    public static final String MDC_TRACE_ID = "traceId";
    static final String TRACE_ID_ATTRIBUTE = "trace_id";
    static final String INPUT_QUERY_ATTRIBUTE = "openinference.input.query";

    private static final SecureRandom RANDOM = new SecureRandom();

    private final TraceBackendFactory backendFactory;
    private final ObjectMapper objectMapper;
    private final String configuredEndpoint;

    private final Object initLock = new Object();
    private volatile boolean initialized;
    private volatile TraceBackend backend;
    private volatile String uiEndpoint;

    public TracingService(
            TraceBackendFactory backendFactory,
            ObjectMapper objectMapper,
            @Value("${tracing.endpoint:}") String configuredEndpoint) {
        this.backendFactory = backendFactory;
        this.objectMapper = objectMapper;
        this.configuredEndpoint = configuredEndpoint;
    }

    /**
     * True iff the tracing backend was reachable and registered successfully.
     */
    public boolean isEnabled() {
        return backend() != null;
    }

    /**
     * Open a child span under the current context. Tagged with the ambient trace id.
     */
    public SpanScope span(String name, Map<String, ?> attributes) {
        TraceBackend active = backend();
        String traceId = ambientTraceId(attributes);
        if (active == null) {
            return new NoopSpanScope(traceId);
        }
        try {
            Span span = active.tracer().spanBuilder(name).startSpan();
            Scope scope = span.makeCurrent();
            OtelSpanScope spanScope = new OtelSpanScope(span, scope, traceId, null, null);
            spanScope.setAttributes(attributes);
            spanScope.setAttribute(TRACE_ID_ATTRIBUTE, traceId);
            return spanScope;
        } catch (RuntimeException e) {
            log.warn("[TracingService] Failed to open span '{}': {}", name, e.getMessage());
            return new NoopSpanScope(traceId);
        }
    }

    /**
     * Open a root span and bind a trace id to the current context for its lifetime.
     * The id comes from the backend span context, or is a random 128-bit hex value
     * when no backend is active.
     */
    public RootSpanScope traceRun(String name, Map<String, ?> attributes) {
        TraceBackend active = backend();
        Span span = null;
        String traceId = null;
        if (active != null) {
            try {
                span = active.tracer().spanBuilder(name).setNoParent().startSpan();
                SpanContext spanContext = span.getSpanContext();
                if (spanContext.isValid()) {
                    traceId = spanContext.getTraceId();
                }
            } catch (RuntimeException e) {
                log.warn("[TracingService] Failed to open root span '{}': {}", name, e.getMessage());
                span = null;
            }
        }
        if (traceId == null) {
            traceId = generateTraceId();
        }

        Context context = Context.current().with(TRACE_ID_KEY, traceId);
        if (span != null) {
            context = context.with(span);
        }
        Scope scope = context.makeCurrent();
        String previousMdc = MDC.get(MDC_TRACE_ID);
        MDC.put(MDC_TRACE_ID, traceId);
        TraceHandle handle = new TraceHandle(traceId, TraceEndpoints.traceUrl(uiEndpoint, traceId));

        if (span == null) {
            return new NoopRootSpanScope(traceId, handle, scope, previousMdc);
        }
        OtelSpanScope root = new OtelSpanScope(span, scope, traceId, handle, previousMdc);
        root.setAttributes(attributes);
        root.setAttribute(TRACE_ID_ATTRIBUTE, traceId);
        if (attributes != null && attributes.get("question") != null) {
            root.setAttribute(INPUT_QUERY_ATTRIBUTE, attributes.get("question"));
        }
        return root;
    }

    /**
     * Run work inside a child span, recording any error on the span before rethrowing it.
     */
    public <T> T inSpan(String name, Map<String, ?> attributes, Function<SpanScope, T> work) {
        try (SpanScope scope = span(name, attributes)) {
            try {
                return work.apply(scope);
            } catch (RuntimeException | Error e) {
                scope.recordError(e);
                throw e;
            }
        }
    }

    /**
     * Run work inside a root span, recording any error on the span before rethrowing it.
     */
    public <T> T inTraceRun(String name, Map<String, ?> attributes, Function<RootSpanScope, T> work) {
        try (RootSpanScope scope = traceRun(name, attributes)) {
            try {
                return work.apply(scope);
            } catch (RuntimeException | Error e) {
                scope.recordError(e);
                throw e;
            }
        }
    }

    /**
     * Trace id bound to the current context, or null outside a root span.
     */
    public static String currentTraceId() {
        return Context.current().get(TRACE_ID_KEY);
    }

    @PreDestroy
    public void shutdown() {
        TraceBackend active = backend;
        if (active == null) {
            return;
        }
        try {
            active.shutdown();
            log.info("[TracingService] Tracing backend shut down");
        } catch (RuntimeException e) {
            log.warn("[TracingService] Failed to shut down tracing backend: {}", e.getMessage());
        }
    }

    private TraceBackend backend() {
        if (!initialized) {
            synchronized (initLock) {
                if (!initialized) {
                    try {
                        initialize();
                    } finally {
                        initialized = true;
                    }
                }
            }
        }
        return backend;
    }

    private void initialize() {
        String endpoint = TraceEndpoints.normalize(configuredEndpoint);
        uiEndpoint = endpoint;
        if (endpoint == null) {
            log.warn("[TracingService] Tracing disabled because tracing.endpoint is not configured; spans will be no-ops");
            return;
        }
        try {
            backend = backendFactory.connect(endpoint);
            log.info("[TracingService] Tracing enabled, exporting to {}", TraceEndpoints.collectorEndpoint(endpoint));
        } catch (RuntimeException e) {
            log.warn("[TracingService] Tracing registration failed, spans will be no-ops: {}", e.getMessage());
        }
    }

    private static String ambientTraceId(Map<String, ?> attributes) {
        if (attributes != null && attributes.get(TRACE_ID_ATTRIBUTE) != null) {
            return String.valueOf(attributes.get(TRACE_ID_ATTRIBUTE));
        }
        return currentTraceId();
    }

    static String generateTraceId() {
        byte[] bytes = new byte[16];
        RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    private static boolean isCancellation(Throwable error) {
        return error instanceof CancellationException
                || error instanceof InterruptedException
                || Thread.currentThread().isInterrupted();
    }

    private static void restoreMdc(String previous) {
        if (previous == null) {
            MDC.remove(MDC_TRACE_ID);
        } else {
            MDC.put(MDC_TRACE_ID, previous);
        }
    }

    private static class NoopSpanScope implements SpanScope {

        private final String traceId;

        NoopSpanScope(String traceId) {
            this.traceId = traceId;
        }

        @Override
        public void setAttribute(String key, Object value) {
        }

        @Override
        public void recordError(Throwable error) {
        }

        @Override
        public String traceId() {
            return traceId;
        }

        @Override
        public void close() {
        }
    }

    private static final class NoopRootSpanScope extends NoopSpanScope implements RootSpanScope {

        private final TraceHandle handle;
        private final Scope scope;
        private final String previousMdc;
        private boolean closed;

        NoopRootSpanScope(String traceId, TraceHandle handle, Scope scope, String previousMdc) {
            super(traceId);
            this.handle = handle;
            this.scope = scope;
            this.previousMdc = previousMdc;
        }

        @Override
        public TraceHandle handle() {
            return handle;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            try {
                scope.close();
            } catch (RuntimeException e) {
                log.debug("[TracingService] Failed to release trace context: {}", e.getMessage());
            }
            restoreMdc(previousMdc);
        }
    }

    private final class OtelSpanScope implements RootSpanScope {

        private final Span span;
        private final Scope scope;
        private final String traceId;
        private final TraceHandle handle;
        private final String previousMdc;
        private boolean closed;

        OtelSpanScope(Span span, Scope scope, String traceId, TraceHandle handle, String previousMdc) {
            this.span = span;
            this.scope = scope;
            this.traceId = traceId;
            this.handle = handle;
            this.previousMdc = previousMdc;
        }

        void setAttributes(Map<String, ?> attributes) {
            if (attributes == null) {
                return;
            }
            attributes.forEach(this::setAttribute);
        }

        @Override
        public void setAttribute(String key, Object value) {
            if (key == null || value == null) {
                return;
            }
            try {
                if (value instanceof String s) {
                    span.setAttribute(key, s);
                } else if (value instanceof Boolean b) {
                    span.setAttribute(key, b);
                } else if (value instanceof Integer || value instanceof Long
                        || value instanceof Short || value instanceof Byte) {
                    span.setAttribute(key, ((Number) value).longValue());
                } else if (value instanceof Number n) {
                    span.setAttribute(key, n.doubleValue());
                } else {
                    span.setAttribute(key, serialize(value));
                }
            } catch (RuntimeException e) {
                log.debug("[TracingService] Failed to set span attribute '{}': {}", key, e.getMessage());
            }
        }

        @Override
        public void recordError(Throwable error) {
            try {
                if (isCancellation(error)) {
                    span.setAttribute("cancelled", true);
                    span.setStatus(StatusCode.ERROR, "cancelled");
                } else {
                    span.setStatus(StatusCode.ERROR, String.valueOf(error.getMessage()));
                }
                span.recordException(error);
            } catch (RuntimeException e) {
                log.debug("[TracingService] Failed to record error on span: {}", e.getMessage());
            }
        }

        @Override
        public String traceId() {
            return traceId;
        }

        @Override
        public TraceHandle handle() {
            return handle;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            try {
                scope.close();
            } catch (RuntimeException e) {
                log.debug("[TracingService] Failed to release span scope: {}", e.getMessage());
            }
            try {
                span.end();
            } catch (RuntimeException e) {
                log.warn("[TracingService] Failed to end span: {}", e.getMessage());
            }
            if (handle != null) {
                restoreMdc(previousMdc);
            }
        }

        private String serialize(Object value) {
            try {
                return objectMapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                return String.valueOf(value);
            }
        }
    }
}
