package com.ai.catalogqa.exception;

import com.ai.catalogqa.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.Map;

@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(VectorStoreUnavailableException.class)
    public ResponseEntity<ApiError> handleStoreUnavailable(VectorStoreUnavailableException e, WebRequest request) {
        log.error("[ExceptionHandler] Vector store unavailable: {}", e.getMessage());

        ApiError error = ApiError.of(
                HttpStatus.SERVICE_UNAVAILABLE.value(),
                "Service Unavailable",
                "STORE_UNAVAILABLE",
                "The vector store is not available",
                getRequestPath(request),
                Map.of(
                        "hint", "Check that Weaviate is running or enable vectorstore.fallback-enabled",
                        "originalError", String.valueOf(e.getMessage())),
                currentTraceId());

        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(error);
    }

    @ExceptionHandler(CatalogUnavailableException.class)
    public ResponseEntity<ApiError> handleCatalogUnavailable(CatalogUnavailableException e, WebRequest request) {
        log.error("[ExceptionHandler] Catalog unavailable: {}", e.getMessage());

        ApiError error = ApiError.of(
                HttpStatus.SERVICE_UNAVAILABLE.value(),
                "Service Unavailable",
                "CATALOG_UNAVAILABLE",
                "The product catalog is not available",
                getRequestPath(request),
                Map.of(
                        "hint", "Check catalog.path points to a readable JSONL file",
                        "originalError", String.valueOf(e.getMessage())),
                currentTraceId());

        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(error);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ApiError> handleResponseStatus(ResponseStatusException e, WebRequest request) {
        log.error("[ExceptionHandler] ResponseStatusException: status={}, reason={}", e.getStatusCode(), e.getReason());

        String code = e.getReason();
        if (code != null && code.contains(":")) {
            code = code.split(":")[0].trim();
        }

        HttpStatus status = HttpStatus.resolve(e.getStatusCode().value());
        ApiError error = ApiError.of(
                e.getStatusCode().value(),
                status != null ? status.getReasonPhrase() : e.getStatusCode().toString(),
                (code != null && !code.isBlank()) ? code : "API_ERROR",
                e.getReason() != null ? e.getReason() : e.getMessage(),
                getRequestPath(request),
                null,
                currentTraceId());

        return ResponseEntity.status(e.getStatusCode()).body(error);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleInvalid(MethodArgumentNotValidException e, WebRequest request) {
        Map<String, Object> fields = new LinkedHashMap<>();
        for (FieldError fieldError : e.getBindingResult().getFieldErrors()) {
            fields.putIfAbsent(fieldError.getField(), String.valueOf(fieldError.getDefaultMessage()));
        }
        log.warn("[ExceptionHandler] Validation failed: {}", fields);

        ApiError error = ApiError.of(
                HttpStatus.BAD_REQUEST.value(),
                "Bad Request",
                "INVALID_REQUEST",
                "Request validation failed",
                getRequestPath(request),
                fields,
                currentTraceId());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleNotReadable(HttpMessageNotReadableException e, WebRequest request) {
        log.error("[ExceptionHandler] HttpMessageNotReadableException: {}", e.getMessage());

        ApiError error = ApiError.of(
                HttpStatus.BAD_REQUEST.value(),
                "Bad Request",
                "INVALID_PAYLOAD",
                "Request body is not valid JSON for this endpoint",
                getRequestPath(request),
                Map.of("details", String.valueOf(e.getMostSpecificCause().getMessage())),
                currentTraceId());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception e, WebRequest request) {
        log.error("[ExceptionHandler] Unexpected error: ", e);

        ApiError error = ApiError.of(
                HttpStatus.INTERNAL_SERVER_ERROR.value(),
                "Internal Server Error",
                "INTERNAL_SERVER_ERROR",
                "An unexpected error occurred: " + e.getMessage(),
                getRequestPath(request),
                null,
                currentTraceId());

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    private String currentTraceId() {
        String traceId = TracingService.currentTraceId();
        return traceId != null ? traceId : MDC.get(TracingService.MDC_TRACE_ID);
    }

    private String getRequestPath(WebRequest request) {
        if (request instanceof ServletWebRequest) {
            return ((ServletWebRequest) request).getRequest().getRequestURI();
        }
        return null;
    }
}
