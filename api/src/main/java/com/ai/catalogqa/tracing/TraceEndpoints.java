package com.ai.catalogqa.tracing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;

/**
 * Endpoint helpers for the tracing backend.
 */
public final class TraceEndpoints {

    private static final Logger log = LoggerFactory.getLogger(TraceEndpoints.class);
    static final String LOOPBACK = "127.0.0.1";
    private static final String TRACES_PATH = "/v1/traces";

    private TraceEndpoints() {
    }

    /**
     * Replace an unresolvable host with the loopback address, keeping scheme, port and path.
     *
     * @return the endpoint to use, or null when none is configured
     */
    public static String normalize(String endpoint) {
        if (endpoint == null || endpoint.isBlank()) {
            return null;
        }
        URI uri;
        try {
            uri = new URI(endpoint.trim());
        } catch (URISyntaxException e) {
            return endpoint;
        }
        String host = uri.getHost();
        if (host == null) {
            return endpoint;
        }
        try {
            InetAddress.getByName(host);
            return endpoint;
        } catch (UnknownHostException e) {
            try {
                String normalized = new URI(uri.getScheme(), uri.getUserInfo(), LOOPBACK, uri.getPort(),
                        uri.getPath(), uri.getQuery(), uri.getFragment()).toString();
                log.warn("[TraceEndpoints] Tracing endpoint host '{}' is not resolvable; falling back to '{}'",
                        host, normalized);
                return normalized;
            } catch (URISyntaxException ex) {
                return endpoint;
            }
        }
    }

    /**
     * OTLP/HTTP trace collector endpoint for a base endpoint.
     */
    public static String collectorEndpoint(String endpoint) {
        if (endpoint == null || endpoint.isBlank()) {
            return null;
        }
        String base = stripTrailingSlashes(endpoint);
        return base.endsWith(TRACES_PATH) ? base : base + TRACES_PATH;
    }

    /**
     * UI link for a trace, or null when no UI endpoint is configured.
     */
    public static String traceUrl(String endpoint, String traceId) {
        if (traceId == null || endpoint == null || endpoint.isBlank()) {
            return null;
        }
        return stripTrailingSlashes(endpoint) + "/traces/" + traceId;
    }

    private static String stripTrailingSlashes(String value) {
        String result = value.trim();
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
