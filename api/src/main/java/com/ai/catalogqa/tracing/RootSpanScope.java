package com.ai.catalogqa.tracing;

/**
 * The top-level span of a request. Binds its trace id to the current context so
 * every nested {@link SpanScope} inherits it.
 */
public interface RootSpanScope extends SpanScope {

    TraceHandle handle();
}
