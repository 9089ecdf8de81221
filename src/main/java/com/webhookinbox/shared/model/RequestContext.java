package com.webhookinbox.shared.model;

import java.util.UUID;

/**
 * Per-request values that downstream code logs with. Created once by the request filter and
 * passed along explicitly.
 */
public record RequestContext(
    String requestId,
    String method,
    String path,
    long startNanos
) {
    public static final String ATTRIBUTE = "webhookinbox.requestContext";

    public static RequestContext start(String method, String path) {
        return new RequestContext(UUID.randomUUID().toString(), method, path, System.nanoTime());
    }

    /** Milliseconds since {@link #startNanos}, rounded to two decimals. */
    public double elapsedMillis() {
        var nanos = System.nanoTime() - startNanos;
        return Math.round(nanos / 10_000.0) / 100.0;
    }
}
