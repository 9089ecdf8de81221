package com.webhookinbox.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Process-wide request counters and latency samples, rendered in the Prometheus text format.
 * Safe for concurrent use from request threads.
 */
public class InboxMetrics {

    public static final String CONTENT_TYPE = "text/plain; version=0.0.4";

    static final String HTTP_REQUESTS = "http_requests_total";
    static final String WEBHOOK_REQUESTS = "webhook_requests_total";
    static final String LATENCY = "request_latency_ms";
    private static final double[] QUANTILES = {0.5, 0.9, 0.99};

    private final MeterRegistry registry;
    private final Object latencyLock = new Object();
    private final List<Double> latencies = new ArrayList<>();

    public InboxMetrics() {
        this.registry = new SimpleMeterRegistry();
    }

    public void recordHttpRequest(String path, int status) {
        Counter.builder(HTTP_REQUESTS)
                .tag("path", path)
                .tag("status", String.valueOf(status))
                .register(registry)
                .increment();
    }

    public void recordWebhookResult(String result) {
        Counter.builder(WEBHOOK_REQUESTS)
                .tag("result", result)
                .register(registry)
                .increment();
    }

    public void recordLatency(double latencyMs) {
        synchronized (latencyLock) {
            latencies.add(latencyMs);
        }
    }

    public double webhookCount(String result) {
        var counter = registry.find(WEBHOOK_REQUESTS).tag("result", result).counter();
        return counter == null ? 0 : counter.count();
    }

    public String export() {
        var out = new StringBuilder();

        out.append("# HELP ").append(HTTP_REQUESTS).append(" Total HTTP requests by path and status\n");
        out.append("# TYPE ").append(HTTP_REQUESTS).append(" counter\n");
        registry.find(HTTP_REQUESTS).counters().stream()
                .sorted(Comparator.comparing((Counter c) -> c.getId().getTag("path"))
                        .thenComparing(c -> c.getId().getTag("status")))
                .forEach(c -> out.append(HTTP_REQUESTS)
                        .append("{path=\"").append(escape(c.getId().getTag("path")))
                        .append("\",status=\"").append(c.getId().getTag("status"))
                        .append("\"} ").append((long) c.count()).append('\n'));

        out.append("# HELP ").append(WEBHOOK_REQUESTS).append(" Total webhook requests by result\n");
        out.append("# TYPE ").append(WEBHOOK_REQUESTS).append(" counter\n");
        registry.find(WEBHOOK_REQUESTS).counters().stream()
                .sorted(Comparator.comparing(c -> c.getId().getTag("result")))
                .forEach(c -> out.append(WEBHOOK_REQUESTS)
                        .append("{result=\"").append(escape(c.getId().getTag("result")))
                        .append("\"} ").append((long) c.count()).append('\n'));

        double[] sorted;
        synchronized (latencyLock) {
            sorted = latencies.stream().mapToDouble(Double::doubleValue).toArray();
        }
        if (sorted.length > 0) {
            Arrays.sort(sorted);
            double sum = 0;
            for (var v : sorted) sum += v;
            out.append("# HELP ").append(LATENCY).append(" Request latency in milliseconds\n");
            out.append("# TYPE ").append(LATENCY).append(" summary\n");
            out.append(LATENCY).append("_count ").append(sorted.length).append('\n');
            out.append(LATENCY).append("_sum ").append(sum).append('\n');
            for (var q : QUANTILES) {
                out.append(LATENCY).append("{quantile=\"").append(q).append("\"} ")
                        .append(sorted[(int) (sorted.length * q)]).append('\n');
            }
        }
        return out.toString();
    }

    private static String escape(String label) {
        return label.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }
}
