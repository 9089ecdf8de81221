package com.webhookinbox.gateway.http;

import com.webhookinbox.observability.InboxMetrics;
import com.webhookinbox.shared.model.RequestContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/** Opens a {@link RequestContext} for every request and records its access log line and metrics. */
public class RequestContextFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RequestContextFilter.class);

    private final InboxMetrics metrics;

    public RequestContextFilter(InboxMetrics metrics) {
        this.metrics = metrics;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        var ctx = RequestContext.start(request.getMethod(), request.getRequestURI());
        request.setAttribute(RequestContext.ATTRIBUTE, ctx);
        try {
            filterChain.doFilter(request, response);
        } finally {
            var latencyMs = ctx.elapsedMillis();
            var status = response.getStatus();
            metrics.recordHttpRequest(ctx.path(), status);
            metrics.recordLatency(latencyMs);
            log.atInfo()
                    .addKeyValue("request_id", ctx.requestId())
                    .addKeyValue("method", ctx.method())
                    .addKeyValue("path", ctx.path())
                    .addKeyValue("status", status)
                    .addKeyValue("latency_ms", latencyMs)
                    .log("{} {} {}", ctx.method(), ctx.path(), status);
        }
    }
}
