package com.webhookinbox.gateway.http;

import com.webhookinbox.observability.InboxMetrics;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class MetricsController {

    private final InboxMetrics metrics;

    public MetricsController(InboxMetrics metrics) {
        this.metrics = metrics;
    }

    @GetMapping("/metrics")
    public ResponseEntity<String> metrics() {
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(InboxMetrics.CONTENT_TYPE))
                .body(metrics.export());
    }
}
