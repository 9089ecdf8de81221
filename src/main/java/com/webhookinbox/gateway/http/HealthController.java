package com.webhookinbox.gateway.http;

import com.webhookinbox.observability.ReadinessCheck;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class HealthController {

    private final ReadinessCheck readiness;

    public HealthController(ReadinessCheck readiness) {
        this.readiness = readiness;
    }

    @GetMapping("/health/live")
    public Map<String, String> live() {
        return Map.of("status", "ok");
    }

    @GetMapping("/health/ready")
    public ResponseEntity<Map<String, String>> ready() {
        return readiness.notReadyReason()
                .map(reason -> ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                        .body(Map.of("status", "not ready", "reason", reason)))
                .orElseGet(() -> ResponseEntity.ok(Map.of("status", "ready")));
    }
}
