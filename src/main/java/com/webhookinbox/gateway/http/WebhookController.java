package com.webhookinbox.gateway.http;

import com.webhookinbox.ingest.IngestionOrchestrator;
import com.webhookinbox.shared.model.RequestContext;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class WebhookController {

    private final IngestionOrchestrator orchestrator;

    public WebhookController(IngestionOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    /** Created and duplicate deliveries get the same response. */
    @PostMapping("/webhook")
    public Map<String, String> webhook(
            @RequestAttribute(RequestContext.ATTRIBUTE) RequestContext ctx,
            @RequestBody(required = false) byte[] body,
            @RequestHeader(value = "X-Signature", required = false) String signature) {
        orchestrator.ingest(ctx, body, signature);
        return Map.of("status", "ok");
    }
}
