package com.webhookinbox.ingest;

import com.webhookinbox.auth.InvalidSignatureException;
import com.webhookinbox.auth.SignatureVerifier;
import com.webhookinbox.observability.InboxMetrics;
import com.webhookinbox.shared.error.ValidationException;
import com.webhookinbox.shared.model.Message;
import com.webhookinbox.shared.model.RequestContext;
import com.webhookinbox.storage.InsertResult;
import com.webhookinbox.storage.MessageStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one webhook delivery through verify, validate and store. The signature is checked
 * against the bytes exactly as received, before any parsing.
 */
public class DefaultIngestionOrchestrator implements IngestionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DefaultIngestionOrchestrator.class);

    static final String INVALID_SIGNATURE = "invalid_signature";
    static final String VALIDATION_ERROR = "validation_error";

    private final SignatureVerifier verifier;
    private final PayloadValidator validator;
    private final MessageStore store;
    private final InboxMetrics metrics;

    public DefaultIngestionOrchestrator(SignatureVerifier verifier, PayloadValidator validator,
                                        MessageStore store, InboxMetrics metrics) {
        this.verifier = verifier;
        this.validator = validator;
        this.store = store;
        this.metrics = metrics;
    }

    @Override
    public InsertResult ingest(RequestContext ctx, byte[] body, String signature) {
        if (!verifier.verify(body, signature)) {
            log.atError()
                    .addKeyValue("request_id", ctx.requestId())
                    .addKeyValue("result", INVALID_SIGNATURE)
                    .log("Invalid signature");
            metrics.recordWebhookResult(INVALID_SIGNATURE);
            throw new InvalidSignatureException();
        }

        Message message;
        try {
            message = validator.validate(body);
        } catch (ValidationException e) {
            log.atError()
                    .addKeyValue("request_id", ctx.requestId())
                    .addKeyValue("result", VALIDATION_ERROR)
                    .log("Validation error: {}", e.getMessage());
            metrics.recordWebhookResult(VALIDATION_ERROR);
            throw e;
        }

        var result = store.insert(message);
        log.atInfo()
                .addKeyValue("request_id", ctx.requestId())
                .addKeyValue("message_id", message.messageId())
                .addKeyValue("dup", result == InsertResult.DUPLICATE)
                .addKeyValue("result", result.label())
                .log("Webhook processed: {}", result.label());
        metrics.recordWebhookResult(result.label());
        return result;
    }
}
