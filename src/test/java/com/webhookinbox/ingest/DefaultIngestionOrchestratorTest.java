package com.webhookinbox.ingest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.webhookinbox.auth.InvalidSignatureException;
import com.webhookinbox.auth.SignatureVerifier;
import com.webhookinbox.observability.InboxMetrics;
import com.webhookinbox.shared.error.ValidationException;
import com.webhookinbox.shared.model.Message;
import com.webhookinbox.shared.model.RequestContext;
import com.webhookinbox.storage.InsertResult;
import com.webhookinbox.storage.MessageStore;
import com.webhookinbox.storage.StorageUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class DefaultIngestionOrchestratorTest {

    private static final String VALID = """
            {"message_id":"m1","from":"+919876543210","to":"+14155550100","ts":"2025-01-15T10:00:00Z","text":"Hello"}""";

    private final SignatureVerifier verifier = new SignatureVerifier("testsecret");
    private final RequestContext ctx = RequestContext.start("POST", "/webhook");
    private MessageStore store;
    private InboxMetrics metrics;
    private DefaultIngestionOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        store = mock(MessageStore.class);
        metrics = new InboxMetrics();
        orchestrator = new DefaultIngestionOrchestrator(
                verifier, new PayloadValidator(new ObjectMapper()), store, metrics);
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void storesValidSignedMessage() throws Exception {
        when(store.insert(any())).thenReturn(InsertResult.CREATED);
        var body = bytes(VALID);

        var result = orchestrator.ingest(ctx, body, verifier.sign(body));

        assertEquals(InsertResult.CREATED, result);
        verify(store).insert(new Message("m1", "+919876543210", "+14155550100", "2025-01-15T10:00:00Z", "Hello"));
        assertEquals(1.0, metrics.webhookCount("created"));
    }

    @Test
    void duplicateIsRecordedButNotAnError() throws Exception {
        when(store.insert(any())).thenReturn(InsertResult.DUPLICATE);
        var body = bytes(VALID);

        var result = orchestrator.ingest(ctx, body, verifier.sign(body));

        assertEquals(InsertResult.DUPLICATE, result);
        assertEquals(1.0, metrics.webhookCount("duplicate"));
        assertEquals(0.0, metrics.webhookCount("created"));
    }

    @Test
    void badSignatureStopsBeforeValidation() {
        var body = bytes("not even json");

        assertThrows(InvalidSignatureException.class, () -> orchestrator.ingest(ctx, body, "deadbeef"));

        verifyNoInteractions(store);
        assertEquals(1.0, metrics.webhookCount("invalid_signature"));
        assertEquals(0.0, metrics.webhookCount("validation_error"));
    }

    @Test
    void missingSignatureIsRejected() {
        assertThrows(InvalidSignatureException.class, () -> orchestrator.ingest(ctx, bytes(VALID), null));
        verifyNoInteractions(store);
    }

    @Test
    void signatureCoversRawBytesNotParsedJson() throws Exception {
        var signed = bytes(VALID);
        var reformatted = bytes(VALID.replace(",", ", "));

        assertThrows(InvalidSignatureException.class,
                () -> orchestrator.ingest(ctx, reformatted, verifier.sign(signed)));
    }

    @Test
    void invalidPayloadIsRejectedAfterAuthentication() throws Exception {
        var body = bytes(VALID.replace("+919876543210", "invalid"));

        assertThrows(ValidationException.class, () -> orchestrator.ingest(ctx, body, verifier.sign(body)));

        verifyNoInteractions(store);
        assertEquals(1.0, metrics.webhookCount("validation_error"));
    }

    @Test
    void storageFailurePropagates() throws Exception {
        when(store.insert(any())).thenThrow(
                new StorageUnavailableException("down", new SQLException("disk I/O error")));
        var body = bytes(VALID);
        var sig = verifier.sign(body);

        assertThrows(StorageUnavailableException.class, () -> orchestrator.ingest(ctx, body, sig));
        assertEquals(0.0, metrics.webhookCount("created"));
    }
}
