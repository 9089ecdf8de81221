package com.webhookinbox.auth;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class SignatureVerifierTest {

    private static final byte[] BODY =
            "{\"message_id\":\"m1\",\"from\":\"+911234567890\",\"to\":\"+14155550100\",\"ts\":\"2025-01-15T10:00:00Z\"}"
                    .getBytes(StandardCharsets.UTF_8);

    @Test
    void acceptsSignatureOverExactBody() throws Exception {
        var verifier = new SignatureVerifier("testsecret");
        assertTrue(verifier.verify(BODY, verifier.sign(BODY)));
    }

    @Test
    void matchesKnownHmacVector() throws Exception {
        // RFC 4231 test case 2
        var verifier = new SignatureVerifier("Jefe");
        var sig = verifier.sign("what do ya want for nothing?".getBytes(StandardCharsets.US_ASCII));
        assertEquals("5bdcc146bf60754e6a042426089575c75a003f089d2739839dec58b964ec3843", sig);
    }

    @Test
    void rejectsOneByteChange() throws Exception {
        var verifier = new SignatureVerifier("testsecret");
        var sig = verifier.sign(BODY);
        var altered = BODY.clone();
        altered[altered.length - 2] ^= 1;
        assertFalse(verifier.verify(altered, sig));
    }

    @Test
    void rejectsWrongSecret() throws Exception {
        var sig = new SignatureVerifier("othersecret").sign(BODY);
        assertFalse(new SignatureVerifier("testsecret").verify(BODY, sig));
    }

    @Test
    void rejectsMissingOrEmptySignature() {
        var verifier = new SignatureVerifier("testsecret");
        assertFalse(verifier.verify(BODY, null));
        assertFalse(verifier.verify(BODY, ""));
    }

    @Test
    void rejectsUppercaseHex() throws Exception {
        var verifier = new SignatureVerifier("testsecret");
        assertFalse(verifier.verify(BODY, verifier.sign(BODY).toUpperCase()));
    }

    @Test
    void unsetSecretNeverVerifies() {
        var verifier = new SignatureVerifier("");
        assertFalse(verifier.verify(BODY, "00"));
        assertFalse(new SignatureVerifier(null).verify(BODY, "00"));
    }
}
