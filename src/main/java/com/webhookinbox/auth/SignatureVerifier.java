package com.webhookinbox.auth;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * Checks the {@code X-Signature} header: lowercase hex HMAC-SHA256 of the raw request body,
 * keyed with the shared webhook secret.
 */
public class SignatureVerifier {

    private static final String ALGORITHM = "HmacSHA256";

    private final byte[] secret;

    public SignatureVerifier(String secret) {
        this.secret = secret == null ? new byte[0] : secret.getBytes(StandardCharsets.UTF_8);
    }

    /** Never throws. A missing or empty signature, or an unset secret, never verifies. */
    public boolean verify(byte[] body, String signature) {
        if (signature == null || signature.isEmpty() || secret.length == 0) {
            return false;
        }
        try {
            var expected = sign(body == null ? new byte[0] : body);
            return MessageDigest.isEqual(
                    expected.getBytes(StandardCharsets.US_ASCII),
                    signature.getBytes(StandardCharsets.US_ASCII));
        } catch (GeneralSecurityException e) {
            return false;
        }
    }

    public String sign(byte[] body) throws GeneralSecurityException {
        var mac = Mac.getInstance(ALGORITHM);
        mac.init(new SecretKeySpec(secret, ALGORITHM));
        return HexFormat.of().formatHex(mac.doFinal(body));
    }
}
