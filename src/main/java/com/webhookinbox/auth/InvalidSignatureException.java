package com.webhookinbox.auth;

public class InvalidSignatureException extends RuntimeException {

    public InvalidSignatureException() {
        super("invalid signature");
    }
}
