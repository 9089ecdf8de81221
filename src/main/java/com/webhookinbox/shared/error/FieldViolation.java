package com.webhookinbox.shared.error;

public record FieldViolation(String field, String message) {}
