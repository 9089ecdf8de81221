package com.webhookinbox.storage;

public enum InsertResult {
    CREATED,
    DUPLICATE;

    /** Outcome label used in logs and metrics. */
    public String label() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
