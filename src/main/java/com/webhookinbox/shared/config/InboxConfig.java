package com.webhookinbox.shared.config;

import java.util.Optional;

public record InboxConfig(
    String webhookSecret,
    String databaseUrl,
    String logLevel
) {
    public static final String DEFAULT_DATABASE_URL = "sqlite:////data/app.db";
    public static final String DEFAULT_LOG_LEVEL = "INFO";

    public boolean hasSecret() {
        return webhookSecret != null && !webhookSecret.isBlank();
    }

    /** Returns the startup error, if any. */
    public Optional<String> validate() {
        if (!hasSecret()) {
            return Optional.of("WEBHOOK_SECRET environment variable is required");
        }
        return Optional.empty();
    }
}
