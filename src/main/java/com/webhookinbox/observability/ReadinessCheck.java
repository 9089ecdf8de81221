package com.webhookinbox.observability;

import com.webhookinbox.shared.config.InboxConfig;
import com.webhookinbox.storage.MessageStore;

import java.util.Optional;

public class ReadinessCheck {

    private final InboxConfig config;
    private final MessageStore store;

    public ReadinessCheck(InboxConfig config, MessageStore store) {
        this.config = config;
        this.store = store;
    }

    /** Returns the reason the service cannot take traffic, or empty when ready. */
    public Optional<String> notReadyReason() {
        if (!config.hasSecret()) {
            return Optional.of("WEBHOOK_SECRET not set");
        }
        if (!store.isReady()) {
            return Optional.of("database not ready");
        }
        return Optional.empty();
    }
}
