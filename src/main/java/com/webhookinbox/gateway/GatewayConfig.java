package com.webhookinbox.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.webhookinbox.auth.SignatureVerifier;
import com.webhookinbox.gateway.http.RequestContextFilter;
import com.webhookinbox.ingest.DefaultIngestionOrchestrator;
import com.webhookinbox.ingest.IngestionOrchestrator;
import com.webhookinbox.ingest.PayloadValidator;
import com.webhookinbox.observability.InboxMetrics;
import com.webhookinbox.observability.ReadinessCheck;
import com.webhookinbox.query.QueryService;
import com.webhookinbox.shared.config.ConfigLoader;
import com.webhookinbox.shared.config.InboxConfig;
import com.webhookinbox.storage.MessageStore;
import com.webhookinbox.storage.SqliteMessageStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;

import java.time.Clock;
import java.util.Locale;

/**
 * Process-wide singletons, built once at startup and passed to their users by constructor.
 * Startup fails when the secret is missing or the schema cannot be created.
 */
@Configuration
public class GatewayConfig {

    private static final Logger log = LoggerFactory.getLogger(GatewayConfig.class);

    @Bean
    public InboxConfig inboxConfig(LoggingSystem loggingSystem) {
        return applyConfig(ConfigLoader.load(), loggingSystem);
    }

    static InboxConfig applyConfig(InboxConfig config, LoggingSystem loggingSystem) {
        loggingSystem.setLogLevel(LoggingSystem.ROOT_LOGGER_NAME, parseLevel(config.logLevel()));
        config.validate().ifPresent(error -> {
            log.error(error);
            throw new IllegalStateException(error);
        });
        return config;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MessageStore messageStore(InboxConfig config, Clock clock) {
        var store = SqliteMessageStore.fromUrl(config.databaseUrl(), clock);
        store.initSchema();
        return store;
    }

    @Bean
    public InboxMetrics inboxMetrics() {
        return new InboxMetrics();
    }

    @Bean
    public SignatureVerifier signatureVerifier(InboxConfig config) {
        return new SignatureVerifier(config.webhookSecret());
    }

    @Bean
    public PayloadValidator payloadValidator(ObjectMapper objectMapper) {
        return new PayloadValidator(objectMapper);
    }

    @Bean
    public IngestionOrchestrator ingestionOrchestrator(SignatureVerifier verifier, PayloadValidator validator,
                                                       MessageStore store, InboxMetrics metrics) {
        return new DefaultIngestionOrchestrator(verifier, validator, store, metrics);
    }

    @Bean
    public QueryService queryService(MessageStore store) {
        return new QueryService(store);
    }

    @Bean
    public ReadinessCheck readinessCheck(InboxConfig config, MessageStore store) {
        return new ReadinessCheck(config, store);
    }

    @Bean
    public RequestContextFilter requestContextFilter(InboxMetrics metrics) {
        return new RequestContextFilter(metrics);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        log.info("Application started");
    }

    @EventListener(ContextClosedEvent.class)
    public void onClose() {
        log.info("Application shutting down");
    }

    static LogLevel parseLevel(String level) {
        var name = level == null ? "" : level.trim().toUpperCase(Locale.ROOT);
        switch (name) {
            case "WARNING":
                return LogLevel.WARN;
            case "CRITICAL":
                return LogLevel.FATAL;
            default:
                try {
                    return LogLevel.valueOf(name);
                } catch (IllegalArgumentException e) {
                    log.warn("Unknown LOG_LEVEL '{}', using INFO", level);
                    return LogLevel.INFO;
                }
        }
    }
}
