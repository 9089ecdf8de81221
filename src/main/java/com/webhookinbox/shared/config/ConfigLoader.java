package com.webhookinbox.shared.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

public class ConfigLoader {

    private static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".webhook-inbox", "config.yaml"
    );

    public static InboxConfig load() {
        var override = System.getenv("WEBHOOK_INBOX_CONFIG");
        var path = override != null && !override.isBlank() ? Path.of(override) : DEFAULT_PATH;
        return load(path, System.getenv());
    }

    static InboxConfig load(Path path, Map<String, String> env) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException e) {
                throw new RuntimeException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        var webhook = section(raw, "webhook");
        var db = section(raw, "database");
        var logging = section(raw, "logging");

        return new InboxConfig(
            envOrDefault(env, "WEBHOOK_SECRET", value(webhook, "secret", "")),
            envOrDefault(env, "DATABASE_URL", value(db, "url", InboxConfig.DEFAULT_DATABASE_URL)),
            envOrDefault(env, "LOG_LEVEL", value(logging, "level", InboxConfig.DEFAULT_LOG_LEVEL))
        );
    }

    // an empty YAML section or key loads as null
    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> raw, String name) {
        var section = raw.get(name);
        return section instanceof Map ? (Map<String, Object>) section : Map.of();
    }

    private static String value(Map<String, Object> section, String key, String fallback) {
        var val = section.get(key);
        return val != null ? val.toString() : fallback;
    }

    private static String envOrDefault(Map<String, String> env, String key, String fallback) {
        var val = env.get(key);
        return val != null ? val : fallback;
    }
}
