package com.webhookinbox.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.webhookinbox.shared.error.FieldViolation;
import com.webhookinbox.shared.error.ValidationException;
import com.webhookinbox.shared.model.Message;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Turns a raw webhook body into a {@link Message}. Every field rule is checked so the error
 * lists all violations, not only the first.
 */
public class PayloadValidator {

    public static final int MAX_TEXT_LENGTH = 4096;

    private static final Pattern E164 = Pattern.compile("\\+[0-9]+");
    private static final Pattern UTC_TIMESTAMP =
            Pattern.compile("[0-9]{4}-[0-9]{2}-[0-9]{2}T[0-9]{2}:[0-9]{2}:[0-9]{2}Z");

    private static final List<FieldRule> RULES = List.of(
            FieldRule.required("message_id", v -> !v.isEmpty(), "must not be empty"),
            FieldRule.required("from", matches(E164), "must be E.164 format: + followed by digits"),
            FieldRule.required("to", matches(E164), "must be E.164 format: + followed by digits"),
            FieldRule.required("ts", matches(UTC_TIMESTAMP),
                    "must be ISO-8601 UTC format: YYYY-MM-DDTHH:MM:SSZ"),
            FieldRule.optional("text", v -> v.codePointCount(0, v.length()) <= MAX_TEXT_LENGTH,
                    "must be at most " + MAX_TEXT_LENGTH + " characters")
    );

    private final ObjectReader reader;

    public PayloadValidator(ObjectMapper mapper) {
        this.reader = mapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public Message validate(byte[] body) {
        JsonNode root;
        try {
            root = reader.readTree(body == null ? new byte[0] : body);
        } catch (JsonProcessingException e) {
            throw ValidationException.of("body", "invalid JSON: " + e.getOriginalMessage());
        } catch (IOException e) {
            throw ValidationException.of("body", "unreadable body");
        }
        if (root == null || !root.isObject()) {
            throw ValidationException.of("body", "must be a JSON object");
        }

        var violations = new ArrayList<FieldViolation>();
        var values = new String[RULES.size()];
        for (int i = 0; i < RULES.size(); i++) {
            values[i] = RULES.get(i).check(root, violations);
        }
        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }
        return new Message(values[0], values[1], values[2], values[3], values[4]);
    }

    private static Predicate<String> matches(Pattern pattern) {
        return v -> pattern.matcher(v).matches();
    }

    record FieldRule(String name, boolean required, Predicate<String> format, String formatMessage) {

        static FieldRule required(String name, Predicate<String> format, String message) {
            return new FieldRule(name, true, format, message);
        }

        static FieldRule optional(String name, Predicate<String> format, String message) {
            return new FieldRule(name, false, format, message);
        }

        /** Returns the field's value, or null when absent or invalid. */
        String check(JsonNode root, List<FieldViolation> violations) {
            var node = root.get(name);
            if (node == null || node.isNull()) {
                if (required) violations.add(new FieldViolation(name, "field required"));
                return null;
            }
            if (!node.isTextual()) {
                violations.add(new FieldViolation(name, "must be a string"));
                return null;
            }
            var value = node.textValue();
            if (!format.test(value)) {
                violations.add(new FieldViolation(name, formatMessage));
                return null;
            }
            return value;
        }
    }
}
