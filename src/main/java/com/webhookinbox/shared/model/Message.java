package com.webhookinbox.shared.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A stored message. {@code text} is null when the sender omitted it, which is distinct from
 * an empty body.
 */
@JsonPropertyOrder({"message_id", "from", "to", "ts", "text"})
public record Message(
    @JsonProperty("message_id") String messageId,
    @JsonProperty("from") String from,
    @JsonProperty("to") String to,
    @JsonProperty("ts") String ts,
    @JsonProperty("text") String text
) {}
