package com.webhookinbox.shared.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/** Aggregate view over all stored messages. Timestamps are null when the store is empty. */
@JsonPropertyOrder({"total_messages", "senders_count", "messages_per_sender",
        "first_message_ts", "last_message_ts"})
public record MessageStats(
    @JsonProperty("total_messages") long totalMessages,
    @JsonProperty("senders_count") long sendersCount,
    @JsonProperty("messages_per_sender") List<SenderCount> messagesPerSender,
    @JsonProperty("first_message_ts") String firstMessageTs,
    @JsonProperty("last_message_ts") String lastMessageTs
) {
    public static MessageStats empty() {
        return new MessageStats(0, 0, List.of(), null, null);
    }
}
