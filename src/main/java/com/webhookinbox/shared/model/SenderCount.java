package com.webhookinbox.shared.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"from", "count"})
public record SenderCount(
    @JsonProperty("from") String from,
    @JsonProperty("count") long count
) {}
