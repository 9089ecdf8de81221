package com.webhookinbox.shared.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonPropertyOrder({"data", "total", "limit", "offset"})
public record MessagesResponse(
    List<Message> data,
    long total,
    int limit,
    int offset
) {}
