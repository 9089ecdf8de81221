package com.webhookinbox.storage;

import com.webhookinbox.shared.model.Message;

import java.util.List;

/** One page of messages plus the size of the whole filtered set. */
public record MessageSlice(List<Message> messages, long total) {}
