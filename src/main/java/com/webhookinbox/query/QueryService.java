package com.webhookinbox.query;

import com.webhookinbox.shared.error.FieldViolation;
import com.webhookinbox.shared.error.ValidationException;
import com.webhookinbox.shared.model.MessageStats;
import com.webhookinbox.shared.model.MessagesResponse;
import com.webhookinbox.storage.MessageFilter;
import com.webhookinbox.storage.MessageStore;

import java.util.ArrayList;

public class QueryService {

    public static final int MAX_LIMIT = 100;

    private final MessageStore store;

    public QueryService(MessageStore store) {
        this.store = store;
    }

    /** Out-of-range {@code limit} or {@code offset} is rejected, never clamped. */
    public MessagesResponse messages(int limit, int offset, String from, String since, String q) {
        var violations = new ArrayList<FieldViolation>();
        if (limit < 1 || limit > MAX_LIMIT) {
            violations.add(new FieldViolation("limit", "must be between 1 and " + MAX_LIMIT));
        }
        if (offset < 0) {
            violations.add(new FieldViolation("offset", "must be greater than or equal to 0"));
        }
        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }

        var slice = store.query(limit, offset, new MessageFilter(from, since, q));
        return new MessagesResponse(slice.messages(), slice.total(), limit, offset);
    }

    public MessageStats stats() {
        return store.stats();
    }
}
