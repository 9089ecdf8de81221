package com.webhookinbox.storage;

import com.webhookinbox.shared.model.Message;
import com.webhookinbox.shared.model.MessageStats;

public interface MessageStore {
    void initSchema();
    InsertResult insert(Message message);
    MessageSlice query(int limit, int offset, MessageFilter filter);
    MessageStats stats();
    boolean isReady();
}
