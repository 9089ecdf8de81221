package com.webhookinbox.ingest;

import com.webhookinbox.shared.model.RequestContext;
import com.webhookinbox.storage.InsertResult;

public interface IngestionOrchestrator {
    InsertResult ingest(RequestContext ctx, byte[] body, String signature);
}
