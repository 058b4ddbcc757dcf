package io.syncmesh.processor;

import io.syncmesh.model.SyncOperation;
import io.syncmesh.model.SyncType;

public interface SyncHandler {
    SyncType type();

    void handle(SyncOperation operation) throws Exception;
}
