package io.syncmesh.deadletter;

import io.syncmesh.model.SyncOperation;

import java.time.Instant;

public record DeadLetterEntry(String key, SyncOperation operation, Instant deadLetteredAt) {
}
