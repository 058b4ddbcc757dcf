package io.syncmesh.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Objects;

public record SyncOperation(
        @JsonProperty("operation_id") String operationId,
        @JsonProperty("source_event_id") String sourceEventId,
        @JsonProperty("sync_type") SyncType syncType,
        @JsonProperty("target_resource_id") String targetResourceId,
        @JsonProperty("associated_identity") String associatedIdentity,
        @JsonProperty("payload") JsonNode payload,
        @JsonProperty("retry_count") int retryCount,
        @JsonProperty("status") OperationStatus status,
        @JsonProperty("error_detail") String errorDetail,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt
) {
    public SyncOperation {
        Objects.requireNonNull(operationId, "operationId");
        Objects.requireNonNull(syncType, "syncType");
        status = status == null ? OperationStatus.PENDING : status;
    }

    public static SyncOperation pending(String operationId, String sourceEventId, SyncType syncType,
                                        String targetResourceId, String associatedIdentity,
                                        JsonNode payload, Instant now) {
        return new SyncOperation(operationId, sourceEventId, syncType, targetResourceId, associatedIdentity,
                payload, 0, OperationStatus.PENDING, null, now, now);
    }

    public SyncOperation withStatus(OperationStatus next, Instant now) {
        return new SyncOperation(operationId, sourceEventId, syncType, targetResourceId, associatedIdentity,
                payload, retryCount, next, errorDetail, createdAt, now);
    }

    public SyncOperation failedAttempt(String error, Instant now) {
        return new SyncOperation(operationId, sourceEventId, syncType, targetResourceId, associatedIdentity,
                payload, retryCount + 1, status, error, createdAt, now);
    }

    public SyncOperation withErrorDetail(String error) {
        return new SyncOperation(operationId, sourceEventId, syncType, targetResourceId, associatedIdentity,
                payload, retryCount, status, error, createdAt, updatedAt);
    }

    public SyncOperation replayed(Instant now) {
        return new SyncOperation(operationId, sourceEventId, syncType, targetResourceId, associatedIdentity,
                payload, 0, OperationStatus.PENDING, errorDetail, createdAt, now);
    }
}
