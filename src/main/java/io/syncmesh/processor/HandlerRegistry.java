package io.syncmesh.processor;

import io.syncmesh.model.SyncType;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

public final class HandlerRegistry {
    private final Map<SyncType, SyncHandler> handlers = new EnumMap<>(SyncType.class);

    public static HandlerRegistry defaults(ExternalSource source, CanonicalStore store) {
        return new HandlerRegistry()
                .register(new SchemaUpdateHandler(source, store))
                .register(new ContentUpdateHandler(source, store))
                .register(new StructureChangeHandler(source, store));
    }

    public HandlerRegistry register(SyncHandler handler) {
        handlers.put(handler.type(), handler);
        return this;
    }

    public Optional<SyncHandler> find(SyncType type) {
        return Optional.ofNullable(handlers.get(type));
    }
}
