package io.syncmesh.webhook;

import java.util.Optional;

@FunctionalInterface
public interface IdentityResolver {
    Optional<String> resolve(String resourceId);
}
