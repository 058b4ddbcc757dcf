package io.syncmesh.remote;

import io.syncmesh.model.SessionContext;

import java.util.Optional;

public interface RemoteAuthorityClient {

    Optional<SessionContext> fetch(String sessionId) throws RemoteAuthorityException;

    void push(SessionContext session) throws RemoteAuthorityException;
}
