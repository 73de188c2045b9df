package com.tcode.gateway.directory;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Lists and controls the codespaces visible to one access token.
 * Failures complete the returned futures with {@link DirectoryError}.
 */
public interface CodespaceDirectory {

    CompletableFuture<List<Codespace>> listCodespaces();

    /**
     * Resolve tunnel coordinates. Fails if the codespace is not {@code Available}.
     */
    CompletableFuture<CodespaceConnectionInfo> getConnectionInfo(String codespaceName);

    CompletableFuture<Codespace> startCodespace(String codespaceName);

    CompletableFuture<Codespace> stopCodespace(String codespaceName);
}
