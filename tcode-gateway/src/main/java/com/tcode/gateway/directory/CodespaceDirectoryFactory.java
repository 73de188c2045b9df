package com.tcode.gateway.directory;

/**
 * Builds a directory client bound to a user's access token.
 */
@FunctionalInterface
public interface CodespaceDirectoryFactory {

    CodespaceDirectory create(String accessToken);
}
