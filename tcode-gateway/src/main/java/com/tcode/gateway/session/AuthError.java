package com.tcode.gateway.session;

/**
 * An operation needs an authenticated session, or the session is already
 * bound to another token.
 */
public class AuthError extends RuntimeException {

    public static final String NOT_AUTHENTICATED = "Not authenticated. Please send an authenticate message first.";

    public AuthError(String message) {
        super(message);
    }

    public static AuthError notAuthenticated() {
        return new AuthError(NOT_AUTHENTICATED);
    }
}
