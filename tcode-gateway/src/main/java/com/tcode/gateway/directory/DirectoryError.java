package com.tcode.gateway.directory;

/**
 * A codespace directory call failed: the listing was rejected, the codespace
 * does not exist, or it is not in a connectable state.
 */
public class DirectoryError extends RuntimeException {

    private final int status;
    private final boolean retryable;
    private final String codespaceState;

    public DirectoryError(String message, int status, boolean retryable, String codespaceState, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.retryable = retryable;
        this.codespaceState = codespaceState;
    }

    public DirectoryError(String message, int status) {
        this(message, status, false, null, null);
    }

    public DirectoryError(String message, Throwable cause) {
        this(message, 0, false, null, cause);
    }

    public static DirectoryError notAvailable(String codespaceState) {
        if ("Starting".equals(codespaceState) || "Provisioning".equals(codespaceState)) {
            return new DirectoryError("Codespace is " + codespaceState
                    + ". This is normal during initialization - please retry in 30-60 seconds.",
                    0, true, codespaceState, null);
        }
        return new DirectoryError("Codespace is not available. Current state: " + codespaceState
                + ". Please start the codespace first.", 0, false, codespaceState, null);
    }

    /** HTTP status of the failed call, or 0 when the failure was not an HTTP error. */
    public int getStatus() {
        return status;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /** State reported for the codespace, when the failure was about its state. */
    public String getCodespaceState() {
        return codespaceState;
    }
}
