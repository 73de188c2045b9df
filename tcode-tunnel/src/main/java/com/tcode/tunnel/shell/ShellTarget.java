package com.tcode.tunnel.shell;

/**
 * Where and as whom to open a remote shell.
 */
public record ShellTarget(
        String host,
        int port,
        String user,
        String privateKey,
        String term,
        int cols,
        int rows,
        int connectTimeoutMs) {

    @Override
    public String toString() {
        return "ShellTarget[" + user + "@" + host + ":" + port + ", term=" + term
                + ", " + cols + "x" + rows + "]";
    }
}
