package com.tcode.tunnel.shell;

/**
 * Receives output from a remote shell.
 */
public interface ShellListener {

    /** Output from the shell's stdout or stderr. */
    void onData(String data);

    /** The remote side closed the shell. Not called for a local {@link ShellChannel#close()}. */
    void onClosed();
}
