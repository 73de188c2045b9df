package com.tcode.gateway.session;

import com.tcode.common.config.TcodeConfig;

import java.time.Duration;

/**
 * Configuration captured when a session is created.
 */
public record SessionSettings(
        Duration gracePeriod,
        int traceMaxHistory,
        boolean traceDebug,
        String term,
        int cols,
        int rows,
        String sshHost,
        int sshConnectTimeoutMs) {

    public static SessionSettings from(TcodeConfig config) {
        TcodeConfig.TerminalConfig terminal = config.getTerminal();
        TcodeConfig.SshConfig ssh = config.getSsh();
        return new SessionSettings(
                Duration.ofMillis(config.getSession().getGracePeriodMs()),
                config.getTrace().getMaxHistory(),
                config.getTrace().isDebug(),
                terminal.getTerm(),
                terminal.getCols(),
                terminal.getRows(),
                ssh.getHost(),
                ssh.getConnectTimeoutMs());
    }

    public static SessionSettings defaults() {
        TcodeConfig config = new TcodeConfig();
        config.setTerminal(new TcodeConfig.TerminalConfig());
        config.setSsh(new TcodeConfig.SshConfig());
        config.setSession(new TcodeConfig.SessionConfig());
        config.setTrace(new TcodeConfig.TraceConfig());
        return from(config);
    }

    public SessionSettings withGracePeriod(Duration period) {
        return new SessionSettings(period, traceMaxHistory, traceDebug, term, cols, rows, sshHost, sshConnectTimeoutMs);
    }
}
