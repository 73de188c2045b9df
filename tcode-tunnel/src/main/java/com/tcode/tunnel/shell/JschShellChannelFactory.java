package com.tcode.tunnel.shell;

import com.jcraft.jsch.ChannelShell;
import com.jcraft.jsch.JSch;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import com.tcode.common.logging.SubsystemLogger;
import com.tcode.tunnel.BridgeError;
import com.tcode.tunnel.ChannelFault;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Opens shells over SSH with JSch. The codespace's SSH server is reached
 * through the local port the relay tunnel exposes, authenticating with the
 * ephemeral key issued by the RPC facility.
 * <p>
 * JSch is blocking; connects run on the supplied executor and each shell gets
 * a reader thread pumping output to its listener.
 */
public class JschShellChannelFactory implements ShellChannelFactory {

    private static final int READ_BUFFER = 8192;

    private final ExecutorService executor;
    private final SubsystemLogger log;

    public JschShellChannelFactory(ExecutorService executor, SubsystemLogger log) {
        this.executor = executor;
        this.log = log;
    }

    @Override
    public CompletableFuture<ShellChannel> open(ShellTarget target, ShellListener listener) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return connect(target, listener);
            } catch (JSchException | IOException e) {
                throw new CompletionException(new BridgeError("SSH connection failed: " + e.getMessage(), e));
            }
        }, executor);
    }

    private ShellChannel connect(ShellTarget target, ShellListener listener)
            throws JSchException, IOException {
        log.info("Opening SSH shell", Map.of("target", target.toString()));
        JSch jsch = new JSch();
        jsch.addIdentity("codespace-" + target.user(),
                target.privateKey().getBytes(StandardCharsets.UTF_8), null, null);

        Session session = jsch.getSession(target.user(), target.host(), target.port());
        // host key is the tunnel's loopback endpoint, not a stable identity
        session.setConfig("StrictHostKeyChecking", "no");
        session.connect(target.connectTimeoutMs());

        ChannelShell channel;
        try {
            channel = (ChannelShell) session.openChannel("shell");
            channel.setPtyType(target.term(), target.cols(), target.rows(), 0, 0);
            channel.setPty(true);
            InputStream stdout = channel.getInputStream();
            InputStream stderr = channel.getExtInputStream();
            OutputStream stdin = channel.getOutputStream();
            channel.connect(target.connectTimeoutMs());

            JschShellChannel shell = new JschShellChannel(session, channel, stdin, listener);
            shell.startReader(stdout, "stdout", true);
            shell.startReader(stderr, "stderr", false);
            log.info("SSH shell established", Map.of("host", target.host(), "port", target.port()));
            return shell;
        } catch (JSchException | IOException e) {
            session.disconnect();
            throw e;
        }
    }

    /**
     * Forward {@code in} to {@code listener} as UTF-8 text until end of stream.
     * The decoder keeps a multi-byte sequence split across reads together.
     */
    static void drain(InputStream in, ShellListener listener) throws IOException {
        Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8);
        char[] buffer = new char[READ_BUFFER];
        int read;
        while ((read = reader.read(buffer)) != -1) {
            if (read > 0) {
                listener.onData(new String(buffer, 0, read));
            }
        }
    }

    private final class JschShellChannel implements ShellChannel {

        private final Session session;
        private final ChannelShell channel;
        private final OutputStream stdin;
        private final ShellListener listener;
        private final AtomicBoolean closedLocally = new AtomicBoolean(false);
        private final AtomicBoolean closeReported = new AtomicBoolean(false);

        JschShellChannel(Session session, ChannelShell channel, OutputStream stdin, ShellListener listener) {
            this.session = session;
            this.channel = channel;
            this.stdin = stdin;
            this.listener = listener;
        }

        void startReader(InputStream in, String name, boolean reportsClose) {
            Thread reader = new Thread(() -> pump(in, reportsClose), "ssh-" + name + "-" + session.getHost() + ":" + session.getPort());
            reader.setDaemon(true);
            reader.start();
        }

        private void pump(InputStream in, boolean reportsClose) {
            try {
                drain(in, listener);
            } catch (IOException e) {
                if (!closedLocally.get()) {
                    log.debug("SSH stream ended: " + e.getMessage());
                }
            }
            if (reportsClose && !closedLocally.get() && closeReported.compareAndSet(false, true)) {
                log.info("SSH shell closed by remote");
                listener.onClosed();
            }
        }

        @Override
        public void write(String data) {
            if (!isOpen()) {
                return;
            }
            try {
                stdin.write(data.getBytes(StandardCharsets.UTF_8));
                stdin.flush();
            } catch (IOException e) {
                throw new ChannelFault("shell", "write failed: " + e.getMessage(), e);
            }
        }

        @Override
        public void resize(int cols, int rows) {
            if (isOpen()) {
                channel.setPtySize(cols, rows, 0, 0);
            }
        }

        @Override
        public boolean isOpen() {
            return !closedLocally.get() && channel.isConnected() && !channel.isClosed();
        }

        @Override
        public CompletableFuture<Void> close() {
            if (!closedLocally.compareAndSet(false, true)) {
                return CompletableFuture.completedFuture(null);
            }
            return CompletableFuture.runAsync(() -> {
                channel.disconnect();
                session.disconnect();
            }, executor);
        }
    }
}
