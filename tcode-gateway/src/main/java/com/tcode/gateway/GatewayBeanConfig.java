package com.tcode.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tcode.common.config.ConfigService;
import com.tcode.common.config.TcodeConfig;
import com.tcode.common.logging.SubsystemLogger;
import com.tcode.gateway.directory.CodespaceDirectoryFactory;
import com.tcode.gateway.directory.GitHubCodespaceDirectory;
import com.tcode.gateway.session.SessionRegistry;
import com.tcode.gateway.transport.UnconfiguredRelayTransport;
import com.tcode.gateway.websocket.ProtocolRouter;
import com.tcode.tunnel.shell.JschShellChannelFactory;
import com.tcode.tunnel.shell.ShellChannelFactory;
import com.tcode.tunnel.transport.RelayTransport;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring configuration for gateway beans.
 */
@Configuration
public class GatewayBeanConfig {

    @Value("${tcode.config.path:~/.tcode/config.json}")
    private String configPath;

    @Bean
    public ConfigService configService() {
        String resolvedPath = configPath;
        if (resolvedPath.startsWith("~")) {
            resolvedPath = System.getProperty("user.home") + resolvedPath.substring(1);
        }
        return new ConfigService(Path.of(resolvedPath));
    }

    /** Grace-window timers for RPC facilities. */
    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService tcodeScheduler() {
        return Executors.newSingleThreadScheduledExecutor(daemonThreads("tcode-grace"));
    }

    /** Blocking work: GitHub calls and SSH connects. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService tcodeIoExecutor() {
        return Executors.newCachedThreadPool(daemonThreads("tcode-io"));
    }

    @Bean
    public OkHttpClient gitHubHttpClient(ConfigService configService) {
        int timeout = configService.loadConfig().getGithub().getTimeoutSeconds();
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .readTimeout(Duration.ofSeconds(timeout))
                .build();
    }

    @Bean
    public CodespaceDirectoryFactory codespaceDirectoryFactory(ConfigService configService,
            OkHttpClient gitHubHttpClient, ObjectMapper objectMapper,
            @Qualifier("tcodeIoExecutor") ExecutorService tcodeIoExecutor) {
        SubsystemLogger log = SubsystemLogger.create("gateway/directory");
        return token -> {
            TcodeConfig.GitHubConfig github = configService.loadConfig().getGithub();
            return new GitHubCodespaceDirectory(token, github, gitHubHttpClient, objectMapper, tcodeIoExecutor, log);
        };
    }

    @Bean
    @ConditionalOnMissingBean(RelayTransport.class)
    public RelayTransport relayTransport() {
        return new UnconfiguredRelayTransport();
    }

    @Bean
    public ShellChannelFactory shellChannelFactory(@Qualifier("tcodeIoExecutor") ExecutorService tcodeIoExecutor) {
        return new JschShellChannelFactory(tcodeIoExecutor, SubsystemLogger.create("tunnel/shell"));
    }

    @Bean
    public SessionRegistry sessionRegistry(CodespaceDirectoryFactory codespaceDirectoryFactory,
            RelayTransport relayTransport, ShellChannelFactory shellChannelFactory,
            @Qualifier("tcodeScheduler") ScheduledExecutorService tcodeScheduler,
            ConfigService configService) {
        return new SessionRegistry(codespaceDirectoryFactory, relayTransport, shellChannelFactory,
                tcodeScheduler, configService, SubsystemLogger.create("gateway"));
    }

    @Bean
    public ProtocolRouter protocolRouter(ObjectMapper objectMapper) {
        return new ProtocolRouter(objectMapper, SubsystemLogger.create("gateway/router"));
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
