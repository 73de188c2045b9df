package com.tcode.gateway.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tcode.common.config.ConfigService;
import com.tcode.common.config.TcodeConfig;
import com.tcode.gateway.session.SessionRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * WebSocket configuration for the terminal bridge.
 * Registers the endpoint at the configured path ({@code /ws} by default).
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final ObjectMapper objectMapper;
    private final ProtocolRouter protocolRouter;
    private final SessionRegistry sessionRegistry;
    private final ConfigService configService;

    public WebSocketConfig(ObjectMapper objectMapper, ProtocolRouter protocolRouter,
            SessionRegistry sessionRegistry, ConfigService configService) {
        this.objectMapper = objectMapper;
        this.protocolRouter = protocolRouter;
        this.sessionRegistry = sessionRegistry;
        this.configService = configService;
    }

    @Override
    public void registerWebSocketHandlers(@NonNull WebSocketHandlerRegistry registry) {
        TcodeConfig.GatewayConfig gateway = configService.loadConfig().getGateway();
        registry.addHandler(codespaceWebSocketHandler(), gateway.getPath())
                .setAllowedOrigins(gateway.getAllowedOrigins().toArray(new String[0]));
    }

    @Bean
    public CodespaceWebSocketHandler codespaceWebSocketHandler() {
        int bufferLimit = configService.loadConfig().getGateway().getMaxTextMessageBytes();
        return new CodespaceWebSocketHandler(objectMapper, protocolRouter, sessionRegistry, bufferLimit);
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        TcodeConfig.GatewayConfig gateway = configService.loadConfig().getGateway();
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(gateway.getMaxTextMessageBytes());
        container.setMaxBinaryMessageBufferSize(gateway.getMaxTextMessageBytes());
        container.setMaxSessionIdleTimeout(gateway.getIdleTimeoutMs());
        return container;
    }
}
