package com.ringai.config;

import com.ringai.trigger.websocket.GatewayConnectionHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * 网关设备 WebSocket 端点注册。
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final GatewayConnectionHandler gatewayConnectionHandler;
    private final BridgeProperties properties;

    public WebSocketConfig(GatewayConnectionHandler gatewayConnectionHandler, BridgeProperties properties) {
        this.gatewayConnectionHandler = gatewayConnectionHandler;
        this.properties = properties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        BridgeProperties.Gateway gateway = properties.getGateway();
        registry.addHandler(gatewayConnectionHandler, gateway.getPath())
                .setAllowedOriginPatterns(gateway.getAllowedOrigins().toArray(new String[0]));
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        BridgeProperties.Gateway gateway = properties.getGateway();
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxBinaryMessageBufferSize(gateway.getMaxBinaryMessageBytes());
        container.setMaxTextMessageBufferSize(gateway.getMaxTextMessageBytes());
        return container;
    }
}
