package com.openclaw.webui.app.websocket;

import com.openclaw.webui.common.infra.EventLoop;
import com.openclaw.webui.gateway.relay.Relay;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

import java.util.Map;

/**
 * Registers the browser WebSocket endpoint at /ws.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    static final String ATTR_FORWARDED_FOR = "webui.forwardedFor";

    /** Five 10 MB attachments, base64 encoded, plus the JSON envelope. */
    private static final int MAX_TEXT_MESSAGE_BYTES = 80 * 1024 * 1024;

    private final Relay relay;
    private final EventLoop relayEventLoop;

    public WebSocketConfig(Relay relay, EventLoop relayEventLoop) {
        this.relay = relay;
        this.relayEventLoop = relayEventLoop;
    }

    @Override
    public void registerWebSocketHandlers(@NonNull WebSocketHandlerRegistry registry) {
        registry.addHandler(relayWebSocketHandler(), "/ws")
                .addInterceptors(forwardedForInterceptor())
                .setAllowedOrigins("*");
    }

    @Bean
    public RelayWebSocketHandler relayWebSocketHandler() {
        return new RelayWebSocketHandler(relay, relayEventLoop);
    }

    /**
     * Captures X-Forwarded-For so connection logs show the browser behind a proxy.
     */
    @Bean
    public HandshakeInterceptor forwardedForInterceptor() {
        return new HandshakeInterceptor() {
            @Override
            public boolean beforeHandshake(@NonNull ServerHttpRequest request,
                    @NonNull ServerHttpResponse response,
                    @NonNull WebSocketHandler wsHandler,
                    @NonNull Map<String, Object> attributes) {
                String forwardedFor = request.getHeaders().getFirst("X-Forwarded-For");
                if (forwardedFor != null) {
                    attributes.put(ATTR_FORWARDED_FOR, forwardedFor.split(",")[0].trim());
                }
                return true;
            }

            @Override
            public void afterHandshake(@NonNull ServerHttpRequest request,
                    @NonNull ServerHttpResponse response,
                    @NonNull WebSocketHandler wsHandler,
                    @Nullable Exception exception) {
                // no-op
            }
        };
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(MAX_TEXT_MESSAGE_BYTES);
        container.setMaxBinaryMessageBufferSize(512 * 1024);
        container.setMaxSessionIdleTimeout(0L); // browsers may idle between turns
        return container;
    }
}
