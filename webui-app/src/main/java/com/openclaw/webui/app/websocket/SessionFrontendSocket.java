package com.openclaw.webui.app.websocket;

import com.openclaw.webui.gateway.relay.FrontendSocket;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.net.InetSocketAddress;

/**
 * {@link FrontendSocket} over a Spring WebSocket session. Writes go through a
 * {@link ConcurrentWebSocketSessionDecorator} so a slow browser cannot stall
 * the relay loop; a browser that falls too far behind is disconnected.
 */
class SessionFrontendSocket implements FrontendSocket {

    static final int SEND_TIME_LIMIT_MS = 10_000;
    static final int BUFFER_SIZE_LIMIT = 16 * 1024 * 1024;

    private final WebSocketSession session;
    private final WebSocketSession decorated;

    SessionFrontendSocket(WebSocketSession session) {
        this.session = session;
        this.decorated = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(String text) throws IOException {
        decorated.sendMessage(new TextMessage(text));
    }

    @Override
    public String remoteAddress() {
        Object forwarded = session.getAttributes().get(WebSocketConfig.ATTR_FORWARDED_FOR);
        if (forwarded instanceof String s && !s.isBlank()) {
            return s;
        }
        InetSocketAddress remote = session.getRemoteAddress();
        return remote != null ? remote.getHostString() : null;
    }
}
