package com.openclaw.webui.app.websocket;

import com.openclaw.webui.common.infra.EventLoop;
import com.openclaw.webui.gateway.relay.Relay;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Browser WebSocket endpoint. Container callbacks are handed to the relay loop
 * in arrival order; no relay state is touched on container threads.
 */
@Slf4j
public class RelayWebSocketHandler extends TextWebSocketHandler {

    private final Relay relay;
    private final EventLoop loop;

    public RelayWebSocketHandler(Relay relay, EventLoop loop) {
        this.relay = relay;
        this.loop = loop;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        SessionFrontendSocket socket = new SessionFrontendSocket(session);
        loop.execute(() -> relay.onFrontendOpen(socket));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        String connId = session.getId();
        String payload = message.getPayload();
        loop.execute(() -> relay.onFrontendMessage(connId, payload));
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("ws:in:error conn={} error={}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        String connId = session.getId();
        log.debug("ws:in:closed conn={} code={}", connId, status.getCode());
        loop.execute(() -> relay.onFrontendClose(connId));
    }
}
