package com.openclaw.webui.gateway.transport;

/**
 * Opens client WebSocket connections to a gateway.
 */
public interface GatewayTransport {

    /**
     * Start connecting to {@code url}. Returns immediately; the outcome is
     * reported through {@code listener} on the transport's own threads.
     */
    GatewaySocket open(String url, GatewaySocket.Listener listener);

    /**
     * Largest UTF-8 encoded text frame one {@link GatewaySocket#send} accepts.
     * Larger frames are refused and may take the socket down with them.
     */
    long maxMessageBytes();
}
