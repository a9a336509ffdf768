package com.openclaw.webui.gateway.transport;

/**
 * One client WebSocket to a gateway.
 */
public interface GatewaySocket {

    /**
     * Enqueue a text frame.
     *
     * @return false when the socket is closing or its outgoing buffer is full
     */
    boolean send(String text);

    /** Begin a graceful close. */
    void close(int code, String reason);

    /** Drop the connection immediately. */
    void cancel();

    /**
     * Socket callbacks. Exactly one of {@link #onClosed} or {@link #onFailure}
     * ends every socket.
     */
    interface Listener {

        void onOpen(GatewaySocket socket);

        void onMessage(GatewaySocket socket, String text);

        /** Remote peer started closing. */
        void onClosing(GatewaySocket socket, int code, String reason);

        void onClosed(GatewaySocket socket, int code, String reason);

        void onFailure(GatewaySocket socket, Throwable error);
    }
}
