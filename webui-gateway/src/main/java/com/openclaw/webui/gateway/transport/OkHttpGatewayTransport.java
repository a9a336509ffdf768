package com.openclaw.webui.gateway.transport;

import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okio.ByteString;

import java.util.concurrent.TimeUnit;

/**
 * {@link GatewayTransport} on OkHttp's WebSocket client. One shared
 * {@link OkHttpClient} serves every gateway link.
 */
@Slf4j
public class OkHttpGatewayTransport implements GatewayTransport, AutoCloseable {

    private static final long CONNECT_TIMEOUT_MS = 10_000;

    /** OkHttp closes a WebSocket whose outgoing queue would exceed 16 MiB. */
    public static final long MAX_QUEUE_BYTES = 16L * 1024 * 1024;

    private final OkHttpClient client;

    public OkHttpGatewayTransport() {
        this(new OkHttpClient.Builder()
                .connectTimeout(CONNECT_TIMEOUT_MS, TimeUnit.MILLISECONDS)
                .readTimeout(0, TimeUnit.MILLISECONDS) // WebSocket: no read timeout
                .build());
    }

    public OkHttpGatewayTransport(OkHttpClient client) {
        this.client = client;
    }

    @Override
    public GatewaySocket open(String url, GatewaySocket.Listener listener) {
        Request request = new Request.Builder().url(url).build();
        OkHttpSocket socket = new OkHttpSocket();
        socket.ws = client.newWebSocket(request, new WebSocketListener() {
            @Override
            public void onOpen(WebSocket ws, Response response) {
                socket.ws = ws;
                listener.onOpen(socket);
            }

            @Override
            public void onMessage(WebSocket ws, String text) {
                listener.onMessage(socket, text);
            }

            @Override
            public void onMessage(WebSocket ws, ByteString bytes) {
                listener.onMessage(socket, bytes.utf8());
            }

            @Override
            public void onClosing(WebSocket ws, int code, String reason) {
                listener.onClosing(socket, code, reason);
            }

            @Override
            public void onClosed(WebSocket ws, int code, String reason) {
                listener.onClosed(socket, code, reason);
            }

            @Override
            public void onFailure(WebSocket ws, Throwable t, Response response) {
                listener.onFailure(socket, t);
            }
        });
        return socket;
    }

    @Override
    public long maxMessageBytes() {
        return MAX_QUEUE_BYTES;
    }

    @Override
    public void close() {
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
    }

    private static final class OkHttpSocket implements GatewaySocket {

        private volatile WebSocket ws;

        @Override
        public boolean send(String text) {
            WebSocket current = ws;
            return current != null && current.send(text);
        }

        @Override
        public void close(int code, String reason) {
            WebSocket current = ws;
            if (current != null) {
                current.close(code, reason);
            }
        }

        @Override
        public void cancel() {
            WebSocket current = ws;
            if (current != null) {
                current.cancel();
            }
        }
    }
}
