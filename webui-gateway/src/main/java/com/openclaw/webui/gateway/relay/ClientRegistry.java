package com.openclaw.webui.gateway.relay;

import com.openclaw.webui.gateway.protocol.ControlCodec;
import com.openclaw.webui.gateway.protocol.ControlFrames.Outbound;
import com.openclaw.webui.gateway.protocol.ControlFrames.SessionEvent;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Connected browser sessions and filtered broadcast.
 * Session-scoped frames reach only connections owning the session key;
 * everything else reaches every authenticated connection.
 *
 * <p>
 * Mutated only on the relay loop; the map is concurrent so health checks can
 * read it from request threads.
 */
@Slf4j
public class ClientRegistry {

    private final Map<String, FrontendConnection> connections = new ConcurrentHashMap<>();
    private final ControlCodec codec;

    public ClientRegistry(ControlCodec codec) {
        this.codec = codec;
    }

    public void add(FrontendConnection connection) {
        connections.put(connection.getId(), connection);
    }

    public FrontendConnection get(String connectionId) {
        return connections.get(connectionId);
    }

    public FrontendConnection remove(String connectionId) {
        return connections.remove(connectionId);
    }

    public int size() {
        return connections.size();
    }

    public int authenticatedCount() {
        return (int) connections.values().stream().filter(FrontendConnection::isAuthenticated).count();
    }

    /**
     * Deliver {@code frame} to every connection allowed to see it.
     *
     * @return number of connections written to
     */
    public int broadcast(Outbound frame) {
        String json = codec.encode(frame);
        String sessionKey = frame instanceof SessionEvent se ? se.sessionKey() : null;
        int delivered = 0;
        for (FrontendConnection conn : connections.values()) {
            if (!conn.isAuthenticated()) {
                continue;
            }
            if (sessionKey != null && !conn.ownsSession(sessionKey)) {
                continue;
            }
            if (write(conn, json)) {
                delivered++;
            }
        }
        return delivered;
    }

    /**
     * Send a frame to one connection regardless of its authentication state.
     */
    public boolean sendTo(FrontendConnection conn, Outbound frame) {
        return write(conn, codec.encode(frame));
    }

    private boolean write(FrontendConnection conn, String json) {
        FrontendSocket socket = conn.getSocket();
        if (!socket.isOpen()) {
            return false;
        }
        try {
            socket.send(json);
            return true;
        } catch (IOException | RuntimeException e) {
            log.debug("ws:out:failed conn={} error={}", conn.getId(), e.getMessage());
            return false;
        }
    }
}
