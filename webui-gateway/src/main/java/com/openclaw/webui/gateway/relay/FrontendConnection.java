package com.openclaw.webui.gateway.relay;

import lombok.Getter;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Relay-side state of one browser connection: whether it passed the password
 * gate, and which session keys it has sent on.
 */
@Getter
public class FrontendConnection {

    private final FrontendSocket socket;
    private volatile boolean authenticated;
    private final Set<String> ownedSessions = new HashSet<>();

    public FrontendConnection(FrontendSocket socket, boolean authenticated) {
        this.socket = socket;
        this.authenticated = authenticated;
    }

    public String getId() {
        return socket.id();
    }

    void markAuthenticated() {
        this.authenticated = true;
    }

    void claimSession(String sessionKey) {
        ownedSessions.add(sessionKey);
    }

    public boolean ownsSession(String sessionKey) {
        return ownedSessions.contains(sessionKey);
    }

    public Set<String> getOwnedSessions() {
        return Collections.unmodifiableSet(ownedSessions);
    }
}
