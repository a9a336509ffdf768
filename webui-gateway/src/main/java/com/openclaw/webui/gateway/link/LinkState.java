package com.openclaw.webui.gateway.link;

/**
 * Lifecycle of one gateway link.
 *
 * <pre>
 * DISCONNECTED → CONNECTING → AWAITING_CHALLENGE → HANDSHAKING → READY
 * </pre>
 *
 * Any state may drop back to {@link #DISCONNECTED}.
 */
public enum LinkState {
    DISCONNECTED,
    CONNECTING,
    AWAITING_CHALLENGE,
    HANDSHAKING,
    READY;

    public boolean canTransitionTo(LinkState next) {
        if (next == DISCONNECTED) {
            return true;
        }
        return switch (this) {
            case DISCONNECTED -> next == CONNECTING;
            case CONNECTING -> next == AWAITING_CHALLENGE;
            case AWAITING_CHALLENGE -> next == HANDSHAKING;
            case HANDSHAKING -> next == READY;
            case READY -> false;
        };
    }

    public boolean isConnected() {
        return this == READY;
    }
}
