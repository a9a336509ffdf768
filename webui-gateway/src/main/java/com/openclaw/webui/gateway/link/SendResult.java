package com.openclaw.webui.gateway.link;

/**
 * Outcome of forwarding a request to a gateway.
 */
public enum SendResult {
    SENT,
    /** Link not {@code READY}; nothing was sent. */
    NOT_READY,
    /** Encoded frame exceeds the transport's message limit; the socket is untouched. */
    TOO_LARGE,
    /** Socket refused the frame; the link has been dropped and will reconnect. */
    FAILED;

    public boolean isSent() {
        return this == SENT;
    }
}
