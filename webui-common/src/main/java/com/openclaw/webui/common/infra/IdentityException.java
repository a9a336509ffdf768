package com.openclaw.webui.common.infra;

/**
 * The device identity could not be created or persisted.
 * Without an identity no gateway handshake is possible, so this is fatal at startup.
 */
public class IdentityException extends RuntimeException {

    public IdentityException(String message, Throwable cause) {
        super(message, cause);
    }
}
