package com.openclaw.webui.gateway.relay;

import java.io.IOException;

/**
 * A browser connection as seen by the relay. Implemented by the web layer.
 */
public interface FrontendSocket {

    String id();

    boolean isOpen();

    void send(String text) throws IOException;

    /** Remote address for logging; may be null. */
    String remoteAddress();
}
