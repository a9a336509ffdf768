package com.openclaw.webui.app.config;

import com.openclaw.webui.common.infra.EventLoop;
import com.openclaw.webui.gateway.relay.Relay;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Starts the gateway links once the web server is up and stops them on shutdown.
 * Both run on the relay loop.
 */
@Slf4j
@Component
public class RelayLifecycle {

    private final Relay relay;
    private final EventLoop relayEventLoop;

    public RelayLifecycle(Relay relay, EventLoop relayEventLoop) {
        this.relay = relay;
        this.relayEventLoop = relayEventLoop;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        relayEventLoop.execute(relay::start);
        log.info("relay:scheduled-start gateways={}", relay.getLinks().size());
    }

    @PreDestroy
    public void shutdown() {
        relayEventLoop.execute(relay::stop);
    }
}
