package com.openclaw.webui.gateway.relay;

import com.openclaw.webui.common.config.WebUiConfig;
import com.openclaw.webui.common.config.WebUiConfig.GatewayConfig;
import com.openclaw.webui.common.logging.LogRedact;
import com.openclaw.webui.gateway.link.GatewayLink;
import com.openclaw.webui.gateway.link.LinkState;
import com.openclaw.webui.gateway.protocol.ControlCodec;
import com.openclaw.webui.gateway.protocol.ControlFrames.Attachment;
import com.openclaw.webui.gateway.protocol.ControlFrames.Auth;
import com.openclaw.webui.gateway.protocol.ControlFrames.AuthFail;
import com.openclaw.webui.gateway.protocol.ControlFrames.AuthOk;
import com.openclaw.webui.gateway.protocol.ControlFrames.AuthRequired;
import com.openclaw.webui.gateway.protocol.ControlFrames.Cancel;
import com.openclaw.webui.gateway.protocol.ControlFrames.ErrorMessage;
import com.openclaw.webui.gateway.protocol.ControlFrames.GatewayInfo;
import com.openclaw.webui.gateway.protocol.ControlFrames.Inbound;
import com.openclaw.webui.gateway.protocol.ControlFrames.Init;
import com.openclaw.webui.gateway.protocol.ControlFrames.Outbound;
import com.openclaw.webui.gateway.protocol.ControlFrames.Routed;
import com.openclaw.webui.gateway.protocol.ControlFrames.Send;
import com.openclaw.webui.gateway.protocol.ControlFrames.Unknown;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

/**
 * Wires the configured {@link GatewayLink}s to the browser connections.
 *
 * <p>
 * Inbound control messages pass the password gate, are routed by gateway
 * index and forwarded to the link. Link output (status and session events)
 * is broadcast through the {@link ClientRegistry}.
 *
 * <p>
 * All methods except the health accessors must be called on the relay loop.
 */
@Slf4j
public class Relay {

    static final String DEFAULT_SESSION_PREFIX = "webui:default_";

    /**
     * Creates the link for gateway {@code index}; {@code sink} receives its output.
     */
    @FunctionalInterface
    public interface LinkFactory {
        GatewayLink create(int index, GatewayConfig config, Consumer<Outbound> sink);
    }

    public record GatewayHealth(int index, String name, LinkState state, boolean connected) {
    }

    private final WebUiConfig config;
    private final ClientRegistry registry;
    private final ControlCodec codec;
    private final List<GatewayLink> links;
    private final byte[] password;
    private final long startedAt = System.currentTimeMillis();

    public Relay(WebUiConfig config, ClientRegistry registry, ControlCodec codec, LinkFactory linkFactory) {
        this.config = config;
        this.registry = registry;
        this.codec = codec;
        String resolved = config.resolvePassword();
        this.password = resolved != null ? resolved.getBytes(StandardCharsets.UTF_8) : null;

        List<GatewayLink> created = new ArrayList<>();
        List<GatewayConfig> gateways = config.getGateways();
        for (int i = 0; i < gateways.size(); i++) {
            created.add(linkFactory.create(i, gateways.get(i), this::onLinkOutput));
        }
        this.links = Collections.unmodifiableList(created);
    }

    public void start() {
        log.info("relay:start gateways={} auth={}", links.size(), isAuthRequired() ? "password" : "none");
        links.forEach(GatewayLink::start);
    }

    public void stop() {
        links.forEach(GatewayLink::stop);
        log.info("relay:stopped");
    }

    private void onLinkOutput(Outbound frame) {
        int delivered = registry.broadcast(frame);
        log.debug("relay:broadcast type={} delivered={}", frame.getClass().getSimpleName(), delivered);
    }

    // =========================================================================
    // Browser connections
    // =========================================================================

    public void onFrontendOpen(FrontendSocket socket) {
        FrontendConnection conn = new FrontendConnection(socket, !isAuthRequired());
        registry.add(conn);
        log.info("ws:in:open conn={} remote={}", socket.id(), socket.remoteAddress());
        if (conn.isAuthenticated()) {
            registry.sendTo(conn, buildInit());
        } else {
            registry.sendTo(conn, new AuthRequired());
        }
    }

    public void onFrontendClose(String connectionId) {
        FrontendConnection conn = registry.remove(connectionId);
        if (conn != null) {
            log.info("ws:in:close conn={} sessions={}", connectionId, conn.getOwnedSessions().size());
        }
    }

    public void onFrontendMessage(String connectionId, String text) {
        FrontendConnection conn = registry.get(connectionId);
        if (conn == null) {
            return;
        }
        Inbound msg = codec.decode(text).orElse(null);
        if (msg == null) {
            log.debug("ws:in:dropped conn={}", connectionId);
            return;
        }

        if (msg instanceof Auth auth) {
            handleAuth(conn, auth);
            return;
        }
        if (!conn.isAuthenticated()) {
            registry.sendTo(conn, new AuthRequired());
            return;
        }
        log.debug("ws:in:msg conn={} {}", connectionId, LogRedact.preview(text));

        if (msg instanceof Send send) {
            handleSend(conn, send);
        } else if (msg instanceof Cancel cancel) {
            handleCancel(conn, cancel);
        } else if (msg instanceof Unknown unknown) {
            log.debug("ws:in:unknown conn={} type={}", connectionId, unknown.type());
        }
    }

    private void handleAuth(FrontendConnection conn, Auth auth) {
        if (!isAuthRequired()) {
            registry.sendTo(conn, new AuthOk());
            return;
        }
        if (passwordMatches(auth.password())) {
            conn.markAuthenticated();
            registry.sendTo(conn, new AuthOk());
            registry.sendTo(conn, buildInit());
            log.info("ws:auth:ok conn={} remote={}", conn.getId(), conn.getSocket().remoteAddress());
        } else {
            registry.sendTo(conn, new AuthFail());
            log.warn("ws:auth:failed conn={} remote={}", conn.getId(), conn.getSocket().remoteAddress());
        }
    }

    private boolean passwordMatches(String candidate) {
        if (candidate == null) {
            return false;
        }
        return MessageDigest.isEqual(password, candidate.getBytes(StandardCharsets.UTF_8));
    }

    private void handleSend(FrontendConnection conn, Send send) {
        int idx = send.gatewayIndex();
        GatewayLink link = resolveLink(conn, send);
        if (link == null) {
            return;
        }
        if (!link.isReady()) {
            log.info("relay:send:rejected gateway={} state={}", idx, link.getState());
            registry.sendTo(conn, notConnected(idx));
            return;
        }
        String sessionKey = sessionKeyOrDefault(send.sessionKey(), idx);
        conn.claimSession(sessionKey);

        List<Attachment> attachments = AttachmentPolicy.filter(send.attachmentsOrEmpty());
        String text = send.message() != null ? send.message() : "";
        log.info("relay:send gateway={} session={} chars={} attachments={}",
                idx, sessionKey, text.length(), attachments.size());
        switch (link.sendMessage(sessionKey, text, attachments)) {
            case SENT -> {
            }
            case NOT_READY -> registry.sendTo(conn, notConnected(idx));
            case TOO_LARGE -> registry.sendTo(conn, new ErrorMessage(idx, "Message too large for gateway"));
            case FAILED -> registry.sendTo(conn, new ErrorMessage(idx, "Failed to forward message to gateway"));
        }
    }

    private void handleCancel(FrontendConnection conn, Cancel cancel) {
        int idx = cancel.gatewayIndex();
        GatewayLink link = resolveLink(conn, cancel);
        if (link == null) {
            return;
        }
        if (!link.isReady()) {
            registry.sendTo(conn, notConnected(idx));
            return;
        }
        String sessionKey = sessionKeyOrDefault(cancel.sessionKey(), idx);
        boolean sent = link.cancelRun(sessionKey);
        log.info("relay:cancel gateway={} session={} sent={}", idx, sessionKey, sent);
    }

    private GatewayLink resolveLink(FrontendConnection conn, Routed msg) {
        int idx = msg.gatewayIndex();
        if (idx < 0 || idx >= links.size()) {
            String shown = idx < 0 ? msg.gateway().asText() : String.valueOf(idx);
            registry.sendTo(conn, new ErrorMessage(null, "Invalid gateway index: " + shown));
            return null;
        }
        return links.get(idx);
    }

    private static String sessionKeyOrDefault(String sessionKey, int idx) {
        return sessionKey != null && !sessionKey.isBlank() ? sessionKey : DEFAULT_SESSION_PREFIX + idx;
    }

    private static ErrorMessage notConnected(int idx) {
        return new ErrorMessage(idx, "Gateway not connected");
    }

    Init buildInit() {
        List<GatewayInfo> gateways = new ArrayList<>(links.size());
        for (GatewayLink link : links) {
            gateways.add(new GatewayInfo(link.getName(), link.isReady()));
        }
        return new Init(config.getModels(), gateways);
    }

    // =========================================================================
    // Health
    // =========================================================================

    public boolean isAuthRequired() {
        return password != null;
    }

    public List<GatewayHealth> gatewayHealth() {
        List<GatewayHealth> result = new ArrayList<>(links.size());
        for (GatewayLink link : links) {
            LinkState state = link.getState();
            result.add(new GatewayHealth(link.getIndex(), link.getName(), state, state.isConnected()));
        }
        return result;
    }

    public int clientCount() {
        return registry.authenticatedCount();
    }

    public long uptimeMs() {
        return System.currentTimeMillis() - startedAt;
    }

    public List<GatewayLink> getLinks() {
        return links;
    }
}
