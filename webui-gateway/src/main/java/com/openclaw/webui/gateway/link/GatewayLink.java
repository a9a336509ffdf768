package com.openclaw.webui.gateway.link;

import com.fasterxml.jackson.databind.JsonNode;
import com.openclaw.webui.common.config.WebUiConfig.GatewayConfig;
import com.openclaw.webui.common.infra.Backoff;
import com.openclaw.webui.common.infra.DeviceIdentity;
import com.openclaw.webui.common.infra.EventLoop;
import com.openclaw.webui.common.logging.LogRedact;
import com.openclaw.webui.gateway.protocol.ControlFrames.Attachment;
import com.openclaw.webui.gateway.protocol.ControlFrames.Outbound;
import com.openclaw.webui.gateway.protocol.ControlFrames.Status;
import com.openclaw.webui.gateway.protocol.ProtocolCodec;
import com.openclaw.webui.gateway.protocol.ProtocolTypes;
import com.openclaw.webui.gateway.protocol.ProtocolTypes.AgentParams;
import com.openclaw.webui.gateway.protocol.ProtocolTypes.CancelParams;
import com.openclaw.webui.gateway.protocol.ProtocolTypes.ClientInfo;
import com.openclaw.webui.gateway.protocol.ProtocolTypes.ConnectAuth;
import com.openclaw.webui.gateway.protocol.ProtocolTypes.ConnectParams;
import com.openclaw.webui.gateway.protocol.ProtocolTypes.ContentBlock;
import com.openclaw.webui.gateway.protocol.ProtocolTypes.DocumentBlock;
import com.openclaw.webui.gateway.protocol.ProtocolTypes.EventFrame;
import com.openclaw.webui.gateway.protocol.ProtocolTypes.Events;
import com.openclaw.webui.gateway.protocol.ProtocolTypes.ImageBlock;
import com.openclaw.webui.gateway.protocol.ProtocolTypes.MediaSource;
import com.openclaw.webui.gateway.protocol.ProtocolTypes.Methods;
import com.openclaw.webui.gateway.protocol.ProtocolTypes.RequestFrame;
import com.openclaw.webui.gateway.protocol.ProtocolTypes.ResponseFrame;
import com.openclaw.webui.gateway.protocol.ProtocolTypes.TextBlock;
import com.openclaw.webui.gateway.protocol.ProtocolTypes.WireFrame;
import com.openclaw.webui.gateway.transport.GatewaySocket;
import com.openclaw.webui.gateway.transport.GatewayTransport;
import lombok.extern.slf4j.Slf4j;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Consumer;

/**
 * One persistent, self-healing connection to one configured gateway.
 *
 * <p>
 * Handshake: socket open → wait for {@code connect.challenge} → send a signed
 * {@code connect} request → {@code READY} on an ok response. Any close or
 * failure drops to {@code DISCONNECTED} and schedules a reconnect with
 * exponential backoff.
 *
 * <p>
 * Not thread-safe: every method, and every socket callback, runs on the
 * {@link EventLoop}. Socket callbacks are re-posted to the loop and tagged
 * with a generation number so events from a replaced socket are ignored.
 */
@Slf4j
public class GatewayLink {

    private static final int NORMAL_CLOSURE = 1000;
    private static final String OCTET_STREAM = "application/octet-stream";

    private final int index;
    private final GatewayConfig config;
    private final DeviceIdentity identity;
    private final GatewayTransport transport;
    private final EventLoop loop;
    private final ProtocolCodec codec;
    private final Consumer<Outbound> sink;
    private final Backoff.Policy backoffPolicy;
    private final String agentPrefix;

    /** requestId → session the request was issued for. */
    private final Map<String, PendingRequest> pendingRequests = new HashMap<>();
    /** sessionKey → runId of the run currently in flight. */
    private final Map<String, String> activeRuns = new HashMap<>();

    private volatile LinkState state = LinkState.DISCONNECTED;
    private GatewaySocket socket;
    private long generation;
    private EventLoop.Timer reconnectTimer;
    private int consecutiveFailures;
    private boolean stopped;

    record PendingRequest(String sessionKey) {
    }

    public GatewayLink(int index, GatewayConfig config, DeviceIdentity identity,
            GatewayTransport transport, EventLoop loop, Consumer<Outbound> sink) {
        this(index, config, identity, transport, loop, sink, Backoff.Policy.GATEWAY_RECONNECT, new ProtocolCodec());
    }

    public GatewayLink(int index, GatewayConfig config, DeviceIdentity identity,
            GatewayTransport transport, EventLoop loop, Consumer<Outbound> sink,
            Backoff.Policy backoffPolicy, ProtocolCodec codec) {
        this.index = index;
        this.config = config;
        this.identity = identity;
        this.transport = transport;
        this.loop = loop;
        this.sink = sink;
        this.backoffPolicy = backoffPolicy;
        this.codec = codec;
        this.agentPrefix = EventTranslator.agentPrefix(config.resolveAgentId());
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    /**
     * Open the first connection. Later connections are driven by the reconnect timer.
     */
    public void start() {
        stopped = false;
        if (state == LinkState.DISCONNECTED && reconnectTimer == null) {
            connect();
        }
    }

    /**
     * Close the socket and stop reconnecting.
     */
    public void stop() {
        stopped = true;
        if (reconnectTimer != null) {
            reconnectTimer.cancel();
            reconnectTimer = null;
        }
        GatewaySocket current = socket;
        generation++;
        socket = null;
        pendingRequests.clear();
        transition(LinkState.DISCONNECTED);
        if (current != null) {
            current.close(NORMAL_CLOSURE, "relay shutting down");
        }
        log.info("gateway:stopped idx={} name={}", index, getName());
    }

    private void connect() {
        reconnectTimer = null;
        if (stopped || state != LinkState.DISCONNECTED) {
            return;
        }
        transition(LinkState.CONNECTING);
        long gen = ++generation;
        String url = buildUrl();
        log.info("gateway:connecting idx={} name={} url={}", index, getName(), config.getUrl());
        try {
            socket = transport.open(url, new SocketListener(gen));
        } catch (RuntimeException e) {
            // OkHttp rejects malformed URLs synchronously
            log.error("gateway:open:failed idx={} url={} error={}", index, config.getUrl(), e.getMessage());
            disconnect(gen, "open failed");
        }
    }

    String buildUrl() {
        String url = config.getUrl();
        String token = config.getToken();
        if (token == null || token.isEmpty()) {
            return url;
        }
        return url + "?token=" + URLEncoder.encode(token, StandardCharsets.UTF_8);
    }

    private void transition(LinkState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal link transition " + state + " -> " + next + " (gateway " + index + ")");
        }
        state = next;
    }

    // =========================================================================
    // Socket callbacks (on the loop)
    // =========================================================================

    private void handleOpen(long gen) {
        if (gen != generation) {
            return;
        }
        transition(LinkState.AWAITING_CHALLENGE);
        log.info("gateway:open idx={} awaiting challenge", index);
    }

    private void handleText(long gen, String text) {
        if (gen != generation) {
            return;
        }
        String heartbeat = text.trim().toLowerCase(Locale.ROOT);
        if ("ping".equals(heartbeat)) {
            socket.send("pong");
            return;
        }
        if ("pong".equals(heartbeat)) {
            return;
        }

        WireFrame frame = codec.decode(text).orElse(null);
        if (frame == null) {
            return;
        }

        if (frame instanceof EventFrame evt && Events.CONNECT_CHALLENGE.equals(evt.event())) {
            if (state == LinkState.AWAITING_CHALLENGE) {
                sendConnect(nonceOf(evt.payload()));
            } else {
                log.debug("gateway:challenge:ignored idx={} state={}", index, state);
            }
            return;
        }
        if (frame instanceof ResponseFrame res && ProtocolTypes.CONNECT_REQUEST_ID.equals(res.id())) {
            if (state == LinkState.HANDSHAKING) {
                handleConnectResponse(gen, res);
            }
            return;
        }

        if (state != LinkState.READY) {
            log.debug("gateway:frame:dropped idx={} state={}", index, state);
            return;
        }
        log.debug("gateway:in idx={} {}", index, LogRedact.preview(text));

        if (frame instanceof ResponseFrame res) {
            handleResponse(res);
        } else if (frame instanceof EventFrame evt) {
            handleEvent(evt);
        } else if (frame instanceof RequestFrame req) {
            log.debug("gateway:req:ignored idx={} method={}", index, req.method());
        }
    }

    private void handleRemoteClosing(long gen, int code, String reason) {
        if (gen != generation) {
            return;
        }
        socket.close(NORMAL_CLOSURE, null);
        disconnect(gen, "closed by gateway code=" + code + (reason != null && !reason.isEmpty() ? " reason=" + reason : ""));
    }

    /**
     * Common path for close, failure and handshake rejection.
     */
    private void disconnect(long gen, String reason) {
        if (gen != generation) {
            return;
        }
        generation++;
        socket = null;
        transition(LinkState.DISCONNECTED);
        int dropped = pendingRequests.size();
        pendingRequests.clear();
        log.info("gateway:disconnected idx={} name={} reason={} pendingDropped={}", index, getName(), reason, dropped);
        sink.accept(new Status(index, false));
        scheduleReconnect();
    }

    private void scheduleReconnect() {
        if (stopped || reconnectTimer != null || state != LinkState.DISCONNECTED) {
            return;
        }
        long delay = Backoff.compute(backoffPolicy, consecutiveFailures + 1);
        consecutiveFailures++;
        log.info("gateway:reconnect idx={} attempt={} delayMs={}", index, consecutiveFailures, delay);
        reconnectTimer = loop.schedule(this::connect, delay);
    }

    // =========================================================================
    // Handshake
    // =========================================================================

    private void sendConnect(String nonce) {
        if (nonce == null) {
            log.warn("gateway:challenge:no-nonce idx={} falling back to v1 assertion", index);
        }
        ConnectParams params = ConnectParams.builder()
                .minProtocol(ProtocolTypes.PROTOCOL_VERSION)
                .maxProtocol(ProtocolTypes.PROTOCOL_VERSION)
                .client(ClientInfo.builder()
                        .id(DeviceIdentity.CLIENT_ID)
                        .version(ProtocolTypes.CLIENT_VERSION)
                        .platform(platform())
                        .mode(DeviceIdentity.CLIENT_MODE)
                        .displayName(ProtocolTypes.CLIENT_DISPLAY_NAME)
                        .build())
                .role(DeviceIdentity.ROLE)
                .scopes(List.of(DeviceIdentity.SCOPES))
                .caps(List.of(ProtocolTypes.CAP_TOOL_EVENTS))
                .auth(new ConnectAuth(config.getToken()))
                .device(identity.signAssertion(config.getToken(), nonce))
                .build();
        transition(LinkState.HANDSHAKING);
        log.info("gateway:challenge idx={} sending connect", index);
        send(ProtocolTypes.CONNECT_REQUEST_ID, Methods.CONNECT, params);
    }

    private void handleConnectResponse(long gen, ResponseFrame res) {
        if (res.ok()) {
            transition(LinkState.READY);
            consecutiveFailures = 0;
            log.info("gateway:ready idx={} name={}", index, getName());
            sink.accept(new Status(index, true));
            return;
        }
        log.warn("gateway:handshake:rejected idx={} error={}", index, res.errorMessage());
        GatewaySocket current = socket;
        disconnect(gen, "handshake rejected");
        if (current != null) {
            current.close(NORMAL_CLOSURE, "handshake rejected");
        }
    }

    private static String nonceOf(JsonNode payload) {
        if (payload == null) {
            return null;
        }
        JsonNode nonce = payload.get("nonce");
        return nonce != null && nonce.isTextual() && !nonce.asText().isEmpty() ? nonce.asText() : null;
    }

    static String platform() {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        if (os.startsWith("windows")) {
            return "win32";
        }
        if (os.startsWith("mac") || os.contains("darwin")) {
            return "darwin";
        }
        return os.isEmpty() ? "unknown" : os.split("\\s+")[0];
    }

    // =========================================================================
    // Business frames
    // =========================================================================

    private void handleResponse(ResponseFrame res) {
        PendingRequest pending = pendingRequests.remove(res.id());
        if (!res.ok()) {
            log.warn("gateway:req:failed idx={} id={} error={}", index, res.id(), res.errorMessage());
            return;
        }
        String runId = res.payloadText("runId");
        if (pending != null && runId != null) {
            activeRuns.put(pending.sessionKey(), runId);
            log.debug("gateway:run idx={} session={} runId={}", index, pending.sessionKey(), runId);
        }
    }

    private void handleEvent(EventFrame evt) {
        switch (evt.event()) {
            case Events.AGENT -> EventTranslator.translate(index, agentPrefix, evt.payload())
                    .ifPresent(this::applyTranslation);
            case Events.CHAT -> log.debug("gateway:chat idx={} {}", index,
                    LogRedact.preview(String.valueOf(evt.payload())));
            default -> log.debug("gateway:event idx={} event={}", index, evt.event());
        }
    }

    private void applyTranslation(EventTranslator.Translation t) {
        switch (t.runEffect()) {
            case TRACK -> activeRuns.put(t.sessionKey(), t.runId());
            case CLEAR -> activeRuns.remove(t.sessionKey());
            case NONE -> {
            }
        }
        sink.accept(t.event());
    }

    /**
     * Forward a user message as an {@code agent} request. Nothing is recorded
     * unless the result is {@link SendResult#SENT}.
     */
    public SendResult sendMessage(String sessionKey, String text, List<Attachment> attachments) {
        if (state != LinkState.READY) {
            return SendResult.NOT_READY;
        }
        long now = System.currentTimeMillis();
        String requestId = "req_" + now + "_" + randomSuffix();
        AgentParams params = AgentParams.builder()
                .agentId(config.resolveAgentId())
                .sessionKey(sessionKey)
                .message(buildMessage(text, attachments))
                .deliver(false)
                .idempotencyKey("acp_" + sessionKey + "_" + now)
                .build();
        pendingRequests.put(requestId, new PendingRequest(sessionKey));
        SendResult result = send(requestId, Methods.AGENT, params);
        if (result != SendResult.SENT) {
            pendingRequests.remove(requestId);
        }
        return result;
    }

    /**
     * Ask the gateway to cancel the session's active run. No frame is sent when
     * no run is tracked for the session.
     *
     * @return true when a cancel request was sent
     */
    public boolean cancelRun(String sessionKey) {
        String runId = activeRuns.get(sessionKey);
        if (runId == null || state != LinkState.READY) {
            return false;
        }
        return send("cancel_" + System.currentTimeMillis(), Methods.AGENT_CANCEL,
                new CancelParams(sessionKey, runId)).isSent();
    }

    static Object buildMessage(String text, List<Attachment> attachments) {
        String body = text != null ? text : "";
        if (attachments == null || attachments.isEmpty()) {
            return body;
        }
        List<ContentBlock> blocks = new ArrayList<>(attachments.size() + 1);
        blocks.add(new TextBlock(body));
        for (Attachment att : attachments) {
            String mime = att.mimeType();
            if (mime != null && mime.startsWith("image/")) {
                blocks.add(new ImageBlock(MediaSource.base64(mime, att.data())));
            } else {
                String mediaType = mime != null && !mime.isEmpty() ? mime : OCTET_STREAM;
                blocks.add(new DocumentBlock(MediaSource.base64(mediaType, att.data()), att.filename()));
            }
        }
        return blocks;
    }

    /**
     * Oversized frames are refused before reaching the socket. A frame the
     * socket itself refuses means the connection is going away: the link is
     * dropped and a reconnect scheduled.
     */
    private SendResult send(String id, String method, Object params) {
        GatewaySocket current = socket;
        if (current == null) {
            return SendResult.NOT_READY;
        }
        String json = codec.encodeRequest(id, method, params);
        long bytes = json.getBytes(StandardCharsets.UTF_8).length;
        if (bytes > transport.maxMessageBytes()) {
            log.warn("gateway:send:too-large idx={} method={} bytes={} limit={}",
                    index, method, bytes, transport.maxMessageBytes());
            return SendResult.TOO_LARGE;
        }
        log.debug("gateway:out idx={} {}", index, LogRedact.preview(json));
        if (!current.send(json)) {
            log.warn("gateway:send:rejected idx={} method={} bytes={}", index, method, bytes);
            current.cancel();
            disconnect(generation, "send rejected");
            return SendResult.FAILED;
        }
        return SendResult.SENT;
    }

    private static String randomSuffix() {
        return Integer.toString(ThreadLocalRandom.current().nextInt(36 * 36 * 36, 36 * 36 * 36 * 36), 36);
    }

    // =========================================================================
    // Accessors
    // =========================================================================

    public int getIndex() {
        return index;
    }

    public String getName() {
        return config.getName();
    }

    public LinkState getState() {
        return state;
    }

    public boolean isReady() {
        return state == LinkState.READY;
    }

    public String activeRunId(String sessionKey) {
        return activeRuns.get(sessionKey);
    }

    public int pendingRequestCount() {
        return pendingRequests.size();
    }

    /**
     * Re-posts every transport callback onto the loop, tagged with the
     * generation of the socket it belongs to.
     */
    private final class SocketListener implements GatewaySocket.Listener {

        private final long gen;

        SocketListener(long gen) {
            this.gen = gen;
        }

        @Override
        public void onOpen(GatewaySocket s) {
            loop.execute(() -> handleOpen(gen));
        }

        @Override
        public void onMessage(GatewaySocket s, String text) {
            loop.execute(() -> handleText(gen, text));
        }

        @Override
        public void onClosing(GatewaySocket s, int code, String reason) {
            loop.execute(() -> handleRemoteClosing(gen, code, reason));
        }

        @Override
        public void onClosed(GatewaySocket s, int code, String reason) {
            loop.execute(() -> disconnect(gen, "closed code=" + code));
        }

        @Override
        public void onFailure(GatewaySocket s, Throwable error) {
            loop.execute(() -> {
                if (gen == generation) {
                    log.warn("gateway:error idx={} error={}", index, error.getMessage());
                }
                disconnect(gen, "failure");
            });
        }
    }
}
