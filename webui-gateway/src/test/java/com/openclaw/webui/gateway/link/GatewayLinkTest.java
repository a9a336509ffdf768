package com.openclaw.webui.gateway.link;

import com.fasterxml.jackson.databind.JsonNode;
import com.openclaw.webui.common.config.WebUiConfig.GatewayConfig;
import com.openclaw.webui.common.infra.Backoff;
import com.openclaw.webui.common.infra.DeviceIdentity;
import com.openclaw.webui.gateway.protocol.ControlFrames.Attachment;
import com.openclaw.webui.gateway.protocol.ControlFrames.Lifecycle;
import com.openclaw.webui.gateway.protocol.ControlFrames.Outbound;
import com.openclaw.webui.gateway.protocol.ControlFrames.Status;
import com.openclaw.webui.gateway.protocol.ProtocolCodec;
import com.openclaw.webui.gateway.support.FakeSocket;
import com.openclaw.webui.gateway.support.FakeTransport;
import com.openclaw.webui.gateway.support.ManualEventLoop;
import com.openclaw.webui.gateway.transport.GatewaySocket;
import com.openclaw.webui.gateway.transport.GatewayTransport;
import com.openclaw.webui.gateway.transport.OkHttpGatewayTransport;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GatewayLinkTest {

    private static final String CONNECT_OK = "{\"type\":\"res\",\"id\":\"connect\",\"ok\":true,\"payload\":{\"type\":\"hello-ok\"}}";
    private static final String CONNECT_REJECTED =
            "{\"type\":\"res\",\"id\":\"connect\",\"ok\":false,\"error\":{\"code\":\"NOT_PAIRED\",\"message\":\"device not paired\"}}";

    private static DeviceIdentity identity;

    private ManualEventLoop loop;
    private FakeTransport transport;
    private List<Outbound> emitted;
    private GatewayLink link;

    @BeforeAll
    static void createIdentity() {
        identity = DeviceIdentity.generate();
    }

    @BeforeEach
    void setUp() {
        loop = new ManualEventLoop();
        transport = new FakeTransport();
        emitted = new ArrayList<>();
        link = newLink(new GatewayConfig("home", "ws://gw.test:18789", "secret-token", null),
                Backoff.Policy.GATEWAY_RECONNECT);
    }

    private GatewayLink newLink(GatewayConfig config, Backoff.Policy policy) {
        return new GatewayLink(0, config, identity, transport, loop, emitted::add, policy, new ProtocolCodec());
    }

    private static String challenge(String nonce) {
        return "{\"type\":\"event\",\"event\":\"connect.challenge\",\"payload\":{\"nonce\":\"" + nonce + "\",\"ts\":1}}";
    }

    private static String agentEvent(String stream, String sessionKey, String runId, String data) {
        return "{\"type\":\"event\",\"event\":\"agent\",\"payload\":{\"stream\":\"" + stream
                + "\",\"sessionKey\":\"" + sessionKey + "\",\"runId\":\"" + runId + "\",\"data\":" + data + "}}";
    }

    private FakeSocket handshake() {
        link.start();
        FakeSocket socket = transport.last();
        socket.open();
        socket.receive(challenge("nonce-1"));
        socket.receive(CONNECT_OK);
        assertEquals(LinkState.READY, link.getState());
        return socket;
    }

    @Nested
    class Handshake {

        @Test
        void start_opensSocketWithTokenInQuery() {
            link.start();
            assertEquals(LinkState.CONNECTING, link.getState());
            assertEquals("ws://gw.test:18789?token=secret-token", transport.last().url());
        }

        @Test
        void tokenIsUrlEncoded() {
            newLink(new GatewayConfig("x", "ws://h", "a&b=c", null), Backoff.Policy.GATEWAY_RECONNECT).start();
            assertEquals("ws://h?token=a%26b%3Dc", transport.last().url());
        }

        @Test
        void noToken_leavesUrlAlone() {
            newLink(new GatewayConfig("x", "ws://h:1", null, null), Backoff.Policy.GATEWAY_RECONNECT).start();
            assertEquals("ws://h:1", transport.last().url());
        }

        @Test
        void open_waitsForChallengeWithoutSending() {
            link.start();
            transport.last().open();
            assertEquals(LinkState.AWAITING_CHALLENGE, link.getState());
            assertTrue(transport.last().sent().isEmpty());
        }

        @Test
        void challenge_sendsSignedConnectRequest() {
            link.start();
            FakeSocket socket = transport.last();
            socket.open();
            socket.receive(challenge("nonce-1"));

            assertEquals(LinkState.HANDSHAKING, link.getState());
            JsonNode frame = socket.lastJson();
            assertEquals("req", frame.get("type").asText());
            assertEquals("connect", frame.get("id").asText());
            assertEquals("connect", frame.get("method").asText());

            JsonNode params = frame.get("params");
            assertEquals(3, params.get("minProtocol").asInt());
            assertEquals(3, params.get("maxProtocol").asInt());
            assertEquals("gateway-client", params.at("/client/id").asText());
            assertEquals("backend", params.at("/client/mode").asText());
            assertEquals("OpenClaw WebUI", params.at("/client/displayName").asText());
            assertFalse(params.at("/client/platform").asText().isEmpty());
            assertEquals("operator", params.get("role").asText());
            assertEquals("operator.admin", params.at("/scopes/0").asText());
            assertEquals("tool-events", params.at("/caps/0").asText());
            assertEquals("secret-token", params.at("/auth/token").asText());

            JsonNode device = params.get("device");
            assertEquals(identity.getDeviceId(), device.get("id").asText());
            assertEquals("nonce-1", device.get("nonce").asText());
            String payload = DeviceIdentity.buildAssertionPayload(identity.getDeviceId(),
                    device.get("signedAt").asLong(), "secret-token", "nonce-1");
            assertTrue(payload.startsWith("v2|"));
            assertTrue(identity.verify(payload, device.get("signature").asText()));
        }

        @Test
        void challengeWithoutNonce_fallsBackToV1Assertion() {
            link.start();
            FakeSocket socket = transport.last();
            socket.open();
            socket.receive("{\"type\":\"event\",\"event\":\"connect.challenge\",\"payload\":{}}");

            JsonNode device = socket.lastJson().at("/params/device");
            assertFalse(device.has("nonce"));
            String payload = DeviceIdentity.buildAssertionPayload(identity.getDeviceId(),
                    device.get("signedAt").asLong(), "secret-token", null);
            assertTrue(payload.startsWith("v1|"));
            assertTrue(identity.verify(payload, device.get("signature").asText()));
        }

        @Test
        void okResponse_makesLinkReadyAndBroadcastsStatus() {
            handshake();
            assertTrue(link.isReady());
            assertEquals(List.of(new Status(0, true)), emitted);
        }

        @Test
        void rejectedHandshake_disconnectsAndSchedulesReconnect() {
            link.start();
            FakeSocket socket = transport.last();
            socket.open();
            socket.receive(challenge("n"));
            socket.receive(CONNECT_REJECTED);

            assertEquals(LinkState.DISCONNECTED, link.getState());
            assertTrue(socket.isClosed());
            assertEquals(List.of(new Status(0, false)), emitted);
            assertEquals(List.of(2_000L), loop.scheduledDelays());
        }

        @Test
        void businessFramesBeforeReady_areDropped() {
            link.start();
            FakeSocket socket = transport.last();
            socket.open();
            socket.receive(agentEvent("assistant", "agent:main:k", "r1", "{\"delta\":\"x\"}"));
            socket.receive(CONNECT_OK);

            assertTrue(emitted.isEmpty());
            assertEquals(LinkState.AWAITING_CHALLENGE, link.getState());
        }

        @Test
        void secondChallengeWhileHandshaking_isIgnored() {
            link.start();
            FakeSocket socket = transport.last();
            socket.open();
            socket.receive(challenge("a"));
            socket.receive(challenge("b"));
            assertEquals(1, socket.sent().size());
        }
    }

    @Nested
    class Heartbeat {

        @Test
        void ping_isAnsweredWithPong() {
            FakeSocket socket = handshake();
            int before = socket.sent().size();
            socket.receive("  PING \n");
            assertEquals(before + 1, socket.sent().size());
            assertEquals("pong", socket.sent().get(before));
        }

        @Test
        void pingBeforeHandshake_isAnsweredToo() {
            link.start();
            FakeSocket socket = transport.last();
            socket.open();
            socket.receive("ping");
            assertEquals(List.of("pong"), socket.sent());
            assertEquals(LinkState.AWAITING_CHALLENGE, link.getState());
        }

        @Test
        void pong_isIgnored() {
            FakeSocket socket = handshake();
            int before = socket.sent().size();
            socket.receive("Pong");
            assertEquals(before, socket.sent().size());
            assertTrue(link.isReady());
        }

        @Test
        void malformedFrame_isDroppedWithoutReconnect() {
            FakeSocket socket = handshake();
            socket.receive("{not json");
            socket.receive("[1,2]");
            socket.receive("{\"type\":\"mystery\"}");
            assertTrue(link.isReady());
            assertEquals(0, loop.timers().size());
        }
    }

    @Nested
    class Reconnect {

        @Test
        void delaysGrowGeometricallyUpToCap() {
            link = newLink(new GatewayConfig("x", "ws://h", null, null), new Backoff.Policy(100, 1_000, 2.0, 0.0));
            link.start();
            for (int i = 0; i < 6; i++) {
                transport.last().fail("refused");
                loop.runDueTimers();
            }
            assertEquals(List.of(100L, 200L, 400L, 800L, 1_000L, 1_000L), loop.scheduledDelays());
            assertEquals(7, transport.sockets().size());
        }

        @Test
        void delayResetsAfterReady() {
            link.start();
            transport.last().fail("refused");
            loop.runDueTimers();
            transport.last().closed(1006);
            loop.runDueTimers();
            assertEquals(List.of(2_000L, 3_000L), loop.scheduledDelays());

            FakeSocket socket = transport.last();
            socket.open();
            socket.receive(challenge("n"));
            socket.receive(CONNECT_OK);
            socket.closed(1006);

            assertEquals(2_000L, loop.scheduledDelays().get(2));
        }

        @Test
        void failureAndCloseOfSameSocket_scheduleOneTimer() {
            link.start();
            FakeSocket socket = transport.last();
            socket.fail("reset");
            socket.closed(1006);
            assertEquals(1, loop.timers().size());
            assertEquals(1, emitted.size());
        }

        @Test
        void disconnect_broadcastsStatusFalse() {
            FakeSocket socket = handshake();
            emitted.clear();
            socket.closed(1001);
            assertEquals(List.of(new Status(0, false)), emitted);
            assertEquals(LinkState.DISCONNECTED, link.getState());
        }

        @Test
        void remoteClose_closesOurSideAndDisconnects() {
            FakeSocket socket = handshake();
            socket.closedByServer(1001);
            assertTrue(socket.isClosed());
            assertEquals(LinkState.DISCONNECTED, link.getState());
            assertEquals(1, loop.pendingTimerCount());
        }

        @Test
        void staleSocketCallbacks_areIgnored() {
            link.start();
            FakeSocket first = transport.last();
            first.fail("refused");
            loop.runDueTimers();
            FakeSocket second = transport.last();
            assertNotSame(first, second);

            first.open();
            first.receive(challenge("n"));
            first.closed(1000);

            assertEquals(LinkState.CONNECTING, link.getState());
            assertTrue(first.sent().isEmpty());
            assertEquals(1, loop.timers().size());
        }

        @Test
        void openFailure_isRecoveredWithBackoff() {
            GatewayLink broken = new GatewayLink(3, new GatewayConfig("x", "not a url", null, null), identity,
                    new GatewayTransport() {
                        @Override
                        public GatewaySocket open(String url, GatewaySocket.Listener listener) {
                            throw new IllegalArgumentException("unexpected url");
                        }

                        @Override
                        public long maxMessageBytes() {
                            return OkHttpGatewayTransport.MAX_QUEUE_BYTES;
                        }
                    }, loop, emitted::add);
            broken.start();
            assertEquals(LinkState.DISCONNECTED, broken.getState());
            assertEquals(List.of(new Status(3, false)), emitted);
            assertEquals(List.of(2_000L), loop.scheduledDelays());
        }

        @Test
        void stop_closesSocketAndCancelsReconnect() {
            FakeSocket socket = handshake();
            link.stop();
            assertTrue(socket.isClosed());
            assertEquals(LinkState.DISCONNECTED, link.getState());

            socket.closed(1000);
            assertEquals(0, loop.timers().size());
        }

        @Test
        void stop_cancelsPendingTimer() {
            link.start();
            transport.last().fail("refused");
            link.stop();
            assertTrue(loop.timers().get(0).isCancelled());
            loop.runDueTimers();
            assertEquals(1, transport.sockets().size());
        }
    }

    @Nested
    class Messages {

        @Test
        void sendWhileNotReady_sendsAndRecordsNothing() {
            link.start();
            assertEquals(SendResult.NOT_READY, link.sendMessage("webui:s1", "hi", List.of()));
            assertEquals(0, link.pendingRequestCount());
            assertTrue(transport.last().sent().isEmpty());
        }

        @Test
        void send_buildsAgentRequest() {
            FakeSocket socket = handshake();
            assertEquals(SendResult.SENT, link.sendMessage("webui:s1", "hello", List.of()));

            JsonNode frame = socket.lastJson();
            assertEquals("agent", frame.get("method").asText());
            assertTrue(frame.get("id").asText().matches("req_\\d+_[0-9a-z]+"), frame.get("id").asText());
            JsonNode params = frame.get("params");
            assertEquals("main", params.get("agentId").asText());
            assertEquals("webui:s1", params.get("sessionKey").asText());
            assertEquals("hello", params.get("message").asText());
            assertFalse(params.get("deliver").asBoolean());
            assertTrue(params.get("idempotencyKey").asText().startsWith("acp_webui:s1_"));
            assertEquals(1, link.pendingRequestCount());
        }

        @Test
        void sendWithAttachments_buildsContentBlocks() {
            FakeSocket socket = handshake();
            link.sendMessage("k", "look", List.of(
                    new Attachment("a.png", "image/png", "iVBOR", 5L),
                    new Attachment("b.pdf", "application/pdf", "JVBER", 5L),
                    new Attachment("c.bin", null, "AAAA", 3L)));

            JsonNode message = socket.lastJson().at("/params/message");
            assertEquals(4, message.size());
            assertEquals("text", message.at("/0/type").asText());
            assertEquals("look", message.at("/0/text").asText());

            assertEquals("image", message.at("/1/type").asText());
            assertEquals("base64", message.at("/1/source/type").asText());
            assertEquals("image/png", message.at("/1/source/media_type").asText());
            assertEquals("iVBOR", message.at("/1/source/data").asText());

            assertEquals("document", message.at("/2/type").asText());
            assertEquals("application/pdf", message.at("/2/source/media_type").asText());
            assertEquals("b.pdf", message.at("/2/title").asText());

            assertEquals("application/octet-stream", message.at("/3/source/media_type").asText());
        }

        @Test
        void sendRejectedBySocket_dropsLinkAndReconnects() {
            FakeSocket socket = handshake();
            emitted.clear();
            socket.rejectSends();

            assertEquals(SendResult.FAILED, link.sendMessage("k", "x", List.of()));

            assertEquals(0, link.pendingRequestCount());
            assertEquals(LinkState.DISCONNECTED, link.getState());
            assertTrue(socket.isClosed());
            assertEquals(List.of(new Status(0, false)), emitted);
            assertEquals(1, loop.pendingTimerCount());
        }

        @Test
        void oversizedMessage_isRefusedAndLinkStaysUsable() {
            FakeSocket socket = handshake();
            emitted.clear();
            int sentBefore = socket.sent().size();
            String eightMegabytes = "A".repeat(8 * 1024 * 1024);

            SendResult result = link.sendMessage("k", "two pdfs", List.of(
                    new Attachment("a.pdf", "application/pdf", eightMegabytes, null),
                    new Attachment("b.pdf", "application/pdf", eightMegabytes, null)));

            assertEquals(SendResult.TOO_LARGE, result);
            assertEquals(sentBefore, socket.sent().size());
            assertEquals(0, link.pendingRequestCount());
            assertEquals(LinkState.READY, link.getState());
            assertFalse(socket.isClosed());
            assertTrue(emitted.isEmpty());

            assertEquals(SendResult.SENT, link.sendMessage("k", "small", List.of()));
            assertEquals("small", socket.lastJson().at("/params/message").asText());
        }

        @Test
        void responseWithRunId_tracksRun() {
            FakeSocket socket = handshake();
            link.sendMessage("webui:s1", "hello", List.of());
            String id = socket.lastJson().get("id").asText();

            socket.receive("{\"type\":\"res\",\"id\":\"" + id + "\",\"ok\":true,\"payload\":{\"runId\":\"run-7\"}}");

            assertEquals("run-7", link.activeRunId("webui:s1"));
            assertEquals(0, link.pendingRequestCount());
        }

        @Test
        void failedResponse_removesPendingWithoutRun() {
            FakeSocket socket = handshake();
            link.sendMessage("webui:s1", "hello", List.of());
            String id = socket.lastJson().get("id").asText();

            socket.receive("{\"type\":\"res\",\"id\":\"" + id + "\",\"ok\":false,\"error\":{\"message\":\"busy\"}}");

            assertNull(link.activeRunId("webui:s1"));
            assertEquals(0, link.pendingRequestCount());
        }

        @Test
        void disconnect_clearsPendingButKeepsRuns() {
            FakeSocket socket = handshake();
            socket.receive(agentEvent("lifecycle", "agent:main:k", "r1", "{\"phase\":\"start\"}"));
            link.sendMessage("k", "x", List.of());
            socket.closed(1006);

            assertEquals(0, link.pendingRequestCount());
            assertEquals("r1", link.activeRunId("k"));
        }
    }

    @Nested
    class Cancel {

        @Test
        void cancelWithoutRun_sendsNothing() {
            FakeSocket socket = handshake();
            int before = socket.sent().size();
            assertFalse(link.cancelRun("k"));
            assertEquals(before, socket.sent().size());
        }

        @Test
        void cancelTrackedRun_sendsAgentCancel() {
            FakeSocket socket = handshake();
            socket.receive(agentEvent("lifecycle", "agent:main:k", "r1", "{\"phase\":\"start\"}"));

            assertTrue(link.cancelRun("k"));
            JsonNode frame = socket.lastJson();
            assertEquals("agent.cancel", frame.get("method").asText());
            assertTrue(frame.get("id").asText().startsWith("cancel_"));
            assertEquals("k", frame.at("/params/sessionKey").asText());
            assertEquals("r1", frame.at("/params/runId").asText());
        }

        @Test
        void lifecycleEnd_clearsRun() {
            FakeSocket socket = handshake();
            socket.receive(agentEvent("lifecycle", "agent:main:k", "r1", "{\"phase\":\"start\"}"));
            socket.receive(agentEvent("lifecycle", "agent:main:k", "r1", "{\"phase\":\"end\"}"));

            assertNull(link.activeRunId("k"));
            assertFalse(link.cancelRun("k"));
        }
    }

    @Nested
    class Events {

        @Test
        void agentEvent_isTranslatedWithPrefixStripped() {
            FakeSocket socket = handshake();
            emitted.clear();
            socket.receive(agentEvent("lifecycle", "agent:main:webui:s1", "r1", "{\"phase\":\"start\"}"));

            assertEquals(List.of(new Lifecycle(0, "webui:s1", "start", "r1", null)), emitted);
            assertEquals("r1", link.activeRunId("webui:s1"));
        }

        @Test
        void configuredAgentId_setsPrefix() {
            link = newLink(new GatewayConfig("x", "ws://h", null, "coder"), Backoff.Policy.GATEWAY_RECONNECT);
            FakeSocket socket = handshake();
            emitted.clear();
            socket.receive(agentEvent("lifecycle", "agent:coder:s", "r1", "{\"phase\":\"start\"}"));

            assertEquals("s", ((Lifecycle) emitted.get(0)).sessionKey());
        }

        @Test
        void chatAndOtherEvents_areNotForwarded() {
            FakeSocket socket = handshake();
            emitted.clear();
            socket.receive("{\"type\":\"event\",\"event\":\"chat\",\"payload\":{\"state\":\"delta\"}}");
            socket.receive("{\"type\":\"event\",\"event\":\"presence\",\"payload\":{}}");
            assertTrue(emitted.isEmpty());
        }
    }
}
