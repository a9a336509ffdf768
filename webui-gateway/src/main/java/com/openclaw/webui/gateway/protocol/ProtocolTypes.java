package com.openclaw.webui.gateway.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import com.openclaw.webui.common.infra.DeviceIdentity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Gateway WebSocket protocol types, as seen from the client side of the link.
 *
 * <p>
 * The gateway protocol uses three frame types:
 * <ul>
 * <li>{@code req} – client→server request</li>
 * <li>{@code res} – server→client response</li>
 * <li>{@code event} – server→client push event</li>
 * </ul>
 */
public final class ProtocolTypes {

    private ProtocolTypes() {
    }

    /** Protocol version sent as both min and max in the connect request. */
    public static final int PROTOCOL_VERSION = 3;

    /** Request id used for the handshake request. */
    public static final String CONNECT_REQUEST_ID = "connect";

    public static final String CLIENT_VERSION = "1.0.0";
    public static final String CLIENT_DISPLAY_NAME = "OpenClaw WebUI";
    public static final String CAP_TOOL_EVENTS = "tool-events";

    // ── Methods & Events ─────────────────────────────────────────

    public static final class Methods {
        public static final String CONNECT = "connect";
        public static final String AGENT = "agent";
        public static final String AGENT_CANCEL = "agent.cancel";

        private Methods() {
        }
    }

    public static final class Events {
        public static final String CONNECT_CHALLENGE = "connect.challenge";
        public static final String AGENT = "agent";
        public static final String CHAT = "chat";

        private Events() {
        }
    }

    // ── Frames ───────────────────────────────────────────────────

    /** Any frame on the gateway socket. */
    public sealed interface WireFrame permits RequestFrame, ResponseFrame, EventFrame {
    }

    /** {type:"req", id, method, params?} */
    public record RequestFrame(String id, String method, JsonNode params) implements WireFrame {
    }

    /**
     * {type:"res", id, ok, payload?, error?}. {@code ok} is false only when the
     * gateway sends an explicit {@code false}.
     */
    public record ResponseFrame(String id, boolean ok, JsonNode payload, JsonNode error) implements WireFrame {

        public String errorMessage() {
            if (error == null || error.isNull()) {
                return null;
            }
            JsonNode msg = error.get("message");
            return msg != null && msg.isTextual() ? msg.asText() : error.toString();
        }

        public String payloadText(String field) {
            if (payload == null) {
                return null;
            }
            JsonNode v = payload.get(field);
            return v != null && v.isTextual() && !v.asText().isEmpty() ? v.asText() : null;
        }
    }

    /** {type:"event", event, payload?} */
    public record EventFrame(String event, JsonNode payload) implements WireFrame {
    }

    // ── Connect Params ───────────────────────────────────────────

    /** Client info sent in the connect request. */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ClientInfo {
        private String id;
        private String version;
        private String platform;
        private String mode;
        private String displayName;
    }

    /** Auth credentials in connect params. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ConnectAuth {
        private String token;
    }

    /** Parameters for the "connect" handshake request. */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ConnectParams {
        private int minProtocol;
        private int maxProtocol;
        private ClientInfo client;
        private String role;
        private List<String> scopes;
        private List<String> caps;
        private ConnectAuth auth;
        private DeviceIdentity.SignedAssertion device;
    }

    // ── Agent Params ─────────────────────────────────────────────

    /** Parameters for the "agent" request. {@code message} is a string or a content block list. */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class AgentParams {
        private String agentId;
        private String sessionKey;
        private Object message;
        private boolean deliver;
        private String idempotencyKey;
    }

    /** Parameters for the "agent.cancel" request. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CancelParams {
        private String sessionKey;
        private String runId;
    }

    // ── Content Blocks ───────────────────────────────────────────

    /** Element of a multi-part {@code message}. */
    @JsonPropertyOrder({"type"})
    public sealed interface ContentBlock permits TextBlock, ImageBlock, DocumentBlock {
        String type();
    }

    /** {type:"text", text} */
    public record TextBlock(String type, String text) implements ContentBlock {
        public TextBlock(String text) {
            this("text", text);
        }
    }

    /** {type:"base64", media_type, data} */
    public record MediaSource(String type, @JsonProperty("media_type") String mediaType, String data) {

        public static MediaSource base64(String mediaType, String data) {
            return new MediaSource("base64", mediaType, data);
        }
    }

    /** {type:"image", source} */
    public record ImageBlock(String type, MediaSource source) implements ContentBlock {
        public ImageBlock(MediaSource source) {
            this("image", source);
        }
    }

    /** {type:"document", source, title} */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record DocumentBlock(String type, MediaSource source, String title) implements ContentBlock {
        public DocumentBlock(MediaSource source, String title) {
            this("document", source, title);
        }
    }
}
