package com.openclaw.webui.gateway.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.JsonNode;
import com.openclaw.webui.common.config.WebUiConfig;

import java.util.List;

/**
 * Browser-facing control protocol.
 *
 * <pre>
 * → {"type":"auth","password":"..."}
 * → {"type":"send","gateway":0,"sessionKey":"...","message":"...","attachments":[...]}
 * → {"type":"cancel","gateway":0,"sessionKey":"..."}
 * ← auth_required | auth_ok | auth_fail | init | status | error
 * ← lifecycle | chunk | thinking | tool_start | tool_result (session-scoped)
 * </pre>
 */
public final class ControlFrames {

    private ControlFrames() {
    }

    // ── Inbound (browser → relay) ────────────────────────────────

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
    @JsonSubTypes({
            @JsonSubTypes.Type(value = Auth.class, name = "auth"),
            @JsonSubTypes.Type(value = Send.class, name = "send"),
            @JsonSubTypes.Type(value = Cancel.class, name = "cancel")
    })
    public sealed interface Inbound permits Auth, Send, Cancel, Unknown {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Auth(String password) implements Inbound {
    }

    /**
     * Inbound messages addressed to one gateway. {@code gateway} is kept raw:
     * only a JSON number selects a gateway, anything else means gateway 0.
     */
    public sealed interface Routed permits Send, Cancel {

        JsonNode gateway();

        /**
         * @return the selected index, or -1 for a number that is not a whole
         *         {@code int} (such as {@code 1.7})
         */
        default int gatewayIndex() {
            JsonNode gateway = gateway();
            if (gateway == null || !gateway.isNumber()) {
                return 0;
            }
            if (!gateway.canConvertToExactIntegral() || !gateway.canConvertToInt()) {
                return -1;
            }
            return gateway.intValue();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Send(JsonNode gateway, String sessionKey, String message, List<Attachment> attachments)
            implements Inbound, Routed {

        public List<Attachment> attachmentsOrEmpty() {
            return attachments != null ? attachments : List.of();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Cancel(JsonNode gateway, String sessionKey) implements Inbound, Routed {
    }

    /** A well-formed message whose {@code type} the relay does not handle. */
    public record Unknown(String type) implements Inbound {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Attachment(String filename, String mimeType, String data, Long size) {
    }

    // ── Outbound (relay → browser) ───────────────────────────────

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
    @JsonSubTypes({
            @JsonSubTypes.Type(value = AuthRequired.class, name = "auth_required"),
            @JsonSubTypes.Type(value = AuthOk.class, name = "auth_ok"),
            @JsonSubTypes.Type(value = AuthFail.class, name = "auth_fail"),
            @JsonSubTypes.Type(value = Init.class, name = "init"),
            @JsonSubTypes.Type(value = Status.class, name = "status"),
            @JsonSubTypes.Type(value = ErrorMessage.class, name = "error"),
            @JsonSubTypes.Type(value = Lifecycle.class, name = "lifecycle"),
            @JsonSubTypes.Type(value = Chunk.class, name = "chunk"),
            @JsonSubTypes.Type(value = Thinking.class, name = "thinking"),
            @JsonSubTypes.Type(value = ToolStart.class, name = "tool_start"),
            @JsonSubTypes.Type(value = ToolResult.class, name = "tool_result")
    })
    public sealed interface Outbound
            permits AuthRequired, AuthOk, AuthFail, Init, Status, ErrorMessage, SessionEvent {
    }

    public record AuthRequired() implements Outbound {
    }

    public record AuthOk() implements Outbound {
    }

    public record AuthFail() implements Outbound {
    }

    public record GatewayInfo(String name, boolean connected) {
    }

    public record Init(List<WebUiConfig.ModelOption> models, List<GatewayInfo> gateways) implements Outbound {
    }

    public record Status(int gateway, boolean connected) implements Outbound {
    }

    /** {@code gateway} is omitted for errors not tied to a link (bad index). */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ErrorMessage(Integer gateway, String message) implements Outbound {
    }

    /** Frames that belong to one conversation; delivered only to connections owning the key. */
    public sealed interface SessionEvent extends Outbound
            permits Lifecycle, Chunk, Thinking, ToolStart, ToolResult {

        int gateway();

        String sessionKey();
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Lifecycle(int gateway, String sessionKey, String phase, String runId, String message)
            implements SessionEvent {
    }

    public record Chunk(int gateway, String sessionKey, String text) implements SessionEvent {
    }

    public record Thinking(int gateway, String sessionKey, String text) implements SessionEvent {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ToolStart(int gateway, String sessionKey, String name, JsonNode args) implements SessionEvent {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ToolResult(int gateway, String sessionKey, String name, JsonNode result) implements SessionEvent {
    }
}
