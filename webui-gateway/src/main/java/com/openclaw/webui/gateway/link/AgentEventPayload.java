package com.openclaw.webui.gateway.link;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Payload of an {@code agent} event frame:
 * {@code {stream, data, runId, sessionKey}}. {@code sessionKey} still carries
 * the gateway's {@code agent:<id>:} prefix.
 */
public record AgentEventPayload(String stream, JsonNode data, String runId, String sessionKey) {

    public static AgentEventPayload from(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            return null;
        }
        return new AgentEventPayload(
                text(payload, "stream"),
                payload.get("data"),
                text(payload, "runId"),
                text(payload, "sessionKey"));
    }

    /**
     * Convenience: get a string value from the data object.
     */
    public String dataString(String key) {
        return data != null ? text(data, key) : null;
    }

    public JsonNode dataNode(String key) {
        if (data == null) {
            return null;
        }
        JsonNode v = data.get(key);
        return v != null && !v.isNull() && !v.isMissingNode() ? v : null;
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v != null && v.isTextual() ? v.asText() : null;
    }
}
