package com.openclaw.webui.gateway.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openclaw.webui.common.logging.LogRedact;
import com.openclaw.webui.gateway.protocol.ProtocolTypes.EventFrame;
import com.openclaw.webui.gateway.protocol.ProtocolTypes.RequestFrame;
import com.openclaw.webui.gateway.protocol.ProtocolTypes.ResponseFrame;
import com.openclaw.webui.gateway.protocol.ProtocolTypes.WireFrame;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Parses gateway socket text into {@link WireFrame}s and encodes outgoing requests.
 * Anything that is not valid JSON with a known {@code type} decodes to empty.
 */
@Slf4j
public class ProtocolCodec {

    private final ObjectMapper mapper;

    public ProtocolCodec() {
        this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public ProtocolCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Optional<WireFrame> decode(String text) {
        JsonNode node;
        try {
            node = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.debug("gateway:frame:unparsable {}", LogRedact.preview(text));
            return Optional.empty();
        }
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        String type = text(node, "type");
        if (type == null) {
            return Optional.empty();
        }
        return switch (type) {
            case "req" -> {
                String id = text(node, "id");
                String method = text(node, "method");
                yield id != null && method != null
                        ? Optional.of(new RequestFrame(id, method, node.get("params")))
                        : Optional.empty();
            }
            case "res" -> {
                String id = text(node, "id");
                JsonNode ok = node.get("ok");
                boolean okValue = ok == null || !ok.isBoolean() || ok.asBoolean();
                yield id != null
                        ? Optional.of(new ResponseFrame(id, okValue, node.get("payload"), node.get("error")))
                        : Optional.empty();
            }
            case "event" -> {
                String event = text(node, "event");
                yield event != null
                        ? Optional.of(new EventFrame(event, node.get("payload")))
                        : Optional.empty();
            }
            default -> Optional.empty();
        };
    }

    /**
     * Encode {@code {type:"req", id, method, params}} as a JSON string.
     */
    public String encodeRequest(String id, String method, Object params) {
        ObjectNode frame = mapper.createObjectNode();
        frame.put("type", "req");
        frame.put("id", id);
        frame.put("method", method);
        if (params != null) {
            frame.set("params", mapper.valueToTree(params));
        }
        try {
            return mapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode request " + method, e);
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v != null && v.isTextual() ? v.asText() : null;
    }
}
