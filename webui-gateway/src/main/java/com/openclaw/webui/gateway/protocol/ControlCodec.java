package com.openclaw.webui.gateway.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.openclaw.webui.common.logging.LogRedact;
import com.openclaw.webui.gateway.protocol.ControlFrames.Inbound;
import com.openclaw.webui.gateway.protocol.ControlFrames.Outbound;
import com.openclaw.webui.gateway.protocol.ControlFrames.Unknown;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.Set;

/**
 * JSON codec for the browser control protocol.
 */
@Slf4j
public class ControlCodec {

    private static final Set<String> INBOUND_TYPES = Set.of("auth", "send", "cancel");

    private final ObjectMapper mapper;

    public ControlCodec() {
        this(new ObjectMapper());
    }

    public ControlCodec(ObjectMapper mapper) {
        this.mapper = mapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
    }

    /**
     * Parse a browser message. Empty when the text is not a JSON object with a
     * string {@code type}, or when a known type has fields of the wrong shape.
     */
    public Optional<Inbound> decode(String text) {
        JsonNode node;
        try {
            node = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.debug("ws:in:unparsable {}", LogRedact.preview(text));
            return Optional.empty();
        }
        if (node == null || !node.isObject() || !node.path("type").isTextual()) {
            return Optional.empty();
        }
        String type = node.get("type").asText();
        if (!INBOUND_TYPES.contains(type)) {
            return Optional.of(new Unknown(type));
        }
        try {
            return Optional.of(mapper.treeToValue(node, Inbound.class));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.debug("ws:in:invalid type={} error={}", type, e.getMessage());
            return Optional.empty();
        }
    }

    public String encode(Outbound frame) {
        try {
            return mapper.writerFor(Outbound.class).writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + frame.getClass().getSimpleName(), e);
        }
    }
}
