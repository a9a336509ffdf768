package com.openclaw.webui.gateway.link;

import com.fasterxml.jackson.databind.JsonNode;
import com.openclaw.webui.gateway.protocol.ControlFrames.Chunk;
import com.openclaw.webui.gateway.protocol.ControlFrames.Lifecycle;
import com.openclaw.webui.gateway.protocol.ControlFrames.SessionEvent;
import com.openclaw.webui.gateway.protocol.ControlFrames.Thinking;
import com.openclaw.webui.gateway.protocol.ControlFrames.ToolResult;
import com.openclaw.webui.gateway.protocol.ControlFrames.ToolStart;

import java.util.Optional;

/**
 * Maps gateway {@code agent} events onto the browser event vocabulary.
 * Stateless; run tracking is reported back as a {@link RunEffect} for the
 * link to apply.
 */
public final class EventTranslator {

    private EventTranslator() {
    }

    public enum RunEffect {
        NONE,
        /** Remember {@code runId} as the active run of the session. */
        TRACK,
        /** Forget the active run of the session. */
        CLEAR
    }

    public record Translation(String sessionKey, String runId, RunEffect runEffect, SessionEvent event) {
    }

    public static String agentPrefix(String agentId) {
        return "agent:" + agentId + ":";
    }

    public static String stripAgentPrefix(String prefix, String sessionKey) {
        if (sessionKey == null) {
            return null;
        }
        return sessionKey.startsWith(prefix) ? sessionKey.substring(prefix.length()) : sessionKey;
    }

    public static Optional<Translation> translate(int gateway, String agentPrefix, JsonNode payload) {
        AgentEventPayload evt = AgentEventPayload.from(payload);
        if (evt == null || evt.stream() == null) {
            return Optional.empty();
        }
        String sessionKey = stripAgentPrefix(agentPrefix, evt.sessionKey());
        if (sessionKey == null || sessionKey.isEmpty()) {
            return Optional.empty();
        }

        return switch (evt.stream()) {
            case "lifecycle" -> {
                String phase = evt.dataString("phase");
                RunEffect effect = RunEffect.NONE;
                if ("start".equals(phase) && evt.runId() != null) {
                    effect = RunEffect.TRACK;
                } else if ("end".equals(phase) || "cancelled".equals(phase)) {
                    effect = RunEffect.CLEAR;
                }
                yield Optional.of(new Translation(sessionKey, evt.runId(), effect,
                        new Lifecycle(gateway, sessionKey, phase, evt.runId(), evt.dataString("message"))));
            }
            case "assistant" -> textOf(evt)
                    .map(text -> session(sessionKey, evt, new Chunk(gateway, sessionKey, text)));
            case "thinking" -> textOf(evt)
                    .map(text -> session(sessionKey, evt, new Thinking(gateway, sessionKey, text)));
            case "tool" -> {
                String phase = evt.dataString("phase");
                String name = evt.dataString("name");
                if ("start".equals(phase)) {
                    yield Optional.of(session(sessionKey, evt,
                            new ToolStart(gateway, sessionKey, name, evt.dataNode("arguments"))));
                } else if ("result".equals(phase)) {
                    yield Optional.of(session(sessionKey, evt,
                            new ToolResult(gateway, sessionKey, name, evt.dataNode("result"))));
                }
                yield Optional.empty();
            }
            default -> Optional.empty();
        };
    }

    // delta wins over text; empty strings produce nothing
    private static Optional<String> textOf(AgentEventPayload evt) {
        String delta = evt.dataString("delta");
        if (delta != null && !delta.isEmpty()) {
            return Optional.of(delta);
        }
        String text = evt.dataString("text");
        return text != null && !text.isEmpty() ? Optional.of(text) : Optional.empty();
    }

    private static Translation session(String sessionKey, AgentEventPayload evt, SessionEvent event) {
        return new Translation(sessionKey, evt.runId(), RunEffect.NONE, event);
    }
}
