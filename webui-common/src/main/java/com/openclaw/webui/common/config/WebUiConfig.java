package com.openclaw.webui.common.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration for the WebUI relay, read from {@code config.json}.
 *
 * <pre>
 * {
 *   "port": 18890,
 *   "password": "secret",
 *   "gateways": [{ "name": "home", "url": "ws://127.0.0.1:18789", "token": "...", "agentId": "main" }],
 *   "models": [{ "value": "sonnet", "label": "Claude Sonnet 4.6" }]
 * }
 * </pre>
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class WebUiConfig {

    public static final int DEFAULT_PORT = 18890;
    public static final String DEFAULT_AGENT_ID = "main";
    public static final String DEFAULT_IDENTITY_PATH = "device.json";

    /** HTTP/WebSocket listen port for browsers. */
    private int port = DEFAULT_PORT;

    /** Shared secret for browser connections; blank disables the gate. */
    private String password;

    /** Gateways to relay to, addressed by their index in this list. */
    private List<GatewayConfig> gateways = new ArrayList<>();

    /** Model options offered to the browser in the init message. */
    private List<ModelOption> models = new ArrayList<>();

    /** Where the device keypair is persisted. */
    private String identityPath = DEFAULT_IDENTITY_PATH;

    /**
     * Trimmed password, or null when no password gate is configured.
     */
    public String resolvePassword() {
        return password != null && !password.isBlank() ? password.trim() : null;
    }

    public boolean isAuthRequired() {
        return resolvePassword() != null;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GatewayConfig {
        private String name;
        /** WebSocket URL, e.g. ws://127.0.0.1:18789 */
        private String url;
        private String token;
        private String agentId;

        public String resolveAgentId() {
            return agentId != null && !agentId.isBlank() ? agentId : DEFAULT_AGENT_ID;
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ModelOption {
        private String value;
        private String label;
    }
}
