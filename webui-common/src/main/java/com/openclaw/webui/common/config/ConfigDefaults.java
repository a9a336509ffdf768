package com.openclaw.webui.common.config;

import java.util.List;

/**
 * Fills in values a config file may leave out.
 */
public final class ConfigDefaults {

    private ConfigDefaults() {
    }

    public static final List<WebUiConfig.ModelOption> DEFAULT_MODELS = List.of(
            new WebUiConfig.ModelOption("opus46", "Claude Opus 4.6"),
            new WebUiConfig.ModelOption("sonnet", "Claude Sonnet 4.6"),
            new WebUiConfig.ModelOption("gemini", "Gemini 2.5 Flash"),
            new WebUiConfig.ModelOption("pro", "Gemini 2.5 Pro"),
            new WebUiConfig.ModelOption("kimi", "Kimi"));

    public static WebUiConfig applyDefaults(WebUiConfig config) {
        if (config.getPort() <= 0) {
            config.setPort(WebUiConfig.DEFAULT_PORT);
        }
        if (config.getGateways() == null) {
            config.setGateways(new java.util.ArrayList<>());
        }
        config.getGateways().removeIf(gw -> gw == null || gw.getUrl() == null || gw.getUrl().isBlank());
        for (int i = 0; i < config.getGateways().size(); i++) {
            WebUiConfig.GatewayConfig gw = config.getGateways().get(i);
            if (gw.getName() == null || gw.getName().isBlank()) {
                gw.setName("Gateway " + i);
            }
        }
        if (config.getModels() == null || config.getModels().isEmpty()) {
            config.setModels(new java.util.ArrayList<>(DEFAULT_MODELS));
        }
        if (config.getIdentityPath() == null || config.getIdentityPath().isBlank()) {
            config.setIdentityPath(WebUiConfig.DEFAULT_IDENTITY_PATH);
        }
        return config;
    }
}
