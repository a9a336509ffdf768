package com.openclaw.webui.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openclaw.webui.common.config.ConfigService;
import com.openclaw.webui.common.config.WebUiConfig;
import com.openclaw.webui.common.infra.DeviceIdentity;
import com.openclaw.webui.common.infra.SingleThreadEventLoop;
import com.openclaw.webui.gateway.link.GatewayLink;
import com.openclaw.webui.gateway.protocol.ControlCodec;
import com.openclaw.webui.gateway.relay.ClientRegistry;
import com.openclaw.webui.gateway.relay.Relay;
import com.openclaw.webui.gateway.transport.OkHttpGatewayTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.server.WebServerFactoryCustomizer;
import org.springframework.boot.web.servlet.server.ConfigurableServletWebServerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.nio.file.Path;

/**
 * Composition root: configuration, device identity, the relay loop and the
 * relay core with one link per configured gateway.
 */
@Slf4j
@Configuration
public class RelayBeanConfig {

    @Bean
    public ConfigService configService(@Value("${webui.config.path:config.json}") String configPath) {
        return new ConfigService(Path.of(configPath));
    }

    @Bean
    public WebUiConfig webUiConfig(ConfigService configService) {
        WebUiConfig config = configService.loadConfig();
        log.info("config:loaded path={} gateways={} auth={}", configService.getConfigPath(),
                config.getGateways().size(), config.isAuthRequired() ? "password" : "none");
        if (config.getGateways().isEmpty()) {
            log.warn("config:no-gateways add at least one entry to \"gateways\" in {}", configService.getConfigPath());
        }
        return config;
    }

    /**
     * Fails startup with {@link com.openclaw.webui.common.infra.IdentityException}
     * when the keypair cannot be persisted.
     */
    @Bean
    public DeviceIdentity deviceIdentity(ConfigService configService, WebUiConfig config) {
        Path path = configService.resolveSibling(config.getIdentityPath());
        DeviceIdentity identity = DeviceIdentity.loadOrCreate(path);
        log.info("identity:ready deviceId={} path={}", identity.getDeviceId(), path);
        return identity;
    }

    @Bean(destroyMethod = "close")
    public SingleThreadEventLoop relayEventLoop() {
        return new SingleThreadEventLoop("webui-relay");
    }

    @Bean(destroyMethod = "close")
    public OkHttpGatewayTransport gatewayTransport() {
        return new OkHttpGatewayTransport();
    }

    @Bean
    public ControlCodec controlCodec(ObjectMapper objectMapper) {
        return new ControlCodec(objectMapper);
    }

    @Bean
    public ClientRegistry clientRegistry(ControlCodec controlCodec) {
        return new ClientRegistry(controlCodec);
    }

    @Bean
    public Relay relay(WebUiConfig config, ClientRegistry clientRegistry, ControlCodec controlCodec,
            DeviceIdentity identity, OkHttpGatewayTransport transport, SingleThreadEventLoop relayEventLoop) {
        return new Relay(config, clientRegistry, controlCodec,
                (index, gateway, sink) -> new GatewayLink(index, gateway, identity, transport, relayEventLoop, sink));
    }

    /**
     * Listen on the configured port unless {@code server.port} is set explicitly.
     */
    @Bean
    public WebServerFactoryCustomizer<ConfigurableServletWebServerFactory> webUiPortCustomizer(
            WebUiConfig config, Environment environment) {
        return factory -> {
            if (!environment.containsProperty("server.port")) {
                factory.setPort(config.getPort());
            }
        };
    }
}
