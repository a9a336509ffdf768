package com.openclaw.webui.app.health;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openclaw.webui.gateway.relay.Relay;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness probe with per-gateway link state.
 */
@RestController
public class HealthEndpoint {

    private final ObjectMapper mapper;
    private final Relay relay;

    public HealthEndpoint(ObjectMapper mapper, Relay relay) {
        this.mapper = mapper;
        this.relay = relay;
    }

    @GetMapping("/health")
    public ObjectNode health() {
        ObjectNode node = mapper.createObjectNode();
        node.put("status", "ok");
        node.put("uptime", relay.uptimeMs());

        ArrayNode gateways = node.putArray("gateways");
        for (Relay.GatewayHealth gw : relay.gatewayHealth()) {
            ObjectNode g = gateways.addObject();
            g.put("index", gw.index());
            g.put("name", gw.name());
            g.put("state", gw.state().name());
            g.put("connected", gw.connected());
        }
        node.put("clients", relay.clientCount());
        return node;
    }
}
