package dev.tana.edge.capability;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.tana.edge.net.EgressGateway;
import dev.tana.edge.net.FetchResult;
import java.util.List;

/**
 * {@code net.fetch}: the single outbound network path.
 */
final class NetCapabilities {
    private NetCapabilities() {}

    static CapabilityRegistry register(CapabilityRegistry registry, EgressGateway gateway) {
        registry.async("net.fetch", List.of(ArgKind.STRING), (scope, args) -> {
            FetchResult result = gateway.fetch(args.get(0).asText());
            ObjectNode node = JsonNodeFactory.instance.objectNode();
            node.put("ok", result.ok());
            node.put("status", result.status());
            node.put("body", result.body());
            return node;
        });
        return registry;
    }
}
