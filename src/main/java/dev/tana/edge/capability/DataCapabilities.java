package dev.tana.edge.capability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import dev.tana.edge.store.StagedStore;
import java.util.List;

/**
 * {@code data.*}: the staged key-value store. Values cross the boundary as serialized strings.
 */
final class DataCapabilities {
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private DataCapabilities() {}

    static CapabilityRegistry register(CapabilityRegistry registry, StagedStore store) {
        registry.sync("data.set", List.of(ArgKind.STRING, ArgKind.STRING), (scope, args) -> {
            store.set(args.get(0).asText(), args.get(1).asText());
            return NullNode.getInstance();
        });
        registry.sync("data.get", List.of(ArgKind.STRING), (scope, args) ->
            store.get(args.get(0).asText())
                .<JsonNode>map(TextNode::valueOf)
                .orElse(NullNode.getInstance()));
        registry.sync("data.delete", List.of(ArgKind.STRING), (scope, args) -> {
            store.delete(args.get(0).asText());
            return NullNode.getInstance();
        });
        registry.sync("data.has", List.of(ArgKind.STRING), (scope, args) ->
            BooleanNode.valueOf(store.has(args.get(0).asText())));
        registry.sync("data.keys", List.of(ArgKind.OPTIONAL_STRING), (scope, args) -> {
            String pattern = args.get(0).isTextual() ? args.get(0).asText() : null;
            ArrayNode keys = NODES.arrayNode();
            store.keys(pattern).forEach(keys::add);
            return keys;
        });
        registry.sync("data.entries", List.of(), (scope, args) -> {
            ObjectNode entries = NODES.objectNode();
            store.entries().forEach(entries::put);
            return entries;
        });
        registry.sync("data.clear", List.of(), (scope, args) -> {
            store.clear();
            return NullNode.getInstance();
        });
        registry.sync("data.commit", List.of(), (scope, args) -> {
            store.commit();
            return NullNode.getInstance();
        });
        return registry;
    }
}
