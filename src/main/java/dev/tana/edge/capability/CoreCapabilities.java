package dev.tana.edge.capability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import dev.tana.edge.error.EdgeException;
import java.util.List;

/**
 * {@code core.*}: console output and the numeric sum helper.
 */
final class CoreCapabilities {
    private CoreCapabilities() {}

    static CapabilityRegistry register(CapabilityRegistry registry) {
        registry.sync("core.print", List.of(ArgKind.STRING), (scope, args) -> {
            scope.console().log(args.get(0).asText());
            return NullNode.getInstance();
        });
        registry.sync("core.printError", List.of(ArgKind.STRING), (scope, args) -> {
            scope.console().error(args.get(0).asText());
            return NullNode.getInstance();
        });
        registry.sync("core.sum", List.of(ArgKind.STRUCTURED), (scope, args) -> sum(args.get(0)));
        return registry;
    }

    private static JsonNode sum(JsonNode numbers) {
        if (!numbers.isArray()) {
            throw EdgeException.typeError("sum expects an array of numbers");
        }
        double total = 0;
        for (JsonNode number : numbers) {
            if (!number.isNumber()) {
                throw EdgeException.typeError("sum expects an array of numbers");
            }
            total += number.doubleValue();
        }
        return JsonNodeFactory.instance.numberNode(total);
    }
}
