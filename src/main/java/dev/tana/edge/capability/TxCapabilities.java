package dev.tana.edge.capability;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import dev.tana.edge.ledger.TransactionLedger;
import java.util.List;

/**
 * {@code tx.*}: staging and executing ledger changes.
 */
final class TxCapabilities {
    private TxCapabilities() {}

    static CapabilityRegistry register(CapabilityRegistry registry, TransactionLedger ledger) {
        registry.sync("tx.transfer", List.of(ArgKind.STRING, ArgKind.STRING, ArgKind.NUMBER, ArgKind.STRING),
            (scope, args) -> {
                ledger.transfer(args.get(0).asText(), args.get(1).asText(), args.get(2).doubleValue(), args.get(3).asText());
                return NullNode.getInstance();
            });
        registry.sync("tx.setBalance", List.of(ArgKind.STRING, ArgKind.NUMBER, ArgKind.STRING), (scope, args) -> {
            ledger.setBalance(args.get(0).asText(), args.get(1).doubleValue(), args.get(2).asText());
            return NullNode.getInstance();
        });
        registry.sync("tx.getChanges", List.of(), (scope, args) -> {
            ArrayNode changes = JsonNodeFactory.instance.arrayNode();
            ledger.getChanges().forEach(change -> changes.add(change.toJson()));
            return changes;
        });
        registry.sync("tx.execute", List.of(), (scope, args) -> ledger.execute().toJson());
        return registry;
    }
}
