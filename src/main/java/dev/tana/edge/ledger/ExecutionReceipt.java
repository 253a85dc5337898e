package dev.tana.edge.ledger;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;

/**
 * Outcome of {@link TransactionLedger#execute()}.
 */
public record ExecutionReceipt(boolean success, List<Change> changes, long gasUsed, String error) {
    public static final String OUT_OF_GAS = "Out of gas";

    public ExecutionReceipt {
        changes = List.copyOf(changes);
    }

    static ExecutionReceipt committed(List<Change> changes, long cost) {
        return new ExecutionReceipt(true, changes, cost, null);
    }

    static ExecutionReceipt outOfGas(long gasLimit) {
        return new ExecutionReceipt(false, List.of(), gasLimit, OUT_OF_GAS);
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("success", success);
        ArrayNode list = node.putArray("changes");
        changes.forEach(change -> list.add(change.toJson()));
        node.put("gasUsed", gasUsed);
        if (error == null) {
            node.putNull("error");
        } else {
            node.put("error", error);
        }
        return node;
    }
}
