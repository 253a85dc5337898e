package dev.tana.edge.ledger;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A pending state-change intent queued by a contract.
 */
public interface Change {
    String type();

    ObjectNode toJson();

    record Transfer(String from, String to, double amount, String currency) implements Change {
        @Override
        public String type() {
            return "transfer";
        }

        @Override
        public ObjectNode toJson() {
            ObjectNode node = JsonNodeFactory.instance.objectNode();
            node.put("type", type());
            node.put("from", from);
            node.put("to", to);
            node.put("amount", amount);
            node.put("currency", currency);
            return node;
        }
    }

    record BalanceUpdate(String userId, double amount, String currency) implements Change {
        @Override
        public String type() {
            return "balance_update";
        }

        @Override
        public ObjectNode toJson() {
            ObjectNode node = JsonNodeFactory.instance.objectNode();
            node.put("type", type());
            node.put("userId", userId);
            node.put("amount", amount);
            node.put("currency", currency);
            return node;
        }
    }
}
