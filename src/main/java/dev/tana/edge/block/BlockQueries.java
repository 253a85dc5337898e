package dev.tana.edge.block;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import dev.tana.edge.error.EdgeException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Batch lookups against the ledger directory.
 *
 * <p>Every query accepts a single id or an array of ids and answers in the same shape: a scalar
 * for a string input, an array (in input order) for an array input.</p>
 */
public final class BlockQueries {
    public static final int MAX_BATCH_QUERY = 10;

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final LedgerDirectory directory;

    public BlockQueries(LedgerDirectory directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    /**
     * Balance of each user in {@code currencyCode}; unknown pairs read as {@code 0}.
     */
    public JsonNode getBalance(JsonNode userIds, String currencyCode) {
        Ids ids = Ids.parse(userIds, "user_ids", "balances");
        List<JsonNode> balances = directory.balances();
        return ids.answer(id -> {
            for (JsonNode balance : balances) {
                if (id.equals(balance.path("ownerId").asText(null))
                    && Objects.equals(currencyCode, balance.path("currencyCode").asText(null))) {
                    return NODES.numberNode(amountOf(balance.get("amount")));
                }
            }
            return NODES.numberNode(0.0);
        });
    }

    /**
     * Users matched by {@code id} or {@code username}; unknown ids read as {@code null}.
     */
    public JsonNode getUser(JsonNode userIds) {
        Ids ids = Ids.parse(userIds, "user_ids", "users");
        List<JsonNode> users = directory.users();
        return ids.answer(id -> {
            for (JsonNode user : users) {
                if (id.equals(user.path("id").asText(null)) || id.equals(user.path("username").asText(null))) {
                    return user;
                }
            }
            return NullNode.getInstance();
        });
    }

    public JsonNode getTransaction(JsonNode txIds) {
        Ids ids = Ids.parse(txIds, "tx_ids", "transactions");
        List<JsonNode> transactions = directory.transactions();
        return ids.answer(id -> {
            for (JsonNode transaction : transactions) {
                if (id.equals(transaction.path("id").asText(null))) {
                    return transaction;
                }
            }
            return NullNode.getInstance();
        });
    }

    private static double amountOf(JsonNode amount) {
        if (amount == null || amount.isNull()) {
            return 0.0;
        }
        if (amount.isNumber()) {
            return amount.doubleValue();
        }
        if (amount.isTextual()) {
            try {
                return Double.parseDouble(amount.asText().trim());
            } catch (NumberFormatException ex) {
                return 0.0;
            }
        }
        return 0.0;
    }

    private record Ids(List<String> values, boolean batch) {
        static Ids parse(JsonNode raw, String label, String kind) {
            List<String> values = new ArrayList<>();
            boolean batch;
            if (raw != null && raw.isTextual()) {
                values.add(raw.asText());
                batch = false;
            } else if (raw != null && raw.isArray()) {
                for (JsonNode item : raw) {
                    if (!item.isTextual()) {
                        throw EdgeException.typeError("Invalid " + label);
                    }
                    values.add(item.asText());
                }
                batch = true;
            } else {
                throw EdgeException.typeError("Invalid " + label);
            }
            if (values.size() > MAX_BATCH_QUERY) {
                throw EdgeException.validation(
                    "Cannot query more than " + MAX_BATCH_QUERY + " " + kind + " at once");
            }
            return new Ids(values, batch);
        }

        JsonNode answer(Function<String, JsonNode> lookup) {
            if (!batch) {
                return lookup.apply(values.get(0));
            }
            ArrayNode results = NODES.arrayNode();
            values.forEach(id -> results.add(lookup.apply(id)));
            return results;
        }
    }
}
