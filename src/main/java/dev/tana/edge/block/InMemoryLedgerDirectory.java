package dev.tana.edge.block;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ledger directory held in memory, for embedders without a ledger service.
 */
public final class InMemoryLedgerDirectory implements LedgerDirectory {
    private final List<JsonNode> balances = new CopyOnWriteArrayList<>();
    private final List<JsonNode> users = new CopyOnWriteArrayList<>();
    private final List<JsonNode> transactions = new CopyOnWriteArrayList<>();

    public InMemoryLedgerDirectory addBalance(JsonNode balance) {
        balances.add(balance);
        return this;
    }

    public InMemoryLedgerDirectory addUser(JsonNode user) {
        users.add(user);
        return this;
    }

    public InMemoryLedgerDirectory addTransaction(JsonNode transaction) {
        transactions.add(transaction);
        return this;
    }

    @Override
    public List<JsonNode> balances() {
        return List.copyOf(balances);
    }

    @Override
    public List<JsonNode> users() {
        return List.copyOf(users);
    }

    @Override
    public List<JsonNode> transactions() {
        return List.copyOf(transactions);
    }
}
