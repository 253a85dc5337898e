package dev.tana.edge.block;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * Read-only view of the ledger service consulted by batch block queries.
 */
public interface LedgerDirectory {
    List<JsonNode> balances();

    List<JsonNode> users();

    List<JsonNode> transactions();
}
