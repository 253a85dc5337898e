package dev.tana.edge.block;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.TextNode;
import dev.tana.edge.error.EdgeException;
import dev.tana.edge.ledger.GasMeter;
import org.junit.jupiter.api.Test;

class BlockQueriesTest {
    private static final ObjectMapper JSON = new ObjectMapper();

    private final InMemoryLedgerDirectory directory = new InMemoryLedgerDirectory()
        .addBalance(node("{\"ownerId\":\"usr_alice\",\"currencyCode\":\"USD\",\"amount\":\"12.50\"}"))
        .addBalance(node("{\"ownerId\":\"usr_alice\",\"currencyCode\":\"EUR\",\"amount\":3}"))
        .addUser(node("{\"id\":\"usr_alice\",\"username\":\"alice\"}"))
        .addTransaction(node("{\"id\":\"tx_1\",\"amount\":\"1.00\"}"));
    private final BlockQueries queries = new BlockQueries(directory);

    @Test
    void singleIdAnswersWithAScalar() {
        assertEquals(12.5, queries.getBalance(TextNode.valueOf("usr_alice"), "USD").doubleValue());
        assertEquals(3.0, queries.getBalance(TextNode.valueOf("usr_alice"), "EUR").doubleValue());
        assertEquals(0.0, queries.getBalance(TextNode.valueOf("usr_bob"), "USD").doubleValue());
    }

    @Test
    void arrayInputAnswersWithAnArrayInOrder() {
        JsonNode balances = queries.getBalance(node("[\"usr_bob\",\"usr_alice\"]"), "USD");
        assertTrue(balances.isArray());
        assertEquals(0.0, balances.get(0).doubleValue());
        assertEquals(12.5, balances.get(1).doubleValue());

        JsonNode single = queries.getBalance(node("[\"usr_alice\"]"), "USD");
        assertTrue(single.isArray());
        assertEquals(1, single.size());
    }

    @Test
    void usersMatchByIdOrUsername() {
        assertEquals("usr_alice", queries.getUser(TextNode.valueOf("alice")).get("id").asText());
        assertEquals("alice", queries.getUser(TextNode.valueOf("usr_alice")).get("username").asText());
        assertTrue(queries.getUser(TextNode.valueOf("nobody")).isNull());
    }

    @Test
    void transactionsMatchById() {
        JsonNode found = queries.getTransaction(node("[\"tx_1\",\"tx_2\"]"));
        assertEquals("1.00", found.get(0).get("amount").asText());
        assertTrue(found.get(1).isNull());
    }

    @Test
    void rejectsOversizedBatches() {
        ArrayNode ids = JSON.createArrayNode();
        for (int i = 0; i < 11; i++) {
            ids.add("usr_" + i);
        }
        EdgeException error = assertThrows(EdgeException.class, () -> queries.getUser(ids));
        assertEquals("Cannot query more than 10 users at once", error.getMessage());
    }

    @Test
    void rejectsIdsThatAreNotStrings() {
        EdgeException users = assertThrows(EdgeException.class, () -> queries.getBalance(node("42"), "USD"));
        assertEquals("Invalid user_ids", users.getMessage());
        assertEquals(EdgeException.GUEST_TYPE_ERROR, users.guestName());

        EdgeException txs = assertThrows(EdgeException.class, () -> queries.getTransaction(node("[\"tx_1\", 7]")));
        assertEquals("Invalid tx_ids", txs.getMessage());
    }

    @Test
    void invocationContextStartsFromMockChainHead() {
        GasMeter gas = new GasMeter(1000);
        gas.tryConsume(300);

        InvocationContext context = InvocationContext.start("counter", gas);
        assertEquals(InvocationContext.MOCK_HEIGHT, context.height());
        assertEquals(InvocationContext.MOCK_EXECUTOR, context.executor());
        assertEquals("counter", context.contractId());
        assertEquals(1000, context.gasLimit());
        assertEquals(300, context.gasUsed());
    }

    private static JsonNode node(String json) {
        try {
            return JSON.readTree(json);
        } catch (Exception ex) {
            throw new IllegalArgumentException(ex);
        }
    }
}
