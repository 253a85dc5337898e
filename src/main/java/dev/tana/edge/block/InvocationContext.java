package dev.tana.edge.block;

import dev.tana.edge.ledger.GasMeter;

/**
 * Block values visible to one invocation, fixed when the invocation starts.
 */
public record InvocationContext(
    long height,
    long timestamp,
    String hash,
    String previousHash,
    String executor,
    String contractId,
    long gasLimit,
    long gasUsed
) {
    public static final long MOCK_HEIGHT = 12345;
    public static final String MOCK_EXECUTOR = "user_edge_server";

    public static InvocationContext start(String contractId, GasMeter gas) {
        return new InvocationContext(
            MOCK_HEIGHT,
            System.currentTimeMillis(),
            "0x" + Long.toHexString(MOCK_HEIGHT),
            "0x" + Long.toHexString(MOCK_HEIGHT - 1),
            MOCK_EXECUTOR,
            contractId,
            gas.limit(),
            gas.used()
        );
    }
}
