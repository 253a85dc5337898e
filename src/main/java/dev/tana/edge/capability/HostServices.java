package dev.tana.edge.capability;

import dev.tana.edge.block.BlockQueries;
import dev.tana.edge.ledger.TransactionLedger;
import dev.tana.edge.net.EgressGateway;
import dev.tana.edge.store.StagedStore;
import java.util.Objects;

/**
 * Stateful services shared by every invocation of one runner.
 */
public record HostServices(StagedStore store, TransactionLedger ledger, EgressGateway gateway, BlockQueries blocks) {
    public HostServices {
        Objects.requireNonNull(store, "store");
        Objects.requireNonNull(ledger, "ledger");
        Objects.requireNonNull(gateway, "gateway");
        Objects.requireNonNull(blocks, "blocks");
    }
}
