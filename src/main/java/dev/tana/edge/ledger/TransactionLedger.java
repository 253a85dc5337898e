package dev.tana.edge.ledger;

import dev.tana.edge.error.EdgeException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Queues transfers and balance updates until {@link #execute()} charges gas for the batch.
 */
public final class TransactionLedger {
    public static final long GAS_LIMIT = 1_000_000L;
    public static final long GAS_COST_PER_CHANGE = 100L;

    private static final Logger log = LogManager.getLogger(TransactionLedger.class);

    private final Object lock = new Object();
    private final List<Change> pending = new ArrayList<>();
    private final GasMeter gas;

    public TransactionLedger() {
        this(new GasMeter(GAS_LIMIT));
    }

    public TransactionLedger(GasMeter gas) {
        this.gas = Objects.requireNonNull(gas, "gas");
    }

    public GasMeter gas() {
        return gas;
    }

    public void transfer(String from, String to, double amount, String currency) {
        if (Objects.equals(from, to)) {
            throw EdgeException.validation("Cannot transfer to self");
        }
        requireFinite(amount);
        if (amount <= 0) {
            throw EdgeException.validation("Amount must be positive");
        }
        synchronized (lock) {
            pending.add(new Change.Transfer(from, to, amount, currency));
        }
    }

    public void setBalance(String userId, double amount, String currency) {
        requireFinite(amount);
        if (amount < 0) {
            throw EdgeException.validation("Balance cannot be negative");
        }
        synchronized (lock) {
            pending.add(new Change.BalanceUpdate(userId, amount, currency));
        }
    }

    public List<Change> getChanges() {
        synchronized (lock) {
            return List.copyOf(pending);
        }
    }

    /**
     * Charges {@link #GAS_COST_PER_CHANGE} per queued change and drains the queue whether or not the charge fits.
     */
    public ExecutionReceipt execute() {
        synchronized (lock) {
            List<Change> batch = List.copyOf(pending);
            pending.clear();
            long cost = GAS_COST_PER_CHANGE * batch.size();
            if (!gas.tryConsume(cost)) {
                log.warn("Ledger batch of {} change(s) rejected: out of gas ({} used of {})",
                    batch.size(), gas.used(), gas.limit());
                return ExecutionReceipt.outOfGas(gas.limit());
            }
            log.debug("Ledger batch of {} change(s) executed for {} gas", batch.size(), cost);
            return ExecutionReceipt.committed(batch, cost);
        }
    }

    private static void requireFinite(double amount) {
        if (Double.isNaN(amount) || Double.isInfinite(amount)) {
            throw EdgeException.validation("Amount must be a finite number");
        }
    }
}
