package dev.tana.edge.ledger;

/**
 * Process-wide cumulative gas counter with its own lock.
 */
public final class GasMeter {
    private final long limit;
    private long used;

    public GasMeter(long limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("gas limit must be positive");
        }
        this.limit = limit;
    }

    public long limit() {
        return limit;
    }

    public synchronized long used() {
        return used;
    }

    /**
     * Adds {@code cost} unless the total would pass the limit.
     *
     * @return {@code false} when the counter was left untouched
     */
    public synchronized boolean tryConsume(long cost) {
        if (cost < 0) {
            throw new IllegalArgumentException("cost must not be negative");
        }
        if (used + cost > limit) {
            return false;
        }
        used += cost;
        return true;
    }
}
