package dev.tana.edge.capability;

/**
 * Builds the sealed registry shared by every isolate of a runner.
 */
public final class HostCapabilities {
    private HostCapabilities() {}

    public static CapabilityRegistry create(HostServices services) {
        var registry = new CapabilityRegistry();
        CoreCapabilities.register(registry);
        NetCapabilities.register(registry, services.gateway());
        DataCapabilities.register(registry, services.store());
        BlockCapabilities.register(registry, services.blocks());
        TxCapabilities.register(registry, services.ledger());
        return registry.seal();
    }
}
