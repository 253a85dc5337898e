package dev.tana.edge.capability;

/**
 * How the guest observes a capability's result.
 */
public enum CallingConvention {
    /** Returns a value directly, on the invocation thread. */
    SYNC,
    /** Returns a promise settled by the dispatcher once the host work completes. */
    ASYNC
}
