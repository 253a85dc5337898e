package dev.tana.edge.runtime;

/**
 * Lifecycle of one contract invocation, in order. {@link #COMPILED} is skipped for precompiled sources.
 */
public enum DispatchPhase {
    CREATED,
    CAPABILITIES_BOUND,
    MODULES_BOOTSTRAPPED,
    SOURCE_LOADED,
    COMPILED,
    ENTRY_INVOKED,
    ASYNC_DRAINED,
    RESULT_EXTRACTED
}
