package dev.tana.edge.capability;

import dev.tana.edge.block.InvocationContext;
import java.util.Objects;

/**
 * Per-invocation state handed to every capability call.
 */
public record CallScope(InvocationContext context, ConsoleSink console) {
    public CallScope {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(console, "console");
    }
}
