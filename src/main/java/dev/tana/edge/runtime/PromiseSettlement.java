package dev.tana.edge.runtime;

import dev.tana.edge.error.EdgeException;
import dev.tana.edge.error.ErrorKind;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.Value;

/**
 * Records how a guest promise settled. Guest handlers call the exported methods.
 */
public final class PromiseSettlement {
    private boolean settled;
    private Value value;
    private String error;
    private ErrorKind kind;

    PromiseSettlement() {}

    @HostAccess.Export
    public void resolve(Value result) {
        if (settled) return;
        settled = true;
        value = result;
    }

    @HostAccess.Export
    public void reject(String message, String kindTag) {
        if (settled) return;
        settled = true;
        error = message == null || message.isBlank() ? "Promise rejected" : message;
        ErrorKind tagged = ErrorKind.fromTag(kindTag);
        kind = tagged == null ? ErrorKind.SETUP : tagged;
    }

    boolean isSettled() {
        return settled;
    }

    boolean isRejected() {
        return settled && error != null;
    }

    Value value() {
        return value;
    }

    /**
     * The rejection as a host exception, keeping the kind a host capability tagged it with.
     */
    EdgeException failure() {
        return new EdgeException(kind, EdgeException.GUEST_ERROR, error, null);
    }
}
